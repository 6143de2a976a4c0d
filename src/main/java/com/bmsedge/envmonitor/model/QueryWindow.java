package com.bmsedge.envmonitor.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.bson.Document;
import org.springframework.data.mongodb.core.query.Criteria;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;

/**
 * Time window plus optional metadata filters shared by every telemetry query.
 * <p>
 * Both ends of a bounded window are inclusive. Filters left unset match any value.
 * Instances are immutable; the filter methods return modified copies.
 */
@EqualsAndHashCode
@ToString
public final class QueryWindow {

    private final Instant start;
    private final Instant end;
    private final String location;
    private final String building;
    private final String room;
    private final String sensorId;

    private QueryWindow(Instant start, Instant end, String location, String building, String room, String sensorId) {
        this.start = start;
        this.end = end;
        this.location = location;
        this.building = building;
        this.room = room;
        this.sensorId = sensorId;
    }

    public static QueryWindow between(Instant start, Instant end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
        return new QueryWindow(start, end, null, null, null, null);
    }

    public static QueryWindow lastHours(int hours, Clock clock) {
        return last(Duration.ofHours(requirePositive(hours, "hours")), clock);
    }

    public static QueryWindow lastDays(int days, Clock clock) {
        return last(Duration.ofDays(requirePositive(days, "days")), clock);
    }

    /**
     * A window without time bounds, for pure metadata searches.
     */
    public static QueryWindow allTime() {
        return new QueryWindow(null, null, null, null, null, null);
    }

    private static QueryWindow last(Duration length, Clock clock) {
        Instant end = clock.instant();
        return between(end.minus(length), end);
    }

    private static int requirePositive(int value, String unit) {
        if (value <= 0) {
            throw new IllegalArgumentException("Window length in " + unit + " must be positive, got " + value);
        }
        return value;
    }

    public QueryWindow location(String value) {
        return new QueryWindow(start, end, blankToNull(value), building, room, sensorId);
    }

    public QueryWindow building(String value) {
        return new QueryWindow(start, end, location, blankToNull(value), room, sensorId);
    }

    public QueryWindow room(String value) {
        return new QueryWindow(start, end, location, building, blankToNull(value), sensorId);
    }

    public QueryWindow sensorId(String value) {
        return new QueryWindow(start, end, location, building, room, blankToNull(value));
    }

    public Optional<Instant> getStart() {
        return Optional.ofNullable(start);
    }

    public Optional<Instant> getEnd() {
        return Optional.ofNullable(end);
    }

    public boolean isBounded() {
        return start != null;
    }

    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<String> getBuilding() {
        return Optional.ofNullable(building);
    }

    public Optional<String> getRoom() {
        return Optional.ofNullable(room);
    }

    public Optional<String> getSensorId() {
        return Optional.ofNullable(sensorId);
    }

    /**
     * Criteria matching {@code timestamp} inside the window and every filter that is set.
     */
    public Criteria toCriteria() {
        Criteria criteria = isBounded()
                ? Criteria.where(TelemetryFields.TIMESTAMP).gte(Date.from(start)).lte(Date.from(end))
                : new Criteria();
        getLocation().ifPresent(v -> criteria.and(TelemetryFields.LOCATION).is(v));
        getBuilding().ifPresent(v -> criteria.and(TelemetryFields.BUILDING).is(v));
        getRoom().ifPresent(v -> criteria.and(TelemetryFields.ROOM).is(v));
        getSensorId().ifPresent(v -> criteria.and(TelemetryFields.SENSOR_ID).is(v));
        return criteria;
    }

    /**
     * The same predicate as {@link #toCriteria()}, rendered for a raw {@code $match} stage.
     */
    public Document toMatchDocument() {
        return new Document(toCriteria().getCriteriaObject());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
