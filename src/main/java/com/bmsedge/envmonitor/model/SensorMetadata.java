package com.bmsedge.envmonitor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Location tags attached to every document. Used for filtering only.
 */
@Value
@Builder(toBuilder = true)
public class SensorMetadata {
    String location;
    String building;
    String room;
    String sensorId;
    String sensorType;
}
