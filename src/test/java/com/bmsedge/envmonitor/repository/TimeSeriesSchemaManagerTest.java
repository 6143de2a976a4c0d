package com.bmsedge.envmonitor.repository;

import com.bmsedge.envmonitor.exception.SchemaSetupException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.UncategorizedMongoDbException;
import org.springframework.data.mongodb.core.CollectionOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexField;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeSeriesSchemaManagerTest {

    private static final String COLLECTION = "serverRoomLogs";

    @Mock
    private MongoTemplate mongoTemplate;
    @Mock
    private IndexOperations indexOps;

    private TimeSeriesSchemaManager schemaManager;

    @BeforeEach
    void setUp() {
        schemaManager = new TimeSeriesSchemaManager(mongoTemplate, COLLECTION);
    }

    @Test
    void createsCollectionOnlyWhenMissing() {
        when(mongoTemplate.collectionExists(COLLECTION)).thenReturn(false);
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(indexOps.getIndexInfo()).thenReturn(List.of());

        schemaManager.ensureSchema();

        verify(mongoTemplate).createCollection(eq(COLLECTION), any(CollectionOptions.class));
        verify(indexOps, times(5)).ensureIndex(any(Index.class));
    }

    @Test
    void existingCollectionIsLeftAlone() {
        when(mongoTemplate.collectionExists(COLLECTION)).thenReturn(true);
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(indexOps.getIndexInfo()).thenReturn(List.of());

        schemaManager.ensureSchema();

        verify(mongoTemplate, never()).createCollection(any(String.class), any(CollectionOptions.class));
    }

    @Test
    void lostCreationRaceIsTolerated() {
        when(mongoTemplate.collectionExists(COLLECTION)).thenReturn(false, true);
        when(mongoTemplate.createCollection(eq(COLLECTION), any(CollectionOptions.class)))
                .thenThrow(new UncategorizedMongoDbException("NamespaceExists", null));
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(indexOps.getIndexInfo()).thenReturn(List.of());

        assertThatCode(() -> schemaManager.ensureSchema()).doesNotThrowAnyException();
    }

    @Test
    void failedCreationIsFatal() {
        when(mongoTemplate.collectionExists(COLLECTION)).thenReturn(false, false);
        when(mongoTemplate.createCollection(eq(COLLECTION), any(CollectionOptions.class)))
                .thenThrow(new DataAccessResourceFailureException("unauthorized"));

        assertThatThrownBy(() -> schemaManager.ensureSchema()).isInstanceOf(SchemaSetupException.class);
    }

    @Test
    void alertIndexesAreDroppedAndDropFailuresTolerated() {
        IndexInfo timestamp = index("timestamp_-1", IndexField.create("timestamp", Sort.Direction.DESC));
        IndexInfo alertType = index("alert_type_1", IndexField.create("alert_type", Sort.Direction.ASC));
        IndexInfo nested = index("alerts.type_1", IndexField.create("alerts.type", Sort.Direction.ASC));
        when(mongoTemplate.collectionExists(COLLECTION)).thenReturn(true);
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(indexOps.getIndexInfo()).thenReturn(List.of(timestamp, alertType, nested));
        doNothing().when(indexOps).dropIndex("alert_type_1");
        doThrow(new DataIntegrityViolationException("cannot drop")).when(indexOps).dropIndex("alerts.type_1");

        schemaManager.ensureSchema();

        verify(indexOps).dropIndex("alert_type_1");
        verify(indexOps).dropIndex("alerts.type_1");
        verify(indexOps, never()).dropIndex("timestamp_-1");
        verify(indexOps, times(5)).ensureIndex(any(Index.class));
    }

    @Test
    void indexFailureIsFatal() {
        when(mongoTemplate.collectionExists(COLLECTION)).thenReturn(true);
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(indexOps.getIndexInfo()).thenReturn(List.of());
        when(indexOps.ensureIndex(any(Index.class))).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> schemaManager.ensureSchema()).isInstanceOf(SchemaSetupException.class);
    }

    @Test
    void requiredIndexesNeverTouchAlertFields() {
        assertThat(TimeSeriesSchemaManager.requiredIndexes())
                .flatExtracting(index -> index.getIndexKeys().keySet())
                .noneMatch(key -> TimeSeriesSchemaManager.isAlertField((String) key));
        assertThat(TimeSeriesSchemaManager.isAlertField("severity")).isTrue();
        assertThat(TimeSeriesSchemaManager.isAlertField("metadata.location")).isFalse();
    }

    @Test
    void listsIndexKeySpecs() {
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(indexOps.getIndexInfo()).thenReturn(List.of(index("compound",
                IndexField.create("timestamp", Sort.Direction.DESC),
                IndexField.create("metadata.location", Sort.Direction.ASC))));

        assertThat(schemaManager.listIndexKeys()).containsExactly("timestamp:-1,metadata.location:1");
    }

    private static IndexInfo index(String name, IndexField... fields) {
        return new IndexInfo(List.of(fields), name, false, false, "");
    }
}
