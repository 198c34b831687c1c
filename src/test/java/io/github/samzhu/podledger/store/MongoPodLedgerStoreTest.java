package io.github.samzhu.podledger.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.bson.BsonString;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import com.mongodb.client.result.UpdateResult;

import io.github.samzhu.podledger.document.PodRecord;
import io.github.samzhu.podledger.document.PodRecords;
import io.github.samzhu.podledger.dto.ResourceRequest;
import io.github.samzhu.podledger.repository.PodRecordRepository;

class MongoPodLedgerStoreTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final Instant START = Instant.parse("2025-06-01T10:00:00Z");
    private static final Instant END = Instant.parse("2025-06-01T11:30:00Z");

    private MongoTemplate mongoTemplate;
    private PodRecordRepository repository;
    private MongoPodLedgerStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        repository = mock(PodRecordRepository.class);
        store = new MongoPodLedgerStore(mongoTemplate, repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateWithSetOnInsert() {
        // Given
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(PodRecord.class)))
            .thenReturn(UpdateResult.acknowledged(0, 0L, new BsonString("u1")));

        // When
        boolean created = store.createIfAbsent("u1", "team-a", "trainer", "node-1",
            new ResourceRequest(new BigDecimal("0.5"), new BigDecimal("1073741824"), BigDecimal.ONE), START);

        // Then
        assertThat(created).isTrue();
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).upsert(any(Query.class), update.capture(), eq(PodRecord.class));
        Document setOnInsert = (Document) update.getValue().getUpdateObject().get("$setOnInsert");
        assertThat(setOnInsert)
            .containsEntry("namespace", "team-a")
            .containsEntry("cpu", 0.5)
            .containsEntry("accelerator", 1.0)
            .containsEntry("startTime", START)
            .containsEntry("endTimeEstimated", false)
            .containsEntry("createdAt", NOW);
        assertThat(update.getValue().getUpdateObject()).doesNotContainKey("$set");
    }

    @Test
    void shouldReportExistingRecordOnCreate() {
        when(mongoTemplate.upsert(any(Query.class), any(Update.class), eq(PodRecord.class)))
            .thenReturn(UpdateResult.acknowledged(1, 0L, null));

        boolean created = store.createIfAbsent("u1", "team-a", "trainer", "node-1", ResourceRequest.ZERO, START);

        assertThat(created).isFalse();
    }

    @Test
    void shouldCloseOpenRecord() {
        when(repository.closeIfOpen("u1", END, false)).thenReturn(1L);

        assertThat(store.setEndTime("u1", END, false)).isTrue();
        verify(repository, never()).findById(any());
    }

    @Test
    void shouldRefuseToOverwriteEndTime() {
        // Given: 條件更新沒有命中
        when(repository.closeIfOpen("u1", NOW, true)).thenReturn(0L);
        when(repository.findById("u1")).thenReturn(Optional.of(closedRecord()));

        // When
        boolean applied = store.setEndTime("u1", NOW, true);

        // Then
        assertThat(applied).isFalse();
        verify(mongoTemplate, never()).updateFirst(any(Query.class), any(Update.class), eq(PodRecord.class));
    }

    @Test
    void shouldReturnNotFoundForUnknownCorrection() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThat(store.correctEndTime("nope", END, false, "audit")).isEqualTo(CorrectionOutcome.NOT_FOUND);
    }

    @Test
    void shouldRejectCorrectionOfOpenRecord() {
        when(repository.findById("u1")).thenReturn(Optional.of(openRecord()));

        assertThat(store.correctEndTime("u1", END, false, "audit")).isEqualTo(CorrectionOutcome.STILL_OPEN);
        verify(mongoTemplate, never()).updateFirst(any(Query.class), any(Update.class), eq(PodRecord.class));
    }

    @Test
    void shouldCorrectEndTimeAndKeepPreviousValue() {
        // Given
        when(repository.findById("u1")).thenReturn(Optional.of(closedRecord()));
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(PodRecord.class)))
            .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        // When
        CorrectionOutcome outcome = store.correctEndTime("u1", END, false, "node log shows exit at 11:30");

        // Then
        assertThat(outcome).isEqualTo(CorrectionOutcome.CORRECTED);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(PodRecord.class));
        assertThat(query.getValue().getQueryObject())
            .containsEntry("_id", "u1")
            .containsEntry("endTime", NOW)
            .containsEntry("endTimeEstimated", true);
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set)
            .containsEntry("endTime", END)
            .containsEntry("endTimeEstimated", false)
            .containsEntry("previousEndTime", NOW)
            .containsEntry("previousEndTimeEstimated", true)
            .containsEntry("correctionReason", "node log shows exit at 11:30")
            .containsEntry("correctedAt", NOW);
    }

    @Test
    void shouldReportConflictWhenRecordChangedConcurrently() {
        when(repository.findById("u1")).thenReturn(Optional.of(closedRecord()));
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(PodRecord.class)))
            .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.correctEndTime("u1", END, false, "audit")).isEqualTo(CorrectionOutcome.CONFLICT);
    }

    @Test
    void shouldListIdsByEndTimePresence() {
        when(mongoTemplate.findDistinct(any(Query.class), eq("_id"), eq(PodRecord.class), eq(String.class)))
            .thenReturn(List.of("a", "b"));

        assertThat(store.listOpenIds()).containsExactlyInAnyOrder("a", "b");

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).findDistinct(query.capture(), eq("_id"), eq(PodRecord.class), eq(String.class));
        assertThat(query.getValue().getQueryObject()).containsEntry("endTime", null);
    }

    @Test
    void shouldListEstimatedRecordsForAudit() {
        when(repository.findByEndTimeEstimatedTrueOrderByEndTimeDesc()).thenReturn(List.of(closedRecord()));

        assertThat(store.listEstimated())
            .singleElement()
            .satisfies(r -> assertThat(r.endTimeEstimated()).isTrue());
    }

    private static PodRecord openRecord() {
        return PodRecord.open("u1", "team-a", "trainer", "node-1", ResourceRequest.ZERO, START, START);
    }

    private static PodRecord closedRecord() {
        return PodRecords.closed(openRecord(), NOW, true);
    }
}
