package io.github.samzhu.podledger.document;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import io.github.samzhu.podledger.dto.ResourceRequest;

class PodRecordTest {

    private static final Instant START = Instant.parse("2025-06-01T10:00:00Z");
    private static final Instant END = Instant.parse("2025-06-01T11:30:00Z");

    @Test
    void shouldOpenWithBaseUnits() {
        PodRecord record = PodRecord.open("u1", "team-a", "trainer", "node-1",
            new ResourceRequest(new BigDecimal("0.25"), new BigDecimal("2147483648"), new BigDecimal("2")),
            START, START);

        assertThat(record.isOpen()).isTrue();
        assertThat(record.cpu()).isEqualTo(0.25);
        assertThat(record.memory()).isEqualTo(2147483648d);
        assertThat(record.accelerator()).isEqualTo(2d);
        assertThat(record.endTimeEstimated()).isFalse();
        assertThat(record.previousEndTime()).isNull();
    }

    @Test
    void shouldKeepPreviousValueOnCorrection() {
        Instant correctedAt = END.plusSeconds(3600);
        PodRecord closed = PodRecords.closed(
            PodRecord.open("u1", "team-a", "trainer", "node-1", ResourceRequest.ZERO, START, START),
            END.plusSeconds(120), true);

        PodRecord corrected = closed.withCorrection(END, false, "kubelet log", correctedAt);

        assertThat(corrected.endTime()).isEqualTo(END);
        assertThat(corrected.endTimeEstimated()).isFalse();
        assertThat(corrected.previousEndTime()).isEqualTo(END.plusSeconds(120));
        assertThat(corrected.previousEndTimeEstimated()).isTrue();
        assertThat(corrected.correctionReason()).isEqualTo("kubelet log");
        assertThat(corrected.correctedAt()).isEqualTo(correctedAt);
        assertThat(corrected.startTime()).isEqualTo(START);
    }
}
