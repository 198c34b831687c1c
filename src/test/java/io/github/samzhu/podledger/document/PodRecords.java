package io.github.samzhu.podledger.document;

import java.time.Instant;

/**
 * 測試用 {@link PodRecord} 建立工具。
 */
public final class PodRecords {

    private PodRecords() {
    }

    /**
     * 複製並設定結束時間，模擬 {@code closeIfOpen} 寫入後的文件。
     */
    public static PodRecord closed(PodRecord record, Instant endTime, boolean estimated) {
        return new PodRecord(record.uid(), record.namespace(), record.name(), record.node(),
            record.cpu(), record.memory(), record.accelerator(),
            record.startTime(), endTime, estimated,
            record.previousEndTime(), record.previousEndTimeEstimated(),
            record.correctionReason(), record.correctedAt(),
            record.createdAt());
    }
}
