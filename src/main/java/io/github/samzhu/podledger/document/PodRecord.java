package io.github.samzhu.podledger.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.podledger.dto.ResourceRequest;

/**
 * Pod 計費記錄文件。
 *
 * <p>每個 Pod 實例一筆，文件 ID 即為 Pod UID，重複建立為 no-op。
 * 下游計費流程讀取此集合作為 append-mostly 的帳本：
 * <ul>
 *   <li>識別欄位 - namespace、name、node，建立後不變</li>
 *   <li>資源請求 - cpu (cores)、memory (bytes)、accelerator (個數)，建立時決定，永不修改</li>
 *   <li>計費區間 - startTime 建立時決定；endTime 為 null 表示仍在計費</li>
 *   <li>估算旗標 - endTimeEstimated 為 true 表示結束時間取自本地時鐘，需保留供稽核</li>
 *   <li>修正軌跡 - 僅由明確的修正 API 寫入，保留修正前的值</li>
 * </ul>
 *
 * @see io.github.samzhu.podledger.store.PodLedgerStore
 */
@Document(collection = "pod_records")
public record PodRecord(
    @Id String uid,

    // ========== 識別 ==========
    @Indexed String namespace,
    String name,
    String node,

    // ========== 資源請求（基本單位）==========
    double cpu,
    double memory,
    double accelerator,

    // ========== 計費區間 ==========
    Instant startTime,
    @Indexed Instant endTime,
    @Indexed boolean endTimeEstimated,

    // ========== 修正軌跡 ==========
    Instant previousEndTime,
    Boolean previousEndTimeEstimated,
    String correctionReason,
    Instant correctedAt,

    Instant createdAt
) {

    /**
     * 建立一筆開啟中（計費中）的記錄。
     */
    public static PodRecord open(String uid, String namespace, String name, String node,
                                 ResourceRequest resources, Instant startTime, Instant createdAt) {
        return new PodRecord(uid, namespace, name, node,
            resources.cpu().doubleValue(), resources.memory().doubleValue(), resources.accelerator().doubleValue(),
            startTime, null, false,
            null, null, null, null,
            createdAt);
    }

    /**
     * @return true 表示仍在計費（尚無結束時間）
     */
    public boolean isOpen() {
        return endTime == null;
    }

    /**
     * 複製並套用修正，保留修正前的結束時間。
     */
    public PodRecord withCorrection(Instant endTime, boolean estimated, String reason, Instant now) {
        return new PodRecord(uid, namespace, name, node, cpu, memory, accelerator,
            startTime, endTime, estimated,
            this.endTime, this.endTimeEstimated, reason, now,
            createdAt);
    }
}
