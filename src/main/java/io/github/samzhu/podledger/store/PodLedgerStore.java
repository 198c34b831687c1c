package io.github.samzhu.podledger.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.github.samzhu.podledger.document.PodRecord;
import io.github.samzhu.podledger.dto.ResourceRequest;

/**
 * Pod 計費帳本的持久化介面。
 *
 * <p>對帳服務與串流協調器只透過此介面寫入。不變量：
 * <ul>
 *   <li>UID 唯一，重複建立為 no-op，不改變第一次寫入的資源欄位</li>
 *   <li>結束時間一經設定，只能透過 {@link #correctEndTime} 明確修正</li>
 *   <li>開啟中的記錄集合即為目前判定仍在消耗資源的 Pod 集合</li>
 * </ul>
 */
public interface PodLedgerStore {

    /**
     * 建立計費記錄；UID 已存在時不做任何事。
     *
     * @return true 表示本次呼叫新增了記錄
     */
    boolean createIfAbsent(String uid, String namespace, String name, String node,
                           ResourceRequest resources, Instant startTime);

    /**
     * 設定結束時間；記錄已關閉時不覆寫並記錄警告。
     *
     * @return true 表示本次呼叫關閉了記錄
     */
    boolean setEndTime(String uid, Instant endTime, boolean estimated);

    /**
     * 明確修正已關閉記錄的結束時間，保留修正前的值。
     */
    CorrectionOutcome correctEndTime(String uid, Instant endTime, boolean estimated, String reason);

    Set<String> listOpenIds();

    Set<String> listClosedIds();

    Optional<PodRecord> getRecord(String uid);

    /**
     * @return 結束時間為估算值的記錄
     */
    List<PodRecord> listEstimated();
}
