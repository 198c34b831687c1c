package io.github.samzhu.podledger.dto;

import java.time.Instant;
import java.util.Set;

/**
 * 一次對帳的結果。
 *
 * @param billing 修復後計費中的 UID
 * @param settled 修復後已結束的 UID
 * @param resourceVersion 完整清單的串流位置，作為串流協調器的起始 token
 * @param reconciledAt 本次對帳的固定時間點，所有估算結束時間皆使用此值
 * @param zombiesClosed 帳本開啟中但叢集已不存在、被關閉的記錄數
 * @param inconsistencies 帳本資料矛盾的記錄數
 * @param missedEndsClosed 離線期間結束、被補上結束時間的記錄數
 * @param backfilled 離線期間開始並結束、被補建的記錄數
 * @param started 離線期間開始且仍在執行、開始計費的記錄數
 * @param skipped 因資料缺漏或錯誤而略過的 Pod 數
 */
public record ReconciliationResult(
    Set<String> billing,
    Set<String> settled,
    String resourceVersion,
    Instant reconciledAt,
    int zombiesClosed,
    int inconsistencies,
    int missedEndsClosed,
    int backfilled,
    int started,
    int skipped
) {
    public ReconciliationResult {
        billing = Set.copyOf(billing);
        settled = Set.copyOf(settled);
    }
}
