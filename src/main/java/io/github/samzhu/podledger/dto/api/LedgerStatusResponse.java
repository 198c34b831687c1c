package io.github.samzhu.podledger.dto.api;

/**
 * 帳本狀態統計。
 *
 * @param openRecords 計費中的記錄數
 * @param closedRecords 已結束的記錄數
 * @param estimatedRecords 結束時間為估算值的記錄數
 */
public record LedgerStatusResponse(
    long openRecords,
    long closedRecords,
    long estimatedRecords
) {}
