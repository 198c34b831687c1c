package io.github.samzhu.podledger.store;

/**
 * 結束時間修正的結果。
 */
public enum CorrectionOutcome {
    CORRECTED,
    NOT_FOUND,
    /** 記錄仍在計費中，歸串流執行緒所有，不可修正 */
    STILL_OPEN,
    /** 讀取後記錄已被其他寫入改變 */
    CONFLICT
}
