package io.github.samzhu.podledger.service;

/**
 * 計費狀態機對單一事件的判定結果。
 */
public enum BillingAction {
    /** Unseen → Billing */
    START_BILLING,
    /** Billing → Settled，Pod 進入終止 phase */
    STOP_BILLING,
    /** Billing → Settled，Pod 物件已刪除，結束時間一律為估算值 */
    STOP_BILLING_ON_REMOVAL,
    IGNORE
}
