package io.github.samzhu.podledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Pod Ledger Service - 叢集工作負載資源計費帳本。
 *
 * <p>此服務觀察叢集中每個 Pod 的生命週期，負責：
 * <ul>
 *   <li>記錄 Pod 開始消耗資源的時間與資源請求 (CPU / 記憶體 / 加速器)</li>
 *   <li>記錄 Pod 停止的時間，無法取得權威時間時標記為估算值</li>
 *   <li>啟動時對帳，修復離線期間遺漏的開始與結束</li>
 *   <li>提供 REST API 查詢與稽核帳本</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * API server ─ list ─→ ReconciliationService ─┐
 *            ─ watch ─→ PodEventStreamService ─┴→ BillingLifecycleService → MongoDB
 *                                                                    pod_records
 * </pre>
 *
 * <p>不強制配額、不修改叢集狀態、不計算金額；下游計費流程讀取 {@code pod_records}。
 */
@SpringBootApplication
public class PodLedgerApplication {

    private static final Logger log = LoggerFactory.getLogger(PodLedgerApplication.class);

    public static void main(String[] args) {
        log.info("Starting Pod Ledger Service - Workload Resource Billing");
        SpringApplication.run(PodLedgerApplication.class, args);
    }
}
