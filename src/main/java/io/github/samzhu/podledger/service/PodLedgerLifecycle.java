package io.github.samzhu.podledger.service;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import io.github.samzhu.podledger.config.PodLedgerProperties;
import io.github.samzhu.podledger.dto.ReconciliationResult;

/**
 * Pod Ledger 的執行生命週期。
 *
 * <p>啟動時：
 * <ol>
 *   <li>在啟動執行緒上同步執行一次對帳；失敗則 Spring context 啟動失敗，不進入串流</li>
 *   <li>建立單一控制執行緒 {@code pod-event-stream}，持有 {@link BillingIndex} 並執行串流迴圈</li>
 * </ol>
 *
 * <p>實作 {@link SmartLifecycle} 確保：
 * <ul>
 *   <li>關閉時先停止接收事件，等待處理中的事件完成寫入</li>
 *   <li>MongoDB 與 Kubernetes 用戶端在此之後才由 Spring 釋放（phase: MAX_VALUE - 100）</li>
 * </ul>
 *
 * @see ReconciliationService
 * @see PodEventStreamService
 */
@Service
public class PodLedgerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PodLedgerLifecycle.class);

    private final ReconciliationService reconciliationService;
    private final PodEventStreamService streamService;
    private final long joinTimeoutMillis;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Thread streamThread;

    public PodLedgerLifecycle(
            ReconciliationService reconciliationService,
            PodEventStreamService streamService,
            PodLedgerProperties properties) {
        this.reconciliationService = reconciliationService;
        this.streamService = streamService;
        this.joinTimeoutMillis = properties.stream().timeout().toMillis() + 5_000;
    }

    // ===== SmartLifecycle Implementation =====

    @Override
    public void start() {
        BillingIndex index = new BillingIndex();
        ReconciliationResult result = reconciliationService.reconcile(index);

        streamThread = new Thread(() -> {
            try {
                streamService.run(index, result.resourceVersion());
            } catch (RuntimeException | Error e) {
                log.error("Pod event stream terminated unexpectedly", e);
                throw e;
            }
        }, "pod-event-stream");
        streamThread.start();
        running.set(true);
        log.info("PodLedgerLifecycle started: billing={}, settled={}",
            result.billing().size(), result.settled().size());
    }

    @Override
    public void stop() {
        log.info("PodLedgerLifecycle stopping, waiting for in-flight event...");
        streamService.stop();
        if (streamThread != null) {
            try {
                streamThread.join(joinTimeoutMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (streamThread.isAlive()) {
                log.warn("Pod event stream did not stop within {}ms", joinTimeoutMillis);
            }
        }
        running.set(false);
        log.info("PodLedgerLifecycle stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 在 web server 之後啟動、之前關閉；資料庫連線於所有 lifecycle 停止後才釋放
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }
}
