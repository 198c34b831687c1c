package io.github.samzhu.podledger.service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.podledger.config.PodLedgerProperties;
import io.github.samzhu.podledger.dto.ChangeKind;
import io.github.samzhu.podledger.dto.PodEvent;
import io.github.samzhu.podledger.dto.WorkloadInstance;
import io.github.samzhu.podledger.exception.FeedPositionExpiredException;
import io.github.samzhu.podledger.feed.PodFeed;
import io.github.samzhu.podledger.feed.PodSubscription;

/**
 * Pod 事件串流協調器。
 *
 * <p>長時間執行的訂閱迴圈：
 * <ol>
 *   <li>從 resumption token 訂閱，每次訂閱最多等待 {@code podledger.stream.timeout}</li>
 *   <li>逐一處理事件（含帳本寫入）後才讀取下一個，並將 token 推進到事件的 resourceVersion</li>
 *   <li>訂閱逾時或關閉後以目前 token 重新訂閱</li>
 * </ol>
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>token 失效 (410 Gone) → 重設 token 並重新訂閱；若啟用 {@code reconcile-on-reset}，
 *       先重新對帳並由新清單的 resourceVersion 接續</li>
 *   <li>其他串流錯誤 → 記錄、重設 token，等待 {@code retry-delay} 後重新訂閱</li>
 *   <li>單一事件處理失敗 → 記錄並繼續下一個事件</li>
 * </ul>
 *
 * <p>迴圈只在 {@link #stop()} 後結束；正在處理的事件會先完成。
 *
 * @see PodLedgerLifecycle
 */
@Service
public class PodEventStreamService {

    private static final Logger log = LoggerFactory.getLogger(PodEventStreamService.class);

    private final PodFeed feed;
    private final BillingLifecycleService lifecycle;
    private final ReconciliationService reconciliationService;
    private final NamespaceFilter namespaceFilter;
    private final Duration timeout;
    private final Duration retryDelay;
    private final boolean reconcileOnReset;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile PodSubscription activeSubscription;

    public PodEventStreamService(
            PodFeed feed,
            BillingLifecycleService lifecycle,
            ReconciliationService reconciliationService,
            NamespaceFilter namespaceFilter,
            PodLedgerProperties properties) {
        this.feed = feed;
        this.lifecycle = lifecycle;
        this.reconciliationService = reconciliationService;
        this.namespaceFilter = namespaceFilter;
        this.timeout = properties.stream().timeout();
        this.retryDelay = properties.stream().retryDelay();
        this.reconcileOnReset = properties.stream().reconcileOnReset();
    }

    /**
     * 在呼叫端執行緒上執行訂閱迴圈，直到 {@link #stop()}。
     *
     * @param index 對帳後的計費索引
     * @param resourceVersion 起始 token，null 表示從目前開始
     */
    public void run(BillingIndex index, String resourceVersion) {
        running.set(true);
        String token = resourceVersion;
        log.info("Starting pod event stream: resourceVersion={}, timeout={}, billing={}",
            token, timeout, index.billingCount());

        while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
            try (PodSubscription subscription = feed.subscribe(token, timeout)) {
                activeSubscription = subscription;
                if (stopRequested.get()) {
                    break;
                }
                while (subscription.hasNext()) {
                    PodEvent event = subscription.next();
                    process(event, index);
                    if (event.resourceVersion() != null) {
                        token = event.resourceVersion();
                    }
                    if (stopRequested.get()) {
                        break;
                    }
                }
            } catch (FeedPositionExpiredException e) {
                log.warn("Resume position expired (resourceVersion={}), resetting", e.getResourceVersion());
                token = resetToken(index);
            } catch (Exception e) {
                log.error("Pod event stream failed, resubscribing: {}", e.getMessage(), e);
                token = resetToken(index);
                pause();
            } finally {
                activeSubscription = null;
            }
        }

        running.set(false);
        log.info("Pod event stream stopped: lastResourceVersion={}, billing={}, settled={}",
            token, index.billingCount(), index.settledCount());
    }

    /**
     * 要求迴圈結束並關閉目前的訂閱；可由其他執行緒呼叫。
     */
    public void stop() {
        stopRequested.set(true);
        PodSubscription subscription = activeSubscription;
        if (subscription != null) {
            subscription.close();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 處理單一事件，錯誤限制在事件範圍內。
     */
    void process(PodEvent event, BillingIndex index) {
        if (event.kind() == ChangeKind.BOOKMARK) {
            return;
        }
        WorkloadInstance instance = event.instance();
        if (namespaceFilter.isIgnored(instance.namespace())) {
            return;
        }
        try {
            lifecycle.handle(event, index);
        } catch (Exception e) {
            log.error("Failed to process {} event for pod {} ({}): {}",
                event.kind(), instance.displayName(), instance.uid(), e.getMessage(), e);
        }
    }

    private String resetToken(BillingIndex index) {
        if (!reconcileOnReset || stopRequested.get()) {
            return null;
        }
        try {
            return reconciliationService.reconcile(index).resourceVersion();
        } catch (Exception e) {
            log.error("Reconciliation after position reset failed, subscribing from now: {}", e.getMessage(), e);
            return null;
        }
    }

    private void pause() {
        if (retryDelay.isZero() || stopRequested.get()) {
            return;
        }
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
        }
    }
}
