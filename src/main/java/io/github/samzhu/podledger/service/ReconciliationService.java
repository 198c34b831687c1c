package io.github.samzhu.podledger.service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.podledger.document.PodRecord;
import io.github.samzhu.podledger.dto.ReconciliationResult;
import io.github.samzhu.podledger.dto.WorkloadInstance;
import io.github.samzhu.podledger.feed.PodFeed;
import io.github.samzhu.podledger.feed.PodSnapshot;
import io.github.samzhu.podledger.store.PodLedgerStore;

/**
 * 啟動對帳服務：以叢集完整清單修復帳本在未觀察期間（當機、重啟、訂閱失效）累積的偏差。
 *
 * <p>處理流程：
 * <ol>
 *   <li>直接向叢集取得完整清單，並由帳本重建 {@link BillingIndex}</li>
 *   <li>Zombie：帳本開啟中但叢集已不存在 → 以對帳時間關閉（估算）；
 *       若記錄其實已有結束時間則記錄不一致，視為已結束且不改寫</li>
 *   <li>清單中 phase 為 terminal 且尚未結束的 Pod：
 *       在 billing 中 → 依結束時間規則關閉；否則 → 補建記錄並立即關閉（需有開始時間）</li>
 *   <li>清單中 phase 為 active、已有開始時間與節點但不在 billing 的 Pod → 開始計費</li>
 * </ol>
 *
 * <p>所有估算結束時間使用同一個對帳時間點，不逐筆取樣。
 * 單一 Pod 的錯誤只記錄並略過，不中止整個對帳；無法取得清單或讀取帳本則向上拋出。
 *
 * @see BillingLifecycleService
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final PodFeed feed;
    private final PodLedgerStore store;
    private final BillingLifecycleService lifecycle;
    private final LifecycleClassifier classifier;
    private final NamespaceFilter namespaceFilter;
    private final Clock clock;

    public ReconciliationService(
            PodFeed feed,
            PodLedgerStore store,
            BillingLifecycleService lifecycle,
            LifecycleClassifier classifier,
            NamespaceFilter namespaceFilter,
            Clock clock) {
        this.feed = feed;
        this.store = store;
        this.lifecycle = lifecycle;
        this.classifier = classifier;
        this.namespaceFilter = namespaceFilter;
        this.clock = clock;
    }

    /**
     * 執行一次對帳並修復傳入的索引。
     *
     * @param index 由單一控制執行緒持有的計費索引，會被重設並修復
     * @return 對帳結果，包含接續串流用的 resourceVersion
     * @throws io.github.samzhu.podledger.exception.ClusterSnapshotException 無法取得叢集清單
     */
    public ReconciliationResult reconcile(BillingIndex index) {
        log.info("Starting reconciliation...");
        long startTime = System.currentTimeMillis();

        PodSnapshot snapshot = feed.listAll();
        Instant now = clock.instant();

        Set<String> open = store.listOpenIds();
        Set<String> closed = store.listClosedIds();
        index.reset(open, closed);
        log.info("Loaded ledger state: {} open, {} closed records", index.billingCount(), index.settledCount());

        Counters counters = new Counters();

        Set<String> snapshotIds = snapshot.items().stream()
            .map(WorkloadInstance::uid)
            .collect(Collectors.toSet());
        Set<String> zombies = new HashSet<>(index.billingIds());
        zombies.removeAll(snapshotIds);
        for (String uid : zombies) {
            closeZombie(uid, index, now, counters);
        }

        for (WorkloadInstance instance : snapshot.items()) {
            if (namespaceFilter.isIgnored(instance.namespace())) {
                continue;
            }
            try {
                reconcileInstance(instance, index, now, counters);
            } catch (Exception e) {
                counters.skipped++;
                log.error("Failed to reconcile pod {} ({}): {}",
                    instance.displayName(), instance.uid(), e.getMessage(), e);
            }
        }

        ReconciliationResult result = new ReconciliationResult(
            index.billingIds(),
            index.settledIds(),
            snapshot.resourceVersion(),
            now,
            counters.zombiesClosed,
            counters.inconsistencies,
            counters.missedEndsClosed,
            counters.backfilled,
            counters.started,
            counters.skipped);

        long duration = System.currentTimeMillis() - startTime;
        log.info("Reconciliation completed in {}ms: zombies={}, inconsistencies={}, missedEnds={}, backfilled={}, "
                + "started={}, skipped={}, billing={}, settled={}, resourceVersion={}",
            duration, result.zombiesClosed(), result.inconsistencies(), result.missedEndsClosed(),
            result.backfilled(), result.started(), result.skipped(),
            result.billing().size(), result.settled().size(), result.resourceVersion());
        return result;
    }

    private void closeZombie(String uid, BillingIndex index, Instant now, Counters counters) {
        try {
            Optional<PodRecord> record = store.getRecord(uid);
            if (record.isPresent() && !record.get().isOpen()) {
                counters.inconsistencies++;
                log.error("Ledger inconsistency: zombie uid={} already has endTime={} (estimated={}), treating as settled",
                    uid, record.get().endTime(), record.get().endTimeEstimated());
                index.settle(uid);
                return;
            }

            store.setEndTime(uid, now, true);
            index.settle(uid);
            counters.zombiesClosed++;
            log.info("Closed zombie record: uid={}, endTime={} (estimated)", uid, now);
        } catch (Exception e) {
            counters.skipped++;
            log.error("Failed to close zombie record {}: {}", uid, e.getMessage(), e);
        }
    }

    private void reconcileInstance(WorkloadInstance instance, BillingIndex index, Instant now, Counters counters) {
        String uid = instance.uid();

        if (classifier.isTerminal(instance.phase())) {
            if (index.isSettled(uid)) {
                return;
            }
            if (index.isBilling(uid)) {
                lifecycle.stopBilling(instance, index, now);
                counters.missedEndsClosed++;
                return;
            }
            if (instance.startTime().isEmpty()) {
                counters.skipped++;
                log.error("Cannot backfill pod {} ({}): no start time", instance.displayName(), uid);
                return;
            }
            lifecycle.backfill(instance, index, now);
            counters.backfilled++;
            return;
        }

        if (classifier.isActive(instance.phase())
                && !index.isBilling(uid)
                && !index.isSettled(uid)
                && instance.startTime().isPresent()
                && instance.node().isPresent()) {
            lifecycle.startBilling(instance, index);
            counters.started++;
        }
    }

    private static class Counters {
        int zombiesClosed;
        int inconsistencies;
        int missedEndsClosed;
        int backfilled;
        int started;
        int skipped;
    }
}
