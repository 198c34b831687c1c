package io.github.samzhu.podledger.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.podledger.document.PodRecord;
import io.github.samzhu.podledger.dto.PodEvent;
import io.github.samzhu.podledger.dto.ResourceRequest;
import io.github.samzhu.podledger.dto.WorkloadInstance;
import io.github.samzhu.podledger.store.PodLedgerStore;

/**
 * 套用計費狀態機的判定：寫入帳本並同步更新 {@link BillingIndex}。
 *
 * <p>處理順序：先寫入帳本，成功後才修改索引。寫入失敗時例外向上傳遞，
 * 索引維持原狀，由呼叫端在單一 Pod 的範圍內記錄並略過。
 *
 * <p>結束時間決定規則（串流與對帳共用）：
 * <ol>
 *   <li>優先使用所有容器與 init 容器中最晚的 {@code terminated.finishedAt}，{@code estimated=false}</li>
 *   <li>無法取得時使用目前時間，{@code estimated=true}</li>
 * </ol>
 *
 * @see LifecycleClassifier
 */
@Service
public class BillingLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(BillingLifecycleService.class);

    private final LifecycleClassifier classifier;
    private final ResourceRequestCalculator calculator;
    private final PodLedgerStore store;
    private final Clock clock;

    public BillingLifecycleService(
            LifecycleClassifier classifier,
            ResourceRequestCalculator calculator,
            PodLedgerStore store,
            Clock clock) {
        this.classifier = classifier;
        this.calculator = calculator;
        this.store = store;
        this.clock = clock;
    }

    /**
     * 分類並套用單一事件。
     *
     * @param event Pod 變更事件（命名空間過濾已由呼叫端完成）
     * @param index 計費索引
     * @return 套用的動作
     */
    public BillingAction handle(PodEvent event, BillingIndex index) {
        BillingAction action = classifier.classify(event, index);
        switch (action) {
            case START_BILLING -> startBilling(event.instance(), index);
            case STOP_BILLING -> stopBilling(event.instance(), index, clock.instant());
            case STOP_BILLING_ON_REMOVAL -> stopBillingOnRemoval(event.instance(), index);
            case IGNORE -> log.trace("Event ignored: kind={}, uid={}", event.kind(),
                event.instance() != null ? event.instance().uid() : null);
        }
        return action;
    }

    /**
     * 建立計費記錄並加入 billing。
     *
     * <p>帳本中已存在且已關閉的 UID 不會重新進入 billing，避免索引與帳本不一致。
     */
    public void startBilling(WorkloadInstance instance, BillingIndex index) {
        ResourceRequest resources = calculator.calculate(instance);
        boolean created = store.createIfAbsent(
            instance.uid(),
            instance.namespace(),
            instance.name(),
            instance.node().orElse(null),
            resources,
            instance.startTime().orElseThrow());

        if (!created) {
            Optional<PodRecord> existing = store.getRecord(instance.uid());
            if (existing.isPresent() && !existing.get().isOpen()) {
                log.warn("Pod {} ({}) is already closed in the ledger, not billing again",
                    instance.displayName(), instance.uid());
                index.settle(instance.uid());
                return;
            }
        }

        index.startBilling(instance.uid());
        log.info("Started billing pod {}: uid={}, node={}, cpu={}, memory={}, accelerator={}",
            instance.displayName(), instance.uid(), instance.node().orElse(null),
            resources.cpu(), resources.memory(), resources.accelerator());
    }

    /**
     * 以結束時間決定規則關閉記錄。
     *
     * @param now 無權威結束時間時使用的時間點
     */
    public void stopBilling(WorkloadInstance instance, BillingIndex index, Instant now) {
        ResolvedEndTime endTime = resolveEndTime(instance, now);
        store.setEndTime(instance.uid(), endTime.time(), endTime.estimated());
        index.settle(instance.uid());
        log.info("Recorded end time for pod {}: uid={}, endTime={}, estimated={}",
            instance.displayName(), instance.uid(), endTime.time(), endTime.estimated());
    }

    /**
     * Pod 物件已刪除，無法取得權威終止狀態，結束時間一律為目前時間並標記估算。
     */
    public void stopBillingOnRemoval(WorkloadInstance instance, BillingIndex index) {
        Instant now = clock.instant();
        store.setEndTime(instance.uid(), now, true);
        index.settle(instance.uid());
        log.info("Pod {} deleted while billing: uid={}, endTime={} (estimated)",
            instance.displayName(), instance.uid(), now);
    }

    /**
     * 為離線期間開始並結束的 Pod 補建記錄並立即關閉。
     *
     * @param now 無權威結束時間時使用的時間點
     */
    public void backfill(WorkloadInstance instance, BillingIndex index, Instant now) {
        ResourceRequest resources = calculator.calculate(instance);
        ResolvedEndTime endTime = resolveEndTime(instance, now);
        store.createIfAbsent(
            instance.uid(),
            instance.namespace(),
            instance.name(),
            instance.node().orElse(null),
            resources,
            instance.startTime().orElseThrow());
        store.setEndTime(instance.uid(), endTime.time(), endTime.estimated());
        index.settle(instance.uid());
        log.info("Backfilled pod {}: uid={}, start={}, endTime={}, estimated={}",
            instance.displayName(), instance.uid(), instance.startTime().orElse(null),
            endTime.time(), endTime.estimated());
    }

    /**
     * 決定結束時間：權威的 terminated 時間優先，否則使用 {@code now} 並標記估算。
     */
    public static ResolvedEndTime resolveEndTime(WorkloadInstance instance, Instant now) {
        return instance.latestTerminatedAt()
            .map(finishedAt -> new ResolvedEndTime(finishedAt, false))
            .orElseGet(() -> new ResolvedEndTime(now, true));
    }

    /**
     * @param time 結束時間
     * @param estimated 是否為估算值
     */
    public record ResolvedEndTime(Instant time, boolean estimated) {}
}
