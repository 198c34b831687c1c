package io.github.samzhu.podledger.service;

import java.util.Set;

import org.springframework.stereotype.Component;

import io.github.samzhu.podledger.config.PodLedgerProperties;
import io.github.samzhu.podledger.dto.ChangeKind;
import io.github.samzhu.podledger.dto.PodEvent;
import io.github.samzhu.podledger.dto.WorkloadInstance;

/**
 * Pod 計費狀態機：{@code Unseen → Billing → Settled}。
 *
 * <p>依下列優先順序判定，第一個符合者勝出：
 * <ol>
 *   <li>建立/更新事件、不在 billing、已有開始時間與節點、phase 為 active → {@link BillingAction#START_BILLING}</li>
 *   <li>建立/更新事件、在 billing、phase 為 terminal → {@link BillingAction#STOP_BILLING}</li>
 *   <li>刪除事件、在 billing → {@link BillingAction#STOP_BILLING_ON_REMOVAL}</li>
 *   <li>其他 → {@link BillingAction#IGNORE}</li>
 * </ol>
 *
 * <p>純判定邏輯，不寫入帳本也不修改索引；套用由 {@link BillingLifecycleService} 負責。
 * 同一 Pod 的事件需依發生順序送入。
 */
@Component
public class LifecycleClassifier {

    private final Set<String> activePhases;
    private final Set<String> terminalPhases;

    public LifecycleClassifier(PodLedgerProperties properties) {
        this.activePhases = properties.phases().active();
        this.terminalPhases = properties.phases().terminal();
    }

    public BillingAction classify(PodEvent event, BillingIndex index) {
        if (event.kind() == ChangeKind.BOOKMARK || event.instance() == null) {
            return BillingAction.IGNORE;
        }

        WorkloadInstance instance = event.instance();
        boolean billing = index.isBilling(instance.uid());

        if (event.kind() == ChangeKind.CREATED_OR_UPDATED) {
            if (!billing
                    && instance.startTime().isPresent()
                    && instance.node().isPresent()
                    && isActive(instance.phase())) {
                return BillingAction.START_BILLING;
            }
            if (billing && isTerminal(instance.phase())) {
                return BillingAction.STOP_BILLING;
            }
        } else if (event.kind() == ChangeKind.REMOVED && billing) {
            return BillingAction.STOP_BILLING_ON_REMOVAL;
        }
        return BillingAction.IGNORE;
    }

    public boolean isActive(String phase) {
        return phase != null && activePhases.contains(phase);
    }

    public boolean isTerminal(String phase) {
        return phase != null && terminalPhases.contains(phase);
    }
}
