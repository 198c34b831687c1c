package io.github.samzhu.podledger.service;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * 記憶體中的計費索引。
 *
 * <p>兩個互斥集合：
 * <ul>
 *   <li>{@code billing} - 計費中的 Pod UID，與帳本中開啟中的記錄一致</li>
 *   <li>{@code settled} - 已結束的 Pod UID，避免重複 backfill</li>
 * </ul>
 *
 * <p>啟動時由帳本重建，只由單一控制執行緒（對帳服務與串流協調器）存取，
 * 因此不做同步；程序結束即丟棄。
 */
public class BillingIndex {

    private final Set<String> billing = new HashSet<>();
    private final Set<String> settled = new HashSet<>();

    /**
     * 以帳本內容重設索引。
     *
     * @param open 帳本中開啟中的 UID
     * @param closed 帳本中已關閉的 UID
     */
    public void reset(Collection<String> open, Collection<String> closed) {
        billing.clear();
        settled.clear();
        settled.addAll(closed);
        open.stream()
            .filter(uid -> !settled.contains(uid))
            .forEach(billing::add);
    }

    public boolean isBilling(String uid) {
        return billing.contains(uid);
    }

    public boolean isSettled(String uid) {
        return settled.contains(uid);
    }

    /**
     * Unseen → Billing。
     */
    public void startBilling(String uid) {
        settled.remove(uid);
        billing.add(uid);
    }

    /**
     * Billing → Settled；也用於直接標記 backfill 或不一致的記錄。
     */
    public void settle(String uid) {
        billing.remove(uid);
        settled.add(uid);
    }

    public Set<String> billingIds() {
        return Set.copyOf(billing);
    }

    public Set<String> settledIds() {
        return Set.copyOf(settled);
    }

    public int billingCount() {
        return billing.size();
    }

    public int settledCount() {
        return settled.size();
    }
}
