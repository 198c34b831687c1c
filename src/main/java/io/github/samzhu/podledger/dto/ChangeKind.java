package io.github.samzhu.podledger.dto;

/**
 * Pod 變更事件類型。
 *
 * <p>對應 Kubernetes watch 的 ADDED / MODIFIED / DELETED / BOOKMARK。
 * ADDED 與 MODIFIED 對計費狀態機而言語意相同，合併為 {@link #CREATED_OR_UPDATED}。
 */
public enum ChangeKind {
    CREATED_OR_UPDATED,
    REMOVED,
    /** 僅推進 resourceVersion，不帶 Pod 狀態 */
    BOOKMARK
}
