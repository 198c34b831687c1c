package io.github.samzhu.podledger.dto;

/**
 * Pod 變更串流中的單一事件。
 *
 * @param kind 變更類型
 * @param instance 事件攜帶的 Pod 狀態，{@link ChangeKind#BOOKMARK} 時為 null
 * @param resourceVersion 事件之後的串流位置
 */
public record PodEvent(
    ChangeKind kind,
    WorkloadInstance instance,
    String resourceVersion
) {
    public static PodEvent bookmark(String resourceVersion) {
        return new PodEvent(ChangeKind.BOOKMARK, null, resourceVersion);
    }
}
