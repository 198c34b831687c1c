package io.github.samzhu.podledger.feed;

import java.util.List;

import io.github.samzhu.podledger.dto.WorkloadInstance;

/**
 * 叢集中所有 Pod 的完整清單。
 *
 * @param items 所有 Pod
 * @param resourceVersion 清單的串流位置，用於接續訂閱
 */
public record PodSnapshot(
    List<WorkloadInstance> items,
    String resourceVersion
) {
    public PodSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
