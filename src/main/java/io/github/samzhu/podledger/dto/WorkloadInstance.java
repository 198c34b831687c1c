package io.github.samzhu.podledger.dto;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 叢集中單一 Pod 的不可變快照。
 *
 * <p>只保留計費狀態機需要的欄位。可能缺少的資料以 null 表示，
 * 並透過 {@link #node()}、{@link #startTime()}、{@link #latestTerminatedAt()}
 * 以 {@link Optional} 形式提供，呼叫端不需處理缺欄位的例外。
 *
 * @param uid Pod 唯一識別碼
 * @param namespace 命名空間
 * @param name Pod 名稱
 * @param nodeName 排程到的節點，未排程時為 null
 * @param phase Pod phase（Pending、Running、Succeeded、Failed、Unknown）
 * @param startedAt kubelet 回報的開始時間，未開始時為 null
 * @param initContainers init 容器資源請求
 * @param containers 主容器資源請求
 * @param terminatedAt 所有容器與 init 容器的 {@code state.terminated.finishedAt}
 */
public record WorkloadInstance(
    String uid,
    String namespace,
    String name,
    String nodeName,
    String phase,
    Instant startedAt,
    List<ContainerRequests> initContainers,
    List<ContainerRequests> containers,
    List<Instant> terminatedAt
) {
    public WorkloadInstance {
        initContainers = initContainers == null ? List.of() : List.copyOf(initContainers);
        containers = containers == null ? List.of() : List.copyOf(containers);
        terminatedAt = terminatedAt == null ? List.of() : List.copyOf(terminatedAt);
    }

    public Optional<String> node() {
        return Optional.ofNullable(nodeName).filter(n -> !n.isBlank());
    }

    public Optional<Instant> startTime() {
        return Optional.ofNullable(startedAt);
    }

    /**
     * 取得最後一個容器停止的時間，即 Pod 真正釋放資源的時間。
     *
     * @return 最晚的 terminated 時間，沒有任何容器回報時為 empty
     */
    public Optional<Instant> latestTerminatedAt() {
        return terminatedAt.stream().max(Comparator.naturalOrder());
    }

    /** @return 供日誌使用的 {@code namespace/name} */
    public String displayName() {
        return namespace + "/" + name;
    }
}
