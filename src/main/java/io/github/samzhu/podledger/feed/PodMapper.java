package io.github.samzhu.podledger.feed;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Component;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.fabric8.kubernetes.api.model.Quantity;
import io.github.samzhu.podledger.config.PodLedgerProperties;
import io.github.samzhu.podledger.dto.ContainerRequests;
import io.github.samzhu.podledger.dto.WorkloadInstance;

/**
 * 將 fabric8 {@link Pod} 轉換為 {@link WorkloadInstance}。
 *
 * <p>缺少的 spec / status 欄位轉為 null 或空清單，不拋出例外。
 * 資源請求保留原始 quantity 字串，由 {@link io.github.samzhu.podledger.service.ResourceRequestCalculator} 解析。
 */
@Component
public class PodMapper {

    private final String acceleratorName;

    public PodMapper(PodLedgerProperties properties) {
        this.acceleratorName = properties.resources().acceleratorName();
    }

    public WorkloadInstance toInstance(Pod pod) {
        ObjectMeta metadata = Objects.requireNonNull(pod.getMetadata(), "pod metadata");
        PodSpec spec = pod.getSpec();
        PodStatus status = pod.getStatus();

        return new WorkloadInstance(
            metadata.getUid(),
            metadata.getNamespace(),
            metadata.getName(),
            spec != null ? spec.getNodeName() : null,
            status != null ? status.getPhase() : null,
            status != null ? parseTimestamp(status.getStartTime()) : null,
            spec != null ? requests(spec.getInitContainers()) : List.of(),
            spec != null ? requests(spec.getContainers()) : List.of(),
            status != null ? terminatedAt(status) : List.of()
        );
    }

    private List<ContainerRequests> requests(List<Container> containers) {
        if (containers == null) {
            return List.of();
        }
        return containers.stream()
            .map(this::requests)
            .toList();
    }

    private ContainerRequests requests(Container container) {
        if (container.getResources() == null || container.getResources().getRequests() == null) {
            return ContainerRequests.none();
        }
        Map<String, Quantity> requests = container.getResources().getRequests();
        return new ContainerRequests(
            quantity(requests.get("cpu")),
            quantity(requests.get("memory")),
            quantity(requests.get(acceleratorName)));
    }

    private static String quantity(Quantity quantity) {
        if (quantity == null || quantity.getAmount() == null) {
            return null;
        }
        String format = quantity.getFormat();
        return format == null ? quantity.getAmount() : quantity.getAmount() + format;
    }

    private static List<Instant> terminatedAt(PodStatus status) {
        List<Instant> finished = new ArrayList<>();
        collectTerminated(status.getContainerStatuses(), finished);
        collectTerminated(status.getInitContainerStatuses(), finished);
        return finished;
    }

    private static void collectTerminated(List<ContainerStatus> statuses, List<Instant> finished) {
        if (statuses == null) {
            return;
        }
        for (ContainerStatus cs : statuses) {
            if (cs.getState() != null
                    && cs.getState().getTerminated() != null
                    && cs.getState().getTerminated().getFinishedAt() != null) {
                finished.add(parseTimestamp(cs.getState().getTerminated().getFinishedAt()));
            }
        }
    }

    static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(timestamp).toInstant();
    }
}
