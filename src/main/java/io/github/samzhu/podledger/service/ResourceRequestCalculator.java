package io.github.samzhu.podledger.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

import org.springframework.stereotype.Service;

import io.github.samzhu.podledger.dto.ContainerRequests;
import io.github.samzhu.podledger.dto.ResourceRequest;
import io.github.samzhu.podledger.dto.WorkloadInstance;
import io.github.samzhu.podledger.util.ResourceQuantities;

/**
 * 計算 Pod 的有效資源保留量，與 Kubernetes scheduler 的規則一致。
 *
 * <p>計算方式（每項資源各自計算）：
 * <pre>
 * init 峰值 = max(每個 init 容器的請求)     // init 容器依序執行
 * 主容器總和 = sum(每個主容器的請求)        // 主容器同時執行
 * 有效保留量 = max(init 峰值, 主容器總和)
 * </pre>
 *
 * <p>未設定的請求視為 0。無狀態、無 I/O。
 *
 * @see <a href="https://kubernetes.io/docs/concepts/workloads/pods/init-containers/#resource-sharing-within-containers">Resource sharing within containers</a>
 */
@Service
public class ResourceRequestCalculator {

    /**
     * 計算有效資源保留量。
     *
     * @param instance Pod 快照
     * @return cpu (cores)、memory (bytes)、accelerator (個數)
     * @throws io.github.samzhu.podledger.exception.ResourceQuantityParseException 任一請求無法解析
     */
    public ResourceRequest calculate(WorkloadInstance instance) {
        if (instance.initContainers().isEmpty() && instance.containers().isEmpty()) {
            return ResourceRequest.ZERO;
        }
        return new ResourceRequest(
            effective(instance, ContainerRequests::cpu),
            effective(instance, ContainerRequests::memory),
            effective(instance, ContainerRequests::accelerator)
        );
    }

    private BigDecimal effective(WorkloadInstance instance, Function<ContainerRequests, String> resource) {
        BigDecimal initPeak = parseAll(instance.initContainers(), resource).stream()
            .reduce(BigDecimal.ZERO, BigDecimal::max);
        BigDecimal mainSum = parseAll(instance.containers(), resource).stream()
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return initPeak.max(mainSum);
    }

    private List<BigDecimal> parseAll(List<ContainerRequests> containers, Function<ContainerRequests, String> resource) {
        return containers.stream()
            .map(resource)
            .map(ResourceQuantities::parse)
            .toList();
    }
}
