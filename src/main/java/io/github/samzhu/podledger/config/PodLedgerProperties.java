package io.github.samzhu.podledger.config;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pod Ledger 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link StreamConfig} - Pod 事件串流設定，控制每次訂閱的逾時與重試</li>
 *   <li>{@link NamespaceConfig} - 不列入計費的系統命名空間</li>
 *   <li>{@link PhaseConfig} - 計費狀態機使用的 Pod phase 分類</li>
 *   <li>{@link ResourceConfig} - 加速器資源名稱</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * podledger:
 *   stream:
 *     timeout: 30s
 *     retry-delay: 1s
 *     reconcile-on-reset: false
 *   namespaces:
 *     ignored: [kube-system, default]
 *     ignored-prefixes: [openshift-, kube-]
 *   phases:
 *     active: [Pending, Running]
 *     terminal: [Succeeded, Failed]
 *   resources:
 *     accelerator-name: nvidia.com/gpu
 * </pre>
 *
 * <p>所有值在程序生命週期內固定不變。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "podledger")
public record PodLedgerProperties(
    StreamConfig stream,
    NamespaceConfig namespaces,
    PhaseConfig phases,
    ResourceConfig resources
) {
    public PodLedgerProperties {
        if (stream == null) {
            stream = StreamConfig.defaults();
        }
        if (namespaces == null) {
            namespaces = NamespaceConfig.defaults();
        }
        if (phases == null) {
            phases = PhaseConfig.defaults();
        }
        if (resources == null) {
            resources = ResourceConfig.defaults();
        }
    }

    /**
     * 建立全部使用預設值的設定。
     */
    public static PodLedgerProperties defaults() {
        return new PodLedgerProperties(null, null, null, null);
    }

    /**
     * Pod 事件串流設定。
     *
     * <p>每次訂閱最多等待 {@code timeout}，之後重新建立訂閱；
     * 這也是偵測串流無聲停滯的機制。
     *
     * @param timeout 單次訂閱的等待上限，預設 30 秒
     * @param retryDelay 傳輸錯誤後重新訂閱前的等待時間，預設 1 秒
     * @param reconcileOnReset resourceVersion 失效時是否重新執行對帳，預設 false
     */
    public record StreamConfig(
        Duration timeout,
        Duration retryDelay,
        boolean reconcileOnReset
    ) {
        public StreamConfig {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofSeconds(30);
            }
            if (retryDelay == null || retryDelay.isNegative()) {
                retryDelay = Duration.ofSeconds(1);
            }
        }

        public static StreamConfig defaults() {
            return new StreamConfig(Duration.ofSeconds(30), Duration.ofSeconds(1), false);
        }
    }

    /**
     * 不列入計費的命名空間。
     *
     * @param ignored 完全比對的命名空間名稱
     * @param ignoredPrefixes 命名空間前綴
     */
    public record NamespaceConfig(
        Set<String> ignored,
        List<String> ignoredPrefixes
    ) {
        public NamespaceConfig {
            if (ignored == null) {
                ignored = Set.of(
                    "openshift",
                    "kube-system",
                    "kube-public",
                    "kube-node-lease",
                    "default",
                    "istio-system",
                    "openshift-marketplace",
                    "nvidia-gpu-operator",
                    "open-cluster-management-agent-addon",
                    "open-cluster-management-agent");
            }
            if (ignoredPrefixes == null) {
                ignoredPrefixes = List.of("openshift-", "kube-");
            }
            ignored = Set.copyOf(ignored);
            ignoredPrefixes = List.copyOf(ignoredPrefixes);
        }

        public static NamespaceConfig defaults() {
            return new NamespaceConfig(null, null);
        }
    }

    /**
     * Pod phase 分類。
     *
     * <p>{@code active} 包含 Pending：init 容器執行期間資源已被保留。
     *
     * @param active 開始計費的 phase
     * @param terminal 結束計費的 phase
     */
    public record PhaseConfig(
        Set<String> active,
        Set<String> terminal
    ) {
        public PhaseConfig {
            if (active == null || active.isEmpty()) {
                active = Set.of("Pending", "Running");
            }
            if (terminal == null || terminal.isEmpty()) {
                terminal = Set.of("Succeeded", "Failed");
            }
            active = Set.copyOf(active);
            terminal = Set.copyOf(terminal);
        }

        public static PhaseConfig defaults() {
            return new PhaseConfig(null, null);
        }
    }

    /**
     * @param acceleratorName 加速器的 extended resource 名稱，預設 {@code nvidia.com/gpu}
     */
    public record ResourceConfig(
        String acceleratorName
    ) {
        public ResourceConfig {
            if (acceleratorName == null || acceleratorName.isBlank()) {
                acceleratorName = "nvidia.com/gpu";
            }
        }

        public static ResourceConfig defaults() {
            return new ResourceConfig(null);
        }
    }
}
