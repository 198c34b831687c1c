package io.github.samzhu.podledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

/**
 * Kubernetes 用戶端配置。
 *
 * <p>使用 fabric8 自動偵測設定：叢集內以 service account 連線，叢集外讀取 {@code ~/.kube/config}。
 * 用戶端在 Spring context 關閉時釋放。
 */
@Configuration
public class KubernetesConfig {

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        return new KubernetesClientBuilder().build();
    }
}
