package io.github.samzhu.podledger.dto;

/**
 * 單一容器的資源請求，保留原始 quantity 字串（如 {@code "500m"}、{@code "1Gi"}）。
 *
 * @param cpu CPU 請求，null 表示未設定
 * @param memory 記憶體請求，null 表示未設定
 * @param accelerator 加速器 (GPU) 請求，null 表示未設定
 */
public record ContainerRequests(
    String cpu,
    String memory,
    String accelerator
) {
    /**
     * 無任何資源請求的容器。
     */
    public static ContainerRequests none() {
        return new ContainerRequests(null, null, null);
    }
}
