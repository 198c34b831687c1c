package io.github.samzhu.podledger.dto;

import java.math.BigDecimal;

/**
 * Pod 的有效資源保留量（基本單位，無單位後綴）。
 *
 * @param cpu CPU cores
 * @param memory 記憶體 bytes
 * @param accelerator 加速器數量
 */
public record ResourceRequest(
    BigDecimal cpu,
    BigDecimal memory,
    BigDecimal accelerator
) {
    public static final ResourceRequest ZERO = new ResourceRequest(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
}
