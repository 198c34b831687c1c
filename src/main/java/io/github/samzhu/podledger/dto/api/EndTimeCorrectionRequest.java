package io.github.samzhu.podledger.dto.api;

import java.time.Instant;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 結束時間修正請求。
 *
 * <p>用於 POST /api/v1/pods/{uid}/end-time-correction 端點。
 */
public record EndTimeCorrectionRequest(
    @NotNull(message = "endTime is required")
    Instant endTime,

    @NotNull(message = "estimated is required")
    Boolean estimated,

    @NotBlank(message = "reason is required")
    String reason
) {}
