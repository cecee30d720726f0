package com.lpzapper.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Share of the position's LP tokens to remove, 1 to 100.
 */
public record ZapOutRequest(
        @NotNull(message = "INVALID_PERCENT") @Min(value = 1, message = "INVALID_PERCENT") @Max(value = 100, message = "INVALID_PERCENT") Integer percent
) {
}
