package com.lpzapper.api.dto;

import com.lpzapper.api.validation.TokenAddress;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record ZapInRequest(
        @TokenAddress String tokenAddress,
        @NotNull(message = "INVALID_AMOUNT") @DecimalMin(value = "0", inclusive = false, message = "INVALID_AMOUNT") BigDecimal amountEth
) {
}
