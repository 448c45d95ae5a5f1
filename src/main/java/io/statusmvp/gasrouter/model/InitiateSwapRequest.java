package io.statusmvp.gasrouter.model;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.math.BigInteger;

public record InitiateSwapRequest(
    String user,
    String tokenIn,
    String tokenOut,
    @NotNull BigInteger amountIn,
    Long sourceChainId,
    @NotNull Long destinationChainId,
    @NotNull Long deadline,
    BigDecimal expectedSavingsUsd) {}
