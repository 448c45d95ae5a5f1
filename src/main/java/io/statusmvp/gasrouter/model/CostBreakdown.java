package io.statusmvp.gasrouter.model;

import java.math.BigDecimal;

public record CostBreakdown(
    long chainId,
    BigDecimal gasCostUsd,
    BigDecimal bridgeFeeUsd,
    BigDecimal slippageCostUsd,
    BigDecimal totalCostUsd,
    long estimatedExecutionTimeSeconds) {}
