package io.statusmvp.gasrouter.model;

import java.math.BigDecimal;

public record OptimizationQuote(
    long originalChain,
    long optimizedChain,
    BigDecimal savingsUsd,
    BigDecimal savingsPercent,
    long estimatedBridgeTime,
    boolean shouldOptimize,
    String reason,
    CostBreakdown originalCost,
    CostBreakdown optimizedCost) {}
