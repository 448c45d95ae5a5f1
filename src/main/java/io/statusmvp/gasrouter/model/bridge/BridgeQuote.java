package io.statusmvp.gasrouter.model.bridge;

import java.math.BigDecimal;

public record BridgeQuote(BigDecimal feeUsd, long estimatedTimeSeconds) {}
