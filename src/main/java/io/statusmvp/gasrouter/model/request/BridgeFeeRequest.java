package io.statusmvp.gasrouter.model.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record BridgeFeeRequest(@NotNull BigDecimal baseFeeUsd, @NotNull Integer feeBps) {}
