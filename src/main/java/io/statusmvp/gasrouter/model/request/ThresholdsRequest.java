package io.statusmvp.gasrouter.model.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record ThresholdsRequest(
    @NotNull Integer minSavingsBps,
    @NotNull BigDecimal minAbsoluteSavingsUsd,
    @NotNull Long maxBridgeTimeSeconds) {}
