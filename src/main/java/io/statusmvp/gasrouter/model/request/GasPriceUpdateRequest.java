package io.statusmvp.gasrouter.model.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

public record GasPriceUpdateRequest(@NotNull BigInteger priceWei) {}
