package io.statusmvp.gasrouter.model;

import java.math.BigDecimal;

public record UsdPrice(String assetId, BigDecimal price, long updatedAt, String source) {}
