package io.statusmvp.gasrouter.model;

import java.math.BigInteger;

public record GasPriceView(
    long chainId,
    BigInteger priceWei,
    long observedAt,
    long ageSeconds,
    boolean stale,
    CongestionLevel congestion) {}
