package io.statusmvp.gasrouter.model;

import java.math.BigInteger;

public record GasPriceTrend(
    long chainId,
    int sampleCount,
    BigInteger average,
    BigInteger min,
    BigInteger max,
    long volatilityBps,
    boolean increasing) {}
