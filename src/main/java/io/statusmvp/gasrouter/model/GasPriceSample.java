package io.statusmvp.gasrouter.model;

import java.math.BigInteger;

/** Gas price in wei observed for a chain at {@code observedAt} (epoch seconds). */
public record GasPriceSample(long chainId, BigInteger price, long observedAt) {}
