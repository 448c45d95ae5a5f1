package io.statusmvp.gasrouter.model;

import java.math.BigInteger;

public record DestinationSwapResult(boolean success, BigInteger amountOut, String error) {}
