package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.model.ChainConfig;
import java.math.BigDecimal;

/** Expected price impact, in USD, of swapping {@code amountInUsd} on a chain. */
public interface SlippageEstimator {
  BigDecimal estimateUsd(ChainConfig chain, String tokenIn, String tokenOut, BigDecimal amountInUsd);
}
