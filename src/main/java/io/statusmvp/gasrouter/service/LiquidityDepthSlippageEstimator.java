package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.util.UsdMath;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Constant-product approximation against the chain's configured liquidity depth:
 * {@code impact = amount * amount / (depth + amount)}, capped at {@code maxSlippageBps} of the
 * amount. Chains without a configured depth are charged the cap.
 */
@Component
public class LiquidityDepthSlippageEstimator implements SlippageEstimator {
  private final int maxSlippageBps;

  public LiquidityDepthSlippageEstimator(OptimizerProperties properties) {
    this.maxSlippageBps = Math.max(0, properties.getCost().getMaxSlippageBps());
  }

  @Override
  public BigDecimal estimateUsd(
      ChainConfig chain, String tokenIn, String tokenOut, BigDecimal amountInUsd) {
    if (amountInUsd == null || amountInUsd.signum() <= 0) return BigDecimal.ZERO;
    BigDecimal cap = UsdMath.applyBps(amountInUsd, maxSlippageBps);
    BigDecimal depth = chain.liquidityDepthUsd();
    if (depth == null || depth.signum() <= 0) return cap;

    BigDecimal impact =
        amountInUsd
            .multiply(amountInUsd)
            .divide(depth.add(amountInUsd), UsdMath.SCALE, RoundingMode.HALF_UP);
    return impact.min(cap);
  }
}
