package io.statusmvp.gasrouter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.support.TestFixtures;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class LiquidityDepthSlippageEstimatorTest {
  private final OptimizerProperties props = TestFixtures.properties();
  private final LiquidityDepthSlippageEstimator estimator =
      new LiquidityDepthSlippageEstimator(props);

  @Test
  void impactGrowsWithSizeRelativeToDepth() {
    ChainConfig chain = ChainRegistry.fromProperties(props.getChains().get(0));
    // 1000 * 1000 / (1_000_000 + 1000)
    BigDecimal impact = estimator.estimateUsd(chain, "ETH", "USDC", BigDecimal.valueOf(1000));
    assertEquals(0, new BigDecimal("0.999000999000999001").compareTo(impact));
  }

  @Test
  void impactIsCappedAtMaxSlippage() {
    ChainConfig chain = ChainRegistry.fromProperties(props.getChains().get(0));
    BigDecimal impact =
        estimator.estimateUsd(chain, "ETH", "USDC", BigDecimal.valueOf(1_000_000));
    // 3% of 1_000_000
    assertEquals(0, BigDecimal.valueOf(30_000).compareTo(impact));
  }

  @Test
  void chainWithoutDepthIsChargedTheCap() {
    OptimizerProperties.Chain c = props.getChains().get(1);
    c.setLiquidityDepthUsd(BigDecimal.ZERO);
    BigDecimal impact =
        estimator.estimateUsd(
            ChainRegistry.fromProperties(c), "ETH", "USDC", BigDecimal.valueOf(100));
    assertEquals(0, new BigDecimal("3").compareTo(impact));
  }
}
