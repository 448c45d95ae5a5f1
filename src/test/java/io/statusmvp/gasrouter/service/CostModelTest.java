package io.statusmvp.gasrouter.service;

import static io.statusmvp.gasrouter.support.TestFixtures.GWEI;
import static io.statusmvp.gasrouter.support.TestFixtures.T0;
import static io.statusmvp.gasrouter.support.TestFixtures.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.CostBreakdown;
import io.statusmvp.gasrouter.model.OptimalChain;
import io.statusmvp.gasrouter.model.OptimizationOutcome;
import io.statusmvp.gasrouter.model.SavingsCriteria;
import io.statusmvp.gasrouter.model.SwapIntent;
import io.statusmvp.gasrouter.support.MutableClock;
import io.statusmvp.gasrouter.support.TestFixtures;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CostModelTest {
  private static final Caller KEEPER = Caller.keeper("keeper");
  private static final Caller ADMIN = Caller.admin("ops");
  private static final SavingsCriteria DEFAULT_CRITERIA =
      new SavingsCriteria(500, BigDecimal.TEN, 1800, Set.of());
  private static final SwapIntent ONE_ETH =
      new SwapIntent(
          USER, "ETH", "USDC", new BigInteger("1000000000000000000"), 18, null, null, null);

  private MutableClock clock;
  private ChainRegistry chains;
  private GasPriceOracle oracle;
  private CostModel costModel;

  @BeforeEach
  void setUp() {
    OptimizerProperties props = TestFixtures.properties();
    clock = new MutableClock(T0);
    AccessControl access = new AccessControl(props);
    chains = new ChainRegistry(props, access);
    UsdPriceService usdPrices = mock(UsdPriceService.class);
    when(usdPrices.usdPrice("ETH")).thenReturn(BigDecimal.valueOf(2000));
    SlippageEstimator slippage = mock(SlippageEstimator.class);
    when(slippage.estimateUsd(any(), any(), any(), any())).thenReturn(BigDecimal.ZERO);
    oracle = new GasPriceOracle(chains, usdPrices, access, TestFixtures.metrics(), clock, props);
    costModel =
        new CostModel(
            chains, oracle, usdPrices, slippage, new OptimizerSettingsService(props, access), props);

    oracle.update(KEEPER, 1, BigInteger.valueOf(50 * GWEI));
    oracle.update(KEEPER, 10, BigInteger.valueOf(1_000_000));
    oracle.update(KEEPER, 8453, BigInteger.valueOf(1_000_000));
  }

  @Test
  void localChainCostHasNoBridgeFeeOrDelay() {
    CostBreakdown cost = costModel.totalCost(1, ONE_ETH);
    // 150000 gas * 1.2 * 50 gwei * $2000
    assertEquals(0, new BigDecimal("18").compareTo(cost.gasCostUsd()));
    assertEquals(0, BigDecimal.ZERO.compareTo(cost.bridgeFeeUsd()));
    assertEquals(0, new BigDecimal("18").compareTo(cost.totalCostUsd()));
    assertEquals(0, cost.estimatedExecutionTimeSeconds());
  }

  @Test
  void remoteChainCostAddsBridgeFeeAndBridgeTime() {
    CostBreakdown cost = costModel.totalCost(10, ONE_ETH);
    assertEquals(0, new BigDecimal("0.00036").compareTo(cost.gasCostUsd()));
    // $2 base + 5 bps of $2000
    assertEquals(0, new BigDecimal("3").compareTo(cost.bridgeFeeUsd()));
    assertEquals(0, new BigDecimal("3.00036").compareTo(cost.totalCostUsd()));
    assertEquals(180, cost.estimatedExecutionTimeSeconds());
  }

  @Test
  void findOptimalChainNeverReturnsDisabledChain() {
    OptimalChain result = costModel.findOptimalChain(ONE_ETH, DEFAULT_CRITERIA);
    assertTrue(result.optimized());
    assertEquals(10, result.chainId());
    assertEquals(0, new BigDecimal("14.99964").compareTo(result.expectedSavingsUsd()));
  }

  @Test
  void enabledChainWithSameCostWinsOnShorterBridgeTime() {
    chains.setEnabled(ADMIN, 8453, true);
    OptimalChain result = costModel.findOptimalChain(ONE_ETH, DEFAULT_CRITERIA);
    assertEquals(8453, result.chainId());
  }

  @Test
  void excludedAndSlowChainsAreNotCandidates() {
    OptimalChain excluded =
        costModel.findOptimalChain(
            ONE_ETH, new SavingsCriteria(500, BigDecimal.TEN, 1800, Set.of(10L)));
    assertEquals(1, excluded.chainId());
    assertEquals(OptimizationOutcome.NO_CHEAPER_CHAIN, excluded.outcome());

    OptimalChain tooSlow =
        costModel.findOptimalChain(ONE_ETH, new SavingsCriteria(500, BigDecimal.TEN, 100, Set.of()));
    assertEquals(1, tooSlow.chainId());
    assertEquals(0, BigDecimal.ZERO.compareTo(tooSlow.expectedSavingsUsd()));
  }

  @Test
  void staleCandidateIsSkipped() {
    clock.set(T0 + 500);
    oracle.update(KEEPER, 1, BigInteger.valueOf(50 * GWEI));
    clock.set(T0 + 700);

    OptimalChain result = costModel.findOptimalChain(ONE_ETH, DEFAULT_CRITERIA);
    assertFalse(result.optimized());
    assertEquals(1, result.chainId());
  }

  @Test
  void staleBaselineFailsWithStalePrice() {
    clock.set(T0 + 601);
    OptimizerException e =
        assertThrows(
            OptimizerException.class, () -> costModel.findOptimalChain(ONE_ETH, DEFAULT_CRITERIA));
    assertEquals(OptimizerErrorCode.STALE_PRICE, e.getCode());
  }

  @Test
  void candidateAboveMaxAcceptableGasPriceIsSkipped() {
    oracle.update(KEEPER, 10, BigInteger.valueOf(20 * GWEI));
    OptimalChain result = costModel.findOptimalChain(ONE_ETH, DEFAULT_CRITERIA);
    assertEquals(1, result.chainId());
  }

  @Test
  void selectOptimizesWhenBothThresholdsAreMet() {
    OptimalChain result =
        CostModel.select(cost(1, "50.00", 0), List.of(cost(10, "2.00", 180)), DEFAULT_CRITERIA);
    assertTrue(result.optimized());
    assertEquals(10, result.chainId());
    assertEquals(0, new BigDecimal("48").compareTo(result.expectedSavingsUsd()));
  }

  @Test
  void selectKeepsBaselineWhenAbsoluteSavingsTooSmall() {
    OptimalChain result =
        CostModel.select(cost(1, "50.00", 0), List.of(cost(10, "46.00", 180)), DEFAULT_CRITERIA);
    assertFalse(result.optimized());
    assertEquals(OptimizationOutcome.BELOW_THRESHOLD, result.outcome());
    assertEquals(1, result.chainId());
    assertEquals(0, BigDecimal.ZERO.compareTo(result.expectedSavingsUsd()));
  }

  @Test
  void selectKeepsBaselineWhenPercentageTooSmall() {
    OptimalChain result =
        CostModel.select(
            cost(1, "1000.00", 0), List.of(cost(10, "980.00", 180)), DEFAULT_CRITERIA);
    assertEquals(OptimizationOutcome.BELOW_THRESHOLD, result.outcome());
  }

  @Test
  void selectBreaksTiesByTimeThenChainId() {
    OptimalChain byTime =
        CostModel.select(
            cost(1, "50", 0),
            List.of(cost(10, "2", 300), cost(42161, "2", 120)),
            DEFAULT_CRITERIA);
    assertEquals(42161, byTime.chainId());

    OptimalChain byId =
        CostModel.select(
            cost(1, "50", 0),
            List.of(cost(42161, "2", 120), cost(10, "2", 120)),
            DEFAULT_CRITERIA);
    assertEquals(10, byId.chainId());
  }

  @Test
  void selectWithoutCheaperCandidateReturnsBaseline() {
    OptimalChain result =
        CostModel.select(cost(1, "5", 0), List.of(cost(10, "7", 180)), DEFAULT_CRITERIA);
    assertEquals(OptimizationOutcome.NO_CHEAPER_CHAIN, result.outcome());
    assertEquals(1, result.chainId());
  }

  private static CostBreakdown cost(long chainId, String total, long seconds) {
    BigDecimal t = new BigDecimal(total);
    return new CostBreakdown(chainId, t, BigDecimal.ZERO, BigDecimal.ZERO, t, seconds);
  }
}
