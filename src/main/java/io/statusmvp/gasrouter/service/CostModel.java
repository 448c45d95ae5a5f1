package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.model.CostBreakdown;
import io.statusmvp.gasrouter.model.GasPriceSample;
import io.statusmvp.gasrouter.model.OptimalChain;
import io.statusmvp.gasrouter.model.OptimizationOutcome;
import io.statusmvp.gasrouter.model.OptimizerSettings;
import io.statusmvp.gasrouter.model.SavingsCriteria;
import io.statusmvp.gasrouter.model.SwapIntent;
import io.statusmvp.gasrouter.util.UsdMath;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-chain total cost in USD and the optimal chain search.
 *
 * <p>Every evaluation first takes a {@link PriceSnapshot} of all chains it may consult and then
 * computes purely from that snapshot, so a concurrent keeper update cannot interleave with one
 * evaluation.
 */
@Service
public class CostModel {
  private static final Logger log = LoggerFactory.getLogger(CostModel.class);

  static final Comparator<CostBreakdown> CHEAPEST_FIRST =
      Comparator.comparing(CostBreakdown::totalCostUsd)
          .thenComparingLong(CostBreakdown::estimatedExecutionTimeSeconds)
          .thenComparingLong(CostBreakdown::chainId);

  private final ChainRegistry chains;
  private final GasPriceOracle oracle;
  private final UsdPriceService usdPrices;
  private final SlippageEstimator slippage;
  private final OptimizerSettingsService settings;

  private final long currentChainId;
  private final int safetyMarginBps;
  private final long defaultSwapGasUnits;

  public CostModel(
      ChainRegistry chains,
      GasPriceOracle oracle,
      UsdPriceService usdPrices,
      SlippageEstimator slippage,
      OptimizerSettingsService settings,
      OptimizerProperties properties) {
    this.chains = chains;
    this.oracle = oracle;
    this.usdPrices = usdPrices;
    this.slippage = slippage;
    this.settings = settings;
    this.currentChainId = properties.getCurrentChainId();
    this.safetyMarginBps = properties.getCost().getSafetyMarginBps();
    this.defaultSwapGasUnits = properties.getCost().getDefaultSwapGasUnits();
  }

  public long currentChainId() {
    return currentChainId;
  }

  public long sourceChainOf(SwapIntent intent) {
    return intent.sourceChainId() == null ? currentChainId : intent.sourceChainId();
  }

  public long gasUnitsOf(SwapIntent intent) {
    Long units = intent.gasUsageUnits();
    return units == null || units <= 0 ? defaultSwapGasUnits : units;
  }

  /** Cost of executing {@code intent} on {@code chainId}. */
  public CostBreakdown totalCost(long chainId, SwapIntent intent) {
    ChainConfig chain = chains.require(chainId);
    BigDecimal amountInUsd = amountInUsd(intent);
    PriceSnapshot snapshot = snapshot(List.of(chain));
    return costFor(chain, sourceChainOf(intent), gasUnitsOf(intent), snapshot.require(chainId),
        intent, amountInUsd, settings.snapshot());
  }

  public OptimalChain findOptimalChain(SwapIntent intent, SavingsCriteria criteria) {
    long source = sourceChainOf(intent);
    ChainConfig sourceChain = chains.require(source);
    OptimizerSettings fees = settings.snapshot();
    long gasUnits = gasUnitsOf(intent);

    List<ChainConfig> considered = new ArrayList<>();
    considered.add(sourceChain);
    for (ChainConfig c : chains.enabled()) {
      if (c.chainId() == source) continue;
      if (criteria.excludes(c.chainId())) continue;
      if (c.estimatedBridgeTimeSeconds() > criteria.maxBridgeTimeSeconds()) {
        log.debug("chain {} skipped: bridge time {}s over limit", c.chainId(), c.estimatedBridgeTimeSeconds());
        continue;
      }
      considered.add(c);
    }

    BigDecimal amountInUsd = amountInUsd(intent);
    PriceSnapshot snapshot = snapshot(considered);

    CostBreakdown baseline =
        costFor(sourceChain, source, gasUnits, snapshot.require(source), intent, amountInUsd, fees);

    List<CostBreakdown> candidates = new ArrayList<>();
    for (ChainConfig c : considered) {
      if (c.chainId() == source) continue;
      ChainPrice price = snapshot.prices.get(c.chainId());
      if (price == null) {
        log.debug("chain {} skipped: {}", c.chainId(), snapshot.failures.get(c.chainId()).getCode());
        continue;
      }
      if (price.gasPriceWei().compareTo(c.maxAcceptableGasPrice()) > 0) {
        log.debug("chain {} skipped: gas price {} above acceptable {}", c.chainId(), price.gasPriceWei(), c.maxAcceptableGasPrice());
        continue;
      }
      candidates.add(costFor(c, source, gasUnits, price, intent, amountInUsd, fees));
    }
    return select(baseline, candidates, criteria);
  }

  /**
   * Picks the cheapest candidate and applies the dual savings bar. Both the basis-point and the
   * absolute threshold must be met.
   */
  public static OptimalChain select(
      CostBreakdown baseline, List<CostBreakdown> candidates, SavingsCriteria criteria) {
    CostBreakdown best = candidates.stream().min(CHEAPEST_FIRST).orElse(null);
    if (best == null || best.totalCostUsd().compareTo(baseline.totalCostUsd()) >= 0) {
      return new OptimalChain(
          baseline.chainId(), BigDecimal.ZERO, baseline, baseline, OptimizationOutcome.NO_CHEAPER_CHAIN);
    }
    BigDecimal savings = baseline.totalCostUsd().subtract(best.totalCostUsd());
    long savingsBps = UsdMath.toBps(savings, baseline.totalCostUsd());
    boolean clears =
        savingsBps >= criteria.minSavingsBps()
            && savings.compareTo(criteria.minAbsoluteSavingsUsd()) >= 0;
    if (!clears) {
      return new OptimalChain(
          baseline.chainId(), BigDecimal.ZERO, baseline, baseline, OptimizationOutcome.BELOW_THRESHOLD);
    }
    return new OptimalChain(
        best.chainId(), UsdMath.usd(savings), baseline, best, OptimizationOutcome.OPTIMIZED);
  }

  CostBreakdown costFor(
      ChainConfig chain,
      long sourceChainId,
      long gasUnits,
      ChainPrice price,
      SwapIntent intent,
      BigDecimal amountInUsd,
      OptimizerSettings fees) {
    boolean local = chain.chainId() == sourceChainId;
    BigDecimal gasCost =
        UsdMath.applyBps(BigDecimal.valueOf(gasUnits), safetyMarginBps).multiply(price.usdPerGasUnit());
    BigDecimal bridgeFee =
        local
            ? BigDecimal.ZERO
            : fees.baseBridgeFeeUsd().add(UsdMath.applyBps(amountInUsd, fees.bridgeFeeBps()));
    BigDecimal slippageCost =
        slippage.estimateUsd(chain, intent.tokenIn(), intent.tokenOut(), amountInUsd);
    return new CostBreakdown(
        chain.chainId(),
        UsdMath.usd(gasCost),
        UsdMath.usd(bridgeFee),
        UsdMath.usd(slippageCost),
        UsdMath.usd(gasCost.add(bridgeFee).add(slippageCost)),
        local ? 0 : chain.estimatedBridgeTimeSeconds());
  }

  BigDecimal amountInUsd(SwapIntent intent) {
    if (intent.amountIn() == null || intent.amountIn().signum() <= 0) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_AMOUNT, "amountIn must be positive");
    }
    return UsdMath.fromUnits(intent.amountIn(), intent.decimalsOrDefault())
        .multiply(usdPrices.usdPrice(intent.tokenIn()));
  }

  /** Reads every chain's gas price and native USD price up front. Unpriceable chains are recorded, not thrown. */
  PriceSnapshot snapshot(List<ChainConfig> configs) {
    Map<Long, ChainPrice> prices = new HashMap<>();
    Map<Long, OptimizerException> failures = new HashMap<>();
    for (ChainConfig c : configs) {
      try {
        GasPriceSample sample = oracle.getFresh(c.chainId());
        BigDecimal nativeUsd = usdPrices.usdPrice(c.nativeSymbol());
        prices.put(
            c.chainId(),
            new ChainPrice(sample.price(), GasPriceOracle.toUsdPerGasUnit(sample.price(), nativeUsd)));
      } catch (OptimizerException e) {
        failures.put(c.chainId(), e);
      }
    }
    return new PriceSnapshot(Map.copyOf(prices), Map.copyOf(failures));
  }

  record ChainPrice(BigInteger gasPriceWei, BigDecimal usdPerGasUnit) {}

  record PriceSnapshot(Map<Long, ChainPrice> prices, Map<Long, OptimizerException> failures) {
    ChainPrice require(long chainId) {
      ChainPrice price = prices.get(chainId);
      if (price != null) return price;
      OptimizerException failure = failures.get(chainId);
      throw failure != null
          ? failure
          : new OptimizerException(OptimizerErrorCode.UNKNOWN_CHAIN, "no price for chain " + chainId);
    }
  }
}
