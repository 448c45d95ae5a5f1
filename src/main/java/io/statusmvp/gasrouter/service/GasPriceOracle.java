package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.model.GasPriceSample;
import io.statusmvp.gasrouter.model.GasPriceTrend;
import io.statusmvp.gasrouter.model.GasPriceView;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Latest gas price per chain plus a bounded history. Writes are serialized per chain through
 * {@link ConcurrentHashMap#compute}; reads see a complete immutable {@link GasPriceHistory}.
 */
@Service
public class GasPriceOracle {
  private static final Logger log = LoggerFactory.getLogger(GasPriceOracle.class);
  private static final BigDecimal WEI_PER_NATIVE = BigDecimal.TEN.pow(18);

  private final Map<Long, GasPriceHistory> histories = new ConcurrentHashMap<>();
  private final ChainRegistry chains;
  private final UsdPriceService usdPrices;
  private final AccessControl access;
  private final OptimizerMetrics metrics;
  private final Clock clock;

  private final long stalenessThresholdSeconds;
  private final int historyCapacity;
  private final BigInteger minGasPrice;
  private final BigInteger maxGasPrice;

  public GasPriceOracle(
      ChainRegistry chains,
      UsdPriceService usdPrices,
      AccessControl access,
      OptimizerMetrics metrics,
      Clock clock,
      OptimizerProperties properties) {
    this.chains = chains;
    this.usdPrices = usdPrices;
    this.access = access;
    this.metrics = metrics;
    this.clock = clock;
    OptimizerProperties.Oracle o = properties.getOracle();
    this.stalenessThresholdSeconds = o.getStalenessThresholdSeconds();
    this.historyCapacity = Math.max(1, o.getHistoryCapacity());
    this.minGasPrice = BigInteger.valueOf(o.getMinGasPriceWei());
    this.maxGasPrice = BigInteger.valueOf(o.getMaxGasPriceWei());
  }

  public GasPriceSample update(Caller caller, long chainId, BigInteger price) {
    access.requireKeeper(caller);
    chains.require(chainId);
    if (price == null || price.compareTo(minGasPrice) < 0 || price.compareTo(maxGasPrice) > 0) {
      throw new OptimizerException(
          OptimizerErrorCode.GAS_PRICE_OUT_OF_BOUNDS,
          "gas price outside [" + minGasPrice + ", " + maxGasPrice + "]",
          Map.of("chainId", chainId, "price", String.valueOf(price)));
    }
    long now = clock.instant().getEpochSecond();
    GasPriceHistory updated =
        histories.compute(
            chainId,
            (id, existing) -> {
              GasPriceHistory h = existing == null ? GasPriceHistory.empty(historyCapacity) : existing;
              GasPriceSample previous = h.latest();
              long observedAt = previous == null ? now : Math.max(now, previous.observedAt());
              return h.append(new GasPriceSample(id, price, observedAt));
            });
    metrics.gasPriceUpdated(chainId);
    if (log.isDebugEnabled()) {
      log.debug("gas price updated chainId={} price={} samples={}", chainId, price, updated.size());
    }
    return updated.latest();
  }

  public GasPriceSample get(long chainId) {
    chains.require(chainId);
    GasPriceHistory h = histories.get(chainId);
    GasPriceSample latest = h == null ? null : h.latest();
    if (latest == null) {
      throw new OptimizerException(
          OptimizerErrorCode.UNKNOWN_CHAIN,
          "no gas price observed for chain " + chainId,
          Map.of("chainId", chainId));
    }
    return latest;
  }

  /** Latest sample, rejected with {@code STALE_PRICE} when older than the staleness threshold. */
  public GasPriceSample getFresh(long chainId) {
    GasPriceSample sample = get(chainId);
    long age = clock.instant().getEpochSecond() - sample.observedAt();
    if (age > stalenessThresholdSeconds) {
      metrics.stalePrice(chainId);
      throw new OptimizerException(
          OptimizerErrorCode.STALE_PRICE,
          "gas price for chain " + chainId + " is stale",
          Map.of("chainId", chainId, "ageSeconds", age));
    }
    return sample;
  }

  /** USD cost of one gas unit on {@code chainId}. */
  public BigDecimal getUsd(long chainId) {
    GasPriceSample sample = getFresh(chainId);
    ChainConfig config = chains.require(chainId);
    BigDecimal nativeUsd = usdPrices.usdPrice(config.nativeSymbol());
    return toUsdPerGasUnit(sample.price(), nativeUsd);
  }

  public GasPriceView view(long chainId) {
    GasPriceSample sample = get(chainId);
    long age = Math.max(0, clock.instant().getEpochSecond() - sample.observedAt());
    return new GasPriceView(
        chainId,
        sample.price(),
        sample.observedAt(),
        age,
        age > stalenessThresholdSeconds,
        chains.congestion(chainId, sample.price()));
  }

  public GasPriceTrend trend(long chainId, int windowSize) {
    if (windowSize <= 0) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, "windowSize must be positive");
    }
    get(chainId);
    List<GasPriceSample> window = histories.get(chainId).lastN(windowSize);
    return computeTrend(chainId, window);
  }

  static GasPriceTrend computeTrend(long chainId, List<GasPriceSample> window) {
    int n = window.size();
    BigInteger sum = BigInteger.ZERO;
    BigInteger min = null;
    BigInteger max = null;
    for (GasPriceSample s : window) {
      BigInteger p = s.price();
      sum = sum.add(p);
      min = min == null || p.compareTo(min) < 0 ? p : min;
      max = max == null || p.compareTo(max) > 0 ? p : max;
    }
    BigInteger avg = sum.divide(BigInteger.valueOf(n));
    long volatilityBps =
        avg.signum() == 0
            ? 0
            : max.subtract(min).multiply(BigInteger.valueOf(10_000)).divide(avg).longValue();

    boolean increasing = false;
    if (n >= 2) {
      int olderCount = n / 2;
      BigInteger older = BigInteger.ZERO;
      BigInteger newer = BigInteger.ZERO;
      for (int i = 0; i < n; i++) {
        if (i < olderCount) older = older.add(window.get(i).price());
        else newer = newer.add(window.get(i).price());
      }
      // Compare means without rounding: newer/newerCount > older/olderCount.
      int newerCount = n - olderCount;
      increasing =
          newer.multiply(BigInteger.valueOf(olderCount))
                  .compareTo(older.multiply(BigInteger.valueOf(newerCount)))
              > 0;
    }
    return new GasPriceTrend(chainId, n, avg, min, max, volatilityBps, increasing);
  }

  static BigDecimal toUsdPerGasUnit(BigInteger gasPriceWei, BigDecimal nativeUsd) {
    return new BigDecimal(gasPriceWei)
        .multiply(nativeUsd)
        .divide(WEI_PER_NATIVE, 30, RoundingMode.HALF_UP);
  }
}
