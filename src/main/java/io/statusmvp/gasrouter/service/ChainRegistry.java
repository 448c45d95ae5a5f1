package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.model.CongestionLevel;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Admin-owned metadata for every supported chain. Entries are replaced atomically and never
 * removed, only disabled.
 */
@Service
public class ChainRegistry {
  private static final Logger log = LoggerFactory.getLogger(ChainRegistry.class);

  private final Map<Long, ChainConfig> chains = new ConcurrentHashMap<>();
  private final AccessControl access;

  public ChainRegistry(OptimizerProperties properties, AccessControl access) {
    this.access = access;
    for (OptimizerProperties.Chain c : properties.getChains()) {
      if (c.getChainId() <= 0) continue;
      chains.put(c.getChainId(), fromProperties(c));
    }
    log.info("chain registry bootstrapped with chains={}", chains.keySet());
  }

  public ChainConfig require(long chainId) {
    ChainConfig config = chains.get(chainId);
    if (config == null) {
      throw new OptimizerException(
          OptimizerErrorCode.UNKNOWN_CHAIN, "unknown chain " + chainId, Map.of("chainId", chainId));
    }
    return config;
  }

  public Optional<ChainConfig> find(long chainId) {
    return Optional.ofNullable(chains.get(chainId));
  }

  public boolean isEnabled(long chainId) {
    ChainConfig config = chains.get(chainId);
    return config != null && config.enabled();
  }

  /** All chains ordered by id. */
  public List<ChainConfig> all() {
    return chains.values().stream().sorted(Comparator.comparingLong(ChainConfig::chainId)).toList();
  }

  public List<ChainConfig> enabled() {
    return all().stream().filter(ChainConfig::enabled).toList();
  }

  public ChainConfig upsert(Caller caller, ChainConfig config) {
    access.requireAdmin(caller);
    validate(config);
    chains.put(config.chainId(), config);
    log.info("chain {} upserted by {} enabled={}", config.chainId(), caller.id(), config.enabled());
    return config;
  }

  public ChainConfig setEnabled(Caller caller, long chainId, boolean enabled) {
    access.requireAdmin(caller);
    ChainConfig updated =
        chains.computeIfPresent(chainId, (id, existing) -> existing.withEnabled(enabled));
    if (updated == null) {
      throw new OptimizerException(
          OptimizerErrorCode.UNKNOWN_CHAIN, "unknown chain " + chainId, Map.of("chainId", chainId));
    }
    log.info("chain {} {} by {}", chainId, enabled ? "enabled" : "disabled", caller.id());
    return updated;
  }

  public CongestionLevel congestion(long chainId, BigInteger gasPrice) {
    ChainConfig config = require(chainId);
    if (gasPrice.compareTo(config.lowGasPrice()) <= 0) return CongestionLevel.LOW;
    if (gasPrice.compareTo(config.mediumGasPrice()) <= 0) return CongestionLevel.MEDIUM;
    if (gasPrice.compareTo(config.highGasPrice()) <= 0) return CongestionLevel.HIGH;
    return CongestionLevel.CRITICAL;
  }

  private static void validate(ChainConfig config) {
    if (config == null || config.chainId() <= 0) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, "chainId must be positive");
    }
    if (config.lowGasPrice() == null
        || config.mediumGasPrice() == null
        || config.highGasPrice() == null
        || config.maxAcceptableGasPrice() == null) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, "gas price thresholds are required");
    }
    if (config.lowGasPrice().compareTo(config.mediumGasPrice()) > 0
        || config.mediumGasPrice().compareTo(config.highGasPrice()) > 0) {
      throw new OptimizerException(
          OptimizerErrorCode.INVALID_ARGUMENT, "congestion thresholds must satisfy low <= medium <= high");
    }
    if (config.finalityTimeSeconds() < 0 || config.bridgeTimeSeconds() < 0) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, "times must not be negative");
    }
  }

  static ChainConfig fromProperties(OptimizerProperties.Chain c) {
    return new ChainConfig(
        c.getChainId(),
        c.getName(),
        c.getNativeSymbol(),
        c.isEnabled(),
        c.getBlockTimeSeconds(),
        c.getFinalityTimeSeconds(),
        c.getBridgeTimeSeconds(),
        BigInteger.valueOf(c.getMaxAcceptableGasPriceWei()),
        BigInteger.valueOf(c.getLowGasPriceWei()),
        BigInteger.valueOf(c.getMediumGasPriceWei()),
        BigInteger.valueOf(c.getHighGasPriceWei()),
        c.getLiquidityDepthUsd() == null ? BigDecimal.ZERO : c.getLiquidityDepthUsd(),
        c.getRpcUrl());
  }
}
