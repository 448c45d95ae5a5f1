package io.statusmvp.gasrouter.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.optimizer")
public class OptimizerProperties {
  private long currentChainId = 1;

  private Oracle oracle = new Oracle();
  private Feed feed = new Feed();
  private Cost cost = new Cost();
  private Thresholds thresholds = new Thresholds();
  private BridgeFee bridgeFee = new BridgeFee();
  private Orchestration orchestration = new Orchestration();
  private Access access = new Access();
  private List<Chain> chains = new ArrayList<>();

  public long getCurrentChainId() {
    return currentChainId;
  }

  public void setCurrentChainId(long currentChainId) {
    this.currentChainId = currentChainId;
  }

  public Oracle getOracle() {
    return oracle;
  }

  public void setOracle(Oracle oracle) {
    this.oracle = oracle;
  }

  public Feed getFeed() {
    return feed;
  }

  public void setFeed(Feed feed) {
    this.feed = feed;
  }

  public Cost getCost() {
    return cost;
  }

  public void setCost(Cost cost) {
    this.cost = cost;
  }

  public Thresholds getThresholds() {
    return thresholds;
  }

  public void setThresholds(Thresholds thresholds) {
    this.thresholds = thresholds;
  }

  public BridgeFee getBridgeFee() {
    return bridgeFee;
  }

  public void setBridgeFee(BridgeFee bridgeFee) {
    this.bridgeFee = bridgeFee;
  }

  public Orchestration getOrchestration() {
    return orchestration;
  }

  public void setOrchestration(Orchestration orchestration) {
    this.orchestration = orchestration;
  }

  public Access getAccess() {
    return access;
  }

  public void setAccess(Access access) {
    this.access = access;
  }

  public List<Chain> getChains() {
    return chains;
  }

  public void setChains(List<Chain> chains) {
    this.chains = chains == null ? new ArrayList<>() : chains;
  }

  public static List<String> splitCsv(String csv) {
    if (csv == null || csv.isBlank()) return List.of();
    return Arrays.stream(csv.split(","))
        .map(String::trim)
        .filter(v -> !v.isEmpty())
        .collect(Collectors.toList());
  }

  public static class Oracle {
    private long stalenessThresholdSeconds = 600;
    private int historyCapacity = 24;
    private long minGasPriceWei = 1L;
    // 10,000 gwei
    private long maxGasPriceWei = 10_000_000_000_000L;

    public long getStalenessThresholdSeconds() {
      return stalenessThresholdSeconds;
    }

    public void setStalenessThresholdSeconds(long stalenessThresholdSeconds) {
      this.stalenessThresholdSeconds = stalenessThresholdSeconds;
    }

    public int getHistoryCapacity() {
      return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
      this.historyCapacity = historyCapacity;
    }

    public long getMinGasPriceWei() {
      return minGasPriceWei;
    }

    public void setMinGasPriceWei(long minGasPriceWei) {
      this.minGasPriceWei = minGasPriceWei;
    }

    public long getMaxGasPriceWei() {
      return maxGasPriceWei;
    }

    public void setMaxGasPriceWei(long maxGasPriceWei) {
      this.maxGasPriceWei = maxGasPriceWei;
    }
  }

  public static class Feed {
    private long maxAgeSeconds = 3600;
    private long cacheTtlSeconds = 30;

    public long getMaxAgeSeconds() {
      return maxAgeSeconds;
    }

    public void setMaxAgeSeconds(long maxAgeSeconds) {
      this.maxAgeSeconds = maxAgeSeconds;
    }

    public long getCacheTtlSeconds() {
      return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
      this.cacheTtlSeconds = cacheTtlSeconds;
    }
  }

  public static class Cost {
    private int safetyMarginBps = 12_000;
    private long defaultSwapGasUnits = 150_000;
    private int maxSlippageBps = 300;

    public int getSafetyMarginBps() {
      return safetyMarginBps;
    }

    public void setSafetyMarginBps(int safetyMarginBps) {
      this.safetyMarginBps = safetyMarginBps;
    }

    public long getDefaultSwapGasUnits() {
      return defaultSwapGasUnits;
    }

    public void setDefaultSwapGasUnits(long defaultSwapGasUnits) {
      this.defaultSwapGasUnits = defaultSwapGasUnits;
    }

    public int getMaxSlippageBps() {
      return maxSlippageBps;
    }

    public void setMaxSlippageBps(int maxSlippageBps) {
      this.maxSlippageBps = maxSlippageBps;
    }
  }

  public static class Thresholds {
    private int minSavingsBps = 500;
    private BigDecimal minAbsoluteSavingsUsd = BigDecimal.TEN;
    private long maxBridgeTimeSeconds = 1800;

    public int getMinSavingsBps() {
      return minSavingsBps;
    }

    public void setMinSavingsBps(int minSavingsBps) {
      this.minSavingsBps = minSavingsBps;
    }

    public BigDecimal getMinAbsoluteSavingsUsd() {
      return minAbsoluteSavingsUsd;
    }

    public void setMinAbsoluteSavingsUsd(BigDecimal minAbsoluteSavingsUsd) {
      this.minAbsoluteSavingsUsd = minAbsoluteSavingsUsd;
    }

    public long getMaxBridgeTimeSeconds() {
      return maxBridgeTimeSeconds;
    }

    public void setMaxBridgeTimeSeconds(long maxBridgeTimeSeconds) {
      this.maxBridgeTimeSeconds = maxBridgeTimeSeconds;
    }
  }

  public static class BridgeFee {
    private BigDecimal baseFeeUsd = new BigDecimal("2.00");
    private int feeBps = 5;

    public BigDecimal getBaseFeeUsd() {
      return baseFeeUsd;
    }

    public void setBaseFeeUsd(BigDecimal baseFeeUsd) {
      this.baseFeeUsd = baseFeeUsd;
    }

    public int getFeeBps() {
      return feeBps;
    }

    public void setFeeBps(int feeBps) {
      this.feeBps = feeBps;
    }
  }

  public static class Orchestration {
    private long userRecoveryTimeoutSeconds = 3600;
    private long defaultDeadlineSeconds = 1200;
    private String escrowAddress = "";

    public long getUserRecoveryTimeoutSeconds() {
      return userRecoveryTimeoutSeconds;
    }

    public void setUserRecoveryTimeoutSeconds(long userRecoveryTimeoutSeconds) {
      this.userRecoveryTimeoutSeconds = userRecoveryTimeoutSeconds;
    }

    public long getDefaultDeadlineSeconds() {
      return defaultDeadlineSeconds;
    }

    public void setDefaultDeadlineSeconds(long defaultDeadlineSeconds) {
      this.defaultDeadlineSeconds = defaultDeadlineSeconds;
    }

    public String getEscrowAddress() {
      return escrowAddress;
    }

    public void setEscrowAddress(String escrowAddress) {
      this.escrowAddress = escrowAddress;
    }
  }

  public static class Access {
    private String keeperId = "keeper";
    private String bridgeRelayerIds = "bridge-relayer";
    private String jwtIssuer = "gas-router-backend";
    private String jwtAudience = "gas-router";
    private String jwtSecret = "replace-me-dev-secret-at-least-32-bytes";

    public String getKeeperId() {
      return keeperId;
    }

    public void setKeeperId(String keeperId) {
      this.keeperId = keeperId;
    }

    public String getBridgeRelayerIds() {
      return bridgeRelayerIds;
    }

    public void setBridgeRelayerIds(String bridgeRelayerIds) {
      this.bridgeRelayerIds = bridgeRelayerIds;
    }

    public List<String> bridgeRelayerIdList() {
      return splitCsv(bridgeRelayerIds);
    }

    public String getJwtIssuer() {
      return jwtIssuer;
    }

    public void setJwtIssuer(String jwtIssuer) {
      this.jwtIssuer = jwtIssuer;
    }

    public String getJwtAudience() {
      return jwtAudience;
    }

    public void setJwtAudience(String jwtAudience) {
      this.jwtAudience = jwtAudience;
    }

    public String getJwtSecret() {
      return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
      this.jwtSecret = jwtSecret;
    }
  }

  /** Bootstrap entry for {@code ChainRegistry}; values in wei unless noted. */
  public static class Chain {
    private long chainId;
    private String name = "";
    private String nativeSymbol = "ETH";
    private boolean enabled = true;
    private double blockTimeSeconds = 12;
    private long finalityTimeSeconds = 900;
    private long bridgeTimeSeconds = 0;
    private long maxAcceptableGasPriceWei = 500_000_000_000L;
    private long lowGasPriceWei = 10_000_000_000L;
    private long mediumGasPriceWei = 30_000_000_000L;
    private long highGasPriceWei = 100_000_000_000L;
    private BigDecimal liquidityDepthUsd = BigDecimal.ZERO;
    private String rpcUrl = "";

    public long getChainId() {
      return chainId;
    }

    public void setChainId(long chainId) {
      this.chainId = chainId;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getNativeSymbol() {
      return nativeSymbol;
    }

    public void setNativeSymbol(String nativeSymbol) {
      this.nativeSymbol = nativeSymbol;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public double getBlockTimeSeconds() {
      return blockTimeSeconds;
    }

    public void setBlockTimeSeconds(double blockTimeSeconds) {
      this.blockTimeSeconds = blockTimeSeconds;
    }

    public long getFinalityTimeSeconds() {
      return finalityTimeSeconds;
    }

    public void setFinalityTimeSeconds(long finalityTimeSeconds) {
      this.finalityTimeSeconds = finalityTimeSeconds;
    }

    public long getBridgeTimeSeconds() {
      return bridgeTimeSeconds;
    }

    public void setBridgeTimeSeconds(long bridgeTimeSeconds) {
      this.bridgeTimeSeconds = bridgeTimeSeconds;
    }

    public long getMaxAcceptableGasPriceWei() {
      return maxAcceptableGasPriceWei;
    }

    public void setMaxAcceptableGasPriceWei(long maxAcceptableGasPriceWei) {
      this.maxAcceptableGasPriceWei = maxAcceptableGasPriceWei;
    }

    public long getLowGasPriceWei() {
      return lowGasPriceWei;
    }

    public void setLowGasPriceWei(long lowGasPriceWei) {
      this.lowGasPriceWei = lowGasPriceWei;
    }

    public long getMediumGasPriceWei() {
      return mediumGasPriceWei;
    }

    public void setMediumGasPriceWei(long mediumGasPriceWei) {
      this.mediumGasPriceWei = mediumGasPriceWei;
    }

    public long getHighGasPriceWei() {
      return highGasPriceWei;
    }

    public void setHighGasPriceWei(long highGasPriceWei) {
      this.highGasPriceWei = highGasPriceWei;
    }

    public BigDecimal getLiquidityDepthUsd() {
      return liquidityDepthUsd;
    }

    public void setLiquidityDepthUsd(BigDecimal liquidityDepthUsd) {
      this.liquidityDepthUsd = liquidityDepthUsd;
    }

    public String getRpcUrl() {
      return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
      this.rpcUrl = rpcUrl;
    }
  }
}
