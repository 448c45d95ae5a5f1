package io.statusmvp.gasrouter.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.math.BigInteger;

public record ChainConfig(
    long chainId,
    String name,
    String nativeSymbol,
    boolean enabled,
    double blockTimeSeconds,
    long finalityTimeSeconds,
    long bridgeTimeSeconds,
    BigInteger maxAcceptableGasPrice,
    BigInteger lowGasPrice,
    BigInteger mediumGasPrice,
    BigInteger highGasPrice,
    BigDecimal liquidityDepthUsd,
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY) String rpcUrl) {

  public ChainConfig withEnabled(boolean value) {
    return new ChainConfig(
        chainId,
        name,
        nativeSymbol,
        value,
        blockTimeSeconds,
        finalityTimeSeconds,
        bridgeTimeSeconds,
        maxAcceptableGasPrice,
        lowGasPrice,
        mediumGasPrice,
        highGasPrice,
        liquidityDepthUsd,
        rpcUrl);
  }

  /** Observed bridge time when configured, otherwise the chain's finality time. */
  public long estimatedBridgeTimeSeconds() {
    return bridgeTimeSeconds > 0 ? bridgeTimeSeconds : finalityTimeSeconds;
  }

  public boolean hasRpcUrl() {
    return rpcUrl != null && !rpcUrl.isBlank();
  }
}
