package io.statusmvp.gasrouter.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

/**
 * Token exchange a caller wants to perform before any chain decision is made.
 *
 * <p>{@code amountIn} is in the token's smallest unit; {@code tokenInDecimals} defaults to 18.
 * {@code sourceChainId} defaults to the service's current chain.
 */
public record SwapIntent(
    @NotBlank String user,
    @NotBlank String tokenIn,
    @NotBlank String tokenOut,
    @NotNull BigInteger amountIn,
    Integer tokenInDecimals,
    Long sourceChainId,
    Long deadline,
    Long gasUsageUnits) {

  public int decimalsOrDefault() {
    return tokenInDecimals == null ? 18 : tokenInDecimals;
  }
}
