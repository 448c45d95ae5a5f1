package io.statusmvp.gasrouter.util;

import java.util.Map;
import java.util.Set;

public final class AssetMappings {
  private AssetMappings() {}

  /** Valued at 1 USD without a feed lookup. */
  public static final Set<String> STABLECOINS =
      Set.of("USDC", "USDT", "DAI", "BUSD", "TUSD", "USDP", "FRAX", "LUSD", "PYUSD", "FDUSD");

  // Minimal symbol -> CoinGecko "id" mapping (extend via app.coingecko.symbolIdOverrides).
  public static final Map<String, String> COINGECKO_IDS =
      Map.ofEntries(
          Map.entry("ETH", "ethereum"),
          Map.entry("WETH", "weth"),
          Map.entry("BTC", "bitcoin"),
          Map.entry("WBTC", "wrapped-bitcoin"),
          Map.entry("BNB", "binancecoin"),
          Map.entry("MATIC", "matic-network"),
          Map.entry("POL", "polygon-ecosystem-token"),
          Map.entry("AVAX", "avalanche-2"),
          Map.entry("ARB", "arbitrum"),
          Map.entry("OP", "optimism"),
          Map.entry("UNI", "uniswap"),
          Map.entry("LINK", "chainlink"),
          Map.entry("USDC", "usd-coin"),
          Map.entry("USDT", "tether"),
          Map.entry("DAI", "dai"));
}
