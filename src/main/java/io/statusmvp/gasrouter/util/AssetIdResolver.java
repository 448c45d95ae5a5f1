package io.statusmvp.gasrouter.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves a price feed asset id from a token symbol.
 *
 * <p>Defaults to {@link AssetMappings#COINGECKO_IDS}; overrides use the format {@code
 * SYMBOL=id,SYMBOL2=id2}. Invalid pairs are ignored.
 */
@Component
public class AssetIdResolver {
  private final Map<String, String> merged;

  public AssetIdResolver(@Value("${app.coingecko.symbolIdOverrides:}") String overrides) {
    Map<String, String> map = new HashMap<>(AssetMappings.COINGECKO_IDS);
    parseOverrides(overrides).forEach(map::put);
    this.merged = Collections.unmodifiableMap(map);
  }

  public String resolve(String symbol) {
    String s = normalizeSymbol(symbol);
    if (s.isBlank()) return null;
    return merged.get(s);
  }

  public boolean isStablecoin(String symbol) {
    return AssetMappings.STABLECOINS.contains(normalizeSymbol(symbol));
  }

  public static String normalizeSymbol(String symbol) {
    return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
  }

  static Map<String, String> parseOverrides(String raw) {
    if (raw == null || raw.isBlank()) return Map.of();
    Map<String, String> out = new HashMap<>();
    for (String part : raw.split(",")) {
      String p = part.trim();
      if (p.isEmpty()) continue;
      int eq = p.indexOf('=');
      if (eq <= 0 || eq >= p.length() - 1) continue;
      String symbol = p.substring(0, eq).trim().toUpperCase(Locale.ROOT);
      String id = p.substring(eq + 1).trim();
      if (symbol.isEmpty() || id.isEmpty()) continue;
      out.put(symbol, id);
    }
    return out;
  }
}
