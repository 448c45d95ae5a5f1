package io.statusmvp.gasrouter.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.UsdPrice;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class CoinGeckoPriceFeedClient implements PriceFeedClient {
  private static final Logger log = LoggerFactory.getLogger(CoinGeckoPriceFeedClient.class);
  private final WebClient webClient;
  private final String apiKey;
  private final String baseUrl;
  private final Duration timeout;

  public CoinGeckoPriceFeedClient(
      WebClient webClient,
      @Value("${app.coingecko.apiKey:}") String apiKey,
      @Value("${app.coingecko.allowPublic:true}") boolean allowPublic,
      @Value("${app.coingecko.timeoutMs:10000}") long timeoutMs) {
    this.webClient = webClient;
    this.apiKey = apiKey == null ? "" : apiKey.trim();
    // Prefer Pro API when key is provided; optionally fall back to the public API (rate-limited).
    if (!this.apiKey.isBlank()) {
      this.baseUrl = "https://pro-api.coingecko.com/api/v3";
    } else if (allowPublic) {
      this.baseUrl = "https://api.coingecko.com/api/v3";
    } else {
      this.baseUrl = "";
    }
    this.timeout = Duration.ofMillis(Math.max(1000L, timeoutMs));
  }

  public boolean isEnabled() {
    return !baseUrl.isBlank();
  }

  @Override
  public UsdPrice getUsdPrice(String assetId) {
    if (!isEnabled() || assetId == null || assetId.isBlank()) {
      throw unavailable(assetId, "coingecko disabled or asset id missing");
    }

    URI uri =
        UriComponentsBuilder.fromUriString(baseUrl + "/simple/price")
            .queryParam("ids", assetId)
            .queryParam("vs_currencies", "usd")
            .queryParam("include_last_updated_at", "true")
            .build(true)
            .toUri();

    JsonNode root;
    try {
      root =
          webClient
              .get()
              .uri(uri)
              .headers(
                  h -> {
                    if (!apiKey.isBlank()) h.set("x-cg-pro-api-key", apiKey);
                  })
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout)
              .block();
    } catch (Exception e) {
      log.warn("CoinGecko simple price request failed for id='{}' uri={}", assetId, uri, e);
      throw unavailable(assetId, "coingecko request failed");
    }
    return parse(assetId, root);
  }

  static UsdPrice parse(String assetId, JsonNode root) {
    if (root == null) {
      log.warn("CoinGecko simple price returned null body for id='{}'", assetId);
      throw unavailable(assetId, "empty response");
    }
    JsonNode node = root.path(assetId);
    JsonNode usd = node.path("usd");
    if (!usd.isNumber()) {
      log.warn("CoinGecko simple price missing numeric 'usd' for id='{}', body={}", assetId, root);
      throw unavailable(assetId, "missing usd price");
    }
    BigDecimal price = usd.decimalValue();
    if (price.signum() <= 0) throw unavailable(assetId, "non-positive price");
    long updatedAt = node.path("last_updated_at").asLong(0L);
    return new UsdPrice(assetId, price, updatedAt, "coingecko");
  }

  private static OptimizerException unavailable(String assetId, String reason) {
    return new OptimizerException(
        OptimizerErrorCode.PRICE_FEED_UNAVAILABLE,
        "price feed unavailable: " + reason,
        Map.of("assetId", assetId == null ? "" : assetId));
  }
}
