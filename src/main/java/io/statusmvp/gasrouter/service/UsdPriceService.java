package io.statusmvp.gasrouter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.statusmvp.gasrouter.client.PriceFeedClient;
import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.UsdPrice;
import io.statusmvp.gasrouter.util.AssetIdResolver;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * USD prices by token symbol with a short Redis cache in front of the {@link PriceFeedClient}.
 * Readings older than the feed max-age are rejected as {@code PRICE_FEED_UNAVAILABLE}.
 */
@Service
public class UsdPriceService {
  private static final Logger log = LoggerFactory.getLogger(UsdPriceService.class);

  private final PriceFeedClient feed;
  private final RedisCache cache;
  private final AssetIdResolver assetIds;
  private final Clock clock;
  private final ObjectMapper mapper = new ObjectMapper();

  private final long maxAgeSeconds;
  private final long cacheTtlSeconds;

  public UsdPriceService(
      PriceFeedClient feed,
      RedisCache cache,
      AssetIdResolver assetIds,
      Clock clock,
      OptimizerProperties properties) {
    this.feed = feed;
    this.cache = cache;
    this.assetIds = assetIds;
    this.clock = clock;
    this.maxAgeSeconds = Math.max(1L, properties.getFeed().getMaxAgeSeconds());
    this.cacheTtlSeconds = properties.getFeed().getCacheTtlSeconds();
  }

  public BigDecimal usdPrice(String symbol) {
    long now = clock.instant().getEpochSecond();
    if (assetIds.isStablecoin(symbol)) return BigDecimal.ONE;

    String assetId = assetIds.resolve(symbol);
    if (assetId == null) {
      throw new OptimizerException(
          OptimizerErrorCode.PRICE_FEED_UNAVAILABLE,
          "no price feed for " + symbol,
          Map.of("symbol", symbol == null ? "" : symbol));
    }

    String key = "price:usd:" + assetId;
    UsdPrice price = cached(key).orElse(null);
    if (price == null) {
      price = feed.getUsdPrice(assetId);
      if (price == null || price.price() == null || price.price().signum() <= 0) {
        throw new OptimizerException(
            OptimizerErrorCode.PRICE_FEED_UNAVAILABLE,
            "price feed returned no usable price",
            Map.of("assetId", assetId));
      }
      try {
        cache.set(key, mapper.writeValueAsString(price), cacheTtlSeconds);
      } catch (Exception e) {
        log.debug("price cache write skipped for {}: {}", key, e.getMessage());
      }
    }

    long age = now - price.updatedAt();
    if (price.updatedAt() <= 0 || age > maxAgeSeconds) {
      log.warn("stale USD price for assetId='{}' ageSeconds={} maxAge={}", assetId, age, maxAgeSeconds);
      throw new OptimizerException(
          OptimizerErrorCode.PRICE_FEED_UNAVAILABLE,
          "price feed reading is stale",
          Map.of("assetId", assetId, "ageSeconds", age));
    }
    return price.price();
  }

  private Optional<UsdPrice> cached(String key) {
    Optional<String> raw = cache.get(key);
    if (raw.isEmpty()) return Optional.empty();
    try {
      return Optional.of(mapper.readValue(raw.get(), UsdPrice.class));
    } catch (Exception e) {
      return Optional.empty();
    }
  }
}
