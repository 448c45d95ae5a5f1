package io.statusmvp.gasrouter.service;

import static io.statusmvp.gasrouter.support.TestFixtures.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.statusmvp.gasrouter.client.PriceFeedClient;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.UsdPrice;
import io.statusmvp.gasrouter.support.MutableClock;
import io.statusmvp.gasrouter.support.TestFixtures;
import io.statusmvp.gasrouter.util.AssetIdResolver;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UsdPriceServiceTest {
  private PriceFeedClient feed;
  private RedisCache cache;
  private MutableClock clock;
  private UsdPriceService service;

  @BeforeEach
  void setUp() {
    feed = mock(PriceFeedClient.class);
    cache = mock(RedisCache.class);
    when(cache.get(anyString())).thenReturn(Optional.empty());
    clock = new MutableClock(T0);
    service =
        new UsdPriceService(
            feed, cache, new AssetIdResolver(""), clock, TestFixtures.properties());
  }

  @Test
  void stablecoinsArePricedWithoutFeed() {
    assertEquals(BigDecimal.ONE, service.usdPrice("usdc"));
    verify(feed, never()).getUsdPrice(anyString());
  }

  @Test
  void freshFeedPriceIsReturnedAndCached() {
    when(feed.getUsdPrice("ethereum"))
        .thenReturn(new UsdPrice("ethereum", new BigDecimal("2500.5"), T0 - 60, "coingecko"));

    assertEquals(new BigDecimal("2500.5"), service.usdPrice("ETH"));
    verify(cache).set(eq("price:usd:ethereum"), anyString(), anyLong());
  }

  @Test
  void cachedReadingIsUsedBeforeFeed() {
    when(cache.get("price:usd:ethereum"))
        .thenReturn(
            Optional.of(
                "{\"assetId\":\"ethereum\",\"price\":2400,\"updatedAt\":"
                    + (T0 - 10)
                    + ",\"source\":\"coingecko\"}"));

    assertEquals(0, new BigDecimal("2400").compareTo(service.usdPrice("ETH")));
    verify(feed, never()).getUsdPrice(anyString());
  }

  @Test
  void readingOlderThanMaxAgeIsUnavailable() {
    when(feed.getUsdPrice("ethereum"))
        .thenReturn(new UsdPrice("ethereum", new BigDecimal("2500"), T0 - 3601, "coingecko"));

    OptimizerException e = assertThrows(OptimizerException.class, () -> service.usdPrice("ETH"));
    assertEquals(OptimizerErrorCode.PRICE_FEED_UNAVAILABLE, e.getCode());
  }

  @Test
  void unmappedSymbolIsUnavailable() {
    OptimizerException e =
        assertThrows(OptimizerException.class, () -> service.usdPrice("NOPE"));
    assertEquals(OptimizerErrorCode.PRICE_FEED_UNAVAILABLE, e.getCode());
  }
}
