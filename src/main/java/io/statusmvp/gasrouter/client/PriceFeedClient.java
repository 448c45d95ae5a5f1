package io.statusmvp.gasrouter.client;

import io.statusmvp.gasrouter.model.UsdPrice;

/**
 * USD price source for native gas assets and swap input tokens.
 *
 * <p>Implementations throw {@code OptimizerException(PRICE_FEED_UNAVAILABLE)} when the feed cannot
 * be reached or reports a non-positive price. Staleness is judged by the caller.
 */
public interface PriceFeedClient {
  UsdPrice getUsdPrice(String assetId);
}
