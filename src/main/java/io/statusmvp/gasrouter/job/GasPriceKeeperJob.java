package io.statusmvp.gasrouter.job;

import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.client.GasPriceRpcClient;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.service.ChainRegistry;
import io.statusmvp.gasrouter.service.GasPriceOracle;
import java.math.BigInteger;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Keeper path: pushes {@code eth_gasPrice} of every enabled chain with an RPC URL into the oracle. */
@Component
@ConditionalOnProperty(name = "app.jobs.enabled", havingValue = "true", matchIfMissing = true)
public class GasPriceKeeperJob {
  private static final Logger log = LoggerFactory.getLogger(GasPriceKeeperJob.class);

  private final ChainRegistry chains;
  private final GasPriceOracle oracle;
  private final GasPriceRpcClient rpc;
  private final AccessControl access;

  public GasPriceKeeperJob(
      ChainRegistry chains, GasPriceOracle oracle, GasPriceRpcClient rpc, AccessControl access) {
    this.chains = chains;
    this.oracle = oracle;
    this.rpc = rpc;
    this.access = access;
  }

  @Scheduled(
      fixedDelayString = "${app.jobs.gasPricePollMs:30000}",
      initialDelayString = "${app.jobs.initialDelayMs:5000}")
  public void runScheduled() {
    refreshAll();
  }

  public int refreshAll() {
    Caller keeper = Caller.keeper(access.currentKeeperId());
    int updated = 0;
    for (ChainConfig chain : chains.enabled()) {
      if (!chain.hasRpcUrl()) continue;
      Optional<BigInteger> price = rpc.fetchGasPrice(chain.chainId(), chain.rpcUrl());
      if (price.isEmpty()) continue;
      try {
        oracle.update(keeper, chain.chainId(), price.get());
        updated++;
      } catch (OptimizerException e) {
        log.warn("gas price for chain {} rejected: {} {}", chain.chainId(), e.getCode(), e.getMessage());
      }
    }
    log.debug("keeper refreshed {} chain(s)", updated);
    return updated;
  }
}
