package io.statusmvp.gasrouter.client;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.http.HttpService;

/** Reads {@code eth_gasPrice} from a chain's JSON-RPC endpoint. One {@link Web3j} per URL. */
@Component
public class GasPriceRpcClient {
  private static final Logger log = LoggerFactory.getLogger(GasPriceRpcClient.class);

  private final Map<String, Web3j> clients = new ConcurrentHashMap<>();

  public Optional<BigInteger> fetchGasPrice(long chainId, String rpcUrl) {
    if (rpcUrl == null || rpcUrl.isBlank()) return Optional.empty();
    try {
      Web3j web3j = clients.computeIfAbsent(rpcUrl.trim(), url -> Web3j.build(new HttpService(url)));
      EthGasPrice response = web3j.ethGasPrice().send();
      if (response == null || response.hasError()) {
        log.warn(
            "eth_gasPrice error chainId={} error={}",
            chainId,
            response == null || response.getError() == null ? "null" : response.getError().getMessage());
        return Optional.empty();
      }
      BigInteger price = response.getGasPrice();
      return price != null && price.signum() > 0 ? Optional.of(price) : Optional.empty();
    } catch (Exception e) {
      log.warn("eth_gasPrice failed chainId={}", chainId, e);
      return Optional.empty();
    }
  }
}
