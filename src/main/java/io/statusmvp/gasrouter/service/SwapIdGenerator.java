package io.statusmvp.gasrouter.service;

import java.math.BigInteger;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

/** Keccak-256 over the swap's defining fields plus a process-wide nonce. */
@Component
public class SwapIdGenerator {
  private final AtomicLong nonce = new AtomicLong();

  public String next(
      String user,
      String tokenIn,
      String tokenOut,
      BigInteger amountIn,
      long sourceChainId,
      long destinationChainId,
      long initiatedAt) {
    String material =
        String.join(
            "|",
            user.toLowerCase(Locale.ROOT),
            tokenIn,
            tokenOut,
            amountIn.toString(),
            Long.toString(sourceChainId),
            Long.toString(destinationChainId),
            Long.toString(initiatedAt),
            Long.toString(nonce.incrementAndGet()));
    return Hash.sha3String(material);
  }
}
