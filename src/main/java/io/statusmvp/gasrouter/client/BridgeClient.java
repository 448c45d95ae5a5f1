package io.statusmvp.gasrouter.client;

import io.statusmvp.gasrouter.model.bridge.BridgeQuote;
import io.statusmvp.gasrouter.model.bridge.BridgeTransferRequest;
import io.statusmvp.gasrouter.model.bridge.BridgeTransferStatus;
import java.math.BigInteger;

/**
 * Request/response contract of the bridge that moves value between chains. Every method may throw
 * {@link BridgeException}; retries are the implementation's concern.
 */
public interface BridgeClient {
  BridgeQuote quote(String token, BigInteger amount, long destinationChainId);

  /** Returns the bridge reference id of the submitted transfer. */
  String transfer(BridgeTransferRequest request);

  BridgeTransferStatus status(String bridgeReferenceId);
}
