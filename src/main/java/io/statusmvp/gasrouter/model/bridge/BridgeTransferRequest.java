package io.statusmvp.gasrouter.model.bridge;

import java.math.BigInteger;

public record BridgeTransferRequest(
    String depositor,
    String recipient,
    String token,
    BigInteger amount,
    long destinationChainId,
    String message) {}
