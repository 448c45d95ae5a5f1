package io.statusmvp.gasrouter.auth;

import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AccessControl {
  private static final Logger log = LoggerFactory.getLogger(AccessControl.class);

  private final AtomicReference<String> keeperId;
  private final List<String> bridgeRelayerIds;

  public AccessControl(OptimizerProperties properties) {
    this.keeperId = new AtomicReference<>(properties.getAccess().getKeeperId());
    this.bridgeRelayerIds = properties.getAccess().bridgeRelayerIdList();
  }

  public String currentKeeperId() {
    return keeperId.get();
  }

  public void requireAdmin(Caller caller) {
    if (caller == null || !caller.isAdmin()) {
      throw denied(caller, "admin capability required");
    }
  }

  public void requireKeeper(Caller caller) {
    if (caller == null || caller.role() != Role.KEEPER || !caller.is(keeperId.get())) {
      throw denied(caller, "keeper capability required");
    }
  }

  public void requireBridgeOrAdmin(Caller caller) {
    if (caller == null) throw denied(null, "bridge capability required");
    if (caller.isAdmin()) return;
    boolean relayer =
        caller.role() == Role.BRIDGE && bridgeRelayerIds.stream().anyMatch(caller::is);
    if (!relayer) throw denied(caller, "bridge capability required");
  }

  public void requireSelfOrAdmin(Caller caller, String user) {
    if (caller == null) throw denied(null, "caller required");
    if (caller.isAdmin()) return;
    if (!caller.is(user)) throw denied(caller, "caller does not own this resource");
  }

  /** Strict ownership: admins are not exempt. */
  public void requireOwner(Caller caller, String user) {
    if (caller == null || !caller.is(user)) throw denied(caller, "only the owner may change this");
  }

  public void rotateKeeper(Caller caller, String newKeeperId) {
    requireAdmin(caller);
    if (newKeeperId == null || newKeeperId.isBlank()) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, "keeper id is required");
    }
    String previous = keeperId.getAndSet(newKeeperId.trim());
    log.info("keeper rotated by {}: {} -> {}", caller.id(), previous, newKeeperId.trim());
  }

  private static OptimizerException denied(Caller caller, String message) {
    return new OptimizerException(
        OptimizerErrorCode.UNAUTHORIZED,
        message,
        Map.of(
            "callerId", caller == null || caller.id() == null ? "" : caller.id(),
            "role", caller == null ? "" : caller.role().name()));
  }
}
