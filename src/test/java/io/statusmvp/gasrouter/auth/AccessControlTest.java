package io.statusmvp.gasrouter.auth;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import org.junit.jupiter.api.Test;

class AccessControlTest {
  private static final String USER = "0xd8dA6BF26964aF9D7eEd9e03E53415D37aA96045";

  private final AccessControl access = new AccessControl(new OptimizerProperties());

  @Test
  void keeperRotationIsAdminOnlyAndImmediate() {
    OptimizerException e =
        assertThrows(
            OptimizerException.class, () -> access.rotateKeeper(Caller.keeper("keeper"), "next"));
    assertEquals(OptimizerErrorCode.UNAUTHORIZED, e.getCode());

    access.rotateKeeper(Caller.admin("ops"), " next ");
    assertEquals("next", access.currentKeeperId());
    assertThrows(OptimizerException.class, () -> access.requireKeeper(Caller.keeper("keeper")));
    assertDoesNotThrow(() -> access.requireKeeper(Caller.keeper("next")));
  }

  @Test
  void bridgeCapabilityRequiresConfiguredRelayer() {
    assertDoesNotThrow(() -> access.requireBridgeOrAdmin(Caller.bridge("bridge-relayer")));
    assertDoesNotThrow(() -> access.requireBridgeOrAdmin(Caller.admin("ops")));
    assertThrows(OptimizerException.class, () -> access.requireBridgeOrAdmin(Caller.bridge("rogue")));
    assertThrows(OptimizerException.class, () -> access.requireBridgeOrAdmin(Caller.user(USER)));
  }

  @Test
  void ownershipComparesAddressesCaseInsensitively() {
    assertDoesNotThrow(() -> access.requireSelfOrAdmin(Caller.user(USER.toLowerCase()), USER));
    assertDoesNotThrow(() -> access.requireOwner(Caller.user(USER.toUpperCase()), USER));
    assertThrows(OptimizerException.class, () -> access.requireOwner(Caller.admin("ops"), USER));
  }
}
