package io.statusmvp.gasrouter.service;

import static io.statusmvp.gasrouter.support.TestFixtures.OTHER_USER;
import static io.statusmvp.gasrouter.support.TestFixtures.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.SavingsCriteria;
import io.statusmvp.gasrouter.model.UserPreferences;
import io.statusmvp.gasrouter.support.TestFixtures;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UserPreferencesServiceTest {
  private OptimizerProperties props;
  private UserPreferencesService service;

  @BeforeEach
  void setUp() {
    props = TestFixtures.properties();
    RedisCache cache = mock(RedisCache.class);
    when(cache.get(anyString())).thenReturn(Optional.empty());
    service = new UserPreferencesService(new AccessControl(props), cache);
  }

  @Test
  void absentPreferencesFallBackToGlobalSettings() {
    UserPreferences prefs = service.get(USER);
    assertNull(prefs.minSavingsBps());

    SavingsCriteria criteria =
        service.criteriaFor(USER, new OptimizerSettingsService(props, new AccessControl(props)).snapshot());
    assertEquals(500, criteria.minSavingsBps());
    assertEquals(0, BigDecimal.TEN.compareTo(criteria.minAbsoluteSavingsUsd()));
    assertEquals(1800, criteria.maxBridgeTimeSeconds());
  }

  @Test
  void ownerOverridesApplyToCriteria() {
    service.update(
        Caller.user(USER.toLowerCase()),
        new UserPreferences(USER, 100, null, 600L, true, Set.of(137L)));

    SavingsCriteria criteria =
        service.criteriaFor(USER, new OptimizerSettingsService(props, new AccessControl(props)).snapshot());
    assertEquals(100, criteria.minSavingsBps());
    assertEquals(0, BigDecimal.TEN.compareTo(criteria.minAbsoluteSavingsUsd()));
    assertEquals(600, criteria.maxBridgeTimeSeconds());
    assertEquals(Set.of(137L), criteria.excludedChainIds());
  }

  @Test
  void onlyOwnerMayUpdateEvenOverAdmin() {
    UserPreferences prefs = new UserPreferences(USER, 100, null, null, null, Set.of());
    OptimizerException e =
        assertThrows(OptimizerException.class, () -> service.update(Caller.user(OTHER_USER), prefs));
    assertEquals(OptimizerErrorCode.UNAUTHORIZED, e.getCode());

    e = assertThrows(OptimizerException.class, () -> service.update(Caller.admin("ops"), prefs));
    assertEquals(OptimizerErrorCode.UNAUTHORIZED, e.getCode());
  }

  @Test
  void invalidOverridesAreRejected() {
    OptimizerException e =
        assertThrows(
            OptimizerException.class,
            () ->
                service.update(
                    Caller.user(USER), new UserPreferences(USER, 20_000, null, null, null, Set.of())));
    assertEquals(OptimizerErrorCode.INVALID_ARGUMENT, e.getCode());
  }
}
