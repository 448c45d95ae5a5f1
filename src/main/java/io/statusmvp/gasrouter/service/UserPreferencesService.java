package io.statusmvp.gasrouter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.OptimizerSettings;
import io.statusmvp.gasrouter.model.SavingsCriteria;
import io.statusmvp.gasrouter.model.UserPreferences;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class UserPreferencesService {
  private static final Logger log = LoggerFactory.getLogger(UserPreferencesService.class);

  private final Map<String, UserPreferences> byUser = new ConcurrentHashMap<>();
  private final AccessControl access;
  private final RedisCache cache;
  private final ObjectMapper mapper = new ObjectMapper();

  public UserPreferencesService(AccessControl access, RedisCache cache) {
    this.access = access;
    this.cache = cache;
  }

  public UserPreferences get(String user) {
    String key = normalize(user);
    UserPreferences prefs = byUser.get(key);
    if (prefs != null) return prefs;
    return load(key).orElseGet(() -> UserPreferences.defaults(user));
  }

  public UserPreferences update(Caller caller, UserPreferences prefs) {
    if (prefs == null || prefs.user() == null || prefs.user().isBlank()) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_USER, "user is required");
    }
    access.requireOwner(caller, prefs.user());
    validate(prefs);
    String key = normalize(prefs.user());
    UserPreferences stored =
        new UserPreferences(
            prefs.user(),
            prefs.minSavingsBps(),
            prefs.minAbsoluteSavingsUsd(),
            prefs.maxBridgeTimeSeconds(),
            prefs.optimizationEnabled(),
            Set.copyOf(prefs.excludedChainIdsOrEmpty()));
    byUser.put(key, stored);
    try {
      cache.set(cacheKey(key), mapper.writeValueAsString(stored), 0);
    } catch (Exception e) {
      log.warn("preferences for {} not mirrored to redis: {}", key, e.getMessage());
    }
    log.info("preferences updated for {}", key);
    return stored;
  }

  /** Global thresholds with this user's overrides applied. */
  public SavingsCriteria criteriaFor(String user, OptimizerSettings settings) {
    UserPreferences prefs = get(user);
    return new SavingsCriteria(
        prefs.minSavingsBps() != null ? prefs.minSavingsBps() : settings.minSavingsBps(),
        prefs.minAbsoluteSavingsUsd() != null
            ? prefs.minAbsoluteSavingsUsd()
            : settings.minAbsoluteSavingsUsd(),
        prefs.maxBridgeTimeSeconds() != null
            ? prefs.maxBridgeTimeSeconds()
            : settings.maxBridgeTimeSeconds(),
        prefs.excludedChainIdsOrEmpty());
  }

  private Optional<UserPreferences> load(String key) {
    Optional<String> raw = cache.get(cacheKey(key));
    if (raw.isEmpty()) return Optional.empty();
    try {
      UserPreferences prefs = mapper.readValue(raw.get(), UserPreferences.class);
      byUser.putIfAbsent(key, prefs);
      return Optional.of(prefs);
    } catch (Exception e) {
      log.warn("unreadable preferences for {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  private static void validate(UserPreferences prefs) {
    Integer bps = prefs.minSavingsBps();
    if (bps != null && (bps < 0 || bps > 10_000)) {
      throw invalid("minSavingsBps must be within [0, 10000]");
    }
    if (prefs.minAbsoluteSavingsUsd() != null && prefs.minAbsoluteSavingsUsd().signum() < 0) {
      throw invalid("minAbsoluteSavingsUsd must not be negative");
    }
    if (prefs.maxBridgeTimeSeconds() != null && prefs.maxBridgeTimeSeconds() <= 0) {
      throw invalid("maxBridgeTimeSeconds must be positive");
    }
  }

  private static OptimizerException invalid(String message) {
    return new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, message);
  }

  private static String normalize(String user) {
    return user == null ? "" : user.trim().toLowerCase(Locale.ROOT);
  }

  private static String cacheKey(String key) {
    return "prefs:" + key;
  }
}
