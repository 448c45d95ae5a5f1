package io.statusmvp.gasrouter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.SwapRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authoritative in-memory swap records with one lock per swap id. Every committed snapshot is
 * mirrored to Redis as JSON; lookups fall back to Redis for records not resident in memory.
 *
 * <p>{@link #create} and {@link #save} must be called from inside {@link #withLock} for the same
 * id. Ids share a fixed set of lock stripes, so an action must not take the lock of another id.
 */
@Component
public class SwapRecordStore {
  private static final Logger log = LoggerFactory.getLogger(SwapRecordStore.class);
  private static final String KEY_PREFIX = "swap:record:";
  private static final int LOCK_STRIPES = 64;

  private final Map<String, SwapRecord> records = new ConcurrentHashMap<>();
  private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
  private final Map<String, Set<String>> activeByUser = new ConcurrentHashMap<>();
  private final RedisCache cache;
  private final ObjectMapper mapper = new ObjectMapper();

  public SwapRecordStore(RedisCache cache) {
    this.cache = cache;
    for (int i = 0; i < locks.length; i++) {
      locks[i] = new ReentrantLock();
    }
  }

  public <T> T withLock(String swapId, Supplier<T> action) {
    ReentrantLock lock = locks[Math.floorMod(String.valueOf(swapId).hashCode(), LOCK_STRIPES)];
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void create(SwapRecord record) {
    if (find(record.swapId()).isPresent()) {
      throw new OptimizerException(
          OptimizerErrorCode.DUPLICATE_SWAP,
          "swap id already used",
          Map.of("swapId", record.swapId()));
    }
    save(record);
  }

  public SwapRecord save(SwapRecord record) {
    records.put(record.swapId(), record);
    String user = userKey(record.user());
    if (record.isActive()) {
      activeByUser.computeIfAbsent(user, u -> ConcurrentHashMap.newKeySet()).add(record.swapId());
    } else {
      activeByUser.computeIfPresent(
          user,
          (u, ids) -> {
            ids.remove(record.swapId());
            return ids.isEmpty() ? null : ids;
          });
    }
    mirror(record);
    return record;
  }

  public Optional<SwapRecord> find(String swapId) {
    if (swapId == null || swapId.isBlank()) return Optional.empty();
    SwapRecord record = records.get(swapId);
    if (record != null) return Optional.of(record);
    return load(swapId);
  }

  public SwapRecord require(String swapId) {
    return find(swapId)
        .orElseThrow(
            () ->
                new OptimizerException(
                    OptimizerErrorCode.SWAP_NOT_FOUND,
                    "swap not found",
                    Map.of("swapId", swapId == null ? "" : swapId)));
  }

  public List<String> activeSwapIds(String user) {
    Set<String> ids = activeByUser.get(userKey(user));
    if (ids == null) return List.of();
    return ids.stream().sorted().toList();
  }

  /** Users with at least one active swap. */
  int trackedUsers() {
    return activeByUser.size();
  }

  /** Resident records that are not terminal, oldest first. */
  public List<SwapRecord> active() {
    List<SwapRecord> out = new ArrayList<>();
    for (SwapRecord r : records.values()) {
      if (r.isActive()) out.add(r);
    }
    out.sort(Comparator.comparingLong(SwapRecord::initiatedAt).thenComparing(SwapRecord::swapId));
    return out;
  }

  private void mirror(SwapRecord record) {
    try {
      cache.set(KEY_PREFIX + record.swapId(), mapper.writeValueAsString(record), 0);
    } catch (Exception e) {
      log.warn("swap {} not mirrored to redis: {}", record.swapId(), e.getMessage());
    }
  }

  private Optional<SwapRecord> load(String swapId) {
    Optional<String> raw = cache.get(KEY_PREFIX + swapId);
    if (raw.isEmpty()) return Optional.empty();
    try {
      SwapRecord record = mapper.readValue(raw.get(), SwapRecord.class);
      SwapRecord resident = records.putIfAbsent(swapId, record);
      return Optional.of(resident != null ? resident : record);
    } catch (Exception e) {
      log.warn("unreadable swap record {} in redis: {}", swapId, e.getMessage());
      return Optional.empty();
    }
  }

  private static String userKey(String user) {
    return user == null ? "" : user.trim().toLowerCase(Locale.ROOT);
  }
}
