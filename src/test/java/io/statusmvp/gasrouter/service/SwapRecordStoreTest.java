package io.statusmvp.gasrouter.service;

import static io.statusmvp.gasrouter.support.TestFixtures.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.SwapRecord;
import io.statusmvp.gasrouter.model.SwapStatus;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SwapRecordStoreTest {
  private RedisCache cache;
  private SwapRecordStore store;

  @BeforeEach
  void setUp() {
    cache = mock(RedisCache.class);
    when(cache.get(anyString())).thenReturn(Optional.empty());
    store = new SwapRecordStore(cache);
  }

  @Test
  void saveMirrorsRecordAndTracksActiveIds() {
    SwapRecord swap = record("0xabc", SwapStatus.BRIDGING);
    store.withLock(swap.swapId(), () -> {
      store.create(swap);
      return null;
    });

    assertEquals(List.of("0xabc"), store.activeSwapIds(USER.toLowerCase()));
    verify(cache).set(eq("swap:record:0xabc"), anyString(), eq(0L));

    store.save(swap.toBuilder().status(SwapStatus.COMPLETED).completedAt(10).build());
    assertTrue(store.activeSwapIds(USER).isEmpty());
    assertEquals(0, store.trackedUsers());
  }

  @Test
  void userIndexKeepsOnlyUsersWithActiveSwaps() {
    store.save(record("0x01", SwapStatus.BRIDGING));
    store.save(record("0x02", SwapStatus.BRIDGING_BACK));
    assertEquals(1, store.trackedUsers());

    store.save(record("0x01", SwapStatus.FAILED));
    assertEquals(List.of("0x02"), store.activeSwapIds(USER));
    store.save(record("0x02", SwapStatus.RECOVERED));
    assertEquals(0, store.trackedUsers());
  }

  @Test
  void locksAreReentrantAndReleasedAcrossManyIds() throws Exception {
    for (int i = 0; i < 500; i++) {
      String id = "0x" + Integer.toHexString(i);
      assertEquals(id, store.withLock(id, () -> store.withLock(id, () -> id)));
    }
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<String> other = pool.submit(() -> store.withLock("0x7", () -> "free"));
      assertEquals("free", other.get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void duplicateIdIsRejected() {
    SwapRecord swap = record("0xdup", SwapStatus.BRIDGING);
    store.create(swap);
    OptimizerException e = assertThrows(OptimizerException.class, () -> store.create(swap));
    assertEquals(OptimizerErrorCode.DUPLICATE_SWAP, e.getCode());
  }

  @Test
  void findFallsBackToRedisMirror() {
    SwapRecord swap = record("0xfeed", SwapStatus.BRIDGING_BACK);
    RedisCache other = mock(RedisCache.class);
    when(other.get(anyString())).thenReturn(Optional.empty());
    new SwapRecordStore(other).save(swap);
    ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
    verify(other).set(eq("swap:record:0xfeed"), json.capture(), eq(0L));

    when(cache.get("swap:record:0xfeed")).thenReturn(Optional.of(json.getValue()));
    SwapRecord loaded = store.require("0xfeed");
    assertEquals(swap, loaded);
  }

  @Test
  void missingSwapIsNotFound() {
    OptimizerException e = assertThrows(OptimizerException.class, () -> store.require("0xnone"));
    assertEquals(OptimizerErrorCode.SWAP_NOT_FOUND, e.getCode());
  }

  private static SwapRecord record(String id, SwapStatus status) {
    return new SwapRecord.Builder()
        .swapId(id)
        .user(USER)
        .tokenIn("ETH")
        .tokenOut("USDC")
        .amountIn(BigInteger.TEN)
        .sourceChainId(1)
        .destinationChainId(10)
        .initiatedAt(100)
        .deadline(1000)
        .status(status)
        .expectedSavingsUsd(new BigDecimal("12.5"))
        .build();
  }
}
