package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.client.BridgeClient;
import io.statusmvp.gasrouter.client.BridgeException;
import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.model.DestinationSwapResult;
import io.statusmvp.gasrouter.model.InitiateSwapRequest;
import io.statusmvp.gasrouter.model.OptimizationQuote;
import io.statusmvp.gasrouter.model.SwapDecision;
import io.statusmvp.gasrouter.model.SwapIntent;
import io.statusmvp.gasrouter.model.SwapRecord;
import io.statusmvp.gasrouter.model.SwapStats;
import io.statusmvp.gasrouter.model.SwapStatus;
import io.statusmvp.gasrouter.model.bridge.BridgeQuote;
import io.statusmvp.gasrouter.model.bridge.BridgeTransferRequest;
import io.statusmvp.gasrouter.model.bridge.BridgeTransferStatus;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives cross-chain swaps through {@code BRIDGING -> BRIDGING_BACK -> COMPLETED}, with
 * {@code FAILED} and {@code RECOVERED} as the other terminal states.
 *
 * <p>Transitions for one swap id are serialized through {@link SwapRecordStore#withLock}. Bridge
 * calls never run under that lock: a transition commits, the lock is released, the bridge is
 * called, and the result is committed under a second acquisition only if the record has not moved
 * on in the meantime.
 */
@Service
public class SwapOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SwapOrchestrator.class);
  private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
  private static final Pattern ZERO_ADDRESS = Pattern.compile("^0x0{40}$");

  private final SwapRecordStore store;
  private final SwapStatistics statistics;
  private final SwapIdGenerator ids;
  private final ChainRegistry chains;
  private final BridgeClient bridge;
  private final QuoteService quotes;
  private final OptimizerSettingsService settings;
  private final AccessControl access;
  private final OptimizerMetrics metrics;
  private final Clock clock;

  private final long currentChainId;
  private final long userRecoveryTimeoutSeconds;
  private final long defaultDeadlineSeconds;
  private final String escrowAddress;

  public SwapOrchestrator(
      SwapRecordStore store,
      SwapStatistics statistics,
      SwapIdGenerator ids,
      ChainRegistry chains,
      BridgeClient bridge,
      QuoteService quotes,
      OptimizerSettingsService settings,
      AccessControl access,
      OptimizerMetrics metrics,
      Clock clock,
      OptimizerProperties properties) {
    this.store = store;
    this.statistics = statistics;
    this.ids = ids;
    this.chains = chains;
    this.bridge = bridge;
    this.quotes = quotes;
    this.settings = settings;
    this.access = access;
    this.metrics = metrics;
    this.clock = clock;
    this.currentChainId = properties.getCurrentChainId();
    OptimizerProperties.Orchestration o = properties.getOrchestration();
    this.userRecoveryTimeoutSeconds = o.getUserRecoveryTimeoutSeconds();
    this.defaultDeadlineSeconds = o.getDefaultDeadlineSeconds();
    this.escrowAddress = o.getEscrowAddress() == null ? "" : o.getEscrowAddress().trim();
  }

  /** Quotes the intent and starts a cross-chain swap only when the quote says it pays off. */
  public SwapDecision submit(Caller caller, SwapIntent intent) {
    OptimizationQuote quote = quotes.quote(intent);
    if (!quote.shouldOptimize()) {
      return new SwapDecision(quote, null);
    }
    long deadline =
        intent.deadline() != null ? intent.deadline() : now() + defaultDeadlineSeconds;
    InitiateSwapRequest request =
        new InitiateSwapRequest(
            intent.user(),
            intent.tokenIn(),
            intent.tokenOut(),
            intent.amountIn(),
            quote.originalChain(),
            quote.optimizedChain(),
            deadline,
            quote.savingsUsd());
    return new SwapDecision(quote, initiate(caller, request));
  }

  public SwapRecord initiate(Caller caller, InitiateSwapRequest request) {
    if (settings.isPaused()) {
      throw new OptimizerException(OptimizerErrorCode.OPERATIONS_PAUSED, "operations are paused");
    }
    String user = request.user();
    if (user == null || user.isBlank() || !EVM_ADDRESS.matcher(user.trim()).matches()
        || ZERO_ADDRESS.matcher(user.trim()).matches()) {
      throw new OptimizerException(
          OptimizerErrorCode.INVALID_USER,
          "user must be a non-zero address",
          Map.of("user", user == null ? "" : user));
    }
    access.requireSelfOrAdmin(caller, user);
    if (request.amountIn() == null || request.amountIn().signum() <= 0) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_AMOUNT, "amountIn must be positive");
    }
    if (isBlank(request.tokenIn()) || isBlank(request.tokenOut())) {
      throw new OptimizerException(
          OptimizerErrorCode.INVALID_ARGUMENT, "tokenIn and tokenOut are required");
    }
    long now = now();
    if (request.deadline() == null || request.deadline() <= now) {
      throw new OptimizerException(
          OptimizerErrorCode.DEADLINE_EXPIRED,
          "deadline has passed",
          Map.of("deadline", String.valueOf(request.deadline()), "now", now));
    }
    long source = request.sourceChainId() == null ? currentChainId : request.sourceChainId();
    chains.require(source);
    long destination = request.destinationChainId();
    requireDestination(source, destination);

    SwapRecord draft =
        new SwapRecord.Builder()
            .user(user.trim())
            .tokenIn(request.tokenIn())
            .tokenOut(request.tokenOut())
            .amountIn(request.amountIn())
            .sourceChainId(source)
            .destinationChainId(destination)
            .deadline(request.deadline())
            .expectedSavingsUsd(request.expectedSavingsUsd())
            .build();
    return start(draft, now);
  }

  /** Bridge-reported result of the swap executed on the destination chain. */
  public SwapRecord handleDestinationSwap(
      Caller caller, String swapId, DestinationSwapResult result) {
    access.requireBridgeOrAdmin(caller);
    SwapRecord committed =
        store.withLock(
            swapId,
            () -> {
              SwapRecord r = store.require(swapId);
              requireStatus(r, SwapStatus.BRIDGING, "handleDestinationSwap");
              if (result == null
                  || !result.success()
                  || result.amountOut() == null
                  || result.amountOut().signum() <= 0) {
                String error = result == null || result.error() == null ? "no output" : result.error();
                return fail(r, "DESTINATION_SWAP_FAILED: " + error);
              }
              return commit(
                  r.toBuilder().status(SwapStatus.BRIDGING_BACK).amountOut(result.amountOut()).build());
            });
    if (committed.status() != SwapStatus.BRIDGING_BACK) return committed;

    BridgeTransferRequest returnLeg =
        new BridgeTransferRequest(
            depositorFor(committed),
            committed.user(),
            committed.tokenOut(),
            committed.amountOut(),
            committed.sourceChainId(),
            committed.swapId());
    try {
      String ref = bridge.transfer(returnLeg);
      return store.withLock(
          swapId,
          () -> {
            SwapRecord r = store.require(swapId);
            if (r.returnBridgeReferenceId() != null) return r;
            return store.save(r.toBuilder().returnBridgeReferenceId(ref).build());
          });
    } catch (BridgeException e) {
      return onBridgeFailure(swapId, SwapStatus.BRIDGING_BACK, "return-transfer", e);
    }
  }

  public SwapRecord complete(Caller caller, String swapId) {
    access.requireBridgeOrAdmin(caller);
    return store.withLock(swapId, () -> completeLocked(store.require(swapId)));
  }

  /**
   * Moves an active swap to {@code RECOVERED} and unwinds its funds toward the source chain.
   * Admins may recover at any time; the owner only after the recovery timeout has elapsed.
   */
  public SwapRecord emergencyRecovery(Caller caller, String swapId) {
    SwapRecord previous =
        store.withLock(
            swapId,
            () -> {
              SwapRecord r = store.require(swapId);
              boolean admin = caller != null && caller.isAdmin();
              if (!admin && (caller == null || !caller.is(r.user()))) {
                throw new OptimizerException(
                    OptimizerErrorCode.UNAUTHORIZED,
                    "only the swap owner or an admin may recover",
                    Map.of("swapId", swapId));
              }
              if (!r.isActive()) {
                throw new OptimizerException(
                    OptimizerErrorCode.SWAP_NOT_ACTIVE,
                    "swap is already " + r.status(),
                    Map.of("swapId", swapId, "status", r.status().name()));
              }
              long now = now();
              long elapsed = now - r.initiatedAt();
              if (!admin && elapsed <= userRecoveryTimeoutSeconds) {
                throw new OptimizerException(
                    OptimizerErrorCode.RECOVERY_TIMEOUT_NOT_REACHED,
                    "recovery is available after " + userRecoveryTimeoutSeconds + "s",
                    Map.of("swapId", swapId, "elapsedSeconds", elapsed));
              }
              if (inFlightLeg(r) == null) {
                throw new OptimizerException(
                    OptimizerErrorCode.INVALID_STATE_TRANSITION,
                    "bridge leg request is still in progress",
                    Map.of("swapId", swapId, "status", r.status().name()));
              }
              statistics.recovered(r.destinationChainId());
              log.info("swap {} recovered by {} after {}s from {}", swapId, caller.id(), elapsed, r.status());
              commit(
                  r.toBuilder()
                      .status(SwapStatus.RECOVERED)
                      .completedAt(Math.max(now, r.initiatedAt()))
                      .build());
              return r;
            });
    return unwind(previous);
  }

  /** Starts a fresh swap with the parameters of a failed one. The failed record stays terminal. */
  public SwapRecord retry(Caller caller, String swapId) {
    access.requireAdmin(caller);
    if (settings.isPaused()) {
      throw new OptimizerException(OptimizerErrorCode.OPERATIONS_PAUSED, "operations are paused");
    }
    SwapRecord failed = store.require(swapId);
    if (failed.status() != SwapStatus.FAILED) {
      throw new OptimizerException(
          OptimizerErrorCode.INVALID_STATE_TRANSITION,
          "only failed swaps can be retried",
          Map.of("swapId", swapId, "status", failed.status().name()));
    }
    requireDestination(failed.sourceChainId(), failed.destinationChainId());
    long now = now();
    SwapRecord draft =
        new SwapRecord.Builder()
            .user(failed.user())
            .tokenIn(failed.tokenIn())
            .tokenOut(failed.tokenOut())
            .amountIn(failed.amountIn())
            .sourceChainId(failed.sourceChainId())
            .destinationChainId(failed.destinationChainId())
            .deadline(now + defaultDeadlineSeconds)
            .expectedSavingsUsd(failed.expectedSavingsUsd())
            .retryOf(failed.swapId())
            .build();
    log.info("swap {} retried by {}", swapId, caller.id());
    return start(draft, now);
  }

  /** Polls the bridge for every in-flight leg and applies failed or completed outcomes. */
  public int reconcileActive() {
    int changed = 0;
    for (SwapRecord r : store.active()) {
      if (reconcile(r)) changed++;
    }
    return changed;
  }

  boolean reconcile(SwapRecord snapshot) {
    SwapStatus status = snapshot.status();
    String ref =
        status == SwapStatus.BRIDGING
            ? snapshot.bridgeReferenceId()
            : status == SwapStatus.BRIDGING_BACK ? snapshot.returnBridgeReferenceId() : null;
    if (ref == null) return false;

    BridgeTransferStatus transfer;
    try {
      transfer = bridge.status(ref);
    } catch (BridgeException e) {
      SwapRecord after = onBridgeFailure(snapshot.swapId(), status, "status", e);
      return after.status() == SwapStatus.FAILED;
    }
    if (transfer == null || transfer.pending()) return false;
    if (status == SwapStatus.BRIDGING && transfer.completed()) return false;

    return store.withLock(
        snapshot.swapId(),
        () -> {
          SwapRecord r = store.require(snapshot.swapId());
          if (r.status() != status) return false;
          if (transfer.failed()) {
            fail(r, "BRIDGE_TRANSFER_FAILED: " + ref);
          } else {
            completeLocked(r);
          }
          return true;
        });
  }

  public SwapRecord find(String swapId) {
    return store.require(swapId);
  }

  public List<String> activeSwapIds(String user) {
    return store.activeSwapIds(user);
  }

  public SwapStats stats() {
    return statistics.global();
  }

  public SwapStats stats(long destinationChainId) {
    return statistics.forChain(destinationChainId);
  }

  private SwapRecord start(SwapRecord draft, long now) {
    String swapId =
        ids.next(
            draft.user(),
            draft.tokenIn(),
            draft.tokenOut(),
            draft.amountIn(),
            draft.sourceChainId(),
            draft.destinationChainId(),
            now);
    SwapRecord bridging =
        draft.toBuilder().swapId(swapId).initiatedAt(now).status(SwapStatus.BRIDGING).build();
    store.withLock(
        swapId,
        () -> {
          store.create(bridging);
          statistics.initiated(bridging.destinationChainId());
          metrics.transition(SwapStatus.BRIDGING);
          return bridging;
        });
    log.info(
        "swap {} initiated user={} {} -> {} amountIn={}",
        swapId,
        bridging.user(),
        bridging.sourceChainId(),
        bridging.destinationChainId(),
        bridging.amountIn());

    try {
      BridgeQuote quote =
          bridge.quote(bridging.tokenIn(), bridging.amountIn(), bridging.destinationChainId());
      long maxBridgeTime = settings.snapshot().maxBridgeTimeSeconds();
      if (quote != null && quote.estimatedTimeSeconds() > maxBridgeTime) {
        log.warn(
            "swap {} not bridged: quoted eta {}s over limit {}s",
            swapId,
            quote.estimatedTimeSeconds(),
            maxBridgeTime);
        return store.withLock(
            swapId,
            () -> {
              SwapRecord r = store.require(swapId);
              if (r.status() != SwapStatus.BRIDGING) return r;
              return fail(r, "BRIDGE_ETA_EXCEEDED");
            });
      }
      String ref =
          bridge.transfer(
              new BridgeTransferRequest(
                  bridging.user(),
                  escrowAddress.isEmpty() ? bridging.user() : escrowAddress,
                  bridging.tokenIn(),
                  bridging.amountIn(),
                  bridging.destinationChainId(),
                  swapId));
      return store.withLock(
          swapId,
          () -> {
            SwapRecord r = store.require(swapId);
            if (r.bridgeReferenceId() != null) return r;
            SwapRecord.Builder next = r.toBuilder().bridgeReferenceId(ref);
            if (quote != null) {
              next.bridgeFeeUsd(quote.feeUsd())
                  .estimatedArrivalAt(r.initiatedAt() + Math.max(0, quote.estimatedTimeSeconds()));
            }
            return store.save(next.build());
          });
    } catch (BridgeException e) {
      return onBridgeFailure(swapId, SwapStatus.BRIDGING, "transfer", e);
    }
  }

  private SwapRecord onBridgeFailure(
      String swapId, SwapStatus expected, String operation, BridgeException e) {
    log.warn("bridge {} for swap {} failed reason={}: {}", operation, swapId, e.getReason(), e.getMessage());
    metrics.bridgeFailure(operation, e.getReason().name());
    return store.withLock(
        swapId,
        () -> {
          SwapRecord r = store.require(swapId);
          if (r.status() != expected) return r;
          return fail(r, "BRIDGE_" + e.getReason().name());
        });
  }

  private SwapRecord completeLocked(SwapRecord r) {
    requireStatus(r, SwapStatus.BRIDGING_BACK, "complete");
    long completedAt = Math.max(now(), r.initiatedAt());
    SwapRecord done =
        commit(r.toBuilder().status(SwapStatus.COMPLETED).completedAt(completedAt).build());
    statistics.completed(done.destinationChainId(), done.executionTimeSeconds(), done.expectedSavingsUsd());
    return done;
  }

  private SwapRecord fail(SwapRecord r, String reason) {
    statistics.failed(r.destinationChainId());
    log.info("swap {} failed from {}: {}", r.swapId(), r.status(), reason);
    return commit(
        r.toBuilder()
            .status(SwapStatus.FAILED)
            .completedAt(Math.max(now(), r.initiatedAt()))
            .failureReason(reason)
            .build());
  }

  private SwapRecord commit(SwapRecord next) {
    store.save(next);
    metrics.transition(next.status());
    if (next.status() != SwapStatus.FAILED) {
      log.info("swap {} -> {}", next.swapId(), next.status());
    }
    return next;
  }

  /**
   * Returns a recovered swap's funds without duplicating a leg the bridge is already carrying. A
   * leg that pays the user directly is itself the unwind unless it failed; funds that reach the
   * escrow are refunded to the source chain.
   */
  private SwapRecord unwind(SwapRecord previous) {
    String swapId = previous.swapId();
    boolean returning = previous.status() == SwapStatus.BRIDGING_BACK;
    String legRef = inFlightLeg(previous);
    boolean legPaysUser = returning || escrowAddress.isEmpty();

    BridgeTransferStatus leg;
    try {
      leg = bridge.status(legRef);
    } catch (BridgeException e) {
      log.warn("swap {} leg {} status unavailable reason={}: {}", swapId, legRef, e.getReason(), e.getMessage());
      metrics.bridgeFailure("refund-status", e.getReason().name());
      return recordUnwind(swapId, null, "REFUND_UNVERIFIED: " + e.getReason());
    }
    boolean legFailed = leg != null && leg.failed();
    if (legPaysUser && !legFailed) {
      log.info("swap {} unwinds through in-flight leg {}", swapId, legRef);
      return recordUnwind(swapId, legRef, null);
    }
    if (!returning && legFailed) {
      // outbound leg never delivered; the bridge hands it back to the depositing user
      return store.require(swapId);
    }

    BridgeTransferRequest refund =
        new BridgeTransferRequest(
            depositorFor(previous),
            previous.user(),
            returning ? previous.tokenOut() : previous.tokenIn(),
            returning ? previous.amountOut() : previous.amountIn(),
            previous.sourceChainId(),
            "refund:" + swapId);
    try {
      return recordUnwind(swapId, bridge.transfer(refund), null);
    } catch (BridgeException e) {
      log.warn("refund transfer for swap {} failed reason={}: {}", swapId, e.getReason(), e.getMessage());
      metrics.bridgeFailure("refund", e.getReason().name());
      return recordUnwind(swapId, null, "REFUND_FAILED: " + e.getReason());
    }
  }

  private SwapRecord recordUnwind(String swapId, String refundReferenceId, String failureReason) {
    return store.withLock(
        swapId,
        () -> {
          SwapRecord.Builder next = store.require(swapId).toBuilder();
          if (refundReferenceId != null) next.refundReferenceId(refundReferenceId);
          if (failureReason != null) next.failureReason(failureReason);
          return store.save(next.build());
        });
  }

  /** Reference of the bridge leg currently carrying the swap's funds. */
  private static String inFlightLeg(SwapRecord r) {
    if (r.status() == SwapStatus.BRIDGING) return r.bridgeReferenceId();
    if (r.status() == SwapStatus.BRIDGING_BACK) return r.returnBridgeReferenceId();
    return null;
  }

  private void requireDestination(long source, long destination) {
    ChainConfig config = chains.find(destination).orElse(null);
    if (config == null || !config.enabled() || destination == source) {
      throw new OptimizerException(
          OptimizerErrorCode.INVALID_DESTINATION_CHAIN,
          "destination chain is unknown, disabled or equal to the source chain",
          Map.of("destinationChainId", destination, "sourceChainId", source));
    }
  }

  private static void requireStatus(SwapRecord r, SwapStatus expected, String operation) {
    if (r.status() != expected) {
      throw new OptimizerException(
          OptimizerErrorCode.INVALID_STATE_TRANSITION,
          operation + " requires " + expected + " but swap is " + r.status(),
          Map.of("swapId", r.swapId(), "status", r.status().name()));
    }
  }

  private String depositorFor(SwapRecord r) {
    return escrowAddress.isEmpty() ? r.user() : escrowAddress;
  }

  private long now() {
    return clock.instant().getEpochSecond();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
