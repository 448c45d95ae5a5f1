package io.statusmvp.gasrouter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Immutable snapshot of one cross-chain swap. Each committed state transition replaces the stored
 * snapshot; {@code amountOut} and {@code completedAt} stay zero until set by a transition.
 */
public record SwapRecord(
    String swapId,
    String user,
    String tokenIn,
    String tokenOut,
    BigInteger amountIn,
    BigInteger amountOut,
    long sourceChainId,
    long destinationChainId,
    long initiatedAt,
    long completedAt,
    long deadline,
    SwapStatus status,
    String bridgeReferenceId,
    String returnBridgeReferenceId,
    String refundReferenceId,
    String failureReason,
    BigDecimal expectedSavingsUsd,
    BigDecimal bridgeFeeUsd,
    long estimatedArrivalAt,
    String retryOf) {

  @JsonIgnore
  public boolean isActive() {
    return !status.isTerminal();
  }

  @JsonIgnore
  public long executionTimeSeconds() {
    return completedAt > 0 ? Math.max(0, completedAt - initiatedAt) : 0;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    private String swapId;
    private String user;
    private String tokenIn;
    private String tokenOut;
    private BigInteger amountIn;
    private BigInteger amountOut = BigInteger.ZERO;
    private long sourceChainId;
    private long destinationChainId;
    private long initiatedAt;
    private long completedAt;
    private long deadline;
    private SwapStatus status = SwapStatus.INITIATED;
    private String bridgeReferenceId;
    private String returnBridgeReferenceId;
    private String refundReferenceId;
    private String failureReason;
    private BigDecimal expectedSavingsUsd = BigDecimal.ZERO;
    private BigDecimal bridgeFeeUsd = BigDecimal.ZERO;
    private long estimatedArrivalAt;
    private String retryOf;

    public Builder() {}

    private Builder(SwapRecord r) {
      this.swapId = r.swapId;
      this.user = r.user;
      this.tokenIn = r.tokenIn;
      this.tokenOut = r.tokenOut;
      this.amountIn = r.amountIn;
      this.amountOut = r.amountOut;
      this.sourceChainId = r.sourceChainId;
      this.destinationChainId = r.destinationChainId;
      this.initiatedAt = r.initiatedAt;
      this.completedAt = r.completedAt;
      this.deadline = r.deadline;
      this.status = r.status;
      this.bridgeReferenceId = r.bridgeReferenceId;
      this.returnBridgeReferenceId = r.returnBridgeReferenceId;
      this.refundReferenceId = r.refundReferenceId;
      this.failureReason = r.failureReason;
      this.expectedSavingsUsd = r.expectedSavingsUsd;
      this.bridgeFeeUsd = r.bridgeFeeUsd;
      this.estimatedArrivalAt = r.estimatedArrivalAt;
      this.retryOf = r.retryOf;
    }

    public Builder swapId(String v) {
      this.swapId = v;
      return this;
    }

    public Builder user(String v) {
      this.user = v;
      return this;
    }

    public Builder tokenIn(String v) {
      this.tokenIn = v;
      return this;
    }

    public Builder tokenOut(String v) {
      this.tokenOut = v;
      return this;
    }

    public Builder amountIn(BigInteger v) {
      this.amountIn = v;
      return this;
    }

    public Builder amountOut(BigInteger v) {
      this.amountOut = v;
      return this;
    }

    public Builder sourceChainId(long v) {
      this.sourceChainId = v;
      return this;
    }

    public Builder destinationChainId(long v) {
      this.destinationChainId = v;
      return this;
    }

    public Builder initiatedAt(long v) {
      this.initiatedAt = v;
      return this;
    }

    public Builder completedAt(long v) {
      this.completedAt = v;
      return this;
    }

    public Builder deadline(long v) {
      this.deadline = v;
      return this;
    }

    public Builder status(SwapStatus v) {
      this.status = v;
      return this;
    }

    public Builder bridgeReferenceId(String v) {
      this.bridgeReferenceId = v;
      return this;
    }

    public Builder returnBridgeReferenceId(String v) {
      this.returnBridgeReferenceId = v;
      return this;
    }

    public Builder refundReferenceId(String v) {
      this.refundReferenceId = v;
      return this;
    }

    public Builder failureReason(String v) {
      this.failureReason = v;
      return this;
    }

    public Builder expectedSavingsUsd(BigDecimal v) {
      this.expectedSavingsUsd = v;
      return this;
    }

    public Builder bridgeFeeUsd(BigDecimal v) {
      this.bridgeFeeUsd = v;
      return this;
    }

    public Builder estimatedArrivalAt(long v) {
      this.estimatedArrivalAt = v;
      return this;
    }

    public Builder retryOf(String v) {
      this.retryOf = v;
      return this;
    }

    public SwapRecord build() {
      return new SwapRecord(
          swapId,
          user,
          tokenIn,
          tokenOut,
          amountIn,
          amountOut == null ? BigInteger.ZERO : amountOut,
          sourceChainId,
          destinationChainId,
          initiatedAt,
          completedAt,
          deadline,
          status,
          bridgeReferenceId,
          returnBridgeReferenceId,
          refundReferenceId,
          failureReason,
          expectedSavingsUsd == null ? BigDecimal.ZERO : expectedSavingsUsd,
          bridgeFeeUsd == null ? BigDecimal.ZERO : bridgeFeeUsd,
          estimatedArrivalAt,
          retryOf);
    }
  }
}
