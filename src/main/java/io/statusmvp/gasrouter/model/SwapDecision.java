package io.statusmvp.gasrouter.model;

/** Either a cross-chain swap record or a decision to execute on the original chain. */
public record SwapDecision(OptimizationQuote quote, SwapRecord swap) {

  public boolean executeLocally() {
    return swap == null;
  }
}
