package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.CostBreakdown;
import io.statusmvp.gasrouter.model.OptimalChain;
import io.statusmvp.gasrouter.model.OptimizationOutcome;
import io.statusmvp.gasrouter.model.OptimizationQuote;
import io.statusmvp.gasrouter.model.OptimizerSettings;
import io.statusmvp.gasrouter.model.SavingsCriteria;
import io.statusmvp.gasrouter.model.SwapIntent;
import io.statusmvp.gasrouter.model.UserPreferences;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Side-effect-free optimization quote. A stale or unreachable price source degrades to
 * {@code shouldOptimize = false} with the error code as reason instead of failing the request.
 */
@Service
public class QuoteService {
  private static final Logger log = LoggerFactory.getLogger(QuoteService.class);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  public static final String REASON_OPTIMIZATION_DISABLED = "OPTIMIZATION_DISABLED";

  private final CostModel costModel;
  private final OptimizerSettingsService settings;
  private final UserPreferencesService preferences;
  private final OptimizerMetrics metrics;

  public QuoteService(
      CostModel costModel,
      OptimizerSettingsService settings,
      UserPreferencesService preferences,
      OptimizerMetrics metrics) {
    this.costModel = costModel;
    this.settings = settings;
    this.preferences = preferences;
    this.metrics = metrics;
  }

  public OptimizationQuote quote(SwapIntent intent) {
    validate(intent);
    long source = costModel.sourceChainOf(intent);
    UserPreferences prefs = preferences.get(intent.user());
    OptimizerSettings snapshot = settings.snapshot();

    OptimizationQuote quote;
    try {
      if (!prefs.allowsOptimization()) {
        CostBreakdown baseline = costModel.totalCost(source, intent);
        quote = local(source, REASON_OPTIMIZATION_DISABLED, baseline);
      } else {
        SavingsCriteria criteria = preferences.criteriaFor(intent.user(), snapshot);
        quote = toQuote(costModel.findOptimalChain(intent, criteria));
      }
    } catch (OptimizerException e) {
      if (!e.isStaleness()) throw e;
      log.warn("quote for {} degraded to local execution: {}", intent.user(), e.getMessage());
      quote = local(source, e.getCode().name(), null);
    }
    metrics.quote(quote.shouldOptimize(), quote.reason());
    return quote;
  }

  static OptimizationQuote toQuote(OptimalChain optimal) {
    CostBreakdown baseline = optimal.baseline();
    CostBreakdown selected = optimal.selected();
    if (!optimal.optimized()) {
      return new OptimizationQuote(
          baseline.chainId(),
          baseline.chainId(),
          BigDecimal.ZERO,
          BigDecimal.ZERO,
          0,
          false,
          optimal.outcome().name(),
          baseline,
          baseline);
    }
    BigDecimal percent =
        optimal
            .expectedSavingsUsd()
            .multiply(HUNDRED)
            .divide(baseline.totalCostUsd(), 2, RoundingMode.DOWN);
    return new OptimizationQuote(
        baseline.chainId(),
        selected.chainId(),
        optimal.expectedSavingsUsd(),
        percent,
        selected.estimatedExecutionTimeSeconds(),
        true,
        OptimizationOutcome.OPTIMIZED.name(),
        baseline,
        selected);
  }

  private static OptimizationQuote local(long source, String reason, CostBreakdown baseline) {
    return new OptimizationQuote(
        source, source, BigDecimal.ZERO, BigDecimal.ZERO, 0, false, reason, baseline, baseline);
  }

  private static void validate(SwapIntent intent) {
    if (intent == null || intent.user() == null || intent.user().isBlank()) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_USER, "user is required");
    }
    if (intent.amountIn() == null || intent.amountIn().signum() <= 0) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_AMOUNT, "amountIn must be positive");
    }
    if (intent.tokenIn() == null
        || intent.tokenIn().isBlank()
        || intent.tokenOut() == null
        || intent.tokenOut().isBlank()) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, "tokenIn and tokenOut are required");
    }
    Integer decimals = intent.tokenInDecimals();
    if (decimals != null && (decimals < 0 || decimals > 36)) {
      throw new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, "tokenInDecimals must be within [0, 36]");
    }
  }
}
