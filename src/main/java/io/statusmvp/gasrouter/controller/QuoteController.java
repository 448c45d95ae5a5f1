package io.statusmvp.gasrouter.controller;

import io.statusmvp.gasrouter.model.OptimizationQuote;
import io.statusmvp.gasrouter.model.SwapIntent;
import io.statusmvp.gasrouter.service.QuoteService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/api/v1/optimizer", produces = MediaType.APPLICATION_JSON_VALUE)
public class QuoteController {
  private final QuoteService quotes;

  public QuoteController(QuoteService quotes) {
    this.quotes = quotes;
  }

  /** Side-effect free; safe to call speculatively before submitting. */
  @PostMapping("/quote")
  public Mono<OptimizationQuote> quote(@Valid @RequestBody SwapIntent intent) {
    return Mono.fromCallable(() -> quotes.quote(intent)).subscribeOn(Schedulers.boundedElastic());
  }
}
