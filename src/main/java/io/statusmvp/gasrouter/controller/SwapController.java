package io.statusmvp.gasrouter.controller;

import io.statusmvp.gasrouter.auth.CallerTokenService;
import io.statusmvp.gasrouter.model.DestinationSwapResult;
import io.statusmvp.gasrouter.model.InitiateSwapRequest;
import io.statusmvp.gasrouter.model.SwapDecision;
import io.statusmvp.gasrouter.model.SwapIntent;
import io.statusmvp.gasrouter.model.SwapRecord;
import io.statusmvp.gasrouter.service.SwapOrchestrator;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/api/v1/swaps", produces = MediaType.APPLICATION_JSON_VALUE)
public class SwapController {
  private final SwapOrchestrator orchestrator;
  private final CallerTokenService tokens;

  public SwapController(SwapOrchestrator orchestrator, CallerTokenService tokens) {
    this.orchestrator = orchestrator;
    this.tokens = tokens;
  }

  @PostMapping
  public Mono<SwapRecord> initiate(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @Valid @RequestBody InitiateSwapRequest req) {
    return Mono.fromCallable(() -> orchestrator.initiate(tokens.resolve(authorization), req))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/submit")
  public Mono<SwapDecision> submit(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @Valid @RequestBody SwapIntent intent) {
    return Mono.fromCallable(() -> orchestrator.submit(tokens.resolve(authorization), intent))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{swapId}")
  public Mono<SwapRecord> get(@PathVariable("swapId") String swapId) {
    return Mono.fromCallable(() -> orchestrator.find(swapId))
        .subscribeOn(Schedulers.boundedElastic());
  }

  /** Ids of the user's swaps that have not reached a terminal state. */
  @GetMapping
  public Mono<List<String>> active(@RequestParam("user") String user) {
    return Mono.fromCallable(() -> orchestrator.activeSwapIds(user))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{swapId}/destination-result")
  public Mono<SwapRecord> destinationResult(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @PathVariable("swapId") String swapId,
      @RequestBody DestinationSwapResult result) {
    return Mono.fromCallable(
            () -> orchestrator.handleDestinationSwap(tokens.resolve(authorization), swapId, result))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{swapId}/complete")
  public Mono<SwapRecord> complete(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @PathVariable("swapId") String swapId) {
    return Mono.fromCallable(() -> orchestrator.complete(tokens.resolve(authorization), swapId))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{swapId}/recover")
  public Mono<SwapRecord> recover(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @PathVariable("swapId") String swapId) {
    return Mono.fromCallable(
            () -> orchestrator.emergencyRecovery(tokens.resolve(authorization), swapId))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{swapId}/retry")
  public Mono<SwapRecord> retry(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @PathVariable("swapId") String swapId) {
    return Mono.fromCallable(() -> orchestrator.retry(tokens.resolve(authorization), swapId))
        .subscribeOn(Schedulers.boundedElastic());
  }
}
