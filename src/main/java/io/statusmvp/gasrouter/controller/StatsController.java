package io.statusmvp.gasrouter.controller;

import io.statusmvp.gasrouter.model.SwapStats;
import io.statusmvp.gasrouter.service.SwapOrchestrator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(path = "/api/v1/stats", produces = MediaType.APPLICATION_JSON_VALUE)
public class StatsController {
  private final SwapOrchestrator orchestrator;

  public StatsController(SwapOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping
  public Mono<SwapStats> global() {
    return Mono.fromSupplier(orchestrator::stats);
  }

  @GetMapping("/chains/{chainId}")
  public Mono<SwapStats> chain(@PathVariable("chainId") long chainId) {
    return Mono.fromSupplier(() -> orchestrator.stats(chainId));
  }
}
