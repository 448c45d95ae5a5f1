package io.statusmvp.gasrouter.controller;

import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.auth.CallerTokenService;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.model.OptimizerSettings;
import io.statusmvp.gasrouter.model.request.BridgeFeeRequest;
import io.statusmvp.gasrouter.model.request.KeeperRotationRequest;
import io.statusmvp.gasrouter.model.request.ThresholdsRequest;
import io.statusmvp.gasrouter.service.ChainRegistry;
import io.statusmvp.gasrouter.service.OptimizerSettingsService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Operator surface. Every mutation requires an admin token and applies to the next evaluation. */
@RestController
@RequestMapping(path = "/api/v1/admin", produces = MediaType.APPLICATION_JSON_VALUE)
public class AdminController {
  private final ChainRegistry chains;
  private final OptimizerSettingsService settings;
  private final AccessControl access;
  private final CallerTokenService tokens;

  public AdminController(
      ChainRegistry chains,
      OptimizerSettingsService settings,
      AccessControl access,
      CallerTokenService tokens) {
    this.chains = chains;
    this.settings = settings;
    this.access = access;
    this.tokens = tokens;
  }

  @GetMapping("/settings")
  public Mono<OptimizerSettings> settings(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return Mono.fromCallable(
            () -> {
              access.requireAdmin(tokens.resolve(authorization));
              return settings.snapshot();
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PutMapping("/chains")
  public Mono<ChainConfig> upsertChain(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestBody ChainConfig config) {
    return Mono.fromCallable(() -> chains.upsert(tokens.resolve(authorization), config))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/chains/{chainId}/enable")
  public Mono<ChainConfig> enableChain(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @PathVariable("chainId") long chainId) {
    return Mono.fromCallable(() -> chains.setEnabled(tokens.resolve(authorization), chainId, true))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/chains/{chainId}/disable")
  public Mono<ChainConfig> disableChain(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @PathVariable("chainId") long chainId) {
    return Mono.fromCallable(() -> chains.setEnabled(tokens.resolve(authorization), chainId, false))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PutMapping("/thresholds")
  public Mono<OptimizerSettings> thresholds(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @Valid @RequestBody ThresholdsRequest req) {
    return Mono.fromCallable(
            () ->
                settings.updateThresholds(
                    tokens.resolve(authorization),
                    req.minSavingsBps(),
                    req.minAbsoluteSavingsUsd(),
                    req.maxBridgeTimeSeconds()))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PutMapping("/bridge-fee")
  public Mono<OptimizerSettings> bridgeFee(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @Valid @RequestBody BridgeFeeRequest req) {
    return Mono.fromCallable(
            () ->
                settings.updateBridgeFee(
                    tokens.resolve(authorization), req.baseFeeUsd(), req.feeBps()))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/pause")
  public Mono<OptimizerSettings> pause(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return Mono.fromCallable(() -> settings.setPaused(tokens.resolve(authorization), true))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/unpause")
  public Mono<OptimizerSettings> unpause(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return Mono.fromCallable(() -> settings.setPaused(tokens.resolve(authorization), false))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/keeper")
  public Mono<Map<String, Object>> rotateKeeper(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @Valid @RequestBody KeeperRotationRequest req) {
    return Mono.fromCallable(
            () -> {
              Caller caller = tokens.resolve(authorization);
              access.rotateKeeper(caller, req.keeperId());
              return Map.<String, Object>of("ok", true, "keeperId", access.currentKeeperId());
            })
        .subscribeOn(Schedulers.boundedElastic());
  }
}
