package io.statusmvp.gasrouter.controller;

import io.statusmvp.gasrouter.auth.CallerTokenService;
import io.statusmvp.gasrouter.model.ChainConfig;
import io.statusmvp.gasrouter.model.GasPriceSample;
import io.statusmvp.gasrouter.model.GasPriceTrend;
import io.statusmvp.gasrouter.model.GasPriceView;
import io.statusmvp.gasrouter.model.request.GasPriceUpdateRequest;
import io.statusmvp.gasrouter.service.ChainRegistry;
import io.statusmvp.gasrouter.service.GasPriceOracle;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
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
@RequestMapping(path = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
public class GasPriceController {
  private final GasPriceOracle oracle;
  private final ChainRegistry chains;
  private final CallerTokenService tokens;

  public GasPriceController(GasPriceOracle oracle, ChainRegistry chains, CallerTokenService tokens) {
    this.oracle = oracle;
    this.chains = chains;
    this.tokens = tokens;
  }

  @GetMapping("/chains")
  public Mono<List<ChainConfig>> chains() {
    return Mono.fromCallable(chains::all).subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/gas/{chainId}")
  public Mono<GasPriceView> gasPrice(@PathVariable("chainId") long chainId) {
    return Mono.fromCallable(() -> oracle.view(chainId)).subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/gas/{chainId}/usd")
  public Mono<Map<String, Object>> gasPriceUsd(@PathVariable("chainId") long chainId) {
    return Mono.fromCallable(
            () -> {
              BigDecimal usd = oracle.getUsd(chainId);
              return Map.<String, Object>of("chainId", chainId, "usdPerGasUnit", usd.toPlainString());
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/gas/{chainId}/trend")
  public Mono<GasPriceTrend> trend(
      @PathVariable("chainId") long chainId,
      @RequestParam(value = "window", required = false, defaultValue = "24") int window) {
    return Mono.fromCallable(() -> oracle.trend(chainId, window))
        .subscribeOn(Schedulers.boundedElastic());
  }

  /** Keeper-only. */
  @PostMapping("/gas/{chainId}")
  public Mono<GasPriceSample> update(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @PathVariable("chainId") long chainId,
      @Valid @RequestBody GasPriceUpdateRequest req) {
    return Mono.fromCallable(
            () -> oracle.update(tokens.resolve(authorization), chainId, req.priceWei()))
        .subscribeOn(Schedulers.boundedElastic());
  }
}
