package io.statusmvp.gasrouter.controller;

import io.statusmvp.gasrouter.auth.CallerTokenService;
import io.statusmvp.gasrouter.model.UserPreferences;
import io.statusmvp.gasrouter.service.UserPreferencesService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/api/v1/preferences", produces = MediaType.APPLICATION_JSON_VALUE)
public class PreferencesController {
  private final UserPreferencesService preferences;
  private final CallerTokenService tokens;

  public PreferencesController(UserPreferencesService preferences, CallerTokenService tokens) {
    this.preferences = preferences;
    this.tokens = tokens;
  }

  @GetMapping
  public Mono<UserPreferences> get(@RequestParam("user") String user) {
    return Mono.fromCallable(() -> preferences.get(user)).subscribeOn(Schedulers.boundedElastic());
  }

  /** Only the owning user may change their preferences. */
  @PutMapping
  public Mono<UserPreferences> update(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestBody UserPreferences prefs) {
    return Mono.fromCallable(() -> preferences.update(tokens.resolve(authorization), prefs))
        .subscribeOn(Schedulers.boundedElastic());
  }
}
