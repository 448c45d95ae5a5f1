package io.statusmvp.gasrouter.config;

import io.netty.channel.ChannelOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class AppConfig {

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
    return new StringRedisTemplate(cf);
  }

  /** Epoch-second source for staleness and recovery timing. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Shared by the price feed and bridge clients; each applies its own per-call timeout on top. */
  @Bean
  public WebClient webClient(
      @Value("${app.http.connectTimeoutMs:3000}") int connectTimeoutMs,
      @Value("${app.http.responseTimeoutMs:15000}") long responseTimeoutMs,
      @Value("${app.http.userAgent:gas-router-backend}") String userAgent) {
    HttpClient http =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(500, connectTimeoutMs))
            .responseTimeout(Duration.ofMillis(Math.max(1000L, responseTimeoutMs)));

    ExchangeStrategies strategies =
        ExchangeStrategies.builder()
            .codecs(c -> c.defaultCodecs().maxInMemorySize(512 * 1024))
            .build();

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(http))
        .exchangeStrategies(strategies)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
        .build();
  }

  @Bean
  public CorsWebFilter corsWebFilter(@Value("${app.cors.allowedOrigins:*}") String allowedOrigins) {
    CorsConfiguration config = new CorsConfiguration();
    config.setAllowCredentials(false);
    List<String> origins =
        allowedOrigins == null
            ? List.of()
            : Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    if (origins.isEmpty() || origins.contains("*")) {
      config.addAllowedOriginPattern("*");
    } else {
      origins.forEach(config::addAllowedOrigin);
    }
    config.setAllowedHeaders(List.of(HttpHeaders.AUTHORIZATION, HttpHeaders.CONTENT_TYPE));
    config.setAllowedMethods(
        List.of(
            HttpMethod.GET.name(),
            HttpMethod.POST.name(),
            HttpMethod.PUT.name(),
            HttpMethod.OPTIONS.name()));
    config.setMaxAge(Duration.ofHours(1));

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/api/**", config);
    return new CorsWebFilter(source);
  }
}
