package io.statusmvp.gasrouter.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.statusmvp.gasrouter.model.bridge.BridgeQuote;
import io.statusmvp.gasrouter.model.bridge.BridgeTransferRequest;
import io.statusmvp.gasrouter.model.bridge.BridgeTransferStatus;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Bridge gateway over HTTP.
 *
 * <p>Endpoints: {@code GET /quote}, {@code POST /transfers}, {@code GET /transfers/{ref}}. Rejections
 * carry a JSON body with a {@code code} of {@code UNSUPPORTED_CHAIN} or {@code AMOUNT_OUT_OF_BOUNDS}.
 */
@Component
public class HttpBridgeClient implements BridgeClient {
  private static final Logger log = LoggerFactory.getLogger(HttpBridgeClient.class);

  private final WebClient webClient;
  private final String baseUrl;
  private final String apiKey;
  private final Duration timeout;

  public HttpBridgeClient(
      WebClient webClient,
      @Value("${app.bridge.baseUrl:}") String baseUrl,
      @Value("${app.bridge.apiKey:}") String apiKey,
      @Value("${app.bridge.timeoutMs:12000}") long timeoutMs) {
    this.webClient = webClient;
    this.baseUrl = (baseUrl == null ? "" : baseUrl.trim()).replaceAll("/+$", "");
    this.apiKey = apiKey == null ? "" : apiKey.trim();
    this.timeout = Duration.ofMillis(Math.max(1000L, timeoutMs));
  }

  @Override
  public BridgeQuote quote(String token, BigInteger amount, long destinationChainId) {
    URI uri =
        UriComponentsBuilder.fromUriString(requireBaseUrl() + "/quote")
            .queryParam("token", token)
            .queryParam("amount", amount)
            .queryParam("destinationChainId", destinationChainId)
            .build(true)
            .toUri();
    JsonNode root = call("quote", () -> get(uri));
    JsonNode fee = root.path("feeUsd");
    if (!fee.isNumber() && !fee.isTextual()) {
      throw new BridgeException(BridgeException.Reason.TRANSPORT, "bridge quote missing feeUsd");
    }
    return new BridgeQuote(new BigDecimal(fee.asText()), root.path("estimatedTimeSeconds").asLong(0L));
  }

  @Override
  public String transfer(BridgeTransferRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("depositor", request.depositor());
    body.put("recipient", request.recipient());
    body.put("token", request.token());
    body.put("amount", request.amount().toString());
    body.put("destinationChainId", request.destinationChainId());
    body.put("message", request.message());

    URI uri = URI.create(requireBaseUrl() + "/transfers");
    JsonNode root =
        call(
            "transfer",
            () ->
                webClient
                    .post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                      if (!apiKey.isBlank()) h.set("x-api-key", apiKey);
                    })
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block());
    String ref = root.path("referenceId").asText("");
    if (ref.isBlank()) {
      throw new BridgeException(BridgeException.Reason.TRANSPORT, "bridge transfer returned no referenceId");
    }
    return ref;
  }

  @Override
  public BridgeTransferStatus status(String bridgeReferenceId) {
    URI uri =
        UriComponentsBuilder.fromUriString(requireBaseUrl() + "/transfers/{ref}")
            .buildAndExpand(bridgeReferenceId)
            .toUri();
    JsonNode root = call("status", () -> get(uri));
    String filled = root.path("filledAmount").asText("0");
    BigInteger filledAmount;
    try {
      filledAmount = new BigInteger(filled.isBlank() ? "0" : filled);
    } catch (NumberFormatException e) {
      filledAmount = BigInteger.ZERO;
    }
    return new BridgeTransferStatus(
        root.path("completed").asBoolean(false), root.path("failed").asBoolean(false), filledAmount);
  }

  private JsonNode get(URI uri) {
    return webClient
        .get()
        .uri(uri)
        .headers(h -> {
          if (!apiKey.isBlank()) h.set("x-api-key", apiKey);
        })
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .block();
  }

  private JsonNode call(String op, Supplier<JsonNode> request) {
    try {
      JsonNode root = request.get();
      if (root == null || !root.isObject()) {
        throw new BridgeException(BridgeException.Reason.TRANSPORT, "bridge " + op + " returned invalid body");
      }
      return root;
    } catch (BridgeException e) {
      throw e;
    } catch (WebClientResponseException e) {
      BridgeException.Reason reason = reasonFrom(e);
      log.warn("bridge {} rejected status={} reason={}", op, e.getStatusCode().value(), reason);
      throw new BridgeException(reason, "bridge " + op + " failed: " + e.getStatusCode().value(), e);
    } catch (Exception e) {
      log.warn("bridge {} request failed", op, e);
      throw new BridgeException(BridgeException.Reason.TRANSPORT, "bridge " + op + " failed", e);
    }
  }

  static BridgeException.Reason reasonFrom(WebClientResponseException e) {
    if (!e.getStatusCode().is4xxClientError()) return BridgeException.Reason.TRANSPORT;
    String body = e.getResponseBodyAsString();
    String upper = body == null ? "" : body.toUpperCase(Locale.ROOT);
    if (upper.contains("UNSUPPORTED_CHAIN")) return BridgeException.Reason.UNSUPPORTED_CHAIN;
    if (upper.contains("AMOUNT_OUT_OF_BOUNDS")) return BridgeException.Reason.AMOUNT_OUT_OF_BOUNDS;
    return BridgeException.Reason.TRANSPORT;
  }

  private String requireBaseUrl() {
    if (baseUrl.isBlank()) {
      throw new BridgeException(BridgeException.Reason.TRANSPORT, "app.bridge.baseUrl is not configured");
    }
    return baseUrl;
  }
}
