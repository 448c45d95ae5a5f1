package io.statusmvp.gasrouter.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.statusmvp.gasrouter.model.bridge.BridgeQuote;
import io.statusmvp.gasrouter.model.bridge.BridgeTransferRequest;
import io.statusmvp.gasrouter.model.bridge.BridgeTransferStatus;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class HttpBridgeClientTest {
  private static final String BASE = "https://bridge.example";

  private static HttpBridgeClient client(
      HttpStatus status, String body, AtomicReference<ClientRequest> seen) {
    WebClient webClient =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  if (seen != null) seen.set(request);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                          .body(body)
                          .build());
                })
            .build();
    return new HttpBridgeClient(webClient, BASE + "/", "k-123", 2000);
  }

  @Test
  void quoteParsesFeeAndTime() {
    AtomicReference<ClientRequest> seen = new AtomicReference<>();
    BridgeQuote quote =
        client(HttpStatus.OK, "{\"feeUsd\":\"1.25\",\"estimatedTimeSeconds\":180}", seen)
            .quote("USDC", BigInteger.valueOf(5_000_000), 10);

    assertEquals(0, new BigDecimal("1.25").compareTo(quote.feeUsd()));
    assertEquals(180, quote.estimatedTimeSeconds());
    assertTrue(seen.get().url().toString().startsWith(BASE + "/quote?"));
    assertEquals("k-123", seen.get().headers().getFirst("x-api-key"));
  }

  @Test
  void transferReturnsReferenceId() {
    String ref =
        client(HttpStatus.OK, "{\"referenceId\":\"dep-42\"}", null)
            .transfer(
                new BridgeTransferRequest(
                    "0xa", "0xb", "USDC", BigInteger.TEN, 10, "0xswap"));
    assertEquals("dep-42", ref);
  }

  @Test
  void statusParsesFlags() {
    BridgeTransferStatus status =
        client(HttpStatus.OK, "{\"completed\":true,\"failed\":false,\"filledAmount\":\"99\"}", null)
            .status("dep-42");
    assertTrue(status.completed());
    assertEquals(BigInteger.valueOf(99), status.filledAmount());
  }

  @Test
  void clientErrorsMapToTypedReasons() {
    BridgeException e =
        assertThrows(
            BridgeException.class,
            () ->
                client(HttpStatus.BAD_REQUEST, "{\"error\":\"AMOUNT_OUT_OF_BOUNDS\"}", null)
                    .quote("USDC", BigInteger.ONE, 10));
    assertEquals(BridgeException.Reason.AMOUNT_OUT_OF_BOUNDS, e.getReason());

    e =
        assertThrows(
            BridgeException.class,
            () ->
                client(HttpStatus.UNPROCESSABLE_ENTITY, "{\"error\":\"unsupported_chain\"}", null)
                    .status("dep-1"));
    assertEquals(BridgeException.Reason.UNSUPPORTED_CHAIN, e.getReason());

    e =
        assertThrows(
            BridgeException.class,
            () -> client(HttpStatus.BAD_GATEWAY, "{}", null).status("dep-1"));
    assertEquals(BridgeException.Reason.TRANSPORT, e.getReason());
  }

  @Test
  void missingBaseUrlIsTransportFailure() {
    HttpBridgeClient unconfigured = new HttpBridgeClient(WebClient.builder().build(), "", "", 2000);
    BridgeException e =
        assertThrows(BridgeException.class, () -> unconfigured.status("dep-1"));
    assertEquals(BridgeException.Reason.TRANSPORT, e.getReason());
  }
}
