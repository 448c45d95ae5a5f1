package io.statusmvp.gasrouter.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.auth.CallerTokenService;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.InitiateSwapRequest;
import io.statusmvp.gasrouter.model.SwapRecord;
import io.statusmvp.gasrouter.model.SwapStatus;
import io.statusmvp.gasrouter.service.SwapOrchestrator;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

@WebFluxTest(controllers = SwapController.class)
class SwapControllerTest {
  private static final String USER = "0xd8dA6BF26964aF9D7eEd9e03E53415D37aA96045";
  private static final String SWAP_ID =
      "0x4d1e2a9f0b7c3e58a6d2f41b9c0e7a35d8b6f2c19e4a07d3b5c8e1f6a29d0b74";
  private static final String BEARER = "Bearer user-token";

  @Autowired private WebTestClient webTestClient;

  @MockBean private SwapOrchestrator orchestrator;
  @MockBean private CallerTokenService tokens;

  @BeforeEach
  void setUp() {
    given(tokens.resolve(BEARER)).willReturn(Caller.user(USER));
    given(tokens.resolve(null))
        .willThrow(new OptimizerException(OptimizerErrorCode.UNAUTHENTICATED, "missing bearer token"));
  }

  @Test
  void initiatesSwapForAuthenticatedCaller() {
    given(orchestrator.initiate(eq(Caller.user(USER)), any(InitiateSwapRequest.class)))
        .willReturn(record(SwapStatus.BRIDGING));

    webTestClient
        .post()
        .uri("/api/v1/swaps")
        .header(HttpHeaders.AUTHORIZATION, BEARER)
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(
            Map.of(
                "user", USER,
                "tokenIn", "USDC",
                "tokenOut", "WETH",
                "amountIn", new BigInteger("1000000000"),
                "destinationChainId", 10,
                "deadline", 1_700_001_200L))
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.swapId")
        .isEqualTo(SWAP_ID)
        .jsonPath("$.status")
        .isEqualTo("BRIDGING")
        .jsonPath("$.destinationChainId")
        .isEqualTo(10)
        .jsonPath("$.active")
        .doesNotExist();
  }

  @Test
  void rejectsInitiateWithoutDeadline() {
    webTestClient
        .post()
        .uri("/api/v1/swaps")
        .header(HttpHeaders.AUTHORIZATION, BEARER)
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(
            Map.of(
                "user", USER,
                "tokenIn", "USDC",
                "tokenOut", "WETH",
                "amountIn", new BigInteger("1000000000"),
                "destinationChainId", 10))
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("INVALID_ARGUMENT");

    verify(orchestrator, never()).initiate(any(), any());
  }

  @Test
  void mapsInvalidTransitionToConflict() {
    given(orchestrator.complete(Caller.user(USER), SWAP_ID))
        .willThrow(
            new OptimizerException(
                OptimizerErrorCode.INVALID_STATE_TRANSITION, "swap is not bridging back"));

    webTestClient
        .post()
        .uri("/api/v1/swaps/{id}/complete", SWAP_ID)
        .header(HttpHeaders.AUTHORIZATION, BEARER)
        .exchange()
        .expectStatus()
        .isEqualTo(409)
        .expectBody()
        .jsonPath("$.ok")
        .isEqualTo(false)
        .jsonPath("$.code")
        .isEqualTo("INVALID_STATE_TRANSITION")
        .jsonPath("$.category")
        .isEqualTo("STATE_MACHINE");
  }

  @Test
  void recoveryWithoutTokenIsUnauthenticated() {
    webTestClient
        .post()
        .uri("/api/v1/swaps/{id}/recover", SWAP_ID)
        .exchange()
        .expectStatus()
        .isUnauthorized()
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("UNAUTHENTICATED");

    verify(orchestrator, never()).emergencyRecovery(any(), any());
  }

  @Test
  void unknownSwapIsNotFound() {
    given(orchestrator.find("0xmissing"))
        .willThrow(new OptimizerException(OptimizerErrorCode.SWAP_NOT_FOUND, "swap not found"));

    webTestClient
        .get()
        .uri("/api/v1/swaps/{id}", "0xmissing")
        .exchange()
        .expectStatus()
        .isNotFound()
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("SWAP_NOT_FOUND");
  }

  @Test
  void listsActiveSwapIds() {
    given(orchestrator.activeSwapIds(USER)).willReturn(List.of(SWAP_ID));

    webTestClient
        .get()
        .uri(uriBuilder -> uriBuilder.path("/api/v1/swaps").queryParam("user", USER).build())
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$[0]")
        .isEqualTo(SWAP_ID);
  }

  private static SwapRecord record(SwapStatus status) {
    return new SwapRecord.Builder()
        .swapId(SWAP_ID)
        .user(USER)
        .tokenIn("USDC")
        .tokenOut("WETH")
        .amountIn(new BigInteger("1000000000"))
        .sourceChainId(1)
        .destinationChainId(10)
        .initiatedAt(1_700_000_000L)
        .deadline(1_700_001_200L)
        .status(status)
        .bridgeReferenceId("bridge-1")
        .expectedSavingsUsd(new BigDecimal("12.5"))
        .build();
  }
}
