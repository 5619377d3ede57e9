package com.nosota.mvesting.api;

import com.nosota.mvesting.api.request.TokenApproveRequest;
import com.nosota.mvesting.api.request.TokenDepositRequest;
import com.nosota.mvesting.api.response.TokenAccountResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of TokenApi.
 *
 * <p>Not a Spring @Component; register it manually next to {@link VestingClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class TokenClient implements TokenApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<TokenAccountResponse> deposit(String address, TokenDepositRequest request) {
        log.debug("Calling deposit: address={}, amount={}, externalReference={}",
                address, request.amount(), request.externalReference());

        return webClient.post()
                .uri("/api/v1/tokens/{address}/deposit", address)
                .bodyValue(request)
                .retrieve()
                .toEntity(TokenAccountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TokenAccountResponse> approve(String caller, String address, TokenApproveRequest request) {
        log.debug("Calling approve: caller={}, address={}, allowance={}", caller, address, request.allowance());

        return webClient.post()
                .uri("/api/v1/tokens/{address}/approve", address)
                .header(VestingApi.CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(TokenAccountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TokenAccountResponse> getAccount(String address) {
        log.debug("Calling getAccount: address={}", address);

        return webClient.get()
                .uri("/api/v1/tokens/{address}", address)
                .retrieve()
                .toEntity(TokenAccountResponse.class)
                .block();
    }
}
