package com.nosota.mvesting.api;

import com.nosota.mvesting.api.dto.PagedResponse;
import com.nosota.mvesting.api.dto.VestingEventDTO;
import com.nosota.mvesting.api.request.AddRecipientsRequest;
import com.nosota.mvesting.api.request.ClaimRequest;
import com.nosota.mvesting.api.request.SeizeLockedTokensRequest;
import com.nosota.mvesting.api.request.UpdateSafeAddressRequest;
import com.nosota.mvesting.api.response.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of VestingApi for consuming the mVesting service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class MVestingClientConfig {
 *     @Bean
 *     public WebClient mvestingWebClient(WebClient.Builder builder,
 *                                         @Value("${services.mvesting.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public VestingClient vestingClient(WebClient mvestingWebClient) {
 *         return new VestingClient(mvestingWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class VestingClient implements VestingApi {

    private static final ParameterizedTypeReference<PagedResponse<VestingEventDTO>> EVENT_PAGE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;

    @Override
    public ResponseEntity<AddRecipientsResponse> addRecipients(String caller, AddRecipientsRequest request) {
        log.debug("Calling addRecipients: caller={}, count={}, totalFunding={}",
                caller, request.addresses().size(), request.totalFunding());

        return webClient.post()
                .uri("/api/v1/vesting/recipients")
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(AddRecipientsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RecipientResponse> pause(String caller, String address) {
        log.debug("Calling pause: caller={}, recipient={}", caller, address);

        return webClient.post()
                .uri("/api/v1/vesting/recipients/{address}/pause", address)
                .header(CALLER_HEADER, caller)
                .retrieve()
                .toEntity(RecipientResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RecipientResponse> unpause(String caller, String address) {
        log.debug("Calling unpause: caller={}, recipient={}", caller, address);

        return webClient.post()
                .uri("/api/v1/vesting/recipients/{address}/unpause", address)
                .header(CALLER_HEADER, caller)
                .retrieve()
                .toEntity(RecipientResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RecipientTerminationResponse> terminateRecipient(String caller, String address) {
        log.debug("Calling terminateRecipient: caller={}, recipient={}", caller, address);

        return webClient.post()
                .uri("/api/v1/vesting/recipients/{address}/terminate", address)
                .header(CALLER_HEADER, caller)
                .retrieve()
                .toEntity(RecipientTerminationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<RecipientResponse> getRecipient(String address) {
        log.debug("Calling getRecipient: recipient={}", address);

        return webClient.get()
                .uri("/api/v1/vesting/recipients/{address}", address)
                .retrieve()
                .toEntity(RecipientResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ClaimResponse> claim(String caller, ClaimRequest request) {
        log.debug("Calling claim: caller={}, amount={}", caller, request.amount());

        return webClient.post()
                .uri("/api/v1/vesting/claims")
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(ClaimResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> terminateEscrow(String caller) {
        log.debug("Calling terminateEscrow: caller={}", caller);

        return webClient.post()
                .uri("/api/v1/vesting/escrow/terminate")
                .header(CALLER_HEADER, caller)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SeizureResponse> seizeLockedTokens(String caller, SeizeLockedTokensRequest request) {
        log.debug("Calling seizeLockedTokens: caller={}, count={}", caller, request.addresses().size());

        return webClient.post()
                .uri("/api/v1/vesting/escrow/seize")
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(SeizureResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DustTransferResponse> transferDust(String caller) {
        log.debug("Calling transferDust: caller={}", caller);

        return webClient.post()
                .uri("/api/v1/vesting/escrow/dust/transfer")
                .header(CALLER_HEADER, caller)
                .retrieve()
                .toEntity(DustTransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> updateSafeAddress(String caller, UpdateSafeAddressRequest request) {
        log.debug("Calling updateSafeAddress: caller={}, safeAddress={}", caller, request.safeAddress());

        return webClient.put()
                .uri("/api/v1/vesting/escrow/safe-address")
                .header(CALLER_HEADER, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowResponse> getEscrow() {
        log.debug("Calling getEscrow");

        return webClient.get()
                .uri("/api/v1/vesting/escrow")
                .retrieve()
                .toEntity(EscrowResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<VestingEventDTO>> getEvents(String recipient, int page, int size) {
        log.debug("Calling getEvents: recipient={}, page={}, size={}", recipient, page, size);

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/api/v1/vesting/events")
                            .queryParam("page", page)
                            .queryParam("size", size);
                    if (recipient != null) {
                        uriBuilder.queryParam("recipient", recipient);
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .toEntity(EVENT_PAGE)
                .block();
    }
}
