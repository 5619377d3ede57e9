package com.nosota.mvesting.api;

import com.nosota.mvesting.api.request.TokenApproveRequest;
import com.nosota.mvesting.api.request.TokenDepositRequest;
import com.nosota.mvesting.api.response.TokenAccountResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Token ledger API interface.
 *
 * <p>Exposes the in-process token ledger the escrow pulls funding from and pushes
 * claims, sweeps and dust to:
 * <ul>
 *   <li>Depositing tokens into an account from an external source</li>
 *   <li>Approving the amount the escrow may pull from an account</li>
 *   <li>Reading balance and allowance</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>TokenController - in service module (server-side implementation)</li>
 *   <li>TokenClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/tokens")
public interface TokenApi {

    /**
     * Credits tokens to an account from an external source.
     */
    @PostMapping("/{address}/deposit")
    ResponseEntity<TokenAccountResponse> deposit(
            @PathVariable("address") String address,
            @RequestBody @Valid TokenDepositRequest request) throws Exception;

    /**
     * Sets the amount the escrow may pull from the account. Only the owner may approve.
     */
    @PostMapping("/{address}/approve")
    ResponseEntity<TokenAccountResponse> approve(
            @RequestHeader(VestingApi.CALLER_HEADER) String caller,
            @PathVariable("address") String address,
            @RequestBody @Valid TokenApproveRequest request) throws Exception;

    /**
     * Returns balance and allowance of an account. Unknown accounts have zero balance.
     */
    @GetMapping("/{address}")
    ResponseEntity<TokenAccountResponse> getAccount(@PathVariable("address") String address) throws Exception;
}
