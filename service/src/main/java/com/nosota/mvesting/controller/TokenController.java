package com.nosota.mvesting.controller;

import com.nosota.mvesting.api.TokenApi;
import com.nosota.mvesting.api.request.TokenApproveRequest;
import com.nosota.mvesting.api.request.TokenDepositRequest;
import com.nosota.mvesting.api.response.TokenAccountResponse;
import com.nosota.mvesting.model.TokenAccount;
import com.nosota.mvesting.service.TokenAccountLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the token ledger.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class TokenController implements TokenApi {

    private final TokenAccountLedger tokenAccountLedger;

    @Override
    public ResponseEntity<TokenAccountResponse> deposit(String address, TokenDepositRequest request) throws Exception {
        log.info("Token deposit request: address={}, amount={}, externalReference={}",
                address, request.amount(), request.externalReference());
        TokenAccount account = tokenAccountLedger.deposit(address, request.amount(), request.externalReference());
        return ResponseEntity.ok(toResponse(account));
    }

    @Override
    public ResponseEntity<TokenAccountResponse> approve(String caller, String address, TokenApproveRequest request)
            throws Exception {
        log.info("Token approve request: caller={}, owner={}, allowance={}", caller, address, request.allowance());
        TokenAccount account = tokenAccountLedger.approve(caller, address, request.allowance());
        return ResponseEntity.ok(toResponse(account));
    }

    @Override
    public ResponseEntity<TokenAccountResponse> getAccount(String address) throws Exception {
        return ResponseEntity.ok(toResponse(tokenAccountLedger.getAccount(address)));
    }

    private TokenAccountResponse toResponse(TokenAccount account) {
        return new TokenAccountResponse(account.getAddress(), account.getBalance(), account.getAllowance());
    }
}
