package com.nosota.mvesting.service;

import com.nosota.mvesting.error.InsufficientFundsException;

/**
 * Fund movement boundary of the vesting engine.
 *
 * <p>Moves tokens between external accounts and the escrow's own account. Callers update
 * their accounting before invoking either operation.
 */
public interface TokenLedger {

    /**
     * Moves {@code amount} from {@code from} into the escrow account.
     *
     * @throws InsufficientFundsException if the balance or the allowance granted to the escrow is too low
     */
    void pull(String from, long amount) throws InsufficientFundsException;

    /**
     * Moves {@code amount} from the escrow account to {@code to}.
     *
     * @throws InsufficientFundsException if the escrow account balance is too low
     */
    void push(String to, long amount) throws InsufficientFundsException;
}
