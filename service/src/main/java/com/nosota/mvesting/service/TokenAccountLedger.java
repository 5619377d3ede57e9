package com.nosota.mvesting.service;

import com.nosota.mvesting.error.InsufficientFundsException;
import com.nosota.mvesting.error.InvalidAddressException;
import com.nosota.mvesting.error.UnauthorizedException;
import com.nosota.mvesting.model.TokenAccount;
import com.nosota.mvesting.repository.TokenAccountRepository;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;

/**
 * {@link TokenLedger} backed by the {@code token_account} table.
 *
 * <p>Besides pull and push for the escrow, it handles money entering the system
 * ({@link #deposit}) and allowance management ({@link #approve}), mirroring an ERC-20
 * style balance/allowance model for a single token.
 *
 * <p>Pull and push must run inside the caller's transaction, so a failed transfer rolls
 * back the vesting accounting done before it.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class TokenAccountLedger implements TokenLedger {

    private final TokenAccountRepository tokenAccountRepository;
    private final EscrowService escrowService;

    @Override
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Exception.class)
    public void pull(String from, long amount) throws InsufficientFundsException {
        TokenAccount source = tokenAccountRepository.findByIdForUpdate(from)
                .orElseThrow(() -> new InsufficientFundsException("Token account " + from + " has no balance"));

        if (source.getAllowance() < amount) {
            throw new InsufficientFundsException(String.format(
                    "Insufficient allowance for %s: allowance=%d, requested=%d", from, source.getAllowance(), amount));
        }
        if (source.getBalance() < amount) {
            throw new InsufficientFundsException(String.format(
                    "Insufficient balance for %s: balance=%d, requested=%d", from, source.getBalance(), amount));
        }

        source.setAllowance(source.getAllowance() - amount);
        source.setBalance(source.getBalance() - amount);
        source.setUpdatedAt(LocalDateTime.now());
        tokenAccountRepository.save(source);

        credit(escrowService.getEscrowAddress(), amount);

        log.info("Pulled tokens into escrow: from={}, amount={}", from, amount);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Exception.class)
    public void push(String to, long amount) throws InsufficientFundsException {
        TokenAccount escrowAccount = tokenAccountRepository.findByIdForUpdate(escrowService.getEscrowAddress())
                .orElseThrow(() -> new InsufficientFundsException("Escrow account holds no tokens"));

        if (escrowAccount.getBalance() < amount) {
            throw new InsufficientFundsException(String.format(
                    "Insufficient escrow balance: balance=%d, requested=%d", escrowAccount.getBalance(), amount));
        }

        escrowAccount.setBalance(escrowAccount.getBalance() - amount);
        escrowAccount.setUpdatedAt(LocalDateTime.now());
        tokenAccountRepository.save(escrowAccount);

        credit(to, amount);

        log.info("Pushed tokens from escrow: to={}, amount={}", to, amount);
    }

    /**
     * Credits tokens to an account from an external source (bridge, exchange, mint).
     *
     * @param address           Target account
     * @param amount            Amount to credit
     * @param externalReference Reference of the external transfer
     * @return Updated account
     */
    @Transactional(rollbackFor = Exception.class)
    public TokenAccount deposit(String address, @NotNull @Positive Long amount, String externalReference)
            throws InvalidAddressException {
        String account = Addresses.normalize(address, "Deposit");
        log.info("Processing token deposit: address={}, amount={}, externalReference={}",
                account, amount, externalReference);

        TokenAccount credited = credit(account, amount);

        log.info("Token deposit completed: address={}, balance={}", account, credited.getBalance());
        return credited;
    }

    /**
     * Replaces the amount the escrow may pull from the owner's account.
     *
     * @param caller    Caller address, must be the owner
     * @param owner     Account owner
     * @param allowance New allowance
     * @return Updated account
     * @throws UnauthorizedException if the caller is not the owner
     */
    @Transactional(rollbackFor = Exception.class)
    public TokenAccount approve(String caller, String owner, @NotNull @PositiveOrZero Long allowance)
            throws InvalidAddressException, UnauthorizedException {
        String account = Addresses.normalize(owner, "Owner");
        if (!account.equals(Addresses.normalize(caller, "Caller"))) {
            throw new UnauthorizedException("Only the owner of " + account + " may approve its allowance");
        }

        TokenAccount tokenAccount = findOrCreateForUpdate(account);
        tokenAccount.setAllowance(allowance);
        tokenAccount.setUpdatedAt(LocalDateTime.now());

        log.info("Allowance updated: owner={}, allowance={}", account, allowance);
        return tokenAccountRepository.save(tokenAccount);
    }

    /**
     * Returns the account, or an empty unsaved one for unknown addresses.
     */
    @Transactional(readOnly = true)
    public TokenAccount getAccount(String address) throws InvalidAddressException {
        String account = Addresses.normalize(address, "Account");
        return tokenAccountRepository.findById(account)
                .orElseGet(() -> newAccount(account));
    }

    public long balanceOf(String address) {
        return tokenAccountRepository.findById(address)
                .map(TokenAccount::getBalance)
                .orElse(0L);
    }

    private TokenAccount credit(String address, long amount) {
        TokenAccount target = findOrCreateForUpdate(address);
        target.setBalance(Math.addExact(target.getBalance(), amount));
        target.setUpdatedAt(LocalDateTime.now());
        return tokenAccountRepository.save(target);
    }

    private TokenAccount findOrCreateForUpdate(String address) {
        return tokenAccountRepository.findByIdForUpdate(address)
                .orElseGet(() -> newAccount(address));
    }

    private TokenAccount newAccount(String address) {
        TokenAccount account = new TokenAccount();
        account.setAddress(address);
        account.setBalance(0L);
        account.setAllowance(0L);
        account.setUpdatedAt(LocalDateTime.now());
        return account;
    }
}
