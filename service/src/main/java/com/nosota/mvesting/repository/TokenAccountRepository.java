package com.nosota.mvesting.repository;

import com.nosota.mvesting.model.TokenAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TokenAccountRepository extends JpaRepository<TokenAccount, String> {
    /**
     * Retrieves the account and locks it for update, so concurrent pulls and pushes
     * cannot both spend the same balance.
     *
     * @param address Normalized account address
     * @return The account if it exists
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM TokenAccount a WHERE a.address = :address")
    Optional<TokenAccount> findByIdForUpdate(@Param("address") String address);
}
