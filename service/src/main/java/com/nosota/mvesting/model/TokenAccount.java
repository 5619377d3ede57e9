package com.nosota.mvesting.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Account in the in-process token ledger.
 *
 * <p>The escrow pulls batch funding from the administrator's account (bounded by both
 * balance and allowance) and pushes claims, sweeps and dust out of its own account.
 */
@Entity
@Table(name = "token_account")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TokenAccount {

    @Id
    @Column(name = "address", length = 42, updatable = false, nullable = false)
    private String address;

    @Column(name = "balance", nullable = false)
    private Long balance = 0L;

    /**
     * Amount the escrow may still pull from this account.
     */
    @Column(name = "allowance", nullable = false)
    private Long allowance = 0L;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
