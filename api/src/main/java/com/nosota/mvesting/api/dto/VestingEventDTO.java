package com.nosota.mvesting.api.dto;

import com.nosota.mvesting.api.model.VestingEventType;

import java.time.LocalDateTime;

/**
 * Entry of the vesting audit trail.
 *
 * @param id               Event id, increasing with commit order
 * @param type             What happened
 * @param recipientAddress Affected recipient, null for escrow-wide events
 * @param counterparty     Other party of a fund movement (payer, beneficiary or safe address)
 * @param amount           Amount moved or allocated, null when nothing moved
 * @param occurredAt       Logical clock reading (epoch seconds)
 * @param createdAt        Wall-clock time the event was stored
 */
public record VestingEventDTO(
        Long id,
        VestingEventType type,
        String recipientAddress,
        String counterparty,
        Long amount,
        Long occurredAt,
        LocalDateTime createdAt
) {
}
