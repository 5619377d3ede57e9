package com.nosota.mvesting.api.response;

/**
 * Escrow aggregate snapshot.
 *
 * @param status               ACTIVE or TERMINATED
 * @param terminatedAt         Termination instant, null while active
 * @param safeAddress          Destination for seized funds and dust
 * @param escrowAddress        Escrow account in the token ledger
 * @param escrowBalance        Current token balance of the escrow account
 * @param totalAllocatedSupply Sum of all allocations
 * @param totalClaimed         Sum of all claims
 * @param totalSeized          Sum of all balances swept to the safe address
 * @param dust                 Funding not assigned to any recipient
 */
public record EscrowResponse(
        String status,
        Long terminatedAt,
        String safeAddress,
        String escrowAddress,
        Long escrowBalance,
        Long totalAllocatedSupply,
        Long totalClaimed,
        Long totalSeized,
        Long dust
) {
}
