package com.nosota.mvesting.dto;

/**
 * Outcome of a funded allocation batch.
 *
 * @param recipientCount Recipients created
 * @param totalFunding   Amount pulled from the administrator
 * @param totalAllocated Sum of the allocations
 * @param dustAdded      Funding left unallocated by this batch
 */
public record AllocationResult(
        int recipientCount,
        long totalFunding,
        long totalAllocated,
        long dustAdded
) {
}
