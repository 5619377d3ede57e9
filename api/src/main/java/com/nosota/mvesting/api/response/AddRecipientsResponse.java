package com.nosota.mvesting.api.response;

/**
 * @param recipientCount Number of recipients created
 * @param totalFunding   Amount pulled from the administrator
 * @param totalAllocated Sum of the allocated amounts
 * @param dustAdded      Part of the funding left unallocated
 */
public record AddRecipientsResponse(
        Integer recipientCount,
        Long totalFunding,
        Long totalAllocated,
        Long dustAdded
) {
}
