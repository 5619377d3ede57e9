package com.nosota.mvesting.api.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request for funding the escrow and allocating vesting schedules to a batch of recipients.
 *
 * <p>The lists are parallel: entry {@code i} of every list describes recipient {@code i}.
 * All lists must have the same, non-zero length. Times are epoch seconds.
 *
 * <p>{@code totalFunding} is pulled from the administrator's token account before the
 * recipients are stored. Whatever is left after the allocations becomes escrow dust.
 *
 * @param addresses      Recipient addresses (0x-prefixed, 40 hex digits)
 * @param amounts        Total vesting amount per recipient
 * @param startTimes     Vesting start per recipient
 * @param endTimes       Vesting end per recipient
 * @param cliffDurations Cliff duration in seconds per recipient
 * @param totalFunding   Amount pulled from the administrator for this batch
 */
public record AddRecipientsRequest(
        @NotEmpty(message = "At least one recipient is required")
        List<String> addresses,

        @NotEmpty(message = "Amounts are required")
        List<Long> amounts,

        @NotEmpty(message = "Start times are required")
        List<Long> startTimes,

        @NotEmpty(message = "End times are required")
        List<Long> endTimes,

        @NotEmpty(message = "Cliff durations are required")
        List<Long> cliffDurations,

        @NotNull(message = "Total funding is required")
        @Positive(message = "Total funding must be positive")
        Long totalFunding
) {
}
