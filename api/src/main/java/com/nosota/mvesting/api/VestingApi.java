package com.nosota.mvesting.api;

import com.nosota.mvesting.api.dto.PagedResponse;
import com.nosota.mvesting.api.dto.VestingEventDTO;
import com.nosota.mvesting.api.request.AddRecipientsRequest;
import com.nosota.mvesting.api.request.ClaimRequest;
import com.nosota.mvesting.api.request.SeizeLockedTokensRequest;
import com.nosota.mvesting.api.request.UpdateSafeAddressRequest;
import com.nosota.mvesting.api.response.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Vesting API interface.
 *
 * <p>Defines REST endpoints for the vesting escrow:
 * <ul>
 *   <li>Recipient administration (add, pause, unpause, terminate)</li>
 *   <li>Claims by recipients</li>
 *   <li>Escrow termination, seizure of locked balances, dust sweep, safe address</li>
 *   <li>Queries (recipient valuation, escrow summary, audit trail)</li>
 * </ul>
 *
 * <p>The caller is identified by the {@value #CALLER_HEADER} header. Administrative
 * operations are rejected with 403 unless the caller is the configured administrator.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>VestingController - in service module (server-side implementation)</li>
 *   <li>VestingClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/vesting")
public interface VestingApi {

    String CALLER_HEADER = "X-Caller-Address";

    // ==================== Recipient Administration ====================

    /**
     * Pulls the batch funding from the administrator and creates the recipients.
     *
     * @param caller  Administrator address
     * @param request Parallel lists of schedules plus the total funding
     * @return Allocation summary
     */
    @PostMapping("/recipients")
    ResponseEntity<AddRecipientsResponse> addRecipients(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid AddRecipientsRequest request) throws Exception;

    /**
     * Freezes the recipient's vesting progress at the current instant.
     */
    @PostMapping("/recipients/{address}/pause")
    ResponseEntity<RecipientResponse> pause(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable("address") String address) throws Exception;

    /**
     * Resumes vesting; the paused duration is added to the cliff and the end time.
     */
    @PostMapping("/recipients/{address}/unpause")
    ResponseEntity<RecipientResponse> unpause(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable("address") String address) throws Exception;

    /**
     * Terminates a single recipient: pays out the claimable amount and sweeps the rest
     * of the entitlement to the safe address.
     */
    @PostMapping("/recipients/{address}/terminate")
    ResponseEntity<RecipientTerminationResponse> terminateRecipient(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable("address") String address) throws Exception;

    /**
     * Returns the recipient schedule and its valuation at the current clock reading.
     */
    @GetMapping("/recipients/{address}")
    ResponseEntity<RecipientResponse> getRecipient(@PathVariable("address") String address) throws Exception;

    // ==================== Claims ====================

    /**
     * Transfers {@code amount} of vested tokens to the caller.
     *
     * @param caller  Recipient address
     * @param request Amount to claim
     * @return Claim result
     */
    @PostMapping("/claims")
    ResponseEntity<ClaimResponse> claim(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid ClaimRequest request) throws Exception;

    // ==================== Escrow ====================

    /**
     * Terminates the escrow. One-way.
     */
    @PostMapping("/escrow/terminate")
    ResponseEntity<EscrowResponse> terminateEscrow(@RequestHeader(CALLER_HEADER) String caller) throws Exception;

    /**
     * Sweeps the frozen locked balances of the given recipients to the safe address.
     * Each recipient is seized at most once.
     */
    @PostMapping("/escrow/seize")
    ResponseEntity<SeizureResponse> seizeLockedTokens(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid SeizeLockedTokensRequest request) throws Exception;

    /**
     * Sweeps accumulated dust to the safe address.
     */
    @PostMapping("/escrow/dust/transfer")
    ResponseEntity<DustTransferResponse> transferDust(@RequestHeader(CALLER_HEADER) String caller) throws Exception;

    /**
     * Replaces the destination for seized funds and dust.
     */
    @PutMapping("/escrow/safe-address")
    ResponseEntity<EscrowResponse> updateSafeAddress(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody @Valid UpdateSafeAddressRequest request) throws Exception;

    /**
     * Returns the escrow aggregate.
     */
    @GetMapping("/escrow")
    ResponseEntity<EscrowResponse> getEscrow();

    // ==================== Audit Trail ====================

    /**
     * Returns the audit trail, newest first.
     *
     * @param recipient Optional recipient filter
     * @param page      Page number (0-based)
     * @param size      Page size
     */
    @GetMapping("/events")
    ResponseEntity<PagedResponse<VestingEventDTO>> getEvents(
            @RequestParam(value = "recipient", required = false) String recipient,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "50") @Positive int size);
}
