package com.nosota.mvesting.service;

import com.nosota.mvesting.api.dto.PagedResponse;
import com.nosota.mvesting.api.dto.VestingEventDTO;
import com.nosota.mvesting.api.model.VestingEventType;
import com.nosota.mvesting.mapper.VestingEventMapper;
import com.nosota.mvesting.model.VestingEvent;
import com.nosota.mvesting.repository.VestingEventRepository;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Audit trail of committed vesting operations.
 *
 * <p>Events are written inside the transaction of the operation they describe, so the
 * trail never contains an operation that was rolled back.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class VestingEventService {

    private final VestingEventRepository vestingEventRepository;

    public void record(@NotNull VestingEventType type, String recipientAddress, String counterparty,
                       Long amount, long occurredAt) {
        VestingEvent event = new VestingEvent();
        event.setType(type);
        event.setRecipientAddress(recipientAddress);
        event.setCounterparty(counterparty);
        event.setAmount(amount);
        event.setOccurredAt(occurredAt);
        event.setCreatedAt(LocalDateTime.now());
        vestingEventRepository.save(event);

        log.debug("Recorded vesting event: type={}, recipient={}, counterparty={}, amount={}, occurredAt={}",
                type, recipientAddress, counterparty, amount, occurredAt);
    }

    /**
     * Returns one page of the trail, newest first.
     *
     * @param recipientAddress Optional filter; matched case-insensitively
     * @param page             Page number (0-based)
     * @param size             Page size
     */
    @Transactional(readOnly = true)
    public PagedResponse<VestingEventDTO> getEvents(String recipientAddress, @Min(0) int page, @Positive int size) {
        PageRequest pageRequest = PageRequest.of(page, size);
        Page<VestingEvent> events = recipientAddress == null || recipientAddress.isBlank()
                ? vestingEventRepository.findAllByOrderByIdDesc(pageRequest)
                : vestingEventRepository.findByRecipientAddressOrderByIdDesc(
                        recipientAddress.trim().toLowerCase(Locale.ROOT), pageRequest);

        return new PagedResponse<>(
                VestingEventMapper.INSTANCE.toDTOList(events.getContent()),
                page,
                size,
                events.getTotalElements());
    }
}
