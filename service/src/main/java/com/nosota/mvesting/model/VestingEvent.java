package com.nosota.mvesting.model;

import com.nosota.mvesting.api.model.VestingEventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Append-only audit record of a committed vesting operation.
 * Written in the same transaction as the operation, so rolled back operations leave no event.
 */
@Entity
@Table(name = "vesting_event")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class VestingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private VestingEventType type;

    @Column(name = "recipient_address", length = 42)
    private String recipientAddress;

    @Column(name = "counterparty", length = 42)
    private String counterparty;

    @Column(name = "amount")
    private Long amount;

    /**
     * Vesting clock reading (epoch seconds).
     */
    @Column(name = "occurred_at", nullable = false)
    private Long occurredAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
