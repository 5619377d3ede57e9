package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.EscrowStatus;
import com.nosota.mvesting.dto.AllocationResult;
import com.nosota.mvesting.model.Escrow;
import com.nosota.mvesting.model.Recipient;
import com.nosota.mvesting.repository.RecipientRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.lenient;

/**
 * Wires the vesting services against an in-memory recipient table, a single escrow row,
 * a settable clock and a mocked token ledger.
 */
@ExtendWith(MockitoExtension.class)
abstract class VestingServiceTestSupport {

    protected static final String ADMIN = "0x" + "a".repeat(40);
    protected static final String SAFE = "0x" + "5".repeat(40);
    protected static final String ALICE = "0x" + "1".repeat(40);
    protected static final String BOB = "0x" + "2".repeat(40);
    protected static final String STRANGER = "0x" + "9".repeat(40);

    /**
     * Vesting start used by the scenarios; the clock starts 100 seconds earlier.
     */
    protected static final long T = 1_700_000_000L;

    @Mock
    protected RecipientRepository recipientRepository;

    @Mock
    protected EscrowService escrowService;

    @Mock
    protected VestingEventService vestingEventService;

    @Mock
    protected TokenLedger tokenLedger;

    @Mock
    protected VestingClock vestingClock;

    protected final Map<String, Recipient> recipients = new LinkedHashMap<>();
    protected final AtomicLong now = new AtomicLong(T - 100);
    protected Escrow escrow;

    protected VestingScheduleCalculator scheduleCalculator;
    protected VestingQueryService vestingQueryService;
    protected AllocationService allocationService;
    protected RecipientLifecycleService recipientLifecycleService;
    protected EscrowTerminationService escrowTerminationService;

    @BeforeEach
    void wireServices() throws Exception {
        escrow = new Escrow();
        escrow.setId(Escrow.SINGLETON_ID);
        escrow.setStatus(EscrowStatus.ACTIVE);
        escrow.setSafeAddress(SAFE);
        escrow.setEscrowAddress("0x" + "e".repeat(40));

        lenient().when(vestingClock.now()).thenAnswer(invocation -> now.get());
        lenient().when(escrowService.lockEscrow()).thenAnswer(invocation -> escrow);
        lenient().when(escrowService.getEscrow()).thenAnswer(invocation -> escrow);
        lenient().when(escrowService.save(any(Escrow.class))).thenAnswer(invocation -> invocation.getArgument(0));

        lenient().when(recipientRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(recipients.get(invocation.<String>getArgument(0))));
        lenient().when(recipientRepository.save(any(Recipient.class))).thenAnswer(invocation -> {
            Recipient recipient = invocation.getArgument(0);
            recipients.put(recipient.getAddress(), recipient);
            return recipient;
        });
        lenient().when(recipientRepository.saveAll(anyList())).thenAnswer(invocation -> {
            List<Recipient> saved = invocation.getArgument(0);
            saved.forEach(recipient -> recipients.put(recipient.getAddress(), recipient));
            return saved;
        });
        lenient().when(recipientRepository.findByAddressIn(anyCollection())).thenAnswer(invocation -> {
            Collection<String> addresses = invocation.getArgument(0);
            List<Recipient> found = new ArrayList<>();
            addresses.stream().map(recipients::get).filter(Objects::nonNull).forEach(found::add);
            return found;
        });

        scheduleCalculator = new VestingScheduleCalculator();
        RecipientStatusStateMachine statusStateMachine = new RecipientStatusStateMachine();
        AccessControlService accessControlService = new AccessControlService(new ConfiguredAdministratorPolicy(ADMIN));

        vestingQueryService = new VestingQueryService(recipientRepository, escrowService, scheduleCalculator,
                statusStateMachine, vestingClock);
        allocationService = new AllocationService(recipientRepository, escrowService, vestingQueryService,
                scheduleCalculator, accessControlService, vestingEventService, tokenLedger, vestingClock);
        recipientLifecycleService = new RecipientLifecycleService(recipientRepository, escrowService,
                vestingQueryService, scheduleCalculator, statusStateMachine, accessControlService,
                vestingEventService, tokenLedger, vestingClock);
        escrowTerminationService = new EscrowTerminationService(recipientRepository, escrowService,
                vestingQueryService, scheduleCalculator, accessControlService, vestingEventService,
                tokenLedger, vestingClock);
    }

    /**
     * Adds one fully funded recipient: start T, end T+1000, cliff 100, total 1000.
     */
    protected AllocationResult addStandardRecipient(String address) throws Exception {
        return allocationService.addRecipients(ADMIN,
                List.of(address), List.of(1000L), List.of(T), List.of(T + 1000), List.of(100L), 1000L);
    }

    protected void advanceTo(long instant) {
        now.set(instant);
    }
}
