package com.flagship.pawn_ledger.outbox;

import com.flagship.pawn_ledger.IntegrationTestSupport;
import com.flagship.pawn_ledger.event.VoucherPostedEvent;
import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.ledger.PostingRequest;
import com.flagship.pawn_ledger.ledger.Voucher;
import com.flagship.pawn_ledger.ledger.VoucherType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OutboxServiceTest extends IntegrationTestSupport {

    private static final int BATCH = 10_000;
    private static final int MAX_RETRIES = 5;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerService ledgerService;

    private UUID companyId;
    private Voucher voucher;

    @BeforeEach
    void setUp() {
        companyId = newCompany().getId();
        UUID cash = accountService.requireByCode(companyId, "1001").getId();
        UUID capital = accountService.requireByCode(companyId, "3001").getId();
        voucher = ledgerService.post(PostingRequest.builder()
            .companyId(companyId)
            .voucherType(VoucherType.JOURNAL)
            .voucherDate(LocalDate.of(2024, 1, 1))
            .narration("Capital introduced")
            .actor(ACTOR)
            .line(PostingRequest.Line.debit(cash, amount("1000"), null, null))
            .line(PostingRequest.Line.credit(capital, amount("1000"), null, null))
            .build());
    }

    private OutboxEvent voucherEvent() {
        List<OutboxEvent> events = outboxService.getEventsForAggregate("Voucher", voucher.getId());
        assertEquals(1, events.size());
        return events.get(0);
    }

    @Test
    @DisplayName("Posting a voucher writes one VoucherPosted event")
    void testRecord_VoucherPosted() {
        OutboxEvent event = voucherEvent();

        assertEquals(VoucherPostedEvent.EVENT_TYPE, event.getEventType());
        assertTrue(event.getPayload().contains(voucher.getId().toString()));
        assertTrue(event.getPayload().contains("\"voucher_type\":\"JOURNAL\""));
        assertNotNull(event.getSequenceNumber());
        assertFalse(event.isPublished());
        assertTrue(outboxService.countUnpublished() >= 1);
    }

    @Test
    @DisplayName("Recording outside a transaction is refused")
    void testRecord_RequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.record(VoucherPostedEvent.from(voucher)));
    }

    @Test
    @DisplayName("Relayed events are marked published")
    void testRelayBatch_MarksPublished() {
        List<UUID> sent = new ArrayList<>();

        int delivered = outboxService.relayBatch(BATCH, MAX_RETRIES, event -> sent.add(event.getAggregateId()));

        assertTrue(delivered >= 1);
        assertTrue(sent.contains(voucher.getId()));
        OutboxEvent event = voucherEvent();
        assertTrue(event.isPublished());
        assertEquals(0, event.getRetryCount());
    }

    @Test
    @DisplayName("A failed send keeps the event pending and counts the attempt")
    void testRelayBatch_FailureCountsRetry() {
        outboxService.relayBatch(BATCH, MAX_RETRIES, event -> {
            if (voucher.getId().equals(event.getAggregateId())) {
                throw new IllegalStateException("broker unavailable");
            }
        });

        OutboxEvent event = voucherEvent();
        assertFalse(event.isPublished());
        assertEquals(1, event.getRetryCount());
        assertEquals("broker unavailable", event.getLastError());
        assertFalse(event.isDeadLettered(MAX_RETRIES));
        assertTrue(event.isDeadLettered(1));
    }
}
