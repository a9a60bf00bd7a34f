package com.gprintex.commission.handler;

import com.gprintex.commission.client.NotificationClient;
import com.gprintex.commission.domain.AccountExecutive;
import com.gprintex.commission.domain.BonusBreakdown;
import com.gprintex.commission.domain.CapResult;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionApprovedEvent;
import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.repository.AccountExecutiveRepository;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import org.apache.camel.ProducerTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommissionEventHandlerTests {

    @Mock private CommissionRepository commissions;
    @Mock private InvoiceRepository invoices;
    @Mock private ContractRepository contracts;
    @Mock private AccountExecutiveRepository accountExecutives;
    @Mock private NotificationClient notificationClient;
    @Mock private ProducerTemplate producerTemplate;

    private CommissionEventHandler handler;

    private final CommissionApprovedEvent event = new CommissionApprovedEvent(
        500L, 7L, new BigDecimal("1250.00"), "manager", LocalDateTime.of(2025, 6, 1, 9, 0));

    @BeforeEach
    void setUp() {
        handler = new CommissionEventHandler(commissions, invoices, contracts, accountExecutives, notificationClient);
    }

    @Test
    void onApproved_notifiesAeWithClientName() {
        when(accountExecutives.findById(7L))
            .thenReturn(Optional.of(AccountExecutive.of("Dana Reyes", "dana@example.com").withId(7L)));
        when(commissions.findById(500L)).thenReturn(Optional.of(Commission.pending(
            42L, 7L, null, new BigDecimal("1250.00"), CapResult.uncapped(new BigDecimal("1250.00")), BonusBreakdown.none(),
            LocalDateTime.of(2025, 5, 1, 9, 0))));
        when(invoices.findById(42L)).thenReturn(Optional.of(Invoice.of(3L, new BigDecimal("12500"), LocalDate.of(2025, 5, 1))));
        when(contracts.findById(3L)).thenReturn(Optional.of(Contract.of("Acme Corp", 7L, new BigDecimal("50000"))));
        when(notificationClient.notifyApproval(eq(500L), any(), eq(new BigDecimal("1250.00")), eq("Acme Corp")))
            .thenReturn(true);

        assertTrue(handler.onApproved(event));
        verify(notificationClient).notifyApproval(500L,
            new NotificationClient.AeInfo(7L, "Dana Reyes", "dana@example.com"), new BigDecimal("1250.00"), "Acme Corp");
    }

    @Test
    void onApproved_unknownAeIsNotNotified() {
        when(accountExecutives.findById(7L)).thenReturn(Optional.empty());

        assertFalse(handler.onApproved(event));
        verifyNoInteractions(notificationClient);
    }

    @Test
    void onApproved_notificationFailureIsSwallowedAndReported() {
        when(accountExecutives.findById(7L))
            .thenReturn(Optional.of(AccountExecutive.of("Dana Reyes", "dana@example.com").withId(7L)));
        when(commissions.findById(500L)).thenReturn(Optional.empty());
        when(notificationClient.notifyApproval(anyLong(), any(), any(), anyString()))
            .thenThrow(new IllegalStateException("connection refused"));

        assertFalse(handler.onApproved(event));
    }

    @Test
    void relay_sendsEventToApprovalQueue() {
        var relay = new ApprovalEventRelay(producerTemplate);

        relay.onApproved(event);

        verify(producerTemplate).sendBody(ApprovalEventRelay.APPROVED_ENDPOINT, event);
    }

    @Test
    void relay_queueFailureDoesNotPropagate() {
        var relay = new ApprovalEventRelay(producerTemplate);
        doThrow(new IllegalStateException("camel stopped")).when(producerTemplate).sendBody(anyString(), any());

        assertDoesNotThrow(() -> relay.onApproved(event));
    }
}
