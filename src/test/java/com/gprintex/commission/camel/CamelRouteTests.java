package com.gprintex.commission.camel;

import com.gprintex.commission.client.NotificationClient;
import com.gprintex.commission.config.TestDataSourceConfig;
import com.gprintex.commission.domain.BatchResult;
import com.gprintex.commission.domain.CommissionApprovedEvent;
import com.gprintex.commission.handler.ApprovalEventRelay;
import com.gprintex.commission.service.InvoiceSyncService;
import io.vavr.control.Try;
import org.apache.camel.CamelContext;
import org.apache.camel.EndpointInject;
import org.apache.camel.ProducerTemplate;
import org.apache.camel.builder.AdviceWith;
import org.apache.camel.component.mock.MockEndpoint;
import org.apache.camel.test.spring.junit5.CamelSpringBootTest;
import org.apache.camel.test.spring.junit5.UseAdviceWith;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Integration tests for Camel routes.
 */
@CamelSpringBootTest
@SpringBootTest
@UseAdviceWith
@ActiveProfiles("test")
@Import(TestDataSourceConfig.class)
class CamelRouteTests {

    @Autowired
    private CamelContext camelContext;

    @Autowired
    private ProducerTemplate producerTemplate;

    @MockBean
    private NotificationClient notificationClient;

    @MockBean
    private InvoiceSyncService invoiceSyncService;

    @EndpointInject("mock:notified")
    private MockEndpoint mockNotified;

    @Test
    void approvedEvent_shouldReachNotificationHandler() throws Exception {
        AdviceWith.adviceWith(camelContext, "commission-approved-notification", a -> a.weaveAddLast().to("mock:notified"));
        camelContext.start();

        mockNotified.expectedMessageCount(1);
        mockNotified.expectedBodiesReceived(false);

        producerTemplate.sendBody(ApprovalEventRelay.APPROVED_ENDPOINT, new CommissionApprovedEvent(
            1L, 999L, new BigDecimal("100.00"), "manager", LocalDateTime.now()));

        mockNotified.assertIsSatisfied();
    }

    @Test
    void invoiceSync_shouldReturnBatchResult() {
        camelContext.start();
        var batch = BatchResult.start("billing-sync").withCounts(3, 2, 1, 0, List.of());
        when(invoiceSyncService.syncPaidInvoices()).thenReturn(Try.success(batch));

        var result = producerTemplate.requestBody(InvoiceSyncRoute.SYNC_ENDPOINT, (Object) null);

        assertEquals(batch, result);
    }

    @Test
    void invoiceSync_failureReturnsCause() {
        camelContext.start();
        var failure = new IllegalStateException("billing down");
        when(invoiceSyncService.syncPaidInvoices()).thenReturn(Try.failure(failure));

        var result = producerTemplate.requestBody(InvoiceSyncRoute.SYNC_ENDPOINT, (Object) null);

        assertSame(failure, result);
    }

    @Test
    void syncTimer_isNotStartedWhenSyncDisabled() {
        camelContext.start();

        assertFalse(camelContext.getRouteController().getRouteStatus("invoice-sync-timer").isStarted());
    }
}
