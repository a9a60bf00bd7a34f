package com.gprintex.commission.service;

import com.gprintex.commission.client.NotificationClient;
import com.gprintex.commission.config.TestDataSourceConfig;
import com.gprintex.commission.domain.AccountExecutive;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.PaymentTerms;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the engine with the non-default policies. With pending commissions counted toward the cap, the cap
 * is applied once at calculation and approval leaves the figures untouched.
 */
@SpringBootTest(properties = {
    "commission.ote.counting-policy=include-pending",
    "commission.bonus.multi-year-policy=per-additional-year"
})
@ActiveProfiles("test")
@Import(TestDataSourceConfig.class)
class IncludePendingCapIntegrationTests {

    @Autowired private AccountExecutiveService accountExecutiveService;
    @Autowired private CommissionConfigService configService;
    @Autowired private ContractService contractService;
    @Autowired private InvoiceService invoiceService;
    @Autowired private CommissionEngine engine;
    @Autowired private CommissionRepository commissionRepository;
    @Autowired private InvoiceRepository invoiceRepository;
    @Autowired private JdbcTemplate jdbcTemplate;
    @Autowired private BonusCalculator bonusCalculator;

    @MockBean
    private NotificationClient notificationClient;

    private Long aeId;
    private Long contractId;

    @BeforeEach
    void setUp() {
        aeId = accountExecutiveService.create(
            AccountExecutive.of("Sam Ortiz", "sam-" + UUID.randomUUID() + "@example.com")).get().id().orElseThrow();
        var config = configService.create(CommissionConfig.draft("Capped", new BigDecimal("0.10"))
            .withCap(new BigDecimal("100000"), new BigDecimal("0.5")), "admin");
        configService.assign(aeId, config.id().orElseThrow(), LocalDate.of(2025, 1, 1), Optional.empty(), "admin").get();
        contractId = contractService.create(Contract.of("Soylent", aeId, new BigDecimal("1200000"))).get()
            .id().orElseThrow();
    }

    @Test
    void capIsFinalAtCalculation() {
        var first = invoiceService.create(Invoice.of(contractId, new BigDecimal("600000"), LocalDate.of(2025, 3, 1)))
            .get().commission().orElseThrow();
        var second = invoiceService.create(Invoice.of(contractId, new BigDecimal("600000"), LocalDate.of(2025, 4, 1)))
            .get().commission().orElseThrow();

        assertEquals(new BigDecimal("60000.00"), first.baseCommission());
        assertFalse(first.oteApplied());
        assertEquals(new BigDecimal("50000.00"), second.baseCommission());
        assertTrue(second.oteApplied());

        engine.approve(second.id().orElseThrow(), "manager");
        engine.approve(first.id().orElseThrow(), "manager");

        assertEquals(new BigDecimal("50000.00"),
            commissionRepository.findById(second.id().orElseThrow()).orElseThrow().baseCommission());
        assertEquals(0, new BigDecimal("110000.00").compareTo(commissionRepository.sumApprovedBaseCommission(aeId, 2025)));
    }

    @Test
    void concurrentCalculationsAcrossTheCapShareItOnce() throws Exception {
        jdbcTemplate.update("INSERT INTO ote_ledger (ae_id, cap_year) VALUES (?, ?)", aeId, 2025);
        var first = invoiceRepository.insert(Invoice.of(contractId, new BigDecimal("600000"), LocalDate.of(2025, 3, 1)));
        var second = invoiceRepository.insert(Invoice.of(contractId, new BigDecimal("600000"), LocalDate.of(2025, 3, 2)));

        var executor = Executors.newFixedThreadPool(2);
        var start = new CountDownLatch(1);
        var results = new ArrayList<Commission>();
        try {
            var futures = new ArrayList<Future<Commission>>();
            for (var invoice : List.of(first, second)) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return engine.calculateCommission(invoice);
                }));
            }
            start.countDown();
            for (var future : futures) {
                try {
                    results.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    fail("Calculation failed: " + e.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        // 60000 in full, then 40000 up to the cap plus 20000 * 0.5
        assertEquals(new BigDecimal("110000.00"),
            commissionRepository.sumBaseCommission(aeId, 2025, EnumSet.of(CommissionStatus.PENDING)));
        assertEquals(1, results.stream().filter(Commission::oteApplied).count());
    }

    @Test
    void multiYearPolicyIsReadFromProperties() {
        var threeYears = Contract.of("Soylent", aeId, new BigDecimal("1500000")).withTerms(3, PaymentTerms.ANNUAL);
        var invoice = Invoice.of(contractId, new BigDecimal("500000"), LocalDate.of(2025, 3, 1));
        var plan = CommissionConfig.draft("Multi-year", new BigDecimal("0.10"))
            .withBonusRates(BigDecimal.ZERO, new BigDecimal("0.02"), BigDecimal.ZERO);

        // two additional years at 2 %
        assertEquals(new BigDecimal("20000.00"), bonusCalculator.computeBonuses(threeYears, invoice, plan).multiYearBonus());
    }
}
