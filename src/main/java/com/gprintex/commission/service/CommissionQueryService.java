package com.gprintex.commission.service;

import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionDetails;
import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.domain.OteProgress;
import com.gprintex.commission.exception.EntityNotFoundException;
import com.gprintex.commission.repository.AccountExecutiveRepository;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.CommissionRepository.CommissionFilter;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Read models over commissions: statements, the approval queue and OTE progress.
 */
@Service
@Transactional(readOnly = true)
public class CommissionQueryService {

    private final CommissionRepository commissions;
    private final AccountExecutiveRepository accountExecutives;
    private final ConfigResolver configResolver;
    private final Clock clock;

    public CommissionQueryService(
        CommissionRepository commissions,
        AccountExecutiveRepository accountExecutives,
        ConfigResolver configResolver,
        Clock clock
    ) {
        this.commissions = commissions;
        this.accountExecutives = accountExecutives;
        this.configResolver = configResolver;
        this.clock = clock;
    }

    public Optional<Commission> findById(Long id) {
        return commissions.findById(id);
    }

    public Optional<Commission> findByInvoice(Long invoiceId) {
        return commissions.findByInvoiceId(invoiceId);
    }

    public List<CommissionDetails> find(CommissionFilter filter) {
        return commissions.findByFilter(filter);
    }

    /**
     * Commissions of one AE, optionally narrowed by status and invoice date range.
     */
    public List<CommissionDetails> statement(Long aeId, Optional<CommissionStatus> status,
                                             Optional<LocalDate> from, Optional<LocalDate> to) {
        requireAe(aeId);
        var filter = new CommissionFilter(Optional.of(aeId), status, from, to);
        return commissions.findByFilter(filter);
    }

    public List<CommissionDetails> pendingApprovals() {
        return commissions.findByFilter(CommissionFilter.all().withStatus(CommissionStatus.PENDING));
    }

    /**
     * Realized and pending base commission of the AE for the year against the cap of the plan in force
     * at the end of the year, or today for the current year.
     */
    public OteProgress oteProgress(Long aeId, int year) {
        requireAe(aeId);
        var today = LocalDate.now(clock);
        var asOf = year == today.getYear() ? today : LocalDate.of(year, 12, 31);
        Optional<BigDecimal> cap = configResolver.findResolution(aeId, asOf)
            .flatMap(resolution -> resolution.config().annualCapAmount());
        return new OteProgress(
            aeId,
            year,
            commissions.sumApprovedBaseCommission(aeId, year),
            commissions.sumBaseCommission(aeId, year, EnumSet.of(CommissionStatus.PENDING)),
            cap
        );
    }

    private void requireAe(Long aeId) {
        if (!accountExecutives.exists(aeId)) {
            throw new EntityNotFoundException("Account executive", aeId);
        }
    }
}
