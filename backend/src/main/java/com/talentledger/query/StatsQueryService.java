package com.talentledger.query;

import com.talentledger.domain.AgreementRepository;
import com.talentledger.domain.AgreementStatus;
import com.talentledger.domain.PartyProfileRepository;
import com.talentledger.domain.PartyRole;
import com.talentledger.domain.PlatformTotals;
import com.talentledger.domain.PlatformTotalsRepository;
import com.talentledger.domain.QuarantinedNotification.QuarantineStatus;
import com.talentledger.domain.QuarantinedNotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumSet;

@Service
@RequiredArgsConstructor
public class StatsQueryService {

    private final AgreementRepository agreementRepository;
    private final PartyProfileRepository partyProfileRepository;
    private final PlatformTotalsRepository platformTotalsRepository;
    private final QuarantinedNotificationRepository quarantineRepository;

    public PlatformStats platformStats() {
        PlatformTotals totals = platformTotalsRepository.findById(PlatformTotals.SINGLETON_ID)
                .orElseGet(PlatformTotals::new);
        return new PlatformStats(
                agreementRepository.count(),
                agreementRepository.countByStatusIn(EnumSet.of(AgreementStatus.ACTIVE)),
                agreementRepository.countByStatusIn(EnumSet.of(AgreementStatus.COMPLETED, AgreementStatus.FINALIZED)),
                partyProfileRepository.countByRolesContaining(PartyRole.COMPANY),
                partyProfileRepository.countByRolesContaining(PartyRole.TALENT),
                totals.getTotalVolume() != null ? totals.getTotalVolume() : BigDecimal.ZERO,
                totals.getTotalPlatformFees() != null ? totals.getTotalPlatformFees() : BigDecimal.ZERO,
                totals.getPaidMilestones());
    }

    public long openQuarantineCount() {
        return quarantineRepository.countByStatus(QuarantineStatus.OPEN);
    }
}
