package com.talentledger.api.dto;

import com.talentledger.common.AmountFormat;
import com.talentledger.domain.Agreement;
import com.talentledger.domain.Milestone;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * GET /api/v1/agreements/{id} response: mirrored agreement plus its most recent activity.
 */
public record AgreementResponse(
        long id,
        String company,
        String talent,
        String title,
        String metadataRef,
        String totalAmount,
        String status,
        boolean companyApproved,
        boolean talentApproved,
        Instant startDate,
        Instant endDate,
        List<MilestoneEntry> milestones,
        Long lastSyncedBlock,
        List<ActivityResponse> activities
) {

    public record MilestoneEntry(int index, String description, String amount, Instant deadline, String status,
                                 String deliverableRef) {
    }

    public static AgreementResponse from(Agreement a, List<ActivityResponse> activities) {
        List<Milestone> source = a.getMilestones() != null ? a.getMilestones() : List.of();
        List<MilestoneEntry> milestones = new ArrayList<>(source.size());
        for (int i = 0; i < source.size(); i++) {
            Milestone m = source.get(i);
            milestones.add(new MilestoneEntry(i, m.getDescription(),
                    m.getAmount() != null ? AmountFormat.toEther(m.getAmount()) : null,
                    m.getDeadline(),
                    m.getStatus() != null ? m.getStatus().name() : null,
                    m.getDeliverableRef()));
        }
        return new AgreementResponse(
                a.getId(),
                a.getCompany(),
                a.getTalent(),
                a.getTitle(),
                a.getMetadataRef(),
                a.getTotalAmount() != null ? AmountFormat.toEther(a.getTotalAmount()) : null,
                a.getStatus() != null ? a.getStatus().name() : null,
                a.isCompanyApproved(),
                a.isTalentApproved(),
                a.getStartDate(),
                a.getEndDate(),
                milestones,
                a.getLastSyncedBlock(),
                activities);
    }
}
