package com.talentledger.ingestion.feed.event;

import com.talentledger.domain.ActivityType;

/**
 * Closed set of notification kinds. Each maps onto exactly one recorded activity type.
 */
public enum NotificationType {
    AGREEMENT_CREATED(ActivityType.CONTRACT_CREATED),
    AGREEMENT_ACCEPTED(ActivityType.CONTRACT_ACCEPTED),
    AGREEMENT_ACTIVATED(ActivityType.CONTRACT_ACTIVATED),
    MILESTONE_SUBMITTED(ActivityType.MILESTONE_SUBMITTED),
    MILESTONE_APPROVED(ActivityType.MILESTONE_APPROVED),
    MILESTONE_PAID(ActivityType.MILESTONE_PAID),
    AGREEMENT_DISPUTED(ActivityType.CONTRACT_DISPUTED),
    AGREEMENT_COMPLETED(ActivityType.CONTRACT_COMPLETED),
    AGREEMENT_FINALIZED(ActivityType.CONTRACT_FINALIZED),
    AGREEMENT_CANCELLED(ActivityType.CONTRACT_CANCELLED),
    CREDENTIAL_ISSUED(ActivityType.CREDENTIAL_ISSUED);

    private final ActivityType activityType;

    NotificationType(ActivityType activityType) {
        this.activityType = activityType;
    }

    public ActivityType activityType() {
        return activityType;
    }
}
