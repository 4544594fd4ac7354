package com.talentledger.ingestion.feed.event;

public record MilestoneApproved(NotificationOrigin origin, long agreementId, int milestoneIndex) implements AgreementNotification {

    @Override
    public NotificationType type() {
        return NotificationType.MILESTONE_APPROVED;
    }
}
