package com.talentledger.ingestion.feed.event;

public record AgreementAccepted(NotificationOrigin origin, long agreementId, String talent) implements AgreementNotification {

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_ACCEPTED;
    }
}
