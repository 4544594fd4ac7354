package com.talentledger.ingestion.feed.event;

public record AgreementActivated(NotificationOrigin origin, long agreementId) implements AgreementNotification {

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_ACTIVATED;
    }
}
