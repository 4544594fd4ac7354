package com.talentledger.ingestion.feed.event;

public record AgreementFinalized(NotificationOrigin origin, long agreementId) implements AgreementNotification {

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_FINALIZED;
    }
}
