package com.talentledger.ingestion.feed.event;

public record AgreementCancelled(NotificationOrigin origin, long agreementId, String reason) implements AgreementNotification {

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_CANCELLED;
    }
}
