package com.talentledger.ingestion.feed.event;

public record AgreementDisputed(NotificationOrigin origin, long agreementId, String initiator) implements AgreementNotification {

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_DISPUTED;
    }
}
