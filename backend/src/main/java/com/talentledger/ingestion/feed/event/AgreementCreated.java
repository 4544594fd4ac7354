package com.talentledger.ingestion.feed.event;

import java.math.BigInteger;

public record AgreementCreated(NotificationOrigin origin, long agreementId, String company, String talent, BigInteger totalAmount) implements AgreementNotification {

    @Override
    public NotificationType type() {
        return NotificationType.AGREEMENT_CREATED;
    }
}
