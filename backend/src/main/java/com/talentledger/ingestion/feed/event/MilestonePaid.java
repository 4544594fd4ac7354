package com.talentledger.ingestion.feed.event;

import java.math.BigInteger;

public record MilestonePaid(NotificationOrigin origin, long agreementId, int milestoneIndex, BigInteger talentPayment) implements AgreementNotification {

    @Override
    public NotificationType type() {
        return NotificationType.MILESTONE_PAID;
    }
}
