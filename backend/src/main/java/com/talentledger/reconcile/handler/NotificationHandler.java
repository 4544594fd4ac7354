package com.talentledger.reconcile.handler;

import com.talentledger.ingestion.feed.event.Notification;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.reconcile.engine.ReconcilePlan;

/**
 * Turns one kind of notification into a commit plan. Queries the ledger for current state and never writes.
 *
 * @param <N> the notification variant handled
 */
public interface NotificationHandler<N extends Notification> {

    NotificationType type();

    /**
     * @throws com.talentledger.ingestion.ledger.UnreachableSourceException     ledger unavailable (transient)
     * @throws com.talentledger.ingestion.ledger.InvalidReferenceException      referenced entity absent
     * @throws com.talentledger.reconcile.engine.LedgerLagException            ledger behind the notification (transient)
     * @throws com.talentledger.reconcile.engine.InvariantViolationException   notification contradicts the ledger
     */
    ReconcilePlan plan(N notification);
}
