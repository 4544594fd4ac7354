package com.talentledger.reconcile.engine;

import com.talentledger.domain.ActivityRecord;
import com.talentledger.ingestion.ledger.LedgerAgreement;

/**
 * What a handler decided to commit: the activity record and, for agreement notifications, the ledger snapshot to
 * merge into the mirror.
 */
public record ReconcilePlan(ActivityRecord record, LedgerAgreement agreementState) {
}
