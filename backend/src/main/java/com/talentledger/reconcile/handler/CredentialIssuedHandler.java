package com.talentledger.reconcile.handler;

import com.talentledger.domain.ActivityPayload;
import com.talentledger.domain.ActivityRecord;
import com.talentledger.ingestion.feed.event.CredentialIssued;
import com.talentledger.ingestion.feed.event.NotificationType;
import com.talentledger.ingestion.ledger.LedgerClient;
import com.talentledger.ingestion.ledger.LedgerCredential;
import com.talentledger.reconcile.engine.InvariantViolationException;
import com.talentledger.reconcile.engine.ReconcilePlan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Soulbound credential minted to a talent. Not tied to an agreement, so there is no mirror to merge.
 */
@Component
@RequiredArgsConstructor
public class CredentialIssuedHandler implements NotificationHandler<CredentialIssued> {

    private final LedgerClient ledgerClient;

    @Override
    public NotificationType type() {
        return NotificationType.CREDENTIAL_ISSUED;
    }

    @Override
    public ReconcilePlan plan(CredentialIssued n) {
        LedgerCredential credential = ledgerClient.fetchCredential(n.tokenId());
        if (!credential.recipient().equals(n.recipient())) {
            throw new InvariantViolationException("Credential " + n.tokenId() + " recipient differs from issue event");
        }
        ActivityRecord record = new ActivityRecord();
        record.setIdempotencyKey(n.idempotencyKey());
        record.setTransactionHash(n.origin().transactionHash());
        record.setSequencePosition(n.sequencePosition());
        record.setLogIndex(n.origin().logIndex());
        record.setType(n.type().activityType());
        record.setTalent(credential.recipient());
        record.setInitiator(n.issuer());
        ActivityPayload payload = new ActivityPayload();
        payload.setTokenId(n.tokenId());
        payload.setSkillName(n.skillName() != null ? n.skillName() : credential.skillName());
        record.setPayload(payload);
        record.setTimestamp(n.origin().blockTimestamp());
        record.setCreatedAt(Instant.now());
        return new ReconcilePlan(record, null);
    }
}
