package com.talentledger.ingestion.feed.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A decoded ledger event. Delivery may repeat or reorder; {@link #idempotencyKey()} identifies the underlying
 * ledger fact and {@link #partitionKey()} the stream whose order must be preserved.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AgreementCreated.class, name = "AgreementCreated"),
        @JsonSubTypes.Type(value = AgreementAccepted.class, name = "AgreementAccepted"),
        @JsonSubTypes.Type(value = AgreementActivated.class, name = "AgreementActivated"),
        @JsonSubTypes.Type(value = MilestoneSubmitted.class, name = "MilestoneSubmitted"),
        @JsonSubTypes.Type(value = MilestoneApproved.class, name = "MilestoneApproved"),
        @JsonSubTypes.Type(value = MilestonePaid.class, name = "MilestonePaid"),
        @JsonSubTypes.Type(value = AgreementDisputed.class, name = "AgreementDisputed"),
        @JsonSubTypes.Type(value = AgreementCompleted.class, name = "AgreementCompleted"),
        @JsonSubTypes.Type(value = AgreementFinalized.class, name = "AgreementFinalized"),
        @JsonSubTypes.Type(value = AgreementCancelled.class, name = "AgreementCancelled"),
        @JsonSubTypes.Type(value = CredentialIssued.class, name = "CredentialIssued")
})
public sealed interface Notification permits AgreementNotification, CredentialIssued {

    NotificationOrigin origin();

    @JsonIgnore
    NotificationType type();

    @JsonIgnore
    String partitionKey();

    /** {transactionHash}:{logIndex}. One transaction may emit several events, so the hash alone is not enough. */
    @JsonIgnore
    default String idempotencyKey() {
        return origin().transactionHash().toLowerCase() + ":" + origin().logIndex();
    }

    @JsonIgnore
    default long sequencePosition() {
        return origin().blockNumber();
    }

    static String agreementPartition(long agreementId) {
        return "agreement-" + agreementId;
    }

    static String credentialPartition(long tokenId) {
        return "credential-" + tokenId;
    }
}
