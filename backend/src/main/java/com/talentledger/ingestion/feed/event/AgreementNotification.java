package com.talentledger.ingestion.feed.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Notification about one agreement; all of them share the agreement's partition.
 */
public sealed interface AgreementNotification extends Notification permits
        AgreementCreated, AgreementAccepted, AgreementActivated, MilestoneSubmitted, MilestoneApproved,
        MilestonePaid, AgreementDisputed, AgreementCompleted, AgreementFinalized, AgreementCancelled {

    long agreementId();

    @Override
    @JsonIgnore
    default String partitionKey() {
        return Notification.agreementPartition(agreementId());
    }
}
