package com.talentledger.ingestion.feed.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record CredentialIssued(NotificationOrigin origin, long tokenId, String issuer, String recipient, String skillName)
        implements Notification {

    @Override
    public NotificationType type() {
        return NotificationType.CREDENTIAL_ISSUED;
    }

    @Override
    @JsonIgnore
    public String partitionKey() {
        return Notification.credentialPartition(tokenId);
    }
}
