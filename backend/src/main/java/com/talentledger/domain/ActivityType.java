package com.talentledger.domain;

/**
 * Kind of ledger fact recorded in the activity history. Event name is the contract event it originates from.
 */
public enum ActivityType {
    CONTRACT_CREATED("ContractCreated"),
    CONTRACT_ACCEPTED("ContractAccepted"),
    CONTRACT_ACTIVATED("ContractActivated"),
    MILESTONE_SUBMITTED("MilestoneSubmitted"),
    MILESTONE_APPROVED("MilestoneApproved"),
    MILESTONE_PAID("MilestonePaid"),
    CONTRACT_DISPUTED("ContractDisputed"),
    CONTRACT_COMPLETED("ContractCompleted"),
    CONTRACT_FINALIZED("ContractFinalized"),
    CONTRACT_CANCELLED("ContractCancelled"),
    CREDENTIAL_ISSUED("CredentialIssued");

    private final String eventName;

    ActivityType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
