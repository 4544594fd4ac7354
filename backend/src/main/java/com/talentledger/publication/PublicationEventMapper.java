package com.talentledger.publication;

import com.talentledger.common.AmountFormat;
import com.talentledger.domain.ActivityPayload;
import com.talentledger.domain.ActivityRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps an activity record to the channel events of each party that should hear about it. Amounts are shown in
 * ether.
 */
@Component
public class PublicationEventMapper {

    public List<PublicationEvent> map(ActivityRecord record) {
        Map<String, Object> payload = payload(record);
        String company = record.getCompany();
        String talent = record.getTalent();
        List<PublicationEvent> events = new ArrayList<>(2);
        switch (record.getType()) {
            case CONTRACT_CREATED -> {
                add(events, company, "contract-created", payload);
                add(events, talent, "contract-received", payload);
            }
            case CONTRACT_ACCEPTED -> add(events, company, "contract-accepted", payload);
            case CONTRACT_ACTIVATED -> both(events, company, talent, "contract-activated", payload);
            case MILESTONE_SUBMITTED -> add(events, company, "milestone-submitted", payload);
            case MILESTONE_APPROVED -> add(events, talent, "milestone-approved", payload);
            case MILESTONE_PAID -> add(events, talent, "milestone-paid", payload);
            case CONTRACT_DISPUTED -> both(events, company, talent, "contract-disputed", payload);
            case CONTRACT_COMPLETED -> both(events, company, talent, "contract-completed", payload);
            case CONTRACT_FINALIZED -> both(events, company, talent, "contract-finalized", payload);
            case CONTRACT_CANCELLED -> both(events, company, talent, "contract-cancelled", payload);
            case CREDENTIAL_ISSUED -> add(events, talent, "credential-received", payload);
        }
        return events;
    }

    private static void both(List<PublicationEvent> events, String company, String talent, String type,
                             Map<String, Object> payload) {
        add(events, company, type, payload);
        add(events, talent, type, payload);
    }

    private static void add(List<PublicationEvent> events, String channel, String type, Map<String, Object> payload) {
        if (channel != null) {
            events.add(new PublicationEvent(channel, type, payload));
        }
    }

    private static Map<String, Object> payload(ActivityRecord record) {
        ActivityPayload p = record.getPayload() != null ? record.getPayload() : new ActivityPayload();
        Map<String, Object> payload = new LinkedHashMap<>();
        if (record.getAgreementId() != null) {
            payload.put("agreementId", record.getAgreementId());
        }
        if (record.getTransactionHash() != null) {
            payload.put("transactionHash", record.getTransactionHash());
        }
        payload.put("blockNumber", record.getSequencePosition());
        if (record.getInitiator() != null) {
            payload.put("initiator", record.getInitiator());
        }
        if (p.getMilestoneIndex() != null) {
            payload.put("milestoneIndex", p.getMilestoneIndex());
        }
        if (p.getAmount() != null) {
            payload.put("amount", AmountFormat.toEther(AmountFormat.fromWeiString(p.getAmount())));
        }
        if (p.getTalentPayment() != null) {
            payload.put("talentPayment", AmountFormat.toEther(AmountFormat.fromWeiString(p.getTalentPayment())));
        }
        if (p.getPlatformFee() != null) {
            payload.put("platformFee", AmountFormat.toEther(AmountFormat.fromWeiString(p.getPlatformFee())));
        }
        if (p.getReason() != null) {
            payload.put("reason", p.getReason());
        }
        if (p.getTokenId() != null) {
            payload.put("tokenId", p.getTokenId());
        }
        if (p.getSkillName() != null) {
            payload.put("skillName", p.getSkillName());
        }
        if (record.getTimestamp() != null) {
            payload.put("timestamp", record.getTimestamp().toString());
        }
        return Collections.unmodifiableMap(payload);
    }
}
