package com.talentledger.api.dto;

import com.talentledger.common.AmountFormat;
import com.talentledger.domain.ActivityPayload;
import com.talentledger.domain.ActivityRecord;

import java.time.Instant;

/**
 * One activity record. Amounts are ether display strings.
 */
public record ActivityResponse(
        String idempotencyKey,
        Long agreementId,
        String type,
        String transactionHash,
        long blockNumber,
        int logIndex,
        String initiator,
        Integer milestoneIndex,
        String amount,
        String talentPayment,
        String platformFee,
        String externalRef,
        String reason,
        Long tokenId,
        String skillName,
        Instant timestamp
) {

    public static ActivityResponse from(ActivityRecord r) {
        ActivityPayload p = r.getPayload() != null ? r.getPayload() : new ActivityPayload();
        return new ActivityResponse(
                r.getIdempotencyKey(),
                r.getAgreementId(),
                r.getType() != null ? r.getType().getEventName() : null,
                r.getTransactionHash(),
                r.getSequencePosition(),
                r.getLogIndex(),
                r.getInitiator(),
                p.getMilestoneIndex(),
                ether(p.getAmount()),
                ether(p.getTalentPayment()),
                ether(p.getPlatformFee()),
                p.getExternalRef(),
                p.getReason(),
                p.getTokenId(),
                p.getSkillName(),
                r.getTimestamp());
    }

    private static String ether(String wei) {
        return wei == null ? null : AmountFormat.toEther(AmountFormat.fromWeiString(wei));
    }
}
