package com.talentledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Type-specific details of an {@link ActivityRecord}. Amounts are decimal wei strings; unset fields stay null.
 */
@NoArgsConstructor
@Getter
@Setter
public class ActivityPayload {

    private Integer milestoneIndex;
    /** Gross milestone amount or agreement total, depending on type. */
    private String amount;
    private String talentPayment;
    private String platformFee;
    private String externalRef;
    private String reason;
    private Long tokenId;
    private String skillName;
}
