package com.talentledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One payable unit of work inside an {@link Agreement}. Embedded; amount in wei.
 */
@NoArgsConstructor
@Getter
@Setter
public class Milestone {

    private String description;
    private BigDecimal amount;
    private Instant deadline;
    private MilestoneStatus status;
    private String deliverableRef;
}
