package com.talentledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Single-document platform aggregate (id {@value #SINGLETON_ID}). Amounts in wei.
 */
@Document(collection = "platform_totals")
@NoArgsConstructor
@Getter
@Setter
public class PlatformTotals {

    public static final String SINGLETON_ID = "platform";

    @Id
    private String id = SINGLETON_ID;
    private BigDecimal totalVolume = BigDecimal.ZERO;
    private BigDecimal totalPlatformFees = BigDecimal.ZERO;
    private long paidMilestones;
    private Instant updatedAt;
}
