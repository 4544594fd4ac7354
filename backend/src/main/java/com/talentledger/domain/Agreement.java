package com.talentledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Local mirror of one escrow-backed agreement. The ledger owns the canonical state; this copy is refreshed on
 * every relevant notification and only ever moves forward. All amounts are wei (Decimal128).
 */
@Document(collection = "agreements")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Agreement {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    @Indexed
    private String company;
    @Indexed
    private String talent;
    private String title;
    private String metadataRef;
    private BigDecimal totalAmount;
    private Instant startDate;
    private Instant endDate;
    private AgreementStatus status;
    private List<Milestone> milestones = new ArrayList<>();
    private boolean companyApproved;
    private boolean talentApproved;
    /** Highest block whose notification refreshed this mirror. */
    private Long lastSyncedBlock;
    private Instant updatedAt;

    public int milestoneCount() {
        return milestones == null ? 0 : milestones.size();
    }
}
