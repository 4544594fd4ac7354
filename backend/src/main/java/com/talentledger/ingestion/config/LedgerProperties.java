package com.talentledger.ingestion.config;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Where and how fast the ledger is read: JSON-RPC endpoints and contract addresses.
 */
@ConfigurationProperties(prefix = "talentledger.ledger")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** JSON-RPC endpoints, used round-robin. */
    @NotEmpty
    private List<String> urls = new ArrayList<>(List.of("http://localhost:8545"));

    /** EmploymentContract address (agreements, milestones, escrow events). */
    private String employmentContract;

    /** CredentialNFT address (soulbound skill credentials). */
    private String credentialContract;

    /** Upper bound for one RPC round trip. */
    @Positive
    private long requestTimeoutMs = 10_000;

    /** Global RPC budget (requests per second) for this service instance. */
    @Positive
    private int maxRequestsPerSecond = 50;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;
}
