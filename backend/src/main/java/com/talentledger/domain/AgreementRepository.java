package com.talentledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;

/**
 * Persistence for the agreement mirror. Written only inside the reconciliation commit.
 */
public interface AgreementRepository extends MongoRepository<Agreement, Long> {

    long countByStatusIn(Collection<AgreementStatus> statuses);
}
