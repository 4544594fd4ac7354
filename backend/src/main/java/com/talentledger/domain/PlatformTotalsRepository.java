package com.talentledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface PlatformTotalsRepository extends MongoRepository<PlatformTotals, String> {
}
