package com.talentledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface PartyProfileRepository extends MongoRepository<PartyProfile, String> {

    long countByRolesContaining(PartyRole role);
}
