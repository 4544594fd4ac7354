package com.talentledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PartitionWatermarkRepository extends MongoRepository<PartitionWatermark, String> {

    List<PartitionWatermark> findByHeldByKeyNotNull();
}
