package com.al.telephonytransformer.repository;

import com.al.telephonytransformer.model.TransformationConfigEntity;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TransformationConfigRepository extends MongoRepository<TransformationConfigEntity, String> {
    Optional<TransformationConfigEntity> findByJobTypeCodeAndActiveTrue(String jobTypeCode);
}
