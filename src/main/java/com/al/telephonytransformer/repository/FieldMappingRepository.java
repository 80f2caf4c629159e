package com.al.telephonytransformer.repository;

import com.al.telephonytransformer.model.FieldMapping;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FieldMappingRepository extends MongoRepository<FieldMapping, String> {
    List<FieldMapping> findByJobTypeIdAndSourcePlatformAndTargetEntity(Integer jobTypeId, String sourcePlatform,
            String targetEntity);
}
