package com.al.telephonytransformer.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;

/**
 * Named bundle of transformation rules for one job type, stored as YAML.
 */
@Data
@Document(collection = "transformation_configs")
public class TransformationConfigEntity {

    @Id
    private String id;

    @Indexed(unique = true)
    @Field("job_type_code")
    private String jobTypeCode;

    @Field("job_type_id")
    private Integer jobTypeId;

    private String name;

    @Field("transformation_config")
    private String transformationConfig; // YAML text

    private boolean active = true;

    private LocalDateTime lastUpdatedDate;
}
