package com.al.telephonytransformer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Declarative source-to-target field mapping for one job type.
 * Target fields are unique per (jobTypeId, sourcePlatform, targetEntity).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "field_mappings")
@CompoundIndex(name = "mapping_target_idx", def = "{'job_type_id': 1, 'source_platform': 1, 'target_entity': 1, 'target_field': 1}", unique = true)
public class FieldMapping {

    @Id
    private String id;

    @Field("job_type_id")
    private Integer jobTypeId;

    @Field("source_platform")
    private String sourcePlatform; // e.g. "ssot"

    @Field("target_entity")
    private String targetEntity; // e.g. "user"

    @Field("source_field")
    private String sourceField; // e.g. "contact.email"

    @Field("target_field")
    private String targetField; // e.g. "user_info.email"

    @Field("transformation_rule")
    private String transformationRule; // e.g. "lowercase", nullable

    @Field("is_required")
    private boolean required;

    private String description;
}
