package com.al.telephonytransformer.service.transformer;

import java.util.Map;

/**
 * Transforms one source-platform entity record into its Zoom shape.
 *
 * <p>
 * Implementations copy every input key into the output before adding target
 * fields. Keys are only dropped where the implementation documents it.
 * Implementations never modify the input record.
 */
public interface EntityTransformer {

    /**
     * Stable job type code this transformer serves, e.g. {@code rc_zoom_sites}.
     */
    String getJobTypeCode();

    Map<String, Object> transform(Map<String, Object> record, TransformContext context);

    default Map<String, Object> transform(Map<String, Object> record) {
        return transform(record, TransformContext.empty());
    }

    /**
     * Check that the entity-identifying fields are present.
     */
    boolean validateInput(Map<String, Object> record);

    /**
     * Check that the target fields exist. Structural leftovers are logged as
     * warnings and do not fail validation.
     */
    boolean validateOutput(Map<String, Object> record);
}
