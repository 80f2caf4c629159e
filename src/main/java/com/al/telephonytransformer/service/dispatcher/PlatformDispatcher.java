package com.al.telephonytransformer.service.dispatcher;

import com.al.telephonytransformer.dto.TransformerInfo;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;

import java.util.List;
import java.util.Map;

/**
 * Routes records of one (source platform, target platform) pair to the
 * transformer for their job type.
 *
 * <p>
 * Job types may be given by code ({@code rc_zoom_sites}) or by numeric id
 * ({@code "33"}).
 */
public interface PlatformDispatcher {

    String getSourcePlatform();

    String getTargetPlatform();

    /**
     * Job type codes this dispatcher can serve, in registration order.
     */
    List<String> getSupportedJobTypes();

    boolean supportsJobType(String jobType);

    /**
     * Transformer for a job type code or numeric id. Instances are created
     * on first use and reused afterwards.
     *
     * @throws com.al.telephonytransformer.exception.UnsupportedJobTypeException
     *             if the job type is unknown or disabled
     */
    EntityTransformer getTransformer(String jobType);

    EntityTransformer getTransformerById(int jobTypeId);

    /**
     * Registered transformers keyed by job type code.
     */
    Map<String, TransformerInfo> getTransformerInfo();

    /**
     * Validate, transform and validate again.
     *
     * @throws com.al.telephonytransformer.exception.TransformValidationException
     *             if the input or output fails its entity contract
     * @throws com.al.telephonytransformer.exception.TransformationException
     *             if the transformer fails unexpectedly
     */
    Map<String, Object> transform(String jobType, Map<String, Object> data, TransformContext context);
}
