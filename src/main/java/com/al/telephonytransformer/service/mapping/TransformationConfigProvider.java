package com.al.telephonytransformer.service.mapping;

import java.util.Map;

/**
 * Source of per-job-type transformation settings. An absent or unreadable
 * configuration is returned as an empty map.
 */
public interface TransformationConfigProvider {

    Map<String, Object> getTransformationConfig(String jobTypeCode);
}
