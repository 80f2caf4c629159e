package com.al.telephonytransformer.service.dispatcher;

import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ssot.SsotAutoReceptionistsTransformer;
import com.al.telephonytransformer.service.transformer.ssot.SsotCallQueuesTransformer;
import com.al.telephonytransformer.service.transformer.ssot.SsotIvrTransformer;
import com.al.telephonytransformer.service.transformer.ssot.SsotSitesTransformer;
import com.al.telephonytransformer.service.transformer.ssot.SsotUsersTransformer;

import static com.al.telephonytransformer.util.MappingConstants.PLATFORM_SSOT;
import static com.al.telephonytransformer.util.MappingConstants.PLATFORM_ZOOM;

/**
 * SSOT transformers read their field mappings when first created, so a
 * mapping change takes effect after {@link DispatcherRegistry#clearCache()}.
 */
public class SsotToZoomDispatcher extends AbstractPlatformDispatcher {

    public SsotToZoomDispatcher(TransformerSupport support) {
        super(PLATFORM_SSOT, PLATFORM_ZOOM, support);
        register(JobType.SSOT_TO_ZOOM_SITES, SsotSitesTransformer::new);
        register(JobType.SSOT_TO_ZOOM_USERS, SsotUsersTransformer::new);
        register(JobType.SSOT_TO_ZOOM_CALL_QUEUES, SsotCallQueuesTransformer::new);
        register(JobType.SSOT_TO_ZOOM_AUTO_RECEPTIONISTS, SsotAutoReceptionistsTransformer::new);
        register(JobType.SSOT_TO_ZOOM_IVR, SsotIvrTransformer::new);
    }
}
