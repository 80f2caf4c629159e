package com.al.telephonytransformer.service.dispatcher;

import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ringcentral.RingCentralAutoReceptionistsTransformer;
import com.al.telephonytransformer.service.transformer.ringcentral.RingCentralCallQueuesTransformer;
import com.al.telephonytransformer.service.transformer.ringcentral.RingCentralIvrTransformer;
import com.al.telephonytransformer.service.transformer.ringcentral.RingCentralSitesTransformer;
import com.al.telephonytransformer.service.transformer.ringcentral.RingCentralUsersTransformer;

import static com.al.telephonytransformer.util.MappingConstants.PLATFORM_RINGCENTRAL;
import static com.al.telephonytransformer.util.MappingConstants.PLATFORM_ZOOM;

public class RingCentralToZoomDispatcher extends AbstractPlatformDispatcher {

    public RingCentralToZoomDispatcher(TransformerSupport support) {
        super(PLATFORM_RINGCENTRAL, PLATFORM_ZOOM, support);
        register(JobType.RC_ZOOM_SITES, RingCentralSitesTransformer::new);
        register(JobType.RC_ZOOM_USERS, RingCentralUsersTransformer::new);
        register(JobType.RC_ZOOM_CALL_QUEUES, RingCentralCallQueuesTransformer::new);
        register(JobType.RC_ZOOM_ARS, RingCentralAutoReceptionistsTransformer::new);
        register(JobType.RC_ZOOM_IVR, RingCentralIvrTransformer::new);
    }
}
