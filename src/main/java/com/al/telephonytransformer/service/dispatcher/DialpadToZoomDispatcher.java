package com.al.telephonytransformer.service.dispatcher;

import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.dialpad.DialpadAutoReceptionistsTransformer;
import com.al.telephonytransformer.service.transformer.dialpad.DialpadCallQueuesTransformer;
import com.al.telephonytransformer.service.transformer.dialpad.DialpadIvrTransformer;
import com.al.telephonytransformer.service.transformer.dialpad.DialpadSitesTransformer;
import com.al.telephonytransformer.service.transformer.dialpad.DialpadUsersTransformer;

import static com.al.telephonytransformer.util.MappingConstants.PLATFORM_DIALPAD;
import static com.al.telephonytransformer.util.MappingConstants.PLATFORM_ZOOM;

/**
 * Dialpad transformers emit the RingCentral output shape, so Dialpad
 * records are loaded by the RingCentral loaders.
 */
public class DialpadToZoomDispatcher extends AbstractPlatformDispatcher {

    public DialpadToZoomDispatcher(TransformerSupport support) {
        super(PLATFORM_DIALPAD, PLATFORM_ZOOM, support);
        register(JobType.DIALPAD_ZOOM_SITES, DialpadSitesTransformer::new);
        register(JobType.DIALPAD_ZOOM_USERS, DialpadUsersTransformer::new);
        register(JobType.DIALPAD_ZOOM_CALL_QUEUES, DialpadCallQueuesTransformer::new);
        register(JobType.DIALPAD_ZOOM_ARS, DialpadAutoReceptionistsTransformer::new);
        register(JobType.DIALPAD_ZOOM_IVR, DialpadIvrTransformer::new);
    }
}
