package com.al.telephonytransformer.service.transformer.dialpad;

import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.rules.ExtensionRules;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * Dialpad office main line to Zoom auto receptionist.
 *
 * <p>
 * The office id doubles as site id: it is written as {@code rc_site_id},
 * {@code office_id} and the literal {@code "site.id"} key, so the site and
 * auto receptionist loaders resolve the same dependency.
 */
@Slf4j
public class DialpadAutoReceptionistsTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.DIALPAD_ZOOM_ARS;

    public DialpadAutoReceptionistsTransformer(TransformerSupport support) {
        log.debug("Initialized {} transformer", JOB_TYPE.getCode());
    }

    @Override
    public String getJobTypeCode() {
        return JOB_TYPE.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);
        String officeId = DialpadRecords.officeId(record);

        transformed.put(KEY_RC_SITE_ID, officeId);
        transformed.put(KEY_OFFICE_ID, officeId);
        transformed.put(KEY_SITE_ID_LITERAL, officeId);
        transformed.put(KEY_EXTENSION_NUMBER,
                ExtensionRules.deterministicExtension(officeId, ExtensionRules.CLASS_AUTO_RECEPTIONIST));

        log.info("Transformed Dialpad office {} to auto receptionist (job {})", officeId, context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        if (DialpadRecords.officeId(record) == null) {
            log.error("Dialpad office has neither id nor office_id");
            return false;
        }
        if (FieldPathResolver.isBlank(record.get(KEY_NAME))) {
            log.error("Dialpad office {} has no name", DialpadRecords.officeId(record));
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (FieldPathResolver.isBlank(record.get(KEY_RC_SITE_ID))) {
            log.error("Transformed auto receptionist {} has no rc_site_id", record.get(KEY_NAME));
            return false;
        }
        return true;
    }
}
