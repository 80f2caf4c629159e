package com.al.telephonytransformer.service.transformer.dialpad;

import com.al.telephonytransformer.model.enums.IvrTargetType;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.rules.IvrRules;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * Dialpad office routing options to Zoom IVR.
 *
 * <p>
 * Each {@code routing_options.open.dtmf} entry is translated to the
 * equivalent RingCentral action name and target type, then built through
 * {@link IvrRules#buildAction}, so Dialpad and RingCentral menus produce the
 * same codes. A {@code timeout} action is appended from
 * {@code no_operators_action}.
 */
@Slf4j
public class DialpadIvrTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.DIALPAD_ZOOM_IVR;
    private static final String TIMEOUT_KEY = "timeout";

    private static final Map<String, String> KEYS = new HashMap<>();
    private static final Map<String, String> ACTIONS = new HashMap<>();

    static {
        KEYS.put("star", "*");
        KEYS.put("hash", "#");
        KEYS.put("pound", "#");

        ACTIONS.put("operator", "Connect");
        ACTIONS.put("department", "Connect");
        ACTIONS.put("voicemail", "Voicemail");
        ACTIONS.put("directory", "DialByName");
        ACTIONS.put("disabled", "Disconnect");
        ACTIONS.put("disconnect", "Disconnect");
        ACTIONS.put("repeat", "Repeat");
    }

    public DialpadIvrTransformer(TransformerSupport support) {
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

        List<Map<String, Object>> actions = new ArrayList<>();
        Object dtmf = FieldPathResolver.get(record, "routing_options.open.dtmf");
        if (dtmf instanceof List) {
            for (Object entry : (List<?>) dtmf) {
                if (!(entry instanceof Map)) {
                    log.warn("Skipping DTMF entry that is not an object: {}", entry);
                    continue;
                }
                Map<String, Object> action = dtmfAction((Map<?, ?>) entry);
                if (action != null) {
                    actions.add(action);
                }
            }
        } else if (record.get("routing_options") == null) {
            log.warn("Dialpad office {} has no routing_options", officeId);
        }
        actions.add(timeoutAction(record.get("no_operators_action")));

        transformed.put(KEY_IVR_ACTIONS, actions);
        transformed.put(KEY_SITE_ID_LITERAL, officeId);
        if (!transformed.containsKey(KEY_EXTENSION_NUMBER)) {
            Object extension = FieldPathResolver.getFirst(record, KEY_OFFICE_ID, KEY_ID);
            transformed.put(KEY_EXTENSION_NUMBER, extension == null ? null : String.valueOf(extension));
        }

        log.info("Transformed Dialpad IVR {} with {} actions (job {})", officeId, actions.size(),
                context.getJobId());
        return transformed;
    }

    private Map<String, Object> dtmfAction(Map<?, ?> entry) {
        Object input = entry.get("input");
        if (FieldPathResolver.isBlank(input) || !(entry.get("options") instanceof Map)) {
            return null;
        }
        Map<?, ?> options = (Map<?, ?>) entry.get("options");
        String dialpadAction = options.get("action") == null ? "" : String.valueOf(options.get("action"));
        String actionName = ACTIONS.get(dialpadAction.toLowerCase());
        if (actionName == null) {
            log.warn("Unknown Dialpad action '{}', using Disconnect", dialpadAction);
            actionName = "Disconnect";
        }
        return IvrRules.buildAction(mapKey(String.valueOf(input)), actionName, targetType(options),
                options.get("action_target_id"));
    }

    private static String mapKey(String input) {
        String mapped = KEYS.get(input.toLowerCase());
        return mapped == null ? input : mapped;
    }

    private static IvrTargetType targetType(Map<?, ?> options) {
        Object action = options.get("action");
        Object targetType = options.get("action_target_type");
        if ("department".equals(action) || "department".equals(targetType)) {
            return IvrTargetType.CALL_QUEUE;
        }
        if ("operator".equals(action)) {
            return IvrTargetType.USER;
        }
        if ("office".equals(targetType)) {
            return IvrTargetType.AUTO_RECEPTIONIST;
        }
        IvrTargetType explicit = IvrTargetType.fromValue(targetType == null ? null : String.valueOf(targetType));
        return explicit == null ? IvrTargetType.USER : explicit;
    }

    private static Map<String, Object> timeoutAction(Object noOperatorsAction) {
        String actionName = noOperatorsAction == null || "voicemail".equals(noOperatorsAction) ? "Voicemail"
                : "Disconnect";
        return IvrRules.buildAction(TIMEOUT_KEY, actionName, IvrTargetType.USER, null);
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        if (DialpadRecords.officeId(record) == null) {
            log.error("Dialpad IVR has neither id nor office_id");
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        Object actions = record.get(KEY_IVR_ACTIONS);
        if (!(actions instanceof List)) {
            log.error("Transformed IVR {} has no ivr_actions list", record.get(KEY_ID));
            return false;
        }
        if (record.get("routing_options") != null && ((List<?>) actions).size() <= 1) {
            log.warn("IVR {} has routing options but no DTMF actions were produced", record.get(KEY_ID));
        }
        return true;
    }
}
