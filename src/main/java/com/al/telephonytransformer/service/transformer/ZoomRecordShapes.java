package com.al.telephonytransformer.service.transformer;

import com.al.telephonytransformer.config.TransformerProperties;
import com.al.telephonytransformer.model.enums.IvrTargetType;
import com.al.telephonytransformer.service.rules.IvrRules;
import com.al.telephonytransformer.service.rules.ScheduleRules;
import com.al.telephonytransformer.service.rules.SiteRules;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * Builders for the target fields every source platform emits.
 *
 * <p>
 * RingCentral output is the reference shape. SSOT and Dialpad transformers
 * build their target fields through the same methods so a single loader can
 * consume any source.
 *
 * @author Telephony Transformer Team
 * @since 1.0.0
 */
@Slf4j
public final class ZoomRecordShapes {

    private ZoomRecordShapes() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Add {@code site_code} and, when enabled by configuration,
     * {@code auto_receptionist_name}.
     */
    public static void addSiteNaming(Map<String, Object> transformed, String siteName,
            TransformationSettings settings, TransformerProperties properties) {
        if (siteName == null || siteName.trim().isEmpty()) {
            return;
        }
        transformed.put(KEY_SITE_CODE, SiteRules.siteCode(siteName, properties.getSiteCodeMaxLength()));
        if (settings.getBoolean("generate_auto_receptionist_name", false)) {
            int maxLength = settings.getInt("ar_name_max_length", properties.getAutoReceptionistNameMaxLength());
            transformed.put(KEY_AUTO_RECEPTIONIST_NAME, SiteRules.autoReceptionistName(siteName, maxLength));
        }
    }

    /**
     * Zoom {@code user_info} object.
     */
    public static Map<String, Object> userInfo(Object firstName, Object lastName, Object email, Object phoneNumber,
            String timezone, Object type) {
        Map<String, Object> userInfo = new LinkedHashMap<>();
        userInfo.put("first_name", firstName);
        userInfo.put("last_name", lastName);
        userInfo.put("email", email);
        userInfo.put("phone_number", phoneNumber);
        userInfo.put("timezone", timezone);
        userInfo.put("type", type);
        return userInfo;
    }

    /**
     * Add {@code custom_hours_settings} when the weekly ranges produce at
     * least one entry.
     *
     * @return true if custom hours were written
     */
    public static boolean addCustomHours(Map<String, Object> transformed, Object weeklyRanges) {
        List<Map<String, Object>> customHours = ScheduleRules.weeklyRangesToCustomHours(weeklyRanges);
        if (customHours.isEmpty()) {
            return false;
        }
        transformed.put(KEY_CUSTOM_HOURS, customHours);
        return true;
    }

    /**
     * Convert RingCentral style IVR actions into Zoom {@code ivr_actions}.
     * Non-object entries are skipped.
     */
    public static List<Map<String, Object>> ivrActions(Object sourceActions) {
        List<Map<String, Object>> actions = new ArrayList<>();
        if (!(sourceActions instanceof List)) {
            return actions;
        }
        for (Object entry : (List<?>) sourceActions) {
            if (!(entry instanceof Map)) {
                log.warn("Skipping IVR action that is not an object: {}", entry);
                continue;
            }
            actions.add(ivrAction((Map<?, ?>) entry));
        }
        return actions;
    }

    /**
     * Convert one RingCentral style IVR action.
     *
     * <p>
     * The key comes from {@code input} (mapped) or {@code key}. The target
     * extension comes from {@code extension{id,name}},
     * {@code target{extension_id,type}} or a flat {@code target_id}. An
     * explicit target type wins; without one the extension name decides, and a
     * missing name means user.
     */
    public static Map<String, Object> ivrAction(Map<?, ?> action) {
        String key = null;
        if (action.containsKey("input")) {
            key = IvrRules.mapIvrKey(stringOrNull(action.get("input")));
        } else if (action.containsKey("key")) {
            key = stringOrNull(action.get("key"));
        }

        Object extensionId = null;
        String extensionName = null;
        String explicitType = null;
        if (action.get("extension") instanceof Map) {
            Map<?, ?> extension = (Map<?, ?>) action.get("extension");
            extensionId = extension.get("id");
            extensionName = stringOrNull(extension.get("name"));
        } else if (action.get("target") instanceof Map) {
            Map<?, ?> target = (Map<?, ?>) action.get("target");
            extensionId = target.get("extension_id");
            explicitType = stringOrNull(target.get("type"));
        } else {
            extensionId = action.get("target_id");
        }
        if (action.get("target_type") != null) {
            explicitType = stringOrNull(action.get("target_type"));
        }

        IvrTargetType targetType = IvrTargetType.fromValue(explicitType);
        if (targetType == null) {
            targetType = IvrRules.detectExtensionType(extensionName);
        }
        return IvrRules.buildAction(key, stringOrNull(action.get("action")), targetType, extensionId);
    }

    /**
     * Resolve the site id an entity belongs to, from the flattened
     * {@code site.id} key or a nested {@code site} object.
     */
    public static Object siteId(Map<String, Object> record) {
        return FieldPathResolver.get(record, KEY_SITE_ID_LITERAL);
    }

    /**
     * Deep-merge {@code values} into {@code target}. Nested maps are merged key
     * by key, any other value replaces the existing one. Stored maps and lists
     * are mutable copies.
     */
    @SuppressWarnings("unchecked")
    public static void mergeInto(Map<String, Object> target, Map<String, Object> values) {
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object existing = target.get(entry.getKey());
            if (existing instanceof Map && entry.getValue() instanceof Map) {
                Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) existing);
                mergeInto(merged, (Map<String, Object>) entry.getValue());
                target.put(entry.getKey(), merged);
            } else {
                target.put(entry.getKey(), FieldPathResolver.copyValue(entry.getValue()));
            }
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
