package com.al.telephonytransformer.util;

/**
 * Centralized record keys and codes for telephony platform transformations.
 *
 * <p>
 * Every source platform writes the same target keys, so the RingCentral,
 * SSOT and Dialpad transformers reference these names instead of literals.
 *
 * <pre>
 * import static com.al.telephonytransformer.util.MappingConstants.*;
 *
 * output.put(KEY_RC_SITE_ID, siteId);
 * </pre>
 *
 * @author Telephony Transformer Team
 * @version 1.0.0
 * @since 1.0.0
 */
public final class MappingConstants {

    /**
     * Private constructor to prevent instantiation of utility class.
     */
    private MappingConstants() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // ========================================================================
    // Platforms
    // ========================================================================

    public static final String PLATFORM_RINGCENTRAL = "ringcentral";
    public static final String PLATFORM_SSOT = "ssot";
    public static final String PLATFORM_DIALPAD = "dialpad";
    public static final String PLATFORM_ZOOM = "zoom";

    // ========================================================================
    // Shared record keys
    // ========================================================================

    public static final String KEY_ID = "id";
    public static final String KEY_NAME = "name";
    public static final String KEY_TYPE = "type";

    /** Flattened site reference emitted by the RingCentral extractor */
    public static final String KEY_SITE_ID_LITERAL = "site.id";
    public static final String KEY_RC_SITE_ID = "rc_site_id";
    public static final String KEY_OFFICE_ID = "office_id";
    public static final String KEY_EXTENSION_NUMBER = "extensionNumber";

    // Sites
    public static final String KEY_BUSINESS_ADDRESS = "businessAddress";
    public static final String KEY_EMERGENCY_ADDRESS = "default_emergency_address";
    public static final String KEY_SITE_CODE = "site_code";
    public static final String KEY_AUTO_RECEPTIONIST_NAME = "auto_receptionist_name";
    public static final String KEY_REGIONAL_SETTINGS = "regionalSettings";

    // Users
    public static final String KEY_CONTACT = "contact";
    public static final String KEY_USER_INFO = "user_info";

    // Call queues
    public static final String KEY_BUSINESS_HOURS = "business_hours";
    public static final String KEY_CUSTOM_HOURS = "custom_hours_settings";

    // IVR
    public static final String KEY_IVR_DETAILS = "ivr_details";
    public static final String KEY_IVR_ACTIONS = "ivr_actions";

    // ========================================================================
    // Address fields
    // ========================================================================

    public static final String ADDRESS_LINE1 = "address_line1";
    public static final String ADDRESS_LINE2 = "address_line2";
    public static final String ADDRESS_CITY = "city";
    public static final String ADDRESS_STATE_CODE = "state_code";
    public static final String ADDRESS_ZIP = "zip";
    public static final String ADDRESS_COUNTRY = "country";

    // ========================================================================
    // Target entities
    // ========================================================================

    public static final String ENTITY_SITE = "site";
    public static final String ENTITY_USER = "user";
    public static final String ENTITY_CALL_QUEUE = "call_queue";
    public static final String ENTITY_AUTO_RECEPTIONIST = "auto_receptionist";
    public static final String ENTITY_IVR = "ivr";

    /** Default Zoom user type (basic) */
    public static final int DEFAULT_USER_TYPE = 1;

    /** Custom-hours entry type for weekly business hours */
    public static final int CUSTOM_HOURS_TYPE = 2;
}
