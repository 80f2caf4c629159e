package com.al.telephonytransformer.model.enums;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * Catalog of transformation job types.
 *
 * <p>
 * {@code code} is the public key used by callers. {@code id} keys the
 * field-mapping tables and is shared by every source platform for the same
 * entity, so a mapping lookup is always (id, source platform, entity).
 * Dependencies list the job types whose output must be loaded first. Every
 * job type here transforms records; none is extraction only.
 */
public enum JobType {

    RC_ZOOM_SITES("rc_zoom_sites", 33, "RingCentral sites", SourcePlatform.RINGCENTRAL, ENTITY_SITE),
    RC_ZOOM_USERS("rc_zoom_users", 39, "RingCentral users", SourcePlatform.RINGCENTRAL, ENTITY_USER,
            "rc_zoom_sites"),
    RC_ZOOM_CALL_QUEUES("rc_zoom_call_queues", 45, "RingCentral call queues", SourcePlatform.RINGCENTRAL,
            ENTITY_CALL_QUEUE, "rc_zoom_sites", "rc_zoom_users"),
    RC_ZOOM_ARS("rc_zoom_ars", 77, "RingCentral auto receptionists", SourcePlatform.RINGCENTRAL,
            ENTITY_AUTO_RECEPTIONIST, "rc_zoom_sites"),
    RC_ZOOM_IVR("rc_zoom_ivr", 78, "RingCentral IVR menus", SourcePlatform.RINGCENTRAL, ENTITY_IVR,
            "rc_zoom_ars", "rc_zoom_call_queues", "rc_zoom_users"),

    SSOT_TO_ZOOM_SITES("ssot_to_zoom_sites", 33, "SSOT sites", SourcePlatform.SSOT, ENTITY_SITE),
    SSOT_TO_ZOOM_USERS("ssot_to_zoom_users", 39, "SSOT users", SourcePlatform.SSOT, ENTITY_USER,
            "ssot_to_zoom_sites"),
    SSOT_TO_ZOOM_CALL_QUEUES("ssot_to_zoom_call_queues", 45, "SSOT call queues", SourcePlatform.SSOT,
            ENTITY_CALL_QUEUE, "ssot_to_zoom_sites", "ssot_to_zoom_users"),
    SSOT_TO_ZOOM_AUTO_RECEPTIONISTS("ssot_to_zoom_auto_receptionists", 77, "SSOT auto receptionists",
            SourcePlatform.SSOT, ENTITY_AUTO_RECEPTIONIST, "ssot_to_zoom_sites"),
    SSOT_TO_ZOOM_IVR("ssot_to_zoom_ivr", 78, "SSOT IVR menus", SourcePlatform.SSOT, ENTITY_IVR,
            "ssot_to_zoom_auto_receptionists", "ssot_to_zoom_call_queues", "ssot_to_zoom_users"),

    DIALPAD_ZOOM_SITES("dialpad_zoom_sites", 33, "Dialpad offices", SourcePlatform.DIALPAD, ENTITY_SITE),
    DIALPAD_ZOOM_USERS("dialpad_zoom_users", 39, "Dialpad users", SourcePlatform.DIALPAD, ENTITY_USER,
            "dialpad_zoom_sites"),
    DIALPAD_ZOOM_CALL_QUEUES("dialpad_zoom_call_queues", 45, "Dialpad departments", SourcePlatform.DIALPAD,
            ENTITY_CALL_QUEUE, "dialpad_zoom_sites", "dialpad_zoom_users"),
    DIALPAD_ZOOM_ARS("dialpad_zoom_ars", 77, "Dialpad main lines", SourcePlatform.DIALPAD,
            ENTITY_AUTO_RECEPTIONIST, "dialpad_zoom_sites"),
    DIALPAD_ZOOM_IVR("dialpad_zoom_ivr", 78, "Dialpad IVR menus", SourcePlatform.DIALPAD, ENTITY_IVR,
            "dialpad_zoom_ars", "dialpad_zoom_call_queues", "dialpad_zoom_users");

    private final String code;
    private final int id;
    private final String displayName;
    private final SourcePlatform sourcePlatform;
    private final String targetEntity;
    private final boolean extractionOnly;
    private final List<String> dependencies;

    JobType(String code, int id, String displayName, SourcePlatform sourcePlatform, String targetEntity,
            String... dependencies) {
        this.code = code;
        this.id = id;
        this.displayName = displayName;
        this.sourcePlatform = sourcePlatform;
        this.targetEntity = targetEntity;
        this.extractionOnly = false;
        this.dependencies = Collections.unmodifiableList(Arrays.asList(dependencies));
    }

    public String getCode() {
        return code;
    }

    public int getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public SourcePlatform getSourcePlatform() {
        return sourcePlatform;
    }

    public String getTargetPlatform() {
        return PLATFORM_ZOOM;
    }

    public String getTargetEntity() {
        return targetEntity;
    }

    public boolean isExtractionOnly() {
        return extractionOnly;
    }

    public List<String> getDependencies() {
        return dependencies;
    }
}
