package com.al.telephonytransformer.service.rules;

import com.al.telephonytransformer.model.enums.IvrTargetType;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * IVR key and action vocabulary for Zoom auto receptionist menus.
 *
 * <p>
 * Action codes are two-tier: universal actions (repeat, return to menu,
 * disconnect) have one code for every target, every other action is looked
 * up per target type. Unknown combinations resolve to {@value #ACTION_DISABLED}.
 *
 * <p>
 * Target type detection from an extension display name is a keyword
 * heuristic. It is only used when the source carries no explicit type.
 *
 * @author Telephony Transformer Team
 * @since 1.0.0
 */
@Slf4j
public final class IvrRules {

    public static final int ACTION_DISABLED = -1;
    public static final int ACTION_REPEAT = 21;
    public static final int ACTION_RETURN_TO_ROOT = 22;
    public static final int ACTION_RETURN_TO_PREVIOUS = 23;

    /** Action codes that never carry a target object */
    public static final Set<Integer> NO_TARGET_ACTIONS = new HashSet<>(
            Arrays.asList(ACTION_DISABLED, ACTION_REPEAT, ACTION_RETURN_TO_ROOT, ACTION_RETURN_TO_PREVIOUS));

    private static final List<String> QUEUE_KEYWORDS = Arrays.asList("queue", "support", "sales", "service", "help",
            "department", "team", "pso");
    private static final List<String> RECEPTIONIST_KEYWORDS = Arrays.asList("receptionist", "menu", "main", "ivr",
            "auto", "greeting");

    private static final Map<String, String> KEYS = new HashMap<>();
    private static final Map<String, Integer> UNIVERSAL_ACTIONS = new HashMap<>();
    private static final Map<IvrTargetType, Map<String, Integer>> TARGET_ACTIONS = new EnumMap<>(IvrTargetType.class);

    static {
        KEYS.put("Star", "*");
        KEYS.put("Hash", "#");
        KEYS.put("NoInput", "timeout");

        UNIVERSAL_ACTIONS.put("Repeat", ACTION_REPEAT);
        UNIVERSAL_ACTIONS.put("ReturnToRoot", ACTION_RETURN_TO_ROOT);
        UNIVERSAL_ACTIONS.put("ReturnToPrevious", ACTION_RETURN_TO_PREVIOUS);
        UNIVERSAL_ACTIONS.put("ReturnToTopLevelMenu", ACTION_RETURN_TO_ROOT);
        UNIVERSAL_ACTIONS.put("Disconnect", ACTION_DISABLED);
        UNIVERSAL_ACTIONS.put("DoNothing", ACTION_DISABLED);

        TARGET_ACTIONS.put(IvrTargetType.USER, targetActions(2, 200, 2));
        TARGET_ACTIONS.put(IvrTargetType.CALL_QUEUE, targetActions(7, 400, 7));
        TARGET_ACTIONS.put(IvrTargetType.AUTO_RECEPTIONIST, targetActions(8, 300, 8));
    }

    private IvrRules() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Map a platform key name to a Zoom key: Star to *, Hash to #, NoInput to
     * timeout. Digits and unknown keys pass through.
     */
    public static String mapIvrKey(String key) {
        if (key == null) {
            return null;
        }
        String mapped = KEYS.get(key);
        return mapped == null ? key : mapped;
    }

    /**
     * Map an action name to a Zoom action code for the given target type.
     *
     * @param action     platform action, e.g. {@code Connect}
     * @param targetType {@code user}, {@code call_queue} or {@code auto_receptionist}
     * @return action code, {@value #ACTION_DISABLED} when unknown
     */
    public static int mapIvrAction(String action, String targetType) {
        return mapIvrAction(action, IvrTargetType.fromValue(targetType));
    }

    public static int mapIvrAction(String action, IvrTargetType targetType) {
        if (action == null) {
            log.warn("Missing IVR action, using {} (disabled)", ACTION_DISABLED);
            return ACTION_DISABLED;
        }
        Integer universal = UNIVERSAL_ACTIONS.get(action);
        if (universal != null) {
            return universal;
        }
        Integer code = targetType == null ? null : TARGET_ACTIONS.get(targetType).get(action);
        if (code == null) {
            log.warn("Unknown IVR action '{}' for target type '{}', using {} (disabled)", action,
                    targetType == null ? null : targetType.getValue(), ACTION_DISABLED);
            return ACTION_DISABLED;
        }
        return code;
    }

    /**
     * Guess the target type of an extension from its display name. Names
     * without a queue or receptionist keyword are treated as users.
     */
    public static IvrTargetType detectExtensionType(String extensionName) {
        if (extensionName == null || extensionName.trim().isEmpty()) {
            return IvrTargetType.USER;
        }
        String lower = extensionName.toLowerCase();
        for (String keyword : QUEUE_KEYWORDS) {
            if (lower.contains(keyword)) {
                return IvrTargetType.CALL_QUEUE;
            }
        }
        for (String keyword : RECEPTIONIST_KEYWORDS) {
            if (lower.contains(keyword)) {
                return IvrTargetType.AUTO_RECEPTIONIST;
            }
        }
        return IvrTargetType.USER;
    }

    public static boolean requiresTarget(int actionCode) {
        return !NO_TARGET_ACTIONS.contains(actionCode);
    }

    /**
     * Build one Zoom IVR action entry.
     *
     * @param key         Zoom key, may be null
     * @param actionName  platform action name, may be null (no action written)
     * @param targetType  resolved target type
     * @param extensionId target extension id, may be null
     * @return action map with {@code key}, {@code action} and, for actions that
     *         forward somewhere, {@code target}
     */
    public static Map<String, Object> buildAction(String key, String actionName, IvrTargetType targetType,
            Object extensionId) {
        Map<String, Object> action = new LinkedHashMap<>();
        if (key != null) {
            action.put("key", key);
        }
        if (actionName == null) {
            return action;
        }
        IvrTargetType resolvedType = targetType == null ? IvrTargetType.USER : targetType;
        int code = mapIvrAction(actionName, resolvedType);
        action.put("action", code);
        if (extensionId != null && !String.valueOf(extensionId).isEmpty() && requiresTarget(code)) {
            Map<String, Object> target = new LinkedHashMap<>();
            target.put("type", resolvedType.getValue());
            target.put("extension_id", String.valueOf(extensionId));
            action.put("target", target);
        }
        return action;
    }

    private static Map<String, Integer> targetActions(int connect, int voicemail, int operator) {
        Map<String, Integer> actions = new HashMap<>();
        actions.put("Connect", connect);
        actions.put("Voicemail", voicemail);
        actions.put("Transfer", 10);
        actions.put("ConnectToOperator", operator);
        actions.put("DialByName", 4);
        return actions;
    }
}
