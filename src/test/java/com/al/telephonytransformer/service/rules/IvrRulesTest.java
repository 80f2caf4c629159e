package com.al.telephonytransformer.service.rules;

import com.al.telephonytransformer.model.enums.IvrTargetType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.al.telephonytransformer.TestRecords.json;
import static org.junit.jupiter.api.Assertions.*;

public class IvrRulesTest {

    @Test
    public void testMapIvrAction_DependsOnTargetType() {
        assertEquals(7, IvrRules.mapIvrAction("Connect", "call_queue"));
        assertEquals(2, IvrRules.mapIvrAction("Connect", "user"));
        assertEquals(8, IvrRules.mapIvrAction("Connect", "auto_receptionist"));
        assertEquals(400, IvrRules.mapIvrAction("Voicemail", "call_queue"));
        assertEquals(300, IvrRules.mapIvrAction("Voicemail", IvrTargetType.AUTO_RECEPTIONIST));
        assertEquals(4, IvrRules.mapIvrAction("DialByName", IvrTargetType.USER));
    }

    @Test
    public void testMapIvrAction_UniversalActionsIgnoreTargetType() {
        assertEquals(21, IvrRules.mapIvrAction("Repeat", "call_queue"));
        assertEquals(21, IvrRules.mapIvrAction("Repeat", "nonsense"));
        assertEquals(22, IvrRules.mapIvrAction("ReturnToRoot", (String) null));
        assertEquals(-1, IvrRules.mapIvrAction("Disconnect", "user"));
    }

    @Test
    public void testMapIvrAction_UnknownIsDisabled() {
        assertEquals(-1, IvrRules.mapIvrAction("Teleport", "user"));
        assertEquals(-1, IvrRules.mapIvrAction(null, "user"));
        assertEquals(-1, IvrRules.mapIvrAction("Connect", "nonsense"));
    }

    @Test
    public void testMapIvrKey() {
        assertEquals("*", IvrRules.mapIvrKey("Star"));
        assertEquals("#", IvrRules.mapIvrKey("Hash"));
        assertEquals("timeout", IvrRules.mapIvrKey("NoInput"));
        assertEquals("5", IvrRules.mapIvrKey("5"));
        assertNull(IvrRules.mapIvrKey(null));
    }

    @Test
    public void testDetectExtensionType() {
        assertEquals(IvrTargetType.CALL_QUEUE, IvrRules.detectExtensionType("Support Queue"));
        assertEquals(IvrTargetType.CALL_QUEUE, IvrRules.detectExtensionType("Sales"));
        assertEquals(IvrTargetType.AUTO_RECEPTIONIST, IvrRules.detectExtensionType("Main Receptionist"));
        assertEquals(IvrTargetType.USER, IvrRules.detectExtensionType("Ada Lovelace"));
        assertEquals(IvrTargetType.USER, IvrRules.detectExtensionType(null));
    }

    @Test
    public void testBuildAction_ForwardingActionCarriesTarget() {
        Map<String, Object> action = IvrRules.buildAction("1", "Connect", IvrTargetType.CALL_QUEUE, 7001);

        assertEquals(json("{'key':'1','action':7,'target':{'type':'call_queue','extension_id':'7001'}}"), action);
    }

    @Test
    public void testBuildAction_NoTargetForDisabledOrRepeat() {
        Map<String, Object> disabled = IvrRules.buildAction("#", "Disconnect", IvrTargetType.USER, "62001");
        Map<String, Object> repeat = IvrRules.buildAction("*", "Repeat", IvrTargetType.USER, "9001");

        assertEquals(json("{'key':'#','action':-1}"), disabled);
        assertEquals(json("{'key':'*','action':21}"), repeat);
    }

    @Test
    public void testBuildAction_WithoutActionOrTargetType() {
        assertEquals(json("{'key':'3'}"), IvrRules.buildAction("3", null, IvrTargetType.USER, "1"));
        assertEquals(2, IvrRules.buildAction("4", "Connect", null, null).get("action"));
    }

    @Test
    public void testRequiresTarget() {
        assertFalse(IvrRules.requiresTarget(-1));
        assertFalse(IvrRules.requiresTarget(23));
        assertTrue(IvrRules.requiresTarget(2));
    }
}
