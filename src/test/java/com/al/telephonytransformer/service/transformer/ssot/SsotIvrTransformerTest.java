package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.TestRecords;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.TestRecords.fixture;
import static com.al.telephonytransformer.TestRecords.json;
import static org.junit.jupiter.api.Assertions.*;

public class SsotIvrTransformerTest {

    private final SsotIvrTransformer transformer = new SsotIvrTransformer(TestRecords.support());

    @Test
    public void testTransform_FoldsDetailsAndMenuOptions() {
        Map<String, Object> result = transformer.transform(fixture("ssot_ivr.json"));

        assertEquals(Arrays.asList(
                json("{'key':'1','action':7,'target':{'type':'call_queue','extension_id':'Q-1'}}"),
                json("{'key':'2','action':8,'target':{'type':'auto_receptionist','extension_id':'AR-9'}}"),
                json("{'key':'0','action':-1}")), result.get("ivr_actions"));
        assertFalse(result.containsKey("ivr_details"));
        assertFalse(result.containsKey("menu_options"));
        assertEquals("After Hours Menu", result.get("name"));
        assertTrue(transformer.validateOutput(result));
    }

    @Test
    public void testTransform_MenuOptionTargetIdBecomesTarget() {
        Map<String, Object> ivr = json("{'id':'IVR-9','menu_options':["
                + "{'key':'1','action':'Connect','target_type':'call_queue','target_id':'Q-1'},"
                + "{'key':'2','action':'Connect','target_id':'U-7'}]}");

        Map<String, Object> result = transformer.transform(ivr);

        assertEquals(Arrays.asList(
                json("{'key':'1','action':7,'target':{'type':'call_queue','extension_id':'Q-1'}}"),
                json("{'key':'2','action':2,'target':{'type':'user','extension_id':'U-7'}}")),
                result.get("ivr_actions"));
    }

    @Test
    public void testTransform_EmptyMenuOptionsStillWritesActions() {
        Map<String, Object> result = transformer.transform(json("{'id':'IVR-2','menu_options':[]}"));

        assertEquals(List.of(), result.get("ivr_actions"));
        assertFalse(result.containsKey("menu_options"));
    }

    @Test
    public void testTransform_WithoutMenuKeysCopiesUnchanged() {
        Map<String, Object> ivr = json("{'id':'IVR-3','name':'Plain'}");

        assertEquals(ivr, transformer.transform(ivr));
    }

    @Test
    public void testValidateInput_RequiresId() {
        assertTrue(transformer.validateInput(fixture("ssot_ivr.json")));
        assertFalse(transformer.validateInput(json("{'name':'No Id'}")));
    }
}
