package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.TestRecords;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.TestRecords.fixture;
import static com.al.telephonytransformer.TestRecords.json;
import static com.al.telephonytransformer.TestRecords.mapping;
import static org.junit.jupiter.api.Assertions.*;

public class SsotCallQueuesTransformerTest {

    private final SsotCallQueuesTransformer transformer = new SsotCallQueuesTransformer(TestRecords.support());

    @Test
    public void testTransform_DaySettingsBecomeCustomHours() {
        Map<String, Object> result = transformer.transform(fixture("ssot_call_queue.json"));

        assertEquals(Arrays.asList(
                json("{'weekday':2,'from':'08:00','to':'18:00','type':2}"),
                json("{'weekday':7,'from':'10:00','to':'14:00','type':2}")), result.get("custom_hours_settings"));
        assertNotNull(result.get("business_hours"));
    }

    @Test
    public void testTransform_ShortExtensionIsPrefixed() {
        Map<String, Object> result = transformer.transform(fixture("ssot_call_queue.json"));

        assertEquals("105", result.get("extensionNumber"));
        assertEquals("5", result.get("extension_number"));
    }

    @Test
    public void testTransform_ExistingExtensionNumberWins() {
        Map<String, Object> result = transformer.transform(
                json("{'id':'Q-3','name':'Q','extension_number':'5','extensionNumber':'300'}"));

        assertEquals("300", result.get("extensionNumber"));
    }

    @Test
    public void testTransform_AlwaysOpenScheduleHasNoCustomHours() {
        Map<String, Object> queue = json("{'id':'Q-2','name':'All Day','business_hours':{'schedule_type':'24_7',"
                + "'weekly_hours':{'monday':{'enabled':true,'start_time':'08:00','end_time':'18:00'}}}}");

        Map<String, Object> result = transformer.transform(queue);

        assertFalse(result.containsKey("custom_hours_settings"));
        assertEquals(queue, result);
    }

    @Test
    public void testTransform_WeeklyRangesShapeIsAccepted() {
        Map<String, Object> queue = json("{'id':'Q-4','name':'Rc Shaped','business_hours':[{'schedule':"
                + "{'weeklyRanges':{'Thursday':[{'from':'07:00','to':'15:00'}]}}}]}");

        Map<String, Object> result = transformer.transform(queue);

        assertEquals(List.of(json("{'weekday':5,'from':'07:00','to':'15:00','type':2}")),
                result.get("custom_hours_settings"));
    }

    @Test
    public void testTransform_MappingsWriteDottedPaths() {
        SsotCallQueuesTransformer mapped = new SsotCallQueuesTransformer(TestRecords.support(
                List.of(mapping("location_code", "site.id", null, false)), new LinkedHashMap<>()));
        Map<String, Object> queue = fixture("ssot_call_queue.json");
        queue.put("location_code", "S-100");

        Map<String, Object> result = mapped.transform(queue);

        assertEquals(json("{'id':'S-100'}"), result.get("site"));
    }

    @Test
    public void testValidation() {
        assertTrue(transformer.validateInput(fixture("ssot_call_queue.json")));
        assertFalse(transformer.validateInput(json("{'id':'Q-5'}")));
        assertFalse(transformer.validateOutput(json("{'id':'Q-5'}")));
        assertTrue(transformer.validateOutput(json("{'id':'Q-5','name':'Named'}")));
    }
}
