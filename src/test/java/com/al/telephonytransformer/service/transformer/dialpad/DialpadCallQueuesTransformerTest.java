package com.al.telephonytransformer.service.transformer.dialpad;

import com.al.telephonytransformer.TestRecords;
import com.al.telephonytransformer.service.rules.ExtensionRules;
import com.al.telephonytransformer.util.FieldPathResolver;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.TestRecords.fixture;
import static com.al.telephonytransformer.TestRecords.json;
import static org.junit.jupiter.api.Assertions.*;

public class DialpadCallQueuesTransformerTest {

    private final DialpadCallQueuesTransformer transformer = new DialpadCallQueuesTransformer(TestRecords.support());

    @Test
    public void testTransform_DayHoursBecomeBusinessAndCustomHours() {
        Map<String, Object> result = transformer.transform(fixture("dialpad_department.json"));

        assertEquals(List.of(json("{'schedule':{'weeklyRanges':{'Monday':[{'from':'08:00','to':'18:00'}],"
                + "'Wednesday':[{'from':'09:00','to':'17:00'}]}}}")), result.get("business_hours"));
        assertEquals(Arrays.asList(
                json("{'weekday':2,'from':'08:00','to':'18:00','type':2}"),
                json("{'weekday':4,'from':'09:00','to':'17:00','type':2}")), result.get("custom_hours_settings"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testTransform_BusinessHoursCanBeEditedDownstream() {
        Map<String, Object> result = transformer.transform(fixture("dialpad_department.json"));

        List<Object> businessHours = (List<Object>) result.get("business_hours");
        businessHours.add(json("{'schedule':{}}"));
        Map<String, Object> first = (Map<String, Object>) businessHours.get(0);
        first.put("label", "open");
        List<Object> monday = (List<Object>) FieldPathResolver.get(first, "schedule.weeklyRanges.Monday");
        monday.add(json("{'from':'19:00','to':'20:00'}"));

        assertEquals(2, businessHours.size());
        assertEquals("open", first.get("label"));
        assertEquals(2, monday.size());
    }

    @Test
    public void testTransform_SynthesizesExtensionAndSite() {
        Map<String, Object> result = transformer.transform(fixture("dialpad_department.json"));

        String extension = (String) result.get("extensionNumber");
        assertEquals(ExtensionRules.deterministicExtension("7771", "cq"), extension);
        int number = Integer.parseInt(extension);
        assertTrue(number >= 200 && number <= 299);
        assertEquals(json("{'id':5551234,'name':'Sales'}"), result.get("site"));
        assertTrue(transformer.validateOutput(result));
    }

    @Test
    public void testTransform_ExtensionIsStableAcrossRuns() {
        assertEquals(transformer.transform(fixture("dialpad_department.json")).get("extensionNumber"),
                transformer.transform(fixture("dialpad_department.json")).get("extensionNumber"));
    }

    @Test
    public void testTransform_NoHoursMeansNoBusinessHours() {
        Map<String, Object> result = transformer.transform(json("{'id':7772,'name':'Support','office_id':1}"));

        assertFalse(result.containsKey("business_hours"));
        assertFalse(result.containsKey("custom_hours_settings"));
    }

    @Test
    public void testValidateInput_RequiresIdAndName() {
        assertTrue(transformer.validateInput(fixture("dialpad_department.json")));
        assertFalse(transformer.validateInput(json("{'id':7773}")));
    }
}
