package com.al.telephonytransformer.service.transformer.ringcentral;

import com.al.telephonytransformer.TestRecords;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.al.telephonytransformer.TestRecords.json;
import static org.junit.jupiter.api.Assertions.*;

public class RingCentralAutoReceptionistsTransformerTest {

    private final RingCentralAutoReceptionistsTransformer transformer =
            new RingCentralAutoReceptionistsTransformer(TestRecords.support());

    @Test
    public void testTransform_SiteIdFromNestedSite() {
        Map<String, Object> result = transformer.transform(
                json("{'id':'8001','name':'Main Receptionist','site':{'id':'1','name':'Main Office'}}"));

        assertEquals("1", result.get("rc_site_id"));
        assertEquals(json("{'id':'1','name':'Main Office'}"), result.get("site"));
        assertTrue(transformer.validateOutput(result));
    }

    @Test
    public void testTransform_SiteIdFromFlattenedKey() {
        Map<String, Object> result = transformer.transform(json("{'id':'8002','name':'Branch AR','site.id':'2'}"));

        assertEquals("2", result.get("rc_site_id"));
    }

    @Test
    public void testTransform_WithoutSiteCopiesUnchanged() {
        Map<String, Object> ar = json("{'id':'8003','name':'Floating'}");

        Map<String, Object> result = transformer.transform(ar);

        assertEquals(ar, result);
        assertTrue(transformer.validateOutput(result));
    }

    @Test
    public void testValidateInput_RequiresIdAndName() {
        assertTrue(transformer.validateInput(json("{'id':'8001','name':'AR'}")));
        assertFalse(transformer.validateInput(json("{'id':'8001'}")));
    }
}
