package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.TestRecords;
import com.al.telephonytransformer.exception.TransformValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.TestRecords.fixture;
import static com.al.telephonytransformer.TestRecords.json;
import static com.al.telephonytransformer.TestRecords.mapping;
import static org.junit.jupiter.api.Assertions.*;

public class SsotSitesTransformerTest {

    private final SsotSitesTransformer transformer = new SsotSitesTransformer(TestRecords.support());

    @Test
    public void testTransform_AddressFromFlatColumns() {
        Map<String, Object> result = transformer.transform(fixture("ssot_site.json"));

        assertEquals(json("{'address_line1':'500 16th st','address_line2':'Ste 200','city':'Denver',"
                + "'state_code':'CO','zip':'80202','country':'US'}"), result.get("default_emergency_address"));
        assertEquals("DENVER_BRANCH_2", result.get("site_code"));
        assertEquals("ssot-site-100", result.get("record_id"));
        assertTrue(transformer.validateOutput(result));
    }

    @Test
    public void testTransform_BusinessAddressIsFoldedAndRemoved() {
        Map<String, Object> site = json("{'id':'S-1','name':'HQ','businessAddress':{'street':'1 Elm St',"
                + "'city':'Austin','state':'TX','zip':'73301','country':'United States'}}");

        Map<String, Object> result = transformer.transform(site);

        assertEquals(json("{'address_line1':'1 Elm St','city':'Austin','state_code':'TX','zip':'73301',"
                + "'country':'US'}"), result.get("default_emergency_address"));
        assertFalse(result.containsKey("businessAddress"));
        assertTrue(site.containsKey("businessAddress"));
    }

    @Test
    public void testTransform_AddressFromConfiguredFields() {
        Map<String, Object> config = json("{'address_transformation':{'source_fields':{'street':'addr1',"
                + "'city':'town','state':'region','zip':'postcode','country':'nation'},"
                + "'fallback_mapping':{'street':'alt_street'}}}");
        SsotSitesTransformer configured = new SsotSitesTransformer(TestRecords.support(new ArrayList<>(), config));
        Map<String, Object> site = json("{'id':'S-2','name':'Boise','addr1':'','alt_street':'12 oak st',"
                + "'town':'boise','region':'ID','postcode':'83702','nation':'United States'}");

        Map<String, Object> result = configured.transform(site);

        assertEquals(json("{'address_line1':'12 Oak ST','city':'Boise','state_code':'ID','zip':'83702',"
                + "'country':'US'}"), result.get("default_emergency_address"));
    }

    @Test
    public void testTransform_NoAddressSources() {
        Map<String, Object> result = transformer.transform(json("{'id':'S-3','name':'Virtual'}"));

        assertFalse(result.containsKey("default_emergency_address"));
        assertEquals("VIRTUAL", result.get("site_code"));
    }

    @Test
    public void testTransform_MappedFieldsMergeIntoEmergencyAddress() {
        SsotSitesTransformer mapped = new SsotSitesTransformer(TestRecords.support(
                List.of(mapping("county", "default_emergency_address.county", "uppercase", false)),
                new LinkedHashMap<>()));
        Map<String, Object> site = fixture("ssot_site.json");
        site.put("county", "denver county");

        Map<?, ?> address = (Map<?, ?>) mapped.transform(site).get("default_emergency_address");

        assertEquals("DENVER COUNTY", address.get("county"));
        assertEquals("500 16th st", address.get("address_line1"));
    }

    @Test
    public void testTransform_RequiredMappedFieldMissing() {
        SsotSitesTransformer mapped = new SsotSitesTransformer(TestRecords.support(
                List.of(mapping("site_phone", "default_emergency_address.phone", null, true)),
                new LinkedHashMap<>()));
        Map<String, Object> site = fixture("ssot_site.json");

        assertFalse(mapped.validateInput(site));
        TransformValidationException e = assertThrows(TransformValidationException.class,
                () -> mapped.transform(site));
        assertEquals("site_phone", e.getValidationErrors().get(0).getLocation());
    }

    @Test
    public void testValidateInput_RequiresIdAndName() {
        assertTrue(transformer.validateInput(fixture("ssot_site.json")));
        assertFalse(transformer.validateInput(json("{'name':'No Id'}")));
    }
}
