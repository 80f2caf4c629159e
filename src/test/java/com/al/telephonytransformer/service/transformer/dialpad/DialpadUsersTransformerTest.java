package com.al.telephonytransformer.service.transformer.dialpad;

import com.al.telephonytransformer.TestRecords;
import com.al.telephonytransformer.service.transformer.ringcentral.RingCentralUsersTransformer;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.al.telephonytransformer.TestRecords.fixture;
import static com.al.telephonytransformer.TestRecords.json;
import static org.junit.jupiter.api.Assertions.*;

public class DialpadUsersTransformerTest {

    private final DialpadUsersTransformer transformer = new DialpadUsersTransformer(TestRecords.support());

    @Test
    public void testTransform_UserToRingCentralShape() {
        Map<String, Object> result = transformer.transform(fixture("dialpad_user.json"));

        assertEquals("Alan Turing", result.get("name"));
        assertEquals("1201", result.get("extensionNumber"));
        assertEquals("NotActivated", result.get("status"));
        assertEquals("User", result.get("type"));
        assertEquals(json("{'first_name':'Alan','last_name':'Turing','email':'alan@example.com',"
                + "'phone_number':'+15125550199','timezone':'America/New_York','type':'User'}"),
                result.get("user_info"));
        assertTrue(transformer.validateOutput(result));
    }

    @Test
    public void testTransform_UserInfoMatchesRingCentralKeys() {
        Map<?, ?> dialpad = (Map<?, ?>) transformer.transform(fixture("dialpad_user.json")).get("user_info");
        Map<?, ?> ringCentral = (Map<?, ?>) new RingCentralUsersTransformer(TestRecords.support())
                .transform(fixture("rc_user.json")).get("user_info");

        assertEquals(ringCentral.keySet(), dialpad.keySet());
    }

    @Test
    public void testTransform_MissingOptionalFields() {
        Map<String, Object> result = transformer.transform(json("{'id':'4802','emails':['x@y.z']}"));

        Map<?, ?> userInfo = (Map<?, ?>) result.get("user_info");
        assertEquals("Enabled", result.get("status"));
        assertFalse(result.containsKey("extensionNumber"));
        assertNull(userInfo.get("phone_number"));
        assertFalse(transformer.validateOutput(result));
    }

    @Test
    public void testValidateInput_RequiresIdAndEmail() {
        assertTrue(transformer.validateInput(fixture("dialpad_user.json")));
        assertFalse(transformer.validateInput(json("{'id':'4803','emails':[]}")));
        assertFalse(transformer.validateInput(json("{'emails':['x@y.z']}")));
    }
}
