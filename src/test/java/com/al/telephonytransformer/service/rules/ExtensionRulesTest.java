package com.al.telephonytransformer.service.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExtensionRulesTest {

    @Test
    public void testDeterministicExtension_IsStable() {
        String first = ExtensionRules.deterministicExtension("5551234", "ar");
        String second = ExtensionRules.deterministicExtension("5551234", "ar");

        assertEquals(first, second);
    }

    @Test
    public void testDeterministicExtension_ClassBands() {
        for (int id = 0; id < 50; id++) {
            int ar = Integer.parseInt(ExtensionRules.deterministicExtension(id, "ar"));
            int cq = Integer.parseInt(ExtensionRules.deterministicExtension(id, "cq"));
            int other = Integer.parseInt(ExtensionRules.deterministicExtension(id, "user"));

            assertTrue(ar >= 300 && ar <= 399, "ar out of band: " + ar);
            assertTrue(cq >= 200 && cq <= 299, "cq out of band: " + cq);
            assertTrue(other >= 400 && other <= 999, "other out of band: " + other);
        }
    }

    @Test
    public void testDeterministicExtension_DistinctAcrossClasses() {
        assertNotEquals(ExtensionRules.deterministicExtension("5551234", "ar"),
                ExtensionRules.deterministicExtension("5551234", "cq"));
    }

    @Test
    public void testApplyMinimumLength() {
        assertEquals("007", ExtensionRules.applyMinimumLength("7", 3, '0', true));
        assertEquals("7xx", ExtensionRules.applyMinimumLength(7, 3, 'x', false));
        assertEquals("1234", ExtensionRules.applyMinimumLength("1234", 3, '0', true));
        assertNull(ExtensionRules.applyMinimumLength(null, 3, '0', true));
    }

    @Test
    public void testApplyCustomExtensionFormat() {
        assertEquals("105", ExtensionRules.applyCustomExtensionFormat("5", "10", 3));
        assertEquals("125", ExtensionRules.applyCustomExtensionFormat(25, "10", 3));
        assertEquals("1234", ExtensionRules.applyCustomExtensionFormat(" 1234 ", "10", 3));
    }

    @Test
    public void testApplyCustomExtensionFormat_NonNumericReturnedAsIs() {
        assertEquals("ab", ExtensionRules.applyCustomExtensionFormat("ab", "10", 3));
        assertEquals("5", ExtensionRules.applyCustomExtensionFormat("5", "", 3));
        assertNull(ExtensionRules.applyCustomExtensionFormat(null, "10", 3));
    }
}
