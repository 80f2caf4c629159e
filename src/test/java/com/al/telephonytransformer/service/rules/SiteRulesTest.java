package com.al.telephonytransformer.service.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SiteRulesTest {

    @Test
    public void testSiteCode() {
        assertEquals("MAIN_OFFICE", SiteRules.siteCode("Main Office"));
        assertEquals("DENVER_BRANCH_2", SiteRules.siteCode("Denver Branch-2"));
        assertEquals("ST_LOUIS_HQ", SiteRules.siteCode("St. Louis (HQ)"));
        assertEquals("", SiteRules.siteCode(null));
    }

    @Test
    public void testSiteCode_TruncatesToMaxLength() {
        String code = SiteRules.siteCode("International Headquarters Building");

        assertEquals(SiteRules.DEFAULT_SITE_CODE_LENGTH, code.length());
        assertEquals("INTERNATIONAL_HEADQU", code);
        assertEquals("MAIN", SiteRules.siteCode("Main Office", 4));
    }

    @Test
    public void testAutoReceptionistName_AppendsSuffix() {
        assertEquals("Main Office (NIU)", SiteRules.autoReceptionistName("Main Office", 30));
    }

    @Test
    public void testAutoReceptionistName_ShortensBaseNotSuffix() {
        String name = SiteRules.autoReceptionistName("Regional Operations Hub North", 30);

        assertEquals("Regional Operations Hub (NIU)", name);
        assertTrue(name.length() <= 30);
    }

    @Test
    public void testAutoReceptionistName_BlankName() {
        assertEquals("Unknown (NIU)", SiteRules.autoReceptionistName(" ", 30));
        assertEquals("Unknown", SiteRules.autoReceptionistName(null, 7));
    }
}
