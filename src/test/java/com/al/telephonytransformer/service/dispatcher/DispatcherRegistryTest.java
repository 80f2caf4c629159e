package com.al.telephonytransformer.service.dispatcher;

import com.al.telephonytransformer.TestRecords;
import com.al.telephonytransformer.config.DispatcherConfiguration;
import com.al.telephonytransformer.exception.TransformerNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.TestRecords.fixture;
import static org.junit.jupiter.api.Assertions.*;

public class DispatcherRegistryTest {

    private final DispatcherRegistry registry = new DispatcherConfiguration()
            .dispatcherRegistry(TestRecords.support());

    @Test
    public void testGetDispatcher_PerPlatformPair() {
        assertTrue(registry.getDispatcher("ringcentral", "zoom") instanceof RingCentralToZoomDispatcher);
        assertTrue(registry.getDispatcher("SSOT", " Zoom ") instanceof SsotToZoomDispatcher);
        assertTrue(registry.getDispatcher("dialpad", "zoom") instanceof DialpadToZoomDispatcher);
    }

    @Test
    public void testGetDispatcher_IsCached() {
        assertSame(registry.getDispatcher("ssot", "zoom"), registry.getDispatcher("ssot", "zoom"));
    }

    @Test
    public void testGetDispatcher_UnknownPairListsCombinations() {
        TransformerNotFoundException e = assertThrows(TransformerNotFoundException.class,
                () -> registry.getDispatcher("teams", "zoom"));

        assertEquals(List.of("ringcentral -> zoom", "ssot -> zoom", "dialpad -> zoom"), e.getSupported());
        assertTrue(e.getMessage().contains("teams -> zoom"));
        assertTrue(e.getMessage().contains("dialpad -> zoom"));
    }

    @Test
    public void testGetSupportedPlatforms() {
        Map<String, List<String>> platforms = registry.getSupportedPlatforms();

        assertEquals(List.of("ringcentral", "ssot", "dialpad"), List.copyOf(platforms.keySet()));
        assertEquals(List.of("zoom"), platforms.get("dialpad"));
        assertTrue(registry.supportsPlatformCombination("RingCentral", "zoom"));
        assertFalse(registry.supportsPlatformCombination("zoom", "ringcentral"));
    }

    @Test
    public void testClearCache_CreatesNewDispatcher() {
        PlatformDispatcher before = registry.getDispatcher("ringcentral", "zoom");

        registry.clearCache();

        assertNotSame(before, registry.getDispatcher("ringcentral", "zoom"));
    }

    @Test
    public void testRegisterDispatcher_ReplacesCachedInstance() {
        PlatformDispatcher before = registry.getDispatcher("ringcentral", "zoom");

        registry.registerDispatcher("ringcentral", "zoom", SsotToZoomDispatcher::new);

        PlatformDispatcher after = registry.getDispatcher("ringcentral", "zoom");
        assertNotSame(before, after);
        assertTrue(after instanceof SsotToZoomDispatcher);
        assertEquals(3, registry.getSupportedPlatforms().size());
    }

    @Test
    public void testTransform_RoutesThroughDispatcher() {
        Map<String, Object> result = registry.transform("dialpad", "zoom", "33", fixture("dialpad_office.json"),
                null);

        assertEquals("AUSTIN_OFFICE", result.get("site_code"));
        assertEquals("dialpad_zoom_sites",
                registry.getDispatcher("dialpad", "zoom").getTransformer("33").getJobTypeCode());
    }
}
