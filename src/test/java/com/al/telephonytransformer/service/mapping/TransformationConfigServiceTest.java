package com.al.telephonytransformer.service.mapping;

import com.al.telephonytransformer.model.TransformationConfigEntity;
import com.al.telephonytransformer.repository.TransformationConfigRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class TransformationConfigServiceTest {

    @Mock
    private TransformationConfigRepository transformationConfigRepository;

    @InjectMocks
    private TransformationConfigService transformationConfigService;

    @Test
    public void testGetTransformationConfig_ParsesYaml() {
        TransformationConfigEntity entity = new TransformationConfigEntity();
        entity.setJobTypeCode("ssot_to_zoom_sites");
        entity.setTransformationConfig("address_transformation:\n"
                + "  source_fields:\n"
                + "    street: addr1\n"
                + "    city: town\n"
                + "required_fields:\n"
                + "  - name\n");
        when(transformationConfigRepository.findByJobTypeCodeAndActiveTrue("ssot_to_zoom_sites"))
                .thenReturn(Optional.of(entity));

        Map<String, Object> config = transformationConfigService.getTransformationConfig("ssot_to_zoom_sites");

        assertEquals(List.of("name"), config.get("required_fields"));
        assertEquals(Map.of("street", "addr1", "city", "town"),
                ((Map<?, ?>) config.get("address_transformation")).get("source_fields"));
    }

    @Test
    public void testGetTransformationConfig_MissingRow() {
        when(transformationConfigRepository.findByJobTypeCodeAndActiveTrue("rc_zoom_users"))
                .thenReturn(Optional.empty());

        assertTrue(transformationConfigService.getTransformationConfig("rc_zoom_users").isEmpty());
    }

    @Test
    public void testGetTransformationConfig_StoreFailure() {
        when(transformationConfigRepository.findByJobTypeCodeAndActiveTrue(anyString()))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertTrue(transformationConfigService.getTransformationConfig("rc_zoom_users").isEmpty());
    }

    @Test
    public void testParse_InvalidYamlYieldsEmptyMap() {
        assertTrue(transformationConfigService.parse("rc_zoom_sites", "key: [unclosed").isEmpty());
        assertTrue(transformationConfigService.parse("rc_zoom_sites", "   ").isEmpty());
        assertTrue(transformationConfigService.parse("rc_zoom_sites", null).isEmpty());
    }
}
