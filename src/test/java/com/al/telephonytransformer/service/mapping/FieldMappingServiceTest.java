package com.al.telephonytransformer.service.mapping;

import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.repository.FieldMappingRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static com.al.telephonytransformer.TestRecords.mapping;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class FieldMappingServiceTest {

    @Mock
    private FieldMappingRepository fieldMappingRepository;

    @InjectMocks
    private FieldMappingService fieldMappingService;

    @Test
    public void testGetFieldMappings_Success() {
        FieldMapping email = mapping("email", "user_info.email", "lowercase", true);
        when(fieldMappingRepository.findByJobTypeIdAndSourcePlatformAndTargetEntity(39, "ssot", "user"))
                .thenReturn(List.of(email));

        List<FieldMapping> result = fieldMappingService.getFieldMappings(39, "ssot", "user");

        assertEquals(1, result.size());
        assertSame(email, result.get(0));
    }

    @Test
    public void testGetFieldMappings_StoreFailureReturnsEmpty() {
        when(fieldMappingRepository.findByJobTypeIdAndSourcePlatformAndTargetEntity(anyInt(), anyString(),
                anyString())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        List<FieldMapping> result = fieldMappingService.getFieldMappings(33, "ringcentral", "site");

        assertNotNull(result);
        assertTrue(result.isEmpty());
    }
}
