package com.al.telephonytransformer.service;

import com.al.telephonytransformer.config.TransformerProperties;
import com.al.telephonytransformer.dto.BatchTransformResult;
import com.al.telephonytransformer.dto.RecordError;
import com.al.telephonytransformer.exception.TransformValidationException;
import com.al.telephonytransformer.exception.TransformationException;
import com.al.telephonytransformer.service.dispatcher.DispatcherRegistry;
import com.al.telephonytransformer.service.dispatcher.PlatformDispatcher;
import com.al.telephonytransformer.service.transformer.TransformContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.KEY_ID;

/**
 * Entry point for callers: single-record and batch transforms with metrics.
 */
@Service
@Slf4j
public class TransformationService {

    static final String METRIC_DURATION = "telephony.transform.duration";
    static final String METRIC_COUNT = "telephony.transform.count";

    private final DispatcherRegistry dispatcherRegistry;
    private final MeterRegistry meterRegistry;
    private final TransformerProperties properties;

    @Autowired
    public TransformationService(DispatcherRegistry dispatcherRegistry, MeterRegistry meterRegistry,
            TransformerProperties properties) {
        this.dispatcherRegistry = dispatcherRegistry;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    /**
     * Transform one record.
     *
     * @throws com.al.telephonytransformer.exception.TransformerNotFoundException
     *             if the platform pair or job type is not supported
     * @throws TransformValidationException if the record fails validation
     * @throws TransformationException      if the transformer fails
     */
    public Map<String, Object> transform(String sourcePlatform, String targetPlatform, String jobType,
            Map<String, Object> record, TransformContext context) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return dispatcherRegistry.transform(sourcePlatform, targetPlatform, jobType, record, context);
        } catch (RuntimeException e) {
            status = e instanceof TransformValidationException ? "invalid" : "error";
            throw e;
        } finally {
            meterRegistry.counter(METRIC_COUNT, "source", String.valueOf(sourcePlatform), "target",
                    String.valueOf(targetPlatform), "job_type", String.valueOf(jobType), "status", status)
                    .increment();
            sample.stop(meterRegistry.timer(METRIC_DURATION, "source", String.valueOf(sourcePlatform), "target",
                    String.valueOf(targetPlatform), "job_type", String.valueOf(jobType)));
        }
    }

    /**
     * Transform a batch of records of one job type. A failing record is
     * reported and the rest of the batch continues. The platform pair and
     * job type are resolved before any record is processed.
     *
     * @throws IllegalArgumentException if the batch exceeds the configured maximum
     */
    public BatchTransformResult transformBatch(String sourcePlatform, String targetPlatform, String jobType,
            List<Map<String, Object>> records, TransformContext context) {
        List<Map<String, Object>> input = records == null ? new ArrayList<>() : records;
        int maxRecords = properties.getBatch().getMaxRecords();
        if (input.size() > maxRecords) {
            throw new IllegalArgumentException(
                    String.format("Batch of %d records exceeds the maximum of %d", input.size(), maxRecords));
        }

        PlatformDispatcher dispatcher = dispatcherRegistry.getDispatcher(sourcePlatform, targetPlatform);
        String jobTypeCode = dispatcher.getTransformer(jobType).getJobTypeCode();

        BatchTransformResult result = BatchTransformResult.builder()
                .sourcePlatform(sourcePlatform)
                .targetPlatform(targetPlatform)
                .jobTypeCode(jobTypeCode)
                .totalCount(input.size())
                .build();

        for (int i = 0; i < input.size(); i++) {
            Map<String, Object> record = input.get(i);
            try {
                result.addRecord(transform(sourcePlatform, targetPlatform, jobTypeCode, record, context));
            } catch (TransformValidationException e) {
                log.warn("Record {} of {} batch failed validation: {}", i, jobTypeCode, e.getMessage());
                result.addError(recordError(i, record, jobTypeCode, "VALIDATION_FAILED", e, validationDetails(e)));
            } catch (TransformationException e) {
                log.error("Record {} of {} batch failed: {}", i, jobTypeCode, e.getMessage());
                result.addError(recordError(i, record, jobTypeCode, "TRANSFORMATION_FAILED", e, new ArrayList<>()));
            }
        }

        log.info("Batch {} complete: {} transformed, {} failed", jobTypeCode, result.getSuccessCount(),
                result.getFailureCount());
        return result;
    }

    private static List<String> validationDetails(TransformValidationException e) {
        List<String> details = new ArrayList<>();
        for (TransformValidationException.ValidationError error : e.getValidationErrors()) {
            details.add(error.getLocation() + ": " + error.getMessage());
        }
        return details;
    }

    private static RecordError recordError(int index, Map<String, Object> record, String jobTypeCode,
            String errorCode, RuntimeException e, List<String> details) {
        Object id = record == null ? null : record.get(KEY_ID);
        return RecordError.builder()
                .recordIndex(index)
                .recordId(id == null ? null : String.valueOf(id))
                .jobTypeCode(jobTypeCode)
                .errorCode(errorCode)
                .message(e.getMessage())
                .details(details)
                .exceptionType(e.getClass().getSimpleName())
                .build();
    }
}
