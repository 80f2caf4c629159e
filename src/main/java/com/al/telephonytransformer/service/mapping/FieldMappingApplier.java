package com.al.telephonytransformer.service.mapping;

import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies declarative {@link FieldMapping}s to a record.
 *
 * <p>
 * Never throws for missing data. Required source fields that are absent are
 * collected in {@link MappingResult#getMissingRequiredFields()} and the
 * caller decides whether that fails the record.
 */
@Component
@Slf4j
public class FieldMappingApplier {

    private static final Object ABSENT = new Object();

    /**
     * Write each mapped value at its literal target field name.
     */
    public MappingResult applyFlat(Map<String, Object> data, List<FieldMapping> mappings) {
        MappingResult result = new MappingResult();
        if (mappings == null) {
            return result;
        }
        for (FieldMapping mapping : mappings) {
            Object value = mappedValue(data, mapping, result);
            if (value != ABSENT) {
                result.getValues().put(mapping.getTargetField(), value);
            }
        }
        return result;
    }

    /**
     * Build a nested object under {@code targetParent} from mappings whose
     * target field starts with {@code targetParent + "."}. Undotted targets
     * are written at the root; dotted targets under any other parent are
     * ignored. A null parent writes every dotted target by its path.
     */
    public MappingResult applyNested(Map<String, Object> data, List<FieldMapping> mappings, String targetParent) {
        MappingResult result = new MappingResult();
        if (mappings == null) {
            return result;
        }
        String prefix = targetParent + ".";
        for (FieldMapping mapping : mappings) {
            String target = mapping.getTargetField();
            if (target == null) {
                continue;
            }
            boolean dotted = target.contains(".");
            if (dotted && targetParent != null && !target.startsWith(prefix)) {
                continue;
            }
            Object value = mappedValue(data, mapping, result);
            if (value == ABSENT) {
                continue;
            }
            if (dotted) {
                FieldPathResolver.set(result.getValues(), target, value);
            } else {
                result.getValues().put(target, value);
            }
        }
        return result;
    }

    /**
     * Apply a named rule. Unknown rule names leave the value untouched.
     */
    public Object applyRule(Object value, String ruleName) {
        if (ruleName == null || ruleName.trim().isEmpty()) {
            return value;
        }
        Optional<TransformationRule> rule = TransformationRule.fromName(ruleName);
        if (rule.isEmpty()) {
            log.warn("Unknown transformation rule '{}', passing value through", ruleName);
            return value;
        }
        return rule.get().apply(value);
    }

    /**
     * Value to write for a mapping, or {@link #ABSENT} when the source field
     * is missing. A present null is written as null and skips the rule.
     */
    private Object mappedValue(Map<String, Object> data, FieldMapping mapping, MappingResult result) {
        String source = mapping.getSourceField();
        if (!isPresent(data, source)) {
            if (mapping.isRequired()) {
                result.addMissing(source);
            }
            return ABSENT;
        }
        Object value = FieldPathResolver.get(data, source);
        if (value == null) {
            return null;
        }
        return applyRule(value, mapping.getTransformationRule());
    }

    private boolean isPresent(Map<String, Object> data, String sourceField) {
        if (data == null || sourceField == null) {
            return false;
        }
        return data.containsKey(sourceField) || FieldPathResolver.get(data, sourceField) != null;
    }
}
