package com.al.telephonytransformer.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception thrown when no dispatcher is registered for a platform pair.
 * The message lists every supported combination.
 */
@Getter
public class TransformerNotFoundException extends RuntimeException {

    private final String requested;
    private final List<String> supported;

    public TransformerNotFoundException(String message, String requested, List<String> supported) {
        super(message);
        this.requested = requested;
        this.supported = supported;
    }

    public static TransformerNotFoundException forPlatforms(String source, String target, List<String> supported) {
        return new TransformerNotFoundException(
                String.format("No dispatcher available for %s -> %s. Available combinations: %s", source, target,
                        String.join(", ", supported)),
                source + " -> " + target, supported);
    }
}
