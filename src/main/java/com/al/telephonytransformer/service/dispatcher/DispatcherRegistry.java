package com.al.telephonytransformer.service.dispatcher;

import com.al.telephonytransformer.exception.TransformerNotFoundException;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of platform dispatchers keyed by (source, target).
 *
 * <p>
 * The table is filled explicitly at startup by
 * {@link com.al.telephonytransformer.config.DispatcherConfiguration}.
 * Platform names are matched case-insensitively. Dispatcher instances are
 * created on first use and cached until replaced or {@link #clearCache()}.
 */
@Slf4j
public class DispatcherRegistry {

    private final TransformerSupport support;
    private final Map<String, Function<TransformerSupport, PlatformDispatcher>> factories = new ConcurrentHashMap<>();
    private final Map<String, PlatformDispatcher> dispatchers = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new ArrayList<>();

    public DispatcherRegistry(TransformerSupport support) {
        this.support = support;
    }

    public void register(String sourcePlatform, String targetPlatform,
            Function<TransformerSupport, PlatformDispatcher> factory) {
        String key = key(sourcePlatform, targetPlatform);
        synchronized (registrationOrder) {
            if (!registrationOrder.contains(key)) {
                registrationOrder.add(key);
            }
        }
        factories.put(key, factory);
        log.debug("Registered dispatcher for {}", key);
    }

    /**
     * Replace the factory for a platform pair and drop its cached dispatcher.
     */
    public void registerDispatcher(String sourcePlatform, String targetPlatform,
            Function<TransformerSupport, PlatformDispatcher> factory) {
        register(sourcePlatform, targetPlatform, factory);
        dispatchers.remove(key(sourcePlatform, targetPlatform));
        log.info("Replaced dispatcher for {} -> {}", sourcePlatform, targetPlatform);
    }

    /**
     * @throws TransformerNotFoundException if no dispatcher is registered for the pair
     */
    public PlatformDispatcher getDispatcher(String sourcePlatform, String targetPlatform) {
        String key = key(sourcePlatform, targetPlatform);
        Function<TransformerSupport, PlatformDispatcher> factory = factories.get(key);
        if (factory == null) {
            throw TransformerNotFoundException.forPlatforms(sourcePlatform, targetPlatform, supportedCombinations());
        }
        return dispatchers.computeIfAbsent(key, k -> {
            log.info("Creating dispatcher for {}", k);
            return factory.apply(support);
        });
    }

    /**
     * Target platforms per source platform.
     */
    public Map<String, List<String>> getSupportedPlatforms() {
        Map<String, List<String>> platforms = new LinkedHashMap<>();
        for (String key : orderedKeys()) {
            String[] parts = key.split(":", 2);
            platforms.computeIfAbsent(parts[0], source -> new ArrayList<>()).add(parts[1]);
        }
        return platforms;
    }

    public boolean supportsPlatformCombination(String sourcePlatform, String targetPlatform) {
        return factories.containsKey(key(sourcePlatform, targetPlatform));
    }

    public void clearCache() {
        dispatchers.clear();
        log.info("Dispatcher cache cleared");
    }

    public Map<String, Object> transform(String sourcePlatform, String targetPlatform, String jobType,
            Map<String, Object> data, TransformContext context) {
        return getDispatcher(sourcePlatform, targetPlatform).transform(jobType, data, context);
    }

    private List<String> supportedCombinations() {
        List<String> combinations = new ArrayList<>();
        for (String key : orderedKeys()) {
            combinations.add(key.replace(":", " -> "));
        }
        return combinations;
    }

    private List<String> orderedKeys() {
        synchronized (registrationOrder) {
            return new ArrayList<>(registrationOrder);
        }
    }

    private static String key(String sourcePlatform, String targetPlatform) {
        return normalize(sourcePlatform) + ":" + normalize(targetPlatform);
    }

    private static String normalize(String platform) {
        return platform == null ? "" : platform.trim().toLowerCase();
    }
}
