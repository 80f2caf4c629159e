package com.al.telephonytransformer.config;

import com.al.telephonytransformer.service.dispatcher.DialpadToZoomDispatcher;
import com.al.telephonytransformer.service.dispatcher.DispatcherRegistry;
import com.al.telephonytransformer.service.dispatcher.RingCentralToZoomDispatcher;
import com.al.telephonytransformer.service.dispatcher.SsotToZoomDispatcher;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * Builds the dispatcher registry. Every supported platform pair is listed
 * here; adding a source platform means adding one line.
 */
@Configuration
@Slf4j
public class DispatcherConfiguration {

    @Bean
    public DispatcherRegistry dispatcherRegistry(TransformerSupport transformerSupport) {
        DispatcherRegistry registry = new DispatcherRegistry(transformerSupport);
        registry.register(PLATFORM_RINGCENTRAL, PLATFORM_ZOOM, RingCentralToZoomDispatcher::new);
        registry.register(PLATFORM_SSOT, PLATFORM_ZOOM, SsotToZoomDispatcher::new);
        registry.register(PLATFORM_DIALPAD, PLATFORM_ZOOM, DialpadToZoomDispatcher::new);
        log.info("Dispatcher registry initialized: {}", registry.getSupportedPlatforms());
        return registry;
    }

    /**
     * In-memory meter registry for runs without an actuator-provided one.
     */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
