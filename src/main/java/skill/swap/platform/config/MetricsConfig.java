package skill.swap.platform.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Metrics configuration for Prometheus monitoring
 */
@Slf4j
@Configuration
public class MetricsConfig {

    static final List<Tag> COMMON_TAGS = List.of(Tag.of("service", "skill-swap-platform"));

    /**
     * Common tags applied before any business meter registers
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTagsCustomizer() {
        return registry -> {
            registry.config().commonTags(COMMON_TAGS);
            log.info("Registered common metric tags: {}", COMMON_TAGS);
        };
    }
}
