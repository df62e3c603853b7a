package com.healthtech.glucose.config;

import com.healthtech.glucose.aggregation.MinuteReducer;
import com.healthtech.glucose.util.BackfillCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    /**
     * Zone used for day windows and minute bucketing. Falls back to the host zone
     * when none is configured, which ties results to the deployment environment.
     */
    @Bean
    public ZoneId glucoseZone(GlucoseProperties properties) {
        String configured = properties.getBackfill().getZoneId();
        if (configured == null || configured.isBlank()) {
            ZoneId zone = ZoneId.systemDefault();
            log.warn("glucose.backfill.zone-id is not set; using host zone {} for day windows and minute buckets", zone);
            return zone;
        }
        ZoneId zone = ZoneId.of(configured.trim());
        log.info("Day windows and minute buckets use zone {}", zone);
        return zone;
    }

    @Bean
    public Clock glucoseClock(ZoneId glucoseZone) {
        return Clock.system(glucoseZone);
    }

    @Bean
    public BackfillCalendar backfillCalendar(Clock glucoseClock, GlucoseProperties properties) {
        return new BackfillCalendar(glucoseClock, properties.getBackfill().getInitialBackfillDays());
    }

    @Bean
    public MinuteReducer minuteReducer(ZoneId glucoseZone) {
        return new MinuteReducer(glucoseZone);
    }

    @Bean
    public RestTemplate nightscoutRestTemplate(RestTemplateBuilder builder, GlucoseProperties properties) {
        GlucoseProperties.Source source = properties.getSource();
        RestTemplateBuilder configured = builder
            .setConnectTimeout(source.getTimeout())
            .setReadTimeout(source.getTimeout());
        if (source.getApiSecret() != null && !source.getApiSecret().isBlank()) {
            configured = configured.defaultHeader("api-secret", source.getApiSecret());
        } else {
            log.warn("No Nightscout API secret configured (glucose.source.api-secret); requests are sent unauthenticated");
        }
        return configured.build();
    }
}
