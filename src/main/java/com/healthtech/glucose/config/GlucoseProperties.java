package com.healthtech.glucose.config;

import com.healthtech.glucose.domain.BackfillMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Externalized configuration for the glucose history service.
 * Maps to 'glucose.*' properties in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "glucose")
public class GlucoseProperties {

    @Valid
    private Source source = new Source();

    @Valid
    private Backfill backfill = new Backfill();

    @Data
    public static class Source {
        /** Nightscout server: "host", "host:port" or a full http(s) URL. */
        @NotBlank
        private String baseUrl = "http://localhost:1337";
        private String apiSecret = "";
        @NotNull
        private Duration timeout = Duration.ofSeconds(15);
        @Min(1)
        private int pageSize = 300;
        @Min(1)
        private int maxPages = 12;
    }

    @Data
    public static class Backfill {
        @NotNull
        private BackfillMode mode = BackfillMode.SCHEDULED;
        @Min(1)
        private int initialBackfillDays = 14;
        /** Blank means the JVM default zone. */
        private String zoneId = "";
        @Min(1000)
        private long stepIntervalMs = 300_000L;
        private long initialDelayMs = 10_000L;
    }
}
