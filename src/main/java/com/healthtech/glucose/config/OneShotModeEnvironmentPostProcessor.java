package com.healthtech.glucose.config;

import com.healthtech.glucose.domain.BackfillMode;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * Starts catch-up and single-step runs without a web server, so cron invocations can overlap
 * each other and the scheduled service without competing for the HTTP port.
 *
 * An explicit spring.main.web-application-type still wins.
 */
public class OneShotModeEnvironmentPostProcessor implements EnvironmentPostProcessor {

    static final String PROPERTY_SOURCE_NAME = "glucoseOneShotMode";
    static final String WEB_APPLICATION_TYPE = "spring.main.web-application-type";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        BackfillMode mode = Binder.get(environment)
            .bind("glucose.backfill.mode", BackfillMode.class)
            .orElse(BackfillMode.SCHEDULED);

        if (mode.isOneShot() && !environment.containsProperty(WEB_APPLICATION_TYPE)) {
            environment.getPropertySources().addLast(
                new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(WEB_APPLICATION_TYPE, "none")));
        }
    }
}
