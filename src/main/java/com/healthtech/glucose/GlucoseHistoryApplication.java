package com.healthtech.glucose;

import com.healthtech.glucose.config.GlucoseProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Glucose History Service
 *
 * Backfills one average glucose value per calendar minute per day from a Nightscout
 * server into PostgreSQL, for display layers that should not query Nightscout directly.
 *
 * Run modes (glucose.backfill.mode):
 * - scheduled: one backfill step every few minutes, read API enabled
 * - catch-up: process all overdue days, then exit
 * - single-step: process at most one overdue day, then exit
 * - disabled: read API only
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class GlucoseHistoryApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(GlucoseHistoryApplication.class, args);
        if (context.getBean(GlucoseProperties.class).getBackfill().getMode().isOneShot()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
