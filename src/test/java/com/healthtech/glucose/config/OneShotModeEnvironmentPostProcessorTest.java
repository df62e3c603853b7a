package com.healthtech.glucose.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OneShotModeEnvironmentPostProcessor Tests")
class OneShotModeEnvironmentPostProcessorTest {

    private final OneShotModeEnvironmentPostProcessor postProcessor = new OneShotModeEnvironmentPostProcessor();

    @ParameterizedTest
    @ValueSource(strings = {"catch-up", "single-step", "CATCH_UP", "SINGLE_STEP"})
    @DisplayName("Should disable the web server for one-shot modes")
    void testOneShotModesRunWithoutWebServer(String mode) {
        MockEnvironment environment = new MockEnvironment().withProperty("glucose.backfill.mode", mode);

        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        assertThat(environment.getProperty("spring.main.web-application-type")).isEqualTo("none");
    }

    @ParameterizedTest
    @ValueSource(strings = {"scheduled", "disabled"})
    @DisplayName("Should keep the web server for long-running modes")
    void testLongRunningModesKeepWebServer(String mode) {
        MockEnvironment environment = new MockEnvironment().withProperty("glucose.backfill.mode", mode);

        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        assertThat(environment.containsProperty("spring.main.web-application-type")).isFalse();
    }

    @Test
    @DisplayName("Should keep the web server when no mode is configured")
    void testDefaultModeKeepsWebServer() {
        MockEnvironment environment = new MockEnvironment();

        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        assertThat(environment.containsProperty("spring.main.web-application-type")).isFalse();
    }

    @Test
    @DisplayName("Should not override an explicit web application type")
    void testExplicitSettingWins() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("glucose.backfill.mode", "single-step")
            .withProperty("spring.main.web-application-type", "servlet");

        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        assertThat(environment.getProperty("spring.main.web-application-type")).isEqualTo("servlet");
    }

    @Test
    @DisplayName("Should start a single-step application context without a web server")
    void testSingleStepContextHasNoWebServer() {
        // Given a servlet classpath, which would otherwise start an embedded server
        SpringApplication application = new SpringApplicationBuilder(EmptyConfiguration.class)
            .properties("spring.main.banner-mode=off")
            .build();
        assertThat(application.getWebApplicationType()).isEqualTo(WebApplicationType.SERVLET);

        // When
        try (ConfigurableApplicationContext context = application.run("--glucose.backfill.mode=single-step")) {
            // Then
            assertThat(context).isNotInstanceOf(WebServerApplicationContext.class);
            assertThat(application.getWebApplicationType()).isEqualTo(WebApplicationType.NONE);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class EmptyConfiguration {
    }
}
