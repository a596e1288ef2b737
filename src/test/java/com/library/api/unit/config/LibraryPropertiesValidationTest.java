package com.library.api.unit.config;

import com.library.api.config.LibraryProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class LibraryPropertiesValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(PropertiesConfig.class);

    @Test
    void validSettings_bindAndStart() {
        contextRunner
            .withPropertyValues("library.activity-log.tag=Books")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(LibraryProperties.class).activityLog().tag()).isEqualTo("Books");
            });
    }

    @Test
    void blankActivityLogTag_failsToBind() {
        contextRunner
            .withPropertyValues("library.activity-log.tag=")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(BindValidationException.class)
                    .rootCause().hasMessageContaining("Activity log tag must not be blank");
            });
    }

    @Test
    void blankTimestampPattern_failsToBind() {
        contextRunner
            .withPropertyValues("library.activity-log.timestamp-pattern=")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(BindValidationException.class)
                    .rootCause().hasMessageContaining("Activity log timestamp pattern must not be blank");
            });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(LibraryProperties.class)
    static class PropertiesConfig {
    }
}
