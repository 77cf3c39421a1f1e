package com.ivamare.eventbus.health;

import com.ivamare.eventbus.EventBusAutoConfiguration;
import com.ivamare.eventbus.broker.BrokerSessionFactory;
import com.ivamare.eventbus.support.FakeBrokerSessionFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(EventBusAutoConfiguration.class, HealthAutoConfiguration.class))
        .withUserConfiguration(FakeBrokerConfig.class);

    @Test
    @DisplayName("should register the broker health indicator")
    void shouldRegisterHealthIndicator() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BrokerHealthIndicator.class);
            assertThat(context.getBean(BrokerHealthIndicator.class).health().getStatus()).isEqualTo(Status.DOWN);
        });
    }

    @Test
    @DisplayName("should not register the indicator when disabled")
    void shouldNotRegisterWhenDisabled() {
        contextRunner
            .withPropertyValues("eventbus.enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(BrokerHealthIndicator.class));
    }

    @Test
    @DisplayName("should not register the indicator without an event bus")
    void shouldNotRegisterWithoutEventBus() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HealthAutoConfiguration.class))
            .run(context -> assertThat(context).doesNotHaveBean(BrokerHealthIndicator.class));
    }

    @Configuration
    static class FakeBrokerConfig {
        @Bean
        BrokerSessionFactory brokerSessionFactory() {
            return new FakeBrokerSessionFactory();
        }
    }
}
