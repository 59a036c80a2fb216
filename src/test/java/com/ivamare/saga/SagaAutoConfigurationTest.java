package com.ivamare.saga;

import com.ivamare.saga.message.ServiceResolver;
import com.ivamare.saga.processor.SagaMessageProcessor;
import com.ivamare.saga.processor.SagaMessageRouter;
import com.ivamare.saga.repository.SagaInstanceCodec;
import com.ivamare.saga.repository.SagaRepositoryFactory;
import com.ivamare.saga.repository.impl.DefaultSagaRepositoryFactory;
import com.ivamare.saga.repository.impl.InMemorySagaRepository;
import com.ivamare.saga.repository.impl.JdbcSagaRepository;
import com.ivamare.saga.statemachine.SagaStateMachine;
import com.ivamare.saga.support.OrderSaga;
import com.ivamare.saga.support.OrderSagaData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("SagaAutoConfiguration")
class SagaAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(SagaAutoConfiguration.class));

    @Test
    @DisplayName("should create all beans with jdbc store")
    void shouldCreateAllBeansWithJdbcStore() {
        contextRunner
            .withUserConfiguration(MockJdbcConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(SagaProperties.class);
                assertThat(context).hasSingleBean(SagaInstanceCodec.class);
                assertThat(context).hasSingleBean(SagaRepositoryFactory.class);
                assertThat(context).hasSingleBean(ServiceResolver.class);
                assertThat(context).hasSingleBean(SagaMessageRouter.class);

                SagaRepositoryFactory factory = context.getBean(SagaRepositoryFactory.class);
                assertThat(factory.create(OrderSaga.SAGA_TYPE, OrderSagaData.class))
                    .isInstanceOf(JdbcSagaRepository.class);
            });
    }

    @Test
    @DisplayName("should fail to start with jdbc store and no JdbcTemplate")
    void shouldFailWithJdbcStoreAndNoJdbcTemplate() {
        contextRunner.run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("should use in-memory store when configured")
    void shouldUseInMemoryStoreWhenConfigured() {
        contextRunner
            .withPropertyValues("saga.repository.store=memory")
            .run(context -> {
                DefaultSagaRepositoryFactory factory =
                    (DefaultSagaRepositoryFactory) context.getBean(SagaRepositoryFactory.class);
                assertThat(factory.getStore()).isEqualTo(SagaProperties.Store.MEMORY);
                assertThat(factory.create(OrderSaga.SAGA_TYPE, OrderSagaData.class))
                    .isInstanceOf(InMemorySagaRepository.class);
            });
    }

    @Test
    @DisplayName("should bind repository properties")
    void shouldBindRepositoryProperties() {
        contextRunner
            .withUserConfiguration(MockJdbcConfig.class)
            .withPropertyValues("saga.repository.table=orders.saga_state")
            .run(context -> {
                SagaProperties properties = context.getBean(SagaProperties.class);
                assertThat(properties.getRepository().getTable()).isEqualTo("orders.saga_state");
                assertThat(properties.getRepository().getStore()).isEqualTo(SagaProperties.Store.JDBC);
            });
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("saga.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(SagaRepositoryFactory.class);
                assertThat(context).doesNotHaveBean(SagaMessageRouter.class);
            });
    }

    @Test
    @DisplayName("should register processors with the router")
    void shouldRegisterProcessorsWithRouter() {
        contextRunner
            .withPropertyValues("saga.repository.store=memory")
            .withUserConfiguration(OrderSagaConfig.class)
            .run(context -> {
                SagaMessageRouter router = context.getBean(SagaMessageRouter.class);
                assertThat(router.sagaTypes()).containsExactly(OrderSaga.SAGA_TYPE);
            });
    }

    @Test
    @DisplayName("should resolve services from the application context")
    void shouldResolveServicesFromApplicationContext() {
        contextRunner
            .withPropertyValues("saga.repository.store=memory")
            .withBean(Clock.class, Clock::systemUTC)
            .run(context -> {
                ServiceResolver resolver = context.getBean(ServiceResolver.class);
                assertThat(resolver.resolve(Clock.class)).isPresent();
            });
    }

    @Test
    @DisplayName("should use custom SagaInstanceCodec if provided")
    void shouldUseCustomCodecIfProvided() {
        contextRunner
            .withPropertyValues("saga.repository.store=memory")
            .withUserConfiguration(CustomCodecConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(SagaInstanceCodec.class);
                assertThat(context.getBean(SagaInstanceCodec.class)).isSameAs(CustomCodecConfig.CUSTOM_CODEC);
            });
    }

    @Configuration
    static class MockJdbcConfig {
        @Bean
        JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }
    }

    @Configuration
    static class OrderSagaConfig {
        @Bean
        SagaMessageProcessor<OrderSagaData> orderSagaProcessor(SagaRepositoryFactory repositoryFactory) {
            return new SagaMessageProcessor<>(
                new SagaStateMachine<>(OrderSaga.definition()),
                repositoryFactory.create(OrderSaga.SAGA_TYPE, OrderSagaData.class));
        }
    }

    @Configuration
    static class CustomCodecConfig {
        static final SagaInstanceCodec CUSTOM_CODEC = SagaInstanceCodec.withDefaultMapper();

        @Bean
        SagaInstanceCodec customCodec() {
            return CUSTOM_CODEC;
        }
    }
}
