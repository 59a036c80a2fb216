package com.ivamare.saga;

import com.ivamare.saga.message.BeanFactoryServiceResolver;
import com.ivamare.saga.message.ServiceResolver;
import com.ivamare.saga.processor.SagaMessageProcessor;
import com.ivamare.saga.processor.SagaMessageRouter;
import com.ivamare.saga.repository.SagaInstanceCodec;
import com.ivamare.saga.repository.SagaRepositoryFactory;
import com.ivamare.saga.repository.impl.DefaultSagaRepositoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Auto-configuration for the saga engine.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Saga instance codec</li>
 *   <li>Repository factory (JDBC or in-memory store)</li>
 *   <li>Service resolver backed by the application context</li>
 *   <li>Message router over all {@link SagaMessageProcessor} beans</li>
 * </ul>
 *
 * <p>Applications declare one {@link SagaMessageProcessor} bean per saga type, typically
 * built from a repository obtained through {@link SagaRepositoryFactory}.
 *
 * <p>To disable auto-configuration:
 * <pre>
 * saga.enabled=false
 * </pre>
 */
@AutoConfiguration(after = JdbcTemplateAutoConfiguration.class)
@ConditionalOnProperty(prefix = "saga", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SagaProperties.class)
public class SagaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SagaInstanceCodec sagaInstanceCodec() {
        return SagaInstanceCodec.withDefaultMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaRepositoryFactory sagaRepositoryFactory(
            SagaProperties properties,
            ObjectProvider<JdbcTemplate> jdbcTemplateProvider,
            SagaInstanceCodec codec) {
        SagaProperties.RepositoryProperties repositoryProps = properties.getRepository();
        return new DefaultSagaRepositoryFactory(
            repositoryProps.getStore(),
            jdbcTemplateProvider.getIfAvailable(),
            codec,
            repositoryProps.getTable()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ServiceResolver sagaServiceResolver(ListableBeanFactory beanFactory) {
        return new BeanFactoryServiceResolver(beanFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaMessageRouter sagaMessageRouter(ObjectProvider<SagaMessageProcessor<?>> processorsProvider) {
        List<SagaMessageProcessor<?>> processors = processorsProvider.orderedStream().toList();
        for (SagaMessageProcessor<?> processor : processors) {
            log.info("Registered saga processor for type {}", processor.getSagaType());
        }
        return new SagaMessageRouter(processors);
    }
}
