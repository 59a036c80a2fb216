package com.ivamare.saga.message;

import org.springframework.beans.factory.ListableBeanFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves handler services from a Spring bean factory.
 *
 * <p>This is a single application-wide resolver over the context's singletons, not a
 * per-message scope. Transports that need request-scoped services (a transaction-bound
 * repository, a per-message unit of work) supply their own {@link ServiceResolver} for
 * each message through {@link DefaultMessageContext.Builder#services(ServiceResolver)}.
 *
 * <p>A type with no bean, or with several beans and no primary, resolves to empty.
 */
public class BeanFactoryServiceResolver implements ServiceResolver {

    private final ListableBeanFactory beanFactory;

    public BeanFactoryServiceResolver(ListableBeanFactory beanFactory) {
        this.beanFactory = Objects.requireNonNull(beanFactory, "beanFactory");
    }

    @Override
    public <T> Optional<T> resolve(Class<T> type) {
        return Optional.ofNullable(beanFactory.getBeanProvider(type).getIfUnique());
    }
}
