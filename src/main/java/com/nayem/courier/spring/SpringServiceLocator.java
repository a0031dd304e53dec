package com.nayem.courier.spring;

import com.nayem.courier.core.ScopeContext;
import com.nayem.courier.core.ServiceLocator;
import com.nayem.courier.exception.ConstructionException;
import com.nayem.courier.instance.InstanceFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;

/**
 * {@link ServiceLocator} backed by the application context.
 * <p>
 * Plain lookups go to {@code getBean}, so the bean definition decides between a shared and a
 * fresh instance. Scoped lookups go to the {@link SpringScopeContext} passed in; calls made
 * without one share a root scope that lives as long as the application context.
 * </p>
 */
public class SpringServiceLocator implements ServiceLocator, DisposableBean {

    private final AutowireCapableBeanFactory beanFactory;
    private final SpringScopeContext rootScope;

    public SpringServiceLocator(AutowireCapableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
        this.rootScope = new SpringScopeContext("root", beanFactory);
    }

    @Override
    public <T> T resolve(Class<T> type, ScopeContext scope) {
        try {
            return beanFactory.getBean(type);
        } catch (BeansException e) {
            throw new ConstructionException(type, e);
        }
    }

    @Override
    public <T> T resolveScoped(Class<T> type, ScopeContext scope) {
        SpringScopeContext target = scope instanceof SpringScopeContext springScope ? springScope : rootScope;
        try {
            return target.get(type);
        } catch (BeansException e) {
            throw new ConstructionException(type, e);
        }
    }

    /**
     * Builds {@code type} through the container, so its constructor is autowired and its
     * {@code @Autowired} members and {@code @PostConstruct} callbacks are honored. The bean is
     * not registered in the context.
     */
    public InstanceFactory instanceFactory(Class<?> type) {
        return (locator, scope) -> {
            try {
                return beanFactory.createBean(type);
            } catch (BeansException e) {
                throw new ConstructionException(type, e);
            }
        };
    }

    /**
     * Opens a new scope. The caller must close it.
     */
    public SpringScopeContext openScope() {
        return SpringScopeContext.open(beanFactory);
    }

    @Override
    public void destroy() {
        rootScope.close();
    }
}
