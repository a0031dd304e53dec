package com.nayem.courier.spring;

import com.nayem.courier.core.CourierEngine;
import com.nayem.courier.core.Mediator;
import com.nayem.courier.registry.HandlerRegistry;
import com.nayem.courier.registry.MiddlewareRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

@AutoConfiguration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(CourierProperties.class)
@ConditionalOnProperty(name = "courier.enabled", havingValue = "true", matchIfMissing = true)
public class CourierAutoConfiguration {

    @Bean
    public static CourierBeanRegistrar courierBeanRegistrar() {
        return new CourierBeanRegistrar();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpringServiceLocator courierServiceLocator(ApplicationContext applicationContext) {
        return new SpringServiceLocator(applicationContext.getAutowireCapableBeanFactory());
    }

    @Bean
    @ConditionalOnMissingBean(Mediator.class)
    public CourierEngine courierEngine(ScannedComponents scanned,
            SpringServiceLocator serviceLocator,
            CourierProperties properties,
            ObjectProvider<MeterRegistry> registryProvider) {

        HandlerScanner scanner = new HandlerScanner(serviceLocator::instanceFactory);

        HandlerRegistry.Builder handlers = HandlerRegistry.builder();
        for (Class<?> type : scanned.handlerTypes()) {
            handlers.registerAll(scanner.describeHandlers(type));
        }

        MiddlewareRegistry.Builder middleware = MiddlewareRegistry.builder();
        for (Class<?> type : scanned.middlewareTypes()) {
            middleware.register(scanner.describeMiddleware(type));
        }

        HandlerRegistry handlerRegistry = handlers.build();
        if (properties.isLogRegistrations()) {
            handlerRegistry.describe();
        }

        return CourierEngine.builder()
                .handlers(handlerRegistry)
                .middleware(middleware.build())
                .serviceLocator(serviceLocator)
                .metrics(properties.getMetrics().isEnabled() ? registryProvider.getIfAvailable() : null)
                .publishStrategy(properties.getPublishStrategy())
                .build();
    }

    @Bean
    public CourierAspect courierAspect(Mediator mediator) {
        return new CourierAspect(mediator);
    }
}
