package com.nayem.courier.spring;

import com.nayem.courier.core.Lifetime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanClassLoaderAware;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.annotation.AnnotatedGenericBeanDefinition;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.beans.factory.support.AbstractBeanDefinition;
import org.springframework.beans.factory.support.BeanDefinitionBuilder;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.beans.factory.support.BeanDefinitionRegistryPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfigurationPackages;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.AnnotationBeanNameGenerator;
import org.springframework.core.env.Environment;

import java.util.List;

/**
 * Scans for handler and middleware classes before any bean is created.
 * <p>
 * The result is registered as a {@link ScannedComponents} bean. Classes with a
 * {@link Lifetime#SINGLETON} or {@link Lifetime#TRANSIENT} lifetime also get a bean definition
 * (singleton or prototype scope) so the container can hand them out, unless a bean with the
 * same name already exists.
 * </p>
 */
public class CourierBeanRegistrar implements BeanDefinitionRegistryPostProcessor, EnvironmentAware,
        BeanClassLoaderAware {

    private static final Logger log = LoggerFactory.getLogger(CourierBeanRegistrar.class);

    public static final String SCANNED_COMPONENTS_BEAN = "courierScannedComponents";

    private Environment environment;
    private ClassLoader classLoader = CourierBeanRegistrar.class.getClassLoader();

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    @Override
    public void setBeanClassLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public void postProcessBeanDefinitionRegistry(BeanDefinitionRegistry registry) {
        List<String> packages = basePackages(registry);
        ScannedComponents scanned = packages.isEmpty()
                ? ScannedComponents.empty()
                : new HandlerScanner().scan(packages, classLoader);

        for (Class<?> type : scanned.handlerTypes()) {
            registerContainerManaged(registry, type, type.getAnnotation(MessageHandler.class).lifetime());
        }
        for (Class<?> type : scanned.middlewareTypes()) {
            registerContainerManaged(registry, type, type.getAnnotation(MessageMiddleware.class).lifetime());
        }

        AbstractBeanDefinition definition = BeanDefinitionBuilder
                .genericBeanDefinition(ScannedComponents.class, () -> scanned)
                .getBeanDefinition();
        registry.registerBeanDefinition(SCANNED_COMPONENTS_BEAN, definition);
    }

    @Override
    public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory) {
        // bean definitions are complete after postProcessBeanDefinitionRegistry
    }

    private List<String> basePackages(BeanDefinitionRegistry registry) {
        List<String> configured = environment == null ? List.of()
                : Binder.get(environment)
                        .bind("courier.base-packages", Bindable.listOf(String.class))
                        .orElse(List.of());
        if (!configured.isEmpty()) {
            return configured;
        }
        if (registry instanceof BeanFactory beanFactory && AutoConfigurationPackages.has(beanFactory)) {
            return AutoConfigurationPackages.get(beanFactory);
        }
        log.warn("No courier.base-packages configured and no auto-configuration package found; "
                + "no message handlers will be registered");
        return List.of();
    }

    private static void registerContainerManaged(BeanDefinitionRegistry registry, Class<?> type, Lifetime lifetime) {
        String scope = switch (lifetime) {
            case SINGLETON -> BeanDefinition.SCOPE_SINGLETON;
            case TRANSIENT -> BeanDefinition.SCOPE_PROTOTYPE;
            case DEFAULT, SCOPED -> null;
        };
        if (scope == null) {
            return;
        }

        AnnotatedGenericBeanDefinition definition = new AnnotatedGenericBeanDefinition(type);
        definition.setScope(scope);
        String beanName = AnnotationBeanNameGenerator.INSTANCE.generateBeanName(definition, registry);
        if (registry.containsBeanDefinition(beanName)) {
            log.debug("Bean {} for {} is already defined, keeping the existing definition", beanName, type.getName());
            return;
        }
        registry.registerBeanDefinition(beanName, definition);
        log.debug("Registered {} bean {} for {}", scope, beanName, type.getName());
    }
}
