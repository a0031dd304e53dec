package com.nayem.courier.spring;

import com.nayem.courier.core.Mediator;
import com.nayem.courier.spring.injection.KnownSkuCheck;
import com.nayem.courier.spring.injection.PriceList;
import com.nayem.courier.spring.injection.Quote;
import com.nayem.courier.spring.injection.QuoteHandler;
import com.nayem.courier.spring.injection.QuotePrice;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SpringInstanceFactoryTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CourierAutoConfiguration.class))
            .withPropertyValues("courier.base-packages=com.nayem.courier.spring.injection")
            .withBean(PriceList.class, () -> new PriceList(Map.of("book", 12L)));

    @Test
    void testDefaultLifetimeHandlerIsBuiltByTheContainer() {
        contextRunner.run(context -> {
            Mediator mediator = context.getBean(Mediator.class);
            PriceList prices = context.getBean(PriceList.class);

            assertEquals(new Quote("book", 12), mediator.invoke(new QuotePrice("book"), Quote.class));
            assertEquals(new Quote("book", 12), mediator.invoke(new QuotePrice("book"), Quote.class));

            assertEquals(1, prices.attachedHandlers());
            assertThat(context).doesNotHaveBean(QuoteHandler.class);
            assertThat(context).doesNotHaveBean(KnownSkuCheck.class);
        });
    }

    @Test
    void testDefaultLifetimeMiddlewareGetsFieldInjection() {
        contextRunner.run(context -> {
            Mediator mediator = context.getBean(Mediator.class);

            assertEquals(new Quote("lamp", 0), mediator.invoke(new QuotePrice("lamp"), Quote.class));
            assertEquals(0, context.getBean(PriceList.class).attachedHandlers());
        });
    }
}
