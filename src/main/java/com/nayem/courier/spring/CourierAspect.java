package com.nayem.courier.spring;

import com.nayem.courier.core.Mediator;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Aspect
public class CourierAspect {

    private static final Logger log = LoggerFactory.getLogger(CourierAspect.class);

    private final Mediator mediator;

    public CourierAspect(Mediator mediator) {
        this.mediator = mediator;
    }

    @Around(value = "@annotation(dispatch)", argNames = "joinPoint,dispatch")
    public Object handleDispatch(ProceedingJoinPoint joinPoint, Dispatch dispatch) throws Throwable {
        Object message = joinPoint.proceed();
        if (message == null) {
            return null;
        }

        CompletableFuture<Void> published = mediator.publishAsync(message);

        if (!dispatch.await()) {
            published.whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("Publishing {} from {} failed: {}", message.getClass().getSimpleName(),
                            joinPoint.getSignature().toShortString(), error.toString());
                }
            });
            return message;
        }

        try {
            published.join();
        } catch (CompletionException e) {
            throw e.getCause() != null ? e.getCause() : e;
        }
        return message;
    }
}
