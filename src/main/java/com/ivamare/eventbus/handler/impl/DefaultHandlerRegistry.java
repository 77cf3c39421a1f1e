package com.ivamare.eventbus.handler.impl;

import com.ivamare.eventbus.handler.EventHandler;
import com.ivamare.eventbus.handler.Handler;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.model.DeliveryContext;
import com.ivamare.eventbus.model.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of HandlerRegistry.
 *
 * <p>Implements BeanPostProcessor to automatically discover and register
 * handlers from Spring beans annotated with @Handler.
 */
public class DefaultHandlerRegistry implements HandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final Map<String, EventHandler> handlers = new ConcurrentHashMap<>();

    @Override
    public void register(String eventType, EventHandler handler) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler for " + eventType + " must not be null");
        }
        if (handlers.put(eventType, handler) != null) {
            log.warn("Replaced existing handler for {}", eventType);
        } else {
            log.debug("Registered handler for {}", eventType);
        }
    }

    @Override
    public boolean unregister(String eventType) {
        return eventType != null && handlers.remove(eventType) != null;
    }

    @Override
    public Optional<EventHandler> get(String eventType) {
        return eventType == null ? Optional.empty() : Optional.ofNullable(handlers.get(eventType));
    }

    @Override
    public boolean hasHandler(String eventType) {
        return eventType != null && handlers.containsKey(eventType);
    }

    @Override
    public List<String> registeredEventTypes() {
        return List.copyOf(handlers.keySet());
    }

    @Override
    public void clear() {
        handlers.clear();
    }

    @Override
    public List<String> registerBean(Object bean) {
        List<String> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            Handler annotation = method.getAnnotation(Handler.class);
            if (annotation == null) {
                continue;
            }

            validateHandlerMethod(method);

            String eventType = annotation.eventType();
            EventHandler handler = (envelope, context) -> invoke(method, bean, envelope, context);

            register(eventType, handler);
            registered.add(eventType);

            log.info("Discovered handler {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), eventType);
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @Handler methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasHandlers = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(Handler.class));

        if (hasHandlers) {
            registerBean(bean);
        }

        return bean;
    }

    private static void invoke(Method method, Object bean, EventEnvelope envelope, DeliveryContext context)
            throws Exception {
        try {
            method.invoke(bean, envelope, context);
        } catch (InvocationTargetException e) {
            // Surface the handler's own failure
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void validateHandlerMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 2 ||
            !params[0].equals(EventEnvelope.class) ||
            !params[1].equals(DeliveryContext.class)) {

            throw new IllegalArgumentException(
                "Handler method " + method.getName() + " must have signature: " +
                "void methodName(EventEnvelope envelope, DeliveryContext context)"
            );
        }
    }
}
