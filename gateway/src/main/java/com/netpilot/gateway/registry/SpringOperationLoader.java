package com.netpilot.gateway.registry;

import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/**
 * Lazy loader: resolves the handler class named by the descriptor and asks
 * the bean factory for its (lazy) bean, so handler dependencies are injected
 * as usual.
 */
@Component
public class SpringOperationLoader implements OperationLoader {

    private static final Logger log = LoggerFactory.getLogger(SpringOperationLoader.class);

    private final BeanFactory beanFactory;

    public SpringOperationLoader(BeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @Override
    public Operation load(OperationDescriptor descriptor) throws ClassNotFoundException {
        Class<?> type = ClassUtils.forName(descriptor.handlerRef(), getClass().getClassLoader());
        if (!Operation.class.isAssignableFrom(type)) {
            throw new IllegalStateException(descriptor.handlerRef() + " does not implement "
                    + Operation.class.getSimpleName());
        }
        Operation handler = beanFactory.getBean(type.asSubclass(Operation.class));
        log.info("Lazy-loaded handler {} for operation '{}'", type.getSimpleName(), descriptor.name());
        return handler;
    }
}
