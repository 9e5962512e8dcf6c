package inbox.spring.boot;

import inbox.StandardUpdateKind;
import inbox.UpdateHandler;
import inbox.registry.DefaultHandlerRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Scans for beans annotated with {@link InboxHandler} and registers them in the
 * {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * which is before {@link InboxLifecycle} starts the inbox.
 *
 * @see InboxHandler
 */
public class InboxHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultHandlerRegistry registry;

    public InboxHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(InboxHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof UpdateHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @InboxHandler must implement UpdateHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            InboxHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), InboxHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @InboxHandler annotation on " + bean.getClass().getName());
            }

            for (String kind : resolveKinds(beanName, annotation)) {
                try {
                    registry.register(kind, handler);
                } catch (IllegalArgumentException | IllegalStateException e) {
                    throw new BeanCreationException(beanName, e.getMessage(), e);
                }
            }
        }
    }

    private Set<String> resolveKinds(String beanName, InboxHandler annotation) {
        Set<String> kinds = new LinkedHashSet<>();
        for (StandardUpdateKind kind : annotation.standard()) {
            kinds.add(kind.kindName());
        }
        for (String kind : annotation.kinds()) {
            kinds.add(kind);
        }
        if (kinds.isEmpty()) {
            throw new BeanCreationException(beanName,
                    "@InboxHandler must specify at least one of kinds or standard");
        }
        return kinds;
    }
}
