package cable.spring.boot;

import cable.MessageHandler;
import cable.SolidCable;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link CableSubscriber} and subscribes them to the bus.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see CableSubscriber
 */
public class CableSubscriberRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(CableSubscriberRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final SolidCable cable;

    public CableSubscriberRegistrar(ListableBeanFactory beanFactory, SolidCable cable) {
        this.beanFactory = beanFactory;
        this.cable = cable;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(CableSubscriber.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof MessageHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @CableSubscriber must implement MessageHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // proxies may hide the annotation from getAnnotation
            CableSubscriber annotation = AnnotationUtils.findAnnotation(bean.getClass(), CableSubscriber.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @CableSubscriber annotation on " + bean.getClass().getName());
            }

            String channel = annotation.value();
            if (channel.isEmpty()) {
                throw new BeanCreationException(beanName, "@CableSubscriber channel must not be empty");
            }

            cable.subscribe(channel, handler);
            logger.log(Level.INFO, "Subscribed bean {0} to channel {1}", new Object[]{beanName, channel});
        }
    }
}
