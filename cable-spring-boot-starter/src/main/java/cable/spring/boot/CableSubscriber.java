package cable.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a subscriber of a bus channel.
 *
 * <p>The annotated bean must implement {@link cable.MessageHandler}. It is subscribed once
 * all singletons are initialized and unsubscribed when the bus closes.
 *
 * <pre>{@code
 * @Component
 * @CableSubscriber("orders")
 * public class OrderSubscriber implements MessageHandler {
 *   public void onMessage(Message message) { ... }
 * }
 * }</pre>
 *
 * <p>Use {@code "*"} to receive messages from every channel.
 *
 * @see CableSubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CableSubscriber {

    /**
     * Channel to subscribe to.
     */
    String value();
}
