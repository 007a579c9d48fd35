/**
 * Spring Boot auto-configuration for the message bus.
 *
 * <p>{@link cable.spring.boot.CableAutoConfiguration} wires a {@link cable.SolidCable} from
 * {@code cable.*} application properties and the application data source. Beans annotated
 * with {@link cable.spring.boot.CableSubscriber @CableSubscriber} are subscribed on startup.
 *
 * @see cable.spring.boot.CableProperties
 * @see cable.spring.boot.CableSubscriberRegistrar
 */
package cable.spring.boot;
