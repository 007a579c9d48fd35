package cable;

/**
 * Thrown by {@link SolidCable#unsubscribe(Subscription)} when called with {@code null}.
 */
public class NullSubscriptionException extends CableException {

    public NullSubscriptionException() {
        super("subscription cannot be null");
    }
}
