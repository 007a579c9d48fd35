package cable;

/**
 * Base unchecked exception for bus failures surfaced to callers.
 *
 * <p>Thrown from {@link SolidCable.Builder#build()} when the store cannot be reached at
 * startup, and from {@link SolidCable#getStats()} when the message count cannot be read.
 */
public class CableException extends RuntimeException {

    public CableException(String message) {
        super(message);
    }

    public CableException(String message, Throwable cause) {
        super(message, cause);
    }
}
