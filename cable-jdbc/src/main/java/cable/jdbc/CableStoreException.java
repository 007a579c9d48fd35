package cable.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the message stores.
 */
public final class CableStoreException extends RuntimeException {
  public CableStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
