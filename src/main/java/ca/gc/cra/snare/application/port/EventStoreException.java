package ca.gc.cra.snare.application.port;

/**
 * Raised when the event store cannot open, write, or read.
 *
 * <p>Unchecked so pipelines decide locally whether a failure is tolerated (the recording path logs and
 * continues) or fatal (startup).</p>
 *
 * @since 0.1.0
 */
public class EventStoreException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public EventStoreException(String message) {
    super(message);
  }

  public EventStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
