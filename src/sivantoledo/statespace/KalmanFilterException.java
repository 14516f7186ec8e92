package sivantoledo.statespace;

/**
 * Root of the failures raised by the filter. Callers that drive the filter
 * from an optimizer can catch the subclasses separately to tell bad
 * parameters ({@link NumericalException}) from bad wiring
 * ({@link ConfigurationException}).
 */
public abstract class KalmanFilterException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  protected KalmanFilterException(String message) {
    super(message);
  }

  protected KalmanFilterException(String message, Throwable cause) {
    super(message, cause);
  }
}
