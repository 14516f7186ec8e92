package sivantoledo.statespace;

/**
 * The inputs do not describe a valid filtering problem: inconsistent matrix
 * dimensions, a regime partition that does not tile the sample, or a
 * presample that swallows the whole sample.
 */
public class ConfigurationException extends KalmanFilterException {

  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
