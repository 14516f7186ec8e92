package sivantoledo.statespace;

/**
 * The innovation covariance of some period is not symmetric positive definite
 * (or not finite), so the period's log-likelihood is undefined.
 */
public class NumericalException extends KalmanFilterException {

  private static final long serialVersionUID = 1L;

  private final int period;

  public NumericalException(String message) {
    this(-1, message, null);
  }

  public NumericalException(String message, Throwable cause) {
    this(-1, message, cause);
  }

  public NumericalException(int period, String message, Throwable cause) {
    super(period < 0 ? message : String.format("period %d: %s", period, message), cause);
    this.period = period;
  }

  /**
   * The 0-based period at which the failure occurred, or -1 if the failure
   * is not tied to a period.
   * 
   * @return the failing period
   */
  public int period() { return period; }
  
  /**
   * Returns a copy of this exception tagged with a period index.
   */
  NumericalException atPeriod(int t) {
    return new NumericalException(t, getMessage(), getCause());
  }
}
