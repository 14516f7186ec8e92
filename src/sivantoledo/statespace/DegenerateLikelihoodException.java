package sivantoledo.statespace;

/**
 * No observable was present in any main-sample period, so the likelihood
 * carries no information about the model. Only thrown when
 * {@link FilterOptions#rejectDegenerateLikelihood()} is set; otherwise the
 * condition is reported by {@link FilterOutput#isDegenerate()}.
 */
public class DegenerateLikelihoodException extends KalmanFilterException {

  private static final long serialVersionUID = 1L;

  public DegenerateLikelihoodException(String message) {
    super(message);
  }
}
