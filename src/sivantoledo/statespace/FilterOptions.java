package sivantoledo.statespace;

/**
 * Settings of one filter run. Immutable; the {@code with...} methods return
 * modified copies.
 */
public final class FilterOptions {

  public static final double DEFAULT_DIFFUSE_PRIOR_VARIANCE = 1e6;

  public static final FilterOptions DEFAULTS = new FilterOptions(true, 0, DEFAULT_DIFFUSE_PRIOR_VARIANCE,
                                                                 LyapunovSolver.Method.AUTOMATIC, false);

  private final boolean               fullOutput;
  private final int                   presamplePeriods;
  private final double                diffusePriorVariance;
  private final LyapunovSolver.Method lyapunovMethod;
  private final boolean               rejectDegenerateLikelihood;

  private FilterOptions(boolean fullOutput, int presamplePeriods, double diffusePriorVariance,
                        LyapunovSolver.Method lyapunovMethod, boolean rejectDegenerateLikelihood) {
    this.fullOutput                 = fullOutput;
    this.presamplePeriods           = presamplePeriods;
    this.diffusePriorVariance       = diffusePriorVariance;
    this.lyapunovMethod             = lyapunovMethod;
    this.rejectDegenerateLikelihood = rejectDegenerateLikelihood;
  }

  /**
   * Whether to record predicted and filtered states, covariances and
   * prediction errors for every period. When false only the likelihood and
   * the final state are produced.
   */
  public boolean fullOutput()                    { return fullOutput; }

  /**
   * Number of leading periods that are filtered but excluded from the
   * likelihood and from all per-period outputs.
   */
  public int presamplePeriods()                  { return presamplePeriods; }

  /**
   * Variance on the diagonal of the initial covariance when the model is not
   * stationary.
   */
  public double diffusePriorVariance()           { return diffusePriorVariance; }

  public LyapunovSolver.Method lyapunovMethod()  { return lyapunovMethod; }

  /**
   * Whether a run with no observation in the main sample fails with
   * {@link DegenerateLikelihoodException} instead of only being flagged.
   */
  public boolean rejectDegenerateLikelihood()    { return rejectDegenerateLikelihood; }

  public FilterOptions withFullOutput(boolean fullOutput) {
    return new FilterOptions(fullOutput, presamplePeriods, diffusePriorVariance, lyapunovMethod, rejectDegenerateLikelihood);
  }

  public FilterOptions withPresamplePeriods(int presamplePeriods) {
    if (presamplePeriods < 0) throw new ConfigurationException("presample periods must be non-negative, got "+presamplePeriods);
    return new FilterOptions(fullOutput, presamplePeriods, diffusePriorVariance, lyapunovMethod, rejectDegenerateLikelihood);
  }

  public FilterOptions withDiffusePriorVariance(double diffusePriorVariance) {
    if (!(diffusePriorVariance > 0) || Double.isInfinite(diffusePriorVariance))
      throw new ConfigurationException("diffuse prior variance must be positive and finite, got "+diffusePriorVariance);
    return new FilterOptions(fullOutput, presamplePeriods, diffusePriorVariance, lyapunovMethod, rejectDegenerateLikelihood);
  }

  public FilterOptions withLyapunovMethod(LyapunovSolver.Method lyapunovMethod) {
    if (lyapunovMethod == null) throw new IllegalArgumentException("lyapunovMethod must not be null");
    return new FilterOptions(fullOutput, presamplePeriods, diffusePriorVariance, lyapunovMethod, rejectDegenerateLikelihood);
  }

  public FilterOptions withRejectDegenerateLikelihood(boolean rejectDegenerateLikelihood) {
    return new FilterOptions(fullOutput, presamplePeriods, diffusePriorVariance, lyapunovMethod, rejectDegenerateLikelihood);
  }

  @Override
  public String toString() {
    return String.format("FilterOptions(fullOutput=%b, presamplePeriods=%d, diffusePriorVariance=%.1e, lyapunovMethod=%s, rejectDegenerateLikelihood=%b)",
                         fullOutput, presamplePeriods, diffusePriorVariance, lyapunovMethod, rejectDegenerateLikelihood);
  }
}
