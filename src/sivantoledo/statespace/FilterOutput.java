package sivantoledo.statespace;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * The result of a filter run.
 *
 * The likelihood, the per-period marginal likelihoods and the initial and
 * final states are always present. The per-period states, covariances and
 * prediction errors are present only if full output was requested; the
 * accessors for them throw {@link IllegalStateException} otherwise.
 *
 * Period indices are relative to the reported sample: column 0 is the first
 * period after the presample.
 */
public class FilterOutput {

  private final double       logLikelihood;
  private final double[]     marginalLogLikelihood;
  private final FilterState  initialState;
  private final FilterState  finalState;
  private final int          presamplePeriods;
  private final boolean      degenerate;

  private final RealMatrix   predicted;           // Nz x n
  private final RealMatrix[] predictedCovariance; // n of Nz x Nz
  private final RealMatrix   filtered;            // Nz x n
  private final RealMatrix[] filteredCovariance;  // n of Nz x Nz
  private final RealMatrix   predictionError;     // Ny x n, NaN where missing
  private final RealMatrix   standardizedPredictionError;

  private double[] rmse = null;
  private double[] rmsd = null;

  FilterOutput(double[] marginalLogLikelihood, FilterState initialState, FilterState finalState,
               int presamplePeriods, boolean degenerate,
               RealMatrix predicted, RealMatrix[] predictedCovariance,
               RealMatrix filtered,  RealMatrix[] filteredCovariance,
               RealMatrix predictionError, RealMatrix standardizedPredictionError) {
    this.marginalLogLikelihood       = marginalLogLikelihood;
    this.initialState                = initialState;
    this.finalState                  = finalState;
    this.presamplePeriods            = presamplePeriods;
    this.degenerate                  = degenerate;
    this.predicted                   = predicted;
    this.predictedCovariance         = predictedCovariance;
    this.filtered                    = filtered;
    this.filteredCovariance          = filteredCovariance;
    this.predictionError             = predictionError;
    this.standardizedPredictionError = standardizedPredictionError;

    double sum = 0;
    for (double l: marginalLogLikelihood) sum += l;
    this.logLikelihood = sum;
  }

  /**
   * The log-likelihood of the main-sample observations, the sum of
   * {@link #marginalLogLikelihood()}.
   */
  public double logLikelihood() { return logLikelihood; }

  /**
   * log p(y_t | y_1..y_{t-1}) for each reported period.
   */
  public double[] marginalLogLikelihood() { return marginalLogLikelihood.clone(); }

  /**
   * The number of periods discarded at the start of the sample.
   */
  public int presamplePeriods() { return presamplePeriods; }

  /**
   * The number of periods in the per-period outputs, T minus the presample.
   */
  public int periods() { return marginalLogLikelihood.length; }

  /**
   * The state the recursion started from or, if a presample was discarded
   * and full output was requested, the filtered state at the end of the
   * presample.
   */
  public FilterState initialState() { return initialState.copy(); }

  /**
   * The filtered state of the last period, z_{T|T} and P_{T|T}.
   */
  public FilterState finalState() { return finalState.copy(); }

  /**
   * True if no observable was present in any main-sample period.
   */
  public boolean isDegenerate() { return degenerate; }

  public boolean hasFullOutput() { return predicted != null; }

  /** z_{t|t-1}, Nz x n. */
  public RealMatrix predicted() { return full(predicted).copy(); }

  /** P_{t|t-1}. */
  public RealMatrix predictedCovariance(int t) { return full(predictedCovariance)[t].copy(); }

  /** z_{t|t}, Nz x n. */
  public RealMatrix filtered() { return full(filtered).copy(); }

  /** P_{t|t}. */
  public RealMatrix filteredCovariance(int t) { return full(filteredCovariance)[t].copy(); }

  /** y_t - y_{t|t-1}, Ny x n, NaN where the observation is missing. */
  public RealMatrix predictionError() { return full(predictionError).copy(); }

  /** Prediction errors divided by their standard deviations, Ny x n. */
  public RealMatrix standardizedPredictionError() { return full(standardizedPredictionError).copy(); }

  /**
   * Root mean squared prediction error of each observable.
   */
  public double[] rmse() {
    if (rmse == null) rmse = Diagnostics.rootMeanSquare(full(predictionError));
    return rmse.clone();
  }

  /**
   * Root mean squared standardized prediction error of each observable.
   */
  public double[] rmsd() {
    if (rmsd == null) rmsd = Diagnostics.rootMeanSquare(full(standardizedPredictionError));
    return rmsd.clone();
  }

  private static <X> X full(X x) {
    if (x == null) throw new IllegalStateException("per-period outputs were not recorded; run with full output");
    return x;
  }

  /*
   * Raw access for the trimmer.
   */
  RealMatrix   rawPredicted()                   { return predicted; }
  RealMatrix[] rawPredictedCovariance()         { return predictedCovariance; }
  RealMatrix   rawFiltered()                    { return filtered; }
  RealMatrix[] rawFilteredCovariance()          { return filteredCovariance; }
  RealMatrix   rawPredictionError()             { return predictionError; }
  RealMatrix   rawStandardizedPredictionError() { return standardizedPredictionError; }
  double[]     rawMarginalLogLikelihood()       { return marginalLogLikelihood; }
  FilterState  rawInitialState()                { return initialState; }
  FilterState  rawFinalState()                  { return finalState; }

  @Override
  public String toString() {
    return String.format("FilterOutput(logLikelihood=%.6e, periods=%d, presample=%d%s%s)",
                         logLikelihood, periods(), presamplePeriods,
                         hasFullOutput() ? ", full" : "", degenerate ? ", degenerate" : "");
  }
}
