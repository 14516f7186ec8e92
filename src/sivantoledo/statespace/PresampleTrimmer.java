package sivantoledo.statespace;

import java.util.Arrays;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Drops the presample periods from a filter run's outputs.
 *
 * The per-period arrays are sliced, not recomputed, and when full output was
 * recorded the reported initial state becomes the filtered state of the last
 * presample period.
 */
public class PresampleTrimmer {

  private PresampleTrimmer() {}

  /**
   * @param untrimmed the outputs of all T periods
   * @param n         the number of leading periods to drop, 0 <= n < T
   * @return the outputs of periods n..T-1
   */
  public static FilterOutput trim(FilterOutput untrimmed, int n) {
    int periods = untrimmed.periods();
    if (n < 0 || n >= periods)
      throw new ConfigurationException(String.format("presample periods must be in [0, %d), got %d", periods, n));
    if (n == 0) return untrimmed;

    double[] marginal = Arrays.copyOfRange(untrimmed.rawMarginalLogLikelihood(), n, periods);

    if (!untrimmed.hasFullOutput()) {
      return new FilterOutput(marginal, untrimmed.rawInitialState(), untrimmed.rawFinalState(),
                              n, untrimmed.isDegenerate(),
                              null, null, null, null, null, null);
    }

    RealMatrix filtered = untrimmed.rawFiltered();
    FilterState initial = new FilterState(filtered.getColumnVector(n-1), untrimmed.rawFilteredCovariance()[n-1]);

    return new FilterOutput(marginal, initial, untrimmed.rawFinalState(),
                            n, untrimmed.isDegenerate(),
                            columns(untrimmed.rawPredicted(), n),
                            Arrays.copyOfRange(untrimmed.rawPredictedCovariance(), n, periods),
                            columns(filtered, n),
                            Arrays.copyOfRange(untrimmed.rawFilteredCovariance(), n, periods),
                            columns(untrimmed.rawPredictionError(), n),
                            columns(untrimmed.rawStandardizedPredictionError(), n));
  }

  private static RealMatrix columns(RealMatrix A, int first) {
    return A.getSubMatrix(0, A.getRowDimension()-1, first, A.getColumnDimension()-1);
  }
}
