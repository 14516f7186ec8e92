package sivantoledo.statespace;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Summary statistics of prediction errors.
 */
public class Diagnostics {

  private Diagnostics() {}

  /**
   * Root mean square of each row over the non-missing (non-NaN) entries.
   * A row with no entries present yields NaN.
   *
   * @param errors an Ny x n matrix of (standardized) prediction errors
   * @return a vector of length Ny
   */
  public static double[] rootMeanSquare(RealMatrix errors) {
    double[] rms = new double[errors.getRowDimension()];
    for (int i=0; i<rms.length; i++) {
      double sum_of_squares = 0;
      int    count          = 0;
      for (int t=0; t<errors.getColumnDimension(); t++) {
        double e = errors.getEntry(i, t);
        if (Double.isNaN(e)) continue;
        sum_of_squares += e*e;
        count++;
      }
      rms[i] = count == 0 ? Double.NaN : Math.sqrt(sum_of_squares/count);
    }
    return rms;
  }

  /**
   * @param output a run with full output
   * @return the root mean squared prediction error of each observable
   */
  public static double[] rmse(FilterOutput output) {
    return rootMeanSquare(output.predictionError());
  }

  /**
   * @param output a run with full output
   * @return the root mean squared standardized prediction error of each observable
   */
  public static double[] rmsd(FilterOutput output) {
    return rootMeanSquare(output.standardizedPredictionError());
  }
}
