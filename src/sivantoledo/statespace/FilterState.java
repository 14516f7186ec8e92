package sivantoledo.statespace;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * The running mean z and covariance P of the state, threaded through the
 * recursion. A single instance is owned by one filter run and updated in
 * place once per period.
 */
public class FilterState {

  private RealVector z;
  private RealMatrix P;

  /**
   * @param mean       the state mean z, length Nz
   * @param covariance the state covariance P, Nz x Nz; symmetrized on entry
   * @throws ConfigurationException if the shapes disagree or an entry is not finite
   */
  public FilterState(RealVector mean, RealMatrix covariance) {
    if (mean == null || covariance == null) throw new IllegalArgumentException("mean and covariance must not be null");
    if (!Matrix.isSquare(covariance, mean.getDimension()))
      throw new ConfigurationException(String.format("state covariance must be %dx%d, is %s",
                                                     mean.getDimension(), mean.getDimension(), Matrix.dimensions(covariance)));
    if (!Matrix.isFinite(mean) || !Matrix.isFinite(covariance))
      throw new ConfigurationException("state mean and covariance must be finite");
    this.z = mean.copy();
    this.P = Matrix.symmetrize(covariance);
  }

  public int dimension() { return z.getDimension(); }

  public RealVector mean()       { return z.copy(); }
  public RealMatrix covariance() { return P.copy(); }

  public FilterState copy() {
    return new FilterState(z, P);
  }

  /*
   * No copying; the recursion replaces rather than mutates the stored objects.
   */
  RealVector z() { return z; }
  RealMatrix P() { return P; }

  void set(RealVector z, RealMatrix P) {
    this.z = z;
    this.P = P;
  }

  @Override
  public String toString() {
    return "FilterState(z="+z+", P="+Matrix.toString(P, "%.3e")+")";
  }
}
