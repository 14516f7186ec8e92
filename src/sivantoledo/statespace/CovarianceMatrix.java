package sivantoledo.statespace;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Representation of a factored symmetric positive-definite covariance matrix C.
 * 
 * All operations reuse one factorization, so solves and the determinant
 * are always consistent with each other.
 * 
 * @author Sivan Toledo
 */

public interface CovarianceMatrix {
  /**
   * Returns the dimension of this square matrix.
   * 
   * @return the dimension of C
   */
  public int dimension();

  /**
   * Solves C*x = v.
   * 
   * @param v a right-hand side
   * @return inv(C)*v, computed without forming inv(C)
   */
  public RealVector solve(RealVector v);

  /**
   * Solves C*X = A.
   * 
   * @param A a matrix of right-hand sides
   * @return inv(C)*A, computed without forming inv(C)
   */
  public RealMatrix solve(RealMatrix A);

  /**
   * Returns log(det(C)).
   * 
   * @return the natural logarithm of the determinant of C
   */
  public double logDeterminant();

  /**
   * Returns an explicit representation of C.
   * 
   * @return an explicit representation of C.
   */
  public RealMatrix get();

  /**
   * Returns the square roots of the diagonal of C.
   * 
   * @return sqrt(diag(C))
   */
  public default RealVector standardDeviations() {
    RealMatrix C = get();
    double[] s = new double[dimension()];
    for (int i=0; i<s.length; i++) s[i] = Math.sqrt(C.getEntry(i, i));
    return MatrixUtils.createRealVector(s);
  }
}
