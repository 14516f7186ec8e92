package sivantoledo.statespace;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSquareMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A covariance matrix held as its Cholesky factor C = L*L'.
 */
public class CholeskyCovarianceMatrix implements CovarianceMatrix {

  /*
   * Pivots must be strictly positive; Commons Math's default absolute
   * threshold of 1e-10 would reject legitimately tiny variances.
   */
  private static final double POSITIVITY_THRESHOLD = 0.0;

  private final RealMatrix          C;
  private final RealMatrix          L;
  private final DecompositionSolver solver;

  /**
   * Factors a covariance matrix.
   * 
   * @param C a symmetric matrix; callers symmetrize before factoring
   * @throws NumericalException if C is not finite, not symmetric, or not positive definite
   */
  public CholeskyCovarianceMatrix(RealMatrix C) {
    if (!Matrix.isFinite(C))
      throw new NumericalException("covariance matrix has non-finite entries: "+Matrix.toString(C, "%.3e"));
    try {
      CholeskyDecomposition chol = new CholeskyDecomposition(C, 
                                                             CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD, 
                                                             POSITIVITY_THRESHOLD);
      this.C      = C.copy();
      this.L      = chol.getL();
      this.solver = chol.getSolver();
    } catch (NonPositiveDefiniteMatrixException npdme) {
      throw new NumericalException("covariance matrix is not positive definite: "+Matrix.toString(C, "%.3e"), npdme);
    } catch (NonSymmetricMatrixException | NonSquareMatrixException nsme) {
      throw new NumericalException("covariance matrix is not symmetric: "+Matrix.toString(C, "%.3e"), nsme);
    }
  }

  @Override
  public int dimension() { return C.getColumnDimension(); }

  @Override
  public RealVector solve(RealVector v) {
    return solver.solve(v);
  }

  @Override
  public RealMatrix solve(RealMatrix A) {
    return solver.solve(A);
  }

  @Override
  public double logDeterminant() {
    double logdet = 0;
    for (int i=0; i<L.getRowDimension(); i++) logdet += Math.log(L.getEntry(i, i));
    return 2*logdet;
  }

  @Override
  public RealMatrix get() { return C.copy(); }

  /**
   * Returns the lower-triangular factor L.
   * 
   * @return L such that L*L' = C
   */
  public RealMatrix factor() { return L.copy(); }

  @Override
  public String toString() { return "L="+Matrix.toString(L, "%.3e"); };

}
