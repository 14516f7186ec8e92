package sivantoledo.statespace;

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Solves the discrete Lyapunov (Stein) equation P - T*P*T' = Q for a stable T.
 */
public class LyapunovSolver {

  public static enum Method {
    AUTOMATIC, // KRONECKER for small systems, DOUBLING otherwise
    KRONECKER, // (I - kron(T,T)) \ vec(Q), an Nz^2 x Nz^2 LU solve
    DOUBLING   // P <- P + A*P*A', A <- A*A
  }

  /*
   * Largest state dimension for which AUTOMATIC forms the Kronecker system
   * (a 400 x 400 LU factorization).
   */
  static final int    KRONECKER_MAX_DIMENSION = 20;

  static final int    DOUBLING_MAX_ITERATIONS = 100;
  static final double DOUBLING_TOLERANCE      = 1e-14;

  private LyapunovSolver() {}

  /**
   * @param T      the transition matrix, all eigenvalues inside the unit circle
   * @param Q      the symmetric right-hand side
   * @param method how to solve
   * @return the symmetric solution P
   * @throws NumericalException if the system is singular, the iteration does not
   *         converge, or the result is not finite
   */
  public static RealMatrix solve(RealMatrix T, RealMatrix Q, Method method) {
    int n = T.getRowDimension();
    if (method == Method.AUTOMATIC) method = n <= KRONECKER_MAX_DIMENSION ? Method.KRONECKER : Method.DOUBLING;

    RealMatrix P;
    switch (method) {
    case KRONECKER:
      P = kronecker(T, Q);
      break;
    case DOUBLING:
      P = doubling(T, Q);
      break;
    default:
      throw new IllegalArgumentException("unknown method "+method);
    }

    if (!Matrix.isFinite(P)) throw new NumericalException("Lyapunov solution is not finite");
    return Matrix.symmetrize(P);
  }

  private static RealMatrix kronecker(RealMatrix T, RealMatrix Q) {
    int n = T.getRowDimension();
    int m = n*n;

    /*
     * Column-major vec: entry (r,c) of P is element c*n+r of vec(P), and
     * vec(T*P*T') = kron(T,T)*vec(P).
     */
    RealMatrix A = MatrixUtils.createRealIdentityMatrix(m);
    RealVector b = MatrixUtils.createRealVector(new double[m]);
    for (int c=0; c<n; c++) {
      for (int r=0; r<n; r++) {
        int row = c*n+r;
        b.setEntry(row, Q.getEntry(r, c));
        for (int bb=0; bb<n; bb++) {
          double tcb = T.getEntry(c, bb);
          if (tcb == 0) continue;
          for (int a=0; a<n; a++) {
            int col = bb*n+a;
            A.addToEntry(row, col, -tcb*T.getEntry(r, a));
          }
        }
      }
    }

    RealVector vecP;
    try {
      vecP = new LUDecomposition(A).getSolver().solve(b);
    } catch (SingularMatrixException sme) {
      throw new NumericalException("Kronecker Lyapunov system is singular", sme);
    }

    RealMatrix P = MatrixUtils.createRealMatrix(n, n);
    for (int c=0; c<n; c++)
      for (int r=0; r<n; r++)
        P.setEntry(r, c, vecP.getEntry(c*n+r));
    return P;
  }

  private static RealMatrix doubling(RealMatrix T, RealMatrix Q) {
    RealMatrix A = T.copy();
    RealMatrix P = Q.copy();
    for (int k=0; k<DOUBLING_MAX_ITERATIONS; k++) {
      RealMatrix increment = A.multiply(P).multiply(A.transpose());
      P = P.add(increment);
      A = A.multiply(A);
      double size = Math.max(1.0, Matrix.normMax(P));
      double step = Matrix.normMax(increment);
      if (Double.isNaN(step) || Double.isInfinite(size)) break;
      if (step <= DOUBLING_TOLERANCE*size) return P;
    }
    throw new NumericalException("Lyapunov doubling iteration did not converge in "+DOUBLING_MAX_ITERATIONS+" iterations");
  }
}
