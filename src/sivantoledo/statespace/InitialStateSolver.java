package sivantoledo.statespace;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Initial state distribution for a filter run whose caller supplied none.
 *
 * When every eigenvalue of T lies strictly inside the unit circle the state
 * process is stationary and the initial distribution is its unconditional one:
 *
 *   z0 = (I - T) \ C
 *   P0 - T*P0*T' = R*Q*R'
 *
 * Otherwise (or when either solve fails) the prior is diffuse: z0 = C and
 * P0 = v*I, with v = 1e6 by default.
 */
public class InitialStateSolver {

  private final static Logger log = LogManager.getLogger();

  private final double                diffusePriorVariance;
  private final LyapunovSolver.Method lyapunovMethod;

  public InitialStateSolver() {
    this(FilterOptions.DEFAULTS);
  }

  public InitialStateSolver(FilterOptions options) {
    this.diffusePriorVariance = options.diffusePriorVariance();
    this.lyapunovMethod       = options.lyapunovMethod();
  }

  /**
   * @param model the model of the first regime
   * @return a fresh state holding z0 and P0
   */
  public FilterState solve(StateSpaceModel model) {
    RealMatrix T = model.T();
    RealVector C = model.C();
    int nz = model.stateDimension();

    if (isStationary(T)) {
      try {
        RealMatrix IminusT = MatrixUtils.createRealIdentityMatrix(nz).subtract(T);
        RealVector z0 = new LUDecomposition(IminusT).getSolver().solve(C);
        RealMatrix P0 = LyapunovSolver.solve(T, model.RQR(), lyapunovMethod);
        log.debug("stationary initial conditions, Nz={}", nz);
        return new FilterState(z0, P0);
      } catch (SingularMatrixException sme) {
        log.warn("I - T is singular; using diffuse prior with variance {}", diffusePriorVariance);
      } catch (NumericalException ne) {
        log.warn("{}; using diffuse prior with variance {}", ne.getMessage(), diffusePriorVariance);
      }
    } else {
      log.debug("transition has an eigenvalue on or outside the unit circle; using diffuse prior with variance {}", diffusePriorVariance);
    }
    return diffuse(model);
  }

  /**
   * z0 = C, P0 = v*I.
   */
  public FilterState diffuse(StateSpaceModel model) {
    int nz = model.stateDimension();
    return new FilterState(model.C(),
                           MatrixUtils.createRealIdentityMatrix(nz).scalarMultiply(diffusePriorVariance));
  }

  /**
   * @param T a square matrix
   * @return true if every eigenvalue of T has modulus strictly less than one
   */
  public static boolean isStationary(RealMatrix T) {
    if (!Matrix.isFinite(T)) return false;
    if (T.getNorm() < 1.0) return true; // an induced norm bounds the spectral radius
    try {
      EigenDecomposition eig = new EigenDecomposition(T);
      for (int i=0; i<T.getRowDimension(); i++) {
        double modulus = Math.hypot(eig.getRealEigenvalue(i), eig.getImagEigenvalue(i));
        if (!(modulus < 1.0)) return false;
      }
      return true;
    } catch (MaxCountExceededException mcee) { // the eigenvalue iteration did not converge
      log.warn("eigenvalues of the transition matrix did not converge: {}", mcee.getMessage());
      return false;
    } catch (MathArithmeticException mae) { // e.g., "zero norm" from a nearly nilpotent T
      log.warn("eigenvalues of the transition matrix could not be computed: {}", mae.getMessage());
      return false;
    }
  }
}
