package sivantoledo.statespace;

import java.util.Arrays;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One predict/update cycle of the Kalman filter under the matrices of one
 * regime.
 *
 * Each call to {@link #step} advances a {@link FilterState} by one period:
 *
 *   z = T*z + C,  P = T*P*T' + R*Q*R'                          (predict)
 *   V = Z_t*P*Z_t' + Z_t*G_t + G_t'*Z_t' + H_t,  dy = y_t - Z_t*z - D_t
 *   z = z + PZG*(V\dy),  P = P - PZG*(V\PZG'),  PZG = P*Z_t' + G_t   (update)
 *
 * where the subscript t restricts the measurement equation to the
 * observables present in period t, H = E + M*Q*M' and G = R*Q*M'. When
 * nothing is observed the update is skipped and the filtered state equals
 * the predicted one.
 *
 * @author Sivan Toledo
 */
public class KalmanRecursion {

  private final static Logger log = LogManager.getLogger();

  static final double LOG_2PI = Math.log(2*Math.PI);

  /**
   * What one period produced. The mean and covariance objects are the ones
   * stored in the filter state; the recursion replaces them in the next
   * period and never mutates them, so they stay valid.
   */
  public static class Period {
    public final int        index;
    public final int        observedCount;               // Ny_t
    public final RealVector predictedMean;               // z_{t|t-1}
    public final RealMatrix predictedCovariance;         // P_{t|t-1}
    public final RealVector filteredMean;                // z_{t|t}
    public final RealMatrix filteredCovariance;          // P_{t|t}
    public final double[]   predictionError;             // length Ny, NaN where missing
    public final double[]   standardizedPredictionError; // length Ny, NaN where missing
    public final double     logLikelihood;               // log p(y_t | y_1..y_{t-1})

    Period(int index, int observedCount,
           RealVector predictedMean, RealMatrix predictedCovariance,
           RealVector filteredMean,  RealMatrix filteredCovariance,
           double[] predictionError, double[] standardizedPredictionError,
           double logLikelihood) {
      this.index                       = index;
      this.observedCount               = observedCount;
      this.predictedMean               = predictedMean;
      this.predictedCovariance         = predictedCovariance;
      this.filteredMean                = filteredMean;
      this.filteredCovariance          = filteredCovariance;
      this.predictionError             = predictionError;
      this.standardizedPredictionError = standardizedPredictionError;
      this.logLikelihood               = logLikelihood;
    }
  }

  private final StateSpaceModel model;

  public KalmanRecursion(StateSpaceModel model) {
    if (model == null) throw new IllegalArgumentException("model must not be null");
    this.model = model;
  }

  /**
   * Advances the state by one period.
   *
   * @param t     the 0-based period index, used only for error reporting
   * @param state the filtered state of period t-1; replaced by that of period t
   * @param y     the observations of period t, length Ny, NaN where missing
   * @return the period's predictions, errors and log-likelihood contribution
   * @throws NumericalException if the innovation covariance is not positive definite, or the
   *                            prediction or the log-likelihood is not finite
   */
  public Period step(int t, FilterState state, double[] y) {
    int ny = model.observableDimension();
    if (y.length != ny) throw new ConfigurationException(String.format("period %d has %d observations, model has %d observables", t, y.length, ny));
    if (state.dimension() != model.stateDimension())
      throw new ConfigurationException(String.format("state has dimension %d, model has %d states", state.dimension(), model.stateDimension()));

    RealMatrix T = model.T();

    /*
     * Predict.
     */
    RealVector z = T.operate(state.z()).add(model.C());
    RealMatrix P = Matrix.symmetrize(T.multiply(state.P()).multiply(T.transpose()).add(model.RQR()));
    if (!Matrix.isFinite(z) || !Matrix.isFinite(P))
      throw new NumericalException(t, "the predicted state is not finite", null);

    double[] error    = new double[ny];
    double[] stdError = new double[ny];
    Arrays.fill(error,    Double.NaN);
    Arrays.fill(stdError, Double.NaN);

    int[] observed = Matrix.nonmissing(y);
    if (observed.length == 0) {
      state.set(z, P);
      log.printf(Level.TRACE, "period %d: nothing observed", t);
      return new Period(t, 0, z, P, z, P, error, stdError, 0.0);
    }

    RealMatrix Z_t = Matrix.selectRows(model.Z(), observed);
    RealVector D_t = Matrix.select(model.D(), observed);
    RealMatrix H_t = model.H().getSubMatrix(observed, observed);
    RealVector y_t = Matrix.select(y, observed);

    RealMatrix PZG = P.multiply(Z_t.transpose()); // Cov(z_t, y_t | y_1..y_{t-1})
    RealMatrix V   = Z_t.multiply(PZG).add(H_t);
    if (model.hasCorrelatedErrors()) {
      RealMatrix G_t = Matrix.selectColumns(model.G(), observed);
      RealMatrix ZG  = Z_t.multiply(G_t);
      V   = V.add(ZG).add(ZG.transpose());
      PZG = PZG.add(G_t);
    }
    V = Matrix.symmetrize(V);

    RealVector dy = y_t.subtract(Z_t.operate(z)).subtract(D_t);
    if (!Matrix.isFinite(dy))
      throw new NumericalException(t, "the prediction error is not finite (infinite observation?)", null);

    CovarianceMatrix innovation;
    try {
      innovation = new CholeskyCovarianceMatrix(V);
    } catch (NumericalException ne) {
      throw ne.atPeriod(t);
    }

    RealVector ddy = innovation.solve(dy);
    RealVector sd  = innovation.standardDeviations();
    for (int i=0; i<observed.length; i++) {
      error   [observed[i]] = dy.getEntry(i);
      stdError[observed[i]] = dy.getEntry(i) / sd.getEntry(i);
    }

    double loglh = -0.5*innovation.logDeterminant() - 0.5*dy.dotProduct(ddy) - 0.5*observed.length*LOG_2PI;
    if (!Double.isFinite(loglh))
      throw new NumericalException(t, String.format("log-likelihood %s", loglh), null);

    /*
     * Update.
     */
    RealVector zf = z.add(PZG.operate(ddy));
    RealMatrix Pf = Matrix.symmetrize(P.subtract(PZG.multiply(innovation.solve(PZG.transpose()))));
    state.set(zf, Pf);

    log.printf(Level.TRACE, "period %d: %d observed, log-likelihood %.6e", t, observed.length, loglh);

    return new Period(t, observed.length, z, P, zf, Pf, error, stdError, loglh);
  }
}
