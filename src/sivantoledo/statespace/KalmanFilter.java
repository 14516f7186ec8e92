package sivantoledo.statespace;

import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Kalman filter and log-likelihood for linear Gaussian state-space models.
 *
 * The model of each regime is
 *
 *   z_t = C + T*z_{t-1} + R*eps_t         eps_t ~ N(0,Q)
 *   y_t = D + Z*z_t     + eta_t + M*eps_t eta_t ~ N(0,E)
 *
 * (see {@link StateSpaceModel}). Observations are an Ny x T matrix in which
 * NaN marks a missing value; a missing value removes that observable from
 * that period's measurement equation only.
 *
 * When no initial state is given, the initial mean and covariance are the
 * stationary ones implied by the first regime, or a diffuse prior (z0 = C,
 * P0 = 1e6*I) if that regime is not stationary.
 *
 * The filter is stateless between calls; independent calls may run
 * concurrently.
 *
 * @author Sivan Toledo
 */
public class KalmanFilter {

  private KalmanFilter() {}

  public static FilterOutput filter(RealMatrix observations, StateSpaceModel model) {
    return filter(observations, model, null, FilterOptions.DEFAULTS);
  }

  public static FilterOutput filter(RealMatrix observations, StateSpaceModel model, FilterOptions options) {
    return filter(observations, model, null, options);
  }

  /**
   * Filters a sample under a single regime.
   *
   * @param observations Ny x T, NaN where missing
   * @param model        the system matrices
   * @param initialState the state before the first period, or null
   * @param options      output and initialization settings
   * @return the filter's outputs
   */
  public static FilterOutput filter(RealMatrix observations, StateSpaceModel model, FilterState initialState,
                                    FilterOptions options) {
    if (observations == null) throw new IllegalArgumentException("observations must not be null");
    return filter(observations, RegimePartition.single(observations.getColumnDimension()),
                  Collections.singletonList(model), initialState, options);
  }

  /**
   * Filters a sample whose system matrices change at known dates.
   *
   * @param observations Ny x T, NaN where missing
   * @param partition    the regimes, covering all T periods in order
   * @param models       one model per regime
   * @param initialState the state before the first period, or null
   * @param options      output and initialization settings
   * @return the filter's outputs
   */
  public static FilterOutput filter(RealMatrix observations, RegimePartition partition, List<StateSpaceModel> models,
                                    FilterState initialState, FilterOptions options) {
    return new RegimeScheduler(options).run(observations, partition, models, initialState);
  }

  /**
   * The log-likelihood alone, without recording per-period outputs.
   */
  public static double logLikelihood(RealMatrix observations, StateSpaceModel model, FilterOptions options) {
    return filter(observations, model, null, options.withFullOutput(false)).logLikelihood();
  }

  /**
   * The log-likelihood alone, without recording per-period outputs.
   */
  public static double logLikelihood(RealMatrix observations, RegimePartition partition, List<StateSpaceModel> models,
                                     FilterState initialState, FilterOptions options) {
    return filter(observations, partition, models, initialState, options.withFullOutput(false)).logLikelihood();
  }
}
