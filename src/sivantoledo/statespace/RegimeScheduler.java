package sivantoledo.statespace;

import java.util.List;
import java.util.function.Consumer;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the Kalman recursion over a sample split into regimes.
 *
 * The state is carried unchanged across regime boundaries: the filtered
 * state at the end of one regime is the starting state of the next. Initial
 * conditions are derived only once, from the first regime's matrices, and
 * only if the caller did not supply them. Presample periods are filtered
 * like any other period but do not contribute to the likelihood.
 */
public class RegimeScheduler {

  private final static Logger log = LogManager.getLogger();

  private final FilterOptions options;

  public RegimeScheduler() {
    this(FilterOptions.DEFAULTS);
  }

  public RegimeScheduler(FilterOptions options) {
    if (options == null) throw new IllegalArgumentException("options must not be null");
    this.options = options;
  }

  /**
   * Filters the whole sample.
   *
   * @param observations an Ny x T matrix, NaN where an observation is missing
   * @param partition    the regimes, covering periods 0..T-1
   * @param models       one model per regime, all with the same dimensions
   * @param initialState the state before period 0, or null to derive it from the first model
   * @return the trimmed outputs
   * @throws ConfigurationException if the inputs are inconsistent
   * @throws NumericalException if an innovation covariance is not positive definite
   * @throws DegenerateLikelihoodException if nothing is observed in the main sample and the options reject that
   */
  public FilterOutput run(RealMatrix observations, RegimePartition partition, List<StateSpaceModel> models,
                          FilterState initialState) {
    if (observations == null) throw new IllegalArgumentException("observations must not be null");
    if (partition == null)    throw new IllegalArgumentException("partition must not be null");
    if (models == null)       throw new IllegalArgumentException("models must not be null");

    int T = observations.getColumnDimension();
    int n = options.presamplePeriods();

    validate(observations, partition, models, initialState);

    StateSpaceModel first = models.get(0);
    int nz = first.stateDimension();
    int ny = first.observableDimension();

    log.debug("filtering T={} periods, Nz={}, Ny={}, {} regime(s), presample={}", T, nz, ny, partition.size(), n);

    FilterState state;
    if (initialState == null) {
      state = new InitialStateSolver(options).solve(first);
    } else {
      log.debug("using caller-supplied initial state");
      state = initialState.copy();
    }
    FilterState initial = state.copy();

    Recording recording = new Recording(T, nz, ny, n, options.fullOutput());

    for (int i=0; i<partition.size(); i++) {
      RegimePartition.Regime regime = partition.get(i);
      log.debug("regime {} covers periods {}", i, regime);
      filterRegime(state, models.get(i), regime, observations, recording);
    }

    if (recording.observedMainSample == 0) {
      String message = String.format("no observations in the %d main-sample periods; the likelihood is degenerate", T-n);
      if (options.rejectDegenerateLikelihood()) throw new DegenerateLikelihoodException(message);
      log.warn(message);
    }

    FilterOutput untrimmed = recording.output(initial, state);
    return PresampleTrimmer.trim(untrimmed, n);
  }

  /**
   * Filters the periods of one regime, starting from and updating the given state.
   *
   * @param state        the filtered state before the regime's first period; on return, after its last
   * @param model        the regime's matrices
   * @param regime       the periods to filter
   * @param observations the full Ny x T observation matrix
   * @param sink         receives the result of each period, in order
   */
  public static void filterRegime(FilterState state, StateSpaceModel model, RegimePartition.Regime regime,
                                  RealMatrix observations, Consumer<KalmanRecursion.Period> sink) {
    KalmanRecursion recursion = new KalmanRecursion(model);
    for (int t=regime.start; t<regime.end; t++) {
      sink.accept(recursion.step(t, state, observations.getColumn(t)));
    }
  }

  private void validate(RealMatrix observations, RegimePartition partition, List<StateSpaceModel> models,
                        FilterState initialState) {
    int T = observations.getColumnDimension();

    partition.checkCovers(T);
    if (models.size() != partition.size())
      throw new ConfigurationException(String.format("%d models for %d regimes", models.size(), partition.size()));

    StateSpaceModel first = models.get(0);
    for (int i=0; i<models.size(); i++) {
      StateSpaceModel m = models.get(i);
      if (m == null) throw new IllegalArgumentException("model of regime "+i+" is null");
      if (!m.hasSameShape(first))
        throw new ConfigurationException(String.format("regime %d has shape %s, regime 0 has %s", i, m, first));
    }

    if (observations.getRowDimension() != first.observableDimension())
      throw new ConfigurationException(String.format("observations have %d rows, model has %d observables",
                                                     observations.getRowDimension(), first.observableDimension()));

    if (options.presamplePeriods() >= T)
      throw new ConfigurationException(String.format("presample of %d periods leaves nothing of a %d-period sample",
                                                     options.presamplePeriods(), T));

    if (initialState != null && initialState.dimension() != first.stateDimension())
      throw new ConfigurationException(String.format("initial state has dimension %d, model has %d states",
                                                     initialState.dimension(), first.stateDimension()));
  }

  /**
   * Collects per-period results into the output arrays.
   */
  private static class Recording implements Consumer<KalmanRecursion.Period> {
    private final int      presample;
    private final double[] marginal;

    private final RealMatrix   pred;
    private final RealMatrix[] vpred;
    private final RealMatrix   filt;
    private final RealMatrix[] vfilt;
    private final RealMatrix   yprederror;
    private final RealMatrix   ystdprederror;

    private int observedMainSample = 0;

    Recording(int T, int nz, int ny, int presample, boolean full) {
      this.presample = presample;
      this.marginal  = new double[T];
      if (full) {
        pred          = MatrixUtils.createRealMatrix(nz, T);
        vpred         = new RealMatrix[T];
        filt          = MatrixUtils.createRealMatrix(nz, T);
        vfilt         = new RealMatrix[T];
        yprederror    = MatrixUtils.createRealMatrix(ny, T);
        ystdprederror = MatrixUtils.createRealMatrix(ny, T);
      } else {
        pred = filt = yprederror = ystdprederror = null;
        vpred = vfilt = null;
      }
    }

    @Override
    public void accept(KalmanRecursion.Period p) {
      int t = p.index;
      if (t >= presample) {
        marginal[t] = p.logLikelihood;
        observedMainSample += p.observedCount;
      }
      if (pred == null) return;
      pred.setColumnVector(t, p.predictedMean);
      vpred[t] = p.predictedCovariance;
      filt.setColumnVector(t, p.filteredMean);
      vfilt[t] = p.filteredCovariance;
      yprederror.setColumn(t, p.predictionError);
      ystdprederror.setColumn(t, p.standardizedPredictionError);
    }

    FilterOutput output(FilterState initial, FilterState last) {
      return new FilterOutput(marginal, initial, last.copy(), 0, observedMainSample == 0,
                              pred, vpred, filt, vfilt, yprederror, ystdprederror);
    }
  }
}
