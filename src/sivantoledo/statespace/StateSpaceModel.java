package sivantoledo.statespace;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * The system matrices of one regime of a linear Gaussian state-space model:
 *
 *   z_t = C + T*z_{t-1} + R*eps_t        (transition equation)
 *   y_t = D + Z*z_t     + eta_t + M*eps_t (measurement equation)
 *
 * with eps_t ~ N(0,Q) and eta_t ~ N(0,E) independent. The measurement-shock
 * loading M is optional; when it is zero the measurement error is
 * uncorrelated with the state shocks.
 *
 * Instances are immutable; all accessors return copies.
 *
 * @author Sivan Toledo
 */
public class StateSpaceModel {

  private final RealMatrix transition;                 // T, Nz x Nz
  private final RealMatrix shockLoading;               // R, Nz x Ne
  private final RealVector transitionConstant;         // C, Nz
  private final RealMatrix shockCovariance;            // Q, Ne x Ne
  private final RealMatrix measurement;                // Z, Ny x Nz
  private final RealVector measurementConstant;        // D, Ny
  private final RealMatrix measurementErrorCovariance; // E, Ny x Ny
  private final RealMatrix measurementShockLoading;    // M, Ny x Ne

  /*
   * Derived once; every period of the recursion needs them.
   */
  private final RealMatrix stateShockCovariance;       // R*Q*R'
  private final RealMatrix measurementCovariance;      // E + M*Q*M'
  private final RealMatrix stateMeasurementCovariance; // R*Q*M'
  private final boolean    correlatedErrors;

  public StateSpaceModel(RealMatrix transition, RealMatrix shockLoading, RealVector transitionConstant,
                         RealMatrix shockCovariance, RealMatrix measurement, RealVector measurementConstant,
                         RealMatrix measurementErrorCovariance) {
    this(transition, shockLoading, transitionConstant, shockCovariance,
         measurement, measurementConstant, measurementErrorCovariance, null);
  }

  /**
   * @param transition                 T, Nz x Nz
   * @param shockLoading               R, Nz x Ne
   * @param transitionConstant         C, length Nz
   * @param shockCovariance            Q, Ne x Ne
   * @param measurement                Z, Ny x Nz
   * @param measurementConstant        D, length Ny
   * @param measurementErrorCovariance E, Ny x Ny
   * @param measurementShockLoading    M, Ny x Ne, or null for zero
   * @throws ConfigurationException if the dimensions are inconsistent or an entry is not finite
   */
  public StateSpaceModel(RealMatrix transition, RealMatrix shockLoading, RealVector transitionConstant,
                         RealMatrix shockCovariance, RealMatrix measurement, RealVector measurementConstant,
                         RealMatrix measurementErrorCovariance, RealMatrix measurementShockLoading) {
    require(transition,                 "transition");
    require(shockLoading,               "shockLoading");
    require(transitionConstant,         "transitionConstant");
    require(shockCovariance,            "shockCovariance");
    require(measurement,                "measurement");
    require(measurementConstant,        "measurementConstant");
    require(measurementErrorCovariance, "measurementErrorCovariance");

    int nz = transition.getRowDimension();
    int ne = shockLoading.getColumnDimension();
    int ny = measurement.getRowDimension();

    check(Matrix.isSquare(transition, nz),                  "transition", transition, nz, nz);
    check(shockLoading.getRowDimension() == nz,             "shockLoading", shockLoading, nz, ne);
    check(transitionConstant.getDimension() == nz,          "transitionConstant must have length "+nz+", has "+transitionConstant.getDimension());
    check(Matrix.isSquare(shockCovariance, ne),             "shockCovariance", shockCovariance, ne, ne);
    check(measurement.getColumnDimension() == nz,           "measurement", measurement, ny, nz);
    check(measurementConstant.getDimension() == ny,         "measurementConstant must have length "+ny+", has "+measurementConstant.getDimension());
    check(Matrix.isSquare(measurementErrorCovariance, ny),  "measurementErrorCovariance", measurementErrorCovariance, ny, ny);
    if (measurementShockLoading != null)
      check(measurementShockLoading.getRowDimension() == ny
            && measurementShockLoading.getColumnDimension() == ne, "measurementShockLoading", measurementShockLoading, ny, ne);

    finite(transition,                 "transition");
    finite(shockLoading,               "shockLoading");
    finite(transitionConstant,         "transitionConstant");
    finite(shockCovariance,            "shockCovariance");
    finite(measurement,                "measurement");
    finite(measurementConstant,        "measurementConstant");
    finite(measurementErrorCovariance, "measurementErrorCovariance");
    if (measurementShockLoading != null)
      finite(measurementShockLoading,  "measurementShockLoading");

    this.transition                 = transition.copy();
    this.shockLoading               = shockLoading.copy();
    this.transitionConstant         = transitionConstant.copy();
    this.shockCovariance            = shockCovariance.copy();
    this.measurement                = measurement.copy();
    this.measurementConstant        = measurementConstant.copy();
    this.measurementErrorCovariance = measurementErrorCovariance.copy();
    this.measurementShockLoading    = measurementShockLoading == null
                                    ? MatrixUtils.createRealMatrix(ny, ne)
                                    : measurementShockLoading.copy();

    this.correlatedErrors = Matrix.normMax(this.measurementShockLoading) != 0.0;

    stateShockCovariance = Matrix.symmetrize(shockLoading.multiply(shockCovariance).multiply(shockLoading.transpose()));
    if (correlatedErrors) {
      RealMatrix MQ = this.measurementShockLoading.multiply(shockCovariance);
      measurementCovariance      = Matrix.symmetrize(measurementErrorCovariance.add(MQ.multiply(this.measurementShockLoading.transpose())));
      stateMeasurementCovariance = shockLoading.multiply(shockCovariance).multiply(this.measurementShockLoading.transpose());
    } else {
      measurementCovariance      = Matrix.symmetrize(measurementErrorCovariance);
      stateMeasurementCovariance = MatrixUtils.createRealMatrix(nz, ny);
    }
  }

  private static void require(Object o, String name) {
    if (o == null) throw new IllegalArgumentException(name+" must not be null");
  }

  private static void check(boolean ok, String message) {
    if (!ok) throw new ConfigurationException(message);
  }

  private static void finite(RealMatrix A, String name) {
    if (!Matrix.isFinite(A)) throw new ConfigurationException(name+" has a NaN or infinite entry");
  }

  private static void finite(RealVector v, String name) {
    if (!Matrix.isFinite(v)) throw new ConfigurationException(name+" has a NaN or infinite entry");
  }

  private static void check(boolean ok, String name, RealMatrix A, int rows, int columns) {
    if (!ok) throw new ConfigurationException(String.format("%s must be %dx%d, is %s", name, rows, columns, Matrix.dimensions(A)));
  }

  /** Nz */
  public int stateDimension()      { return transition.getRowDimension(); }
  /** Ne */
  public int shockDimension()      { return shockLoading.getColumnDimension(); }
  /** Ny */
  public int observableDimension() { return measurement.getRowDimension(); }

  public RealMatrix transition()                 { return transition.copy(); }
  public RealMatrix shockLoading()               { return shockLoading.copy(); }
  public RealVector transitionConstant()         { return transitionConstant.copy(); }
  public RealMatrix shockCovariance()            { return shockCovariance.copy(); }
  public RealMatrix measurement()                { return measurement.copy(); }
  public RealVector measurementConstant()        { return measurementConstant.copy(); }
  public RealMatrix measurementErrorCovariance() { return measurementErrorCovariance.copy(); }
  public RealMatrix measurementShockLoading()    { return measurementShockLoading.copy(); }

  /**
   * R*Q*R', the covariance of the state innovation.
   */
  public RealMatrix stateShockCovariance()       { return stateShockCovariance.copy(); }

  /**
   * E + M*Q*M', the covariance of the total measurement error.
   */
  public RealMatrix measurementCovariance()      { return measurementCovariance.copy(); }

  /**
   * R*Q*M', the covariance between the state innovation and the measurement error.
   */
  public RealMatrix stateMeasurementCovariance() { return stateMeasurementCovariance.copy(); }

  /**
   * @return true if the measurement-shock loading is not identically zero
   */
  public boolean hasCorrelatedErrors()           { return correlatedErrors; }

  /**
   * @return true if the other model's matrices have the same shapes as this one's
   */
  public boolean hasSameShape(StateSpaceModel other) {
    return stateDimension()      == other.stateDimension()
        && shockDimension()      == other.shockDimension()
        && observableDimension() == other.observableDimension();
  }

  /*
   * Package-private views without copying, for the recursion.
   */
  RealMatrix T()  { return transition; }
  RealVector C()  { return transitionConstant; }
  RealMatrix Z()  { return measurement; }
  RealVector D()  { return measurementConstant; }
  RealMatrix RQR(){ return stateShockCovariance; }
  RealMatrix H()  { return measurementCovariance; }
  RealMatrix G()  { return stateMeasurementCovariance; }

  @Override
  public String toString() {
    return String.format("StateSpaceModel(Nz=%d, Ne=%d, Ny=%d%s)",
                         stateDimension(), shockDimension(), observableDimension(),
                         correlatedErrors ? ", correlated measurement errors" : "");
  }
}
