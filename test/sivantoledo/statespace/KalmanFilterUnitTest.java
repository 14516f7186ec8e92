package sivantoledo.statespace;

import static sivantoledo.statespace.StateSpaceSimulation.row;
import static sivantoledo.statespace.StateSpaceSimulation.vector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class KalmanFilterUnitTest {

  private static final double TOLERANCE = 1e-10;

  @Test
  public void testScalarExample() {
    FilterOutput out = KalmanFilter.filter(row(1.0, -0.5), StateSpaceSimulation.scalar(0.5, 0.0, 1.0, 1.0));
    Assert.assertEquals(out.initialState().mean().getEntry(0), 0.0, TOLERANCE);
    Assert.assertEquals(out.initialState().covariance().getEntry(0, 0), 4.0/3.0, TOLERANCE);
    Assert.assertEquals(out.filtered().getEntry(0, 0), (4.0/3.0)/(4.0/3.0+1.0), TOLERANCE);
    Assert.assertEquals(out.filtered().getEntry(0, 0), 0.5714, 1e-4);
  }

  @DataProvider(name = "samples")
  public Object[][] samples() {
    return new Object[][] {
      { 1,  8, new int[][] {} },
      { 2, 10, new int[][] { { 0, 2 }, { 1, 2 }, { 1, 5 } } }, // period 2 entirely missing
      { 3, 12, new int[][] { { 0, 0 }, { 1, 11 } } },
    };
  }

  /**
   * The filter's likelihood must equal the joint Gaussian density of all
   * observed values, computed directly from their mean and covariance.
   */
  @Test(dataProvider = "samples")
  public void testLikelihoodMatchesJointDensity(int seed, int T, int[][] missing) {
    StateSpaceModel model = StateSpaceSimulation.threeStates();
    StateSpaceSimulation sim = new StateSpaceSimulation(model, seed).simulate(T, vector(0.5, -0.5, 1.0));
    for (int[] m: missing) sim.remove(m[0], m[1]);

    FilterOutput out = KalmanFilter.filter(sim.observations, model);
    FilterState initial = new InitialStateSolver().solve(model);

    Assert.assertEquals(out.logLikelihood(), jointLogDensity(model, initial, sim.observations), 1e-8);
  }

  @Test
  public void testMarginalsSumToLikelihood() {
    StateSpaceModel model = StateSpaceSimulation.threeStates();
    RealMatrix y = new StateSpaceSimulation(model, 9).simulate(40, vector(0, 0, 0)).remove(0, 10).observations;
    FilterOutput out = KalmanFilter.filter(y, model, FilterOptions.DEFAULTS.withPresamplePeriods(3));
    Assert.assertEquals(Arrays.stream(out.marginalLogLikelihood()).sum(), out.logLikelihood(), TOLERANCE);
  }

  @Test
  public void testCovariancesAreSymmetric() {
    StateSpaceModel model = StateSpaceSimulation.threeStates();
    RealMatrix y = new StateSpaceSimulation(model, 17).simulate(50, vector(0, 0, 0))
                     .remove(0, 3).remove(0, 4).remove(1, 4).remove(1, 20).observations;
    FilterOutput out = KalmanFilter.filter(y, model);
    for (int t=0; t<out.periods(); t++) {
      RealMatrix vpred = out.predictedCovariance(t);
      RealMatrix vfilt = out.filteredCovariance(t);
      Assert.assertEquals(Matrix.normMax(vpred.subtract(vpred.transpose())), 0.0);
      Assert.assertEquals(Matrix.normMax(vfilt.subtract(vfilt.transpose())), 0.0);
    }
  }

  @Test
  public void testMissingObservableMatchesRemovedObservable() {
    StateSpaceModel two = StateSpaceSimulation.threeStates();
    RealMatrix y = new StateSpaceSimulation(two, 23).simulate(25, vector(0, 0, 0)).observations;
    for (int t=0; t<25; t++) y.setEntry(1, t, Double.NaN);

    StateSpaceModel one = new StateSpaceModel(two.transition(), two.shockLoading(), two.transitionConstant(),
                                              two.shockCovariance(),
                                              two.measurement().getSubMatrix(0, 0, 0, 2),
                                              vector(two.measurementConstant().getEntry(0)),
                                              two.measurementErrorCovariance().getSubMatrix(0, 0, 0, 0));
    RealMatrix y1 = y.getSubMatrix(0, 0, 0, 24);

    FilterOutput withMissing = KalmanFilter.filter(y, two);
    FilterOutput removed     = KalmanFilter.filter(y1, one);

    Assert.assertEquals(withMissing.logLikelihood(), removed.logLikelihood(), TOLERANCE);
    Assert.assertEquals(Matrix.normMax(withMissing.filtered().subtract(removed.filtered())), 0.0, TOLERANCE);
    Assert.assertEquals(Matrix.normMax(withMissing.predicted().subtract(removed.predicted())), 0.0, TOLERANCE);
    Assert.assertEquals(withMissing.predictionError().getRow(0), removed.predictionError().getRow(0), TOLERANCE);
    for (int t=0; t<25; t++) {
      Assert.assertTrue(Double.isNaN(withMissing.predictionError().getEntry(1, t)));
      Assert.assertTrue(Double.isNaN(withMissing.standardizedPredictionError().getEntry(1, t)));
    }
    Assert.assertTrue(Double.isNaN(withMissing.rmse()[1]));
    Assert.assertEquals(withMissing.rmse()[0], removed.rmse()[0], TOLERANCE);
  }

  @Test
  public void testZeroMeasurementShockLoadingIsUncorrelated() {
    StateSpaceModel plain = StateSpaceSimulation.threeStates();
    StateSpaceModel zero  = new StateSpaceModel(plain.transition(), plain.shockLoading(), plain.transitionConstant(),
                                                plain.shockCovariance(), plain.measurement(), plain.measurementConstant(),
                                                plain.measurementErrorCovariance(), MatrixUtils.createRealMatrix(2, 2));
    Assert.assertFalse(zero.hasCorrelatedErrors());
    RealMatrix y = new StateSpaceSimulation(plain, 31).simulate(12, vector(0, 0, 0)).observations;
    Assert.assertEquals(KalmanFilter.filter(y, zero).logLikelihood(), KalmanFilter.filter(y, plain).logLikelihood(), 0.0);
  }

  @Test
  public void testRegimeOverload() {
    StateSpaceModel a = StateSpaceSimulation.scalar(0.5, 0.0, 1.0, 1.0);
    StateSpaceModel b = StateSpaceSimulation.scalar(0.8, 0.1, 0.5, 2.0);
    RealMatrix y = row(0.2, 1.5, -0.3, 0.7);
    FilterOutput out = KalmanFilter.filter(y, RegimePartition.ofLengths(1, 3), Arrays.asList(a, b), null, FilterOptions.DEFAULTS);
    double lean = KalmanFilter.logLikelihood(y, RegimePartition.ofLengths(1, 3), Arrays.asList(a, b), null, FilterOptions.DEFAULTS);
    Assert.assertEquals(out.periods(), 4);
    Assert.assertEquals(lean, out.logLikelihood(), TOLERANCE);
  }

  @Test
  public void testNonStationaryModelUsesDiffusePrior() {
    StateSpaceModel walk = StateSpaceSimulation.scalar(1.0, 0.25, 1.0, 1.0);
    FilterOutput out = KalmanFilter.filter(row(1.0, 2.0, 3.0), walk);
    Assert.assertEquals(out.initialState().mean().getEntry(0), 0.25);
    Assert.assertEquals(out.initialState().covariance().getEntry(0, 0), 1e6);
    // after one observation the diffuse prior is nearly forgotten
    Assert.assertEquals(out.filtered().getEntry(0, 0), 1.0, 1e-5);
  }

  /**
   * log N(y_obs; mean, cov) with mean and covariance of the observed values
   * built period by period from the model.
   */
  private static double jointLogDensity(StateSpaceModel model, FilterState initial, RealMatrix y) {
    int T = y.getColumnDimension();
    RealMatrix A = model.transition();
    RealMatrix Z = model.measurement();
    RealMatrix E = model.measurementErrorCovariance();

    RealVector[] mean = new RealVector[T];
    RealMatrix[][] cross = new RealMatrix[T][T]; // cross[t][s] = Cov(z_t, z_s), t >= s
    RealVector m = initial.mean();
    RealMatrix P = initial.covariance();
    for (int t=0; t<T; t++) {
      m = A.operate(m).add(model.transitionConstant());
      P = A.multiply(P).multiply(A.transpose()).add(model.stateShockCovariance());
      mean[t] = m;
      cross[t][t] = P;
      for (int s=0; s<t; s++) cross[t][s] = A.multiply(cross[t-1][s]);
    }

    List<int[]> observed = new ArrayList<>();
    for (int t=0; t<T; t++)
      for (int i=0; i<y.getRowDimension(); i++)
        if (!Double.isNaN(y.getEntry(i, t))) observed.add(new int[] { i, t });

    int n = observed.size();
    RealVector r = MatrixUtils.createRealVector(new double[n]);
    RealMatrix S = MatrixUtils.createRealMatrix(n, n);
    for (int a=0; a<n; a++) {
      int i = observed.get(a)[0], t = observed.get(a)[1];
      r.setEntry(a, y.getEntry(i, t) - model.measurementConstant().getEntry(i) - Z.getRowVector(i).dotProduct(mean[t]));
      for (int b=0; b<n; b++) {
        int j = observed.get(b)[0], s = observed.get(b)[1];
        RealMatrix C = t >= s ? cross[t][s] : cross[s][t].transpose();
        double c = Z.getRowVector(i).dotProduct(C.operate(Z.getRowVector(j)));
        if (t == s) c += E.getEntry(i, j);
        S.setEntry(a, b, c);
      }
    }
    S = Matrix.symmetrize(S);

    CholeskyDecomposition chol = new CholeskyDecomposition(S);
    double logdet = 0;
    for (int a=0; a<n; a++) logdet += 2*Math.log(chol.getL().getEntry(a, a));
    double quad = r.dotProduct(chol.getSolver().solve(r));
    return -0.5*logdet - 0.5*quad - 0.5*n*Math.log(2*Math.PI);
  }
}
