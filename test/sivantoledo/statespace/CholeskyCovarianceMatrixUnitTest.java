package sivantoledo.statespace;

import static sivantoledo.statespace.StateSpaceSimulation.matrix;
import static sivantoledo.statespace.StateSpaceSimulation.vector;

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CholeskyCovarianceMatrixUnitTest {

  private static final double TOLERANCE = 1e-12;

  private static final RealMatrix C = matrix(new double[][] {
    { 4.0, 1.0, 0.5 },
    { 1.0, 3.0, 0.2 },
    { 0.5, 0.2, 2.0 }
  });

  @Test
  public void testLogDeterminantMatchesLU() {
    CovarianceMatrix cov = new CholeskyCovarianceMatrix(C);
    double det = new LUDecomposition(C).getDeterminant();
    Assert.assertEquals(cov.logDeterminant(), Math.log(det), TOLERANCE);
    Assert.assertEquals(cov.dimension(), 3);
  }

  @Test
  public void testSolve() {
    CovarianceMatrix cov = new CholeskyCovarianceMatrix(C);
    RealVector b = vector(1.0, -2.0, 0.5);
    RealVector x = cov.solve(b);
    RealVector r = C.operate(x).subtract(b);
    Assert.assertEquals(r.getLInfNorm(), 0.0, TOLERANCE);

    RealMatrix B = matrix(new double[][] {{ 1, 0 }, { 0, 1 }, { 2, 3 }});
    RealMatrix X = cov.solve(B);
    Assert.assertEquals(C.multiply(X).subtract(B).getNorm(), 0.0, TOLERANCE);
  }

  @Test
  public void testStandardDeviationsAndFactor() {
    CholeskyCovarianceMatrix cov = new CholeskyCovarianceMatrix(C);
    RealVector sd = cov.standardDeviations();
    Assert.assertEquals(sd.getEntry(0), 2.0, TOLERANCE);
    Assert.assertEquals(sd.getEntry(1), Math.sqrt(3.0), TOLERANCE);
    Assert.assertEquals(sd.getEntry(2), Math.sqrt(2.0), TOLERANCE);
    RealMatrix L = cov.factor();
    Assert.assertEquals(L.multiply(L.transpose()).subtract(C).getNorm(), 0.0, TOLERANCE);
    Assert.assertEquals(cov.get().subtract(C).getNorm(), 0.0);
  }

  @Test(expectedExceptions = NumericalException.class)
  public void testSingularIsRejected() {
    new CholeskyCovarianceMatrix(matrix(new double[][] {{ 1, 1 }, { 1, 1 }}));
  }

  @Test(expectedExceptions = NumericalException.class)
  public void testIndefiniteIsRejected() {
    new CholeskyCovarianceMatrix(matrix(new double[][] {{ 1, 2 }, { 2, 1 }}));
  }

  @Test(expectedExceptions = NumericalException.class)
  public void testNaNIsRejected() {
    new CholeskyCovarianceMatrix(matrix(new double[][] {{ 1, Double.NaN }, { Double.NaN, 1 }}));
  }

  @Test
  public void testTinyVarianceIsAccepted() {
    CovarianceMatrix cov = new CholeskyCovarianceMatrix(matrix(new double[][] {{ 1e-14 }}));
    Assert.assertEquals(cov.logDeterminant(), Math.log(1e-14), 1e-9);
  }
}
