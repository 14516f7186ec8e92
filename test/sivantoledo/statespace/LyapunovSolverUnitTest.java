package sivantoledo.statespace;

import static sivantoledo.statespace.StateSpaceSimulation.matrix;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class LyapunovSolverUnitTest {

  private static final double TOLERANCE = 1e-10;

  @DataProvider(name = "methods")
  public Object[][] methods() {
    return new Object[][] {
      { LyapunovSolver.Method.KRONECKER },
      { LyapunovSolver.Method.DOUBLING  },
      { LyapunovSolver.Method.AUTOMATIC },
    };
  }

  @Test(dataProvider = "methods")
  public void testScalar(LyapunovSolver.Method method) {
    RealMatrix P = LyapunovSolver.solve(matrix(new double[][] {{ 0.5 }}), matrix(new double[][] {{ 1 }}), method);
    Assert.assertEquals(P.getEntry(0, 0), 4.0/3.0, TOLERANCE);
  }

  @Test(dataProvider = "methods")
  public void testResidual(LyapunovSolver.Method method) {
    StateSpaceModel model = StateSpaceSimulation.threeStates();
    RealMatrix T = model.transition();
    RealMatrix Q = model.stateShockCovariance();
    RealMatrix P = LyapunovSolver.solve(T, Q, method);
    RealMatrix residual = P.subtract(T.multiply(P).multiply(T.transpose())).subtract(Q);
    Assert.assertEquals(Matrix.normMax(residual), 0.0, TOLERANCE);
    Assert.assertEquals(Matrix.normMax(P.subtract(P.transpose())), 0.0);
  }

  @Test
  public void testMethodsAgree() {
    RealMatrix T = matrix(new double[][] {
      {  0.9, 0.3 },
      { -0.3, 0.8 }
    });
    RealMatrix Q = matrix(new double[][] {
      { 2.0, 0.4 },
      { 0.4, 1.0 }
    });
    RealMatrix kronecker = LyapunovSolver.solve(T, Q, LyapunovSolver.Method.KRONECKER);
    RealMatrix doubling  = LyapunovSolver.solve(T, Q, LyapunovSolver.Method.DOUBLING);
    Assert.assertEquals(Matrix.normMax(kronecker.subtract(doubling)), 0.0, 1e-8);
  }

  @Test(expectedExceptions = NumericalException.class)
  public void testKroneckerSingular() {
    LyapunovSolver.solve(MatrixUtils.createRealIdentityMatrix(2), MatrixUtils.createRealIdentityMatrix(2),
                         LyapunovSolver.Method.KRONECKER);
  }

  @Test(expectedExceptions = NumericalException.class)
  public void testDoublingDiverges() {
    LyapunovSolver.solve(matrix(new double[][] {{ 1.5 }}), matrix(new double[][] {{ 1 }}),
                         LyapunovSolver.Method.DOUBLING);
  }
}
