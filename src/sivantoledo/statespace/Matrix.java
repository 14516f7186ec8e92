package sivantoledo.statespace;

import java.util.Arrays;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Small matrix helpers used by the filter that Commons Math does not provide
 * directly.
 */
public class Matrix {

  private Matrix() {}

  /**
   * Returns (A+A')/2. Covariances are passed through this after every
   * update so that Cholesky never sees rounding-level asymmetry.
   *
   * @param A a square matrix
   * @return the symmetric part of A
   */
  public static RealMatrix symmetrize(RealMatrix A) {
    int n = A.getRowDimension();
    double[][] S = new double[n][n];
    for (int i=0; i<n; i++) {
      S[i][i] = A.getEntry(i, i);
      for (int j=0; j<i; j++) {
        double a = 0.5*(A.getEntry(i, j) + A.getEntry(j, i));
        S[i][j] = a;
        S[j][i] = a;
      }
    }
    return MatrixUtils.createRealMatrix(S);
  }

  /**
   * Indices of the entries of a column that are not NaN.
   *
   * @param column one period of observations
   * @return indices of present observations, in increasing order
   */
  public static int[] nonmissing(double[] column) {
    int[] rows = new int[column.length];
    int count = 0;
    for (int i=0; i<column.length; i++)
      if (!Double.isNaN(column[i])) rows[count++] = i;
    return Arrays.copyOf(rows, count);
  }

  public static RealVector select(RealVector v, int[] indices) {
    double[] s = new double[indices.length];
    for (int i=0; i<indices.length; i++) s[i] = v.getEntry(indices[i]);
    return MatrixUtils.createRealVector(s);
  }

  public static RealVector select(double[] v, int[] indices) {
    double[] s = new double[indices.length];
    for (int i=0; i<indices.length; i++) s[i] = v[indices[i]];
    return MatrixUtils.createRealVector(s);
  }

  /**
   * Restricts a matrix to a subset of its rows, keeping all columns.
   */
  public static RealMatrix selectRows(RealMatrix A, int[] rows) {
    return A.getSubMatrix(rows, allIndices(A.getColumnDimension()));
  }

  /**
   * Restricts a matrix to a subset of its columns, keeping all rows.
   */
  public static RealMatrix selectColumns(RealMatrix A, int[] columns) {
    return A.getSubMatrix(allIndices(A.getRowDimension()), columns);
  }

  public static int[] allIndices(int n) {
    int[] indices = new int[n];
    for (int i=0; i<n; i++) indices[i] = i;
    return indices;
  }

  public static boolean isFinite(RealMatrix A) {
    for (int i=0; i<A.getRowDimension(); i++)
      for (int j=0; j<A.getColumnDimension(); j++)
        if (!Double.isFinite(A.getEntry(i, j))) return false;
    return true;
  }

  public static boolean isFinite(RealVector v) {
    for (int i=0; i<v.getDimension(); i++)
      if (!Double.isFinite(v.getEntry(i))) return false;
    return true;
  }

  public static double normMax(RealMatrix A) {
    double max = 0;
    for (int i=0; i<A.getRowDimension(); i++) {
      for (int j=0; j<A.getColumnDimension(); j++) {
        double a = Math.abs(A.getEntry(i, j));
        if (a > max || Double.isNaN(a)) max = a;
      }
    }
    return max;
  }

  public static boolean isSquare(RealMatrix A, int n) {
    return A.getRowDimension() == n && A.getColumnDimension() == n;
  }

  public static String dimensions(RealMatrix A) {
    return A.getRowDimension() + "x" + A.getColumnDimension();
  }

  public static String toString(RealMatrix A, String format) {
    StringBuilder s = new StringBuilder();
    s.append('[');
    for (int d=0; d<A.getRowDimension(); d++) {
      s.append('[');
      for (int i=0; i<A.getColumnDimension(); i++) {
        if (i > 0) s.append(' ');
        s.append(String.format(format, A.getEntry(d, i)));
      }
      s.append(']');
    }
    s.append(']');
    return s.toString();
  }
}
