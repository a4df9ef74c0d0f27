/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.unmix.common.math;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.FastMath;

/**
 * Contains utility methods for dealing with dense matrices, represented as Commons Math {@link RealMatrix}
 * instances, usually {@link Array2DRowRealMatrix}.
 *
 * @author Sean Owen
 */
public final class MatrixUtils {

  private static final int PRINT_COLUMN_WIDTH = 12;

  private MatrixUtils() {
  }

  /**
   * @param matrix a {@link RealMatrix}
   * @return its underlying data -- not a copy -- if it is an {@link Array2DRowRealMatrix}, otherwise a copy
   */
  public static double[][] accessMatrixDataDirectly(RealMatrix matrix) {
    if (matrix instanceof Array2DRowRealMatrix) {
      return ((Array2DRowRealMatrix) matrix).getDataRef();
    }
    return matrix.getData();
  }

  /**
   * @param M matrix whose rows are signals and columns are samples
   * @return mean of each row
   */
  public static double[] rowMeans(RealMatrix M) {
    double[][] data = accessMatrixDataDirectly(M);
    double[] means = new double[data.length];
    for (int row = 0; row < data.length; row++) {
      means[row] = SimpleVectorMath.mean(data[row]);
    }
    return means;
  }

  /**
   * @param M matrix to center
   * @param rowOffsets value to subtract from every entry of each row
   * @return newly allocated copy of M with {@code rowOffsets} subtracted row-wise
   */
  public static RealMatrix subtractFromRows(RealMatrix M, double[] rowOffsets) {
    Preconditions.checkArgument(M.getRowDimension() == rowOffsets.length,
                                "Expected %s offsets but got %s", M.getRowDimension(), rowOffsets.length);
    double[][] data = accessMatrixDataDirectly(M);
    double[][] result = new double[data.length][];
    for (int row = 0; row < data.length; row++) {
      double[] source = data[row];
      double[] target = new double[source.length];
      double offset = rowOffsets[row];
      for (int col = 0; col < source.length; col++) {
        target[col] = source[col] - offset;
      }
      result[row] = target;
    }
    return new Array2DRowRealMatrix(result, false);
  }

  /**
   * @param M square matrix
   * @return (M + MT) / 2, which removes asymmetry due only to rounding
   */
  public static RealMatrix symmetrize(RealMatrix M) {
    int dimension = M.getRowDimension();
    Preconditions.checkArgument(dimension == M.getColumnDimension(), "Not square");
    double[][] data = accessMatrixDataDirectly(M);
    double[][] result = new double[dimension][dimension];
    for (int row = 0; row < dimension; row++) {
      for (int col = 0; col < dimension; col++) {
        result[row][col] = (data[row][col] + data[col][row]) / 2.0;
      }
    }
    return new Array2DRowRealMatrix(result, false);
  }

  /**
   * Computes S<sup>-1/2</sup> of a symmetric positive semi-definite matrix from its eigendecomposition.
   * Eigenvalues below {@code floor} are raised to {@code floor}.
   *
   * @param S symmetric matrix
   * @param floor smallest eigenvalue to use; must be positive
   * @return V * diag(1 / sqrt(max(lambda, floor))) * VT
   */
  public static RealMatrix symmetricInverseSquareRoot(RealMatrix S, double floor) {
    Preconditions.checkArgument(floor > 0.0, "floor must be positive: %s", floor);
    EigenDecomposition eigen = new EigenDecomposition(symmetrize(S));
    double[] eigenvalues = eigen.getRealEigenvalues();
    RealMatrix V = eigen.getV();
    int dimension = eigenvalues.length;
    double[][] scaledV = V.getData();
    for (int col = 0; col < dimension; col++) {
      double scale = 1.0 / FastMath.sqrt(FastMath.max(eigenvalues[col], floor));
      for (int row = 0; row < dimension; row++) {
        scaledV[row][col] *= scale;
      }
    }
    return new Array2DRowRealMatrix(scaledV, false).multiply(V.transpose());
  }

  /**
   * @param M any matrix
   * @return the Moore-Penrose pseudo-inverse of M
   */
  public static RealMatrix pseudoInverse(RealMatrix M) {
    return new SingularValueDecomposition(M).getSolver().getInverse();
  }

  /**
   * @param M square matrix
   * @return largest absolute difference between an entry of M and the corresponding entry of the identity
   */
  public static double maxDeviationFromIdentity(RealMatrix M) {
    int dimension = M.getRowDimension();
    Preconditions.checkArgument(dimension == M.getColumnDimension(), "Not square");
    double[][] data = accessMatrixDataDirectly(M);
    double max = 0.0;
    for (int row = 0; row < dimension; row++) {
      for (int col = 0; col < dimension; col++) {
        double expected = row == col ? 1.0 : 0.0;
        max = FastMath.max(max, FastMath.abs(data[row][col] - expected));
      }
    }
    return max;
  }

  /**
   * @param M matrix to print
   * @return a print-friendly rendering of a dense matrix. Not useful for wide matrices.
   */
  public static String matrixToString(RealMatrix M) {
    StringBuilder result = new StringBuilder();
    double[][] data = accessMatrixDataDirectly(M);
    for (double[] row : data) {
      for (int col = 0; col < row.length; col++) {
        if (col > 0) {
          result.append('\t');
        }
        appendWithPadOrTruncate(row[col], result);
      }
      result.append('\n');
    }
    return result.toString();
  }

  private static void appendWithPadOrTruncate(double value, StringBuilder to) {
    String stringValue = Double.toString(value);
    if (value >= 0.0) {
      stringValue = ' ' + stringValue;
    }
    appendWithPadOrTruncate(stringValue, to);
  }

  private static void appendWithPadOrTruncate(CharSequence value, StringBuilder to) {
    int length = value.length();
    if (length >= PRINT_COLUMN_WIDTH) {
      to.append(value, 0, PRINT_COLUMN_WIDTH);
    } else {
      for (int i = length; i < PRINT_COLUMN_WIDTH; i++) {
        to.append(' ');
      }
      to.append(value);
    }
  }

}
