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

package net.unmix.ica.whitening;

import java.util.Arrays;
import java.util.Comparator;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.unmix.common.math.MatrixUtils;
import net.unmix.ica.InsufficientSamplesException;

/**
 * <p>Centers and whitens observations, so that the result has identity sample covariance.</p>
 *
 * <p>The covariance C of the centered data is eigendecomposed as C = E D E<sup>T</sup>, with eigenvalues in
 * descending order. The whitening matrix is then diag(1 / sqrt(d + eps)) E<sup>T</sup>, where eps is a small floor
 * proportional to the largest eigenvalue that keeps (near-)zero eigenvalues from rank-deficient input finite.
 * The floor can be set relative to the largest eigenvalue with system property {@code ica.eigenvalueFloor}.
 * Eigenvalues at or below {@code ica.degeneracyThreshold} times the largest mark the covariance as
 * degenerate.</p>
 *
 * @author Sean Owen
 */
public final class Whitening {

  private static final Logger log = LoggerFactory.getLogger(Whitening.class);

  private static final double EIGENVALUE_FLOOR =
      Double.parseDouble(System.getProperty("ica.eigenvalueFloor", "1.0e-12"));
  private static final double DEGENERACY_THRESHOLD =
      Double.parseDouble(System.getProperty("ica.degeneracyThreshold", "1.0e-10"));

  private Whitening() {
  }

  /**
   * @param observations N signals (rows) x M samples (columns); not modified
   * @return whitened data and the transforms that produced it
   * @throws InsufficientSamplesException if M &lt; N or M &lt; 2
   */
  public static WhitenedData whiten(RealMatrix observations) {
    int signals = observations.getRowDimension();
    int samples = observations.getColumnDimension();
    if (samples < signals || samples < 2) {
      throw new InsufficientSamplesException(signals, samples);
    }

    double[] mean = MatrixUtils.rowMeans(observations);
    RealMatrix centered = MatrixUtils.subtractFromRows(observations, mean);

    RealMatrix covariance = new Covariance(centered.transpose(), true).getCovarianceMatrix();
    EigenDecomposition eigen = new EigenDecomposition(MatrixUtils.symmetrize(covariance));
    double[] unsortedEigenvalues = eigen.getRealEigenvalues();
    RealMatrix unsortedE = eigen.getV();

    Integer[] order = descendingOrder(unsortedEigenvalues);
    double[] eigenvalues = new double[signals];
    double[][] E = new double[signals][signals];
    for (int i = 0; i < signals; i++) {
      int from = order[i];
      // Clamp negative values from rounding in ill-conditioned input
      eigenvalues[i] = FastMath.max(unsortedEigenvalues[from], 0.0);
      for (int row = 0; row < signals; row++) {
        E[row][i] = unsortedE.getEntry(row, from);
      }
    }

    double largest = eigenvalues[0];
    double epsilon = FastMath.max(EIGENVALUE_FLOOR * largest, Double.MIN_NORMAL);
    boolean degenerate = largest <= 0.0 || eigenvalues[signals - 1] <= DEGENERACY_THRESHOLD * largest;
    if (degenerate) {
      log.warn("Covariance is degenerate (eigenvalues {}); input signals may be constant or linearly dependent",
               Arrays.toString(eigenvalues));
    } else {
      log.debug("Covariance eigenvalues: {}", Arrays.toString(eigenvalues));
    }

    double[][] whitening = new double[signals][signals];
    double[][] dewhitening = new double[signals][signals];
    for (int i = 0; i < signals; i++) {
      double scale = FastMath.sqrt(eigenvalues[i] + epsilon);
      for (int j = 0; j < signals; j++) {
        whitening[i][j] = E[j][i] / scale;
        dewhitening[j][i] = E[j][i] * scale;
      }
    }
    RealMatrix whiteningMatrix = new Array2DRowRealMatrix(whitening, false);
    RealMatrix dewhiteningMatrix = new Array2DRowRealMatrix(dewhitening, false);
    RealMatrix whitened = whiteningMatrix.multiply(centered);

    return new WhitenedData(whitened, whiteningMatrix, dewhiteningMatrix, mean, centered, eigenvalues, degenerate);
  }

  /**
   * @return indices of values, sorted by descending value; ties keep their original order
   */
  private static Integer[] descendingOrder(final double[] values) {
    Integer[] order = new Integer[values.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    // Object sort is stable
    Arrays.sort(order, new Comparator<Integer>() {
      @Override
      public int compare(Integer a, Integer b) {
        return Double.compare(values[b], values[a]);
      }
    });
    return order;
  }

}
