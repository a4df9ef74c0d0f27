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

package net.unmix.ica.estimator;

import java.util.List;

import com.google.common.collect.Lists;
import com.google.common.primitives.Ints;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.unmix.common.math.MatrixUtils;
import net.unmix.common.math.SimpleVectorMath;
import net.unmix.common.random.RandomUtils;
import net.unmix.ica.Nonlinearity;

/**
 * <p>Estimates directions one at a time. For each component, a random unit vector w is repeatedly
 * updated by the fixed-point rule, made orthogonal to all previously accepted directions (Gram-Schmidt),
 * and renormalized, until its direction (ignoring sign) stops changing or the iteration cap is reached.
 * A component that hits the cap is accepted as-is and reported; estimation continues with the next one.</p>
 *
 * @author Sean Owen
 */
public final class DeflationEstimator extends AbstractUnmixingEstimator {

  private static final Logger log = LoggerFactory.getLogger(DeflationEstimator.class);

  /** A direction shorter than this after orthogonalization carries no usable information. */
  private static final double MIN_NORM = 1.0e-12;

  public DeflationEstimator(int componentCount,
                            Nonlinearity nonlinearity,
                            int maxIterations,
                            double convergenceEpsilon,
                            RandomGenerator random) {
    super(componentCount, nonlinearity, maxIterations, convergenceEpsilon, random);
  }

  @Override
  public Estimate estimate(RealMatrix whitened) {
    checkDimensions(whitened);
    int components = getComponentCount();
    int dimensions = whitened.getRowDimension();
    double[][] z = MatrixUtils.accessMatrixDataDirectly(whitened);
    ProjectionBuffers buffers = new ProjectionBuffers(whitened.getColumnDimension());
    RandomGenerator random = getRandom();
    int maxIterations = getMaxIterations();
    double epsilon = getConvergenceEpsilon();

    List<double[]> accepted = Lists.newArrayListWithCapacity(components);
    int[] iterations = new int[components];
    List<Integer> unconverged = Lists.newArrayList();

    for (int i = 0; i < components; i++) {
      double[] w = RandomUtils.randomUnitVector(dimensions, random);
      double[] updated = new double[dimensions];
      boolean converged = false;
      int iteration = 0;
      while (iteration < maxIterations) {
        iteration++;
        fixedPointUpdate(w, z, buffers, updated);
        orthogonalize(updated, accepted);
        if (SimpleVectorMath.norm(updated) < MIN_NORM) {
          log.debug("Component {} collapsed at iteration {}; restarting from a random direction", i, iteration);
          updated = RandomUtils.randomUnitVectorOrthogonalTo(dimensions, accepted, random);
        } else {
          SimpleVectorMath.normalize(updated);
        }

        double change = directionChange(updated, w);
        double[] previous = w;
        w = updated;
        updated = previous;
        if (hasIterationListener()) {
          fireIterationCompleted(i, iteration, toMatrix(accepted, w));
        }

        if (change < epsilon) {
          converged = true;
          break;
        }
      }

      iterations[i] = iteration;
      if (converged) {
        log.debug("Component {} converged in {} iterations", i, iteration);
      } else {
        log.warn("Component {} did not converge in {} iterations; using last estimate", i, maxIterations);
        unconverged.add(i);
      }
      accepted.add(w);
      if ((i + 1) % 5 == 0) {
        log.info("Extracted {}/{} components", i + 1, components);
      }
    }

    RealMatrix W = toMatrix(accepted, null);
    return new Estimate(W, iterations, Ints.toArray(unconverged));
  }

  /**
   * Subtracts from w its projection onto the span of the accepted orthonormal directions, computing all
   * projections from the unmodified w.
   */
  private static void orthogonalize(double[] w, List<double[]> accepted) {
    int count = accepted.size();
    if (count == 0) {
      return;
    }
    double[] dots = new double[count];
    for (int r = 0; r < count; r++) {
      dots[r] = SimpleVectorMath.dot(w, accepted.get(r));
    }
    for (int r = 0; r < count; r++) {
      double[] row = accepted.get(r);
      double dot = dots[r];
      for (int j = 0; j < w.length; j++) {
        w[j] -= dot * row[j];
      }
    }
  }

  private static RealMatrix toMatrix(List<double[]> rows, double[] lastRow) {
    int count = rows.size() + (lastRow == null ? 0 : 1);
    double[][] data = new double[count][];
    for (int r = 0; r < rows.size(); r++) {
      data[r] = rows.get(r).clone();
    }
    if (lastRow != null) {
      data[count - 1] = lastRow.clone();
    }
    return new Array2DRowRealMatrix(data, false);
  }

}
