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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.unmix.common.math.MatrixUtils;
import net.unmix.common.random.RandomUtils;
import net.unmix.ica.Nonlinearity;

/**
 * <p>Estimates all k directions jointly. Starting from a random k x N matrix W, each iteration applies the
 * fixed-point update to every row and then symmetrically orthonormalizes the result:</p>
 *
 * <p>W &larr; (W W<sup>T</sup>)<sup>-1/2</sup> W</p>
 *
 * <p>so that the rows of W are orthonormal after every iteration, not only at convergence. Iteration
 * stops once no row direction changes by more than the convergence epsilon, ignoring sign, or when the
 * iteration cap is reached. In the latter case the last iterate is returned and flagged as unconverged.</p>
 *
 * @author Sean Owen
 */
public final class SymmetricEstimator extends AbstractUnmixingEstimator {

  private static final Logger log = LoggerFactory.getLogger(SymmetricEstimator.class);

  /** Floor on eigenvalues of W WT during orthonormalization. */
  private static final double ORTHONORMALIZATION_FLOOR = Math.ulp(1.0);

  public SymmetricEstimator(int componentCount,
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

    RealMatrix W = orthonormalize(RandomUtils.randomGaussianMatrix(components, dimensions, getRandom()));

    int maxIterations = getMaxIterations();
    double epsilon = getConvergenceEpsilon();
    boolean converged = false;
    int iteration = 0;
    double delta = Double.NaN;
    while (iteration < maxIterations) {
      iteration++;
      double[][] previous = MatrixUtils.accessMatrixDataDirectly(W);
      double[][] updated = new double[components][dimensions];
      for (int i = 0; i < components; i++) {
        fixedPointUpdate(previous[i], z, buffers, updated[i]);
      }
      W = orthonormalize(new Array2DRowRealMatrix(updated, false));

      double[][] current = MatrixUtils.accessMatrixDataDirectly(W);
      delta = 0.0;
      for (int i = 0; i < components; i++) {
        delta = FastMath.max(delta, directionChange(current[i], previous[i]));
      }
      if (hasIterationListener()) {
        fireIterationCompleted(-1, iteration, W.copy());
      }

      if (delta < epsilon) {
        converged = true;
        break;
      }
      if (iteration % LOG_INTERVAL == 0) {
        log.debug("Iteration {}, delta = {}", iteration, delta);
      }
    }

    int[] unconverged;
    if (converged) {
      log.info("Converged in {} iterations (delta = {})", iteration, delta);
      unconverged = new int[0];
    } else {
      log.warn("Did not converge in {} iterations (delta = {}); using last estimate", maxIterations, delta);
      unconverged = new int[components];
      for (int i = 0; i < components; i++) {
        unconverged[i] = i;
      }
    }
    return new Estimate(W, new int[] {iteration}, unconverged);
  }

  /**
   * @param W k x N matrix of full row rank
   * @return (W WT)<sup>-1/2</sup> W, whose rows are orthonormal and span the same space as those of W
   */
  static RealMatrix orthonormalize(RealMatrix W) {
    RealMatrix WWT = W.multiply(W.transpose());
    return MatrixUtils.symmetricInverseSquareRoot(WWT, ORTHONORMALIZATION_FLOOR).multiply(W);
  }

}
