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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;

import net.unmix.common.LangUtils;
import net.unmix.ica.Nonlinearity;

/**
 * Superclass of the fixed-point {@link UnmixingEstimator}s. Holds their common settings and implements
 * the one-unit update rule shared by both.
 *
 * @author Sean Owen
 */
public abstract class AbstractUnmixingEstimator implements UnmixingEstimator {

  static final int LOG_INTERVAL = 100;

  private final int componentCount;
  private final Nonlinearity nonlinearity;
  private final int maxIterations;
  private final double convergenceEpsilon;
  private final RandomGenerator random;
  private IterationListener listener;

  /**
   * @param componentCount number of components k to estimate; must be positive
   * @param nonlinearity contrast function
   * @param maxIterations iteration cap; must be positive
   * @param convergenceEpsilon iteration stops when every direction changes by less than this
   * @param random source of the random initial estimate
   */
  protected AbstractUnmixingEstimator(int componentCount,
                                      Nonlinearity nonlinearity,
                                      int maxIterations,
                                      double convergenceEpsilon,
                                      RandomGenerator random) {
    Preconditions.checkArgument(componentCount > 0, "componentCount must be positive: %s", componentCount);
    Preconditions.checkNotNull(nonlinearity);
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive: %s", maxIterations);
    Preconditions.checkArgument(LangUtils.isFinite(convergenceEpsilon) && convergenceEpsilon > 0.0,
                                "convergenceEpsilon must be positive: %s", convergenceEpsilon);
    Preconditions.checkNotNull(random);
    this.componentCount = componentCount;
    this.nonlinearity = nonlinearity;
    this.maxIterations = maxIterations;
    this.convergenceEpsilon = convergenceEpsilon;
    this.random = random;
  }

  @Override
  public final void setIterationListener(IterationListener listener) {
    this.listener = listener;
  }

  protected final int getComponentCount() {
    return componentCount;
  }

  protected final int getMaxIterations() {
    return maxIterations;
  }

  protected final double getConvergenceEpsilon() {
    return convergenceEpsilon;
  }

  protected final RandomGenerator getRandom() {
    return random;
  }

  protected final void checkDimensions(RealMatrix whitened) {
    int signals = whitened.getRowDimension();
    Preconditions.checkArgument(componentCount <= signals,
                                "Can't estimate %s components from %s signals", componentCount, signals);
    Preconditions.checkArgument(whitened.getColumnDimension() > 0, "No samples");
  }

  protected final boolean hasIterationListener() {
    return listener != null;
  }

  protected final void fireIterationCompleted(int component, int iteration, RealMatrix current) {
    listener.iterationCompleted(component, iteration, current);
  }

  /**
   * @param w current direction
   * @param previous direction from the prior iteration
   * @return |1 - |w . previous||, which is 0 when the direction (up to sign) has not changed
   */
  static double directionChange(double[] w, double[] previous) {
    double dot = 0.0;
    for (int i = 0; i < w.length; i++) {
      dot += w[i] * previous[i];
    }
    return Math.abs(1.0 - Math.abs(dot));
  }

  /**
   * Computes one fixed-point step for direction w: E[z g(w<sup>T</sup>z)] - E[g'(w<sup>T</sup>z)] w, where
   * expectations are sample means over the columns z of the whitened data.
   *
   * @param w current direction, length N
   * @param z whitened data, N rows of M samples
   * @param buffers scratch space for M projections
   * @param out receives the new, unnormalized direction; length N
   */
  final void fixedPointUpdate(double[] w, double[][] z, ProjectionBuffers buffers, double[] out) {
    int dimensions = w.length;
    int samples = z[0].length;
    double[] u = buffers.u;
    double[] g = buffers.g;
    double[] gPrime = buffers.gPrime;

    for (int m = 0; m < samples; m++) {
      u[m] = 0.0;
    }
    for (int j = 0; j < dimensions; j++) {
      double wj = w[j];
      double[] zj = z[j];
      for (int m = 0; m < samples; m++) {
        u[m] += wj * zj[m];
      }
    }

    nonlinearity.apply(u, g, gPrime);

    double gPrimeTotal = 0.0;
    for (int m = 0; m < samples; m++) {
      gPrimeTotal += gPrime[m];
    }
    double gPrimeMean = gPrimeTotal / samples;

    for (int j = 0; j < dimensions; j++) {
      double[] zj = z[j];
      double total = 0.0;
      for (int m = 0; m < samples; m++) {
        total += g[m] * zj[m];
      }
      out[j] = total / samples - gPrimeMean * w[j];
    }
  }

  /**
   * Scratch arrays for one set of projections, reused across iterations.
   */
  static final class ProjectionBuffers {

    final double[] u;
    final double[] g;
    final double[] gPrime;

    ProjectionBuffers(int samples) {
      u = new double[samples];
      g = new double[samples];
      gPrime = new double[samples];
    }

  }

}
