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

package net.unmix.ica;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.apache.commons.math3.linear.RealMatrix;

import net.unmix.common.math.MatrixUtils;

/**
 * <p>The outcome of one run of {@link FastICA}: the unmixing matrix W (k x N), the mixing matrix A (N x k),
 * which is the pseudo-inverse of W, and the k x M component signals.</p>
 *
 * <p>Components are W applied to the <em>centered</em> observations, so each has zero mean, and
 * {@code A * components} reproduces the centered observations when k = N; see {@link #reconstruct()}.</p>
 *
 * <p>Components are only determined up to sign and order. Callers must not assume a canonical order or sign,
 * and should compare components with known sources by correlation, not equality.</p>
 *
 * <p>Any non-fatal {@link ICACondition}s encountered are available from {@link #getConditions()}.</p>
 *
 * @author Sean Owen
 */
public final class ICAResult {

  private final RealMatrix unmixing;
  private final RealMatrix mixing;
  private final RealMatrix components;
  private final RealMatrix whitenedUnmixing;
  private final RealMatrix whiteningMatrix;
  private final RealMatrix dewhiteningMatrix;
  private final double[] mean;
  private final Set<ICACondition> conditions;
  private final int[] iterations;

  ICAResult(RealMatrix unmixing,
            RealMatrix mixing,
            RealMatrix components,
            RealMatrix whitenedUnmixing,
            RealMatrix whiteningMatrix,
            RealMatrix dewhiteningMatrix,
            double[] mean,
            Set<ICACondition> conditions,
            int[] iterations) {
    this.unmixing = unmixing;
    this.mixing = mixing;
    this.components = components;
    this.whitenedUnmixing = whitenedUnmixing;
    this.whiteningMatrix = whiteningMatrix;
    this.dewhiteningMatrix = dewhiteningMatrix;
    this.mean = mean;
    this.conditions = conditions.isEmpty()
        ? Collections.<ICACondition>emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(conditions));
    this.iterations = iterations;
  }

  /**
   * @return W, k x N, mapping observations to components
   */
  public RealMatrix getUnmixing() {
    return unmixing;
  }

  /**
   * @return A, N x k, the pseudo-inverse of W
   */
  public RealMatrix getMixing() {
    return mixing;
  }

  /**
   * @return k x M component signals, W * (X - mean)
   */
  public RealMatrix getComponents() {
    return components;
  }

  /**
   * @return k x N unmixing matrix in whitened space; its rows are orthonormal
   */
  public RealMatrix getWhitenedUnmixing() {
    return whitenedUnmixing;
  }

  /**
   * @return N x N whitening matrix; {@code getUnmixing() = getWhitenedUnmixing() * getWhiteningMatrix()}
   */
  public RealMatrix getWhiteningMatrix() {
    return whiteningMatrix;
  }

  /**
   * @return N x N inverse of the whitening matrix
   */
  public RealMatrix getDewhiteningMatrix() {
    return dewhiteningMatrix;
  }

  /**
   * @return per-signal mean removed before unmixing
   */
  public double[] getMean() {
    return mean.clone();
  }

  /**
   * @return non-fatal conditions encountered; empty if none
   */
  public Set<ICACondition> getConditions() {
    return conditions;
  }

  public boolean hasCondition(ICACondition condition) {
    return conditions.contains(condition);
  }

  /**
   * @return true unless {@link ICACondition#NON_CONVERGENCE} was reported
   */
  public boolean isConverged() {
    return !conditions.contains(ICACondition.NON_CONVERGENCE);
  }

  /**
   * @return iterations run: a single value for the symmetric approach, otherwise one per component
   */
  public int[] getIterations() {
    return iterations.clone();
  }

  /**
   * @return A * components + mean, an N x M approximation of the observations, exact up to rounding
   *  when k = N
   */
  public RealMatrix reconstruct() {
    RealMatrix centered = mixing.multiply(components);
    double[] negativeMean = new double[mean.length];
    for (int i = 0; i < mean.length; i++) {
      negativeMean[i] = -mean[i];
    }
    return MatrixUtils.subtractFromRows(centered, negativeMean);
  }

  @Override
  public String toString() {
    return "ICAResult[" + unmixing.getRowDimension() + " components of " + unmixing.getColumnDimension() +
        " signals, " + components.getColumnDimension() + " samples, conditions:" + conditions + ']';
  }

}
