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

import org.apache.commons.math3.linear.RealMatrix;

/**
 * The result of {@link UnmixingEstimator#estimate(RealMatrix)}.
 *
 * @author Sean Owen
 */
public final class Estimate {

  private final RealMatrix unmixing;
  private final int[] iterations;
  private final int[] unconvergedComponents;

  /**
   * @param unmixing k x N unmixing matrix in whitened space
   * @param iterations iterations run: one value for a joint estimate, otherwise one per component
   * @param unconvergedComponents indices of components that hit the iteration limit; for a joint
   *  estimate that did not converge, all of them
   */
  public Estimate(RealMatrix unmixing, int[] iterations, int[] unconvergedComponents) {
    this.unmixing = unmixing;
    this.iterations = iterations;
    this.unconvergedComponents = unconvergedComponents;
  }

  public RealMatrix getUnmixing() {
    return unmixing;
  }

  public int[] getIterations() {
    return iterations.clone();
  }

  public int[] getUnconvergedComponents() {
    return unconvergedComponents.clone();
  }

  public boolean isConverged() {
    return unconvergedComponents.length == 0;
  }

}
