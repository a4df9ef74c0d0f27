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

import java.util.Set;

import org.apache.commons.math3.linear.RealMatrix;

import net.unmix.common.math.MatrixUtils;
import net.unmix.ica.estimator.Estimate;
import net.unmix.ica.whitening.WhitenedData;

/**
 * Maps a whitened-space estimate back to the space of the observations.
 *
 * @author Sean Owen
 */
final class ResultAssembler {

  private ResultAssembler() {
  }

  /**
   * @param estimate k x N unmixing matrix in whitened space
   * @param whitenedData whitening transform and centered observations that produced the estimate
   * @param conditions non-fatal conditions to report
   * @return W = estimate * whitening matrix, A = pinv(W), and components W * centered observations
   */
  static ICAResult assemble(Estimate estimate, WhitenedData whitenedData, Set<ICACondition> conditions) {
    RealMatrix whitenedUnmixing = estimate.getUnmixing();
    RealMatrix unmixing = whitenedUnmixing.multiply(whitenedData.getWhiteningMatrix());
    RealMatrix mixing = MatrixUtils.pseudoInverse(unmixing);
    RealMatrix components = unmixing.multiply(whitenedData.getCentered());
    return new ICAResult(unmixing,
                         mixing,
                         components,
                         whitenedUnmixing,
                         whitenedData.getWhiteningMatrix(),
                         whitenedData.getDewhiteningMatrix(),
                         whitenedData.getMean(),
                         conditions,
                         estimate.getIterations());
  }

}
