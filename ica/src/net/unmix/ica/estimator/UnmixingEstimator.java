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
 * Implementations of this interface estimate an unmixing matrix for whitened data by fixed-point iteration,
 * maximizing the non-Gaussianity of the projected components.
 *
 * @author Sean Owen
 */
public interface UnmixingEstimator {

  /**
   * @param whitened N x M whitened data, whose sample covariance is the identity
   * @return estimate holding a k x N matrix whose rows are orthonormal directions in whitened space
   */
  Estimate estimate(RealMatrix whitened);

  /**
   * @param listener called after each completed iteration; may be {@code null}
   */
  void setIterationListener(IterationListener listener);

}
