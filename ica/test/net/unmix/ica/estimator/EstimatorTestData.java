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
import org.apache.commons.math3.random.RandomGenerator;

import net.unmix.common.random.RandomManager;
import net.unmix.ica.Signals;
import net.unmix.ica.whitening.Whitening;

final class EstimatorTestData {

  private EstimatorTestData() {
  }

  /**
   * @return whitened mixture of a sine, a square wave and a sawtooth, 2000 samples each
   */
  static RealMatrix whitenedMixture() {
    RealMatrix X = Signals.mix(new double[][] {{1.0, 0.5, 0.2}, {0.4, 1.2, 0.6}, {0.3, 0.2, 0.9}},
                               Signals.sine(5.0, 2000, 200.0),
                               Signals.square(3.0, 2000, 200.0),
                               Signals.sawtooth(2.0, 2000, 200.0));
    return Whitening.whiten(X).getWhitened();
  }

  static RandomGenerator random() {
    return RandomManager.getRandom(11L);
  }

}
