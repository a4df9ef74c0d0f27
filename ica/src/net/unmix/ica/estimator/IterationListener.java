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
 * Observes the progress of an {@link UnmixingEstimator}.
 *
 * @author Sean Owen
 */
public interface IterationListener {

  /**
   * @param component 0-based index of the component being estimated in deflation mode, or -1 when all
   *  components are estimated jointly
   * @param iteration 1-based iteration number
   * @param current copy of the current estimate. In symmetric mode this is the whole k x N matrix. In deflation
   *  mode it is the rows accepted so far followed by the current direction as the last row.
   */
  void iterationCompleted(int component, int iteration, RealMatrix current);

}
