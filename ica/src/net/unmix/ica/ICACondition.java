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

/**
 * Non-fatal conditions that may be reported alongside an otherwise normal {@link ICAResult}.
 *
 * @author Sean Owen
 */
public enum ICACondition {

  /**
   * The iteration limit was reached before the convergence threshold was met, for the joint estimate or
   * for at least one deflation component. The last iterate was used.
   */
  NON_CONVERGENCE,

  /**
   * The covariance of the observations had (near-)zero eigenvalues, as from duplicated or linearly
   * dependent signals. Whitening used an eigenvalue floor for those directions.
   */
  DEGENERATE_COVARIANCE,

}
