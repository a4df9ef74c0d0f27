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

package net.unmix.ica.whitening;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * The output of {@link Whitening#whiten(RealMatrix)}: centered, decorrelated, unit-variance data along with
 * the transforms that produced it.
 *
 * @author Sean Owen
 */
public final class WhitenedData {

  private final RealMatrix whitened;
  private final RealMatrix whiteningMatrix;
  private final RealMatrix dewhiteningMatrix;
  private final double[] mean;
  private final RealMatrix centered;
  private final double[] eigenvalues;
  private final boolean degenerate;

  WhitenedData(RealMatrix whitened,
               RealMatrix whiteningMatrix,
               RealMatrix dewhiteningMatrix,
               double[] mean,
               RealMatrix centered,
               double[] eigenvalues,
               boolean degenerate) {
    this.whitened = whitened;
    this.whiteningMatrix = whiteningMatrix;
    this.dewhiteningMatrix = dewhiteningMatrix;
    this.mean = mean;
    this.centered = centered;
    this.eigenvalues = eigenvalues;
    this.degenerate = degenerate;
  }

  /**
   * @return Z, the N x M whitened data
   */
  public RealMatrix getWhitened() {
    return whitened;
  }

  /**
   * @return N x N matrix mapping centered observations to whitened data
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
   * @return mean of each signal, subtracted before whitening
   */
  public double[] getMean() {
    return mean.clone();
  }

  /**
   * @return N x M observations with the mean of each signal removed
   */
  public RealMatrix getCentered() {
    return centered;
  }

  /**
   * @return eigenvalues of the covariance, in descending order, with negative values clamped to 0
   */
  public double[] getEigenvalues() {
    return eigenvalues.clone();
  }

  /**
   * @return true if the covariance had (near-)zero eigenvalues
   */
  public boolean isDegenerate() {
    return degenerate;
  }

}
