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

package net.unmix.ica.epoch;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import net.unmix.common.math.MatrixUtils;
import net.unmix.ica.InvalidInputException;

/**
 * <p>Converts between epoched recordings and the single observation matrix that ICA works on.</p>
 *
 * <p>An epoched recording is a series of trials, each a channels x points matrix, indexed as
 * {@code [trial][channel][point]}. Trials are concatenated along the sample axis, so that sample
 * {@code trial * points + point} of the observation matrix is point {@code point} of trial {@code trial}.
 * Components computed from the concatenated matrix can then be split back into the same epochs.</p>
 *
 * @author Sean Owen
 */
public final class Epochs {

  private Epochs() {
  }

  /**
   * @param epochs trials, each channels x points; all trials must have the same shape
   * @return channels x (points * trials) matrix
   * @throws InvalidInputException if there are no trials, or trials differ in shape
   */
  public static RealMatrix concatenate(double[][][] epochs) {
    if (epochs == null || epochs.length == 0 || epochs[0].length == 0 || epochs[0][0].length == 0) {
      throw new InvalidInputException("No epochs");
    }
    int trials = epochs.length;
    int channels = epochs[0].length;
    int points = epochs[0][0].length;
    double[][] data = new double[channels][points * trials];
    for (int trial = 0; trial < trials; trial++) {
      double[][] epoch = epochs[trial];
      if (epoch.length != channels) {
        throw new InvalidInputException("Trial " + trial + " has " + epoch.length + " channels, expected " + channels);
      }
      for (int channel = 0; channel < channels; channel++) {
        double[] values = epoch[channel];
        if (values.length != points) {
          throw new InvalidInputException("Trial " + trial + ", channel " + channel + " has " + values.length +
                                          " points, expected " + points);
        }
        System.arraycopy(values, 0, data[channel], trial * points, points);
      }
    }
    return new Array2DRowRealMatrix(data, false);
  }

  /**
   * @param signals rows x (points * trials) matrix, such as ICA components
   * @param pointsPerEpoch number of points in each trial
   * @return trials, each rows x points, indexed {@code [trial][row][point]}
   * @throws IllegalArgumentException if the number of columns is not a positive multiple of {@code pointsPerEpoch}
   */
  public static double[][][] split(RealMatrix signals, int pointsPerEpoch) {
    int columns = signals.getColumnDimension();
    Preconditions.checkArgument(pointsPerEpoch > 0 && columns % pointsPerEpoch == 0,
                                "%s samples are not a whole number of %s-point epochs", columns, pointsPerEpoch);
    int rows = signals.getRowDimension();
    int trials = columns / pointsPerEpoch;
    double[][] data = MatrixUtils.accessMatrixDataDirectly(signals);
    double[][][] epochs = new double[trials][rows][pointsPerEpoch];
    for (int trial = 0; trial < trials; trial++) {
      for (int row = 0; row < rows; row++) {
        System.arraycopy(data[row], trial * pointsPerEpoch, epochs[trial][row], 0, pointsPerEpoch);
      }
    }
    return epochs;
  }

}
