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

package net.unmix.common.random;

import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

import net.unmix.common.math.SimpleVectorMath;

/**
 * Helpful methods related to randomness and related functions.
 *
 * @author Sean Owen
 * @since 1.0
 */
public final class RandomUtils {

  private RandomUtils() {
  }

  /**
   * @param dimensions dimensionality of resulting vector
   * @param random random number generator to use
   * @return a vector of length 1 over the given number of dimensions, whose direction is chosen uniformly
   *   at random (that is: a point chosen uniformly at random on the unit hypersphere)
   */
  public static double[] randomUnitVector(int dimensions, RandomGenerator random) {
    double[] vector = new double[dimensions];
    doRandomUnitVector(vector, random);
    return vector;
  }

  private static void doRandomUnitVector(double[] vector, RandomGenerator random) {
    int dimensions = vector.length;
    double total = 0.0;
    for (int i = 0; i < dimensions; i++) {
      double d = random.nextGaussian();
      vector[i] = d;
      total += d * d;
    }
    double normalization = FastMath.sqrt(total);
    for (int i = 0; i < dimensions; i++) {
      vector[i] /= normalization;
    }
  }

  /**
   * @param dimensions dimensionality of resulting vector
   * @param orthogonalTo mutually orthonormal vectors; fewer than {@code dimensions} of them
   * @param random random number generator to use
   * @return a random vector of length 1 that is orthogonal to all of {@code orthogonalTo}
   */
  public static double[] randomUnitVectorOrthogonalTo(int dimensions,
                                                      List<double[]> orthogonalTo,
                                                      RandomGenerator random) {
    if (orthogonalTo.size() >= dimensions) {
      throw new IllegalArgumentException("No direction is orthogonal to " + orthogonalTo.size() + " vectors");
    }
    double[] vector = new double[dimensions];
    while (true) {
      doRandomUnitVector(vector, random);
      for (double[] other : orthogonalTo) {
        SimpleVectorMath.subtractProjection(vector, other);
      }
      // Nearly always true; otherwise the draw fell almost entirely inside the excluded subspace
      if (SimpleVectorMath.norm(vector) > 1.0e-6) {
        SimpleVectorMath.normalize(vector);
        return vector;
      }
    }
  }

  /**
   * @param rows number of rows
   * @param columns number of columns
   * @param random random number generator to use
   * @return matrix whose entries are independent standard normal values
   */
  public static RealMatrix randomGaussianMatrix(int rows, int columns, RandomGenerator random) {
    double[][] data = new double[rows][columns];
    for (int row = 0; row < rows; row++) {
      double[] values = data[row];
      for (int col = 0; col < columns; col++) {
        values[col] = random.nextGaussian();
      }
    }
    return new Array2DRowRealMatrix(data, false);
  }

}
