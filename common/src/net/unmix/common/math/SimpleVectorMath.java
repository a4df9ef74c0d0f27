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

package net.unmix.common.math;

import org.apache.commons.math3.util.FastMath;

/**
 * Simple utility methods related to vectors represented as simple {@code double[]}s.
 *
 * @author Sean Owen
 * @since 1.0
 */
public final class SimpleVectorMath {

  private SimpleVectorMath() {}

  /**
   * @return dot product of the two given arrays
   */
  public static double dot(double[] x, double[] y) {
    int length = x.length;
    double dot = 0.0;
    for (int i = 0; i < length; i++) {
      dot += x[i] * y[i];
    }
    return dot;
  }

  /**
   * @return the L2 norm of vector x
   */
  public static double norm(double[] x) {
    double total = 0.0;
    for (double d : x) {
      total += d * d;
    }
    return FastMath.sqrt(total);
  }

  /**
   * @return arithmetic mean of the values in x
   */
  public static double mean(double[] x) {
    double total = 0.0;
    for (double d : x) {
      total += d;
    }
    return total / x.length;
  }

  /**
   * @param x vector that will modified to have unit length
   * @return the norm x had before normalization
   */
  public static double normalize(double[] x) {
    double norm = norm(x);
    for (int i = 0; i < x.length; i++) {
      x[i] /= norm;
    }
    return norm;
  }

  /**
   * Removes from x its projection onto the unit vector {@code onto}.
   *
   * @param x vector that will be modified
   * @param onto unit vector
   */
  public static void subtractProjection(double[] x, double[] onto) {
    double dot = dot(x, onto);
    for (int i = 0; i < x.length; i++) {
      x[i] -= dot * onto[i];
    }
  }

  /**
   * @return Pearson correlation of x and y, or 0 if either has no variance
   */
  public static double correlation(double[] x, double[] y) {
    int length = x.length;
    double xMean = mean(x);
    double yMean = mean(y);
    double xy = 0.0;
    double xx = 0.0;
    double yy = 0.0;
    for (int i = 0; i < length; i++) {
      double dx = x[i] - xMean;
      double dy = y[i] - yMean;
      xy += dx * dy;
      xx += dx * dx;
      yy += dy * dy;
    }
    if (xx == 0.0 || yy == 0.0) {
      return 0.0;
    }
    return xy / FastMath.sqrt(xx * yy);
  }

}
