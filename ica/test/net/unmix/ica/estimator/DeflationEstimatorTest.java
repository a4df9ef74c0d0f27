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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import net.unmix.common.UnmixTest;
import net.unmix.common.math.SimpleVectorMath;
import net.unmix.ica.Nonlinearity;

public final class DeflationEstimatorTest extends UnmixTest {

  @Test
  public void testEachDirectionOrthogonalToPrevious() {
    DeflationEstimator estimator =
        new DeflationEstimator(3, Nonlinearity.TANH, 1000, 1.0e-4, EstimatorTestData.random());
    final int[] lastComponent = {0};
    estimator.setIterationListener(new IterationListener() {
      @Override
      public void iterationCompleted(int component, int iteration, RealMatrix current) {
        assertTrue(component >= lastComponent[0]);
        lastComponent[0] = component;
        assertEquals(component + 1, current.getRowDimension());
        double[] newest = current.getRow(component);
        assertEquals(1.0, SimpleVectorMath.norm(newest), 1.0e-10);
        for (int previous = 0; previous < component; previous++) {
          assertEquals(0.0, SimpleVectorMath.dot(newest, current.getRow(previous)), 1.0e-9);
        }
      }
    });
    Estimate estimate = estimator.estimate(EstimatorTestData.whitenedMixture());
    assertEquals(2, lastComponent[0]);
    assertTrue(estimate.isConverged());
    assertEquals(3, estimate.getIterations().length);
    for (int iterations : estimate.getIterations()) {
      assertTrue(iterations >= 1);
    }
    RealMatrix W = estimate.getUnmixing();
    assertOrthonormalRows(W, 1.0e-9);
  }

  @Test
  public void testSingleComponent() {
    DeflationEstimator estimator =
        new DeflationEstimator(1, Nonlinearity.GAUSSIAN, 1000, 1.0e-4, EstimatorTestData.random());
    RealMatrix W = estimator.estimate(EstimatorTestData.whitenedMixture()).getUnmixing();
    assertEquals(1, W.getRowDimension());
    assertEquals(3, W.getColumnDimension());
    assertEquals(1.0, SimpleVectorMath.norm(W.getRow(0)), 1.0e-10);
  }

  @Test
  public void testIterationCapReportsEachComponent() {
    DeflationEstimator estimator =
        new DeflationEstimator(3, Nonlinearity.TANH, 1, 1.0e-4, EstimatorTestData.random());
    Estimate estimate = estimator.estimate(EstimatorTestData.whitenedMixture());
    assertFalse(estimate.isConverged());
    assertArrayEquals(new int[] {1, 1, 1}, estimate.getIterations());
    assertArrayEquals(new int[] {0, 1, 2}, estimate.getUnconvergedComponents());
    assertEquals(3, estimate.getUnmixing().getRowDimension());
  }

  @Test
  public void testCollapsedDirectionIsReplaced() {
    // Only one dimension carries information; the second direction must still come out orthonormal
    double[][] z = new double[2][400];
    for (int i = 0; i < 400; i++) {
      z[0][i] = (i % 2 == 0) ? 1.0 : -1.0;
    }
    DeflationEstimator estimator =
        new DeflationEstimator(2, Nonlinearity.CUBIC, 50, 1.0e-4, EstimatorTestData.random());
    RealMatrix W = estimator.estimate(new Array2DRowRealMatrix(z)).getUnmixing();
    assertOrthonormalRows(W, 1.0e-9);
  }

}
