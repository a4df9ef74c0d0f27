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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Test;

import net.unmix.common.UnmixTest;
import net.unmix.common.math.MatrixUtils;
import net.unmix.common.random.RandomManager;
import net.unmix.ica.InsufficientSamplesException;
import net.unmix.ica.Signals;

public final class WhiteningTest extends UnmixTest {

  private static RealMatrix mixture(int samples) {
    RandomGenerator random = RandomManager.getRandom(3L);
    return Signals.mix(new double[][] {{2.0, 1.0, 0.5}, {0.3, 1.5, 0.2}, {1.0, 0.1, 3.0}},
                       Signals.sine(5.0, samples, 250.0),
                       Signals.square(3.0, samples, 250.0),
                       Signals.gaussian(samples, random));
  }

  @Test
  public void testWhitenedCovarianceIsIdentity() {
    WhitenedData data = Whitening.whiten(mixture(1000));
    RealMatrix Z = data.getWhitened();
    assertEquals(3, Z.getRowDimension());
    assertEquals(1000, Z.getColumnDimension());
    RealMatrix covariance = Z.multiply(Z.transpose()).scalarMultiply(1.0 / (Z.getColumnDimension() - 1));
    assertTrue(MatrixUtils.maxDeviationFromIdentity(covariance) < 1.0e-8);
    assertFalse(data.isDegenerate());
  }

  @Test
  public void testWhitenedRowsAreCentered() {
    WhitenedData data = Whitening.whiten(mixture(500).scalarAdd(10.0));
    for (double mean : MatrixUtils.rowMeans(data.getWhitened())) {
      assertEquals(0.0, mean, 1.0e-10);
    }
    for (double mean : data.getMean()) {
      assertTrue(mean > 5.0);
    }
  }

  @Test
  public void testEigenvaluesDescending() {
    double[] eigenvalues = Whitening.whiten(mixture(500)).getEigenvalues();
    for (int i = 1; i < eigenvalues.length; i++) {
      assertTrue(eigenvalues[i - 1] >= eigenvalues[i]);
    }
    assertTrue(eigenvalues[eigenvalues.length - 1] > 0.0);
  }

  @Test
  public void testDewhiteningInvertsWhitening() {
    WhitenedData data = Whitening.whiten(mixture(500));
    RealMatrix product = data.getDewhiteningMatrix().multiply(data.getWhiteningMatrix());
    assertTrue(MatrixUtils.maxDeviationFromIdentity(product) < 1.0e-6);
    assertMatrixEquals(data.getCentered(), data.getDewhiteningMatrix().multiply(data.getWhitened()), 1.0e-6);
  }

  @Test
  public void testInputNotModified() {
    RealMatrix X = mixture(200);
    RealMatrix copy = X.copy();
    Whitening.whiten(X);
    assertMatrixEquals(copy, X, 0.0);
  }

  @Test
  public void testDuplicatedSignalIsDegenerate() {
    double[] sine = Signals.sine(5.0, 400, 250.0);
    RealMatrix X = new Array2DRowRealMatrix(new double[][] {sine, Signals.square(3.0, 400, 250.0), sine.clone()});
    WhitenedData data = Whitening.whiten(X);
    assertTrue(data.isDegenerate());
    assertAllFinite(data.getWhitened());
  }

  @Test
  public void testConstantSignalIsDegenerate() {
    RealMatrix X = new Array2DRowRealMatrix(new double[][] {Signals.sine(5.0, 100, 250.0), new double[100]});
    assertTrue(Whitening.whiten(X).isDegenerate());
  }

  @Test(expected = InsufficientSamplesException.class)
  public void testTooFewSamples() {
    Whitening.whiten(new Array2DRowRealMatrix(new double[3][2]));
  }

}
