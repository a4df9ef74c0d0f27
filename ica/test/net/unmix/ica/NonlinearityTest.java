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

import org.junit.Test;

import net.unmix.common.UnmixTest;

public final class NonlinearityTest extends UnmixTest {

  @Test
  public void testCubic() {
    assertEquals(8.0, Nonlinearity.CUBIC.g(2.0));
    assertEquals(-0.125, Nonlinearity.CUBIC.g(-0.5));
    assertEquals(12.0, Nonlinearity.CUBIC.gPrime(2.0));
  }

  @Test
  public void testTanh() {
    assertEquals(0.0, Nonlinearity.TANH.g(0.0));
    assertEquals(1.0, Nonlinearity.TANH.gPrime(0.0));
    assertEquals(Math.tanh(0.7), Nonlinearity.TANH.g(0.7));
    double t = Math.tanh(-1.3);
    assertEquals(1.0 - t * t, Nonlinearity.TANH.gPrime(-1.3));
  }

  @Test
  public void testGaussian() {
    assertEquals(0.0, Nonlinearity.GAUSSIAN.g(0.0));
    assertEquals(1.0, Nonlinearity.GAUSSIAN.gPrime(0.0));
    assertEquals(Math.exp(-0.5), Nonlinearity.GAUSSIAN.g(1.0));
    assertEquals(0.0, Nonlinearity.GAUSSIAN.gPrime(1.0));
    assertEquals(-3.0 * Math.exp(-2.0), Nonlinearity.GAUSSIAN.gPrime(2.0));
  }

  @Test
  public void testApplyMatchesPointwise() {
    double[] u = {-2.5, -1.0, -0.1, 0.0, 0.3, 1.7, 4.0};
    for (Nonlinearity nonlinearity : Nonlinearity.values()) {
      double[] g = new double[u.length];
      double[] gPrime = new double[u.length];
      nonlinearity.apply(u, g, gPrime);
      for (int i = 0; i < u.length; i++) {
        assertEquals(nonlinearity + " g", nonlinearity.g(u[i]), g[i]);
        assertEquals(nonlinearity + " g'", nonlinearity.gPrime(u[i]), gPrime[i]);
      }
    }
  }

  @Test
  public void testForName() {
    assertSame(Nonlinearity.CUBIC, Nonlinearity.forName("pow3"));
    assertSame(Nonlinearity.CUBIC, Nonlinearity.forName("CUBIC"));
    assertSame(Nonlinearity.TANH, Nonlinearity.forName("tanh"));
    assertSame(Nonlinearity.GAUSSIAN, Nonlinearity.forName("gauss"));
    assertSame(Nonlinearity.GAUSSIAN, Nonlinearity.forName(" Gaussian "));
  }

  @Test
  public void testUnknownNameFallsBackToDefault() {
    assertSame(Nonlinearity.TANH, Nonlinearity.DEFAULT);
    assertSame(Nonlinearity.DEFAULT, Nonlinearity.forName("skew"));
    assertSame(Nonlinearity.DEFAULT, Nonlinearity.forName(""));
    assertSame(Nonlinearity.DEFAULT, Nonlinearity.forName(null));
  }

}
