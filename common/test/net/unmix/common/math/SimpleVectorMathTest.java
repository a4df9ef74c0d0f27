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

import org.junit.Test;

import net.unmix.common.UnmixTest;

public final class SimpleVectorMathTest extends UnmixTest {

  private static final double[] VEC1 = {-1.0, 2.5, 3.0};
  private static final double[] VEC2 = {1.5, -1.5, 0.0};

  @Test
  public void testDot() {
    assertEquals(-5.25, SimpleVectorMath.dot(VEC1, VEC2));
  }

  @Test
  public void testNorm() {
    assertEquals(4.03112887414928, SimpleVectorMath.norm(VEC1));
    assertEquals(2.12132034355964, SimpleVectorMath.norm(VEC2));
  }

  @Test
  public void testNormalize() {
    double[] x = {3.0, 4.0};
    assertEquals(5.0, SimpleVectorMath.normalize(x));
    assertArrayEquals(new double[] {0.6, 0.8}, x);
  }

  @Test
  public void testSubtractProjection() {
    double[] x = {2.0, 3.0, -1.0};
    SimpleVectorMath.subtractProjection(x, new double[] {0.0, 1.0, 0.0});
    assertArrayEquals(new double[] {2.0, 0.0, -1.0}, x);
  }

  @Test
  public void testCorrelation() {
    double[] x = {1.0, 2.0, 3.0, 4.0};
    assertEquals(1.0, SimpleVectorMath.correlation(x, new double[] {2.0, 4.0, 6.0, 8.0}));
    assertEquals(-1.0, SimpleVectorMath.correlation(x, new double[] {-1.0, -2.0, -3.0, -4.0}));
    assertEquals(0.0, SimpleVectorMath.correlation(x, new double[] {5.0, 5.0, 5.0, 5.0}));
  }

}
