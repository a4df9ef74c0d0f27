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

public final class ICAOptionsTest extends UnmixTest {

  @Test
  public void testDefaults() {
    ICAOptions options = ICAOptions.defaults();
    assertSame(Approach.SYMMETRIC, options.getApproach());
    assertNull(options.getComponentCount());
    assertSame(Nonlinearity.TANH, options.getNonlinearity());
    assertEquals(1000, options.getMaxIterations());
    assertEquals(1.0e-4, options.getConvergenceEpsilon());
    assertNull(options.getRandomSeed());
  }

  @Test
  public void testBuilder() {
    ICAOptions options = ICAOptions.builder()
        .approach("defl")
        .componentCount(2)
        .nonlinearity("gauss")
        .maxIterations(50)
        .convergenceEpsilon(1.0e-6)
        .randomSeed(42L)
        .build();
    assertSame(Approach.DEFLATION, options.getApproach());
    assertEquals(Integer.valueOf(2), options.getComponentCount());
    assertSame(Nonlinearity.GAUSSIAN, options.getNonlinearity());
    assertEquals(50, options.getMaxIterations());
    assertEquals(1.0e-6, options.getConvergenceEpsilon());
    assertEquals(Long.valueOf(42L), options.getRandomSeed());
  }

  @Test
  public void testToBuilder() {
    ICAOptions options = ICAOptions.builder().approach(Approach.DEFLATION).randomSeed(7L).build();
    ICAOptions copy = options.toBuilder().maxIterations(10).build();
    assertSame(Approach.DEFLATION, copy.getApproach());
    assertEquals(Long.valueOf(7L), copy.getRandomSeed());
    assertEquals(10, copy.getMaxIterations());
    assertEquals(ICAOptions.DEFAULT_MAX_ITERATIONS, options.getMaxIterations());
  }

  @Test
  public void testUnknownNonlinearityName() {
    assertSame(Nonlinearity.DEFAULT, ICAOptions.builder().nonlinearity("skew").build().getNonlinearity());
  }

  @Test
  public void testApproachNames() {
    assertSame(Approach.SYMMETRIC, Approach.forName("symm"));
    assertSame(Approach.SYMMETRIC, Approach.forName("Symmetric"));
    assertSame(Approach.DEFLATION, Approach.forName("DEFLATION"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownApproach() {
    ICAOptions.builder().approach("sideways");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadMaxIterations() {
    ICAOptions.builder().maxIterations(0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadEpsilon() {
    ICAOptions.builder().convergenceEpsilon(Double.NaN);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeEpsilon() {
    ICAOptions.builder().convergenceEpsilon(-1.0e-3);
  }

}
