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

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Source of random number generators. Callers that need reproducible results pass a seed; otherwise
 * generators are seeded from the clock, except in tests, where {@link #useTestSeed()} fixes the seed of
 * every generator handed out afterwards.
 *
 * @author Sean Owen
 */
public final class RandomManager {

  private static final long TEST_SEED = 1234567890L;

  private static volatile boolean useTestSeed;

  private RandomManager() {
  }

  /**
   * @return a new generator, seeded from the clock unless {@link #useTestSeed()} has been called
   */
  public static RandomGenerator getRandom() {
    return useTestSeed ? getRandom(TEST_SEED) : new MersenneTwister();
  }

  /**
   * @param seed seed for the generator
   * @return a new generator whose sequence is fully determined by {@code seed}, whether or not
   *  {@link #useTestSeed()} has been called
   */
  public static RandomGenerator getRandom(long seed) {
    return new MersenneTwister(seed);
  }

  /**
   * Makes every later call to {@link #getRandom()} return a generator with the same fixed seed.
   */
  public static void useTestSeed() {
    useTestSeed = true;
  }

}
