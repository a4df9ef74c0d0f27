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

/**
 * Thrown when there are fewer samples (columns) than signals (rows) in the observations.
 *
 * @author Sean Owen
 */
public final class InsufficientSamplesException extends InvalidInputException {

  private final int signals;
  private final int samples;

  public InsufficientSamplesException(int signals, int samples) {
    super("Need at least as many samples as signals, and at least 2 samples, but got " +
          signals + " signals x " + samples + " samples");
    this.signals = signals;
    this.samples = samples;
  }

  public int getSignals() {
    return signals;
  }

  public int getSamples() {
    return samples;
  }

}
