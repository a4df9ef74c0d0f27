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
 * Thrown when the requested number of components is not between 1 and the number of signals, inclusive.
 *
 * @author Sean Owen
 */
public final class InvalidComponentCountException extends InvalidInputException {

  private final int requested;
  private final int signals;

  public InvalidComponentCountException(int requested, int signals) {
    super("Component count must be in [1," + signals + "] but was " + requested);
    this.requested = requested;
    this.signals = signals;
  }

  public int getRequested() {
    return requested;
  }

  public int getSignals() {
    return signals;
  }

}
