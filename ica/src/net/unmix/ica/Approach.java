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

import java.util.Locale;

/**
 * How the unmixing matrix is estimated.
 *
 * @author Sean Owen
 */
public enum Approach {

  /** All components are estimated jointly, with symmetric orthonormalization after each step. */
  SYMMETRIC,

  /** Components are estimated one at a time, each orthogonalized against those found before it. */
  DEFLATION;

  /**
   * @param name "symm", "symmetric", "defl" or "deflation", in any case
   * @return the matching approach
   * @throws IllegalArgumentException if the name is not recognized
   */
  public static Approach forName(String name) {
    String lowerName = name == null ? "" : name.trim().toLowerCase(Locale.ENGLISH);
    if ("symm".equals(lowerName) || "symmetric".equals(lowerName)) {
      return SYMMETRIC;
    }
    if ("defl".equals(lowerName) || "deflation".equals(lowerName)) {
      return DEFLATION;
    }
    throw new IllegalArgumentException("Unknown approach: " + name);
  }

}
