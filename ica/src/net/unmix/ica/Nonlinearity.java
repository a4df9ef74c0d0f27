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

import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Contrast functions used to approximate negentropy. Each supplies a scalar function {@code g}
 * and its derivative {@code g'}, applied elementwise to projections of the whitened data.</p>
 *
 * <ul>
 *   <li>{@link #CUBIC}: g(u) = u<sup>3</sup>, suited to sub-Gaussian sources</li>
 *   <li>{@link #TANH}: g(u) = tanh(u), suited to super-Gaussian sources, and the general default</li>
 *   <li>{@link #GAUSSIAN}: g(u) = u exp(-u<sup>2</sup>/2), robust to outliers</li>
 * </ul>
 *
 * @author Sean Owen
 */
public enum Nonlinearity {

  CUBIC {
    @Override
    public double g(double u) {
      return u * u * u;
    }
    @Override
    public double gPrime(double u) {
      return 3.0 * u * u;
    }
  },

  TANH {
    @Override
    public double g(double u) {
      return FastMath.tanh(u);
    }
    @Override
    public double gPrime(double u) {
      double tanh = FastMath.tanh(u);
      return 1.0 - tanh * tanh;
    }
    @Override
    public void apply(double[] u, double[] g, double[] gPrime) {
      for (int i = 0; i < u.length; i++) {
        double tanh = FastMath.tanh(u[i]);
        g[i] = tanh;
        gPrime[i] = 1.0 - tanh * tanh;
      }
    }
  },

  GAUSSIAN {
    @Override
    public double g(double u) {
      return u * FastMath.exp(-u * u / 2.0);
    }
    @Override
    public double gPrime(double u) {
      double u2 = u * u;
      return (1.0 - u2) * FastMath.exp(-u2 / 2.0);
    }
    @Override
    public void apply(double[] u, double[] g, double[] gPrime) {
      for (int i = 0; i < u.length; i++) {
        double ui = u[i];
        double u2 = ui * ui;
        double exp = FastMath.exp(-u2 / 2.0);
        g[i] = ui * exp;
        gPrime[i] = (1.0 - u2) * exp;
      }
    }
  };

  private static final Logger log = LoggerFactory.getLogger(Nonlinearity.class);

  /** Used when no nonlinearity is named, or the name is not recognized. */
  public static final Nonlinearity DEFAULT = TANH;

  /**
   * @param u projection value
   * @return g(u)
   */
  public abstract double g(double u);

  /**
   * @param u projection value
   * @return g'(u)
   */
  public abstract double gPrime(double u);

  /**
   * Applies g and g' elementwise.
   *
   * @param u projection values
   * @param g array to receive g(u); same length as {@code u}
   * @param gPrime array to receive g'(u); same length as {@code u}
   */
  public void apply(double[] u, double[] g, double[] gPrime) {
    for (int i = 0; i < u.length; i++) {
      g[i] = g(u[i]);
      gPrime[i] = gPrime(u[i]);
    }
  }

  /**
   * Resolves a nonlinearity by name. Accepts the enum names in any case, as well as the short names
   * "pow3", "tanh" and "gauss". Any other value, including {@code null}, resolves to {@link #DEFAULT}; this
   * never fails.
   *
   * @param name nonlinearity name
   * @return matching nonlinearity, or {@link #DEFAULT}
   */
  public static Nonlinearity forName(String name) {
    if (name == null) {
      return DEFAULT;
    }
    String lowerName = name.trim().toLowerCase(Locale.ENGLISH);
    if ("pow3".equals(lowerName) || "cubic".equals(lowerName)) {
      return CUBIC;
    }
    if ("tanh".equals(lowerName)) {
      return TANH;
    }
    if ("gauss".equals(lowerName) || "gaussian".equals(lowerName)) {
      return GAUSSIAN;
    }
    log.debug("Unknown nonlinearity '{}'; using {}", name, DEFAULT);
    return DEFAULT;
  }

}
