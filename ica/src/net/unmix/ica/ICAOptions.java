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

import java.io.Serializable;

import com.google.common.base.Preconditions;

import net.unmix.common.LangUtils;

/**
 * <p>Settings for one run of {@link FastICA}. Instances are immutable and are created with a
 * {@link Builder}:</p>
 *
 * <p>{@code ICAOptions options = ICAOptions.builder().approach(Approach.DEFLATION).randomSeed(42L).build();}</p>
 *
 * <ul>
 *   <li>approach: {@link Approach#SYMMETRIC} by default</li>
 *   <li>component count: all signals by default</li>
 *   <li>nonlinearity: {@link Nonlinearity#TANH} by default</li>
 *   <li>max iterations: {@value #DEFAULT_MAX_ITERATIONS} by default</li>
 *   <li>convergence epsilon: {@value #DEFAULT_CONVERGENCE_EPSILON} by default</li>
 *   <li>random seed: none by default, meaning a new generator from
 *     {@link net.unmix.common.random.RandomManager#getRandom()}</li>
 * </ul>
 *
 * @author Sean Owen
 */
public final class ICAOptions implements Serializable {

  public static final int DEFAULT_MAX_ITERATIONS = 1000;
  public static final double DEFAULT_CONVERGENCE_EPSILON = 1.0e-4;

  private static final ICAOptions DEFAULTS = builder().build();

  private final Approach approach;
  private final Integer componentCount;
  private final Nonlinearity nonlinearity;
  private final int maxIterations;
  private final double convergenceEpsilon;
  private final Long randomSeed;

  private ICAOptions(Builder builder) {
    this.approach = builder.approach;
    this.componentCount = builder.componentCount;
    this.nonlinearity = builder.nonlinearity;
    this.maxIterations = builder.maxIterations;
    this.convergenceEpsilon = builder.convergenceEpsilon;
    this.randomSeed = builder.randomSeed;
  }

  /**
   * @return options with all default values
   */
  public static ICAOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return a builder initialized with this instance's values
   */
  public Builder toBuilder() {
    return new Builder()
        .approach(approach)
        .componentCount(componentCount)
        .nonlinearity(nonlinearity)
        .maxIterations(maxIterations)
        .convergenceEpsilon(convergenceEpsilon)
        .randomSeed(randomSeed);
  }

  public Approach getApproach() {
    return approach;
  }

  /**
   * @return number of components to extract, or {@code null} to extract as many as there are signals
   */
  public Integer getComponentCount() {
    return componentCount;
  }

  public Nonlinearity getNonlinearity() {
    return nonlinearity;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public double getConvergenceEpsilon() {
    return convergenceEpsilon;
  }

  /**
   * @return seed for the random initial estimate, or {@code null} if none was set
   */
  public Long getRandomSeed() {
    return randomSeed;
  }

  @Override
  public String toString() {
    return "ICAOptions[approach:" + approach +
        ", componentCount:" + (componentCount == null ? "all" : componentCount) +
        ", nonlinearity:" + nonlinearity +
        ", maxIterations:" + maxIterations +
        ", convergenceEpsilon:" + convergenceEpsilon +
        ", randomSeed:" + randomSeed + ']';
  }

  /**
   * Builds {@link ICAOptions}. Values are checked as they are set.
   */
  public static final class Builder {

    private Approach approach = Approach.SYMMETRIC;
    private Integer componentCount;
    private Nonlinearity nonlinearity = Nonlinearity.DEFAULT;
    private int maxIterations = DEFAULT_MAX_ITERATIONS;
    private double convergenceEpsilon = DEFAULT_CONVERGENCE_EPSILON;
    private Long randomSeed;

    private Builder() {
    }

    public Builder approach(Approach approach) {
      this.approach = Preconditions.checkNotNull(approach);
      return this;
    }

    /**
     * @param approach name as understood by {@link Approach#forName(String)}
     */
    public Builder approach(String approach) {
      return approach(Approach.forName(approach));
    }

    /**
     * @param componentCount number of components to extract, or {@code null} for all. It is checked
     *  against the number of signals when the engine runs.
     */
    public Builder componentCount(Integer componentCount) {
      this.componentCount = componentCount;
      return this;
    }

    public Builder nonlinearity(Nonlinearity nonlinearity) {
      this.nonlinearity = Preconditions.checkNotNull(nonlinearity);
      return this;
    }

    /**
     * @param nonlinearity name as understood by {@link Nonlinearity#forName(String)}; unknown names
     *  select {@link Nonlinearity#DEFAULT}
     */
    public Builder nonlinearity(String nonlinearity) {
      return nonlinearity(Nonlinearity.forName(nonlinearity));
    }

    public Builder maxIterations(int maxIterations) {
      Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive: %s", maxIterations);
      this.maxIterations = maxIterations;
      return this;
    }

    public Builder convergenceEpsilon(double convergenceEpsilon) {
      Preconditions.checkArgument(LangUtils.isFinite(convergenceEpsilon) && convergenceEpsilon > 0.0,
                                  "convergenceEpsilon must be positive: %s", convergenceEpsilon);
      this.convergenceEpsilon = convergenceEpsilon;
      return this;
    }

    public Builder randomSeed(Long randomSeed) {
      this.randomSeed = randomSeed;
      return this;
    }

    public ICAOptions build() {
      return new ICAOptions(this);
    }

  }

}
