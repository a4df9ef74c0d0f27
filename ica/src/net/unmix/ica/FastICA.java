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

import java.util.EnumSet;
import java.util.Set;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.unmix.common.LangUtils;
import net.unmix.common.math.MatrixUtils;
import net.unmix.common.random.RandomManager;
import net.unmix.ica.estimator.DeflationEstimator;
import net.unmix.ica.estimator.Estimate;
import net.unmix.ica.estimator.IterationListener;
import net.unmix.ica.estimator.SymmetricEstimator;
import net.unmix.ica.estimator.UnmixingEstimator;
import net.unmix.ica.whitening.WhitenedData;
import net.unmix.ica.whitening.Whitening;

/**
 * <p>Implements the FastICA algorithm described in
 * <a href="https://doi.org/10.1016/S0893-6080(00)00026-5">"Independent component analysis: algorithms and
 * applications"</a> by Aapo Hyv&auml;rinen and Erkki Oja: blind separation of N observed, linearly mixed
 * signals into k &lt;= N statistically independent components, by maximizing non-Gaussianity.</p>
 *
 * <p>A run proceeds in four stages:</p>
 *
 * <ol>
 *   <li>the observations are centered and whitened ({@link Whitening});</li>
 *   <li>a {@link Nonlinearity} supplies the contrast function;</li>
 *   <li>an {@link UnmixingEstimator} finds orthonormal directions in whitened space, jointly
 *     ({@link Approach#SYMMETRIC}) or one by one ({@link Approach#DEFLATION});</li>
 *   <li>the directions are mapped back to observation space to give the unmixing matrix, its
 *     pseudo-inverse the mixing matrix, and the components.</li>
 * </ol>
 *
 * <p>Instances hold no state between runs other than their options, and observations are never modified,
 * so one instance may be used from several threads at once. Given the same observations and a
 * {@link ICAOptions#getRandomSeed() random seed}, results are identical from run to run.</p>
 *
 * @author Sean Owen
 */
public final class FastICA {

  private static final Logger log = LoggerFactory.getLogger(FastICA.class);

  private final ICAOptions options;
  private volatile IterationListener iterationListener;

  public FastICA() {
    this(ICAOptions.defaults());
  }

  public FastICA(ICAOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public ICAOptions getOptions() {
    return options;
  }

  /**
   * @param iterationListener notified after every iteration of the estimator; may be {@code null}
   */
  public void setIterationListener(IterationListener iterationListener) {
    this.iterationListener = iterationListener;
  }

  /**
   * Runs ICA with default options.
   *
   * @see #runICA(RealMatrix, ICAOptions)
   */
  public static ICAResult runICA(RealMatrix observations) {
    return new FastICA().run(observations);
  }

  /**
   * @param observations N signals (rows) x M samples (columns); not modified
   * @param options settings for this run
   * @return unmixing matrix, mixing matrix, components and any non-fatal conditions
   * @throws InvalidInputException if observations are empty, ragged or non-finite
   * @throws InsufficientSamplesException if there are fewer samples than signals
   * @throws InvalidComponentCountException if the component count is not in [1,N]
   */
  public static ICAResult runICA(RealMatrix observations, ICAOptions options) {
    return new FastICA(options).run(observations);
  }

  /**
   * @param observations N signals (rows) x M samples (columns); each row must have the same length
   * @see #run(RealMatrix)
   */
  public ICAResult run(double[][] observations) {
    checkRectangular(observations);
    return run(new Array2DRowRealMatrix(observations, true));
  }

  /**
   * @param observations N signals (rows) x M samples (columns); not modified
   * @return unmixing matrix, mixing matrix, components and any non-fatal conditions
   * @throws InvalidInputException if observations are empty or non-finite
   * @throws InsufficientSamplesException if there are fewer samples than signals
   * @throws InvalidComponentCountException if the component count is not in [1,N]
   */
  public ICAResult run(RealMatrix observations) {
    if (observations == null) {
      throw new InvalidInputException("No observations");
    }
    int signals = observations.getRowDimension();
    int samples = observations.getColumnDimension();
    int[] nonFinite = LangUtils.findNonFinite(MatrixUtils.accessMatrixDataDirectly(observations));
    if (nonFinite != null) {
      throw new InvalidInputException("Non-finite value at signal " + nonFinite[0] + ", sample " + nonFinite[1]);
    }
    if (samples < signals || samples < 2) {
      throw new InsufficientSamplesException(signals, samples);
    }
    Integer requested = options.getComponentCount();
    int components = requested == null ? signals : requested;
    if (components < 1 || components > signals) {
      throw new InvalidComponentCountException(components, signals);
    }

    log.info("Extracting {} independent components from {} signals x {} samples",
             components, signals, samples);
    log.debug("{}", options);

    Set<ICACondition> conditions = EnumSet.noneOf(ICACondition.class);

    WhitenedData whitenedData = Whitening.whiten(observations);
    if (whitenedData.isDegenerate()) {
      conditions.add(ICACondition.DEGENERATE_COVARIANCE);
    }

    UnmixingEstimator estimator = buildEstimator(components);
    estimator.setIterationListener(iterationListener);
    log.debug("Running {} approach with {} nonlinearity", options.getApproach(), options.getNonlinearity());
    Estimate estimate = estimator.estimate(whitenedData.getWhitened());
    if (!estimate.isConverged()) {
      conditions.add(ICACondition.NON_CONVERGENCE);
    }

    ICAResult result = ResultAssembler.assemble(estimate, whitenedData, conditions);
    if (log.isDebugEnabled()) {
      log.debug("Unmixing matrix:\n{}", MatrixUtils.matrixToString(result.getUnmixing()));
    }
    log.info("Extracted {} independent components{}",
             components, conditions.isEmpty() ? "" : " with conditions " + conditions);
    return result;
  }

  private UnmixingEstimator buildEstimator(int components) {
    RandomGenerator random = options.getRandomSeed() == null
        ? RandomManager.getRandom()
        : RandomManager.getRandom(options.getRandomSeed());
    switch (options.getApproach()) {
      case DEFLATION:
        return new DeflationEstimator(components,
                                      options.getNonlinearity(),
                                      options.getMaxIterations(),
                                      options.getConvergenceEpsilon(),
                                      random);
      case SYMMETRIC:
        return new SymmetricEstimator(components,
                                      options.getNonlinearity(),
                                      options.getMaxIterations(),
                                      options.getConvergenceEpsilon(),
                                      random);
      default:
        throw new IllegalStateException("Unknown approach " + options.getApproach());
    }
  }

  private static void checkRectangular(double[][] observations) {
    if (observations == null || observations.length == 0 || observations[0].length == 0) {
      throw new InvalidInputException("No observations");
    }
    int samples = observations[0].length;
    for (int i = 1; i < observations.length; i++) {
      if (observations[i].length != samples) {
        throw new InvalidInputException("Signal " + i + " has " + observations[i].length +
                                        " samples but signal 0 has " + samples);
      }
    }
  }

}
