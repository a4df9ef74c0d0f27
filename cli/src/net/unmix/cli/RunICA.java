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

package net.unmix.cli;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import com.lexicalscope.jewel.cli.HelpRequestedException;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.unmix.common.log.LogUtils;
import net.unmix.ica.FastICA;
import net.unmix.ica.ICACondition;
import net.unmix.ica.ICAOptions;
import net.unmix.ica.ICAResult;
import net.unmix.ica.InvalidInputException;
import net.unmix.ica.epoch.Epochs;
import net.unmix.ica.estimator.DeflationEstimator;
import net.unmix.ica.estimator.SymmetricEstimator;
import net.unmix.ica.whitening.Whitening;

/**
 * <p>Command-line interface to {@link FastICA}. It is run like so:</p>
 *
 * <p>{@code java -jar unmix-cli-X.Y.jar [options] input [outputDir]}</p>
 *
 * <p>{@code input} is a delimited text file with one signal per line and one sample per column. It may be
 * compressed, as understood by {@link net.unmix.common.io.IOUtils#openMaybeDecompressing(File)}.
 * "options" are:</p>
 *
 * <ul>
 *   <li>{@code --approach}: "symm" or "defl"</li>
 *   <li>{@code --components}: number of components to extract</li>
 *   <li>{@code --nonlinearity}: "pow3", "tanh" or "gauss"</li>
 *   <li>{@code --maxIterations}: iteration cap</li>
 *   <li>{@code --epsilon}: convergence threshold</li>
 *   <li>{@code --seed}: random seed</li>
 *   <li>{@code --epochLength}: points per epoch, if the input is several trials concatenated</li>
 *   <li>{@code --delimiter}: value separator, "," by default; "\t" means tab</li>
 *   <li>{@code --verbose}: log more messages</li>
 * </ul>
 *
 * <p>Output is written to {@code outputDir}, or the current directory, as {@code unmixing.csv},
 * {@code mixing.csv} and {@code components.csv}. With {@code --epochLength}, components are also written as
 * {@code components-epoch-0.csv}, {@code components-epoch-1.csv}, and so on. Non-convergence and degenerate
 * input are reported as warnings on standard error. Invalid input prints help and exits with status 1.</p>
 *
 * <p>For example:</p>
 *
 * <p>{@code java -jar unmix-cli-X.Y.jar --approach defl --components 3 --seed 42 eeg.csv.gz out}</p>
 *
 * @author Sean Owen
 */
public final class RunICA {

  private static final Logger log = LoggerFactory.getLogger(RunICA.class);

  static final String UNMIXING_FILE = "unmixing.csv";
  static final String MIXING_FILE = "mixing.csv";
  static final String COMPONENTS_FILE = "components.csv";
  static final String EPOCH_COMPONENTS_FILE_PREFIX = "components-epoch-";

  private RunICA() {
  }

  public static void main(String[] args) throws Exception {
    int status = run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * @param args command line arguments
   * @return process exit status: 0 on success, 1 if arguments or input are invalid
   * @throws IOException if input can't be read or output can't be written
   */
  static int run(String[] args) throws IOException {

    RunICAArgs cliArgs;
    try {
      cliArgs = CliFactory.parseArguments(RunICAArgs.class, args);
    } catch (HelpRequestedException hre) {
      printHelp(null);
      return 0;
    } catch (ArgumentValidationException ave) {
      printHelp(ave.getMessage());
      return 1;
    }

    List<String> files = cliArgs.getFiles();
    if (files == null || files.isEmpty() || files.size() > 2) {
      printHelp("Specify an input file, and optionally an output directory");
      return 1;
    }

    if (cliArgs.isVerbose()) {
      LogUtils.setSensibleLogFormat();
      LogUtils.enableDebugLoggingIn(RunICA.class,
                                    FastICA.class,
                                    Whitening.class,
                                    SymmetricEstimator.class,
                                    DeflationEstimator.class);
      log.debug("{}", cliArgs);
    }

    File inputFile = new File(files.get(0));
    File outputDir = new File(files.size() > 1 ? files.get(1) : ".");
    String delimiter = unescape(cliArgs.getDelimiter());

    ICAOptions options;
    try {
      options = buildOptions(cliArgs);
    } catch (IllegalArgumentException iae) {
      printHelp(iae.getMessage());
      return 1;
    }

    Integer epochLength = cliArgs.getEpochLength();
    ICAResult result;
    try {
      RealMatrix observations = MatrixFiles.read(inputFile, delimiter);
      log.info("Read {} signals x {} samples from {}",
               observations.getRowDimension(), observations.getColumnDimension(), inputFile);
      if (epochLength != null &&
          (epochLength <= 0 || observations.getColumnDimension() % epochLength != 0)) {
        throw new InvalidInputException(observations.getColumnDimension() +
                                        " samples are not a whole number of epochs of length " + epochLength);
      }
      result = new FastICA(options).run(observations);
    } catch (InvalidInputException iie) {
      printHelp(iie.getMessage());
      return 1;
    }

    for (ICACondition condition : result.getConditions()) {
      printWarning(System.err, condition);
    }

    if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
      throw new IOException("Can't create " + outputDir);
    }
    MatrixFiles.write(result.getUnmixing(), new File(outputDir, UNMIXING_FILE), delimiter);
    MatrixFiles.write(result.getMixing(), new File(outputDir, MIXING_FILE), delimiter);
    MatrixFiles.write(result.getComponents(), new File(outputDir, COMPONENTS_FILE), delimiter);
    if (epochLength != null) {
      double[][][] epochs = Epochs.split(result.getComponents(), epochLength);
      for (int epoch = 0; epoch < epochs.length; epoch++) {
        MatrixFiles.write(epochs[epoch], new File(outputDir, EPOCH_COMPONENTS_FILE_PREFIX + epoch + ".csv"), delimiter);
      }
    }
    log.info("Wrote results to {}", outputDir);
    return 0;
  }

  static ICAOptions buildOptions(RunICAArgs cliArgs) {
    ICAOptions.Builder builder = ICAOptions.builder();
    if (cliArgs.getApproach() != null) {
      builder.approach(cliArgs.getApproach());
    }
    if (cliArgs.getNonlinearity() != null) {
      builder.nonlinearity(cliArgs.getNonlinearity());
    }
    builder.componentCount(cliArgs.getComponents());
    if (cliArgs.getMaxIterations() != null) {
      builder.maxIterations(cliArgs.getMaxIterations());
    }
    if (cliArgs.getEpsilon() != null) {
      builder.convergenceEpsilon(cliArgs.getEpsilon());
    }
    builder.randomSeed(cliArgs.getSeed());
    return builder.build();
  }

  private static String unescape(String delimiter) {
    return "\\t".equals(delimiter) ? "\t" : delimiter;
  }

  private static void printWarning(PrintStream out, ICACondition condition) {
    switch (condition) {
      case NON_CONVERGENCE:
        out.println("Warning: did not converge; results are the last estimate");
        break;
      case DEGENERATE_COVARIANCE:
        out.println("Warning: input covariance is degenerate; signals may be constant or linearly dependent");
        break;
      default:
        out.println("Warning: " + condition);
        break;
    }
  }

  private static void printHelp(String message) {
    System.out.println();
    System.out.println("unmix: independent component analysis by FastICA");
    System.out.println();
    if (message != null) {
      System.out.println(message);
      System.out.println();
    }
    System.out.println(CliFactory.createCli(RunICAArgs.class).getHelpMessage());
  }

}
