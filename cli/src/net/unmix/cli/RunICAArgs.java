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

import java.util.List;

import com.lexicalscope.jewel.cli.Option;
import com.lexicalscope.jewel.cli.Unparsed;

/**
 * Command line argument object for {@link RunICA}.
 *
 * @author Sean Owen
 */
public interface RunICAArgs {

  @Option(description = "Verbose logging")
  boolean isVerbose();

  @Option(defaultToNull = true, description = "Estimation approach: 'symm' (default) or 'defl'")
  String getApproach();

  @Option(defaultToNull = true, description = "Number of components to extract; defaults to the number of signals")
  Integer getComponents();

  @Option(defaultToNull = true,
          description = "Nonlinearity: 'pow3', 'tanh' (default) or 'gauss'; unrecognized values use the default")
  String getNonlinearity();

  @Option(defaultToNull = true, description = "Iteration cap per run, or per component in deflation")
  Integer getMaxIterations();

  @Option(defaultToNull = true, description = "Convergence threshold on the change in direction")
  Double getEpsilon();

  @Option(defaultToNull = true, description = "Random seed, for reproducible results")
  Long getSeed();

  @Option(defaultToNull = true,
          description = "Points per epoch; if set, components are also written out one file per epoch")
  Integer getEpochLength();

  @Option(defaultValue = ",", description = "Delimiter between values in input and output files")
  String getDelimiter();

  @Option(helpRequest = true)
  boolean getHelp();

  @Unparsed
  List<String> getFiles();

}
