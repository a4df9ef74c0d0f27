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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import net.unmix.common.LangUtils;
import net.unmix.common.io.IOUtils;
import net.unmix.common.math.MatrixUtils;
import net.unmix.ica.InvalidInputException;

/**
 * Reads and writes matrices as delimited text, one row per line. Blank lines, and lines beginning with
 * {@code #}, are skipped on input.
 *
 * @author Sean Owen
 */
public final class MatrixFiles {

  private static final String COMMENT_PREFIX = "#";

  private MatrixFiles() {
  }

  /**
   * @param file delimited text file, possibly compressed (see {@link IOUtils#openMaybeDecompressing(File)})
   * @param delimiter separator between values; if blank, any run of whitespace separates values
   * @return matrix with one row per non-blank line
   * @throws IOException if the file can't be read
   * @throws InvalidInputException if the file has no rows, rows of different lengths, or a value that is
   *  not a finite number
   */
  public static RealMatrix read(File file, String delimiter) throws IOException {
    Splitter splitter = splitterFor(delimiter);
    List<double[]> rows = Lists.newArrayList();
    BufferedReader reader = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(file));
    try {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
          continue;
        }
        double[] row = parseRow(splitter.split(trimmed), file, lineNumber);
        if (!rows.isEmpty() && row.length != rows.get(0).length) {
          throw new InvalidInputException(file + " line " + lineNumber + " has " + row.length +
                                          " values but the first row has " + rows.get(0).length);
        }
        rows.add(row);
      }
    } finally {
      reader.close();
    }
    if (rows.isEmpty()) {
      throw new InvalidInputException("No data in " + file);
    }
    return new Array2DRowRealMatrix(rows.toArray(new double[rows.size()][]), false);
  }

  private static double[] parseRow(Iterable<String> tokens, File file, int lineNumber) {
    List<String> values = Lists.newArrayList(tokens);
    double[] row = new double[values.size()];
    for (int i = 0; i < row.length; i++) {
      try {
        row[i] = LangUtils.parseDouble(values.get(i));
      } catch (IllegalArgumentException iae) {
        // Also covers NumberFormatException
        throw new InvalidInputException(file + " line " + lineNumber + ", value " + (i + 1) + ": " +
                                        iae.getMessage(), iae);
      }
    }
    return row;
  }

  /**
   * @param M matrix to write
   * @param file destination; overwritten
   * @param delimiter separator between values
   * @throws IOException if the file can't be written
   */
  public static void write(RealMatrix M, File file, String delimiter) throws IOException {
    write(MatrixUtils.accessMatrixDataDirectly(M), file, delimiter);
  }

  /**
   * @param rows rows to write
   * @param file destination; overwritten
   * @param delimiter separator between values
   * @throws IOException if the file can't be written
   */
  public static void write(double[][] rows, File file, String delimiter) throws IOException {
    Joiner joiner = Joiner.on(delimiter.isEmpty() ? " " : delimiter);
    Writer out = Files.newWriter(file, Charsets.UTF_8);
    try {
      List<String> formatted = Lists.newArrayList();
      for (double[] row : rows) {
        formatted.clear();
        for (double value : row) {
          formatted.add(Double.toString(value));
        }
        out.write(joiner.join(formatted));
        out.write('\n');
      }
    } finally {
      out.close();
    }
  }

  private static Splitter splitterFor(String delimiter) {
    if (delimiter.trim().isEmpty()) {
      return Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    }
    return Splitter.on(delimiter).trimResults();
  }

}
