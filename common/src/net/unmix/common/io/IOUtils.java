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

package net.unmix.common.io;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipInputStream;

import com.google.common.base.Charsets;
import com.google.common.io.Closeables;
import com.google.common.io.Files;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

/**
 * I/O helpers for reading observation files, which may be compressed.
 *
 * @author Sean Owen
 */
public final class IOUtils {

  private IOUtils() {
  }

  /**
   * Deletes a file, or a directory and everything under it. Symlinked directories are not followed
   * reliably.
   *
   * @param fileOrDir file or directory to delete; may be {@code null}
   * @return {@code true} only if everything was deleted
   */
  public static boolean deleteRecursively(File fileOrDir) {
    if (fileOrDir == null || !fileOrDir.exists()) {
      return false;
    }
    boolean deletedAll = true;
    File[] children = fileOrDir.listFiles();
    if (children != null) {
      for (File child : children) {
        deletedAll &= deleteRecursively(child);
      }
    }
    return fileOrDir.delete() && deletedAll;
  }

  /**
   * Opens a file for reading, decompressing it according to its extension: {@code gz}, {@code zip}
   * (first entry only), {@code deflate}, or {@code bz2}/{@code bzip2}. Other files are read as-is.
   *
   * @param file file to open
   * @return stream over the uncompressed contents
   * @throws IOException if the file can't be opened, or is not valid for its compression format
   */
  public static InputStream openMaybeDecompressing(File file) throws IOException {
    String extension = Files.getFileExtension(file.getName()).toLowerCase(Locale.ENGLISH);
    InputStream in = new BufferedInputStream(new FileInputStream(file));
    try {
      if ("gz".equals(extension)) {
        return new GZIPInputStream(in);
      }
      if ("zip".equals(extension)) {
        ZipInputStream zipIn = new ZipInputStream(in);
        if (zipIn.getNextEntry() == null) {
          throw new IOException("No entries in " + file);
        }
        return zipIn;
      }
      if ("deflate".equals(extension)) {
        return new InflaterInputStream(in);
      }
      if ("bz2".equals(extension) || "bzip2".equals(extension)) {
        return new BZip2CompressorInputStream(in);
      }
      return in;
    } catch (IOException ioe) {
      Closeables.close(in, true);
      throw ioe;
    }
  }

  /**
   * @param file file to open, decoded as UTF-8
   * @return reader over the uncompressed contents
   * @throws IOException if the file can't be opened
   * @see #openMaybeDecompressing(File)
   */
  public static Reader openReaderMaybeDecompressing(File file) throws IOException {
    return new InputStreamReader(openMaybeDecompressing(file), Charsets.UTF_8);
  }

  /**
   * @return {@code reader} if it is already a {@link BufferedReader}, otherwise a {@link BufferedReader}
   *  around it
   */
  public static BufferedReader buffer(Reader reader) {
    if (reader instanceof BufferedReader) {
      return (BufferedReader) reader;
    }
    return new BufferedReader(reader);
  }

}
