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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.junit.Test;

import net.unmix.common.UnmixTest;

public final class IOUtilsTest extends UnmixTest {

  private static final byte[] SOME_BYTES = { 0x01, 0x02, 0x03 };

  @Test
  public void testReadGZIP() throws IOException {
    File gzFile = new File(getTestTempDir(), "data.csv.gz");
    OutputStream out = new GZIPOutputStream(new FileOutputStream(gzFile));
    Writer writer = new OutputStreamWriter(out, Charsets.UTF_8);
    try {
      writer.write("1,2,3\n4,5,6\n");
    } finally {
      writer.close();
    }
    BufferedReader reader = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(gzFile));
    try {
      assertEquals("1,2,3", reader.readLine());
      assertEquals("4,5,6", reader.readLine());
      assertNull(reader.readLine());
    } finally {
      reader.close();
    }
  }

  @Test
  public void testReadBZip2() throws IOException {
    File bz2File = new File(getTestTempDir(), "data.csv.bz2");
    Writer writer =
        new OutputStreamWriter(new BZip2CompressorOutputStream(new FileOutputStream(bz2File)), Charsets.UTF_8);
    try {
      writer.write("0.5,-1\n");
    } finally {
      writer.close();
    }
    BufferedReader reader = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(bz2File));
    try {
      assertEquals("0.5,-1", reader.readLine());
      assertNull(reader.readLine());
    } finally {
      reader.close();
    }
  }

  @Test
  public void testReadZipFirstEntry() throws IOException {
    File zipFile = new File(getTestTempDir(), "data.zip");
    ZipOutputStream out = new ZipOutputStream(new FileOutputStream(zipFile));
    try {
      out.putNextEntry(new ZipEntry("first.csv"));
      out.write("1,1\n".getBytes(Charsets.UTF_8));
      out.closeEntry();
      out.putNextEntry(new ZipEntry("second.csv"));
      out.write("2,2\n".getBytes(Charsets.UTF_8));
      out.closeEntry();
    } finally {
      out.close();
    }
    BufferedReader reader = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(zipFile));
    try {
      assertEquals("1,1", reader.readLine());
      assertNull(reader.readLine());
    } finally {
      reader.close();
    }
  }

  @Test(expected = IOException.class)
  public void testEmptyZip() throws IOException {
    File zipFile = new File(getTestTempDir(), "empty.zip");
    Files.write(new byte[0], zipFile);
    IOUtils.openMaybeDecompressing(zipFile);
  }

  @Test
  public void testReadPlain() throws IOException {
    File file = new File(getTestTempDir(), "data.csv");
    Files.asCharSink(file, Charsets.UTF_8).write("7,8\n");
    BufferedReader reader = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(file));
    try {
      assertEquals("7,8", reader.readLine());
    } finally {
      reader.close();
    }
  }

  @Test
  public void testDeleteRecursively() throws IOException {

    File tempDir = getTestTempDir();
    assertTrue(tempDir.exists());
    File subFile1 = new File(tempDir, "subFile1");
    Files.write(SOME_BYTES, subFile1);
    assertTrue(subFile1.exists());
    File subDir1 = new File(tempDir, "subDir1");
    subDir1.mkdirs();
    assertTrue(subDir1.exists());
    File subFile2 = new File(subDir1, "subFile2");
    Files.write(SOME_BYTES, subFile2);
    assertTrue(subFile2.exists());

    assertTrue(IOUtils.deleteRecursively(tempDir));

    assertFalse(tempDir.exists());
    assertFalse(subFile1.exists());
    assertFalse(subDir1.exists());
    assertFalse(subFile2.exists());
  }

}
