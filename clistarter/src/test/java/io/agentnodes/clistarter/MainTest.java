/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.agentnodes.clistarter;

import static io.agentnodes.lib.utils.JsonUtils.fromJsonString;
import static org.junit.jupiter.api.Assertions.*;

import io.agentnodes.api.graph.PortType;
import io.agentnodes.lib.compile.CompilationResult;
import io.agentnodes.lib.utils.MiscUtils;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

  @AfterEach
  void resetLogLevel() {
    Configurator.setLevel(Main.ROOT_LOGGER, Level.INFO);
  }

  private static String graphBase64(String resource) {
    return MiscUtils.toBase64String(
        MiscUtils.loadStringFromResource(resource).getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testCompileToStdout() {
    ByteArrayOutputStream testOut = new ByteArrayOutputStream();
    int exitCode =
        Main.run(
            new String[] {"-d", graphBase64("/graph_add.yml")},
            new PrintStream(testOut, true, StandardCharsets.UTF_8));

    assertEquals(0, exitCode);
    CompilationResult result =
        fromJsonString(testOut.toString(StandardCharsets.UTF_8), CompilationResult.class);
    assertTrue(result.isSuccess());
    assertNull(result.getErrors());
    assertEquals(List.of(PortType.INTEGER), result.getData().getInputs());
    assertEquals(4, result.getData().getInstances().size());
    assertFalse(result.getData().getEndNode().isEmpty());
  }

  @Test
  public void testCompileErrorsToFile(@TempDir Path tempDir) throws IOException {
    Path graphFile = tempDir.resolve("graph.json");
    Files.writeString(graphFile, MiscUtils.loadStringFromResource("/graph_type_error.json"));
    Path outputFile = tempDir.resolve("result.json");
    ByteArrayOutputStream testOut = new ByteArrayOutputStream();

    int exitCode =
        Main.run(
            new String[] {"-f", graphFile.toString(), "-o", outputFile.toString()},
            new PrintStream(testOut, true, StandardCharsets.UTF_8));

    assertEquals(1, exitCode);
    assertEquals(0, testOut.size());
    CompilationResult result =
        fromJsonString(Files.readString(outputFile), CompilationResult.class);
    assertFalse(result.isSuccess());
    assertNull(result.getData());
    assertEquals(1, result.getErrors().size());
    assertTrue(result.getErrors().get(0).startsWith("TypeError: "));
  }

  @Test
  public void testCompileCanvas(@TempDir Path tempDir) throws IOException {
    Path canvasFile = tempDir.resolve("canvas.json");
    Files.writeString(canvasFile, MiscUtils.loadStringFromResource("/canvas_print.json"));
    ByteArrayOutputStream testOut = new ByteArrayOutputStream();

    int exitCode =
        Main.run(
            new String[] {"--canvas", "-f", canvasFile.toString()},
            new PrintStream(testOut, true, StandardCharsets.UTF_8));

    assertEquals(0, exitCode);
    CompilationResult result =
        fromJsonString(testOut.toString(StandardCharsets.UTF_8), CompilationResult.class);
    // Integer -> String cast into print
    assertEquals(3, result.getData().getInstances().size());
    assertEquals(1, result.getData().countCasts());
  }

  @Test
  public void testUnreadableInput(@TempDir Path tempDir) {
    ByteArrayOutputStream testOut = new ByteArrayOutputStream();
    int exitCode =
        Main.run(
            new String[] {"-f", tempDir.resolve("missing.yml").toString()},
            new PrintStream(testOut, true, StandardCharsets.UTF_8));
    assertEquals(1, exitCode);
    CompilationResult result =
        fromJsonString(testOut.toString(StandardCharsets.UTF_8), CompilationResult.class);
    assertFalse(result.isSuccess());
    assertTrue(result.getErrors().get(0).startsWith("failed to load graph from file"));
  }

  @Test
  public void testUnknownOption() {
    assertEquals(1, Main.run(new String[] {"--jobId", "x"}, System.out));
  }

  @Test
  void testApplyLogLevel() {
    Main.applyLogLevel("DEBUG");
    assertEquals(Level.DEBUG, LogManager.getLogger(Main.ROOT_LOGGER).getLevel());
    Main.applyLogLevel("warn");
    assertEquals(Level.WARN, LogManager.getLogger(Main.ROOT_LOGGER).getLevel());
  }

  @Test
  void testApplyLogLevel_invalidOrBlank_noChange() {
    Level before = LogManager.getLogger(Main.ROOT_LOGGER).getLevel();
    Main.applyLogLevel("notavalidlevel");
    Main.applyLogLevel("  ");
    Main.applyLogLevel(null);
    assertEquals(before, LogManager.getLogger(Main.ROOT_LOGGER).getLevel());
  }
}
