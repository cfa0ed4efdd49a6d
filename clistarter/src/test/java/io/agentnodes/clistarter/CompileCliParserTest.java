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

import static org.junit.jupiter.api.Assertions.*;

import io.agentnodes.api.graph.Graph;
import io.agentnodes.api.graph.PortType;
import io.agentnodes.lib.compile.CompilerOptions;
import io.agentnodes.lib.utils.MiscUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompileCliParserTest {

  @Test
  void parseArgs_loadGraphFromCli() throws ParseException {
    String graphStr = MiscUtils.loadStringFromResource("/graph_add.yml");
    String graphBase64Str = MiscUtils.toBase64String(graphStr.getBytes());
    CompileConfig config =
        CompileCliParser.parseArgs(new String[] {"-d", graphBase64Str, "--log-level", "debug"});

    Graph graph = config.getGraph();
    assertEquals(4, graph.getNodes().size());
    assertEquals(3, graph.getEdges().size());
    assertEquals("binary-operation", graph.getNodes().get(2).getKind());
    assertEquals(CompilerOptions.defaults(), config.getCompilerOptions());
    assertNull(config.getOutputPath());
    assertEquals("debug", config.getLogLevel());
  }

  @Test
  void parseArgs_loadGraphFromFile(@TempDir Path tempDir) throws IOException, ParseException {
    Path graphFile = tempDir.resolve("graph.json");
    Files.writeString(graphFile, MiscUtils.loadStringFromResource("/graph_type_error.json"));
    Path optionsFile = tempDir.resolve("options.yml");
    Files.writeString(optionsFile, MiscUtils.loadStringFromResource("/compiler_options.yml"));
    Path outputFile = tempDir.resolve("program.json");

    String[] args =
        String.format("-f %s -c %s -o %s", graphFile, optionsFile, outputFile).split("\\s+");
    CompileConfig config = CompileCliParser.parseArgs(args);

    assertEquals(2, config.getGraph().getNodes().size());
    assertEquals("e1", config.getGraph().getEdges().get(0).getId());
    assertEquals(PortType.STRING, config.getCompilerOptions().getUnmatchedInputType());
    assertEquals(
        CompilerOptions.DEFAULT_LIBRARY_PATH_PREFIX,
        config.getCompilerOptions().getLibraryPathPrefix());
    assertEquals(outputFile.toString(), config.getOutputPath());
  }

  @Test
  void parseArgs_loadCanvas(@TempDir Path tempDir) throws IOException, ParseException {
    Path canvasFile = tempDir.resolve("canvas.json");
    Files.writeString(canvasFile, MiscUtils.loadStringFromResource("/canvas_print.json"));

    CompileConfig config =
        CompileCliParser.parseArgs(new String[] {"--canvas", "-f", canvasFile.toString()});

    assertEquals("start", config.getGraph().getNodes().get(0).getKind());
    assertEquals(
        "input-1718000000001-0-bbbb", config.getGraph().getEdges().get(0).getTargetPort());
  }

  @Test
  void parseArgs_badInputs(@TempDir Path tempDir) {
    assertThrows(
        IllegalArgumentException.class,
        () -> CompileCliParser.parseArgs(new String[] {"-f", tempDir.resolve("nope").toString()}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CompileCliParser.parseArgs(new String[] {"-d", "!!not-base64!!"}));
    assertThrows(
        ParseException.class, () -> CompileCliParser.parseArgs(new String[] {"--dag", "x"}));
  }
}
