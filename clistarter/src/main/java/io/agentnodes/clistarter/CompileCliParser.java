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

import static io.agentnodes.lib.utils.MiscUtils.*;
import static io.agentnodes.lib.utils.YamlUtils.fromYamlString;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Preconditions;
import io.agentnodes.api.graph.Graph;
import io.agentnodes.lib.canvas.CanvasDefinition;
import io.agentnodes.lib.compile.CompilerOptions;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.*;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class CompileCliParser {
  static final String GRAPH_ENV_VAR = "GRAPH";

  private static final Options CLI_OPTIONS;

  private static final Option GRAPH_OPT =
      Option.builder("d").longOpt("graph").desc("base64 encoded graph string").hasArg().build();

  private static final Option GRAPH_FILE_OPT =
      Option.builder("f")
          .longOpt("graphFile")
          .desc("path to the graph json/yaml file")
          .hasArg()
          .build();

  private static final Option CANVAS_OPT =
      Option.builder().longOpt("canvas").desc("the graph is an editor canvas document").build();

  private static final Option CONFIG_OPT =
      Option.builder("c")
          .longOpt("config")
          .desc("path to the compiler options yaml file")
          .hasArg()
          .build();

  private static final Option OUTPUT_OPT =
      Option.builder("o")
          .longOpt("output")
          .desc("write the compilation result to this file instead of stdout")
          .hasArg()
          .build();

  private static final Option LOG_LEVEL_OPT =
      Option.builder()
          .longOpt("log-level")
          .desc("log level of the compiler loggers (error, warn, info, debug, trace)")
          .hasArg()
          .build();

  static {
    CLI_OPTIONS = new Options();
    CLI_OPTIONS
        .addOption(GRAPH_OPT)
        .addOption(GRAPH_FILE_OPT)
        .addOption(CANVAS_OPT)
        .addOption(CONFIG_OPT)
        .addOption(OUTPUT_OPT)
        .addOption(LOG_LEVEL_OPT);
  }

  public static CompileConfig parseArgs(String[] args) throws ParseException {
    CommandLineParser commandLineParser = new DefaultParser();
    CommandLine commandLine = commandLineParser.parse(CLI_OPTIONS, args);

    boolean canvas = commandLine.hasOption(CANVAS_OPT.getLongOpt());
    CompilerOptions compilerOptions =
        getOptionalCommandArgValue(
            commandLine, "c", CompileCliParser::loadCompilerOptions, CompilerOptions.defaults());

    return CompileConfig.builder()
        .graph(getGraph(commandLine, canvas))
        .compilerOptions(compilerOptions)
        .outputPath(getOptionalCommandArgValue(commandLine, "o", StringUtils::trimToNull, null))
        .logLevel(getOptionalCommandArgValue(commandLine, "log-level", l -> l, null))
        .build();
  }

  private static Graph getGraph(CommandLine commandLine, boolean canvas) {
    // check if graph string (-d) is directly available
    Graph graph =
        getOptionalCommandArgValue(
            commandLine,
            "d",
            d -> {
              if (StringUtils.isBlank(d)) {
                return null;
              }
              try {
                String graphStr = new String(fromBase64String(d), StandardCharsets.UTF_8);
                return parseGraph(graphStr, canvas);
              } catch (Exception e) {
                throw new IllegalArgumentException(
                    "failed to convert -d argument into a graph: " + d, e);
              }
            },
            null);
    if (graph != null) {
      return graph;
    }

    // check if graph file (-f) is available
    graph =
        getOptionalCommandArgValue(
            commandLine,
            "f",
            f -> {
              if (StringUtils.isBlank(f)) {
                return null;
              }
              try {
                String graphStr = Files.readString(Path.of(f));
                log.debug("read content from graph file {}:\n {}", f, graphStr);
                return parseGraph(graphStr, canvas);
              } catch (Exception e) {
                throw new IllegalArgumentException("failed to load graph from file: " + f, e);
              }
            },
            null);
    if (graph != null) {
      return graph;
    }

    // try to get graph from the GRAPH environment variable
    String graphStr = StringUtils.trimToNull(System.getenv(GRAPH_ENV_VAR));
    if (graphStr == null) {
      throw new IllegalArgumentException("no graph was provided");
    }
    try {
      return parseGraph(graphStr, canvas);
    } catch (Exception e) {
      throw new IllegalArgumentException(
          "failed to load graph from the " + GRAPH_ENV_VAR + " environment variable", e);
    }
  }

  /** Json is valid yaml, so one parser reads both. */
  static Graph parseGraph(String graphStr, boolean canvas) {
    if (canvas) {
      CanvasDefinition canvasDefinition = fromYamlString(graphStr, new TypeReference<>() {});
      Preconditions.checkArgument(canvasDefinition != null, "empty canvas document");
      return canvasDefinition.toGraph();
    }
    Graph graph = fromYamlString(graphStr, new TypeReference<>() {});
    Preconditions.checkArgument(graph != null, "empty graph document");
    return graph;
  }

  private static CompilerOptions loadCompilerOptions(String path) {
    if (StringUtils.isBlank(path)) {
      return CompilerOptions.defaults();
    }
    try {
      String optionsStr = Files.readString(Path.of(path));
      CompilerOptions options = fromYamlString(optionsStr, new TypeReference<>() {});
      return options == null ? CompilerOptions.defaults() : options;
    } catch (Exception e) {
      throw new IllegalArgumentException("failed to load compiler options from file: " + path, e);
    }
  }

  public static void printUsage(String prog) {
    HelpFormatter formatter = new HelpFormatter();
    String header = "Options:";
    String footer = "\n";
    formatter.printHelp(prog, header, CLI_OPTIONS, footer, true);
  }
}
