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

import static io.agentnodes.lib.utils.JsonUtils.toPrettyJsonString;

import com.google.common.annotations.VisibleForTesting;
import io.agentnodes.lib.compile.CompilationResult;
import io.agentnodes.lib.compile.GraphCompiler;
import io.agentnodes.lib.compile.IdentityGenerator;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

/** Compiles one graph and writes the compilation result document. Exits 1 on failure. */
@Slf4j
public class Main {
  static final String PROG = "agentnodes-compile";
  static final String ROOT_LOGGER = "io.agentnodes";

  public static void main(String[] args) {
    int exitCode = run(args, System.out);
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  @VisibleForTesting
  static int run(String[] args, PrintStream out) {
    CompileConfig config;
    try {
      config = CompileCliParser.parseArgs(args);
    } catch (ParseException cliParseException) {
      log.error("invalid arguments: {}", cliParseException.getMessage());
      CompileCliParser.printUsage(PROG);
      return 1;
    } catch (IllegalArgumentException e) {
      log.error("failed to read input", e);
      writeResult(CompilationResult.failure(List.of(e.getMessage())), null, out);
      return 1;
    }
    applyLogLevel(config.getLogLevel());

    GraphCompiler compiler =
        new GraphCompiler(config.getCompilerOptions(), IdentityGenerator.random());
    CompilationResult result = compiler.tryCompile(config.getGraph());
    if (!result.isSuccess()) {
      log.warn("compilation failed with {} error(s)", result.getErrors().size());
    }
    if (!writeResult(result, config.getOutputPath(), out)) {
      return 1;
    }
    return result.isSuccess() ? 0 : 1;
  }

  /** Case-insensitive; blank or unknown levels leave the current level unchanged. */
  @VisibleForTesting
  static void applyLogLevel(String logLevel) {
    if (StringUtils.isBlank(logLevel)) {
      return;
    }
    Level level = Level.toLevel(logLevel.trim().toUpperCase(), null);
    if (level == null) {
      log.warn("ignoring unknown log level: {}", logLevel);
      return;
    }
    Configurator.setLevel(ROOT_LOGGER, level);
  }

  private static boolean writeResult(CompilationResult result, String outputPath, PrintStream out) {
    String document = toPrettyJsonString(result);
    if (outputPath == null) {
      out.println(document);
      return true;
    }
    try {
      Files.writeString(
          Path.of(outputPath), document + System.lineSeparator(), StandardCharsets.UTF_8);
      log.info("wrote compilation result to {}", outputPath);
      return true;
    } catch (IOException e) {
      log.error("failed to write compilation result to {}", outputPath, e);
      return false;
    }
  }
}
