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
package io.agentnodes.lib.compile;

import com.google.common.base.Preconditions;
import io.agentnodes.api.CompilationError;
import io.agentnodes.api.graph.Graph;
import io.agentnodes.api.ir.Program;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Graph to program compiler.
 *
 * <pre>
 * validate -> compile instances (with variable desugaring) -> coerce -> resolve interface
 * </pre>
 *
 * All-or-nothing: any error means no program. Errors of one phase are all collected before
 * failing. Stateless apart from its options and identity generator, so one compiler may be shared.
 */
@Slf4j
public class GraphCompiler {
  private final CompilerOptions options;
  private final IdentityGenerator identityGenerator;
  private final GraphValidator validator = new GraphValidator();

  public GraphCompiler() {
    this(CompilerOptions.defaults(), IdentityGenerator.random());
  }

  public GraphCompiler(CompilerOptions options, IdentityGenerator identityGenerator) {
    this.options = Preconditions.checkNotNull(options);
    this.identityGenerator = Preconditions.checkNotNull(identityGenerator);
  }

  /**
   * @throws GraphCompilationException with every structural, type or identity error found
   */
  public Program compile(Graph graph) {
    List<CompilationError> structuralErrors = validator.validate(graph);
    if (!structuralErrors.isEmpty()) {
      throw new GraphCompilationException(structuralErrors);
    }

    GraphIndex index = new GraphIndex(graph);
    CompiledGraph compiled = new InstanceCompiler(options, identityGenerator).compile(index);
    CoercionPass.Result coerced = new CoercionPass(identityGenerator).apply(compiled.instances());
    if (coerced.hasErrors()) {
      throw new GraphCompilationException(coerced.errors());
    }

    InterfaceResolver interfaceResolver = new InterfaceResolver(index);
    Program program =
        Program.builder()
            .inputs(interfaceResolver.programInputs())
            .outputs(interfaceResolver.programOutputs())
            .instances(coerced.instances())
            .endNode(interfaceResolver.endNode(compiled.identities()))
            .build();
    log.info(
        "compiled {} node(s) and {} edge(s) into {} instance(s), {} cast(s)",
        index.nodes().size(),
        index.edges().size(),
        program.getInstances().size(),
        coerced.castCount());
    return program;
  }

  /** Never throws. Unexpected failures are reported as a single error message. */
  public CompilationResult tryCompile(Graph graph) {
    try {
      return CompilationResult.success(compile(graph));
    } catch (GraphCompilationException e) {
      log.debug("graph compilation failed", e);
      return CompilationResult.failure(e.describeErrors());
    } catch (RuntimeException e) {
      log.error("unexpected error during graph compilation", e);
      return CompilationResult.failure(List.of("Compilation failed: " + e.getMessage()));
    }
  }
}
