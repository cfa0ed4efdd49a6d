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

import io.agentnodes.api.CompilationError;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/** Compilation failed. Carries every error found, in the order they were found. */
@Getter
public class GraphCompilationException extends RuntimeException {
  private final List<CompilationError> errors;

  public GraphCompilationException(List<CompilationError> errors) {
    super(summarize(errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> describeErrors() {
    return errors.stream().map(CompilationError::describe).collect(Collectors.toList());
  }

  private static String summarize(List<CompilationError> errors) {
    return String.format(
        "graph compilation failed with %d error(s): %s",
        errors.size(),
        errors.stream().map(CompilationError::describe).collect(Collectors.joining("; ")));
  }
}
