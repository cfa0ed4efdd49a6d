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
package io.agentnodes.api;

/**
 * One compilation problem.
 *
 * @param subject the graph node, edge or instance the problem is about; may be {@code null}
 */
public record CompilationError(ErrorKind kind, String subject, String message) {

  public static CompilationError structural(String subject, String message) {
    return new CompilationError(ErrorKind.STRUCTURAL, subject, message);
  }

  public static CompilationError type(String subject, String message) {
    return new CompilationError(ErrorKind.TYPE, subject, message);
  }

  public static CompilationError identity(String subject, String message) {
    return new CompilationError(ErrorKind.IDENTITY, subject, message);
  }

  /** Human-readable form, e.g. {@code "TypeError: ..."}. */
  public String describe() {
    return kind.getLabel() + ": " + message;
  }

  @Override
  public String toString() {
    return describe();
  }
}
