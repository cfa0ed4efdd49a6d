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

import lombok.Getter;

@Getter
public enum ErrorKind {
  /** Malformed node or dangling edge. Reported before any instance is compiled. */
  STRUCTURAL("StructuralError"),
  /** No coercion path between two port types. */
  TYPE("TypeError"),
  /** A binding names an instance, or an output, that does not exist. */
  IDENTITY("IdentityError");

  private final String label;

  ErrorKind(String label) {
    this.label = label;
  }
}
