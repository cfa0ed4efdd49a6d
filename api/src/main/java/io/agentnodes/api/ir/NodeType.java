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
package io.agentnodes.api.ir;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * What a runtime instance is. Externally tagged on the wire: {@code {"Atomic": ...}} for built-in
 * behaviors and {@code {"Complex": "<path>"}} for a reference to another compiled document.
 */
@JsonSerialize(using = NodeTypeSerializer.class)
@JsonDeserialize(using = NodeTypeDeserializer.class)
public sealed interface NodeType permits NodeType.Atomic, NodeType.Complex {

  static NodeType atomic(AtomicType type) {
    return new Atomic(type);
  }

  static NodeType complex(String path) {
    return new Complex(path);
  }

  record Atomic(AtomicType type) implements NodeType {}

  /** Library reference. The referenced body is compiled separately and never inlined. */
  record Complex(String path) implements NodeType {}
}
