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

import io.agentnodes.api.graph.PortType;
import java.util.UUID;

/**
 * A typed pointer at one output of one instance. Used where a node type carries a live value
 * reference instead of an input binding.
 */
public record ValueRef(PortType type, UUID instanceId, int outputIndex) {

  /** All-zero identity used when a reference cannot be resolved. */
  public static final UUID NIL_ID = new UUID(0L, 0L);

  public static ValueRef nil(PortType type) {
    return new ValueRef(type, NIL_ID, 0);
  }
}
