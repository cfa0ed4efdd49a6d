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

import io.agentnodes.api.ir.Instance;
import java.util.Map;
import java.util.UUID;

/**
 * Output of the instance compiler.
 *
 * @param identities graph node id to instance identity, in graph order
 * @param instances instance identity to compiled instance, in graph order
 */
public record CompiledGraph(Map<String, UUID> identities, Map<UUID, Instance> instances) {

  public UUID identityOf(String nodeId) {
    return identities.get(nodeId);
  }

  public Instance instanceOf(String nodeId) {
    UUID id = identities.get(nodeId);
    return id == null ? null : instances.get(id);
  }
}
