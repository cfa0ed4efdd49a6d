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

import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import io.agentnodes.api.graph.PortType;
import io.agentnodes.api.ir.Binding;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;

/** Turns an edge into the consumer-side binding {@code (expected_type, source_id, index)}. */
@Slf4j
class EdgeResolver {
  private final GraphIndex index;
  private final Map<String, UUID> identities;
  private final CompilerOptions options;

  EdgeResolver(GraphIndex index, Map<String, UUID> identities, CompilerOptions options) {
    this.index = index;
    this.identities = identities;
    this.options = options;
  }

  Binding resolve(GraphEdge edge) {
    GraphNode target = index.lookupNode(edge.getTarget());
    GraphNode source = index.lookupNode(edge.getSource());

    PortType expected;
    OptionalInt targetIndex = PortLookup.indexOf(target.getInputs(), edge.getTargetPort());
    if (targetIndex.isPresent()) {
      expected = PortLookup.typeAt(target.getInputs(), targetIndex.getAsInt());
    } else {
      expected = ObjectUtils.defaultIfNull(options.getUnmatchedInputType(), PortType.INTEGER);
      log.debug(
          "edge {}: target port not found on node {}, expecting {}",
          edge.describe(),
          target.getId(),
          expected);
    }

    OptionalInt sourceIndex = PortLookup.indexOf(source.getOutputs(), edge.getSourcePort());
    if (sourceIndex.isEmpty()) {
      log.debug(
          "edge {}: source port not found on node {}, using output 0",
          edge.describe(),
          source.getId());
    }
    return Binding.of(expected, identities.get(source.getId()), sourceIndex.orElse(0));
  }
}
