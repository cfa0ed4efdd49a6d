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
import io.agentnodes.api.graph.Graph;
import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 *
 *
 * <pre>
 * validate the graph is structurally sound:
 *    1. every node has a non-empty, unique id
 *    2. every node has a non-empty kind
 *    3. every edge's source and target name an existing node
 * </pre>
 *
 * Port ids are not checked here; unmatched ports fall back during instance compilation.
 */
@Slf4j
public class GraphValidator {

  public List<CompilationError> validate(Graph graph) {
    List<CompilationError> errors = new ArrayList<>();
    if (graph == null || graph.getNodes() == null) {
      errors.add(CompilationError.structural(null, "Invalid graph: missing or invalid nodes list"));
      return errors;
    }
    if (graph.getEdges() == null) {
      errors.add(CompilationError.structural(null, "Invalid graph: missing or invalid edges list"));
      return errors;
    }

    Set<String> nodeIds = new HashSet<>();
    List<GraphNode> nodes = graph.getNodes();
    for (int i = 0; i < nodes.size(); i++) {
      GraphNode node = nodes.get(i);
      if (node == null) {
        errors.add(CompilationError.structural(null, "Node at position " + i + " is null"));
        continue;
      }
      String id = node.getId();
      if (StringUtils.isBlank(id)) {
        errors.add(
            CompilationError.structural(null, "Node at position " + i + " is missing id property"));
      } else if (!nodeIds.add(id)) {
        errors.add(CompilationError.structural(id, "Duplicate node id: " + id));
      }
      if (StringUtils.isBlank(node.getKind())) {
        String label = StringUtils.isBlank(id) ? "at position " + i : id;
        errors.add(CompilationError.structural(id, "Node " + label + " is missing kind"));
      }
    }

    List<GraphEdge> edges = graph.getEdges();
    for (int i = 0; i < edges.size(); i++) {
      GraphEdge edge = edges.get(i);
      if (edge == null) {
        errors.add(CompilationError.structural(null, "Edge at position " + i + " is null"));
        continue;
      }
      if (!nodeIds.contains(edge.getSource())) {
        errors.add(
            CompilationError.structural(
                edge.getId(),
                String.format(
                    "Edge %s references invalid source node: %s",
                    edge.describe(), edge.getSource())));
      }
      if (!nodeIds.contains(edge.getTarget())) {
        errors.add(
            CompilationError.structural(
                edge.getId(),
                String.format(
                    "Edge %s references invalid target node: %s",
                    edge.describe(), edge.getTarget())));
      }
    }

    if (!errors.isEmpty()) {
      log.debug("graph validation found {} structural error(s): {}", errors.size(), errors);
    }
    return errors;
  }
}
