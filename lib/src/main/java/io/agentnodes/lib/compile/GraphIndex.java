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

import io.agentnodes.api.graph.Graph;
import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.collections4.ListUtils;

/** Lookup indexes over a structurally valid graph. */
public class GraphIndex {
  private final List<GraphNode> nodes;
  private final List<GraphEdge> edges;
  private final Map<String, GraphNode> nodeIndex = new LinkedHashMap<>();
  private final Map<String, List<GraphEdge>> incomingEdgesIndex = new LinkedHashMap<>();
  private final Map<String, List<GraphEdge>> outgoingEdgesIndex = new LinkedHashMap<>();

  public GraphIndex(Graph graph) {
    this.nodes = ListUtils.emptyIfNull(graph.getNodes());
    this.edges = ListUtils.emptyIfNull(graph.getEdges());
    for (GraphNode node : nodes) {
      nodeIndex.put(node.getId(), node);
    }
    for (GraphEdge edge : edges) {
      incomingEdgesIndex.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge);
      outgoingEdgesIndex.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
    }
  }

  public List<GraphNode> nodes() {
    return nodes;
  }

  public List<GraphEdge> edges() {
    return edges;
  }

  public GraphNode lookupNode(String nodeId) {
    GraphNode node = nodeIndex.get(nodeId);
    if (node == null) {
      throw new IllegalArgumentException("Node with ID " + nodeId + " not found");
    }
    return node;
  }

  public List<GraphEdge> upstreamEdges(String nodeId) {
    return incomingEdgesIndex.getOrDefault(nodeId, Collections.emptyList());
  }

  public boolean hasDownstreamEdges(String nodeId) {
    return outgoingEdgesIndex.containsKey(nodeId);
  }

  /** First node, in graph order, whose kind equals {@code kind}. */
  public Optional<GraphNode> firstOfKind(String kind) {
    return nodes.stream().filter(n -> kind.equals(n.getKind())).findFirst();
  }

  public long countOfKind(String kind) {
    return nodes.stream().filter(n -> kind.equals(n.getKind())).count();
  }
}
