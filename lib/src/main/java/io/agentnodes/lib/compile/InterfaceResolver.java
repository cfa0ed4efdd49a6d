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

import io.agentnodes.api.graph.GraphNode;
import io.agentnodes.api.graph.Port;
import io.agentnodes.api.graph.PortType;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.ListUtils;

/** Derives the program's external signature and picks its end instance. */
@Slf4j
public class InterfaceResolver {
  private final GraphIndex index;

  public InterfaceResolver(GraphIndex index) {
    this.index = index;
  }

  /** Output port types of the start node, empty without one. */
  public List<PortType> programInputs() {
    return sentinel(NodeKinds.KIND_START)
        .map(n -> types(n.getOutputs()))
        .orElseGet(List::of);
  }

  /** Input port types of the finish node, empty without one. */
  public List<PortType> programOutputs() {
    return sentinel(NodeKinds.KIND_FINISH)
        .map(n -> types(n.getInputs()))
        .orElseGet(List::of);
  }

  /**
   * The finish node if there is one. Otherwise the first node without outgoing edges, preferring
   * one that is not the start node, else the first node. Empty string for an empty graph.
   */
  public String endNode(Map<String, UUID> identities) {
    List<GraphNode> nodes = index.nodes();
    if (nodes.isEmpty()) {
      return "";
    }
    Optional<GraphNode> finish = index.firstOfKind(NodeKinds.KIND_FINISH);
    if (finish.isPresent()) {
      return identities.get(finish.get().getId()).toString();
    }

    List<GraphNode> candidates =
        nodes.stream().filter(n -> !index.hasDownstreamEdges(n.getId())).toList();
    GraphNode selected =
        candidates.stream()
            .filter(n -> !NodeKinds.KIND_START.equals(n.getKind()))
            .findFirst()
            .orElse(candidates.isEmpty() ? nodes.get(0) : candidates.get(0));
    log.debug("no finish node, selected {} as the end node", selected.getId());
    return identities.get(selected.getId()).toString();
  }

  private Optional<GraphNode> sentinel(String kind) {
    long count = index.countOfKind(kind);
    if (count > 1) {
      log.warn("graph has {} {} nodes, using the first one", count, kind);
    }
    return index.firstOfKind(kind);
  }

  private static List<PortType> types(List<Port> ports) {
    return ListUtils.emptyIfNull(ports).stream()
        .map(p -> p == null || p.getType() == null ? PortType.NONE : p.getType())
        .collect(Collectors.toList());
  }
}
