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
package io.agentnodes.lib.canvas;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agentnodes.api.graph.Graph;
import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import io.agentnodes.api.graph.LiteralValue;
import io.agentnodes.api.graph.Port;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.collections4.ListUtils;

/**
 * The editor's canvas document (React Flow json: {@code nodes[].data}, {@code edges[]}). Only the
 * fields the compiler needs are bound; positions, styles and the viewport are ignored.
 */
@Data
@NoArgsConstructor
@Builder
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CanvasDefinition {
  @Builder.Default private List<CanvasNode> nodes = new ArrayList<>();
  @Builder.Default private List<CanvasEdge> edges = new ArrayList<>();

  /**
   * Converts to the compiler's graph. A null node or edge list is kept null so that validation
   * reports it.
   */
  public Graph toGraph() {
    List<GraphNode> graphNodes =
        nodes == null
            ? null
            : nodes.stream()
                .map(n -> n == null ? null : n.toGraphNode())
                .collect(Collectors.toList());
    List<GraphEdge> graphEdges =
        edges == null
            ? null
            : edges.stream()
                .map(e -> e == null ? null : e.toGraphEdge())
                .collect(Collectors.toList());
    return new Graph(graphNodes, graphEdges);
  }

  @Data
  @NoArgsConstructor
  @Builder
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CanvasNode {
    private String id;
    private String type;
    private CanvasNodeData data;

    GraphNode toGraphNode() {
      CanvasNodeData d = data == null ? new CanvasNodeData() : data;
      boolean variable = Boolean.TRUE.equals(d.getIsVariableNode());
      return GraphNode.builder()
          .id(id)
          .kind(d.getNodeId())
          .libraryPath(d.getMetadataPath())
          .inputs(new ArrayList<>(ListUtils.emptyIfNull(d.getInputs())))
          .outputs(new ArrayList<>(ListUtils.emptyIfNull(d.getOutputs())))
          .literals(new ArrayList<>(ListUtils.emptyIfNull(d.getConstantValues())))
          .variableId(variable ? d.getVariableId() : null)
          .getter(variable ? d.getIsGetter() : null)
          .build();
    }
  }

  @Data
  @NoArgsConstructor
  @Builder
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CanvasNodeData {
    /** Node kind, e.g. {@code start} or a library node's name. */
    private String nodeId;

    private String label;
    private List<Port> inputs;
    private List<Port> outputs;
    private List<LiteralValue> constantValues;
    private String metadataPath;
    private String variableId;
    private String variableName;
    private Boolean isVariableNode;
    private Boolean isGetter;
  }

  @Data
  @NoArgsConstructor
  @Builder
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CanvasEdge {
    private String id;
    private String source;
    private String sourceHandle;
    private String target;
    private String targetHandle;

    GraphEdge toGraphEdge() {
      return new GraphEdge(id, source, sourceHandle, target, targetHandle);
    }
  }
}
