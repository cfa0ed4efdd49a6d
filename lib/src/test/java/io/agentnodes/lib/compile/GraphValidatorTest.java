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

import static io.agentnodes.lib.compile.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

import io.agentnodes.api.CompilationError;
import io.agentnodes.api.ErrorKind;
import io.agentnodes.api.graph.Graph;
import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import io.agentnodes.api.graph.PortType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class GraphValidatorTest {
  private final GraphValidator validator = new GraphValidator();

  @Test
  void testSoundGraph() {
    Graph graph =
        Graph.of(
            List.of(
                start("s", port("x", PortType.INTEGER)), finish("f", port("r", PortType.INTEGER))),
            List.of(GraphEdge.of("s", "x", "f", "r")));
    assertTrue(validator.validate(graph).isEmpty());
  }

  @Test
  void testDanglingEdgeEndpoints() {
    Graph graph =
        Graph.of(
            List.of(start("s", port("x", PortType.INTEGER))),
            List.of(
                new GraphEdge("e1", "ghost", "out", "s", "in"),
                new GraphEdge("e2", "s", "x", "nowhere", "in")));
    List<CompilationError> errors = validator.validate(graph);
    assertEquals(2, errors.size());
    assertTrue(errors.stream().allMatch(e -> e.kind() == ErrorKind.STRUCTURAL));
    assertEquals("e1", errors.get(0).subject());
    assertTrue(errors.get(0).message().contains("invalid source node: ghost"));
    assertEquals("e2", errors.get(1).subject());
    assertTrue(errors.get(1).message().contains("invalid target node: nowhere"));
  }

  @Test
  void testMissingKindAndId() {
    GraphNode noKind = node("a", null, ports(), ports());
    GraphNode blankKind = node("b", "  ", ports(), ports());
    GraphNode noId = node(null, "print", ports(), ports());
    List<CompilationError> errors =
        validator.validate(Graph.of(List.of(noKind, blankKind, noId), List.of()));
    assertEquals(3, errors.size());
    assertEquals("StructuralError: Node a is missing kind", errors.get(0).describe());
    assertEquals("StructuralError: Node b is missing kind", errors.get(1).describe());
    assertEquals(
        "StructuralError: Node at position 2 is missing id property", errors.get(2).describe());
  }

  @Test
  void testDuplicateNodeId() {
    List<CompilationError> errors =
        validator.validate(Graph.of(List.of(start("s"), finish("s")), List.of()));
    assertEquals(1, errors.size());
    assertEquals("Duplicate node id: s", errors.get(0).message());
  }

  @Test
  void testMissingLists() {
    assertEquals(1, validator.validate(new Graph(null, new ArrayList<>())).size());
    assertEquals(1, validator.validate(new Graph(new ArrayList<>(), null)).size());
    assertEquals(1, validator.validate(null).size());
  }

  @Test
  void testPortIdsAreNotChecked() {
    Graph graph =
        Graph.of(
            List.of(
                start("s", port("x", PortType.INTEGER)), finish("f", port("r", PortType.INTEGER))),
            List.of(GraphEdge.of("s", "no-such-port", "f", "no-such-port")));
    assertTrue(validator.validate(graph).isEmpty());
  }
}
