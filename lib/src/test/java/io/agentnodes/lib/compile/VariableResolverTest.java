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

import io.agentnodes.api.graph.Graph;
import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import io.agentnodes.api.graph.PortType;
import io.agentnodes.api.ir.AtomicType;
import io.agentnodes.api.ir.Binding;
import io.agentnodes.api.ir.Instance;
import io.agentnodes.api.ir.NodeType;
import io.agentnodes.api.ir.Program;
import io.agentnodes.api.ir.ValueRef;
import io.agentnodes.api.ir.VariableAccess;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class VariableResolverTest {

  private static CompiledGraph compile(List<GraphNode> nodes, List<GraphEdge> edges) {
    return new InstanceCompiler(CompilerOptions.defaults(), sequentialIds())
        .compile(new GraphIndex(Graph.of(nodes, edges)));
  }

  @Test
  void testGetterReferencesSetter() {
    GraphNode producer = constant("text", PortType.STRING, "hello");
    GraphNode set = setter("set", "greeting", PortType.STRING);
    GraphNode get = getter("get", "greeting", PortType.STRING);
    CompiledGraph compiled =
        compile(
            List.of(producer, set, get), List.of(GraphEdge.of("text", "value", "set", "value")));

    UUID textId = compiled.identityOf("text");
    UUID setId = compiled.identityOf("set");
    assertEquals(
        NodeType.atomic(
            new AtomicType.Variable(
                new VariableAccess.Set(new ValueRef(PortType.STRING, textId, 0)))),
        compiled.instanceOf("set").getNodeType());
    assertEquals(List.of(PortType.STRING), compiled.instanceOf("set").getOutputs());
    assertEquals(
        NodeType.atomic(
            new AtomicType.Variable(
                new VariableAccess.Get(new ValueRef(PortType.STRING, setId, 0)))),
        compiled.instanceOf("get").getNodeType());
    assertEquals(
        List.of(Binding.orderingOnly(PortType.STRING, setId, 0)),
        compiled.instanceOf("get").getInputs());
  }

  @Test
  void testGetterWithoutSetterReferencesNil() {
    CompiledGraph compiled =
        compile(List.of(getter("get", "orphan", PortType.INTEGER)), List.of());
    Instance get = compiled.instanceOf("get");
    assertEquals(
        NodeType.atomic(
            new AtomicType.Variable(new VariableAccess.Get(ValueRef.nil(PortType.INTEGER)))),
        get.getNodeType());
    assertTrue(get.getInputs().isEmpty());
  }

  @Test
  void testSetterWithoutEdgeReferencesNil() {
    CompiledGraph compiled = compile(List.of(setter("set", "v", PortType.FLOAT)), List.of());
    assertEquals(
        NodeType.atomic(
            new AtomicType.Variable(new VariableAccess.Set(ValueRef.nil(PortType.FLOAT)))),
        compiled.instanceOf("set").getNodeType());
  }

  @Test
  void testFirstSetterWins() {
    GraphNode first = setter("first", "v", PortType.INTEGER);
    GraphNode second = setter("second", "v", PortType.INTEGER);
    GraphNode get = getter("get", "v", PortType.INTEGER);
    CompiledGraph compiled = compile(List.of(get, first, second), List.of());
    VariableAccess access =
        ((AtomicType.Variable) ((NodeType.Atomic) compiled.instanceOf("get").getNodeType()).type())
            .access();
    assertEquals(compiled.identityOf("first"), access.ref().instanceId());
  }

  @Test
  void testFlaggedVariableNodes() {
    GraphNode producer = constant("n", PortType.INTEGER, 7);
    GraphNode set =
        GraphNode.builder()
            .id("set")
            .kind("counter")
            .variableId("v-1")
            .getter(false)
            .inputs(ports(port("value", PortType.INTEGER)))
            .build();
    GraphNode get =
        GraphNode.builder()
            .id("get")
            .kind("counter")
            .variableId("v-1")
            .getter(true)
            .outputs(ports(port("value", PortType.INTEGER)))
            .build();
    CompiledGraph compiled =
        compile(List.of(producer, set, get), List.of(GraphEdge.of("n", "value", "set", "value")));
    assertEquals(
        List.of(Binding.orderingOnly(PortType.INTEGER, compiled.identityOf("set"), 0)),
        compiled.instanceOf("get").getInputs());
  }

  @Test
  void testVariablePairCompilesWithoutStorageInstance() {
    GraphNode producer = constant("text", PortType.STRING, "hello");
    GraphNode set = setter("set", "greeting", PortType.STRING);
    GraphNode get = getter("get", "greeting", PortType.STRING);
    GraphNode print = node("p", "print", ports(port("in", PortType.STRING)), ports());
    Program program =
        new GraphCompiler(CompilerOptions.defaults(), sequentialIds())
            .compile(
                Graph.of(
                    List.of(producer, set, get, print),
                    List.of(
                        GraphEdge.of("text", "value", "set", "value"),
                        GraphEdge.of("get", "value", "p", "in"))));
    assertEquals(4, program.getInstances().size());
    assertEquals(0, program.countCasts());
  }
}
