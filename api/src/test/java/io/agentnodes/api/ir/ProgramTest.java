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

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentnodes.api.graph.PortType;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ProgramTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final UUID START_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
  private static final UUID END_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");

  @Test
  void testBindingWireForm() throws JsonProcessingException {
    assertEquals(
        "[\"Integer\",\"" + START_ID + "\",0]",
        MAPPER.writeValueAsString(Binding.of(PortType.INTEGER, START_ID, 0)));
    assertEquals(
        "[\"String\",\"" + START_ID + "\",0,false]",
        MAPPER.writeValueAsString(Binding.orderingOnly(PortType.STRING, START_ID, 0)));

    Binding ordering =
        MAPPER.readValue("[\"String\",\"" + START_ID + "\",0,false]", Binding.class);
    assertTrue(ordering.ordering());
    Binding strong = MAPPER.readValue("[\"String\",\"" + START_ID + "\",2,true]", Binding.class);
    assertFalse(strong.ordering());
    assertEquals(2, strong.outputIndex());
  }

  @Test
  void testBindingRejectsMalformedArray() {
    assertThrows(
        JsonProcessingException.class,
        () -> MAPPER.readValue("[\"Integer\",\"" + START_ID + "\"]", Binding.class));
    assertThrows(
        JsonProcessingException.class,
        () -> MAPPER.readValue("[\"Integer\",\"not-a-uuid\",0]", Binding.class));
  }

  @Test
  void testProgramDocumentKeys() throws JsonProcessingException {
    Program program = sampleProgram();
    Map<String, Object> document =
        MAPPER.readValue(MAPPER.writeValueAsString(program), new TypeReference<>() {});
    assertEquals(
        List.of("inputs", "outputs", "defaults", "instances", "end_node"),
        List.copyOf(document.keySet()));
    assertEquals(END_ID.toString(), document.get("end_node"));

    @SuppressWarnings("unchecked")
    Map<String, Map<String, Object>> instances =
        (Map<String, Map<String, Object>>) document.get("instances");
    assertEquals(
        List.of("node_type", "default_overrides", "outputs", "inputs"),
        List.copyOf(instances.get(END_ID.toString()).keySet()));
    assertEquals(List.of("Integer"), instances.get(END_ID.toString()).get("outputs"));
  }

  @Test
  void testProgramRoundTrip() throws JsonProcessingException {
    Program program = sampleProgram();
    Program decoded = MAPPER.readValue(MAPPER.writeValueAsString(program), Program.class);
    assertEquals(program, decoded);
    assertEquals(0, decoded.countCasts());
  }

  private static Program sampleProgram() {
    Instance start =
        Instance.builder()
            .nodeType(NodeType.atomic(new AtomicType.Control(ControlType.START)))
            .outputs(List.of(PortType.INTEGER))
            .build();
    Instance end =
        Instance.builder()
            .nodeType(NodeType.atomic(new AtomicType.Control(ControlType.END)))
            .outputs(List.of(PortType.INTEGER))
            .inputs(List.of(Binding.of(PortType.INTEGER, START_ID, 0)))
            .build();
    Program program =
        Program.builder()
            .inputs(List.of(PortType.INTEGER))
            .outputs(List.of(PortType.INTEGER))
            .endNode(END_ID.toString())
            .build();
    program.getInstances().put(START_ID, start);
    program.getInstances().put(END_ID, end);
    return program;
  }
}
