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
package io.agentnodes.lib.utils;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.type.TypeReference;
import io.agentnodes.api.graph.Graph;
import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import io.agentnodes.api.graph.Port;
import io.agentnodes.api.graph.PortType;
import io.agentnodes.lib.compile.CompilerOptions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SerializationUtilsTest {

  @Test
  void testCompilerOptionsFromYaml() throws IOException {
    CompilerOptions options =
        YamlUtils.fromYamlResource("/compiler_options.yml", new TypeReference<>() {});
    assertEquals(Set.of("print", "log"), options.getPrintKinds());
    assertEquals("library/", options.getLibraryPathPrefix());
    assertEquals(".program.json", options.getLibraryDocumentExtension());
    assertEquals(PortType.STRING, options.getUnmatchedInputType());
    // not in the file
    assertEquals(CompilerOptions.DEFAULT_CONSTANTS_LIBRARY_PATH, options.getConstantsLibraryPath());
  }

  @Test
  void testGraphJsonIsReadableAsYaml() {
    Graph graph =
        Graph.of(
            List.of(
                GraphNode.builder()
                    .id("s")
                    .kind("start")
                    .outputs(List.of(Port.of("x", PortType.INTEGER)))
                    .build()),
            List.of(GraphEdge.of("s", "x", "s", "y")));
    String json = JsonUtils.toJsonString(graph);
    assertEquals(graph, YamlUtils.fromYamlString(json, new TypeReference<Graph>() {}));
    assertEquals(graph, JsonUtils.fromJsonString(json, Graph.class));
  }

  @Test
  void testTrailingTokensRejected() {
    assertThrows(
        RuntimeException.class, () -> JsonUtils.fromJsonString("{\"nodes\":[]} {}", Graph.class));
  }

  @Test
  void testMiscUtils() {
    String encoded = MiscUtils.toBase64String("graph".getBytes(StandardCharsets.UTF_8));
    assertEquals("graph", new String(MiscUtils.fromBase64String(encoded), StandardCharsets.UTF_8));
    assertNull(MiscUtils.toBase64String(null));
    assertTrue(MiscUtils.validArrayIndex(List.of(1, 2), 1));
    assertFalse(MiscUtils.validArrayIndex(List.of(1, 2), 2));
    assertFalse(MiscUtils.validArrayIndex(null, 0));
    assertTrue(MiscUtils.loadStringFromResource("/compiler_options.yml").contains("printKinds"));
  }
}
