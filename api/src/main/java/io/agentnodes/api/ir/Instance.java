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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.agentnodes.api.graph.PortType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/** Compiled form of one graph node, or of a synthesized cast. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"node_type", "default_overrides", "outputs", "inputs"})
public class Instance {
  @JsonProperty("node_type")
  private NodeType nodeType;

  /** Reserved. Always empty. */
  @JsonProperty("default_overrides")
  @Builder.Default
  private Map<String, Object> defaultOverrides = new HashMap<>();

  @Builder.Default private List<PortType> outputs = new ArrayList<>();
  @Builder.Default private List<Binding> inputs = new ArrayList<>();

  /** Id of the graph node this instance came from; {@code null} for synthesized instances. */
  @JsonIgnore @EqualsAndHashCode.Exclude private String origin;

  /**
   * @return the output type at {@code index}, or {@code null} when the index is out of range
   */
  public PortType outputAt(int index) {
    if (outputs == null || index < 0 || index >= outputs.size()) {
      return null;
    }
    return outputs.get(index);
  }

  @JsonIgnore
  public boolean isCast() {
    return nodeType instanceof NodeType.Atomic atomic && atomic.type() instanceof AtomicType.Cast;
  }
}
