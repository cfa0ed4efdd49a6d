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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.agentnodes.api.graph.PortType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The compiled program document consumed by the runtime.
 *
 * <p>{@code instances} is closed: every identity referenced by an input binding is a key of the
 * same map. {@code endNode} is empty only when the source graph had no nodes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"inputs", "outputs", "defaults", "instances", "end_node"})
public class Program {
  @Builder.Default private List<PortType> inputs = new ArrayList<>();
  @Builder.Default private List<PortType> outputs = new ArrayList<>();

  /** Reserved. Always empty. */
  @Builder.Default private Map<String, Object> defaults = new HashMap<>();

  @Builder.Default private Map<UUID, Instance> instances = new LinkedHashMap<>();

  @JsonProperty("end_node")
  @Builder.Default
  private String endNode = "";

  public Instance instance(UUID id) {
    return instances.get(id);
  }

  public long countCasts() {
    return instances.values().stream().filter(Instance::isCast).count();
  }
}
