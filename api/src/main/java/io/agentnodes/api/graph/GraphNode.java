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
package io.agentnodes.api.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One visual node of the editor graph.
 *
 * <p>{@code kind} is either a built-in behavior tag ({@code start}, {@code binary-operation},
 * {@code variable_get_<id>}, ...) or the identifier of a reusable library definition, in which case
 * {@code libraryPath} names the library location. {@code variableId} and {@code getter} mark the
 * node as a variable getter or setter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphNode {
  private String id;
  private String kind;
  private String libraryPath;
  @Builder.Default private List<Port> inputs = new ArrayList<>();
  @Builder.Default private List<Port> outputs = new ArrayList<>();
  @Builder.Default private List<LiteralValue> literals = new ArrayList<>();
  private String variableId;
  private Boolean getter;
}
