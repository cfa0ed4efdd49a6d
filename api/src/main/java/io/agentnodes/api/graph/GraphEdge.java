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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Directed connection {@code (source, sourcePort) -> (target, targetPort)}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphEdge {
  private String id;
  private String source;
  private String sourcePort;
  private String target;
  private String targetPort;

  public static GraphEdge of(String source, String sourcePort, String target, String targetPort) {
    return new GraphEdge(null, source, sourcePort, target, targetPort);
  }

  public String describe() {
    String route = String.format("%s:%s -> %s:%s", source, sourcePort, target, targetPort);
    return id == null ? route : id + " (" + route + ")";
  }
}
