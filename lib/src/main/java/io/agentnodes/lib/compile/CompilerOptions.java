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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agentnodes.api.graph.PortType;
import java.util.HashSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompilerOptions {
  public static final String DEFAULT_LIBRARY_PATH_PREFIX = "complex/";
  public static final String DEFAULT_LIBRARY_DOCUMENT_EXTENSION = ".json";
  public static final String DEFAULT_CONSTANTS_LIBRARY_PATH = "atomic/constants";

  /** Kinds that always report a single sink output. */
  @Builder.Default private Set<String> printKinds = new HashSet<>(Set.of(NodeKinds.KIND_PRINT));

  /** Library locations under this prefix compile to a library reference. */
  @Builder.Default private String libraryPathPrefix = DEFAULT_LIBRARY_PATH_PREFIX;

  @Builder.Default private String libraryDocumentExtension = DEFAULT_LIBRARY_DOCUMENT_EXTENSION;
  @Builder.Default private String constantsLibraryPath = DEFAULT_CONSTANTS_LIBRARY_PATH;

  /** Expected type of an input binding whose target port cannot be matched. */
  @Builder.Default private PortType unmatchedInputType = PortType.INTEGER;

  public static CompilerOptions defaults() {
    return CompilerOptions.builder().build();
  }
}
