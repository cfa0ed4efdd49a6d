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

import static io.agentnodes.lib.compile.NodeKinds.*;

import io.agentnodes.api.graph.GraphNode;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Closed classification of a graph node. The raw kind string is inspected once, here; everything
 * downstream switches over this enum.
 */
public enum NodeKind {
  START,
  FINISH,
  CONSTANT,
  BINARY_OPERATION,
  UNARY_OPERATION,
  LOGICAL_OPERATION,
  PRINT,
  OPEN_SOCKET,
  OPEN_FILE,
  READ_LINE,
  WRITE,
  READ,
  WHILE,
  WAIT_FOR_INIT,
  VARIABLE_GET,
  VARIABLE_SET,
  LIBRARY,
  UNRECOGNIZED;

  public static NodeKind classify(GraphNode node, CompilerOptions options) {
    String kind = node.getKind();
    if (KIND_START.equals(kind)) {
      return START;
    }
    if (KIND_FINISH.equals(kind)) {
      return FINISH;
    }
    if (NodeKinds.isGetter(node)) {
      return VARIABLE_GET;
    }
    if (NodeKinds.isSetter(node)) {
      return VARIABLE_SET;
    }
    if (KIND_CONSTANT.equals(kind)
        || StringUtils.equals(node.getLibraryPath(), options.getConstantsLibraryPath())) {
      // the first literal is the payload
      return CollectionUtils.isEmpty(node.getLiterals()) || node.getLiterals().get(0) == null
          ? UNRECOGNIZED
          : CONSTANT;
    }
    if (StringUtils.isBlank(kind)) {
      return UNRECOGNIZED;
    }
    NodeKind builtIn =
        switch (kind) {
          case KIND_BINARY_OPERATION -> BINARY_OPERATION;
          case KIND_UNARY_OPERATION -> UNARY_OPERATION;
          case KIND_LOGICAL_OPERATION -> LOGICAL_OPERATION;
          case KIND_TCP_SOCKET, KIND_OPEN_SOCKET -> OPEN_SOCKET;
          case KIND_OPEN_FILE -> OPEN_FILE;
          case KIND_GET_LINE, KIND_READ_LINE -> READ_LINE;
          case KIND_WRITE -> WRITE;
          case KIND_READ -> READ;
          case KIND_WHILE -> WHILE;
          case KIND_WAIT_FOR_INIT -> WAIT_FOR_INIT;
          default -> null;
        };
    if (builtIn != null) {
      return builtIn;
    }
    if (options.getPrintKinds() != null && options.getPrintKinds().contains(kind)) {
      return PRINT;
    }
    if (StringUtils.startsWith(node.getLibraryPath(), options.getLibraryPathPrefix())) {
      return LIBRARY;
    }
    return UNRECOGNIZED;
  }
}
