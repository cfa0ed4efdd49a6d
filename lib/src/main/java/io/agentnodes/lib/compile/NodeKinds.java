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

import io.agentnodes.api.graph.GraphNode;
import org.apache.commons.lang3.StringUtils;

/** Built-in node kind tags as the editor emits them. */
public interface NodeKinds {
  String KIND_START = "start";
  String KIND_FINISH = "finish";
  String KIND_CONSTANT = "constant";
  String KIND_BINARY_OPERATION = "binary-operation";
  String KIND_UNARY_OPERATION = "unary-operation";
  String KIND_LOGICAL_OPERATION = "logical-operation";
  String KIND_PRINT = "print";
  String KIND_TCP_SOCKET = "tcp-socket";
  String KIND_OPEN_SOCKET = "open-socket";
  String KIND_OPEN_FILE = "open-file";
  String KIND_GET_LINE = "get-line";
  String KIND_READ_LINE = "read-line";
  String KIND_WRITE = "write";
  String KIND_READ = "read";
  String KIND_WHILE = "while";
  String KIND_WAIT_FOR_INIT = "wait-for-init";

  String PREFIX_VARIABLE_GET = "variable_get_";
  String PREFIX_VARIABLE_SET = "variable_set_";

  String TAG_PRINT = "Print";

  static boolean isGetter(GraphNode node) {
    if (StringUtils.startsWith(node.getKind(), PREFIX_VARIABLE_GET)) {
      return true;
    }
    return StringUtils.isNotBlank(node.getVariableId()) && Boolean.TRUE.equals(node.getGetter());
  }

  static boolean isSetter(GraphNode node) {
    if (StringUtils.startsWith(node.getKind(), PREFIX_VARIABLE_SET)) {
      return true;
    }
    return StringUtils.isNotBlank(node.getVariableId()) && !Boolean.TRUE.equals(node.getGetter());
  }

  /**
   * @return the explicit variable id, else the suffix of a {@code variable_get_}/{@code
   *     variable_set_} kind, else {@code null}
   */
  static String variableIdOf(GraphNode node) {
    if (StringUtils.isNotBlank(node.getVariableId())) {
      return node.getVariableId();
    }
    String kind = node.getKind();
    if (StringUtils.startsWith(kind, PREFIX_VARIABLE_GET)) {
      return kind.substring(PREFIX_VARIABLE_GET.length());
    }
    if (StringUtils.startsWith(kind, PREFIX_VARIABLE_SET)) {
      return kind.substring(PREFIX_VARIABLE_SET.length());
    }
    return null;
  }
}
