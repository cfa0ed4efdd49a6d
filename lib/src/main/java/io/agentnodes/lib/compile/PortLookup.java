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

import io.agentnodes.api.graph.Port;
import io.agentnodes.api.graph.PortType;
import io.agentnodes.lib.utils.MiscUtils;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/** Finds a port's position from the port id an edge carries. */
public interface PortLookup {

  /**
   * Match {@code portId} against the declared ports by id. Failing that, use the index encoded in
   * an editor handle id ({@code <input|output>-<timestamp>-<index>-<random>}) when it is in range.
   */
  static OptionalInt indexOf(List<Port> ports, String portId) {
    List<Port> declared = ListUtils.emptyIfNull(ports);
    for (int i = 0; i < declared.size(); i++) {
      if (declared.get(i) != null && Objects.equals(declared.get(i).getId(), portId)) {
        return OptionalInt.of(i);
      }
    }
    OptionalInt encoded = parseHandleIndex(portId);
    if (encoded.isPresent() && MiscUtils.validArrayIndex(declared, encoded.getAsInt())) {
      return encoded;
    }
    return OptionalInt.empty();
  }

  static OptionalInt parseHandleIndex(String handleId) {
    if (StringUtils.isBlank(handleId)) {
      return OptionalInt.empty();
    }
    String[] parts = handleId.split("-");
    if (parts.length < 3 || !NumberUtils.isDigits(parts[2])) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(NumberUtils.toInt(parts[2], 0));
  }

  static PortType typeAt(List<Port> ports, int index) {
    Port port = ports.get(index);
    return port == null || port.getType() == null ? PortType.NONE : port.getType();
  }

  static PortType firstType(List<Port> ports) {
    List<Port> declared = ListUtils.emptyIfNull(ports);
    return declared.isEmpty() ? PortType.NONE : typeAt(declared, 0);
  }
}
