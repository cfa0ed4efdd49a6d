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

import com.google.common.collect.ImmutableSetMultimap;
import io.agentnodes.api.graph.PortType;

/** The fixed set of implicit conversions the compiler may insert a cast for. */
public interface CoercionTable {

  ImmutableSetMultimap<PortType, PortType> ALLOWED =
      ImmutableSetMultimap.<PortType, PortType>builder()
          .putAll(PortType.INTEGER, PortType.FLOAT, PortType.STRING)
          .putAll(PortType.FLOAT, PortType.INTEGER, PortType.STRING)
          .put(PortType.BOOLEAN, PortType.STRING)
          .build();

  static boolean canCoerce(PortType actual, PortType expected) {
    return ALLOWED.containsEntry(actual, expected);
  }
}
