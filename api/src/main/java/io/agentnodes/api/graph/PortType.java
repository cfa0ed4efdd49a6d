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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/** Closed set of primitive port types. {@link #NONE} is the sink type: a trigger without a value. */
@Getter
public enum PortType {
  NONE("None"),
  INTEGER("Integer"),
  FLOAT("Float"),
  STRING("String"),
  BOOLEAN("Boolean"),
  HANDLE("Handle"),
  ARRAY("Array"),
  BYTE("Byte"),
  OBJECT("Object");

  @JsonValue private final String value;

  PortType(String value) {
    this.value = value;
  }

  public boolean isSink() {
    return this == NONE;
  }

  /**
   * Parse a wire type name.
   *
   * @param value the type name, case-insensitive
   * @return the matching type, {@link #NONE} for blank or unknown names
   */
  @JsonCreator
  public static PortType fromValue(String value) {
    if (value == null || value.trim().isEmpty()) {
      return NONE;
    }
    for (PortType type : PortType.values()) {
      if (type.value.equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    return NONE;
  }

  @Override
  public String toString() {
    return value;
  }
}
