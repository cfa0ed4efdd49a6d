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

import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import io.agentnodes.api.graph.PortType;
import io.agentnodes.api.ir.Binding;
import io.agentnodes.api.ir.ValueRef;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Desugars variables into references. A getter becomes {@code (type, setter, 0)} plus an
 * ordering-only dependency on the setter; a setter re-exposes the binding of the edge feeding it.
 * Missing counterparts resolve to {@link ValueRef#NIL_ID}.
 */
@Slf4j
class VariableResolver {
  private final GraphIndex index;
  private final Map<String, UUID> identities;
  private final EdgeResolver edgeResolver;
  private final Map<String, GraphNode> settersByVariable = new HashMap<>();

  VariableResolver(GraphIndex index, Map<String, UUID> identities, EdgeResolver edgeResolver) {
    this.index = index;
    this.identities = identities;
    this.edgeResolver = edgeResolver;
    for (GraphNode node : index.nodes()) {
      if (!NodeKinds.isSetter(node) || NodeKinds.isGetter(node)) {
        continue;
      }
      String variableId = NodeKinds.variableIdOf(node);
      if (variableId == null) {
        continue;
      }
      GraphNode existing = settersByVariable.putIfAbsent(variableId, node);
      if (existing != null) {
        log.warn(
            "variable {} has more than one setter ({}, {}), using {}",
            variableId,
            existing.getId(),
            node.getId(),
            existing.getId());
      }
    }
  }

  ValueRef getterRef(GraphNode getter) {
    PortType type = PortLookup.firstType(getter.getOutputs());
    return pairedSetter(getter)
        .map(setter -> new ValueRef(type, identities.get(setter.getId()), 0))
        .orElseGet(
            () -> {
              log.warn(
                  "variable getter {} has no setter for variable {}, referencing nil",
                  getter.getId(),
                  NodeKinds.variableIdOf(getter));
              return ValueRef.nil(type);
            });
  }

  ValueRef setterRef(GraphNode setter) {
    List<GraphEdge> feeding = index.upstreamEdges(setter.getId());
    if (feeding.isEmpty()) {
      log.debug("variable setter {} has no incoming edge, referencing nil", setter.getId());
      return ValueRef.nil(PortLookup.firstType(setter.getInputs()));
    }
    Binding binding = edgeResolver.resolve(feeding.get(0));
    return new ValueRef(binding.type(), binding.sourceId(), binding.outputIndex());
  }

  /** Ordering-only binding that sequences the paired setter before the getter. */
  Optional<Binding> schedulingDependency(GraphNode getter) {
    PortType type = PortLookup.firstType(getter.getOutputs());
    return pairedSetter(getter)
        .map(setter -> Binding.orderingOnly(type, identities.get(setter.getId()), 0));
  }

  private Optional<GraphNode> pairedSetter(GraphNode getter) {
    String variableId = NodeKinds.variableIdOf(getter);
    return Optional.ofNullable(variableId == null ? null : settersByVariable.get(variableId));
  }
}
