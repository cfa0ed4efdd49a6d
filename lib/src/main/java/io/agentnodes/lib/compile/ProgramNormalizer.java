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

import io.agentnodes.api.ir.AtomicType;
import io.agentnodes.api.ir.ControlType;
import io.agentnodes.api.ir.Instance;
import io.agentnodes.api.ir.NodeType;
import io.agentnodes.api.ir.Program;
import io.agentnodes.api.ir.ValueRef;
import io.agentnodes.api.ir.VariableAccess;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Renames instance identities to {@code 00000000-0000-0000-0000-00000000000n}, n counting from 1 in
 * instance map order. Two compiles of the same graph normalize to equal programs. The nil identity
 * and identities that are not instance keys are left alone.
 */
public class ProgramNormalizer {

  public Program normalize(Program program) {
    Map<UUID, UUID> renames = new HashMap<>();
    long next = 1;
    for (UUID id : program.getInstances().keySet()) {
      renames.put(id, new UUID(0L, next++));
    }

    Map<UUID, Instance> instances = new LinkedHashMap<>();
    program
        .getInstances()
        .forEach(
            (id, instance) ->
                instances.put(
                    renames.get(id),
                    instance.toBuilder()
                        .nodeType(rename(instance.getNodeType(), renames))
                        .inputs(
                            instance.getInputs().stream()
                                .map(
                                    b ->
                                        b.redirect(
                                            b.type(),
                                            rename(b.sourceId(), renames),
                                            b.outputIndex()))
                                .collect(Collectors.toList()))
                        .build()));

    String endNode = program.getEndNode();
    if (StringUtils.isNotBlank(endNode)) {
      endNode = rename(UUID.fromString(endNode), renames).toString();
    }
    return Program.builder()
        .inputs(program.getInputs())
        .outputs(program.getOutputs())
        .defaults(program.getDefaults())
        .instances(instances)
        .endNode(endNode)
        .build();
  }

  private static NodeType rename(NodeType nodeType, Map<UUID, UUID> renames) {
    if (!(nodeType instanceof NodeType.Atomic atomic)) {
      return nodeType;
    }
    AtomicType type = atomic.type();
    if (type instanceof AtomicType.Control control) {
      if (control.control() instanceof ControlType.While w) {
        return NodeType.atomic(
            new AtomicType.Control(new ControlType.While(rename(w.condition(), renames))));
      }
      if (control.control() instanceof ControlType.WaitForInit wait) {
        return NodeType.atomic(
            new AtomicType.Control(new ControlType.WaitForInit(rename(wait.value(), renames))));
      }
    } else if (type instanceof AtomicType.Variable variable) {
      if (variable.access() instanceof VariableAccess.Get get) {
        return NodeType.atomic(
            new AtomicType.Variable(new VariableAccess.Get(rename(get.ref(), renames))));
      }
      if (variable.access() instanceof VariableAccess.Set set) {
        return NodeType.atomic(
            new AtomicType.Variable(new VariableAccess.Set(rename(set.ref(), renames))));
      }
    }
    return nodeType;
  }

  private static ValueRef rename(ValueRef ref, Map<UUID, UUID> renames) {
    return new ValueRef(ref.type(), rename(ref.instanceId(), renames), ref.outputIndex());
  }

  private static UUID rename(UUID id, Map<UUID, UUID> renames) {
    return renames.getOrDefault(id, id);
  }
}
