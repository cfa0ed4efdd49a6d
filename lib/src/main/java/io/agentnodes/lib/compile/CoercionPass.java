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

import com.google.common.base.Preconditions;
import io.agentnodes.api.CompilationError;
import io.agentnodes.api.graph.PortType;
import io.agentnodes.api.ir.AtomicType;
import io.agentnodes.api.ir.Binding;
import io.agentnodes.api.ir.Instance;
import io.agentnodes.api.ir.NodeType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Makes every input binding's declared type equal its source's actual output type.
 *
 * <pre>
 * per binding (expected, source, index):
 *    - source missing or index out of range: IdentityError
 *    - expected == actual: keep
 *    - expected is None: keep, the value is discarded
 *    - actual is None: TypeError
 *    - (actual, expected) in {@link CoercionTable}: insert Cast(expected),
 *      rebind to (expected, cast, 0)
 *    - otherwise: TypeError, binding kept as is
 * </pre>
 *
 * Ordering-only bindings are not checked. The input map is left untouched.
 */
@Slf4j
public class CoercionPass {
  private final IdentityGenerator identityGenerator;

  public CoercionPass(IdentityGenerator identityGenerator) {
    this.identityGenerator = Preconditions.checkNotNull(identityGenerator);
  }

  public record Result(
      Map<UUID, Instance> instances, List<CompilationError> errors, int castCount) {
    public boolean hasErrors() {
      return !errors.isEmpty();
    }
  }

  public Result apply(Map<UUID, Instance> instances) {
    Map<UUID, Instance> rewritten = new LinkedHashMap<>();
    Map<UUID, Instance> casts = new LinkedHashMap<>();
    List<CompilationError> errors = new ArrayList<>();

    for (Map.Entry<UUID, Instance> entry : instances.entrySet()) {
      UUID ownerId = entry.getKey();
      Instance owner = entry.getValue();
      List<Binding> inputs = owner.getInputs() == null ? List.of() : owner.getInputs();
      List<Binding> newInputs = new ArrayList<>(inputs.size());

      for (int position = 0; position < inputs.size(); position++) {
        Binding binding = inputs.get(position);
        if (binding.ordering()) {
          newInputs.add(binding);
          continue;
        }
        Instance source = instances.get(binding.sourceId());
        if (source == null) {
          errors.add(
              CompilationError.identity(
                  subject(ownerId, owner),
                  String.format(
                      "instance %s input %d references unknown instance %s",
                      subject(ownerId, owner), position, binding.sourceId())));
          newInputs.add(binding);
          continue;
        }
        PortType actual = source.outputAt(binding.outputIndex());
        if (actual == null) {
          errors.add(
              CompilationError.identity(
                  subject(ownerId, owner),
                  String.format(
                      "instance %s input %d references output %d of instance %s, which has %d"
                          + " output(s)",
                      subject(ownerId, owner),
                      position,
                      binding.outputIndex(),
                      binding.sourceId(),
                      source.getOutputs() == null ? 0 : source.getOutputs().size())));
          newInputs.add(binding);
          continue;
        }

        PortType expected = binding.type();
        if (expected == actual || expected.isSink()) {
          newInputs.add(binding);
        } else if (actual.isSink()) {
          errors.add(
              CompilationError.type(
                  subject(ownerId, owner),
                  String.format(
                      "instance %s input %d expects %s but its source %s produces None, a sink"
                          + " cannot carry a value",
                      subject(ownerId, owner),
                      position,
                      expected,
                      subject(binding.sourceId(), source))));
          newInputs.add(binding);
        } else if (CoercionTable.canCoerce(actual, expected)) {
          UUID castId = identityGenerator.next();
          Instance cast =
              Instance.builder()
                  .nodeType(NodeType.atomic(new AtomicType.Cast(expected)))
                  .outputs(new ArrayList<>(List.of(expected)))
                  .inputs(
                      new ArrayList<>(
                          List.of(Binding.of(actual, binding.sourceId(), binding.outputIndex()))))
                  .build();
          casts.put(castId, cast);
          newInputs.add(binding.redirect(expected, castId, 0));
          log.debug(
              "inserted cast {} ({} -> {}) for instance {} input {}",
              castId,
              actual,
              expected,
              subject(ownerId, owner),
              position);
        } else {
          errors.add(
              CompilationError.type(
                  subject(ownerId, owner),
                  String.format(
                      "instance %s input %d expects %s but its source %s produces %s, no coercion"
                          + " exists",
                      subject(ownerId, owner),
                      position,
                      expected,
                      subject(binding.sourceId(), source),
                      actual)));
          newInputs.add(binding);
        }
      }
      rewritten.put(ownerId, owner.toBuilder().inputs(newInputs).build());
    }

    rewritten.putAll(casts);
    if (!casts.isEmpty()) {
      log.info("coercion pass inserted {} cast instance(s)", casts.size());
    }
    return new Result(rewritten, errors, casts.size());
  }

  private static String subject(UUID id, Instance instance) {
    return instance.getOrigin() == null ? id.toString() : instance.getOrigin();
  }
}
