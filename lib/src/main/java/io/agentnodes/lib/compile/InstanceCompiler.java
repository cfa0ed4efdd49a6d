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
import io.agentnodes.api.graph.GraphEdge;
import io.agentnodes.api.graph.GraphNode;
import io.agentnodes.api.graph.LiteralValue;
import io.agentnodes.api.graph.Port;
import io.agentnodes.api.graph.PortType;
import io.agentnodes.api.ir.AtomicType;
import io.agentnodes.api.ir.BinaryOperator;
import io.agentnodes.api.ir.Binding;
import io.agentnodes.api.ir.ControlType;
import io.agentnodes.api.ir.Instance;
import io.agentnodes.api.ir.IoType;
import io.agentnodes.api.ir.LogicalOperator;
import io.agentnodes.api.ir.NodeType;
import io.agentnodes.api.ir.OpenTarget;
import io.agentnodes.api.ir.Tagged;
import io.agentnodes.api.ir.UnaryOperator;
import io.agentnodes.api.ir.ValueRef;
import io.agentnodes.api.ir.VariableAccess;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Compiles every node of a structurally valid graph into one {@link Instance}, in graph order.
 * Identities are all drawn up front so that forward references (edges, variable pairs) resolve.
 */
@Slf4j
public class InstanceCompiler {
  private final CompilerOptions options;
  private final IdentityGenerator identityGenerator;

  public InstanceCompiler(CompilerOptions options, IdentityGenerator identityGenerator) {
    this.options = Preconditions.checkNotNull(options);
    this.identityGenerator = Preconditions.checkNotNull(identityGenerator);
  }

  public CompiledGraph compile(GraphIndex index) {
    Map<String, UUID> identities = new LinkedHashMap<>();
    for (GraphNode node : index.nodes()) {
      identities.put(node.getId(), identityGenerator.next());
    }

    EdgeResolver edgeResolver = new EdgeResolver(index, identities, options);
    VariableResolver variableResolver = new VariableResolver(index, identities, edgeResolver);

    Map<UUID, Instance> instances = new LinkedHashMap<>();
    for (GraphNode node : index.nodes()) {
      NodeKind kind = NodeKind.classify(node, options);
      Instance instance =
          Instance.builder()
              .nodeType(nodeType(node, kind, identities, variableResolver))
              .outputs(outputTypes(node, kind))
              .inputs(inputBindings(node, kind, index, edgeResolver, variableResolver))
              .origin(node.getId())
              .build();
      instances.put(identities.get(node.getId()), instance);
      log.debug(
          "compiled node {} ({}) into instance {}",
          node.getId(),
          kind,
          identities.get(node.getId()));
    }
    return new CompiledGraph(identities, instances);
  }

  List<PortType> outputTypes(GraphNode node, NodeKind kind) {
    switch (kind) {
      case FINISH:
        return types(node.getInputs());
      case PRINT:
        return List.of(PortType.NONE);
      case VARIABLE_SET:
        if (CollectionUtils.isEmpty(node.getOutputs())) {
          return types(node.getInputs());
        }
        return types(node.getOutputs());
      default:
        return types(node.getOutputs());
    }
  }

  NodeType nodeType(
      GraphNode node,
      NodeKind kind,
      Map<String, UUID> identities,
      VariableResolver variableResolver) {
    return switch (kind) {
      case START -> atomic(new AtomicType.Control(ControlType.START));
      case FINISH -> atomic(new AtomicType.Control(ControlType.END));
      case CONSTANT -> atomic(new AtomicType.Value(node.getLiterals().get(0).getValue()));
      case BINARY_OPERATION -> atomic(
          new AtomicType.BinOp(operator(node, BinaryOperator.class, BinaryOperator.ADD)));
      case UNARY_OPERATION -> atomic(
          new AtomicType.UnOp(operator(node, UnaryOperator.class, UnaryOperator.NEG)));
      case LOGICAL_OPERATION -> atomic(
          new AtomicType.Logic(operator(node, LogicalOperator.class, LogicalOperator.AND)));
      case PRINT -> atomic(new AtomicType.Named(NodeKinds.TAG_PRINT));
      case OPEN_SOCKET -> atomic(new AtomicType.Io(new IoType.Open(OpenTarget.TCP_SOCKET)));
      case OPEN_FILE -> atomic(new AtomicType.Io(new IoType.Open(OpenTarget.FILE)));
      case READ_LINE -> atomic(new AtomicType.Io(IoType.GET_LINE));
      case WRITE -> atomic(new AtomicType.Io(IoType.WRITE));
      case READ -> atomic(new AtomicType.Io(IoType.READ));
      case WHILE -> atomic(
          new AtomicType.Control(new ControlType.While(literalRef(node, identities))));
      case WAIT_FOR_INIT -> atomic(
          new AtomicType.Control(new ControlType.WaitForInit(literalRef(node, identities))));
      case VARIABLE_GET -> atomic(
          new AtomicType.Variable(new VariableAccess.Get(variableResolver.getterRef(node))));
      case VARIABLE_SET -> atomic(
          new AtomicType.Variable(new VariableAccess.Set(variableResolver.setterRef(node))));
      case LIBRARY -> NodeType.complex(node.getKind() + options.getLibraryDocumentExtension());
      case UNRECOGNIZED -> {
        log.debug(
            "node {} has unrecognized kind {}, passing it through", node.getId(), node.getKind());
        yield atomic(new AtomicType.Named(node.getKind()));
      }
    };
  }

  List<Binding> inputBindings(
      GraphNode node,
      NodeKind kind,
      GraphIndex index,
      EdgeResolver edgeResolver,
      VariableResolver variableResolver) {
    List<Binding> bindings = new ArrayList<>();
    for (GraphEdge edge : index.upstreamEdges(node.getId())) {
      bindings.add(edgeResolver.resolve(edge));
    }
    if (kind == NodeKind.VARIABLE_GET) {
      variableResolver.schedulingDependency(node).ifPresent(bindings::add);
    }
    return bindings;
  }

  /**
   * Reference baked into the node's literals: the first literal names the referenced node (or
   * instance identity) and carries the type, the optional second literal is the output index.
   */
  ValueRef literalRef(GraphNode node, Map<String, UUID> identities) {
    List<LiteralValue> literals = ListUtils.emptyIfNull(node.getLiterals());
    if (literals.isEmpty() || literals.get(0) == null) {
      log.debug("node {} carries no reference literal, referencing nil", node.getId());
      return ValueRef.nil(PortType.NONE);
    }
    LiteralValue target = literals.get(0);
    PortType type = target.getType() == null ? PortType.NONE : target.getType();
    String reference = target.getValue() == null ? null : String.valueOf(target.getValue());

    UUID id = identities.get(reference);
    if (id == null) {
      try {
        id = reference == null ? ValueRef.NIL_ID : UUID.fromString(reference);
      } catch (IllegalArgumentException e) {
        log.debug("node {} references unknown value {}, referencing nil", node.getId(), reference);
        id = ValueRef.NIL_ID;
      }
    }

    int outputIndex = 0;
    if (literals.size() > 1 && literals.get(1) != null && literals.get(1).getValue() != null) {
      outputIndex = NumberUtils.toInt(String.valueOf(literals.get(1).getValue()), 0);
    }
    return new ValueRef(type, id, outputIndex);
  }

  private <E extends Enum<E> & Tagged> E operator(GraphNode node, Class<E> type, E fallback) {
    List<LiteralValue> literals = ListUtils.emptyIfNull(node.getLiterals());
    Object selector =
        literals.isEmpty() || literals.get(0) == null ? null : literals.get(0).getValue();
    return Tagged.fromTag(type, selector)
        .orElseGet(
            () -> {
              log.debug(
                  "node {} has invalid {} selector {}, using {}",
                  node.getId(),
                  type.getSimpleName(),
                  selector,
                  fallback.getTag());
              return fallback;
            });
  }

  private static NodeType atomic(AtomicType type) {
    return NodeType.atomic(type);
  }

  private static List<PortType> types(List<Port> ports) {
    return ListUtils.emptyIfNull(ports).stream()
        .map(p -> p == null || p.getType() == null ? PortType.NONE : p.getType())
        .collect(Collectors.toList());
  }
}
