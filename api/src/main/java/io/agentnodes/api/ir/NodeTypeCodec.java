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
package io.agentnodes.api.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentnodes.api.graph.PortType;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;

/**
 * Tree form of {@link NodeType}: every variant family is an object with exactly one discriminant
 * key, payload-less leaves are plain strings, and value references are {@code [type, id, index]}
 * arrays.
 */
public final class NodeTypeCodec {
  public static final String ATOMIC = "Atomic";
  public static final String COMPLEX = "Complex";
  public static final String VALUE = "Value";
  public static final String BIN_OP = "BinOp";
  public static final String UN_OP = "UnOp";
  public static final String LOGIC = "Logic";
  public static final String CONTROL = "Control";
  public static final String IO = "Io";
  public static final String VARIABLE = "Variable";
  public static final String CAST = "Cast";
  public static final String START = "Start";
  public static final String END = "End";
  public static final String WHILE = "While";
  public static final String WAIT_FOR_INIT = "WaitForInit";
  public static final String OPEN = "Open";
  public static final String GET_LINE = "GetLine";
  public static final String WRITE = "Write";
  public static final String READ = "Read";
  public static final String GET = "Get";
  public static final String SET = "Set";

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private NodeTypeCodec() {}

  public static JsonNode toTree(NodeType nodeType) {
    if (nodeType instanceof NodeType.Complex complex) {
      return tagged(COMPLEX, NODES.textNode(complex.path()));
    }
    if (nodeType instanceof NodeType.Atomic atomic) {
      return tagged(ATOMIC, atomicToTree(atomic.type()));
    }
    throw new IllegalArgumentException("unsupported node type: " + nodeType);
  }

  public static NodeType fromTree(JsonNode tree) {
    Map.Entry<String, JsonNode> entry = singleEntry(tree);
    return switch (entry.getKey()) {
      case ATOMIC -> NodeType.atomic(atomicFromTree(entry.getValue()));
      case COMPLEX -> NodeType.complex(text(entry.getValue()));
      default -> throw invalid(tree);
    };
  }

  private static JsonNode atomicToTree(AtomicType type) {
    if (type instanceof AtomicType.Named named) {
      return NODES.textNode(named.tag());
    }
    if (type instanceof AtomicType.Value value) {
      JsonNode literal = MAPPER.valueToTree(value.literal());
      return tagged(VALUE, literal == null ? NODES.nullNode() : literal);
    }
    if (type instanceof AtomicType.BinOp op) {
      return tagged(BIN_OP, NODES.textNode(op.operator().getTag()));
    }
    if (type instanceof AtomicType.UnOp op) {
      return tagged(UN_OP, NODES.textNode(op.operator().getTag()));
    }
    if (type instanceof AtomicType.Logic op) {
      return tagged(LOGIC, NODES.textNode(op.operator().getTag()));
    }
    if (type instanceof AtomicType.Control control) {
      return tagged(CONTROL, controlToTree(control.control()));
    }
    if (type instanceof AtomicType.Io io) {
      return tagged(IO, ioToTree(io.io()));
    }
    if (type instanceof AtomicType.Variable variable) {
      VariableAccess access = variable.access();
      String tag = access instanceof VariableAccess.Get ? GET : SET;
      return tagged(VARIABLE, tagged(tag, refToTree(access.ref())));
    }
    if (type instanceof AtomicType.Cast cast) {
      return tagged(CAST, NODES.textNode(cast.target().getValue()));
    }
    throw new IllegalArgumentException("unsupported atomic type: " + type);
  }

  private static JsonNode controlToTree(ControlType control) {
    if (control instanceof ControlType.Start) {
      return NODES.textNode(START);
    }
    if (control instanceof ControlType.End) {
      return NODES.textNode(END);
    }
    if (control instanceof ControlType.While w) {
      return tagged(WHILE, refToTree(w.condition()));
    }
    if (control instanceof ControlType.WaitForInit w) {
      return tagged(WAIT_FOR_INIT, refToTree(w.value()));
    }
    throw new IllegalArgumentException("unsupported control type: " + control);
  }

  private static JsonNode ioToTree(IoType io) {
    if (io instanceof IoType.Open open) {
      return tagged(OPEN, NODES.textNode(open.target().getTag()));
    }
    if (io instanceof IoType.GetLine) {
      return NODES.textNode(GET_LINE);
    }
    if (io instanceof IoType.Write) {
      return NODES.textNode(WRITE);
    }
    if (io instanceof IoType.Read) {
      return NODES.textNode(READ);
    }
    throw new IllegalArgumentException("unsupported io type: " + io);
  }

  private static AtomicType atomicFromTree(JsonNode tree) {
    if (tree.isTextual()) {
      return new AtomicType.Named(tree.textValue());
    }
    Map.Entry<String, JsonNode> entry = singleEntry(tree);
    JsonNode payload = entry.getValue();
    return switch (entry.getKey()) {
      case VALUE -> new AtomicType.Value(MAPPER.convertValue(payload, Object.class));
      case BIN_OP ->
          new AtomicType.BinOp(
              Tagged.fromTag(BinaryOperator.class, text(payload))
                  .orElseThrow(() -> invalid(tree)));
      case UN_OP ->
          new AtomicType.UnOp(
              Tagged.fromTag(UnaryOperator.class, text(payload)).orElseThrow(() -> invalid(tree)));
      case LOGIC ->
          new AtomicType.Logic(
              Tagged.fromTag(LogicalOperator.class, text(payload))
                  .orElseThrow(() -> invalid(tree)));
      case CONTROL -> new AtomicType.Control(controlFromTree(payload));
      case IO -> new AtomicType.Io(ioFromTree(payload));
      case VARIABLE -> new AtomicType.Variable(variableFromTree(payload));
      case CAST -> new AtomicType.Cast(PortType.fromValue(text(payload)));
      default -> throw invalid(tree);
    };
  }

  private static ControlType controlFromTree(JsonNode tree) {
    if (tree.isTextual()) {
      return switch (tree.textValue()) {
        case START -> ControlType.START;
        case END -> ControlType.END;
        default -> throw invalid(tree);
      };
    }
    Map.Entry<String, JsonNode> entry = singleEntry(tree);
    return switch (entry.getKey()) {
      case WHILE -> new ControlType.While(refFromTree(entry.getValue()));
      case WAIT_FOR_INIT -> new ControlType.WaitForInit(refFromTree(entry.getValue()));
      default -> throw invalid(tree);
    };
  }

  private static IoType ioFromTree(JsonNode tree) {
    if (tree.isTextual()) {
      return switch (tree.textValue()) {
        case GET_LINE -> IoType.GET_LINE;
        case WRITE -> IoType.WRITE;
        case READ -> IoType.READ;
        default -> throw invalid(tree);
      };
    }
    Map.Entry<String, JsonNode> entry = singleEntry(tree);
    if (!OPEN.equals(entry.getKey())) {
      throw invalid(tree);
    }
    return new IoType.Open(
        Tagged.fromTag(OpenTarget.class, text(entry.getValue())).orElseThrow(() -> invalid(tree)));
  }

  private static VariableAccess variableFromTree(JsonNode tree) {
    Map.Entry<String, JsonNode> entry = singleEntry(tree);
    return switch (entry.getKey()) {
      case GET -> new VariableAccess.Get(refFromTree(entry.getValue()));
      case SET -> new VariableAccess.Set(refFromTree(entry.getValue()));
      default -> throw invalid(tree);
    };
  }

  private static JsonNode refToTree(ValueRef ref) {
    ArrayNode array = NODES.arrayNode();
    array.add(ref.type().getValue());
    array.add(ref.instanceId().toString());
    array.add(ref.outputIndex());
    return array;
  }

  private static ValueRef refFromTree(JsonNode tree) {
    if (!tree.isArray() || tree.size() != 3) {
      throw invalid(tree);
    }
    UUID id;
    try {
      id = UUID.fromString(tree.get(1).asText());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("invalid instance id in reference: " + tree, e);
    }
    return new ValueRef(PortType.fromValue(tree.get(0).asText()), id, tree.get(2).asInt());
  }

  private static ObjectNode tagged(String tag, JsonNode payload) {
    ObjectNode node = NODES.objectNode();
    node.set(tag, payload);
    return node;
  }

  private static Map.Entry<String, JsonNode> singleEntry(JsonNode tree) {
    if (tree == null || !tree.isObject() || tree.size() != 1) {
      throw invalid(tree);
    }
    Iterator<Map.Entry<String, JsonNode>> it = tree.fields();
    return it.next();
  }

  private static String text(JsonNode node) {
    if (node == null || !node.isTextual()) {
      throw invalid(node);
    }
    return node.textValue();
  }

  private static IllegalArgumentException invalid(JsonNode tree) {
    return new IllegalArgumentException("invalid node_type: " + tree);
  }
}
