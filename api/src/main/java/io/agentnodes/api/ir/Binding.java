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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.agentnodes.api.graph.PortType;
import java.io.IOException;
import java.util.UUID;

/**
 * One input of an instance: the type the consumer expects, and the producing instance and output
 * index. Serialized as {@code [type, source_id, output_index]}; ordering-only bindings append a
 * trailing {@code false} (weak connection).
 *
 * @param ordering true for a scheduling dependency that carries no value and skips coercion
 */
@JsonSerialize(using = Binding.Serializer.class)
@JsonDeserialize(using = Binding.Deserializer.class)
public record Binding(PortType type, UUID sourceId, int outputIndex, boolean ordering) {

  public static Binding of(PortType type, UUID sourceId, int outputIndex) {
    return new Binding(type, sourceId, outputIndex, false);
  }

  public static Binding orderingOnly(PortType type, UUID sourceId, int outputIndex) {
    return new Binding(type, sourceId, outputIndex, true);
  }

  public Binding redirect(PortType newType, UUID newSourceId, int newOutputIndex) {
    return new Binding(newType, newSourceId, newOutputIndex, ordering);
  }

  public static class Serializer extends StdSerializer<Binding> {
    public Serializer() {
      super(Binding.class);
    }

    @Override
    public void serialize(Binding value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartArray();
      gen.writeString(value.type().getValue());
      gen.writeString(value.sourceId().toString());
      gen.writeNumber(value.outputIndex());
      if (value.ordering()) {
        gen.writeBoolean(false);
      }
      gen.writeEndArray();
    }
  }

  public static class Deserializer extends StdDeserializer<Binding> {
    public Deserializer() {
      super(Binding.class);
    }

    @Override
    public Binding deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonNode node = p.readValueAsTree();
      if (node == null || !node.isArray() || node.size() < 3 || node.size() > 4) {
        throw JsonMappingException.from(
            p, "binding must be [type, source_id, output_index(, strong)]: " + node);
      }
      PortType type = PortType.fromValue(node.get(0).asText());
      UUID sourceId;
      try {
        sourceId = UUID.fromString(node.get(1).asText());
      } catch (IllegalArgumentException e) {
        throw JsonMappingException.from(p, "invalid binding source id: " + node.get(1), e);
      }
      int index = node.get(2).asInt();
      boolean ordering = node.size() == 4 && !node.get(3).asBoolean(true);
      return new Binding(type, sourceId, index, ordering);
    }
  }
}
