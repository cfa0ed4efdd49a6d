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

import io.agentnodes.api.graph.PortType;

/** Payload of {@link NodeType.Atomic}. */
public sealed interface AtomicType
    permits AtomicType.Named,
        AtomicType.Value,
        AtomicType.BinOp,
        AtomicType.UnOp,
        AtomicType.Logic,
        AtomicType.Control,
        AtomicType.Io,
        AtomicType.Variable,
        AtomicType.Cast {

  /** Payload-less atomic identified by its tag only, e.g. {@code Print} or an unrecognized kind. */
  record Named(String tag) implements AtomicType {}

  record Value(Object literal) implements AtomicType {}

  record BinOp(BinaryOperator operator) implements AtomicType {}

  record UnOp(UnaryOperator operator) implements AtomicType {}

  record Logic(LogicalOperator operator) implements AtomicType {}

  record Control(ControlType control) implements AtomicType {}

  record Io(IoType io) implements AtomicType {}

  record Variable(VariableAccess access) implements AtomicType {}

  /** One input, one output of type {@code target}. */
  record Cast(PortType target) implements AtomicType {}
}
