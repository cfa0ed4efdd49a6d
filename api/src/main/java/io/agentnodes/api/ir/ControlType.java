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

public sealed interface ControlType
    permits ControlType.Start, ControlType.End, ControlType.While, ControlType.WaitForInit {

  ControlType START = new Start();
  ControlType END = new End();

  record Start() implements ControlType {}

  record End() implements ControlType {}

  record While(ValueRef condition) implements ControlType {}

  record WaitForInit(ValueRef value) implements ControlType {}
}
