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

public sealed interface IoType permits IoType.Open, IoType.GetLine, IoType.Write, IoType.Read {

  IoType GET_LINE = new GetLine();
  IoType WRITE = new Write();
  IoType READ = new Read();

  record Open(OpenTarget target) implements IoType {}

  record GetLine() implements IoType {}

  record Write() implements IoType {}

  record Read() implements IoType {}
}
