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
package io.agentnodes.lib.utils;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.function.Function;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.io.IOUtils;

public interface MiscUtils {

  String REGEX_WINDOWS_LINE_SEPARATOR = "\\r\\n";
  String REGEX_LINUX_LINE_SEPARATOR = "\n";

  static String loadStringFromResource(String resourceName) {
    try (InputStream in = MiscUtils.class.getResourceAsStream(resourceName)) {
      Preconditions.checkNotNull(in, "resource not found: %s", resourceName);
      return IOUtils.toString(in, StandardCharsets.UTF_8)
          .replaceAll(REGEX_WINDOWS_LINE_SEPARATOR, REGEX_LINUX_LINE_SEPARATOR);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  static String toBase64String(byte[] bytes) {
    if (bytes == null) {
      return null;
    }
    return Base64.getEncoder().encodeToString(bytes);
  }

  static byte[] fromBase64String(String base64String) {
    return Base64.getDecoder().decode(base64String);
  }

  static <T> T getOptionalCommandArgValue(
      CommandLine cmd, String argName, Function<String, T> func, T defaultValue) {
    if (!cmd.hasOption(argName)) {
      return defaultValue;
    }
    String value = cmd.getOptionValue(argName);
    return func.apply(value);
  }

  static <T> boolean validArrayIndex(List<T> array, int index) {
    return array != null && index >= 0 && index < array.size();
  }
}
