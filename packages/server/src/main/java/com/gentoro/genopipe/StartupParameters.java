package com.gentoro.genopipe;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Program arguments of the form {@code --key=value} (or a bare {@code --flag}, read as {@code
 * true}). Anything else is ignored.
 */
public final class StartupParameters {
  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() <= 2) continue;
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public String getParameter(String name, String defaultValue) {
    return Objects.requireNonNullElse(parameters.get(name), defaultValue);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }

  /** Path of the YAML configuration file, or {@code null} to use the bundled one. */
  public String configFile() {
    return parameters.get("config");
  }
}
