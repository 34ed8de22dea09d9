package com.gentoro.genopipe;

import com.gentoro.genopipe.exception.ConfigException;
import com.gentoro.genopipe.logging.LoggingService;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the application configuration from a YAML file. When no file is given, {@code
 * application.yaml} is read from the classpath. Values support Commons Configuration interpolation
 * such as {@code ${env:NCBI_API_KEY}}.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);
  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration configuration;

  public ConfigurationProvider(String configFile) {
    this.configuration = new YAMLConfiguration();
    if (configFile == null || configFile.isBlank()) {
      loadClasspath();
    } else {
      loadFile(Path.of(configFile.trim()));
    }
  }

  private void loadClasspath() {
    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new ConfigException("Bundled " + DEFAULT_RESOURCE + " not found on the classpath");
      }
      configuration.read(in);
      log.info("Loaded configuration from classpath:{}", DEFAULT_RESOURCE);
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to read bundled " + DEFAULT_RESOURCE, e);
    }
  }

  private void loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file not found: " + file.toAbsolutePath());
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      configuration.read(reader);
      log.info("Loaded configuration from {}", file.toAbsolutePath());
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration file " + file, e);
    }
  }

  public Configuration config() {
    return configuration;
  }
}
