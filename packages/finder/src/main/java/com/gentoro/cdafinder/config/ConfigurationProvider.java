package com.gentoro.cdafinder.config;

import com.gentoro.cdafinder.exception.ConfigurationException;
import com.gentoro.cdafinder.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the finder configuration.
 *
 * <p>Lookup order, first match wins:
 *
 * <ol>
 *   <li>JVM system properties (for example {@code -Doutput.format=text})
 *   <li>the user supplied YAML file, when given
 *   <li>the bundled {@value #DEFAULTS_RESOURCE}
 * </ol>
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULTS_RESOURCE = "cda-finder.yaml";

  private final CompositeConfiguration configuration;

  public ConfigurationProvider(Path configFile) {
    this.configuration = new CompositeConfiguration();
    configuration.addConfiguration(new SystemConfiguration());
    if (configFile != null) {
      if (!Files.isRegularFile(configFile)) {
        throw new ConfigurationException("Configuration file not found: " + configFile);
      }
      try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
        configuration.addConfiguration(readYaml(reader, configFile.toString()));
        log.debug("Loaded configuration overrides from {}", configFile);
      } catch (IOException e) {
        throw new ConfigurationException("Failed to read configuration file: " + configFile, e);
      }
    }
    configuration.addConfiguration(loadDefaults());
  }

  public Configuration configuration() {
    return configuration;
  }

  private static YAMLConfiguration loadDefaults() {
    InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
    if (in == null) {
      log.warn("Bundled {} not found on the classpath, built-in defaults apply", DEFAULTS_RESOURCE);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return readYaml(reader, DEFAULTS_RESOURCE);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read bundled " + DEFAULTS_RESOURCE, e);
    }
  }

  private static YAMLConfiguration readYaml(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Invalid YAML configuration in " + source, e);
    }
    return yaml;
  }
}
