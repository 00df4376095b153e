package edu.washington.escience.arrayagg.tool;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.ini4j.ConfigParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.arrayagg.ArrayAggConstants;
import edu.washington.escience.arrayagg.ArrayAggSystemConfigKeys;

/** The class to read the aggregation engine configuration file, e.g. aggregates.cfg. */
public final class AggregateConfiguration extends ConfigParser {

  /** */
  private static final long serialVersionUID = 1L;

  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(AggregateConfiguration.class);

  /**
   * load the config file.
   *
   * @param filename filename.
   * @return parsed mapping from sections to keys to values.
   * @throws ConfigFileException if error occurred when parsing the config file
   */
  public static AggregateConfiguration loadWithDefaultValues(final String filename) throws ConfigFileException {
    File f = new File(filename);
    if (!f.exists()) {
      throw new ConfigFileException("config file " + filename + " doesn't exist!");
    }
    AggregateConfiguration config = new AggregateConfiguration();
    try {
      config.read(f);
    } catch (IOException e) {
      throw new ConfigFileException(e);
    }
    ArrayAggSystemConfigKeys.addDefaultConfigValues(config);
    return config;
  }

  /**
   * Load the configuration shipped on the classpath as {@link ArrayAggConstants#DEFAULT_CONFIG_RESOURCE}. Falls back
   * to the built-in defaults if the resource is absent.
   *
   * @return the configuration.
   * @throws ConfigFileException if the resource exists but cannot be parsed.
   */
  public static AggregateConfiguration loadDefault() throws ConfigFileException {
    AggregateConfiguration config = new AggregateConfiguration();
    try (InputStream in =
        AggregateConfiguration.class.getClassLoader().getResourceAsStream(ArrayAggConstants.DEFAULT_CONFIG_RESOURCE)) {
      if (in == null) {
        LOGGER.debug("{} not on the classpath, using built-in defaults", ArrayAggConstants.DEFAULT_CONFIG_RESOURCE);
      } else {
        config.read(in);
      }
    } catch (IOException e) {
      throw new ConfigFileException(e);
    }
    ArrayAggSystemConfigKeys.addDefaultConfigValues(config);
    return config;
  }

  /**
   *
   * @return a new configuration holding the default values.
   */
  public static AggregateConfiguration newConfiguration() {
    AggregateConfiguration config = new AggregateConfiguration();
    ArrayAggSystemConfigKeys.addDefaultConfigValues(config);
    return config;
  }

  /**
   * @return number of threads a read step uses.
   * @throws ConfigFileException if the value is missing or not a positive integer.
   */
  public int getWorkerThreads() throws ConfigFileException {
    int threads = parseInt(ArrayAggSystemConfigKeys.WORKER_THREADS);
    if (threads <= 0) {
      throw new ConfigFileException(ArrayAggSystemConfigKeys.WORKER_THREADS + " must be positive, got " + threads);
    }
    return threads;
  }

  /**
   * @return whether full tiles may be aggregated from their metadata.
   * @throws ConfigFileException if the value is missing.
   */
  public boolean useTileMetadata() throws ConfigFileException {
    return Boolean.parseBoolean(getRequired(ArrayAggSystemConfigKeys.SECTION,
        ArrayAggSystemConfigKeys.USE_TILE_METADATA).trim());
  }

  /**
   * @return how long a read step waits for its workers.
   * @throws ConfigFileException if the value is missing or not a positive integer.
   */
  public long getStepTimeoutSeconds() throws ConfigFileException {
    String value = getRequired(ArrayAggSystemConfigKeys.SECTION, ArrayAggSystemConfigKeys.STEP_TIMEOUT_SECONDS);
    long timeout;
    try {
      timeout = Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigFileException(e);
    }
    if (timeout <= 0) {
      throw new ConfigFileException(ArrayAggSystemConfigKeys.STEP_TIMEOUT_SECONDS + " must be positive, got "
          + timeout);
    }
    return timeout;
  }

  /**
   * @param key a key of the aggregates section.
   * @return its value as an int.
   * @throws ConfigFileException if the value is missing or not an integer.
   */
  private int parseInt(final String key) throws ConfigFileException {
    String value = getRequired(ArrayAggSystemConfigKeys.SECTION, key);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigFileException(e);
    }
  }

  /**
   *
   * @param section the section
   * @param key the key
   * @return the value, must exist
   * @throws ConfigFileException if error occurred when getting the value
   */
  @Nonnull
  public String getRequired(final String section, final String key) throws ConfigFileException {
    try {
      return get(section, key);
    } catch (NoSectionException | NoOptionException | InterpolationException e) {
      throw new ConfigFileException(e);
    }
  }

  /**
   *
   * @param section the section
   * @param key the key
   * @return the value, null if not exist
   */
  @Nullable
  public String getOptional(final String section, final String key) {
    try {
      return get(section, key);
    } catch (NoSectionException | NoOptionException | InterpolationException e) {
      return null;
    }
  }

  /**
   *
   * @param section the section
   * @param key the key
   * @param value the value, if null don't set
   */
  public void setValue(final String section, final String key, final String value) {
    if (value == null) {
      return;
    }
    try {
      if (!hasSection(section)) {
        addSection(section);
      }
      set(section, key, value);
    } catch (NoSectionException | DuplicateSectionException e) {
      // Should not happen
      throw new IllegalStateException(e);
    }
  }
}
