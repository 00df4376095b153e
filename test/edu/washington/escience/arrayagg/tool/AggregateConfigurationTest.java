package edu.washington.escience.arrayagg.tool;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;

import org.junit.Test;

import edu.washington.escience.arrayagg.ArrayAggSystemConfigKeys;

public class AggregateConfigurationTest {

  /**
   * @param resource a test resource.
   * @return its path on disk.
   * @throws Exception if the resource is missing.
   */
  private static String pathOf(final String resource) throws Exception {
    return new File(AggregateConfigurationTest.class.getResource(resource).toURI()).getPath();
  }

  @Test
  public void testDefaults() throws Exception {
    AggregateConfiguration config = AggregateConfiguration.newConfiguration();
    assertEquals(Runtime.getRuntime().availableProcessors(), config.getWorkerThreads());
    assertTrue(config.useTileMetadata());
    assertEquals(ArrayAggSystemConfigKeys.DEFAULT_STEP_TIMEOUT_SECONDS, config.getStepTimeoutSeconds());
  }

  @Test
  public void testLoadDefault() throws Exception {
    AggregateConfiguration config = AggregateConfiguration.loadDefault();
    assertTrue(config.useTileMetadata());
    assertEquals(600, config.getStepTimeoutSeconds());
    assertTrue(config.getWorkerThreads() > 0);
  }

  @Test
  public void testLoadFile() throws Exception {
    AggregateConfiguration config = AggregateConfiguration.loadWithDefaultValues(pathOf("/config/custom.cfg"));
    assertEquals(3, config.getWorkerThreads());
    assertFalse(config.useTileMetadata());
    /* Unset keys get their default. */
    assertEquals(ArrayAggSystemConfigKeys.DEFAULT_STEP_TIMEOUT_SECONDS, config.getStepTimeoutSeconds());
  }

  @Test(expected = ConfigFileException.class)
  public void testBadValue() throws Exception {
    AggregateConfiguration.loadWithDefaultValues(pathOf("/config/bad_threads.cfg")).getWorkerThreads();
  }

  @Test(expected = ConfigFileException.class)
  public void testMissingFile() throws Exception {
    AggregateConfiguration.loadWithDefaultValues("no/such/aggregates.cfg");
  }

  @Test
  public void testSetValue() throws Exception {
    AggregateConfiguration config = AggregateConfiguration.newConfiguration();
    config.setValue(ArrayAggSystemConfigKeys.SECTION, ArrayAggSystemConfigKeys.WORKER_THREADS, "0");
    try {
      config.getWorkerThreads();
      throw new AssertionError("zero threads accepted");
    } catch (ConfigFileException e) {
      assertTrue(e.getMessage().contains(ArrayAggSystemConfigKeys.WORKER_THREADS));
    }
    config.setValue("other", "key", null);
    assertNull(config.getOptional("other", "key"));
    config.setValue("other", "key", "value");
    assertEquals("value", config.getRequired("other", "key"));
  }

  @Test(expected = ConfigFileException.class)
  public void testRequiredMissing() throws Exception {
    AggregateConfiguration.newConfiguration().getRequired(ArrayAggSystemConfigKeys.SECTION, "no_such_key");
  }
}
