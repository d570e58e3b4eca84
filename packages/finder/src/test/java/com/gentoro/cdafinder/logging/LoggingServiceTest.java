package com.gentoro.cdafinder.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  void appliesConfiguredLevels() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("logging.level.com.gentoro.cdafinder.sample", "debug");
    config.setProperty("logging.level.com.gentoro.cdafinder.other", " ");

    LoggingService.applyConfiguration(config);

    Logger sample = (Logger) LoggerFactory.getLogger("com.gentoro.cdafinder.sample");
    assertEquals(Level.DEBUG, sample.getLevel());
    Logger other = (Logger) LoggerFactory.getLogger("com.gentoro.cdafinder.other");
    assertNull(other.getLevel());
  }

  @Test
  void nullConfigurationIsIgnored() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }

  @Test
  void loggersAreNamedAfterTheirClass() {
    assertEquals(
        LoggingServiceTest.class.getName(), LoggingService.getLogger(getClass()).getName());
  }
}
