package com.gentoro.cdafinder.exception;

public class ConfigurationException extends CdaFinderException {
  public ConfigurationException(String message) {
    super(CdaFinderErrorCode.CONFIG_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(CdaFinderErrorCode.CONFIG_ERROR, message, cause);
  }
}
