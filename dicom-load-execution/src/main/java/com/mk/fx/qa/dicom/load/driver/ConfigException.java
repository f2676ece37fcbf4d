package com.mk.fx.qa.dicom.load.driver;

import com.mk.fx.qa.dicom.load.LoadSetupException;

/** Invalid or missing run options. */
public class ConfigException extends LoadSetupException {

  private final String key;

  public ConfigException(String message) {
    this(null, message);
  }

  public ConfigException(String key, String message) {
    super(message);
    this.key = key;
  }

  public static ConfigException missing(String key) {
    return new ConfigException(key, "Missing required option '" + key + "'");
  }

  public static ConfigException invalid(String key, Object value, String reason) {
    return new ConfigException(key, "Invalid value for '" + key + "': " + value + " (" + reason + ")");
  }

  /** Option the problem relates to, {@code null} when it spans several options. */
  public String getKey() {
    return key;
  }
}
