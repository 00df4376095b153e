package edu.washington.escience.arrayagg.tool;

import edu.washington.escience.arrayagg.DbException;

/** Raised when the engine configuration cannot be read or lacks a value. */
public class ConfigFileException extends DbException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param message what went wrong.
   */
  public ConfigFileException(final String message) {
    super(message);
  }

  /**
   * @param e the cause.
   */
  public ConfigFileException(final Throwable e) {
    super(e);
  }
}
