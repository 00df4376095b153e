package edu.washington.escience.arrayagg;

/** The destination buffer bound for an aggregate does not have the shape the aggregate writes. */
public class InvalidOutputBufferException extends AggregateConfigurationException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param origin the component reporting the error.
   * @param message what went wrong.
   */
  public InvalidOutputBufferException(final String origin, final String message) {
    super(origin, message);
  }
}
