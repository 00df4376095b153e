package edu.washington.escience.arrayagg;

/**
 * Raised when an aggregate is requested in a way that can never work: an unsupported datatype, a bad field shape, or a
 * bad channel registration. Always raised before any data is aggregated.
 */
public class AggregateConfigurationException extends DbException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param origin the component reporting the error.
   * @param message what went wrong.
   */
  public AggregateConfigurationException(final String origin, final String message) {
    super(origin + ": " + message);
  }
}
