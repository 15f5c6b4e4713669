package ml.dmlc.conformal4j;

/**
 * Custom error class for conformal4j
 */
public class ConformalError extends Exception {
  private static final long serialVersionUID = 1L;

  public ConformalError(String message) {
    super(message);
  }

  public ConformalError(String message, Throwable cause) {
    super(message, cause);
  }
}
