package ml.dmlc.conformal4j.nc;

/**
 * Turns regression residuals into nonconformity scores, and calibration
 * scores back into interval widths.
 */
public interface RegressionErrFunc {
  /**
   * Score examples against point predictions
   * @param prediction point predictions, of length ``[num_row]``
   * @param y true targets, of length ``[num_row]``
   * @return nonconformity scores, of length ``[num_row]``
   */
  public double[] apply(double[] prediction, double[] y);

  /**
   * Compute interval widths from calibration scores
   * @param nc calibration scores, in any order
   * @param significance significance level, in ``(0, 1)``
   * @return ``{lower, upper}``: the interval is
   *         ``[prediction - lower, prediction + upper]``
   */
  public double[] applyInverse(double[] nc, double significance);
}
