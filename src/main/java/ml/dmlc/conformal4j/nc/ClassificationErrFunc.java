package ml.dmlc.conformal4j.nc;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Turns estimated class probabilities into nonconformity scores.
 */
public interface ClassificationErrFunc {
  /**
   * Score examples against estimated class probabilities
   * @param probability probabilities, of dimension ``[num_row]*[num_class]``
   * @param y class indices, of length ``[num_row]``
   * @return nonconformity scores, of length ``[num_row]``
   */
  public double[] apply(INDArray probability, double[] y);
}
