package ml.dmlc.conformal4j.nc;

import ml.dmlc.conformal4j.ConformalError;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Plugs a probabilistic classification model into {@link ClassifierNc}.
 * Labels are class indices ``0, 1, ..., num_class - 1`` stored as doubles.
 */
public interface ClassifierAdapter {
  /**
   * Train the underlying model
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @param y class indices, of length ``[num_row]``
   * @throws ConformalError error raised by the model
   */
  public void fit(INDArray x, INDArray y) throws ConformalError;

  /**
   * Estimate class probabilities
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @return probabilities, of dimension ``[num_row]*[num_class]``; column ``k``
   *         holds the probability of class index ``k``
   * @throws ConformalError error raised by the model
   */
  public INDArray predictProbability(INDArray x) throws ConformalError;
}
