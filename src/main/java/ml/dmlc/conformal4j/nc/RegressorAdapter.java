package ml.dmlc.conformal4j.nc;

import ml.dmlc.conformal4j.ConformalError;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Plugs a regression model into {@link RegressorNc}.
 */
public interface RegressorAdapter {
  /**
   * Train the underlying model
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @param y targets, of length ``[num_row]``
   * @throws ConformalError error raised by the model
   */
  public void fit(INDArray x, INDArray y) throws ConformalError;

  /**
   * Make point predictions
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @return predictions, of length ``[num_row]``
   * @throws ConformalError error raised by the model
   */
  public INDArray predict(INDArray x) throws ConformalError;
}
