package ml.dmlc.conformal4j;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Scores how atypical an (input, label) pair is with respect to an underlying
 * point predictor. Higher scores mean more unusual examples.
 */
public interface NonconformityFunction {
  /**
   * Fit the underlying point predictor.
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @param y labels, of dimension ``[num_row]``
   * @throws ConformalError error raised by the underlying model
   */
  public void fit(INDArray x, INDArray y) throws ConformalError;

  /**
   * Compute one nonconformity score per example.
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @param y labels, of dimension ``[num_row]``
   * @return nonconformity scores, of length ``[num_row]``
   * @throws ConformalError error raised by the underlying model
   */
  public double[] calcNc(INDArray x, INDArray y) throws ConformalError;
}
