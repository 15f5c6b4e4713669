package ml.dmlc.conformal4j;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.Objects;

/**
 * Calibration examples of a conformal predictor. Inputs are kept as a
 * ``[num_row]*[num_feature]`` matrix and labels as a vector of length
 * ``[num_row]``, both in float64. The set holds its own copy of the arrays
 * it was created from.
 */
public class CalibrationSet {
  private final INDArray x;
  private final INDArray y;

  /**
   * Create a calibration set from a batch of examples
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @param y labels, of length ``[num_row]``
   * @throws ConformalError if the dimensions of ``x`` and ``y`` do not agree
   */
  public CalibrationSet(INDArray x, INDArray y) throws ConformalError {
    Objects.requireNonNull(x, "x");
    Objects.requireNonNull(y, "y");
    if (x.rank() != 2) {
      throw new ConformalError(String.format(
          "Inputs must be a 2D matrix, got an array of rank %d", x.rank()));
    }
    if (y.length() != x.rows()) {
      throw new ConformalError(String.format(
          "Got %d inputs but %d labels", x.rows(), y.length()));
    }
    this.x = x.castTo(DataType.DOUBLE).dup();
    this.y = y.reshape(y.length()).castTo(DataType.DOUBLE).dup();
  }

  /**
   * Create a new calibration set holding the examples of this set followed
   * by the examples of ``other``. Neither set is modified.
   * @param other examples to append
   * @return merged calibration set
   * @throws ConformalError if the two sets have a different number of features
   */
  public CalibrationSet append(CalibrationSet other) throws ConformalError {
    if (other.getNumFeature() != getNumFeature()) {
      throw new ConformalError(String.format(
          "Cannot append calibration examples with %d features to a "
              + "calibration set with %d features",
          other.getNumFeature(), getNumFeature()));
    }
    return new CalibrationSet(Nd4j.vstack(this.x, other.x),
        Nd4j.concat(0, this.y, other.y));
  }

  /**
   * Get the inputs
   * @return copy of the inputs, of dimension ``[num_row]*[num_feature]``
   */
  public INDArray getX() {
    return this.x.dup();
  }

  /**
   * Get the labels
   * @return copy of the labels, of length ``[num_row]``
   */
  public INDArray getY() {
    return this.y.dup();
  }

  /**
   * Get the number of calibration examples
   * @return Number of examples
   */
  public int size() {
    return this.x.rows();
  }

  /**
   * Get the number of features of each input
   * @return Number of features
   */
  public int getNumFeature() {
    return this.x.columns();
  }
}
