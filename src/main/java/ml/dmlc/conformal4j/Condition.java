package ml.dmlc.conformal4j;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Maps an example to the category it is calibrated in (Mondrian conformal
 * prediction). Examples only share calibration scores with examples of the
 * same category.
 */
public interface Condition {
  /**
   * Condition putting every example into category 0.
   */
  public static final Condition NONE = new Condition() {
    @Override
    public int category(INDArray xRow, Double y) {
      return 0;
    }
  };

  /**
   * Compute the category of a single example.
   * @param xRow input of the example, of dimension ``[num_feature]``
   * @param y label of the example, or ``null`` when the label is unknown
   * @return category id
   */
  public int category(INDArray xRow, Double y);
}
