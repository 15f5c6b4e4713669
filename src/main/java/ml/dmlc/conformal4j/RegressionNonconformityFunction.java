package ml.dmlc.conformal4j;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

/**
 * Nonconformity function that can also turn calibration scores back into
 * prediction intervals.
 */
public abstract class RegressionNonconformityFunction implements NonconformityFunction {
  /**
   * Significance levels used when no single level is requested:
   * ``0.01, 0.02, ..., 0.99``.
   */
  public static final double[] SIGNIFICANCE_GRID = significanceGrid();

  /**
   * Construct prediction intervals at one significance level.
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @param calScores calibration scores of the category the inputs belong to
   * @param significance significance level, in ``(0, 1)``
   * @return interval bounds, of dimension ``[num_row]*2``; column 0 holds the
   *         lower bound and column 1 the upper bound
   * @throws ConformalError error raised by the underlying model
   */
  public abstract INDArray predict(INDArray x, double[] calScores, double significance)
      throws ConformalError;

  /**
   * Construct prediction intervals for every level in {@link #SIGNIFICANCE_GRID}.
   * Calls {@link #predict(INDArray, double[], double)} once per level.
   * @param x inputs, of dimension ``[num_row]*[num_feature]``
   * @param calScores calibration scores of the category the inputs belong to
   * @return interval bounds, of dimension ``[num_row]*2*[99]``
   * @throws ConformalError error raised by the underlying model
   */
  public INDArray predict(INDArray x, double[] calScores) throws ConformalError {
    int num_row = x.rows();
    INDArray out = Nd4j.zeros(DataType.DOUBLE, (long) num_row, 2L, (long) SIGNIFICANCE_GRID.length);
    for (int k = 0; k < SIGNIFICANCE_GRID.length; ++k) {
      INDArray interval = predict(x, calScores, SIGNIFICANCE_GRID[k]);
      for (int i = 0; i < num_row; ++i) {
        out.putScalar(i, 0, k, interval.getDouble(i, 0));
        out.putScalar(i, 1, k, interval.getDouble(i, 1));
      }
    }
    return out;
  }

  private static double[] significanceGrid() {
    double[] grid = new double[99];
    for (int i = 0; i < grid.length; ++i) {
      grid[i] = (i + 1) / 100.0;
    }
    return grid;
  }
}
