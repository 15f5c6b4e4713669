package ml.dmlc.conformal4j;

import org.apache.commons.lang.ArrayUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inductive conformal regressor. Interval construction is left to the
 * nonconformity function; this class routes every test example to the
 * calibration scores of its category and assembles the results.
 */
public class IcpRegressor extends BaseIcp<RegressionNonconformityFunction> {
  private static final Log logger = LogFactory.getLog(IcpRegressor.class);

  /**
   * Create an unconditional conformal regressor
   * @param nc_function nonconformity function
   */
  public IcpRegressor(RegressionNonconformityFunction nc_function) {
    this(nc_function, null, false);
  }

  /**
   * Create a conformal regressor
   * @param nc_function nonconformity function
   * @param condition maps examples to categories; ``null`` for unconditional
   *                  calibration. At prediction time it is called with a
   *                  ``null`` label.
   */
  public IcpRegressor(RegressionNonconformityFunction nc_function, Condition condition) {
    this(nc_function, condition, false);
  }

  /**
   * Create a conformal regressor
   * @param nc_function nonconformity function
   * @param condition maps examples to categories; ``null`` for unconditional calibration
   * @param verbose whether to print extra diagnostic messages
   */
  public IcpRegressor(RegressionNonconformityFunction nc_function, Condition condition,
                      boolean verbose) {
    super(nc_function, condition, verbose);
  }

  /**
   * Compute prediction intervals at a significance level
   * @param x inputs of the test examples, of dimension ``[num_row]*[num_feature]``
   * @param significance maximum allowed error rate, in ``(0, 1)``
   * @return intervals, of dimension ``[num_row]*2``; column 0 holds the lower
   *         bound and column 1 the upper bound
   * @throws ConformalError if the predictor is not calibrated, ``significance``
   *                        is out of range, or a test example falls into a
   *                        category unseen during calibration
   */
  public INDArray predict(INDArray x, double significance) throws ConformalError {
    checkSignificance(significance);
    return predictIntervals(x, significance);
  }

  /**
   * Compute prediction intervals for the significance levels
   * ``0.01, 0.02, ..., 0.99``
   * @param x inputs of the test examples, of dimension ``[num_row]*[num_feature]``
   * @return intervals, of dimension ``[num_row]*2*[99]``; entry ``[i, 0, k]``
   *         is the lower bound of example ``i`` at significance
   *         ``RegressionNonconformityFunction.SIGNIFICANCE_GRID[k]``
   * @throws ConformalError if the predictor is not calibrated, or a test
   *                        example falls into a category unseen during calibration
   */
  public INDArray predict(INDArray x) throws ConformalError {
    return predictIntervals(x, null);
  }

  private INDArray predictIntervals(INDArray x, Double significance) throws ConformalError {
    checkReady(x);
    CalibrationScores cal_scores = getCalibrationScores();
    Condition condition = getCondition();
    int n_test = x.rows();

    Map<Integer, List<Integer>> members = new LinkedHashMap<>();
    for (int j = 0; j < n_test; ++j) {
      int category = condition.category(x.getRow(j), null);
      List<Integer> group = members.get(category);
      if (group == null) {
        group = new ArrayList<>();
        members.put(category, group);
      }
      group.add(j);
    }
    for (int category : members.keySet()) {
      if (!cal_scores.contains(category)) {
        throw new ConformalError(String.format(
            "Unknown category %d: no calibration example belongs to it; "
                + "calibrated categories are %s",
            category, Arrays.toString(cal_scores.getCategories())));
      }
    }

    INDArray prediction = significance == null
        ? Nd4j.zeros(DataType.DOUBLE, (long) n_test, 2L,
            (long) RegressionNonconformityFunction.SIGNIFICANCE_GRID.length)
        : Nd4j.zeros(DataType.DOUBLE, (long) n_test, 2L);

    for (Map.Entry<Integer, List<Integer>> e : members.entrySet()) {
      int[] idx = ArrayUtils.toPrimitive(e.getValue().toArray(new Integer[0]));
      double[] scores = cal_scores.get(e.getKey());
      if (significance != null && significance < 1.0 / (scores.length + 1)) {
        logger.warn(String.format(
            "Category %d has only %d calibration examples; intervals at "
                + "significance %s are not informative",
            e.getKey(), scores.length, significance));
      }
      INDArray p = significance == null
          ? getNcFunction().predict(x.getRows(idx), scores)
          : getNcFunction().predict(x.getRows(idx), scores, significance);
      scatter(p, idx, prediction);
      if (logger.isDebugEnabled()) {
        logger.debug(String.format("Predicted %d intervals in category %d",
            idx.length, e.getKey()));
      }
    }
    return prediction;
  }

  private static void scatter(INDArray p, int[] idx, INDArray prediction)
      throws ConformalError {
    long[] expected = prediction.shape().clone();
    expected[0] = idx.length;
    if (!Arrays.equals(p.shape(), expected)) {
      throw new ConformalError(String.format(
          "Nonconformity function returned intervals of dimension %s, expected %s",
          Arrays.toString(p.shape()), Arrays.toString(expected)));
    }
    for (int i = 0; i < idx.length; ++i) {
      if (prediction.rank() == 2) {
        prediction.putScalar(idx[i], 0, p.getDouble(i, 0));
        prediction.putScalar(idx[i], 1, p.getDouble(i, 1));
      } else {
        for (int k = 0; k < expected[2]; ++k) {
          prediction.putScalar(idx[i], 0, k, p.getDouble(i, 0, k));
          prediction.putScalar(idx[i], 1, k, p.getDouble(i, 1, k));
        }
      }
    }
  }
}
