package ml.dmlc.conformal4j;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import org.apache.commons.lang.ArrayUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.objenesis.strategy.StdInstantiatorStrategy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Base class for inductive conformal predictors. Takes care of fitting the
 * nonconformity function and of (incremental, optionally conditional)
 * calibration. A predictor instance is not safe for concurrent use.
 *
 * @param <N> type of nonconformity function the predictor relies on
 */
public abstract class BaseIcp<N extends NonconformityFunction> {
  private static final Log logger = LogFactory.getLog(BaseIcp.class);

  private final N nc_function;
  private final Condition condition;
  private final boolean conditional;
  private final boolean verbose;
  private boolean fitted = false;
  private CalibrationSet cal_set;
  private CalibrationScores cal_scores;

  /**
   * Create a conformal predictor
   * @param nc_function nonconformity function scoring calibration and test examples
   * @param condition maps examples to categories; ``null`` disables
   *                  conditional calibration (all examples share category 0)
   * @param verbose whether to print extra diagnostic messages
   */
  protected BaseIcp(N nc_function, Condition condition, boolean verbose) {
    this.nc_function = Objects.requireNonNull(nc_function, "nc_function");
    if (condition != null) {
      this.condition = condition;
      this.conditional = true;
    } else {
      this.condition = Condition.NONE;
      this.conditional = false;
    }
    this.verbose = verbose;
  }

  /**
   * Fit the underlying nonconformity function
   * @param x inputs of the training examples, of dimension ``[num_row]*[num_feature]``
   * @param y labels of the training examples, of length ``[num_row]``
   * @throws ConformalError error raised by the nonconformity function
   */
  public void fit(INDArray x, INDArray y) throws ConformalError {
    this.nc_function.fit(x, y);
    this.fitted = true;
  }

  /**
   * Calibrate the conformal predictor, replacing any previous calibration examples
   * @param x inputs of the calibration examples, of dimension ``[num_row]*[num_feature]``
   * @param y labels of the calibration examples, of length ``[num_row]``
   * @throws ConformalError if the predictor is not fitted or the data is malformed
   */
  public void calibrate(INDArray x, INDArray y) throws ConformalError {
    calibrate(x, y, false);
  }

  /**
   * Calibrate the conformal predictor. Scores of all calibration examples are
   * recomputed, and their categories derived again.
   * @param x inputs of the calibration examples, of dimension ``[num_row]*[num_feature]``
   * @param y labels of the calibration examples, of length ``[num_row]``
   * @param increment if ``true``, the examples are added to the previously
   *                  existing calibration examples instead of replacing them
   * @throws ConformalError if the predictor is not fitted or the data is malformed
   */
  public void calibrate(INDArray x, INDArray y, boolean increment) throws ConformalError {
    if (!this.fitted) {
      throw new ConformalError("Conformal predictor is not fitted; call fit() first");
    }
    CalibrationSet batch = new CalibrationSet(x, y);
    CalibrationSet merged = (increment && this.cal_set != null)
        ? this.cal_set.append(batch) : batch;

    INDArray cal_x = merged.getX();
    double[] cal_y = merged.getY().toDoubleVector();
    Map<Integer, double[]> table = new HashMap<>();
    if (this.conditional) {
      Map<Integer, List<Integer>> members = new TreeMap<>();
      for (int i = 0; i < cal_y.length; ++i) {
        int category = this.condition.category(cal_x.getRow(i), cal_y[i]);
        List<Integer> group = members.get(category);
        if (group == null) {
          group = new ArrayList<>();
          members.put(category, group);
        }
        group.add(i);
      }
      for (Map.Entry<Integer, List<Integer>> e : members.entrySet()) {
        int[] idx = ArrayUtils.toPrimitive(e.getValue().toArray(new Integer[0]));
        table.put(e.getKey(), score(cal_x.getRows(idx), selectLabels(cal_y, idx)));
      }
    } else {
      table.put(0, score(cal_x, merged.getY()));
    }
    CalibrationScores scores = new CalibrationScores(table);

    // commit; nothing below may fail
    calibrateHook(batch.getY(), increment);
    this.cal_set = merged;
    this.cal_scores = scores;

    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Calibration scores per category: %s", this.cal_scores));
    }
    if (this.verbose) {
      logger.info(String.format(
          "Calibrated on %d examples (%s) in %d categor%s",
          merged.size(), increment ? "incremental" : "full",
          table.size(), table.size() == 1 ? "y" : "ies"));
    }
  }

  /**
   * Called once the new calibration scores are computed, right before they
   * replace the previous ones, with the labels of the new calibration
   * examples. Must not fail. Does nothing by default.
   * @param y labels of the new calibration examples
   * @param increment whether the calibration is incremental
   */
  protected void calibrateHook(INDArray y, boolean increment) {
  }

  /**
   * Compute nonconformity scores, checking that one score comes back per example.
   */
  protected double[] score(INDArray x, INDArray y) throws ConformalError {
    double[] nc = this.nc_function.calcNc(x, y);
    if (nc == null || nc.length != x.rows()) {
      throw new ConformalError(String.format(
          "Nonconformity function returned %s scores for %d examples",
          nc == null ? "no" : String.valueOf(nc.length), x.rows()));
    }
    return nc;
  }

  /**
   * Throw unless the predictor is fitted and calibrated, and ``x`` has the
   * dimension of the calibration inputs.
   */
  protected void checkReady(INDArray x) throws ConformalError {
    Objects.requireNonNull(x, "x");
    if (!this.fitted) {
      throw new ConformalError("Conformal predictor is not fitted; call fit() first");
    }
    if (this.cal_scores == null) {
      throw new ConformalError(
          "Conformal predictor is not calibrated; call calibrate() first");
    }
    if (x.rank() != 2 || x.columns() != this.cal_set.getNumFeature()) {
      throw new ConformalError(String.format(
          "Expected inputs of dimension [num_row]*[%d], got %s",
          this.cal_set.getNumFeature(), Arrays.toString(x.shape())));
    }
  }

  /**
   * Throw unless ``significance`` lies in the open interval (0, 1)
   */
  protected static void checkSignificance(double significance) throws ConformalError {
    if (!(significance > 0.0 && significance < 1.0)) {
      throw new ConformalError(String.format(
          "Significance must lie in (0, 1), got %s", significance));
    }
  }

  static INDArray selectLabels(double[] y, int[] idx) {
    double[] out = new double[idx.length];
    for (int i = 0; i < idx.length; ++i) {
      out[i] = y[idx[i]];
    }
    return Nd4j.createFromArray(out);
  }

  /**
   * Get the configuration of the predictor
   * @param deep if ``true``, the returned nonconformity function is a deep
   *             copy of the one held by the predictor
   * @return nonconformity function and condition
   * @throws ConformalError if the nonconformity function cannot be copied
   */
  public Params<N> getParams(boolean deep) throws ConformalError {
    if (!deep) {
      return new Params<>(this.nc_function, this.condition);
    }
    Kryo kryo = new Kryo();
    kryo.setRegistrationRequired(false);
    kryo.setReferences(true);
    kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
    // nd4j arrays wrap native memory and must not be copied field by field
    kryo.addDefaultSerializer(INDArray.class, new NDArraySerializer());
    try {
      return new Params<>(kryo.copy(this.nc_function), this.condition);
    } catch (KryoException ex) {
      throw new ConformalError("Unable to copy nonconformity function "
          + this.nc_function.getClass().getName(), ex);
    }
  }

  public N getNcFunction() {
    return this.nc_function;
  }

  public Condition getCondition() {
    return this.condition;
  }

  /**
   * Test whether calibration is conditional, i.e. a condition was supplied
   * @return whether calibration is conditional
   */
  public boolean isConditional() {
    return this.conditional;
  }

  public boolean isVerbose() {
    return this.verbose;
  }

  /**
   * Get the calibration examples
   * @return calibration set, or ``null`` before the first calibration
   */
  public CalibrationSet getCalibrationSet() {
    return this.cal_set;
  }

  /**
   * Get the per-category calibration scores
   * @return score table, or ``null`` before the first calibration
   */
  public CalibrationScores getCalibrationScores() {
    return this.cal_scores;
  }

  /**
   * Configuration of a conformal predictor
   * @param <N> type of nonconformity function
   */
  public static class Params<N extends NonconformityFunction> {
    private final N nc_function;
    private final Condition condition;

    Params(N nc_function, Condition condition) {
      this.nc_function = nc_function;
      this.condition = condition;
    }

    public N getNcFunction() {
      return this.nc_function;
    }

    public Condition getCondition() {
      return this.condition;
    }
  }
}
