package ml.dmlc.conformal4j.nc;

import ml.dmlc.conformal4j.ConformalError;
import ml.dmlc.conformal4j.RegressionNonconformityFunction;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.Objects;

/**
 * Nonconformity function for regression, built from a point regression
 * model and an error function.
 *
 * <pre>
 * IcpRegressor icp = new IcpRegressor(new RegressorNc(model, new AbsErrorErrFunc()));
 * </pre>
 */
public class RegressorNc extends RegressionNonconformityFunction {
  private final RegressorAdapter model;
  private final RegressionErrFunc err_func;

  /**
   * Create a nonconformity function scoring with {@link AbsErrorErrFunc}
   * @param model underlying regression model
   */
  public RegressorNc(RegressorAdapter model) {
    this(model, new AbsErrorErrFunc());
  }

  /**
   * Create a nonconformity function
   * @param model underlying regression model
   * @param err_func turns residuals into scores and back
   */
  public RegressorNc(RegressorAdapter model, RegressionErrFunc err_func) {
    this.model = Objects.requireNonNull(model, "model");
    this.err_func = Objects.requireNonNull(err_func, "err_func");
  }

  @Override
  public void fit(INDArray x, INDArray y) throws ConformalError {
    this.model.fit(x, y);
  }

  @Override
  public double[] calcNc(INDArray x, INDArray y) throws ConformalError {
    return this.err_func.apply(pointPredict(x), y.toDoubleVector());
  }

  @Override
  public INDArray predict(INDArray x, double[] calScores, double significance)
      throws ConformalError {
    double[] prediction = pointPredict(x);
    double[] err_dist = this.err_func.applyInverse(calScores, significance);
    INDArray intervals = Nd4j.zeros(DataType.DOUBLE, (long) prediction.length, 2L);
    for (int i = 0; i < prediction.length; ++i) {
      intervals.putScalar(i, 0, prediction[i] - err_dist[0]);
      intervals.putScalar(i, 1, prediction[i] + err_dist[1]);
    }
    return intervals;
  }

  /**
   * Same as the inherited grid prediction, but runs the model only once.
   */
  @Override
  public INDArray predict(INDArray x, double[] calScores) throws ConformalError {
    double[] prediction = pointPredict(x);
    int num_level = SIGNIFICANCE_GRID.length;
    INDArray intervals = Nd4j.zeros(DataType.DOUBLE, (long) prediction.length, 2L,
        (long) num_level);
    for (int k = 0; k < num_level; ++k) {
      double[] err_dist = this.err_func.applyInverse(calScores, SIGNIFICANCE_GRID[k]);
      for (int i = 0; i < prediction.length; ++i) {
        intervals.putScalar(i, 0, k, prediction[i] - err_dist[0]);
        intervals.putScalar(i, 1, k, prediction[i] + err_dist[1]);
      }
    }
    return intervals;
  }

  private double[] pointPredict(INDArray x) throws ConformalError {
    INDArray prediction = this.model.predict(x);
    if (prediction.length() != x.rows()) {
      throw new ConformalError(String.format(
          "Model returned %d predictions for %d examples",
          prediction.length(), x.rows()));
    }
    return prediction.reshape(prediction.length()).toDoubleVector();
  }

  public RegressorAdapter getModel() {
    return this.model;
  }

  public RegressionErrFunc getErrFunc() {
    return this.err_func;
  }
}
