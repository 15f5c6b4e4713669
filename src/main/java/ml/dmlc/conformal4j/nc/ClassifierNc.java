package ml.dmlc.conformal4j.nc;

import ml.dmlc.conformal4j.ConformalError;
import ml.dmlc.conformal4j.NonconformityFunction;
import org.nd4j.linalg.api.ndarray.INDArray;

import java.util.Arrays;
import java.util.Objects;

/**
 * Nonconformity function for classification, built from a probabilistic
 * model and an error function.
 */
public class ClassifierNc implements NonconformityFunction {
  private final ClassifierAdapter model;
  private final ClassificationErrFunc err_func;

  /**
   * Create a nonconformity function scoring with {@link MarginErrFunc}
   * @param model underlying classification model
   */
  public ClassifierNc(ClassifierAdapter model) {
    this(model, new MarginErrFunc());
  }

  /**
   * Create a nonconformity function
   * @param model underlying classification model
   * @param err_func turns class probabilities into scores
   */
  public ClassifierNc(ClassifierAdapter model, ClassificationErrFunc err_func) {
    this.model = Objects.requireNonNull(model, "model");
    this.err_func = Objects.requireNonNull(err_func, "err_func");
  }

  @Override
  public void fit(INDArray x, INDArray y) throws ConformalError {
    this.model.fit(x, y);
  }

  @Override
  public double[] calcNc(INDArray x, INDArray y) throws ConformalError {
    INDArray probability = this.model.predictProbability(x);
    if (probability.rank() != 2 || probability.rows() != x.rows()) {
      throw new ConformalError(String.format(
          "Model returned probabilities of dimension %s for %d examples",
          Arrays.toString(probability.shape()), x.rows()));
    }
    return this.err_func.apply(probability, y.toDoubleVector());
  }

  public ClassifierAdapter getModel() {
    return this.model;
  }

  public ClassificationErrFunc getErrFunc() {
    return this.err_func;
  }

  /**
   * Probability of class index ``label`` in row ``row``; 0 when the model has
   * no column for the label.
   */
  static double classProbability(INDArray probability, int row, double label) {
    int k = (int) label;
    if (k < 0 || k >= probability.size(1)) {
      return 0.0;
    }
    return probability.getDouble(row, k);
  }
}
