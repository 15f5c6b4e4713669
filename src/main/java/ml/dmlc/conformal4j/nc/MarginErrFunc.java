package ml.dmlc.conformal4j.nc;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Nonconformity ``0.5 - (p(y) - max p(k != y)) / 2``: the gap between the
 * probability of the true class and the most probable other class, mapped
 * to ``[0, 1]``.
 */
public class MarginErrFunc implements ClassificationErrFunc {
  @Override
  public double[] apply(INDArray probability, double[] y) {
    int num_class = (int) probability.size(1);
    double[] nc = new double[y.length];
    for (int i = 0; i < y.length; ++i) {
      double prob = ClassifierNc.classProbability(probability, i, y[i]);
      double other = Double.NEGATIVE_INFINITY;
      for (int k = 0; k < num_class; ++k) {
        if (k != (int) y[i]) {
          other = Math.max(other, probability.getDouble(i, k));
        }
      }
      if (other == Double.NEGATIVE_INFINITY) {
        other = 0.0;  // single column: no competing class
      }
      nc[i] = 0.5 - (prob - other) / 2.0;
    }
    return nc;
  }
}
