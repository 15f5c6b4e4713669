package ml.dmlc.conformal4j.nc;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Nonconformity ``1 - p(y)``, where ``p(y)`` is the estimated probability of
 * the true class.
 */
public class InverseProbabilityErrFunc implements ClassificationErrFunc {
  @Override
  public double[] apply(INDArray probability, double[] y) {
    double[] nc = new double[y.length];
    for (int i = 0; i < y.length; ++i) {
      nc[i] = 1.0 - ClassifierNc.classProbability(probability, i, y[i]);
    }
    return nc;
  }
}
