package ml.dmlc.conformal4j.nc;

/**
 * Signed error ``y - prediction``; yields intervals that may be asymmetric
 * around the point prediction, splitting the significance level evenly
 * between both tails.
 */
public class SignErrorErrFunc implements RegressionErrFunc {
  @Override
  public double[] apply(double[] prediction, double[] y) {
    double[] nc = new double[y.length];
    for (int i = 0; i < y.length; ++i) {
      nc[i] = y[i] - prediction[i];
    }
    return nc;
  }

  @Override
  public double[] applyInverse(double[] nc, double significance) {
    int n = nc.length;
    // k-th largest score bounds from above, k-th smallest from below
    int k = (int) Math.floor((significance / 2) * (n + 1));
    if (k < 1) {
      return new double[]{Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY};
    }
    double[] sorted = AbsErrorErrFunc.descending(nc);
    int upper = Math.min(k - 1, n - 1);
    int lower = Math.max(n - k, 0);
    return new double[]{-sorted[lower], sorted[upper]};
  }
}
