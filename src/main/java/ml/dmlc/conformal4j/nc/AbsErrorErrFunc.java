package ml.dmlc.conformal4j.nc;

import org.apache.commons.lang.ArrayUtils;

import java.util.Arrays;

/**
 * Absolute error ``|y - prediction|``; yields intervals symmetric around the
 * point prediction.
 */
public class AbsErrorErrFunc implements RegressionErrFunc {
  @Override
  public double[] apply(double[] prediction, double[] y) {
    double[] nc = new double[y.length];
    for (int i = 0; i < y.length; ++i) {
      nc[i] = Math.abs(y[i] - prediction[i]);
    }
    return nc;
  }

  @Override
  public double[] applyInverse(double[] nc, double significance) {
    int border = (int) Math.floor(significance * (nc.length + 1)) - 1;
    // too few scores to exclude anything at this significance
    if (border < 0) {
      return new double[]{Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY};
    }
    double[] sorted = descending(nc);
    border = Math.min(border, sorted.length - 1);
    return new double[]{sorted[border], sorted[border]};
  }

  static double[] descending(double[] nc) {
    double[] sorted = nc.clone();
    Arrays.sort(sorted);
    ArrayUtils.reverse(sorted);
    return sorted;
  }
}
