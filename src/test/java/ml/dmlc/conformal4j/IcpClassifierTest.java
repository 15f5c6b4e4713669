package ml.dmlc.conformal4j;

import junit.framework.TestCase;
import ml.dmlc.conformal4j.Datasets.Dataset;
import ml.dmlc.conformal4j.nc.ClassifierNc;
import ml.dmlc.conformal4j.nc.InverseProbabilityErrFunc;
import org.junit.Test;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.io.IOException;
import java.util.Arrays;
import java.util.Random;

/**
 * Test cases for the conformal classifier
 */
public class IcpClassifierTest {
  private static final Condition BY_LABEL = new Condition() {
    @Override
    public int category(INDArray xRow, Double y) {
      return y.intValue();
    }
  };

  private static IcpClassifier scoredByColumn(boolean smoothing) throws ConformalError {
    IcpClassifier icp = new IcpClassifier(new ColumnScoreNc(), null, smoothing);
    INDArray cal_x = Nd4j.create(new double[][]{{0.1}, {0.4}, {0.4}, {0.9}});
    INDArray cal_y = Nd4j.createFromArray(0.0, 0.0, 0.0, 0.0);
    icp.fit(cal_x, cal_y);
    icp.calibrate(cal_x, cal_y);
    return icp;
  }

  private static IcpClassifier blobs(Condition condition, boolean smoothing, long seed) {
    return new IcpClassifier(new ClassifierNc(new NearestCentroidClassifier()),
        condition, smoothing, new Random(seed), false);
  }

  @Test
  public void testPValueOfTiedScore() throws ConformalError {
    IcpClassifier icp = scoredByColumn(false);
    INDArray test_x = Nd4j.create(new double[][]{{0.4}});

    // one greater score, two equal scores plus the test example itself
    INDArray p = icp.predict(test_x);
    TestCase.assertEquals(1, p.rows());
    TestCase.assertEquals(1, p.columns());
    TestCase.assertEquals(0.8, p.getDouble(0, 0), 1e-12);

    TestCase.assertTrue(Datasets.included(icp.predict(test_x, 0.5), 0, 0));
    TestCase.assertTrue(Datasets.included(icp.predict(test_x, 0.7), 0, 0));
    TestCase.assertFalse(Datasets.included(icp.predict(test_x, 0.8), 0, 0));
  }

  @Test
  public void testPValueExtremes() throws ConformalError {
    IcpClassifier icp = scoredByColumn(false);
    INDArray p = icp.predict(Nd4j.create(new double[][]{{5.0}, {-5.0}}));
    // most atypical: only ties with itself
    TestCase.assertEquals(1.0 / 5, p.getDouble(0, 0), 1e-12);
    // least atypical: every calibration score is greater
    TestCase.assertEquals(1.0, p.getDouble(1, 0), 1e-12);
  }

  @Test
  public void testSmoothedPValueBounds() throws ConformalError {
    IcpClassifier icp = scoredByColumn(true);
    INDArray test_x = Nd4j.create(new double[100][1]);
    for (int i = 0; i < 100; ++i) {
      test_x.putScalar(i, 0, 0.4);
    }
    double[] p = icp.predict(test_x).getColumn(0).toDoubleVector();
    boolean varies = false;
    for (double v : p) {
      // (n_gt + n_eq * U) / (n_cal + 1) with n_gt = 1, n_eq = 3
      TestCase.assertTrue(v >= 0.2 && v < 0.8);
      varies |= v != p[0];
    }
    TestCase.assertTrue(varies);
  }

  @Test
  public void testPValueRangeAndDeterminism() throws ConformalError, IOException {
    Dataset data = Datasets.loadLibSVM(Datasets.THREE_BLOBS);
    int[] perm = Datasets.permutation(data.size(), new Random(7));
    Dataset train = data.subset(perm, 0, 200);
    Dataset cal = data.subset(perm, 200, 400);
    Dataset test = data.subset(perm, 400, 600);

    IcpClassifier icp = blobs(null, false, 0);
    icp.fit(train.x, train.y);
    icp.calibrate(cal.x, cal.y);
    INDArray p1 = icp.predict(test.x);
    INDArray p2 = icp.predict(test.x);

    TestCase.assertTrue(Arrays.equals(new double[]{0, 1, 2}, icp.getClasses()));
    TestCase.assertTrue(Arrays.equals(new long[]{200, 3}, p1.shape()));
    double[][] m1 = p1.toDoubleMatrix();
    double[][] m2 = p2.toDoubleMatrix();
    for (int i = 0; i < m1.length; ++i) {
      TestCase.assertTrue(Arrays.equals(m1[i], m2[i]));
      for (double v : m1[i]) {
        TestCase.assertTrue(v > 0.0 && v <= 1.0);
      }
    }
  }

  @Test
  public void testSmoothingIsReproducibleWithSeed() throws ConformalError, IOException {
    Dataset data = Datasets.loadLibSVM(Datasets.THREE_BLOBS);
    int[] perm = Datasets.permutation(data.size(), new Random(11));
    Dataset train = data.subset(perm, 0, 200);
    Dataset cal = data.subset(perm, 200, 400);
    Dataset test = data.subset(perm, 400, 450);

    IcpClassifier a = blobs(null, true, 42);
    IcpClassifier b = blobs(null, true, 42);
    for (IcpClassifier icp : new IcpClassifier[]{a, b}) {
      icp.fit(train.x, train.y);
      icp.calibrate(cal.x, cal.y);
    }
    INDArray pa = a.predict(test.x);
    INDArray pb = b.predict(test.x);
    INDArray pa_again = a.predict(test.x);
    TestCase.assertEquals(pa, pb);
    TestCase.assertFalse(pa.equals(pa_again));
    for (double[] row : pa.toDoubleMatrix()) {
      for (double v : row) {
        TestCase.assertTrue(v >= 0.0 && v <= 1.0);
      }
    }
  }

  @Test
  public void testPredictionSetsShrinkWithSignificance() throws ConformalError, IOException {
    Dataset data = Datasets.loadLibSVM(Datasets.THREE_BLOBS);
    int[] perm = Datasets.permutation(data.size(), new Random(3));
    IcpClassifier icp = blobs(null, false, 0);
    icp.fit(data.subset(perm, 0, 200).x, data.subset(perm, 0, 200).y);
    icp.calibrate(data.subset(perm, 200, 400).x, data.subset(perm, 200, 400).y);
    INDArray test_x = data.subset(perm, 400, 600).x;

    double[] levels = {0.01, 0.05, 0.1, 0.2, 0.35, 0.5, 0.8};
    INDArray previous = icp.predict(test_x, levels[0]);
    for (int l = 1; l < levels.length; ++l) {
      INDArray current = icp.predict(test_x, levels[l]);
      for (int i = 0; i < current.rows(); ++i) {
        for (int c = 0; c < current.columns(); ++c) {
          if (Datasets.included(current, i, c)) {
            TestCase.assertTrue(Datasets.included(previous, i, c));
          }
        }
      }
      previous = current;
    }
  }

  @Test
  public void testCoverage() throws ConformalError, IOException {
    Dataset data = Datasets.loadLibSVM(Datasets.THREE_BLOBS);
    Random random = new Random(2024);
    double significance = 0.1;
    for (boolean smoothing : new boolean[]{false, true}) {
      int covered = 0;
      int total = 0;
      for (int trial = 0; trial < 50; ++trial) {
        int[] perm = Datasets.permutation(data.size(), random);
        Dataset train = data.subset(perm, 0, 200);
        Dataset cal = data.subset(perm, 200, 400);
        Dataset test = data.subset(perm, 400, 600);
        IcpClassifier icp = blobs(null, smoothing, trial);
        icp.fit(train.x, train.y);
        icp.calibrate(cal.x, cal.y);
        INDArray sets = icp.predict(test.x, significance);
        double[] truth = test.y.toDoubleVector();
        for (int i = 0; i < truth.length; ++i) {
          covered += Datasets.included(sets, i, (int) truth[i]) ? 1 : 0;
          ++total;
        }
      }
      double coverage = (double) covered / total;
      TestCase.assertTrue("coverage " + coverage, coverage >= 1 - significance - 0.02);
      if (smoothing) {
        TestCase.assertTrue("coverage " + coverage, coverage <= 1 - significance + 0.02);
      }
    }
  }

  @Test
  public void testClassConditionalCalibration() throws ConformalError, IOException {
    Dataset data = Datasets.loadLibSVM(Datasets.THREE_BLOBS);
    int[] perm = Datasets.permutation(data.size(), new Random(5));
    Dataset train = data.subset(perm, 0, 200);
    Dataset cal = data.subset(perm, 200, 400);

    IcpClassifier icp = blobs(BY_LABEL, false, 0);
    TestCase.assertTrue(icp.isConditional());
    icp.fit(train.x, train.y);
    icp.calibrate(cal.x, cal.y);

    CalibrationScores scores = icp.getCalibrationScores();
    TestCase.assertTrue(Arrays.equals(new int[]{0, 1, 2}, scores.getCategories()));
    int[] expected = new int[3];
    for (double label : cal.y.toDoubleVector()) {
      ++expected[(int) label];
    }
    int sum = 0;
    for (int category : scores.getCategories()) {
      TestCase.assertEquals(expected[category], scores.size(category));
      sum += scores.size(category);
    }
    TestCase.assertEquals(cal.size(), sum);
    TestCase.assertEquals(cal.size(), scores.size());

    // p-value of class c only depends on calibration examples of class c
    INDArray test_x = data.subset(perm, 400, 420).x;
    INDArray p = icp.predict(test_x);
    ClassifierNc nc = (ClassifierNc) icp.getNcFunction();
    for (int c = 0; c < 3; ++c) {
      double[] test_class = new double[test_x.rows()];
      Arrays.fill(test_class, c);
      double[] test_nc = nc.calcNc(test_x, Nd4j.createFromArray(test_class));
      for (int j = 0; j < test_x.rows(); ++j) {
        int n_gt = scores.countGreater(c, test_nc[j]);
        int n_eq = scores.countEqual(c, test_nc[j]) + 1;
        TestCase.assertEquals((n_gt + n_eq) / (double) (expected[c] + 1),
            p.getDouble(j, c), 1e-12);
      }
    }
  }

  @Test
  public void testIncrementalCalibrationMatchesBatch() throws ConformalError, IOException {
    Dataset data = Datasets.loadLibSVM(Datasets.THREE_BLOBS);
    int[] perm = Datasets.permutation(data.size(), new Random(9));
    Dataset train = data.subset(perm, 0, 200);
    Dataset first = data.subset(perm, 200, 300);
    Dataset second = data.subset(perm, 300, 400);
    Dataset both = data.subset(perm, 200, 400);
    INDArray test_x = data.subset(perm, 400, 500).x;

    IcpClassifier incremental = blobs(BY_LABEL, false, 0);
    incremental.fit(train.x, train.y);
    incremental.calibrate(first.x, first.y);
    incremental.calibrate(second.x, second.y, true);

    IcpClassifier batch = blobs(BY_LABEL, false, 0);
    batch.fit(train.x, train.y);
    batch.calibrate(both.x, both.y);

    TestCase.assertEquals(batch.getCalibrationSet().getX(),
        incremental.getCalibrationSet().getX());
    TestCase.assertEquals(batch.getCalibrationSet().getY(),
        incremental.getCalibrationSet().getY());
    CalibrationScores expected = batch.getCalibrationScores();
    CalibrationScores actual = incremental.getCalibrationScores();
    TestCase.assertTrue(Arrays.equals(expected.getCategories(), actual.getCategories()));
    for (int category : expected.getCategories()) {
      TestCase.assertTrue(Arrays.equals(expected.get(category), actual.get(category)));
    }
    TestCase.assertEquals(batch.predict(test_x), incremental.predict(test_x));
  }

  @Test
  public void testClassRegistry() throws ConformalError {
    IcpClassifier icp = new IcpClassifier(new ColumnScoreNc(), null, false);
    INDArray x = Nd4j.create(new double[][]{{0.1}, {0.2}, {0.3}});
    icp.fit(x, Nd4j.createFromArray(0.0, 1.0, 1.0));
    TestCase.assertNull(icp.getClasses());

    icp.calibrate(x, Nd4j.createFromArray(1.0, 0.0, 1.0));
    TestCase.assertTrue(Arrays.equals(new double[]{0, 1}, icp.getClasses()));

    icp.calibrate(Nd4j.create(new double[][]{{0.5}}), Nd4j.createFromArray(4.0), true);
    TestCase.assertTrue(Arrays.equals(new double[]{0, 1, 4}, icp.getClasses()));
    TestCase.assertEquals(4, icp.getCalibrationSet().size());
    TestCase.assertEquals(3, icp.predict(x).columns());

    icp.calibrate(Nd4j.create(new double[][]{{0.5}}), Nd4j.createFromArray(2.0));
    TestCase.assertTrue(Arrays.equals(new double[]{2}, icp.getClasses()));
    TestCase.assertEquals(1, icp.getCalibrationSet().size());
  }

  @Test
  public void testInverseProbabilityScores() throws ConformalError, IOException {
    Dataset data = Datasets.loadLibSVM(Datasets.THREE_BLOBS);
    int[] perm = Datasets.permutation(data.size(), new Random(13));
    IcpClassifier icp = new IcpClassifier(new ClassifierNc(
        new NearestCentroidClassifier(), new InverseProbabilityErrFunc()), null, false);
    icp.fit(data.subset(perm, 0, 200).x, data.subset(perm, 0, 200).y);
    icp.calibrate(data.subset(perm, 200, 400).x, data.subset(perm, 200, 400).y);
    Dataset test = data.subset(perm, 400, 600);
    INDArray sets = icp.predict(test.x, 0.2);
    double[] truth = test.y.toDoubleVector();
    int covered = 0;
    for (int i = 0; i < truth.length; ++i) {
      covered += Datasets.included(sets, i, (int) truth[i]) ? 1 : 0;
    }
    // single split: loose bound
    TestCase.assertTrue(covered >= 0.7 * truth.length);
  }

  @Test
  public void testDeepParams() throws ConformalError {
    ColumnScoreNc nc = new ColumnScoreNc();
    IcpClassifier icp = new IcpClassifier(nc, BY_LABEL, true);
    icp.fit(Nd4j.create(new double[][]{{0.1}}), Nd4j.createFromArray(0.0));

    BaseIcp.Params<NonconformityFunction> shallow = icp.getParams(false);
    TestCase.assertSame(nc, shallow.getNcFunction());
    TestCase.assertSame(BY_LABEL, shallow.getCondition());

    BaseIcp.Params<NonconformityFunction> deep = icp.getParams(true);
    TestCase.assertNotSame(nc, deep.getNcFunction());
    TestCase.assertTrue(deep.getNcFunction() instanceof ColumnScoreNc);
    TestCase.assertEquals(1, ((ColumnScoreNc) deep.getNcFunction()).getFitCalls());
    TestCase.assertSame(BY_LABEL, deep.getCondition());
  }

  @Test(expected = ConformalError.class)
  public void testCalibrateBeforeFit() throws ConformalError {
    IcpClassifier icp = new IcpClassifier(new ColumnScoreNc());
    icp.calibrate(Nd4j.create(new double[][]{{0.1}}), Nd4j.createFromArray(0.0));
  }

  @Test(expected = ConformalError.class)
  public void testPredictBeforeFit() throws ConformalError {
    IcpClassifier icp = new IcpClassifier(new ColumnScoreNc());
    icp.predict(Nd4j.create(new double[][]{{0.1}}));
  }

  @Test(expected = ConformalError.class)
  public void testPredictBeforeCalibrate() throws ConformalError {
    IcpClassifier icp = new IcpClassifier(new ColumnScoreNc());
    icp.fit(Nd4j.create(new double[][]{{0.1}}), Nd4j.createFromArray(0.0));
    icp.predict(Nd4j.create(new double[][]{{0.1}}));
  }

  @Test
  public void testSignificanceOutOfRange() throws ConformalError {
    IcpClassifier icp = scoredByColumn(false);
    INDArray test_x = Nd4j.create(new double[][]{{0.4}});
    for (double significance : new double[]{0.0, 1.0, -0.1, 1.5, Double.NaN}) {
      try {
        icp.predict(test_x, significance);
        TestCase.fail("accepted significance " + significance);
      } catch (ConformalError ex) {
        TestCase.assertTrue(ex.getMessage().contains("Significance"));
      }
    }
  }

  @Test
  public void testIncrementalDimensionMismatchKeepsState() throws ConformalError {
    IcpClassifier icp = scoredByColumn(false);
    try {
      icp.calibrate(Nd4j.create(new double[][]{{0.1, 0.2}}), Nd4j.createFromArray(0.0), true);
      TestCase.fail("accepted calibration examples with another number of features");
    } catch (ConformalError ex) {
      TestCase.assertTrue(ex.getMessage().contains("features"));
    }
    TestCase.assertEquals(4, icp.getCalibrationSet().size());
    TestCase.assertEquals(4, icp.getCalibrationScores().size());
    TestCase.assertTrue(Arrays.equals(new double[]{0}, icp.getClasses()));
  }

  @Test
  public void testFailedScoringKeepsState() throws ConformalError {
    // scores the first feature, but cannot score label 7
    NonconformityFunction nc = new NonconformityFunction() {
      @Override
      public void fit(INDArray x, INDArray y) {
      }

      @Override
      public double[] calcNc(INDArray x, INDArray y) throws ConformalError {
        double[] labels = y.toDoubleVector();
        double[] out = new double[labels.length];
        for (int i = 0; i < labels.length; ++i) {
          if (labels[i] == 7.0) {
            throw new ConformalError("Cannot score label 7");
          }
          out[i] = x.getDouble(i, 0);
        }
        return out;
      }
    };
    IcpClassifier icp = new IcpClassifier(nc, null, false);
    INDArray cal_x = Nd4j.create(new double[][]{{0.1}, {0.4}, {0.9}});
    INDArray cal_y = Nd4j.createFromArray(0.0, 1.0, 0.0);
    icp.fit(cal_x, cal_y);
    icp.calibrate(cal_x, cal_y);
    CalibrationScores before = icp.getCalibrationScores();

    try {
      icp.calibrate(Nd4j.create(new double[][]{{0.5}}), Nd4j.createFromArray(7.0), true);
      TestCase.fail("calibrated on a label the nonconformity function rejects");
    } catch (ConformalError ex) {
      TestCase.assertTrue(ex.getMessage().contains("label 7"));
    }
    TestCase.assertEquals(3, icp.getCalibrationSet().size());
    TestCase.assertSame(before, icp.getCalibrationScores());
    TestCase.assertEquals(icp.getCalibrationSet().size(), icp.getCalibrationScores().size());
    TestCase.assertTrue(Arrays.equals(new double[]{0, 1}, icp.getClasses()));
    TestCase.assertEquals(2, icp.predict(Nd4j.create(new double[][]{{0.5}})).columns());
  }

  @Test
  public void testCallerArraysAreNotShared() throws ConformalError {
    IcpClassifier icp = new IcpClassifier(new ColumnScoreNc(), null, false);
    INDArray cal_x = Nd4j.create(new double[][]{{0.1}, {0.4}, {0.9}});
    INDArray cal_y = Nd4j.createFromArray(0.0, 0.0, 0.0);
    icp.fit(cal_x, cal_y);
    icp.calibrate(cal_x, cal_y);
    cal_x.putScalar(0, 0, 99.0);
    cal_y.putScalar(1, 5.0);

    icp.calibrate(Nd4j.create(new double[][]{{0.2}}), Nd4j.createFromArray(0.0), true);
    TestCase.assertEquals(0.1, icp.getCalibrationSet().getX().getDouble(0, 0));
    TestCase.assertTrue(Arrays.equals(new double[]{0}, icp.getClasses()));
    TestCase.assertTrue(Arrays.equals(new double[]{0.9, 0.4, 0.2, 0.1},
        icp.getCalibrationScores().get(0)));
  }

  @Test(expected = ConformalError.class)
  public void testPredictDimensionMismatch() throws ConformalError {
    scoredByColumn(false).predict(Nd4j.create(new double[][]{{0.4, 1.0}}));
  }

  @Test
  public void testUnknownCategory() throws ConformalError {
    Condition by_sign = new Condition() {
      @Override
      public int category(INDArray xRow, Double y) {
        return xRow.getDouble(0) < 0 ? 0 : 1;
      }
    };
    IcpClassifier icp = new IcpClassifier(new ColumnScoreNc(), by_sign, false);
    INDArray cal_x = Nd4j.create(new double[][]{{0.1}, {0.4}, {0.9}});
    INDArray cal_y = Nd4j.createFromArray(0.0, 1.0, 0.0);
    icp.fit(cal_x, cal_y);
    icp.calibrate(cal_x, cal_y);
    TestCase.assertTrue(icp.predict(Nd4j.create(new double[][]{{0.5}})).getDouble(0, 0) > 0);
    try {
      icp.predict(Nd4j.create(new double[][]{{-0.5}}));
      TestCase.fail("predicted in a category without calibration examples");
    } catch (ConformalError ex) {
      TestCase.assertTrue(ex.getMessage().contains("Unknown category 0"));
    }
  }
}
