package ml.dmlc.conformal4j;

import org.apache.commons.lang.ArrayUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;
import java.util.TreeSet;

/**
 * Inductive conformal classifier. Computes, for every test example and every
 * class label seen during calibration, the p-value of the example carrying
 * that label.
 *
 * <pre>
 * IcpClassifier icp = new IcpClassifier(nc);
 * icp.fit(trainX, trainY);
 * icp.calibrate(calX, calY);
 * INDArray sets = icp.predict(testX, 0.1);
 * </pre>
 */
public class IcpClassifier extends BaseIcp<NonconformityFunction> {
  private static final Log logger = LogFactory.getLog(IcpClassifier.class);
  private final boolean smoothing;
  private final Random random;
  private double[] classes;

  /**
   * Create an unconditional conformal classifier with smoothed p-values
   * @param nc_function nonconformity function
   */
  public IcpClassifier(NonconformityFunction nc_function) {
    this(nc_function, null, true);
  }

  /**
   * Create a conformal classifier
   * @param nc_function nonconformity function
   * @param condition maps examples to categories; ``null`` for unconditional calibration
   * @param smoothing whether to break ties between equal scores at random
   */
  public IcpClassifier(NonconformityFunction nc_function, Condition condition,
                       boolean smoothing) {
    this(nc_function, condition, smoothing, new Random(), false);
  }

  /**
   * Create a conformal classifier
   * @param nc_function nonconformity function
   * @param condition maps examples to categories; ``null`` for unconditional calibration
   * @param smoothing whether to break ties between equal scores at random
   * @param random source of the uniform draws used by smoothing
   * @param verbose whether to print extra diagnostic messages
   */
  public IcpClassifier(NonconformityFunction nc_function, Condition condition,
                       boolean smoothing, Random random, boolean verbose) {
    super(nc_function, condition, verbose);
    this.smoothing = smoothing;
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  protected void calibrateHook(INDArray y, boolean increment) {
    double[] labels = y.toDoubleVector();
    if (this.classes == null || !increment) {
      this.classes = unique(labels);
    } else {
      this.classes = unique(ArrayUtils.addAll(this.classes, labels));
    }
  }

  /**
   * Compute p-values of every test example for every class
   * @param x inputs of the test examples, of dimension ``[num_row]*[num_feature]``
   * @return p-values, of dimension ``[num_row]*[num_class]``; column ``i``
   *         belongs to ``getClasses()[i]``
   * @throws ConformalError if the predictor is not calibrated, or a test
   *                        example falls into a category unseen during calibration
   */
  public INDArray predict(INDArray x) throws ConformalError {
    checkReady(x);
    CalibrationScores cal_scores = getCalibrationScores();
    Condition condition = getCondition();
    int n_test = x.rows();
    INDArray p = Nd4j.zeros(DataType.DOUBLE, (long) n_test, (long) this.classes.length);
    double[] test_class = new double[n_test];
    for (int i = 0; i < this.classes.length; ++i) {
      double c = this.classes[i];
      Arrays.fill(test_class, c);
      double[] test_nc_scores = score(x, Nd4j.createFromArray(test_class));
      for (int j = 0; j < n_test; ++j) {
        int category = condition.category(x.getRow(j), c);
        double nc = test_nc_scores[j];
        int n_cal = cal_scores.size(category);
        int n_gt = cal_scores.countGreater(category, nc);
        // the test example ties with itself
        int n_eq = cal_scores.countEqual(category, nc) + 1;
        double u = this.smoothing ? this.random.nextDouble() : 1.0;
        p.putScalar(j, i, pValue(n_gt, n_eq, n_cal, u));
      }
    }
    return p;
  }

  /**
   * Compute prediction sets at a significance level
   * @param x inputs of the test examples, of dimension ``[num_row]*[num_feature]``
   * @param significance maximum allowed error rate, in ``(0, 1)``
   * @return boolean matrix of dimension ``[num_row]*[num_class]``; an entry is
   *         ``true`` when the class belongs to the prediction set of the example,
   *         i.e. its p-value exceeds ``significance``
   * @throws ConformalError if ``significance`` is out of range, or prediction fails
   */
  public INDArray predict(INDArray x, double significance) throws ConformalError {
    checkSignificance(significance);
    INDArray p = predict(x);
    if (logger.isWarnEnabled()) {
      warnIfTrivial(significance);
    }
    return p.gt(significance);
  }

  static double pValue(int n_gt, int n_eq, int n_cal, double u) {
    return (n_gt + n_eq * u) / (n_cal + 1);
  }

  private void warnIfTrivial(double significance) throws ConformalError {
    CalibrationScores cal_scores = getCalibrationScores();
    for (int category : cal_scores.getCategories()) {
      int n_cal = cal_scores.size(category);
      if (!this.smoothing && significance < 1.0 / (n_cal + 1)) {
        logger.warn(String.format(
            "Category %d has only %d calibration examples; every class is "
                + "included at significance %s", category, n_cal, significance));
      }
    }
  }

  private static double[] unique(double[] labels) {
    TreeSet<Double> set = new TreeSet<>(Arrays.asList(ArrayUtils.toObject(labels)));
    return ArrayUtils.toPrimitive(set.toArray(new Double[0]));
  }

  /**
   * Get the class labels seen during calibration, in ascending order
   * @return class labels, or ``null`` before the first calibration
   */
  public double[] getClasses() {
    return this.classes == null ? null : this.classes.clone();
  }

  public boolean isSmoothing() {
    return this.smoothing;
  }
}
