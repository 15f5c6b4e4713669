package ml.dmlc.conformal4j;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoSerializable;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import org.apache.commons.lang.ArrayUtils;

import java.io.IOException;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Nonconformity scores of the calibration examples, kept per category and
 * sorted in descending order. A table is built in one go and never modified
 * afterwards; recalibration builds a new table.
 */
public class CalibrationScores implements Serializable, KryoSerializable {
  private static final long serialVersionUID = 1L;
  private transient TreeMap<Integer, double[]> scores;

  /**
   * Build a score table.
   * @param scores unsorted nonconformity scores of each category
   */
  public CalibrationScores(Map<Integer, double[]> scores) {
    this.scores = new TreeMap<>();
    for (Map.Entry<Integer, double[]> e : scores.entrySet()) {
      double[] sorted = e.getValue().clone();
      Arrays.sort(sorted);
      ArrayUtils.reverse(sorted);
      this.scores.put(e.getKey(), sorted);
    }
  }

  // used by Kryo
  private CalibrationScores() {
    this.scores = new TreeMap<>();
  }

  /**
   * Get the categories present in the table, in ascending order
   * @return category ids
   */
  public int[] getCategories() {
    return ArrayUtils.toPrimitive(this.scores.keySet().toArray(new Integer[0]));
  }

  /**
   * Test whether the table holds scores for a category
   * @param category category id
   * @return whether the category was seen during calibration
   */
  public boolean contains(int category) {
    return this.scores.containsKey(category);
  }

  /**
   * Get the scores of a category, sorted in descending order
   * @param category category id
   * @return copy of the scores of the category
   * @throws ConformalError if the category was never seen during calibration
   */
  public double[] get(int category) throws ConformalError {
    return lookup(category).clone();
  }

  /**
   * Get the number of scores of a category
   * @param category category id
   * @return number of calibration examples in the category
   * @throws ConformalError if the category was never seen during calibration
   */
  public int size(int category) throws ConformalError {
    return lookup(category).length;
  }

  /**
   * Get the total number of scores over all categories
   * @return number of calibration examples
   */
  public int size() {
    int total = 0;
    for (double[] s : this.scores.values()) {
      total += s.length;
    }
    return total;
  }

  /**
   * Count the calibration scores of a category strictly greater than ``score``
   * @param category category id
   * @param score nonconformity score of a test example
   * @return number of greater scores
   * @throws ConformalError if the category was never seen during calibration
   */
  public int countGreater(int category, double score) throws ConformalError {
    return countGreater(lookup(category), score);
  }

  /**
   * Count the calibration scores of a category equal to ``score``
   * @param category category id
   * @param score nonconformity score of a test example
   * @return number of equal scores
   * @throws ConformalError if the category was never seen during calibration
   */
  public int countEqual(int category, double score) throws ConformalError {
    double[] s = lookup(category);
    return countGreaterOrEqual(s, score) - countGreater(s, score);
  }

  private double[] lookup(int category) throws ConformalError {
    double[] s = this.scores.get(category);
    if (s == null) {
      throw new ConformalError(String.format(
          "Unknown category %d: no calibration example belongs to it; "
              + "calibrated categories are %s",
          category, this.scores.keySet()));
    }
    return s;
  }

  /* Both searches run over scores sorted in descending order. */

  static int countGreater(double[] desc, double score) {
    int lo = 0;
    int hi = desc.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (desc[mid] > score) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  static int countGreaterOrEqual(double[] desc, double score) {
    int lo = 0;
    int hi = desc.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (desc[mid] >= score) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  private void writeObject(java.io.ObjectOutputStream out) throws IOException {
    out.writeInt(this.scores.size());
    for (Map.Entry<Integer, double[]> e : this.scores.entrySet()) {
      out.writeInt(e.getKey());
      out.writeInt(e.getValue().length);
      for (double v : e.getValue()) {
        out.writeDouble(v);
      }
    }
  }

  private void readObject(java.io.ObjectInputStream in)
      throws IOException, ClassNotFoundException {
    this.scores = new TreeMap<>();
    int num_category = in.readInt();
    for (int i = 0; i < num_category; ++i) {
      int category = in.readInt();
      double[] s = new double[in.readInt()];
      for (int k = 0; k < s.length; ++k) {
        s[k] = in.readDouble();
      }
      this.scores.put(category, s);
    }
  }

  @Override
  public void write(Kryo kryo, Output out) {
    out.writeInt(this.scores.size());
    for (Map.Entry<Integer, double[]> e : this.scores.entrySet()) {
      out.writeInt(e.getKey());
      out.writeInt(e.getValue().length);
      out.writeDoubles(e.getValue(), 0, e.getValue().length);
    }
  }

  @Override
  public void read(Kryo kryo, Input in) {
    this.scores = new TreeMap<>();
    int num_category = in.readInt();
    for (int i = 0; i < num_category; ++i) {
      int category = in.readInt();
      int length = in.readInt();
      this.scores.put(category, in.readDoubles(length));
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CalibrationScores{");
    for (Map.Entry<Integer, double[]> e : this.scores.entrySet()) {
      if (sb.length() > "CalibrationScores{".length()) {
        sb.append(", ");
      }
      sb.append(e.getKey()).append('=').append(e.getValue().length);
    }
    return sb.append('}').toString();
  }
}
