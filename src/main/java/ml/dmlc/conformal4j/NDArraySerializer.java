package ml.dmlc.conformal4j;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

/**
 * Kryo serializer for nd4j arrays. Goes through the nd4j binary format
 * instead of the fields of the array, which point into native memory.
 */
class NDArraySerializer extends Serializer<INDArray> {
  @Override
  public void write(Kryo kryo, Output out, INDArray array) {
    byte[] bytes = Nd4j.toByteArray(array);
    out.writeInt(bytes.length);
    out.writeBytes(bytes);
  }

  @Override
  public INDArray read(Kryo kryo, Input in, Class<? extends INDArray> type) {
    int length = in.readInt();
    return Nd4j.fromByteArray(in.readBytes(length));
  }

  @Override
  public INDArray copy(Kryo kryo, INDArray original) {
    return original.dup();
  }
}
