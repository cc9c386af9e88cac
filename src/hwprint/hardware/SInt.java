package hwprint.hardware;

import java.math.BigInteger;

/** Two's complement signed bit-vector. */
public class SInt extends Bits {

  public SInt(int width) { super(width, null); }

  private SInt(int width, BigInteger literal) { super(width, literal); }

  /** Signed literal with the narrowest width that holds it (sign bit included). */
  public static SInt literal(long value) { return literal(BigInteger.valueOf(value)); }

  public static SInt literal(BigInteger value) { return literal(value, value.bitLength() + 1); }

  /**
   * Signed literal of an explicit width.
   * @throws IllegalArgumentException if the value does not fit into width bits
   */
  public static SInt literal(BigInteger value, int width) {
    if (width < value.bitLength() + 1)
      throw new IllegalArgumentException(String.format("Literal %s does not fit into %d signed bits", value, width));
    return new SInt(width, value);
  }

  @Override
  public String irType() {
    return "SInt<" + width + ">";
  }
}
