package hwprint.hardware;

import java.math.BigInteger;

/** Unsigned bit-vector. */
public class UInt extends Bits {

  public UInt(int width) { super(width, null); }

  protected UInt(int width, BigInteger literal) { super(width, literal); }

  /** Unsigned literal with the narrowest width that holds it. */
  public static UInt literal(long value) { return literal(BigInteger.valueOf(value)); }

  /** Unsigned literal with the narrowest width that holds it. */
  public static UInt literal(BigInteger value) { return literal(value, minWidth(value)); }

  /**
   * Unsigned literal of an explicit width.
   * @throws IllegalArgumentException if the value is negative or does not fit into width bits
   */
  public static UInt literal(BigInteger value, int width) {
    if (value.signum() < 0)
      throw new IllegalArgumentException("Unsigned literal cannot be negative: " + value);
    if (width < minWidth(value))
      throw new IllegalArgumentException(String.format("Literal %s does not fit into %d bits", value, width));
    return new UInt(width, value);
  }

  static int minWidth(BigInteger value) { return Math.max(1, value.bitLength()); }

  @Override
  public String irType() {
    return "UInt<" + width + ">";
  }
}
