package hwprint.hardware;

import java.math.BigInteger;

/** Single-bit unsigned value. */
public class Bool extends UInt {

  public Bool() { super(1); }

  private Bool(BigInteger literal) { super(1, literal); }

  public static Bool literal(boolean value) { return new Bool(value ? BigInteger.ONE : BigInteger.ZERO); }
}
