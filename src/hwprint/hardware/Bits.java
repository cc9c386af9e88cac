package hwprint.hardware;

import hwprint.printable.Document;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Bit-vector value of a fixed width, optionally a literal.
 */
public abstract class Bits extends HardwareValue {
  protected final int width;
  private final BigInteger literal;

  protected Bits(int width, BigInteger literal) {
    if (width <= 0)
      throw new IllegalArgumentException("Bit-vector width must be positive, got " + width);
    this.width = width;
    this.literal = literal;
  }

  public int getWidth() { return width; }

  public Optional<BigInteger> getLiteral() { return Optional.ofNullable(literal); }

  @Override
  public boolean isLiteral() {
    return literal != null;
  }

  @Override
  public ValueKind kind() {
    return ValueKind.BitVector;
  }

  /** Bit-vectors print as decimals by default. */
  @Override
  public Document toPrintable() {
    return Document.decimal(this);
  }

  /**
   * Returns the IR expression of this literal, e.g. <code>UInt&lt;4&gt;("ha")</code>.
   * @throws IllegalStateException if the value is not a literal
   */
  public String literalText() {
    if (literal == null)
      throw new IllegalStateException("Not a literal: " + this);
    return String.format("%s(\"h%s\")", irType(), literal.toString(16));
  }

  @Override
  public String toString() {
    return isLiteral() ? literalText() : super.toString();
  }
}
