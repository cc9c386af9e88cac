package hwprint.printable;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Rendering instruction attached to one value of a message.
 * Each directive is identified by its format letter; letters without a dedicated kind are kept as {@link Kind#Custom} and checked
 * when the message is flattened.
 */
public final class Directive {

  public enum Kind {
    /** Render through the value's default document (decimal for bit-vectors, structural for aggregates). */
    Default('s'),
    /** Short instance name of the value. */
    Name('n'),
    /** Module-relative dotted path of the value. */
    FullName('N'),
    Decimal('d'),
    Hex('x'),
    Binary('b'),
    Character('c'),
    /** Letter passed through to the backend as is. */
    Custom('?');

    public final char letter;

    private Kind(char letter) { this.letter = letter; }

    public static Optional<Kind> fromLetter(char letter) {
      return Stream.of(Kind.values()).filter(kind -> kind != Custom && kind.letter == letter).findAny();
    }
  }

  public static final Directive DEFAULT = new Directive(Kind.Default, Kind.Default.letter);
  public static final Directive NAME = new Directive(Kind.Name, Kind.Name.letter);
  public static final Directive FULL_NAME = new Directive(Kind.FullName, Kind.FullName.letter);
  public static final Directive DECIMAL = new Directive(Kind.Decimal, Kind.Decimal.letter);
  public static final Directive HEX = new Directive(Kind.Hex, Kind.Hex.letter);
  public static final Directive BINARY = new Directive(Kind.Binary, Kind.Binary.letter);
  public static final Directive CHARACTER = new Directive(Kind.Character, Kind.Character.letter);

  private final Kind kind;
  private final char letter;

  private Directive(Kind kind, char letter) {
    this.kind = kind;
    this.letter = letter;
  }

  /**
   * Returns the directive for a format letter. Known letters map to their shared constant, anything else becomes a custom directive.
   * @param letter the character following the <code>%</code>
   * @return the directive
   */
  public static Directive fromLetter(char letter) {
    var kind_opt = Kind.fromLetter(letter);
    if (kind_opt.isEmpty()) {
      if (!java.lang.Character.isLetter(letter))
        throw new FormatException(String.format("Illegal format specifier '%%%c'!", letter));
      return new Directive(Kind.Custom, letter);
    }
    switch (kind_opt.get()) {
    case Default:
      return DEFAULT;
    case Name:
      return NAME;
    case FullName:
      return FULL_NAME;
    case Decimal:
      return DECIMAL;
    case Hex:
      return HEX;
    case Binary:
      return BINARY;
    case Character:
      return CHARACTER;
    default:
      throw new IllegalStateException("Unhandled directive kind " + kind_opt.get());
    }
  }

  public Kind getKind() { return kind; }

  public char getLetter() { return letter; }

  /** The directive as it is written in a format string, e.g. <code>%x</code>. */
  public String token() { return "%" + letter; }

  /** True iff the directive can be attached to hardware values that are not bit-vectors. */
  public boolean allowedOnNonBits() { return kind == Kind.Default || kind == Kind.Name || kind == Kind.FullName; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Directive other = (Directive)obj;
    return kind == other.kind && letter == other.letter;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + letter;
  }

  @Override
  public String toString() {
    return kind == Kind.Custom ? String.format("Custom(%s)", token()) : kind.name();
  }
}
