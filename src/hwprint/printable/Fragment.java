package hwprint.printable;

import hwprint.hardware.HardwareValue;
import hwprint.hardware.ValueKind;
import java.util.Objects;

/**
 * One piece of a {@link Document}. The set of fragment kinds is closed; use {@link #getKind()} to dispatch.
 */
public abstract class Fragment {

  public enum Kind {
    /** Escape-processed text. */
    Literal,
    /** A literal percent sign split out of directive-mode text. */
    Percent,
    /** A hardware value rendered with a directive. */
    ValueRef,
    /** The name of a hardware value, resolved to text during flattening. */
    NameRef,
    /** An embedded document. */
    Nested
  }

  public enum NameKind { Short, Full }

  private Fragment() {}

  public abstract Kind getKind();

  public static final class Literal extends Fragment {
    private final String text;

    Literal(String text) { this.text = Objects.requireNonNull(text); }

    public String getText() { return text; }

    @Override
    public Kind getKind() {
      return Kind.Literal;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Literal && ((Literal)obj).text.equals(text);
    }
    @Override
    public int hashCode() {
      return text.hashCode();
    }
    @Override
    public String toString() {
      return "Literal(\"" + text + "\")";
    }
  }

  public static final class Percent extends Fragment {
    static final Percent INSTANCE = new Percent();

    private Percent() {}

    @Override
    public Kind getKind() {
      return Kind.Percent;
    }
    @Override
    public String toString() {
      return "Percent";
    }
  }

  public static final class ValueRef extends Fragment {
    private final HardwareValue value;
    private final Directive directive;

    /**
     * @throws FormatException if the directive cannot be applied to the kind of value
     */
    ValueRef(HardwareValue value, Directive directive) {
      this.value = Objects.requireNonNull(value);
      this.directive = Objects.requireNonNull(directive);
      if (value.kind() != ValueKind.BitVector && !directive.allowedOnNonBits())
        throw new FormatException(
            String.format("Illegal format specifier '%s'! Values of kind %s only accept %%s, %%n and %%N", directive.token(), value.kind()));
    }

    public HardwareValue getValue() { return value; }

    public Directive getDirective() { return directive; }

    @Override
    public Kind getKind() {
      return Kind.ValueRef;
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ValueRef))
        return false;
      ValueRef other = (ValueRef)obj;
      return other.value == value && other.directive.equals(directive);
    }
    @Override
    public int hashCode() {
      return System.identityHashCode(value) * 31 + directive.hashCode();
    }
    @Override
    public String toString() {
      return String.format("ValueRef(%s, %s)", value, directive);
    }
  }

  public static final class NameRef extends Fragment {
    private final HardwareValue value;
    private final NameKind nameKind;

    NameRef(HardwareValue value, NameKind nameKind) {
      this.value = Objects.requireNonNull(value);
      this.nameKind = Objects.requireNonNull(nameKind);
    }

    public HardwareValue getValue() { return value; }

    public NameKind getNameKind() { return nameKind; }

    @Override
    public Kind getKind() {
      return Kind.NameRef;
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof NameRef))
        return false;
      NameRef other = (NameRef)obj;
      return other.value == value && other.nameKind == nameKind;
    }
    @Override
    public int hashCode() {
      return System.identityHashCode(value) * 31 + nameKind.hashCode();
    }
    @Override
    public String toString() {
      return String.format("NameRef(%s, %s)", value, nameKind);
    }
  }

  public static final class Nested extends Fragment {
    private final Document document;

    Nested(Document document) { this.document = Objects.requireNonNull(document); }

    public Document getDocument() { return document; }

    @Override
    public Kind getKind() {
      return Kind.Nested;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Nested && ((Nested)obj).document.equals(document);
    }
    @Override
    public int hashCode() {
      return document.hashCode();
    }
    @Override
    public String toString() {
      return "Nested(" + document + ")";
    }
  }
}
