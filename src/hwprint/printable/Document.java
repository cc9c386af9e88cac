package hwprint.printable;

import hwprint.hardware.Bits;
import hwprint.hardware.HardwareValue;
import hwprint.printable.Fragment.NameKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable message to be printed by the circuit, as an ordered sequence of {@link Fragment}s.
 * Composition always creates a new document; fragment order is kept through concatenation and nesting.
 */
public final class Document {
  private static final Document EMPTY = new Document(Collections.emptyList());

  private final List<Fragment> fragments;

  private Document(List<Fragment> fragments) { this.fragments = fragments; }

  public static Document empty() { return EMPTY; }

  public static Document of(Fragment... fragments) { return of(Arrays.asList(fragments)); }

  public static Document of(List<Fragment> fragments) {
    if (fragments.isEmpty())
      return EMPTY;
    return new Document(Collections.unmodifiableList(new ArrayList<>(fragments)));
  }

  public static Document literal(String text) { return of(literalFragment(text)); }

  /** Document holding one escaped percent sign. */
  public static Document percent() { return of(percentFragment()); }

  /**
   * Document rendering a hardware value with a directive.
   * Name directives produce a name lookup, all others a value reference.
   * @throws FormatException if the directive does not apply to the value's kind
   */
  public static Document value(HardwareValue value, Directive directive) { return of(valueFragment(value, directive)); }

  public static Document decimal(Bits value) { return value(value, Directive.DECIMAL); }

  public static Document hexadecimal(Bits value) { return value(value, Directive.HEX); }

  public static Document binary(Bits value) { return value(value, Directive.BINARY); }

  public static Document character(Bits value) { return value(value, Directive.CHARACTER); }

  public static Document name(HardwareValue value) { return of(new Fragment.NameRef(value, NameKind.Short)); }

  public static Document fullName(HardwareValue value) { return of(new Fragment.NameRef(value, NameKind.Full)); }

  public static Fragment literalFragment(String text) { return new Fragment.Literal(text); }

  public static Fragment percentFragment() { return Fragment.Percent.INSTANCE; }

  public static Fragment nestedFragment(Document document) { return new Fragment.Nested(document); }

  public static Fragment valueFragment(HardwareValue value, Directive directive) {
    switch (directive.getKind()) {
    case Name:
      return new Fragment.NameRef(value, NameKind.Short);
    case FullName:
      return new Fragment.NameRef(value, NameKind.Full);
    default:
      return new Fragment.ValueRef(value, directive);
    }
  }

  public List<Fragment> getFragments() { return fragments; }

  public boolean isEmpty() { return fragments.isEmpty(); }

  /** Appends another document. Associative, with {@link #empty()} as identity. */
  public Document concat(Document other) {
    if (other.isEmpty())
      return this;
    if (this.isEmpty())
      return other;
    List<Fragment> combined = new ArrayList<>(fragments.size() + other.fragments.size());
    combined.addAll(fragments);
    combined.addAll(other.fragments);
    return new Document(Collections.unmodifiableList(combined));
  }

  public Document plus(String text) { return concat(literal(text)); }

  /** Embeds this document as a single nested fragment. */
  public Fragment asNested() { return nestedFragment(this); }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Document && ((Document)obj).fragments.equals(fragments);
  }

  @Override
  public int hashCode() {
    return fragments.hashCode();
  }

  @Override
  public String toString() {
    return fragments.stream().map(Fragment::toString).collect(Collectors.joining(", ", "Document(", ")"));
  }
}
