package hwprint.hardware;

import hwprint.printable.Document;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Indexed collection of hardware values of the same type.
 */
public class Vec<T extends HardwareValue> extends HardwareValue {
  private final List<T> elements;

  /**
   * Creates a vector adopting the given elements. The elements must not be bound or part of another aggregate.
   */
  public Vec(List<T> elements) {
    if (elements.isEmpty())
      throw new IllegalArgumentException("Vec needs at least one element to derive its type");
    this.elements = new ArrayList<>(elements);
    String elementType = elements.get(0).irType();
    for (int i = 0; i < this.elements.size(); ++i) {
      T element = this.elements.get(i);
      if (!element.irType().equals(elementType))
        throw new IllegalArgumentException(String.format("Vec elements must share one type, got %s and %s", elementType, element.irType()));
      element.adopt(this, "[" + i + "]", Integer.toString(i));
    }
  }

  public static <T extends HardwareValue> Vec<T> fill(int size, Supplier<T> gen) {
    List<T> elements = new ArrayList<>(size);
    for (int i = 0; i < size; ++i)
      elements.add(gen.get());
    return new Vec<>(elements);
  }

  public T get(int index) { return elements.get(index); }

  public int size() { return elements.size(); }

  public List<T> getElements() { return Collections.unmodifiableList(elements); }

  @Override
  public ValueKind kind() {
    return ValueKind.Vec;
  }

  /** Renders as <code>Vec(e0, e1, ...)</code>. */
  @Override
  public Document toPrintable() {
    Document doc = Document.literal("Vec(");
    for (int i = 0; i < elements.size(); ++i) {
      if (i > 0)
        doc = doc.plus(", ");
      doc = doc.concat(elements.get(i).toPrintable());
    }
    return doc.plus(")");
  }

  @Override
  public String irType() {
    return elements.get(0).irType() + "[" + elements.size() + "]";
  }
}
