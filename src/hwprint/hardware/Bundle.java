package hwprint.hardware;

import hwprint.printable.Document;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collection of named hardware values, kept in declaration order.
 * Subclasses declare their fields in the constructor or initializer:
 * <pre>
 * class MyBundle extends Bundle {
 *   final UInt foo = field("foo", new UInt(32));
 * }
 * </pre>
 */
public class Bundle extends HardwareValue {
  private final LinkedHashMap<String, HardwareValue> fields = new LinkedHashMap<>();
  private final String typeName;

  public Bundle() { this.typeName = null; }

  /** Creates a bundle printed under an explicit type name. */
  public Bundle(String typeName) { this.typeName = typeName; }

  /**
   * Adds a field to this bundle.
   * @return the adopted field value
   */
  public <T extends HardwareValue> T field(String name, T value) {
    if (fields.containsKey(name))
      throw new IllegalArgumentException("Duplicate bundle field '" + name + "'");
    value.adopt(this, "." + name, name);
    fields.put(name, value);
    return value;
  }

  public HardwareValue get(String name) {
    HardwareValue ret = fields.get(name);
    if (ret == null)
      throw new IllegalArgumentException("Bundle " + getTypeName() + " has no field '" + name + "'");
    return ret;
  }

  public Map<String, HardwareValue> getFields() { return Collections.unmodifiableMap(fields); }

  /** The name the bundle is printed with: the explicit type name, the class name, or AnonymousBundle. */
  public String getTypeName() {
    if (typeName != null)
      return typeName;
    if (getClass() == Bundle.class || getClass().isAnonymousClass())
      return "AnonymousBundle";
    return getClass().getSimpleName();
  }

  @Override
  public ValueKind kind() {
    return ValueKind.Bundle;
  }

  /** Renders as <code>TypeName(field -&gt; value, ...)</code>. */
  @Override
  public Document toPrintable() {
    Document doc = Document.literal(getTypeName() + "(");
    boolean first = true;
    for (Map.Entry<String, HardwareValue> field : fields.entrySet()) {
      if (!first)
        doc = doc.plus(", ");
      first = false;
      doc = doc.plus(field.getKey() + " -> ").concat(field.getValue().toPrintable());
    }
    return doc.plus(")");
  }

  @Override
  public String irType() {
    return fields.entrySet()
        .stream()
        .map(field -> field.getKey() + " : " + field.getValue().irType())
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
