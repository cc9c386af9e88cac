package hwprint.hardware;

import hwprint.printable.Document;
import java.util.Optional;

/**
 * Handle of a value living in the circuit graph.
 * A value is either bound as a root (wire or port of a {@link ModuleBuilder}), adopted as the child of an aggregate, or a literal.
 */
public abstract class HardwareValue {
  private ModuleBuilder owner = null;
  private String rootName = null;

  private HardwareValue parent = null;
  /** Path element relative to the parent, e.g. <code>.foo</code> or <code>[2]</code>. */
  private String pathElement = null;
  private String childName = null;

  public abstract ValueKind kind();

  /**
   * Returns the document this value is printed as if no directive is given.
   * Aggregates render their elements recursively; subclasses may override this to customise their message.
   */
  public abstract Document toPrintable();

  /** The type of this value as written in the IR, e.g. <code>UInt&lt;32&gt;</code>. */
  public abstract String irType();

  public boolean isLiteral() { return false; }

  /** True iff the value is reachable from a module, either directly or through its aggregate parents. */
  public boolean isBound() { return getRoot().owner != null; }

  /** Returns the module the root of this value is bound to. */
  public Optional<ModuleBuilder> getOwner() { return Optional.ofNullable(getRoot().owner); }

  public Optional<HardwareValue> getParent() { return Optional.ofNullable(parent); }

  /** Returns the outermost aggregate containing this value (or the value itself). */
  public HardwareValue getRoot() {
    HardwareValue cur = this;
    while (cur.parent != null)
      cur = cur.parent;
    return cur;
  }

  /**
   * Binds this value as a named root of a module.
   * @param owner the module declaring the value
   * @param name the wire or port name
   */
  void bind(ModuleBuilder owner, String name) {
    if (isLiteral())
      throw new IllegalArgumentException("Literal " + this + " cannot be bound as " + name);
    if (parent != null || this.owner != null)
      throw new IllegalArgumentException(String.format("Value already bound as '%s', cannot rebind as '%s'", describePath(), name));
    this.owner = owner;
    this.rootName = name;
  }

  /**
   * Adopts this value as the child of an aggregate.
   * @param parent the aggregate
   * @param pathElement the path suffix relative to the parent (<code>.field</code> or <code>[index]</code>)
   * @param childName the short name of the child
   */
  void adopt(HardwareValue parent, String pathElement, String childName) {
    if (isLiteral())
      throw new IllegalArgumentException("Literal " + this + " cannot be an aggregate element");
    if (this.parent != null || this.owner != null)
      throw new IllegalArgumentException("Value " + describePath() + " already belongs to another aggregate or module");
    this.parent = parent;
    this.pathElement = pathElement;
    this.childName = childName;
  }

  /**
   * Returns the path of this value relative to its owning module, e.g. <code>myBun.foo</code> or <code>myVec[0]</code>.
   * @throws IllegalStateException if the value is not bound to a module
   */
  public String localPath() {
    if (parent != null)
      return parent.localPath() + pathElement;
    if (rootName == null)
      throw new IllegalStateException("Value of type " + irType() + " is not bound to a module");
    return rootName;
  }

  /**
   * Returns the short instance name: the field name for bundle elements, the indexed name for vector elements, the wire name for roots.
   * @throws IllegalStateException if the value is not bound to a module
   */
  public String instanceName() {
    if (parent != null)
      return parent.kind() == ValueKind.Vec ? parent.instanceName() + pathElement : childName;
    if (rootName == null)
      throw new IllegalStateException("Value of type " + irType() + " is not bound to a module");
    return rootName;
  }

  private String describePath() {
    if (parent == null)
      return rootName == null ? "<unbound>" : rootName;
    return parent.describePath() + pathElement;
  }

  @Override
  public String toString() {
    return isBound() ? String.format("%s(%s)", irType(), localPath()) : irType();
  }
}
