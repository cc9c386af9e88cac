package hwprint.hardware;

/**
 * Names values as seen from one module: its own wires and ports by their local path, ports of its submodule instances prefixed by
 * the instance name, literals by their IR expression.
 */
public class ModuleNaming implements Naming {
  private final ModuleBuilder context;

  public ModuleNaming(ModuleBuilder context) { this.context = context; }

  @Override
  public String shortName(HardwareValue value) {
    if (value.isLiteral())
      return ((Bits)value).literalText();
    return value.instanceName();
  }

  @Override
  public String fullName(HardwareValue value) {
    if (value.isLiteral())
      return ((Bits)value).literalText();
    ModuleBuilder owner =
        value.getOwner().orElseThrow(() -> new IllegalStateException("Value of type " + value.irType() + " is not bound to a module"));
    if (owner == context)
      return value.localPath();
    String instName = context.instanceNameOf(owner).orElseThrow(
        () -> new IllegalStateException(String.format("%s belongs to module %s, which is not instantiated in %s", value.localPath(),
                                                      owner.getName(), context.getName())));
    return instName + "." + value.localPath();
  }
}
