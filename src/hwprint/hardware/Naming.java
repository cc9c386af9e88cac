package hwprint.hardware;

/**
 * Resolves hardware values to the names printed for <code>%n</code> and <code>%N</code> and used as argument references.
 * Implementations are bound to one elaboration context; see {@link ModuleNaming}.
 */
public interface Naming {
  /**
   * Short instance name of a value.
   * @throws IllegalStateException if the value is not bound into the circuit
   */
  String shortName(HardwareValue value);

  /**
   * Dotted path of a value, as referenced from the naming context.
   * @throws IllegalStateException if the value is not bound into the circuit or not visible from the context
   */
  String fullName(HardwareValue value);
}
