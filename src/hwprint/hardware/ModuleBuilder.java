package hwprint.hardware;

import hwprint.backend.FirrtlBuilder;
import hwprint.backend.PrintStatement;
import hwprint.printable.ArgumentToken;
import hwprint.printable.Document;
import hwprint.printable.FlattenedMessage;
import hwprint.printable.Flattener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds one module of the circuit: its ports, wires, submodule instances and print statements.
 * Print messages are flattened when the statement is added, with names resolved relative to this module.
 */
public class ModuleBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String name;
  private final Clock clock = new Clock();
  private final ModuleNaming naming = new ModuleNaming(this);
  private final FirrtlBuilder builder;
  private final Flattener flattener;
  private final LinkedHashMap<String, HardwareValue> signals = new LinkedHashMap<>();
  private final LinkedHashMap<String, ModuleBuilder> instances = new LinkedHashMap<>();

  public ModuleBuilder(String name) { this(name, "clock", Collections.emptySet()); }

  /**
   * @param name module name
   * @param clockName name of the implicit clock input
   * @param passThroughDirectives custom directive letters accepted by the backend
   */
  public ModuleBuilder(String name, String clockName, Set<Character> passThroughDirectives) {
    this.name = name;
    this.builder = new FirrtlBuilder(name, naming);
    this.flattener = new Flattener(naming, passThroughDirectives);
    port(clockName, clock, true);
  }

  public String getName() { return name; }

  public Clock getClock() { return clock; }

  public Naming getNaming() { return naming; }

  public FirrtlBuilder getBuilder() { return builder; }

  /** Declares a wire. */
  public <T extends HardwareValue> T wire(String wireName, T value) {
    value.bind(this, wireName);
    builder.declareWire(wireName, value);
    signals.put(wireName, value);
    return value;
  }

  public <T extends HardwareValue> T input(String portName, T value) { return port(portName, value, true); }

  public <T extends HardwareValue> T output(String portName, T value) { return port(portName, value, false); }

  private <T extends HardwareValue> T port(String portName, T value, boolean isInput) {
    value.bind(this, portName);
    builder.declarePort(portName, value, isInput);
    signals.put(portName, value);
    return value;
  }

  /**
   * Instantiates another module inside this one. The ports of the submodule can then be printed from this module.
   * @return the submodule
   */
  public ModuleBuilder instance(String instName, ModuleBuilder module) {
    if (module == this)
      throw new IllegalArgumentException("Module " + name + " cannot instantiate itself");
    if (instances.containsValue(module))
      throw new IllegalArgumentException("Module " + module.getName() + " is already instantiated in " + name);
    builder.declareInstance(instName, module.getName());
    instances.put(instName, module);
    return module;
  }

  public Optional<String> instanceNameOf(ModuleBuilder module) {
    return instances.entrySet().stream().filter(entry -> entry.getValue() == module).map(Map.Entry::getKey).findFirst();
  }

  public List<ModuleBuilder> getInstances() { return new ArrayList<>(instances.values()); }

  /** Looks up a port, wire or instance port by name, e.g. <code>myWire</code> or <code>myInst.io</code>. */
  public Optional<HardwareValue> lookup(String signalName) {
    HardwareValue ret = signals.get(signalName);
    if (ret != null)
      return Optional.of(ret);
    int dot = signalName.indexOf('.');
    if (dot < 0)
      return Optional.empty();
    ModuleBuilder sub = instances.get(signalName.substring(0, dot));
    if (sub == null)
      return Optional.empty();
    return sub.lookup(signalName.substring(dot + 1)).filter(value -> value.getOwner().orElse(null) == sub);
  }

  /** Adds a print statement that fires on every clock cycle. */
  public PrintStatement printf(Document message) { return printf(Bool.literal(true), message); }

  /**
   * Adds a print statement.
   * @param condition 1-bit enable
   * @param message the message
   * @return handle of the statement
   * @throws hwprint.printable.FormatException if the message cannot be flattened
   * @throws IllegalStateException if the message refers to values not visible from this module
   */
  public PrintStatement printf(Bits condition, Document message) {
    FlattenedMessage flat = flattener.flatten(message);
    // Resolve all references now so that errors point at the printf rather than at emission.
    for (ArgumentToken arg : flat.arguments())
      naming.fullName(arg.value());
    naming.fullName(condition);
    logger.debug("Module {}: printf \"{}\"", name, flat.formatString());
    return builder.emitFormatStatement(flat.formatString(), flat.arguments(), condition, clock);
  }

  /** Renders this module as IR text. */
  public String emit() { return builder.emit(); }

  @Override
  public String toString() {
    return "ModuleBuilder(" + name + ")";
  }
}
