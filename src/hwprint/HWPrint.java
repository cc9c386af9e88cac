package hwprint;

import hwprint.hardware.ModuleBuilder;
import hwprint.ui.HWPrintConfig;
import hwprint.util.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Holds the modules of a design and writes one IR file per top module (a module no other module instantiates).
 */
public class HWPrint {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final HWPrintConfig cfg;
  private final LinkedHashMap<String, ModuleBuilder> modules = new LinkedHashMap<>();

  public HWPrint() { this(new HWPrintConfig()); }

  public HWPrint(HWPrintConfig cfg) {
    cfg.validate();
    this.cfg = cfg;
  }

  public HWPrintConfig GetConfig() { return cfg; }

  /**
   * Creates a module using the configured clock name, pass-through directives and indentation.
   * @throws IllegalArgumentException if a module of that name exists
   */
  public ModuleBuilder AddModule(String name) {
    if (modules.containsKey(name))
      throw new IllegalArgumentException("Module " + name + " is already defined");
    ModuleBuilder module = new ModuleBuilder(name, cfg.clock_name, cfg.GetPassThroughDirectives());
    module.getBuilder().tab = cfg.indent;
    modules.put(name, module);
    logger.debug("Added module {}", name);
    return module;
  }

  public Optional<ModuleBuilder> GetModule(String name) { return Optional.ofNullable(modules.get(name)); }

  public Collection<ModuleBuilder> GetModules() { return Collections.unmodifiableCollection(modules.values()); }

  public List<ModuleBuilder> GetTopModules() {
    var instantiated = modules.values().stream().flatMap(module -> module.getInstances().stream()).collect(Collectors.toSet());
    return modules.values().stream().filter(module -> !instantiated.contains(module)).collect(Collectors.toList());
  }

  /**
   * Renders the circuit rooted at a module: the circuit header followed by every reachable module, submodules first.
   */
  public String EmitCircuit(ModuleBuilder top) {
    FileWriter toFile = new FileWriter();
    String file = top.getName() + ".fir";
    AddCircuit(toFile, file, top);
    return toFile.GetContent(file);
  }

  /**
   * Writes <code>&lt;outPath&gt;/&lt;top&gt;.fir</code> for every top module.
   * @return true iff all files were written
   */
  public boolean Generate(String outPath) {
    FileWriter toFile = new FileWriter();
    for (ModuleBuilder top : GetTopModules())
      AddCircuit(toFile, top.getName() + ".fir", top);
    try {
      toFile.WriteFiles(outPath);
    } catch (IOException e) {
      logger.error("Writing the circuit files to {} failed: {}", outPath, e.getMessage());
      return false;
    }
    return true;
  }

  private void AddCircuit(FileWriter toFile, String file, ModuleBuilder top) {
    toFile.tab = cfg.indent;
    toFile.AddFile(file, true);
    toFile.nrTabs = 0;
    toFile.UpdateContent(file, "circuit " + top.getName() + " :");
    toFile.nrTabs = 1;
    boolean first = true;
    for (ModuleBuilder module : CollectModules(top)) {
      if (!first)
        toFile.UpdateContent(file, "");
      first = false;
      toFile.UpdateContent(file, module.emit());
    }
    toFile.nrTabs = 0;
  }

  /** Returns the modules reachable from top in post-order, each once. */
  private static List<ModuleBuilder> CollectModules(ModuleBuilder top) {
    LinkedHashSet<ModuleBuilder> ret = new LinkedHashSet<>();
    CollectModules(top, ret, new ArrayList<>());
    return new ArrayList<>(ret);
  }

  private static void CollectModules(ModuleBuilder module, LinkedHashSet<ModuleBuilder> ret, List<ModuleBuilder> stack) {
    if (stack.contains(module))
      throw new IllegalStateException("Recursive instantiation of module " + module.getName());
    if (ret.contains(module))
      return;
    stack.add(module);
    for (ModuleBuilder sub : module.getInstances())
      CollectModules(sub, ret, stack);
    stack.remove(stack.size() - 1);
    ret.add(module);
  }
}
