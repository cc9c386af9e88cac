package hwprint.backend;

import hwprint.hardware.Bits;
import hwprint.hardware.Clock;
import hwprint.hardware.HardwareValue;
import hwprint.hardware.Naming;
import hwprint.printable.ArgumentToken;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the declarations and print statements of one module and renders them as FIRRTL-style text:
 * <pre>
 * module MyModule :
 *   input clock : Clock
 *   wire myWire : UInt&lt;32&gt;
 *   printf(clock, UInt&lt;1&gt;("h1"), "myWire = %d", myWire) : printf
 * </pre>
 */
public class FirrtlBuilder implements IRBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public String tab = "  ";

  private final String moduleName;
  private final Naming naming;
  private final List<String> ports = new ArrayList<>();
  private final List<String> declarations = new ArrayList<>();
  private final List<PrintStatement> statements = new ArrayList<>();
  private final Namespace namespace = new Namespace();

  /**
   * @param moduleName name of the emitted module
   * @param naming resolves argument, condition and clock references
   */
  public FirrtlBuilder(String moduleName, Naming naming) {
    this.moduleName = moduleName;
    this.naming = naming;
  }

  public void declarePort(String name, HardwareValue value, boolean input) {
    namespace.reserve(name);
    ports.add(String.format("%s %s : %s", input ? "input" : "output", name, value.irType()));
  }

  public void declareWire(String name, HardwareValue value) {
    namespace.reserve(name);
    declarations.add(String.format("wire %s : %s", name, value.irType()));
  }

  public void declareInstance(String name, String instModuleName) {
    namespace.reserve(name);
    declarations.add(String.format("inst %s of %s", name, instModuleName));
  }

  @Override
  public PrintStatement emitFormatStatement(String formatString, List<ArgumentToken> args, HardwareValue condition, HardwareValue clock) {
    if (!(condition instanceof Bits) || ((Bits)condition).getWidth() != 1)
      throw new IllegalArgumentException("Print condition must be a 1-bit value, got " + condition);
    if (!(clock instanceof Clock))
      throw new IllegalArgumentException("Print clock must be a clock, got " + clock);
    PrintStatement statement = new PrintStatement(formatString, args, condition, clock);
    statements.add(statement);
    logger.trace("Module {}: added {}", moduleName, statement);
    return statement;
  }

  public List<PrintStatement> getStatements() { return Collections.unmodifiableList(statements); }

  /**
   * Renders the module. Statement names are assigned here, in statement order: the suggested name or <code>printf</code>,
   * suffixed with <code>_1</code>, <code>_2</code>, ... on a clash.
   */
  public String emit() {
    Namespace statementNamespace = namespace.copy();
    StringBuilder ret = new StringBuilder();
    ret.append("module ").append(moduleName).append(" :\n");
    ports.forEach(port -> ret.append(tab).append(port).append("\n"));
    if (!declarations.isEmpty()) {
      ret.append("\n");
      declarations.forEach(decl -> ret.append(tab).append(decl).append("\n"));
    }
    if (!statements.isEmpty()) {
      ret.append("\n");
      for (PrintStatement statement : statements) {
        String name = statementNamespace.newName(statement.getSuggestedName().orElse("printf"));
        ret.append(tab).append(printLine(statement, name)).append("\n");
      }
    }
    return ret.toString();
  }

  String printLine(PrintStatement statement, String name) {
    String args = statement.getArgs().stream().map(arg -> ", " + naming.fullName(arg.value())).collect(Collectors.joining());
    return String.format("printf(%s, %s, \"%s\"%s) : %s", naming.fullName(statement.getClock()), naming.fullName(statement.getCondition()),
                         escape(statement.getFormatString()), args, name);
  }

  /** Escapes a format string for a double-quoted IR string literal. */
  public static String escape(String text) {
    StringBuilder ret = new StringBuilder(text.length());
    for (char c : text.toCharArray()) {
      switch (c) {
      case '\\':
        ret.append("\\\\");
        break;
      case '"':
        ret.append("\\\"");
        break;
      case '\t':
        ret.append("\\t");
        break;
      case '\n':
        ret.append("\\n");
        break;
      case '\r':
        ret.append("\\r");
        break;
      case '\b':
        ret.append("\\b");
        break;
      case '\f':
        ret.append("\\f");
        break;
      default:
        // remaining control characters have no short escape
        if (c < 0x20)
          ret.append(String.format("\\u%04x", (int)c));
        else
          ret.append(c);
      }
    }
    return ret.toString();
  }

  /** Set of names used in a module. */
  private static class Namespace {
    private final HashSet<String> used = new HashSet<>();

    void reserve(String name) {
      if (!used.add(name))
        throw new IllegalArgumentException("Name '" + name + "' is already declared");
    }

    String newName(String base) {
      String name = base;
      for (int i = 1; !used.add(name); ++i)
        name = base + "_" + i;
      return name;
    }

    Namespace copy() {
      Namespace ret = new Namespace();
      ret.used.addAll(used);
      return ret;
    }
  }
}
