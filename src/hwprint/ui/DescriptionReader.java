package hwprint.ui;

import hwprint.HWPrint;
import hwprint.backend.PrintStatement;
import hwprint.frontend.Messages;
import hwprint.frontend.MessageTemplate;
import hwprint.frontend.TemplateParser;
import hwprint.hardware.Bits;
import hwprint.hardware.Bool;
import hwprint.hardware.Bundle;
import hwprint.hardware.Clock;
import hwprint.hardware.HardwareValue;
import hwprint.hardware.ModuleBuilder;
import hwprint.hardware.SInt;
import hwprint.hardware.UInt;
import hwprint.hardware.Vec;
import hwprint.printable.Document;
import hwprint.printable.FormatException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a YAML list of module descriptions and builds the modules, their signals and print statements in a {@link HWPrint}.
 * <pre>
 * - module: MyModule
 *   instances: [{name: myInst, module: MySubModule}]
 *   ports:     [{name: io, direction: output, type: Bundle, fields: [{name: fizz, type: UInt, width: 32}]}]
 *   signals:   [{name: myWire, type: UInt, width: 32}, {name: b1, type: UInt, literal: 10}]
 *   values:    {f1: 20.45156}
 *   printf:    [{message: "F1 = $f1%2.2f wire = ${myWire}%x", mode: cf, name: howdy, condition: en}]
 * </pre>
 * Modules must be described before they are instantiated.
 */
public class DescriptionReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern ROOT_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern PATH_ELEMENT = Pattern.compile("\\.([A-Za-z_][A-Za-z0-9_]*)|\\[(\\d+)\\]");

  private static final Set<String> MODULE_KEYS = Set.of("module", "instances", "ports", "signals", "values", "printf");
  private static final Set<String> VALUE_KEYS = Set.of("name", "type", "width", "literal", "elements", "element", "fields", "type_name",
                                                       "direction");
  private static final Set<String> PRINTF_KEYS = Set.of("message", "mode", "name", "condition");

  private final HWPrint shim;

  public DescriptionReader(HWPrint shim) { this.shim = shim; }

  public void Read(File description) throws IOException {
    try (InputStream in = new FileInputStream(description)) {
      Read(in);
    }
  }

  /**
   * Reads all module descriptions from a YAML stream.
   * @throws IllegalArgumentException if the description is malformed (a {@link FormatException} for message errors)
   */
  public void Read(InputStream in) {
    Object data = new Yaml().load(in);
    if (data == null) {
      logger.warn("Empty module description");
      return;
    }
    for (Object moduleDesc : AsList(data, "module description list"))
      ReadModule(AsMap(moduleDesc, "module description"));
  }

  private void ReadModule(Map<String, Object> desc) {
    WarnUnknownKeys(desc, MODULE_KEYS, "module");
    String moduleName = GetString(desc, "module", "module");
    ModuleBuilder module = shim.AddModule(moduleName);
    Map<String, Object> hostValues = new HashMap<>();
    Map<String, HardwareValue> literals = new HashMap<>();

    for (Object instDesc_ : AsList(desc.getOrDefault("instances", List.of()), moduleName + ".instances")) {
      Map<String, Object> instDesc = AsMap(instDesc_, moduleName + ".instances");
      String instName = GetString(instDesc, "name", moduleName + ".instances");
      String instModule = GetString(instDesc, "module", moduleName + "." + instName);
      ModuleBuilder sub = shim.GetModule(instModule).orElseThrow(
          () -> new IllegalArgumentException(String.format("%s.%s: module %s is not defined (yet)", moduleName, instName, instModule)));
      module.instance(instName, sub);
    }
    for (Object portDesc_ : AsList(desc.getOrDefault("ports", List.of()), moduleName + ".ports")) {
      Map<String, Object> portDesc = AsMap(portDesc_, moduleName + ".ports");
      String portName = GetString(portDesc, "name", moduleName + ".ports");
      String direction = portDesc.getOrDefault("direction", "input").toString();
      HardwareValue value = CreateValue(portDesc, moduleName + "." + portName);
      if (direction.equals("input"))
        module.input(portName, value);
      else if (direction.equals("output"))
        module.output(portName, value);
      else
        throw new IllegalArgumentException(String.format("%s.%s: direction must be input or output, got %s", moduleName, portName, direction));
    }
    for (Object signalDesc_ : AsList(desc.getOrDefault("signals", List.of()), moduleName + ".signals")) {
      Map<String, Object> signalDesc = AsMap(signalDesc_, moduleName + ".signals");
      String signalName = GetString(signalDesc, "name", moduleName + ".signals");
      HardwareValue value = CreateValue(signalDesc, moduleName + "." + signalName);
      if (value.isLiteral())
        literals.put(signalName, value);
      else
        module.wire(signalName, value);
    }
    hostValues.putAll(AsMap(desc.getOrDefault("values", Map.of()), moduleName + ".values"));

    TemplateParser parser = new TemplateParser(ref -> Resolve(module, hostValues, literals, ref));
    int iPrintf = 0;
    for (Object printfDesc_ : AsList(desc.getOrDefault("printf", List.of()), moduleName + ".printf")) {
      String context = String.format("%s.printf[%d]", moduleName, iPrintf++);
      Map<String, Object> printfDesc = AsMap(printfDesc_, context);
      WarnUnknownKeys(printfDesc, PRINTF_KEYS, context);
      Messages.Mode mode = printfDesc.containsKey("mode") ? Messages.Mode.fromName(printfDesc.get("mode").toString())
                                                           : shim.GetConfig().GetDefaultMode();
      Document message;
      try {
        MessageTemplate template = parser.parse(GetString(printfDesc, "message", context));
        message = Messages.interpolate(mode, template);
      } catch (FormatException e) {
        throw new FormatException(context + ": " + e.getMessage(), e);
      }
      Bits condition = Bool.literal(true);
      if (printfDesc.containsKey("condition")) {
        String condName = printfDesc.get("condition").toString();
        Object cond = Resolve(module, hostValues, literals, condName)
                          .orElseThrow(() -> new IllegalArgumentException(context + ": unknown condition " + condName));
        if (!(cond instanceof Bits) || ((Bits)cond).getWidth() != 1)
          throw new IllegalArgumentException(context + ": condition " + condName + " is not a 1-bit signal");
        condition = (Bits)cond;
      }
      PrintStatement statement;
      try {
        statement = module.printf(condition, message);
      } catch (FormatException e) {
        throw new FormatException(context + ": " + e.getMessage(), e);
      }
      if (printfDesc.containsKey("name"))
        statement.suggestName(printfDesc.get("name").toString());
      logger.debug("{}: {} message \"{}\"", context, mode, statement.getFormatString());
    }
  }

  /**
   * Creates an unbound value (or literal) from its description.
   */
  static HardwareValue CreateValue(Map<String, Object> desc, String context) {
    WarnUnknownKeys(desc, VALUE_KEYS, context);
    String type = GetString(desc, "type", context);
    switch (type) {
    case "UInt":
      if (desc.containsKey("literal"))
        return desc.containsKey("width") ? UInt.literal(GetLiteral(desc, context), GetInt(desc, "width", context))
                                         : UInt.literal(GetLiteral(desc, context));
      return new UInt(GetInt(desc, "width", context));
    case "SInt":
      if (desc.containsKey("literal"))
        return desc.containsKey("width") ? SInt.literal(GetLiteral(desc, context), GetInt(desc, "width", context))
                                         : SInt.literal(GetLiteral(desc, context));
      return new SInt(GetInt(desc, "width", context));
    case "Bool":
      if (desc.containsKey("literal"))
        return Bool.literal(GetBoolLiteral(desc, context));
      return new Bool();
    case "Clock":
      return new Clock();
    case "Vec": {
      int elements = GetInt(desc, "elements", context);
      Map<String, Object> elementDesc = AsMap(desc.get("element"), context + ".element");
      return Vec.fill(elements, () -> CreateValue(elementDesc, context + ".element"));
    }
    case "Bundle": {
      Bundle bundle = desc.containsKey("type_name") ? new Bundle(desc.get("type_name").toString()) : new Bundle();
      for (Object fieldDesc_ : AsList(desc.getOrDefault("fields", List.of()), context + ".fields")) {
        Map<String, Object> fieldDesc = AsMap(fieldDesc_, context + ".fields");
        String fieldName = GetString(fieldDesc, "name", context + ".fields");
        bundle.field(fieldName, CreateValue(fieldDesc, context + "." + fieldName));
      }
      return bundle;
    }
    default:
      throw new IllegalArgumentException(
          String.format("%s: unknown type '%s', expected one of UInt, SInt, Bool, Clock, Vec, Bundle", context, type));
    }
  }

  /**
   * Resolves a message reference: a host value, a literal, or a signal path such as <code>myBun.foo</code>, <code>myVec[2]</code>
   * or <code>myInst.io.fizz</code>.
   */
  static Optional<Object> Resolve(ModuleBuilder module, Map<String, Object> hostValues, Map<String, HardwareValue> literals, String ref) {
    if (hostValues.containsKey(ref))
      return Optional.ofNullable(hostValues.get(ref));
    if (literals.containsKey(ref))
      return Optional.of(literals.get(ref));
    Matcher rootMatcher = ROOT_NAME.matcher(ref);
    if (!rootMatcher.lookingAt())
      return Optional.empty();
    int pos = rootMatcher.end();
    Matcher elementMatcher = PATH_ELEMENT.matcher(ref);
    Optional<HardwareValue> root = module.lookup(rootMatcher.group());
    if (root.isEmpty()) {
      // ports of submodule instances
      elementMatcher.region(pos, ref.length());
      if (elementMatcher.lookingAt() && elementMatcher.group(1) != null) {
        root = module.lookup(rootMatcher.group() + "." + elementMatcher.group(1));
        pos = elementMatcher.end();
      }
    }
    if (root.isEmpty())
      return Optional.empty();
    HardwareValue value = root.get();
    while (pos < ref.length()) {
      elementMatcher.region(pos, ref.length());
      if (!elementMatcher.lookingAt())
        return Optional.empty();
      if (elementMatcher.group(1) != null) {
        if (!(value instanceof Bundle) || !((Bundle)value).getFields().containsKey(elementMatcher.group(1)))
          return Optional.empty();
        value = ((Bundle)value).get(elementMatcher.group(1));
      } else {
        int index = Integer.parseInt(elementMatcher.group(2));
        if (!(value instanceof Vec) || index >= ((Vec<?>)value).size())
          return Optional.empty();
        value = ((Vec<?>)value).get(index);
      }
      pos = elementMatcher.end();
    }
    return Optional.of(value);
  }

  private static void WarnUnknownKeys(Map<String, Object> desc, Set<String> known, String context) {
    for (String key : desc.keySet()) {
      if (!known.contains(key))
        logger.warn("{}: ignoring unknown setting '{}'", context, key);
    }
  }

  private static List<?> AsList(Object obj, String context) {
    if (!(obj instanceof List))
      throw new IllegalArgumentException(context + ": expected a list, got " + obj);
    return (List<?>)obj;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> AsMap(Object obj, String context) {
    if (!(obj instanceof Map))
      throw new IllegalArgumentException(context + ": expected a mapping, got " + obj);
    Map<String, Object> ret = new LinkedHashMap<>();
    ((Map<Object, Object>)obj).forEach((key, value) -> ret.put(key.toString(), value));
    return ret;
  }

  private static String GetString(Map<String, Object> desc, String key, String context) {
    Object value = desc.get(key);
    if (value == null)
      throw new IllegalArgumentException(context + ": missing '" + key + "'");
    return value.toString();
  }

  private static int GetInt(Map<String, Object> desc, String key, String context) {
    Object value = desc.get(key);
    if (!(value instanceof Integer))
      throw new IllegalArgumentException(context + ": '" + key + "' must be an integer, got " + value);
    return (Integer)value;
  }

  private static BigInteger GetLiteral(Map<String, Object> desc, String context) {
    Object value = desc.get("literal");
    if (value instanceof Integer || value instanceof Long)
      return BigInteger.valueOf(((Number)value).longValue());
    if (value instanceof BigInteger)
      return (BigInteger)value;
    String text = String.valueOf(value);
    try {
      if (text.startsWith("0x") || text.startsWith("0X"))
        return new BigInteger(text.substring(2), 16);
      return new BigInteger(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(context + ": literal must be an integer, got " + text, e);
    }
  }

  // YAML true/false or the integers 0 and 1
  private static boolean GetBoolLiteral(Map<String, Object> desc, String context) {
    Object value = desc.get("literal");
    if (value instanceof Boolean)
      return (Boolean)value;
    BigInteger literal;
    try {
      literal = GetLiteral(desc, context);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(context + ": Bool literal must be true, false, 0 or 1, got " + value, e);
    }
    if (literal.equals(BigInteger.ONE))
      return true;
    if (literal.signum() == 0)
      return false;
    throw new IllegalArgumentException(context + ": Bool literal must be true, false, 0 or 1, got " + value);
  }
}
