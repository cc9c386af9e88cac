package hwprint.ui;

import hwprint.frontend.Messages;
import hwprint.printable.Directive;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold tool options.
 */
public class HWPrintConfig {

  /** Name of the implicit clock input of every module */
  public String clock_name = "clock";
  /** Interpolator for messages without an explicit mode: cf, p or legacy */
  public String default_mode = "cf";
  /** Directive letters the backend accepts besides d, x, b and c */
  public List<String> pass_through_directives = new ArrayList<>();
  /** Indentation of the emitted IR */
  public String indent = "  ";

  /**
   * Reads a configuration from YAML. Keys not given keep their default; an empty document yields the defaults.
   * @throws IllegalArgumentException if the configuration is inconsistent
   */
  public static HWPrintConfig load(InputStream in) {
    Yaml yaml = new Yaml(new Constructor(HWPrintConfig.class, new LoaderOptions()));
    HWPrintConfig cfg = yaml.load(in);
    if (cfg == null)
      cfg = new HWPrintConfig();
    cfg.validate();
    return cfg;
  }

  /**
   * Checks the option values.
   * @throws IllegalArgumentException on an unknown mode, an empty clock name or a malformed directive letter
   */
  public void validate() {
    if (clock_name == null || clock_name.isEmpty())
      throw new IllegalArgumentException("clock_name must not be empty");
    GetDefaultMode();
    GetPassThroughDirectives();
  }

  public Messages.Mode GetDefaultMode() { return Messages.Mode.fromName(default_mode); }

  public Set<Character> GetPassThroughDirectives() {
    Set<Character> ret = new LinkedHashSet<>();
    for (String letter : pass_through_directives) {
      if (letter == null || letter.length() != 1 || !Character.isLetter(letter.charAt(0)))
        throw new IllegalArgumentException("pass_through_directives entries must be single letters, got '" + letter + "'");
      if (Directive.fromLetter(letter.charAt(0)).getKind() != Directive.Kind.Custom)
        throw new IllegalArgumentException("Directive %" + letter + " is built in and cannot be passed through");
      ret.add(letter.charAt(0));
    }
    return ret;
  }
}
