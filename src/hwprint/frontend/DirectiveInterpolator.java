package hwprint.frontend;

import hwprint.hardware.HardwareValue;
import hwprint.hardware.ValueKind;
import hwprint.printable.Directive;
import hwprint.printable.Document;
import hwprint.printable.FormatException;
import hwprint.printable.Fragment;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds documents from templates whose arguments may be followed by a <code>%</code> directive, e.g.
 * <code>"sum = " + s + "%x"</code>.
 * <p>
 * The text part following an argument is checked for a leading directive token: <code>%</code>, optional printf flags, width and
 * precision, and a terminating letter. Without one, the argument gets the implicit <code>%s</code>. Hardware values accept
 * single letter directives only; documents accept none; host values are formatted right away with {@link HostFormatter}.
 * After that, every <code>%%</code> left in the text becomes a literal percent and any other <code>%</code> is an error.
 */
public class DirectiveInterpolator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Characters allowed between the <code>%</code> and the conversion letter. */
  private static final String SPECIFIER_CHARS = "-#+ 0,(.<$";

  /**
   * @param template the message template
   * @return the document
   * @throws FormatException on a stray <code>%</code>, an invalid escape sequence, or a directive not applicable to its argument
   */
  public Document interpolate(MessageTemplate template) {
    List<Object> args = template.getArgs();
    List<String> parts = new ArrayList<>(template.getParts().size());
    template.getParts().forEach(part -> parts.add(StringEscapes.treatEscapes(part)));

    List<Fragment> fragments = new ArrayList<>();
    // The first part has no preceding argument, so it never holds a directive.
    splitPercents(parts.get(0), fragments);
    for (int i = 0; i < args.size(); ++i) {
      String part = parts.get(i + 1);
      int directiveEnd = findDirectiveEnd(part);
      String token = directiveEnd >= 0 ? part.substring(0, directiveEnd + 1) : "%s";
      logger.trace("Argument {} ({}) uses directive {}", i, describe(args.get(i)), token);
      argumentFragment(args.get(i), token, fragments);
      splitPercents(part.substring(directiveEnd + 1), fragments);
    }
    return Document.of(fragments);
  }

  /**
   * Returns the index of the letter terminating the directive at the start of a part, or -1 if the part does not start with one.
   * A part starting with <code>%%</code> starts with an escaped percent, not a directive.
   */
  static int findDirectiveEnd(String part) {
    if (part.isEmpty() || part.charAt(0) != '%')
      return -1;
    if (part.length() >= 2 && part.charAt(1) == '%')
      return -1;
    for (int i = 1; i < part.length(); ++i) {
      char c = part.charAt(i);
      if (Character.isLetter(c))
        return i;
      if (!Character.isDigit(c) && SPECIFIER_CHARS.indexOf(c) < 0)
        return -1;
    }
    return -1;
  }

  private static void argumentFragment(Object arg, String token, List<Fragment> fragments) {
    if (arg instanceof HardwareValue) {
      HardwareValue value = (HardwareValue)arg;
      if (value.kind() == ValueKind.BitVector) {
        if (token.length() != 2)
          throw new FormatException(
              String.format("In the case of bit-vector types, only single format char allowed! Got '%s' for %s", token, value));
        fragments.add(Document.valueFragment(value, Directive.fromLetter(token.charAt(1))));
        return;
      }
      switch (token) {
      case "%s":
      case "%n":
      case "%N":
        fragments.add(Document.valueFragment(value, Directive.fromLetter(token.charAt(1))));
        return;
      default:
        throw new FormatException(String.format("Illegal format specifier '%s'! Values of kind %s only accept %%s, %%n and %%N", token,
                                                value.kind()));
      }
    }
    if (arg instanceof Document) {
      if (!token.equals("%s"))
        throw new FormatException(String.format("Embedded messages do not accept format specifiers, got '%s'", token));
      fragments.add(((Document)arg).asNested());
      return;
    }
    String formatted = HostFormatter.format(token, arg);
    if (!formatted.isEmpty())
      fragments.add(Document.literalFragment(formatted));
  }

  /**
   * Adds the text of a part, splitting every <code>%%</code> into a percent fragment.
   * @throws FormatException if the text holds a <code>%</code> that is not doubled
   */
  static void splitPercents(String text, List<Fragment> fragments) {
    int start = 0;
    int i = 0;
    while (i < text.length()) {
      if (text.charAt(i) != '%') {
        ++i;
        continue;
      }
      if (i + 1 >= text.length() || text.charAt(i + 1) != '%')
        throw new FormatException(String.format("Un-escaped %% found at index %d of \"%s\"! Use %%%% for a literal percent", i, text));
      if (i > start)
        fragments.add(Document.literalFragment(text.substring(start, i)));
      fragments.add(Document.percentFragment());
      i += 2;
      start = i;
    }
    if (start < text.length())
      fragments.add(Document.literalFragment(text.substring(start)));
  }

  private static String describe(Object arg) {
    return arg == null ? "null" : arg.getClass().getSimpleName();
  }
}
