package hwprint.frontend;

import hwprint.printable.Document;
import hwprint.printable.FormatException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Entry points for building printable messages.
 * <ul>
 * <li>{@link #cf}: directive mode, arguments may be followed by <code>%x</code>, <code>%d</code>, <code>%2.2f</code>, ...</li>
 * <li>{@link #p}: like cf, but every <code>%</code> in the text is literal</li>
 * <li>{@link #legacy}: every argument printed with its default rendering, no percent handling at all</li>
 * </ul>
 * The varargs forms take text and arguments alternately, starting with text:
 * <code>Messages.cf("w1 = ", w1, "%x and f1 = ", f1, "%2.2f")</code>.
 */
public class Messages {

  public enum Mode {
    cf,
    p,
    legacy;

    public static Mode fromName(String name) {
      return Arrays.stream(values())
          .filter(mode -> mode.name().equals(name))
          .findAny()
          .orElseThrow(() -> new IllegalArgumentException("Unknown message mode '" + name + "', expected one of " + Arrays.toString(values())));
    }
  }

  private static final DirectiveInterpolator directiveInterpolator = new DirectiveInterpolator();
  private static final LegacyInterpolator legacyInterpolator = new LegacyInterpolator();

  private Messages() {}

  public static Document cf(MessageTemplate template) { return directiveInterpolator.interpolate(template); }

  public static Document cf(Object... textAndArgs) { return cf(zip(textAndArgs)); }

  public static Document p(MessageTemplate template) { return cf(template.mapParts(part -> part.replace("%", "%%"))); }

  public static Document p(Object... textAndArgs) { return p(zip(textAndArgs)); }

  public static Document legacy(MessageTemplate template) { return legacyInterpolator.interpolate(template); }

  public static Document legacy(Object... textAndArgs) { return legacy(zip(textAndArgs)); }

  public static Document interpolate(Mode mode, MessageTemplate template) {
    switch (mode) {
    case cf:
      return cf(template);
    case p:
      return p(template);
    case legacy:
      return legacy(template);
    default:
      throw new IllegalStateException("Unhandled mode " + mode);
    }
  }

  /**
   * Splits alternating text and arguments into a template. A missing trailing text part is taken as empty.
   * @throws FormatException if an element at a text position is not a String
   */
  static MessageTemplate zip(Object... textAndArgs) {
    List<String> parts = new ArrayList<>();
    List<Object> args = new ArrayList<>();
    for (int i = 0; i < textAndArgs.length; ++i) {
      if (i % 2 == 1) {
        args.add(textAndArgs[i]);
        continue;
      }
      if (!(textAndArgs[i] instanceof String))
        throw new FormatException(String.format("Expected message text at position %d, got %s", i, textAndArgs[i]));
      parts.add((String)textAndArgs[i]);
    }
    if (parts.size() == args.size())
      parts.add("");
    return MessageTemplate.of(parts, args);
  }
}
