package hwprint.frontend;

import hwprint.printable.FormatException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses message text with <code>$name</code> and <code>${path}</code> references into a {@link MessageTemplate}.
 * <code>$$</code> stands for a literal dollar sign. Reference paths are resolved through a lookup function, so
 * <code>${myBun.foo}</code> or <code>${myVec[2]}</code> are supported as far as the lookup understands them.
 */
public class TemplateParser {
  private final Function<String, Optional<Object>> lookup;

  public TemplateParser(Function<String, Optional<Object>> lookup) { this.lookup = lookup; }

  /**
   * @param text the message text
   * @return the template with resolved arguments
   * @throws FormatException on an unterminated or empty reference, a lone <code>$</code>, or a name the lookup does not know
   */
  public MessageTemplate parse(String text) {
    List<String> parts = new ArrayList<>();
    List<Object> args = new ArrayList<>();
    StringBuilder currentPart = new StringBuilder();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c != '$') {
        currentPart.append(c);
        ++i;
        continue;
      }
      if (i + 1 >= text.length())
        throw new FormatException("Lone '$' at the end of \"" + text + "\", use $$ for a literal dollar sign");
      char next = text.charAt(i + 1);
      String reference;
      if (next == '$') {
        currentPart.append('$');
        i += 2;
        continue;
      } else if (next == '{') {
        int close = text.indexOf('}', i + 2);
        if (close < 0)
          throw new FormatException("Unterminated ${ at index " + i + " of \"" + text + "\"");
        reference = text.substring(i + 2, close).trim();
        i = close + 1;
      } else if (Character.isLetter(next) || next == '_') {
        int end = i + 2;
        while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_'))
          ++end;
        reference = text.substring(i + 1, end);
        i = end;
      } else {
        throw new FormatException(String.format("Invalid reference '$%c' at index %d of \"%s\", use $$ for a literal dollar sign", next, i, text));
      }
      if (reference.isEmpty())
        throw new FormatException("Empty reference in \"" + text + "\"");
      Object value = lookup.apply(reference).orElseThrow(() -> new FormatException("Unknown reference '" + reference + "' in \"" + text + "\""));
      parts.add(currentPart.toString());
      currentPart = new StringBuilder();
      args.add(value);
    }
    parts.add(currentPart.toString());
    return MessageTemplate.of(parts, args);
  }
}
