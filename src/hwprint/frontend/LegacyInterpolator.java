package hwprint.frontend;

import hwprint.hardware.HardwareValue;
import hwprint.printable.Directive;
import hwprint.printable.Document;
import hwprint.printable.Fragment;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds documents from templates without directive syntax. Every hardware value is printed with its default directive,
 * and a <code>%</code> in the text is plain text.
 */
public class LegacyInterpolator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * @param template the message template
   * @return the document
   * @throws hwprint.printable.FormatException on an invalid escape sequence in the text
   */
  public Document interpolate(MessageTemplate template) {
    List<String> parts = template.getParts();
    List<Object> args = template.getArgs();
    List<Fragment> fragments = new ArrayList<>(parts.size() + args.size());
    for (int i = 0; i < parts.size(); ++i) {
      String text = StringEscapes.treatEscapes(parts.get(i));
      if (!text.isEmpty())
        fragments.add(Document.literalFragment(text));
      if (i < args.size())
        argumentFragment(args.get(i), fragments);
    }
    return Document.of(fragments);
  }

  private static void argumentFragment(Object arg, List<Fragment> fragments) {
    if (arg instanceof Document) {
      fragments.add(((Document)arg).asNested());
    } else if (arg instanceof HardwareValue) {
      fragments.add(Document.valueFragment((HardwareValue)arg, Directive.DEFAULT));
    } else if (arg != null) {
      String str = arg.toString();
      if (!str.isEmpty())
        fragments.add(Document.literalFragment(str));
      else
        logger.trace("Dropping empty argument of type {}", arg.getClass().getSimpleName());
    }
  }
}
