package hwprint.printable;

import hwprint.hardware.Naming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers a {@link Document} into a {@link FlattenedMessage}: a depth-first walk that appends format text and collects arguments.
 */
public class Flattener {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Naming naming;
  private final Set<Character> passThroughDirectives;

  public Flattener(Naming naming) { this(naming, Collections.emptySet()); }

  /**
   * @param naming resolves name fragments
   * @param passThroughDirectives custom directive letters the backend accepts in addition to <code>d x b c</code>
   */
  public Flattener(Naming naming, Set<Character> passThroughDirectives) {
    this.naming = naming;
    this.passThroughDirectives = Collections.unmodifiableSet(new HashSet<>(passThroughDirectives));
  }

  /**
   * Flattens a document.
   * @param doc the document
   * @return the format string with its arguments
   * @throws FormatException if a custom directive is not supported by the backend
   */
  public FlattenedMessage flatten(Document doc) {
    StringBuilder format = new StringBuilder();
    List<ArgumentToken> args = new ArrayList<>();
    flattenInto(doc, format, args);
    logger.debug("Flattened message: \"{}\" with {} argument(s)", format, args.size());
    return new FlattenedMessage(format.toString(), args);
  }

  private void flattenInto(Document doc, StringBuilder format, List<ArgumentToken> args) {
    for (Fragment fragment : doc.getFragments()) {
      switch (fragment.getKind()) {
      case Literal:
        format.append(((Fragment.Literal)fragment).getText().replace("%", "%%"));
        break;
      case Percent:
        format.append("%%");
        break;
      case NameRef: {
        var nameRef = (Fragment.NameRef)fragment;
        format.append(nameRef.getNameKind() == Fragment.NameKind.Short ? naming.shortName(nameRef.getValue())
                                                                       : naming.fullName(nameRef.getValue()));
        break;
      }
      case ValueRef:
        flattenValue((Fragment.ValueRef)fragment, format, args);
        break;
      case Nested:
        flattenInto(((Fragment.Nested)fragment).getDocument(), format, args);
        break;
      }
    }
  }

  private void flattenValue(Fragment.ValueRef valueRef, StringBuilder format, List<ArgumentToken> args) {
    Directive directive = valueRef.getDirective();
    switch (directive.getKind()) {
    case Default:
      // Aggregates expand into their elements, bit-vectors into a decimal reference.
      flattenInto(valueRef.getValue().toPrintable(), format, args);
      return;
    case Name:
      format.append(naming.shortName(valueRef.getValue()));
      return;
    case FullName:
      format.append(naming.fullName(valueRef.getValue()));
      return;
    case Custom:
      if (!passThroughDirectives.contains(directive.getLetter()))
        throw new FormatException(String.format("Illegal format specifier '%s'!", directive.token()));
      break;
    default:
      break;
    }
    format.append(directive.token());
    args.add(new ArgumentToken(valueRef.getValue()));
  }
}
