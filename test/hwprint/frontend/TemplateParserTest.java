package hwprint.frontend;

import hwprint.printable.FormatException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TemplateParserTest {

  static final Map<String, Object> values = Map.of("f1", 20.45156, "d1", 10, "myBun.foo", "foo");

  final TemplateParser parser = new TemplateParser(name -> Optional.ofNullable(values.get(name)));

  @Test
  void testReferences() {
    MessageTemplate template = parser.parse("F1 = $f1%2.2f D1 = ${ d1 }%x");
    Assertions.assertEquals(List.of("F1 = ", "%2.2f D1 = ", "%x"), template.getParts());
    Assertions.assertEquals(List.of(20.45156, 10), template.getArgs());
  }

  @Test
  void testPathsAndAdjacentReferences() {
    MessageTemplate template = parser.parse("${myBun.foo}$d1$f1");
    Assertions.assertEquals(List.of("", "", "", ""), template.getParts());
    Assertions.assertEquals(List.of("foo", 10, 20.45156), template.getArgs());
  }

  @Test
  void testDollarEscape() {
    MessageTemplate template = parser.parse("costs $$5");
    Assertions.assertEquals(List.of("costs $5"), template.getParts());
    Assertions.assertTrue(template.getArgs().isEmpty());
  }

  @ParameterizedTest
  @ValueSource(strings = {"cost $", "${d1", "${ }", "$1", "$unknown", "${myBun.bar}"})
  void testInvalidReferences(String text) {
    Assertions.assertThrows(FormatException.class, () -> parser.parse(text));
  }
}
