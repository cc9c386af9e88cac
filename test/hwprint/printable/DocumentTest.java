package hwprint.printable;

import hwprint.hardware.Bundle;
import hwprint.hardware.ModuleBuilder;
import hwprint.hardware.UInt;
import hwprint.hardware.Vec;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DocumentTest {

  @Test
  void testConcatAssociative() {
    var module = new ModuleBuilder("MyModule");
    UInt w = module.wire("myWire", new UInt(8));
    Document a = Document.literal("a = ");
    Document b = Document.hexadecimal(w);
    Document c = Document.percent().plus(" done");
    Assertions.assertEquals(a.concat(b).concat(c), a.concat(b.concat(c)));
    Assertions.assertEquals(4, a.concat(b).concat(c).getFragments().size());
  }

  @Test
  void testEmptyIsIdentity() {
    Document a = Document.literal("text");
    Assertions.assertEquals(a, a.concat(Document.empty()));
    Assertions.assertEquals(a, Document.empty().concat(a));
    Assertions.assertTrue(Document.of(List.of()).isEmpty());
  }

  @Test
  void testConcatKeepsOperands() {
    Document a = Document.literal("a");
    Document b = Document.literal("b");
    Document ab = a.concat(b);
    Assertions.assertEquals(1, a.getFragments().size());
    Assertions.assertEquals(1, b.getFragments().size());
    Assertions.assertEquals(List.of(Document.literalFragment("a"), Document.literalFragment("b")), ab.getFragments());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> ab.getFragments().add(Document.percentFragment()));
  }

  @Test
  void testNameDirectivesBecomeNameRefs() {
    var module = new ModuleBuilder("MyModule");
    UInt w = module.wire("myWire", new UInt(8));
    Assertions.assertEquals(Fragment.Kind.NameRef, Document.valueFragment(w, Directive.NAME).getKind());
    Assertions.assertEquals(Fragment.NameKind.Full, ((Fragment.NameRef)Document.valueFragment(w, Directive.FULL_NAME)).getNameKind());
    Assertions.assertEquals(Fragment.Kind.ValueRef, Document.valueFragment(w, Directive.DEFAULT).getKind());
  }

  @Test
  void testValueRefChecksDirective() {
    var vec = Vec.fill(2, () -> new UInt(8));
    var bundle = new Bundle();
    bundle.field("foo", new UInt(8));
    Assertions.assertThrows(FormatException.class, () -> Document.value(vec, Directive.HEX));
    Assertions.assertThrows(FormatException.class, () -> Document.value(bundle, Directive.DECIMAL));
    Assertions.assertEquals(Fragment.Kind.ValueRef, Document.value(vec, Directive.DEFAULT).getFragments().get(0).getKind());
  }

  @Test
  void testValueRefEqualityIsByIdentity() {
    UInt a = new UInt(8);
    UInt b = new UInt(8);
    Assertions.assertEquals(Document.decimal(a), Document.decimal(a));
    Assertions.assertNotEquals(Document.decimal(a), Document.decimal(b));
    Assertions.assertNotEquals(Document.decimal(a), Document.hexadecimal(a));
  }

  @Test
  void testDirectiveFromLetter() {
    Assertions.assertSame(Directive.HEX, Directive.fromLetter('x'));
    Assertions.assertSame(Directive.FULL_NAME, Directive.fromLetter('N'));
    Directive custom = Directive.fromLetter('q');
    Assertions.assertEquals(Directive.Kind.Custom, custom.getKind());
    Assertions.assertEquals("%q", custom.token());
    Assertions.assertEquals(custom, Directive.fromLetter('q'));
    Assertions.assertThrows(FormatException.class, () -> Directive.fromLetter('5'));
  }
}
