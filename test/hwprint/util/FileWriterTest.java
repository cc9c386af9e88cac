package hwprint.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileWriterTest {

  @Test
  void testIndentation() {
    FileWriter toFile = new FileWriter();
    toFile.UpdateContent("a.fir", "circuit A :");
    toFile.nrTabs = 1;
    toFile.UpdateContent("a.fir", "module A :\n  input clock : Clock\n");
    toFile.UpdateContent("a.fir", "");
    toFile.tab = "\t";
    toFile.UpdateContent("a.fir", "x");
    Assertions.assertEquals("circuit A :\n  module A :\n    input clock : Clock\n\n\tx\n", toFile.GetContent("a.fir"));
    toFile.AddFile("a.fir", true);
    Assertions.assertEquals("", toFile.GetContent("a.fir"));
    Assertions.assertEquals("", toFile.GetContent("missing.fir"));
  }

  @Test
  void testWriteFiles(@TempDir Path tempDir) throws IOException {
    FileWriter toFile = new FileWriter();
    toFile.UpdateContent("A.fir", "circuit A :");
    toFile.UpdateContent("sub/B.fir", "circuit B : µ");
    Path outDir = tempDir.resolve("results");
    toFile.WriteFiles(outDir.toString());
    Assertions.assertEquals("circuit A :\n", Files.readString(outDir.resolve("A.fir"), StandardCharsets.UTF_8));
    Assertions.assertEquals("circuit B : µ\n", Files.readString(outDir.resolve("sub/B.fir"), StandardCharsets.UTF_8));
  }
}
