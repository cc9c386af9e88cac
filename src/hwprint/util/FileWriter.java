package hwprint.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map.Entry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing generated files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file relative path, value: text to write, in insertion order */
  private LinkedHashMap<String, StringBuilder> update_files = new LinkedHashMap<String, StringBuilder>();
  public String tab = "  ";
  public int nrTabs = 0;

  /**
   * Adds text to be written to a file. Text for the same file is written in the order it was added.
   *
   * @param file The relative path to the file. The path string should be equal for all updates that target the same file.
   * @param text The text to add; use "\n" line breaks for multi-line text. The final line break is added implicitly.
   *     Every non-empty line is indented by {@link #nrTabs} tabs.
   */
  public void UpdateContent(String file, String text) {
    String indent = tab.repeat(nrTabs);
    StringBuilder content = update_files.computeIfAbsent(file, file_ -> new StringBuilder());
    for (String line : text.split("\n", -1)) {
      if (!line.isEmpty())
        content.append(indent).append(line);
      content.append("\n");
    }
    // split keeps a trailing empty element for text ending in a line break
    if (text.endsWith("\n"))
      content.setLength(content.length() - 1);
  }

  /**
   * Registers a file to be written.
   *
   * @param file The relative path to the file.
   * @param clear If set, drop the text collected so far for that file.
   */
  public void AddFile(String file, boolean clear) {
    StringBuilder content = update_files.computeIfAbsent(file, file_ -> new StringBuilder());
    if (clear)
      content.setLength(0);
  }

  /**
   * Returns the text collected for a file, or an empty string.
   */
  public String GetContent(String file) {
    StringBuilder content = update_files.get(file);
    return content == null ? "" : content.toString();
  }

  /**
   * Writes all registered files (UTF-8), creating directories as needed.
   *
   * @param out_path Base output directory. If set to null, the current directory will be used.
   * @throws IOException if a file cannot be written
   */
  public void WriteFiles(String out_path) throws IOException {
    for (Entry<String, StringBuilder> entry : update_files.entrySet()) {
      File outFile = out_path == null ? new File(entry.getKey()) : new File(out_path, entry.getKey());
      File parent = outFile.getAbsoluteFile().getParentFile();
      if (parent != null && !parent.isDirectory() && !parent.mkdirs())
        throw new IOException("Cannot create output directory " + parent);
      logger.info("Writing " + outFile.getPath());
      try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8))) {
        out.print(entry.getValue());
        if (out.checkError())
          throw new IOException("Error writing file " + outFile.getPath());
      }
    }
  }
}
