package dpgen.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing generated files. Collects the text per file and writes all files at once.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file path relative to base_path, order is the order of the first update */
  private LinkedHashMap<String, StringBuilder> contents = new LinkedHashMap<String, StringBuilder>();
  private String base_path = "";

  public FileWriter(String base_path) { this.base_path = base_path; }

  /**
   * Appends text to a file to be written later.
   *
   * @param file The relative path to the file. The path string should be equal for all updates that target the same file.
   * @param text The text to append; use "\n" line breaks for multi-line text.
   */
  public void UpdateContent(String file, String text) { contents.computeIfAbsent(file, file_ -> new StringBuilder()).append(text); }

  /** The relative paths of all files with registered content. */
  public Set<String> GetFiles() { return contents.keySet(); }

  /** The content registered for a file so far. */
  public Optional<String> GetContent(String file) { return Optional.ofNullable(contents.get(file)).map(StringBuilder::toString); }

  /**
   * Writes all files with registered content below the base path, creating directories as needed.
   * @throws UncheckedIOException if a file cannot be written
   */
  public void WriteFiles() {
    for (String file : contents.keySet())
      WriteFile(file, contents.get(file).toString());
  }

  private void WriteFile(String file, String text) {
    File outFile = base_path.isEmpty() ? new File(file) : new File(base_path, file);
    File parent = outFile.getAbsoluteFile().getParentFile();
    if (parent != null)
      parent.mkdirs();

    logger.info("Writing " + outFile.getPath());
    try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8))) {
      out.print(text);
      if (out.checkError())
        throw new IOException("Error writing file " + outFile.getPath());
    } catch (IOException e) {
      logger.fatal("File " + outFile.getPath() + " could not be written");
      throw new UncheckedIOException(e);
    }
  }
}
