package hdlgen.util;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: file relative path, value: content; order is the order in which files were added */
  private final LinkedHashMap<String, String> files = new LinkedHashMap<>();
  private String base_path = "";

  public FileWriter(String base_path) { this.base_path = base_path; }

  /**
   * Registers the content of a file to be written later. Adding the same path again replaces the content.
   *
   * @param file The path of the file relative to the base path.
   * @param text The complete file content.
   */
  public void AddFile(String file, String text) { files.put(file, text); }

  /** @return the registered files, relative path to content */
  public Map<String, String> GetFiles() { return Collections.unmodifiableMap(files); }

  /**
   * Writes all registered files below the base path, creating directories as needed.
   *
   * @return true if every file was written
   */
  public boolean WriteFiles() {
    boolean success = true;
    for (Map.Entry<String, String> file : files.entrySet())
      success &= WriteFile(file.getKey(), file.getValue());
    return success;
  }

  private boolean WriteFile(String file, String text) {
    File outFile = Paths.get(base_path, file).toFile();
    // create output path if necessary
    File parent = outFile.getParentFile();
    if (parent != null)
      parent.mkdirs();

    logger.info("Writing " + outFile.getPath());
    try (PrintWriter out = new PrintWriter(outFile, StandardCharsets.UTF_8)) {
      out.print(text);
      if (out.checkError()) {
        logger.error("Error writing file " + file);
        return false;
      }
    } catch (IOException e) {
      logger.error("File " + file + " could not be opened for writing: " + e.getMessage());
      return false;
    }
    return true;
  }
}
