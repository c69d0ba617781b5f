package soadsl.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing generated files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private String base_path = "";

  public FileWriter(String base_path) { this.base_path = base_path == null ? "" : base_path; }

  public FileWriter() { this(""); }

  /**
   * Writes {@code text} to {@code file}, replacing any previous content. Missing parent directories are created.
   *
   * @param file path relative to the base path, or absolute
   * @return the path written to
   */
  public Path WriteFile(String file, String text) throws IOException {
    Path outFile = Paths.get(base_path).resolve(file);
    // create output path if necessary
    if (outFile.getParent() != null)
      Files.createDirectories(outFile.getParent());
    logger.info("Writing " + outFile);
    Files.writeString(outFile, text, StandardCharsets.UTF_8);
    return outFile;
  }
}
