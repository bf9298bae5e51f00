package org.fwqpbo;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Scanner;

/**
 * A parsed INI-style configuration file: {@code [section]} headers followed by
 * {@code key = value} (or {@code key: value}) lines. Keys and section names are case-insensitive;
 * lines starting with '#' or ';' are comments.
 */
public class ConfigFile {
  private final File file;
  private final Map<String, ConfigSection> sections = new LinkedHashMap<String, ConfigSection>();

  private ConfigFile(File file) {
    this.file = file;
  }

  public static ConfigFile read(File file) throws IOException, ConfigException {
    try (InputStream in = new FileInputStream(file)) {
      return parse(in, file);
    }
  }

  /**
   * Parses {@code in}; relative paths in values resolve against the directory of {@code file}.
   */
  public static ConfigFile parse(InputStream in, File file) throws ConfigException {
    ConfigFile config = new ConfigFile(file);
    File baseDir = file == null ? null : file.getAbsoluteFile().getParentFile();
    ConfigSection current = null;
    Scanner scan = new Scanner(in, "UTF-8");
    int lineNumber = 0;
    while (scan.hasNextLine()) {
      String line = scan.nextLine().trim();
      ++lineNumber;
      if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) continue;
      if (line.startsWith("[")) {
        if (!line.endsWith("]")) {
          throw new ConfigException(where(file, lineNumber) + "malformed section header: " + line);
        }
        String name = line.substring(1, line.length() - 1).trim().toLowerCase(Locale.ROOT);
        current = new ConfigSection(name, baseDir);
        config.sections.put(name, current);
        continue;
      }
      int eq = line.indexOf('=');
      int colon = line.indexOf(':');
      int split = eq < 0 ? colon : (colon < 0 ? eq : Math.min(eq, colon));
      if (split <= 0) {
        throw new ConfigException(where(file, lineNumber) + "expected key = value: " + line);
      }
      if (current == null) {
        throw new ConfigException(where(file, lineNumber) + "value outside of any section: " + line);
      }
      current.put(line.substring(0, split).trim().toLowerCase(Locale.ROOT), line.substring(split + 1).trim());
    }
    return config;
  }

  public boolean hasSection(String name) {
    return sections.containsKey(name.toLowerCase(Locale.ROOT));
  }

  public ConfigSection section(String name) throws ConfigException {
    ConfigSection section = sections.get(name.toLowerCase(Locale.ROOT));
    if (section == null) {
      throw new ConfigException("No [" + name + "] section in " + (file == null ? "config" : file));
    }
    return section;
  }

  private static String where(File file, int lineNumber) {
    return (file == null ? "config" : file.getPath()) + ":" + lineNumber + ": ";
  }
}
