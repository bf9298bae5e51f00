package org.fwqpbo;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Key/value pairs of one configuration section with typed, validating accessors. Numeric lists
 * are comma-separated.
 */
public class ConfigSection {
  public static final String TRUE_TOKEN = "True";

  public final String name;
  private final File baseDir;
  private final Map<String, String> values = new LinkedHashMap<String, String>();

  public ConfigSection(String name, File baseDir) {
    this.name = name;
    this.baseDir = baseDir;
  }

  public void put(String key, String value) {
    values.put(key.toLowerCase(Locale.ROOT), value);
  }

  public boolean has(String key) {
    return values.containsKey(key);
  }

  public String getString(String key) {
    return values.get(key);
  }

  public String getString(String key, String defaultValue) {
    String v = values.get(key);
    return v == null ? defaultValue : v;
  }

  public double getDouble(String key, double defaultValue) throws ConfigException {
    Double v = getOptionalDouble(key);
    return v == null ? defaultValue : v;
  }

  public Double getOptionalDouble(String key) throws ConfigException {
    String v = values.get(key);
    return v == null ? null : parseDouble(key, v);
  }

  public int getInt(String key, int defaultValue) throws ConfigException {
    String v = values.get(key);
    return v == null ? defaultValue : parseInt(key, v);
  }

  /**
   * True only for the exact token {@code True}; any other value, or absence, is false.
   */
  public boolean getFlag(String key) {
    return TRUE_TOKEN.equals(values.get(key));
  }

  /** Null when the key is absent. */
  public List<Double> getDoubleList(String key) throws ConfigException {
    String v = values.get(key);
    if (v == null) return null;
    List<Double> out = new ArrayList<Double>();
    for (String token : split(key, v)) {
      out.add(parseDouble(key, token));
    }
    return out;
  }

  /** Null when the key is absent. */
  public List<Integer> getIntList(String key) throws ConfigException {
    String v = values.get(key);
    if (v == null) return null;
    List<Integer> out = new ArrayList<Integer>();
    for (String token : split(key, v)) {
      out.add(parseInt(key, token));
    }
    return out;
  }

  /** Comma-separated paths, resolved against the config file's directory. Null when absent. */
  public List<File> getFileList(String key) throws ConfigException {
    String v = values.get(key);
    if (v == null) return null;
    List<File> out = new ArrayList<File>();
    for (String token : split(key, v)) {
      out.add(resolve(token));
    }
    return out;
  }

  public File getFile(String key) {
    String v = values.get(key);
    return v == null ? null : resolve(v.trim());
  }

  private File resolve(String path) {
    File f = new File(path);
    if (f.isAbsolute() || baseDir == null) return f;
    return new File(baseDir, path);
  }

  private String[] split(String key, String value) throws ConfigException {
    String[] tokens = value.split(",");
    for (int i = 0; i < tokens.length; ++i) {
      tokens[i] = tokens[i].trim();
      if (tokens[i].isEmpty()) {
        throw new ConfigException("Empty list entry for '" + key + "' in [" + name + "]: " + value);
      }
    }
    return tokens;
  }

  private double parseDouble(String key, String value) throws ConfigException {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigException(
          "Malformed number for '" + key + "' in [" + name + "]: " + value, e);
    }
  }

  private int parseInt(String key, String value) throws ConfigException {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigException(
          "Malformed integer for '" + key + "' in [" + name + "]: " + value, e);
    }
  }
}
