package dpgen.ui;

/** Thrown when a generator configuration cannot be read or is not valid. */
public class ConfigException extends Exception {
  private static final long serialVersionUID = 1L;

  public ConfigException(String message) { super(message); }
  public ConfigException(String message, Throwable cause) { super(message, cause); }
}
