package net.java.henkan;

import java.io.IOException;

/**
 * Thrown when a compiled cost or boundary table cannot be decoded.
 * The engine cannot run without its tables, so this is always an
 * initialization failure.
 */
public class CorruptTableException extends IOException {

  private static final long serialVersionUID = 1L;

  public CorruptTableException(String message) {
    super(message);
  }

  public CorruptTableException(String message, Throwable cause) {
    super(message, cause);
  }
}
