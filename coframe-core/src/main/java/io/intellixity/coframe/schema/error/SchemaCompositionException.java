package io.intellixity.coframe.schema.error;

/**
 * Raised when the plugin composition pass cannot produce a consistent schema.
 * <p>
 * Every failure is fatal: there is no partial-schema mode. Subclasses carry the plugin, table, column or
 * path that caused the failure so the message is actionable on its own.
 */
public class SchemaCompositionException extends RuntimeException {
  public SchemaCompositionException(String message) {
    super(message);
  }

  public SchemaCompositionException(String message, Throwable cause) {
    super(message, cause);
  }
}
