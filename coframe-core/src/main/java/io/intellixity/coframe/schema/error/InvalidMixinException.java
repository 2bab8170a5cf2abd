package io.intellixity.coframe.schema.error;

public final class InvalidMixinException extends SchemaCompositionException {
  private final String tableName;
  private final String mixin;

  public InvalidMixinException(String tableName, String mixin) {
    super("Mixin \"" + mixin + "\" of table \"" + tableName + "\" is not a type with columns");
    this.tableName = tableName;
    this.mixin = mixin;
  }

  public String tableName() { return tableName; }
  public String mixin() { return mixin; }
}
