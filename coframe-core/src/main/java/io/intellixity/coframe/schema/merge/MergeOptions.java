package io.intellixity.coframe.schema.merge;

/**
 * @param strictScalars when true a plugin overriding a scalar value with a different one fails the merge
 *                      instead of logging a warning
 */
public record MergeOptions(boolean strictScalars) {
  public static MergeOptions defaults() { return new MergeOptions(false); }
}
