package io.intellixity.coframe.schema.merge;

/** What a {@link ListMergeHandler} sees of the merge in progress. */
public interface MergeContext {
  /** Dot-notation path of the list being merged, e.g. {@code tables.User.columns}. */
  String path();

  /** Plugin contributing the incoming list. */
  String plugin();

  /** Deep-merge two maps with the engine's rules; history is recorded under {@code path}. */
  Node.MapNode mergeMaps(Node.MapNode existing, Node.MapNode incoming, String path);

  /** Record a newly appended item, and everything under it, as contributed at {@code path}. */
  void added(Node item, String path);
}
