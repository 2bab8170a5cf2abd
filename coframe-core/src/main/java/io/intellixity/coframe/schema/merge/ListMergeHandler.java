package io.intellixity.coframe.schema.merge;

/** Custom merge strategy for list values whose path matches a registered pattern. */
@FunctionalInterface
public interface ListMergeHandler {
  Node.ListNode merge(Node.ListNode existing, Node.ListNode incoming, MergeContext ctx);
}
