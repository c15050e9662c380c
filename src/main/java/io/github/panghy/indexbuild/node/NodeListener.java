package io.github.panghy.indexbuild.node;

/**
 * Receives registry membership changes. Callbacks run outside the registry lock.
 */
public interface NodeListener {

  /** Called once a node is gone; jobs it owned must be released and re-dispatched. */
  void onNodeRemoved(NodeInfo node);
}
