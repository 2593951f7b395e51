package org.circuitemu.base.util.circuit;

import java.util.List;

/**
 * The root class of the circuit node hierarchy.  A node is either an input
 * reference (a leaf) or a gate over one or more child nodes.  Nodes are
 * immutable once constructed, so a tree of them may be evaluated from any
 * number of threads at once.
 * <p>
 * The set of node kinds is closed: all subclasses live in this package and
 * every kind has a dedicated method on {@link CircuitNodeVisitor}.
 */
public abstract class CircuitNode
{
  CircuitNode()
  {
    // Only the node kinds in this package may extend this class.
  }

  /**
   * Getter method.
   *
   * @return The child nodes, in order.  Empty for an input reference.
   */
  public abstract List<CircuitNode> getInputs();

  /**
   * Compute the value of this node.  The caller guarantees that the assignment
   * has an entry for every input index reachable from this node.
   *
   * @param xiAssignment - the value of each input, by index.
   *
   * @return the value of the node under the assignment.
   */
  abstract boolean getValue(boolean[] xiAssignment);

  /**
   * Dispatch to the visitor method for this node's kind.
   *
   * @param xiVisitor - the visitor.
   *
   * @return whatever the visitor returns.
   */
  public abstract <R> R accept(CircuitNodeVisitor<R> xiVisitor);
}
