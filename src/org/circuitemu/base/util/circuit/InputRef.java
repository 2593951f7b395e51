package org.circuitemu.base.util.circuit;

import java.util.Collections;
import java.util.List;

/**
 * Leaf node that reads one slot of the external assignment.
 */
public final class InputRef extends CircuitNode
{
  private final int mIndex;

  InputRef(int xiIndex)
  {
    if (xiIndex < 0)
    {
      throw new IllegalArgumentException("Input index must not be negative: " + xiIndex);
    }
    mIndex = xiIndex;
  }

  /**
   * @return the index of the input slot this node reads.
   */
  public int getIndex()
  {
    return mIndex;
  }

  @Override
  public List<CircuitNode> getInputs()
  {
    return Collections.emptyList();
  }

  @Override
  boolean getValue(boolean[] xiAssignment)
  {
    return xiAssignment[mIndex];
  }

  @Override
  public <R> R accept(CircuitNodeVisitor<R> xiVisitor)
  {
    return xiVisitor.visitInput(this);
  }

  @Override
  public String toString()
  {
    return "I" + mIndex;
  }
}
