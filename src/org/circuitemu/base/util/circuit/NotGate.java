package org.circuitemu.base.util.circuit;

import java.util.Collections;
import java.util.List;

/**
 * The NotGate class is designed to represent logical NOT gates.
 */
public final class NotGate extends CircuitNode
{
  private final CircuitNode mInput;

  NotGate(CircuitNode xiInput)
  {
    if (xiInput == null)
    {
      throw new IllegalArgumentException("NOT gate requires an input");
    }
    mInput = xiInput;
  }

  /**
   * A convenience method, to get the one and only input.
   *
   * @return The single input to the gate.
   */
  public CircuitNode getSingleInput()
  {
    return mInput;
  }

  @Override
  public List<CircuitNode> getInputs()
  {
    return Collections.singletonList(mInput);
  }

  /**
   * Returns the inverse of the input to the not.
   */
  @Override
  boolean getValue(boolean[] xiAssignment)
  {
    return !mInput.getValue(xiAssignment);
  }

  @Override
  public <R> R accept(CircuitNodeVisitor<R> xiVisitor)
  {
    return xiVisitor.visitNot(this);
  }

  @Override
  public String toString()
  {
    return "NOT(" + mInput + ")";
  }
}
