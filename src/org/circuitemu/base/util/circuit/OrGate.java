package org.circuitemu.base.util.circuit;

import java.util.Collection;

/**
 * The OrGate class is designed to represent logical OR gates.
 */
public final class OrGate extends MultiInputGate
{
  OrGate(Collection<? extends CircuitNode> xiInputs)
  {
    super("OR", xiInputs);
  }

  /**
   * Returns true if and only if at least one of the inputs to the or is true.
   * Inputs after the first true one are not evaluated.
   */
  @Override
  boolean getValue(boolean[] xiAssignment)
  {
    for (CircuitNode lInput : mInputsArray)
    {
      if (lInput.getValue(xiAssignment))
      {
        return true;
      }
    }
    return false;
  }

  @Override
  public <R> R accept(CircuitNodeVisitor<R> xiVisitor)
  {
    return xiVisitor.visitOr(this);
  }
}
