package org.circuitemu.base.util.circuit;

import java.util.Collection;

/**
 * The AndGate class is designed to represent logical AND gates.
 */
public final class AndGate extends MultiInputGate
{
  AndGate(Collection<? extends CircuitNode> xiInputs)
  {
    super("AND", xiInputs);
  }

  /**
   * Returns true if and only if every input to the and is true.  Inputs after
   * the first false one are not evaluated.
   */
  @Override
  boolean getValue(boolean[] xiAssignment)
  {
    for (CircuitNode lInput : mInputsArray)
    {
      if (!lInput.getValue(xiAssignment))
      {
        return false;
      }
    }
    return true;
  }

  @Override
  public <R> R accept(CircuitNodeVisitor<R> xiVisitor)
  {
    return xiVisitor.visitAnd(this);
  }
}
