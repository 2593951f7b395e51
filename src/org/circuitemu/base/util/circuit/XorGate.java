package org.circuitemu.base.util.circuit;

import java.util.Collection;

/**
 * The XorGate class represents a one-hot exclusive or: the output is true if
 * and only if exactly one input is true.  With three or more inputs this is
 * NOT the parity function - two or three true inputs both give false.
 */
public final class XorGate extends MultiInputGate
{
  XorGate(Collection<? extends CircuitNode> xiInputs)
  {
    super("XOR", xiInputs);
  }

  @Override
  boolean getValue(boolean[] xiAssignment)
  {
    boolean lFoundTrue = false;

    for (CircuitNode lInput : mInputsArray)
    {
      if (lInput.getValue(xiAssignment))
      {
        if (lFoundTrue)
        {
          // Second true input - no later input can make this true again.
          return false;
        }
        lFoundTrue = true;
      }
    }

    return lFoundTrue;
  }

  @Override
  public <R> R accept(CircuitNodeVisitor<R> xiVisitor)
  {
    return xiVisitor.visitXor(this);
  }
}
