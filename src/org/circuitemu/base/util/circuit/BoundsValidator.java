package org.circuitemu.base.util.circuit;

import org.circuitemu.base.util.circuit.exceptions.InputOutOfBoundsException;

/**
 * Checks that every input reference in a tree lies within a declared input
 * count.  The walk is depth-first, left to right, and stops at the first
 * offending leaf.
 */
public final class BoundsValidator implements CircuitNodeVisitor<InputRef>
{
  private final int mInputCount;

  private BoundsValidator(int xiInputCount)
  {
    mInputCount = xiInputCount;
  }

  /**
   * Validate a tree against an input count.
   *
   * @param xiRoot - the root of the tree.
   * @param xiInputCount - the number of inputs the tree may read.
   *
   * @throws InputOutOfBoundsException naming the first input reference whose
   *         index is not below {@code xiInputCount}.
   */
  public static void validate(CircuitNode xiRoot, int xiInputCount) throws InputOutOfBoundsException
  {
    InputRef lOffender = xiRoot.accept(new BoundsValidator(xiInputCount));
    if (lOffender != null)
    {
      throw new InputOutOfBoundsException(lOffender.getIndex(), xiInputCount);
    }
  }

  @Override
  public InputRef visitInput(InputRef xiInput)
  {
    return (xiInput.getIndex() >= mInputCount) ? xiInput : null;
  }

  @Override
  public InputRef visitNot(NotGate xiNot)
  {
    return xiNot.getSingleInput().accept(this);
  }

  @Override
  public InputRef visitOr(OrGate xiOr)
  {
    return firstOffender(xiOr);
  }

  @Override
  public InputRef visitAnd(AndGate xiAnd)
  {
    return firstOffender(xiAnd);
  }

  @Override
  public InputRef visitXor(XorGate xiXor)
  {
    return firstOffender(xiXor);
  }

  private InputRef firstOffender(MultiInputGate xiGate)
  {
    for (CircuitNode lInput : xiGate.getInputs())
    {
      InputRef lOffender = lInput.accept(this);
      if (lOffender != null)
      {
        return lOffender;
      }
    }
    return null;
  }
}
