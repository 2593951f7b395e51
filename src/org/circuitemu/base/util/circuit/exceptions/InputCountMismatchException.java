package org.circuitemu.base.util.circuit.exceptions;

/**
 * Thrown when an assignment of a different length than the circuit's input
 * count is supplied for evaluation.
 */
@SuppressWarnings("serial")
public final class InputCountMismatchException extends CircuitException
{
  private final int mSupplied;
  private final int mExpected;

  public InputCountMismatchException(int xiSupplied, int xiExpected)
  {
    super("Supplied " + xiSupplied + " input values, expected " + xiExpected);
    mSupplied = xiSupplied;
    mExpected = xiExpected;
  }

  public int getSupplied()
  {
    return mSupplied;
  }

  public int getExpected()
  {
    return mExpected;
  }
}
