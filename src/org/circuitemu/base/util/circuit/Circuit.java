package org.circuitemu.base.util.circuit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.OpenBitSet;
import org.circuitemu.base.util.circuit.exceptions.InputCountMismatchException;
import org.circuitemu.base.util.circuit.exceptions.InputOutOfBoundsException;
import org.circuitemu.base.util.config.EmulatorConfiguration;
import org.circuitemu.base.util.config.EmulatorConfiguration.CfgItem;

/**
 * A validated circuit: a tree of nodes together with the number of inputs it
 * reads.  Every input reference in the tree is known to be below the input
 * count, so a Circuit can be evaluated any number of times, from any number of
 * threads, without further checks on the tree.
 */
public final class Circuit
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Largest input count {@link #evaluateAll()} accepts.  Rows are indexed by an
   * int counter and the row count 2^N must itself be a positive int.
   */
  public static final int MAX_ENUMERABLE_INPUTS = Integer.SIZE - 2;

  private final int mInputCount;
  private final CircuitNode mRoot;

  /**
   * Create a circuit.
   *
   * @param xiInputCount - the number of inputs.
   * @param xiRoot - the root of the node tree.
   *
   * @throws InputOutOfBoundsException if the tree references an input at or
   *         beyond {@code xiInputCount}.
   */
  public Circuit(int xiInputCount, CircuitNode xiRoot) throws InputOutOfBoundsException
  {
    if (xiInputCount < 0)
    {
      throw new IllegalArgumentException("Input count must not be negative: " + xiInputCount);
    }
    if (xiRoot == null)
    {
      throw new IllegalArgumentException("Circuit requires a root node");
    }

    BoundsValidator.validate(xiRoot, xiInputCount);

    mInputCount = xiInputCount;
    mRoot = xiRoot;

    if (LOGGER.isTraceEnabled())
    {
      LOGGER.trace("Built " + xiInputCount + "-input circuit " + xiRoot);
    }
  }

  /**
   * Getter method.
   *
   * @return The number of inputs.
   */
  public int getInputCount()
  {
    return mInputCount;
  }

  /**
   * Getter method.
   *
   * @return The root node.
   */
  public CircuitNode getRoot()
  {
    return mRoot;
  }

  /**
   * Evaluate the circuit for a single assignment.
   *
   * @param xiAssignment - the value of each input, by index.  Not modified.
   *
   * @return the circuit's output.
   *
   * @throws InputCountMismatchException if the assignment is not exactly
   *         {@link #getInputCount()} long.
   */
  public boolean evaluate(boolean[] xiAssignment) throws InputCountMismatchException
  {
    if (xiAssignment.length != mInputCount)
    {
      throw new InputCountMismatchException(xiAssignment.length, mInputCount);
    }
    return mRoot.getValue(xiAssignment);
  }

  /**
   * Evaluate the circuit for every possible assignment.  Row {@code i} of the
   * result is the assignment whose input {@code k} is bit
   * {@code (inputCount - 1 - k)} of {@code i}.
   *
   * @return the truth table.
   *
   * @throws IllegalStateException if the input count exceeds
   *         {@link #MAX_ENUMERABLE_INPUTS}.
   */
  public TruthTable evaluateAll()
  {
    if (mInputCount > MAX_ENUMERABLE_INPUTS)
    {
      throw new IllegalStateException("Too many inputs (" + mInputCount + ") to emulate all possible states");
    }

    if (mInputCount >= EmulatorConfiguration.getCfgInt(CfgItem.LARGE_TABLE_WARNING_INPUTS))
    {
      LOGGER.warn("Enumerating " + mInputCount + " inputs - the truth table will have " +
                  (1L << mInputCount) + " rows");
    }

    int lRowCount = 1 << mInputCount;
    LOGGER.debug("Enumerating " + lRowCount + " assignments");

    OpenBitSet lOutputs = new OpenBitSet(lRowCount);
    boolean[] lAssignment = new boolean[mInputCount];
    for (int lRow = 0; lRow < lRowCount; lRow++)
    {
      TruthTable.fillAssignment(lRow, lAssignment);
      if (mRoot.getValue(lAssignment))
      {
        lOutputs.fastSet(lRow);
      }
    }

    return new TruthTable(mInputCount, lOutputs);
  }

  @Override
  public String toString()
  {
    return mInputCount + " inputs: " + mRoot;
  }
}
