package org.circuitemu.base.util.circuit;

import java.util.Arrays;
import java.util.Collection;

/**
 * Static constructors for circuit nodes.  Trees are built bottom-up:
 *
 * <pre>
 *   and(input(0), or(input(1), input(2)), not(input(3)))
 * </pre>
 *
 * Input indices are not checked against any input count here; that happens
 * once the tree is wrapped in a {@link Circuit}.  Supplying fewer than two
 * inputs to an n-ary gate is a programming error and fails with
 * {@link IllegalArgumentException}.
 */
public final class Gates
{
  private Gates()
  {
  }

  /**
   * Create a leaf reading input slot {@code xiIndex}.
   */
  public static InputRef input(int xiIndex)
  {
    return new InputRef(xiIndex);
  }

  public static NotGate not(CircuitNode xiInput)
  {
    return new NotGate(xiInput);
  }

  public static OrGate or(CircuitNode... xiInputs)
  {
    return new OrGate(asCollection(xiInputs));
  }

  public static OrGate or(Collection<? extends CircuitNode> xiInputs)
  {
    return new OrGate(xiInputs);
  }

  public static AndGate and(CircuitNode... xiInputs)
  {
    return new AndGate(asCollection(xiInputs));
  }

  public static AndGate and(Collection<? extends CircuitNode> xiInputs)
  {
    return new AndGate(xiInputs);
  }

  /**
   * Create a one-hot XOR gate - see {@link XorGate}.
   */
  public static XorGate xor(CircuitNode... xiInputs)
  {
    return new XorGate(asCollection(xiInputs));
  }

  public static XorGate xor(Collection<? extends CircuitNode> xiInputs)
  {
    return new XorGate(xiInputs);
  }

  private static Collection<CircuitNode> asCollection(CircuitNode[] xiInputs)
  {
    return (xiInputs == null) ? null : Arrays.asList(xiInputs);
  }
}
