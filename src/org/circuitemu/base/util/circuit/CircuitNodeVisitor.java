package org.circuitemu.base.util.circuit;

/**
 * Visitor over the closed set of circuit node kinds.  Adding a node kind adds
 * a method here, so every walk over a circuit must handle it.
 *
 * @param <R> the type produced for each visited node.
 */
public interface CircuitNodeVisitor<R>
{
  public abstract R visitInput(InputRef xiInput);

  public abstract R visitNot(NotGate xiNot);

  public abstract R visitOr(OrGate xiOr);

  public abstract R visitAnd(AndGate xiAnd);

  public abstract R visitXor(XorGate xiXor);
}
