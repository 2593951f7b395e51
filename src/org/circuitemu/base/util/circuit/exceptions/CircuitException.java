package org.circuitemu.base.util.circuit.exceptions;

/**
 * Abstract class for recoverable exceptions raised when a circuit is built or
 * driven with inputs it cannot accept.
 */
public abstract class CircuitException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected CircuitException(String xiMessage)
  {
    super(xiMessage);
  }
}
