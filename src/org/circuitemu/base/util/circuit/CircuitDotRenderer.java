package org.circuitemu.base.util.circuit;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Renders a circuit in .dot format.  This can be viewed with tools like
 * Graphviz and ZGRViewer.
 * <p>
 * Vertices are numbered in pre-order, so the root is always "n0".  Edges run
 * from each input to the gate that consumes it.
 */
public final class CircuitDotRenderer implements CircuitNodeVisitor<String>
{
  private final StringBuilder mOutput = new StringBuilder();
  private int mNextVertex = 0;

  private CircuitDotRenderer()
  {
  }

  /**
   * @return a representation of the circuit in .dot format.
   *
   * @param xiCircuit - the circuit.
   */
  public static String toDot(Circuit xiCircuit)
  {
    CircuitDotRenderer lRenderer = new CircuitDotRenderer();
    lRenderer.mOutput.append("digraph circuit\n{\n");
    xiCircuit.getRoot().accept(lRenderer);
    lRenderer.mOutput.append("}\n");
    return lRenderer.mOutput.toString();
  }

  /**
   * Write the circuit in .dot format.
   *
   * @param xiCircuit - the circuit.
   * @param xiOutput - the output stream to write to.
   *
   * @throws IOException if there was a problem writing the circuit.
   */
  public static void renderAsDot(Circuit xiCircuit, Writer xiOutput) throws IOException
  {
    xiOutput.write(toDot(xiCircuit));
  }

  /**
   * Outputs the circuit in .dot format to a particular file.
   *
   * @param xiCircuit - the circuit.
   * @param xiFile - the file to output to.
   *
   * @throws IOException if the file could not be written.
   */
  public static void renderToFile(Circuit xiCircuit, File xiFile) throws IOException
  {
    try (Writer lWriter = new OutputStreamWriter(new FileOutputStream(xiFile), StandardCharsets.UTF_8))
    {
      renderAsDot(xiCircuit, lWriter);
    }
  }

  @Override
  public String visitInput(InputRef xiInput)
  {
    return addVertex("circle", "white", xiInput.toString());
  }

  @Override
  public String visitNot(NotGate xiNot)
  {
    return addGate(xiNot, "invtriangle", "NOT");
  }

  @Override
  public String visitOr(OrGate xiOr)
  {
    return addGate(xiOr, "ellipse", xiOr.getName());
  }

  @Override
  public String visitAnd(AndGate xiAnd)
  {
    return addGate(xiAnd, "invhouse", xiAnd.getName());
  }

  @Override
  public String visitXor(XorGate xiXor)
  {
    return addGate(xiXor, "diamond", xiXor.getName());
  }

  private String addGate(CircuitNode xiGate, String xiShape, String xiLabel)
  {
    String lVertex = addVertex(xiShape, "grey", xiLabel);
    for (CircuitNode lInput : xiGate.getInputs())
    {
      String lInputVertex = lInput.accept(this);
      mOutput.append("\t\"").append(lInputVertex).append("\"->\"").append(lVertex).append("\";\n");
    }
    return lVertex;
  }

  private String addVertex(String xiShape, String xiFillColour, String xiLabel)
  {
    String lVertex = "n" + (mNextVertex++);
    mOutput.append("\t\"").append(lVertex)
           .append("\"[shape=").append(xiShape)
           .append(", style= filled, fillcolor=").append(xiFillColour)
           .append(", label=\"").append(xiLabel).append("\"];\n");
    return lVertex;
  }
}
