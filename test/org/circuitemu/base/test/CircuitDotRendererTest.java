package org.circuitemu.base.test;

import static org.circuitemu.base.util.circuit.Gates.and;
import static org.circuitemu.base.util.circuit.Gates.input;
import static org.circuitemu.base.util.circuit.Gates.not;
import static org.circuitemu.base.util.circuit.Gates.xor;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.circuitemu.base.util.circuit.Circuit;
import org.circuitemu.base.util.circuit.CircuitDotRenderer;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CircuitDotRendererTest
{
  @Rule
  public TemporaryFolder mTempFolder = new TemporaryFolder();

  private static final String EXPECTED =
    "digraph circuit\n{\n" +
    "\t\"n0\"[shape=invhouse, style= filled, fillcolor=grey, label=\"AND\"];\n" +
    "\t\"n1\"[shape=circle, style= filled, fillcolor=white, label=\"I0\"];\n" +
    "\t\"n1\"->\"n0\";\n" +
    "\t\"n2\"[shape=invtriangle, style= filled, fillcolor=grey, label=\"NOT\"];\n" +
    "\t\"n3\"[shape=diamond, style= filled, fillcolor=grey, label=\"XOR\"];\n" +
    "\t\"n4\"[shape=circle, style= filled, fillcolor=white, label=\"I1\"];\n" +
    "\t\"n4\"->\"n3\";\n" +
    "\t\"n5\"[shape=circle, style= filled, fillcolor=white, label=\"I2\"];\n" +
    "\t\"n5\"->\"n3\";\n" +
    "\t\"n3\"->\"n2\";\n" +
    "\t\"n2\"->\"n0\";\n" +
    "}\n";

  private static Circuit circuit() throws Exception
  {
    return new Circuit(3, and(input(0), not(xor(input(1), input(2)))));
  }

  @Test
  public void testDotOutput() throws Exception
  {
    assertEquals(EXPECTED, CircuitDotRenderer.toDot(circuit()));
  }

  @Test
  public void testRenderToFile() throws Exception
  {
    File lFile = new File(mTempFolder.getRoot(), "circuit.dot");
    CircuitDotRenderer.renderToFile(circuit(), lFile);
    assertEquals(EXPECTED, new String(Files.readAllBytes(lFile.toPath()), StandardCharsets.UTF_8));
  }
}
