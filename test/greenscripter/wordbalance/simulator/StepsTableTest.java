package greenscripter.wordbalance.simulator;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class StepsTableTest {

	private final Simulator simulator = new Simulator();

	@Test
	public void testRendersPipeTable() {
		String[] lines = StepsTable.render(simulator.trace("cat apple!")).split("\n");
		assertEquals(2 + 11, lines.length);
		assertEquals("| State | Remaining Input | Stack |", lines[0]);
		assertEquals("|:------|:----------------|:------|", lines[1]);
		assertEquals("| q0    | cat apple!      | S     |", lines[2]);
		assertEquals("| q1    | at apple!       | CS    |", lines[3]);
		assertEquals("| q0    | apple!          | CS    |", lines[6]);
		assertEquals("| q2    | ε               | ε     |", lines[12]);
	}

	@Test
	public void testPreservesSpacesAndWidensColumns() {
		String table = StepsTable.render(List.of(List.of("q0", "  a long remaining input!", "VVVVVVS")));
		String[] lines = table.split("\n");
		assertEquals("| State | Remaining Input           | Stack   |", lines[0]);
		assertEquals("|:------|:--------------------------|:--------|", lines[1]);
		assertEquals("| q0    |   a long remaining input! | VVVVVVS |", lines[2]);
	}

	@Test
	public void testFailedTraceAppendsMessage() {
		String table = StepsTable.render(simulator.trace("cat"));
		assertTrue(table.startsWith("| State |"));
		assertTrue(table.contains("| q1    | ε               | CS    |"));
		assertTrue(table.endsWith("\n\nInput ended without the end marker '!'. (position 3)"));
	}

	@Test
	public void testEmptyTraceStillHasHeaders() {
		assertEquals("| State | Remaining Input | Stack |\n|:------|:----------------|:------|", StepsTable.render(List.of()));
	}
}
