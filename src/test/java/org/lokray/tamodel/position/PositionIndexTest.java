package org.lokray.tamodel.position;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionIndexTest
{
	@Test
	void locatesOffsetsAfterTheNearestBreakpoint()
	{
		PositionIndex index = new PositionIndex();
		index.add(0, 0, 1, "model.xta");
		index.add(10, 10, 2, "model.xta");
		index.add(25, 0, 1, "queries.q");

		SourceLocation first = index.locate(4);
		assertEquals("model.xta", first.getPath());
		assertEquals(1, first.getLine());
		assertEquals(5, first.getColumn());

		SourceLocation second = index.locate(12);
		assertEquals(2, second.getLine());
		assertEquals(3, second.getColumn());

		SourceLocation query = index.locate(30);
		assertEquals("queries.q", query.getPath());
		assertEquals(1, query.getLine());
	}

	@Test
	void structuredSourcesKeepFileAndElementPath()
	{
		PositionIndex index = new PositionIndex();
		index.add(0, 0, 1, "model.xml", "/nta/template[1]/declaration");
		index.add(40, 0, 1, "model.xml", "/nta/template[1]/transition[2]/label[1]");

		SourceLocation guard = index.locate(43);
		assertEquals("model.xml", guard.getPath());
		assertEquals("/nta/template[1]/transition[2]/label[1]", guard.getStructuralPath());
		assertEquals(4, guard.getColumn());

		Diagnostic diagnostic = new Diagnostic(ErrorKind.TYPE_MISMATCH, guard, guard, "Guard must be boolean", "x");
		assertEquals("model.xml", diagnostic.getFile());
		assertEquals("/nta/template[1]/transition[2]/label[1]", diagnostic.getPath());
		assertNull(index.locate(Position.UNKNOWN_OFFSET).getStructuralPath());
	}

	@Test
	void plainTextHasNoElementPath()
	{
		PositionIndex index = new PositionIndex();
		index.add(0, 0, 1, "model.xta");

		assertNull(index.locate(2).getStructuralPath());
		assertEquals("model.xta", index.locate(2).getPath());
	}

	@Test
	void breakpointAtSamePositionReplacesThePreviousOne()
	{
		PositionIndex index = new PositionIndex();
		index.add(0, 0, 1, "a");
		index.add(0, 0, 7, "b");

		assertEquals(1, index.size());
		assertEquals("b", index.lookup(3).getPath());
	}

	@Test
	void outOfOrderBreakpointsAreRejected()
	{
		PositionIndex index = new PositionIndex();
		index.add(10, 0, 1, "a");
		assertThrows(IllegalArgumentException.class, () -> index.add(5, 0, 1, "a"));
	}

	@Test
	void unknownPositionHasNoLocation()
	{
		PositionIndex index = new PositionIndex();
		index.add(0, 0, 1, "a");
		assertSame(SourceLocation.UNKNOWN, index.locate(Position.UNKNOWN_OFFSET));
		assertEquals("<unknown>", SourceLocation.UNKNOWN.toString());
	}

	@Test
	void firstBreakpointAfterFallsBackToTheLast()
	{
		PositionIndex index = new PositionIndex();
		index.add(0, 0, 1, "a");
		index.add(20, 0, 2, "a");

		assertEquals(2, index.lookupFirstAfter(5).getLine());
		assertEquals(2, index.lookupFirstAfter(100).getLine());
	}
}
