package org.lokray.tamodel.semantic.symbol;

import org.junit.jupiter.api.Test;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.position.SemanticException;
import org.lokray.tamodel.semantic.type.PrimitiveType;

import static org.junit.jupiter.api.Assertions.*;

class FrameTest
{
	@Test
	void innerDeclarationShadowsOuter()
	{
		Frame global = Frame.createRoot();
		Symbol outer = global.declare("x", PrimitiveType.INT, Position.UNKNOWN);
		Frame local = global.child();
		Symbol inner = local.declare("x", PrimitiveType.BOOL, Position.UNKNOWN);

		assertSame(inner, local.resolve("x").orElseThrow());
		assertSame(outer, global.resolve("x").orElseThrow());
		assertSame(outer, global.child().resolve("x").orElseThrow());
		assertSame(global, local.getParent());
		assertSame(local, inner.getFrame());
	}

	@Test
	void redeclarationInSameFrameFails()
	{
		Frame frame = Frame.createRoot();
		frame.declare("a", PrimitiveType.INT, Position.UNKNOWN);

		SemanticException e = assertThrows(SemanticException.class, () -> frame.declare("a", PrimitiveType.DOUBLE, Position.UNKNOWN));
		assertEquals(ErrorKind.DUPLICATE_SYMBOL, e.getKind());
		assertEquals(1, frame.size());
	}

	@Test
	void lookupWalksParentsButResolveLocallyDoesNot()
	{
		Frame global = Frame.createRoot();
		global.declare("N", PrimitiveType.INT, Position.UNKNOWN);
		Frame child = global.child().child();

		assertTrue(child.resolve("N").isPresent());
		assertTrue(child.resolveLocally("N").isEmpty());
		assertTrue(child.resolve("missing").isEmpty());
	}

	@Test
	void includedSymbolsKeepTheirFrame()
	{
		Frame a = Frame.createRoot();
		Symbol p = a.declare("p", PrimitiveType.INT, Position.UNKNOWN);
		Frame b = Frame.createRoot();
		b.include(p);

		assertTrue(b.contains(p));
		assertSame(a, p.getFrame());
		assertEquals(0, b.indexOf(p));
	}

	@Test
	void isWithinIncludesTheFrameItself()
	{
		Frame root = Frame.createRoot();
		Frame child = root.child();
		Frame sibling = root.child();

		assertTrue(child.isWithin(child));
		assertTrue(child.isWithin(root));
		assertFalse(root.isWithin(child));
		assertFalse(child.isWithin(sibling));
	}

	@Test
	void symbolsKeepDeclarationOrder()
	{
		Frame frame = Frame.createRoot();
		frame.declare("c", PrimitiveType.INT, Position.UNKNOWN);
		frame.declare("a", PrimitiveType.INT, Position.UNKNOWN);
		frame.declare("b", PrimitiveType.INT, Position.UNKNOWN);

		assertEquals("a", frame.get(1).getName());
		assertEquals("(int c, int a, int b)", frame.toString());
	}
}
