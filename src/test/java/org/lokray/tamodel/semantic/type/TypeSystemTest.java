package org.lokray.tamodel.semantic.type;

import org.junit.jupiter.api.Test;
import org.lokray.tamodel.expression.ExprKind;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.position.SemanticException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeSystemTest
{
	private static Expression constant(long value)
	{
		return Expression.createConstant(value, Position.UNKNOWN);
	}

	private static Type range(long lower, long upper)
	{
		return new RangeType(constant(lower), constant(upper));
	}

	@Test
	void integralValuesConvertIntoEachOther()
	{
		assertTrue(TypeSystem.isAssignable(PrimitiveType.INT, PrimitiveType.BOOL));
		assertTrue(TypeSystem.isAssignable(PrimitiveType.BOOL, PrimitiveType.INT));
		assertTrue(TypeSystem.isAssignable(range(0, 5), PrimitiveType.INT));
		assertFalse(TypeSystem.isAssignable(PrimitiveType.INT, PrimitiveType.DOUBLE));
	}

	@Test
	void clocksAreResetFromNumbersAndReadAsDouble()
	{
		assertTrue(TypeSystem.isAssignable(PrimitiveType.CLOCK, PrimitiveType.INT));
		assertTrue(TypeSystem.isAssignable(PrimitiveType.DOUBLE, PrimitiveType.CLOCK));
		assertFalse(TypeSystem.isAssignable(PrimitiveType.INT, PrimitiveType.CLOCK));
	}

	@Test
	void qualifiersAreIgnoredForAssignability()
	{
		Type constInt = QualifiedType.of(Qualifier.CONST, PrimitiveType.INT);
		assertTrue(TypeSystem.isAssignable(PrimitiveType.INT, constInt));
		assertTrue(constInt.isConstant());
		assertSame(PrimitiveType.INT, constInt.strip());
	}

	@Test
	void scalarsOnlyMixWithinTheirOwnSet()
	{
		Type a = new ScalarType(constant(3));
		Type b = new ScalarType(constant(3));
		assertTrue(TypeSystem.isAssignable(a, a));
		assertFalse(TypeSystem.isAssignable(a, b));
		assertFalse(TypeSystem.isAssignable(a, PrimitiveType.INT));
	}

	@Test
	void arraysNeedTheSameShape()
	{
		Type a = new ArrayType(PrimitiveType.INT, constant(4));
		Type b = new ArrayType(range(0, 9), constant(4));
		Type c = new ArrayType(PrimitiveType.INT, constant(5));
		assertTrue(TypeSystem.structuralEqual(a, b));
		assertFalse(TypeSystem.structuralEqual(a, c));
		assertFalse(TypeSystem.isAssignable(a, c));
	}

	@Test
	void operatorsOnNumbersAndClocks()
	{
		assertSame(PrimitiveType.INT, TypeSystem.compatibleForOperator(ExprKind.PLUS, List.of(PrimitiveType.INT, range(0, 3))));
		assertSame(PrimitiveType.DOUBLE, TypeSystem.compatibleForOperator(ExprKind.MULT, List.of(PrimitiveType.INT, PrimitiveType.DOUBLE)));
		assertSame(PrimitiveType.CLOCK, TypeSystem.compatibleForOperator(ExprKind.MINUS, List.of(PrimitiveType.CLOCK, PrimitiveType.CLOCK)));
		assertSame(PrimitiveType.BOOL, TypeSystem.compatibleForOperator(ExprKind.LE, List.of(PrimitiveType.CLOCK, PrimitiveType.INT)));
		assertSame(PrimitiveType.BOOL, TypeSystem.compatibleForOperator(ExprKind.AND, List.of(PrimitiveType.BOOL, PrimitiveType.INT)));
	}

	@Test
	void operatorsRejectChannelsAndClockInequality()
	{
		assertTrue(TypeSystem.compatibleForOperator(ExprKind.EQ, List.of(PrimitiveType.CHANNEL, PrimitiveType.CHANNEL)).isError());
		assertTrue(TypeSystem.compatibleForOperator(ExprKind.NEQ, List.of(PrimitiveType.CLOCK, PrimitiveType.INT)).isError());
		assertTrue(TypeSystem.compatibleForOperator(ExprKind.MOD, List.of(PrimitiveType.DOUBLE, PrimitiveType.INT)).isError());
	}

	@Test
	void arraySizesFoldToNonNegativeConstants()
	{
		Expression size = Expression.createBinary(ExprKind.PLUS, constant(2), constant(3), Position.UNKNOWN);
		assertEquals(5, TypeSystem.evaluateConstantSize(size));

		Expression negative = Expression.createUnary(ExprKind.UNARY_MINUS, constant(1), Position.UNKNOWN);
		SemanticException e = assertThrows(SemanticException.class, () -> TypeSystem.evaluateConstantSize(negative));
		assertEquals(ErrorKind.INVALID_ARRAY_SIZE, e.getKind());
	}
}
