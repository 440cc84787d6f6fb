package org.lokray.tamodel.parser;

import org.lokray.tamodel.builder.DocumentBuilder;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.type.ArrayType;
import org.lokray.tamodel.semantic.type.PrimitiveType;
import org.lokray.tamodel.semantic.type.QualifiedType;
import org.lokray.tamodel.semantic.type.Qualifier;
import org.lokray.tamodel.semantic.type.RangeType;
import org.lokray.tamodel.semantic.type.RecordType;
import org.lokray.tamodel.semantic.type.ScalarType;
import org.lokray.tamodel.semantic.type.Type;

import java.util.List;

/**
 * Builds {@link Type}s from type syntax. Named types go through the builder so unknown
 * names are reported against the current scope.
 */
public class TypeVisitor extends TimedAutomataBaseVisitor<Type>
{
	private final DocumentBuilder builder;
	private final ExpressionVisitor expressions;
	private final int base;

	TypeVisitor(DocumentBuilder builder, ExpressionVisitor expressions, int base)
	{
		this.builder = builder;
		this.expressions = expressions;
		this.base = base;
	}

	@Override
	public Type visitType(TimedAutomataParser.TypeContext ctx)
	{
		Type type = visit(ctx.typeCore());
		for (TimedAutomataParser.TypePrefixContext prefix : ctx.typePrefix())
		{
			type = QualifiedType.of(qualifier(prefix.getText()), type);
		}
		return type;
	}

	private static Qualifier qualifier(String keyword)
	{
		return switch (keyword)
		{
			case "const" -> Qualifier.CONST;
			case "meta" -> Qualifier.META;
			case "urgent" -> Qualifier.URGENT;
			case "broadcast" -> Qualifier.BROADCAST;
			default -> throw new IllegalArgumentException("Unknown type prefix: " + keyword);
		};
	}

	@Override
	public Type visitIntType(TimedAutomataParser.IntTypeContext ctx)
	{
		if (ctx.expression().isEmpty())
		{
			return PrimitiveType.INT;
		}
		return new RangeType(expressions.visit(ctx.expression(0)), expressions.visit(ctx.expression(1)));
	}

	@Override
	public Type visitBoolType(TimedAutomataParser.BoolTypeContext ctx)
	{
		return PrimitiveType.BOOL;
	}

	@Override
	public Type visitDoubleType(TimedAutomataParser.DoubleTypeContext ctx)
	{
		return PrimitiveType.DOUBLE;
	}

	@Override
	public Type visitClockType(TimedAutomataParser.ClockTypeContext ctx)
	{
		return PrimitiveType.CLOCK;
	}

	@Override
	public Type visitChanType(TimedAutomataParser.ChanTypeContext ctx)
	{
		return PrimitiveType.CHANNEL;
	}

	@Override
	public Type visitVoidType(TimedAutomataParser.VoidTypeContext ctx)
	{
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitStringType(TimedAutomataParser.StringTypeContext ctx)
	{
		return PrimitiveType.STRING;
	}

	@Override
	public Type visitScalarType(TimedAutomataParser.ScalarTypeContext ctx)
	{
		// Every scalar declaration introduces its own scalar set.
		return new ScalarType(expressions.visit(ctx.expression()));
	}

	@Override
	public Type visitStructType(TimedAutomataParser.StructTypeContext ctx)
	{
		Frame fields = Frame.createRoot();
		for (TimedAutomataParser.FieldDeclContext field : ctx.fieldDecl())
		{
			Type fieldType = visit(field.type());
			for (TimedAutomataParser.TypeIdContext id : field.typeId())
			{
				builder.declare(fields, arrayOf(fieldType, id.arraySize()), id.ID().getText(), SourceRange.of(id, base));
			}
		}
		return new RecordType(fields);
	}

	@Override
	public Type visitNamedType(TimedAutomataParser.NamedTypeContext ctx)
	{
		return builder.typeName(ctx.ID().getText(), SourceRange.of(ctx, base));
	}

	/**
	 * Wraps {@code element} in one array dimension per size, so that {@code a[2][3]}
	 * is an array of two arrays of three.
	 */
	public Type arrayOf(Type element, List<TimedAutomataParser.ArraySizeContext> sizes)
	{
		Type type = element;
		for (int i = sizes.size() - 1; i >= 0; i--)
		{
			type = new ArrayType(type, expressions.visit(sizes.get(i).expression()));
		}
		return type;
	}
}
