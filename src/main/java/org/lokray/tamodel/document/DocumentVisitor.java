package org.lokray.tamodel.document;

/**
 * Callbacks for a walk over a {@link Document}, see {@link Document#accept}. Every method
 * does nothing by default, so implementations override only what they need.
 */
public interface DocumentVisitor
{
	default void visitDocumentBefore(Document document)
	{
	}

	default void visitDocumentAfter(Document document)
	{
	}

	default void visitVariable(Variable variable)
	{
	}

	default void visitTypeDefinition(TypeDefinition definition)
	{
	}

	default void visitFunction(Function function)
	{
	}

	default void visitProgressMeasure(ProgressMeasure measure)
	{
	}

	default void visitGantt(Gantt gantt)
	{
	}

	default void visitIoDecl(IoDecl decl)
	{
	}

	/**
	 * @return false to skip the contents of the template
	 */
	default boolean visitTemplateBefore(Template template)
	{
		return true;
	}

	default void visitTemplateAfter(Template template)
	{
	}

	default void visitLocation(Location location)
	{
	}

	default void visitBranchpoint(Branchpoint branchpoint)
	{
	}

	default void visitEdge(Edge edge)
	{
	}

	default void visitInstanceLine(InstanceLine line)
	{
	}

	default void visitMessage(Message message)
	{
	}

	default void visitCondition(Condition condition)
	{
	}

	default void visitUpdate(Update update)
	{
	}

	/** Called for every partial or complete instance of the system section. */
	default void visitInstance(Instance instance)
	{
	}

	default void visitProcess(Instance process)
	{
	}

	default void visitChanPriority(ChanPriority priority)
	{
	}

	default void visitQuery(Query query)
	{
	}
}
