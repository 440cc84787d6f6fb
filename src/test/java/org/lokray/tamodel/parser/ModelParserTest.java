package org.lokray.tamodel.parser;

import org.junit.jupiter.api.Test;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.document.Query;
import org.lokray.tamodel.document.Template;
import org.lokray.tamodel.expression.ExprKind;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Diagnostic;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.semantic.TypeChecker;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelParserTest
{
	private static Path resource(String name) throws Exception
	{
		return Path.of(ModelParserTest.class.getResource(name).toURI());
	}

	@Test
	void trainGateParsesAndChecksCleanly() throws Exception
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseFile(resource("/models/traingate.xta"));
		parser.parseQueryFile(document, resource("/models/traingate.q"));
		TypeChecker.check(document);

		assertTrue(document.getErrors().isEmpty(), () -> "errors: " + document.getErrors());
		assertTrue(document.getWarnings().isEmpty(), () -> "warnings: " + document.getWarnings());

		List<Template> templates = document.getTemplates();
		assertEquals(2, templates.size());
		Template train = templates.get(0);
		assertEquals("Train", train.getName());
		assertEquals(5, train.getLocations().size());
		assertEquals(6, train.getEdges().size());
		assertEquals("Safe", train.getInit().getName());

		Template gate = templates.get(1);
		assertTrue(gate.getLocations().stream().anyMatch(l -> l.getName().equals("Send") && l.isCommitted()));
		assertEquals(2, document.getProcesses().size());
	}

	@Test
	void queriesKeepTheirCommentsAndEstimationShape() throws Exception
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseFile(resource("/models/traingate.xta"));
		List<Query> queries = parser.parseQueryFile(document, resource("/models/traingate.q"));

		assertEquals(6, queries.size());
		assertEquals(6, document.getQueries().size());
		assertEquals("Gate can be occupied", queries.get(0).getComment());
		assertEquals("", queries.get(1).getComment());
		assertEquals(ExprKind.EF, queries.get(0).getFormula().getKind());
		assertEquals(ExprKind.LEADS_TO, queries.get(3).getFormula().getKind());

		Expression probability = queries.get(4).getFormula();
		assertEquals(ExprKind.PROBA_DIAMOND, probability.getKind());
		assertEquals(5, probability.getSize());
		assertEquals(7, probability.get(0).getValue());
		assertEquals(QueryVisitor.BOUND_TIME, probability.get(1).getValue());
		assertTrue(probability.get(2).isEmpty());
		assertEquals(100, probability.get(3).getValue());
		assertEquals("Probability of reaching the occupied state", queries.get(4).getComment());

		Expression estimate = queries.get(5).getFormula();
		assertEquals(ExprKind.EXP_MAX, estimate.getKind());
		assertEquals(5, estimate.getSize());
		assertEquals(-1, estimate.get(0).getValue());
	}

	@Test
	void syntaxErrorIsReportedWithoutBuildingTheModel()
	{
		Document document = new Document();
		boolean parsed = new ModelParser().parseModel(document, "int x;\nint y = ;\n", "broken.xta");

		assertFalse(parsed);
		assertTrue(document.hasErrors());
		Diagnostic error = document.getErrors().get(0);
		assertEquals(ErrorKind.SYNTAX, error.getKind());
		assertEquals("broken.xta", error.getFile());
		assertEquals(2, error.getStart().getLine());
		assertTrue(document.getGlobalFrame().resolve("x").isEmpty());
	}

	@Test
	void semanticDiagnosticsPointAtTheirSourceLine()
	{
		Document document = new ModelParser().parseModel("int a;\n\nint b = c + 1;\n", "model.xta");

		assertEquals(1, document.getErrors().size());
		Diagnostic error = document.getErrors().get(0);
		assertEquals(ErrorKind.UNDECLARED_SYMBOL, error.getKind());
		assertEquals("c", error.getContext());
		assertEquals(3, error.getStart().getLine());
		assertEquals(9, error.getStart().getColumn());
	}

	@Test
	void malformedQueryLineIsSkipped() throws Exception
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseFile(resource("/models/traingate.xta"));
		List<Query> queries = parser.parseQueries(document, "E<> Gate.Occ\nA[] (\nA[] len <= N\n", "broken.q");

		assertEquals(2, queries.size());
		Diagnostic error = document.getErrors().get(0);
		assertEquals(ErrorKind.SYNTAX, error.getKind());
		assertEquals("broken.q", error.getFile());
		assertEquals(2, error.getStart().getLine());
	}

	@Test
	void propertyResolvesProcessMembers() throws Exception
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseFile(resource("/models/traingate.xta"));
		Expression property = parser.parseProperty(document, "A[] Gate.Occ imply len > 0", "inline");

		assertEquals(ExprKind.AG, property.getKind());
		assertEquals(ExprKind.IMPLY, property.get(0).getKind());
		assertFalse(document.hasErrors());
	}

	@Test
	void oversizedRunCountIsReportedNotThrown() throws Exception
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseFile(resource("/models/traingate.xta"));
		Expression property = parser.parseProperty(document, "Pr[<=1;99999999999999999999](<> true)", "inline");

		assertEquals(ExprKind.PROBA_DIAMOND, property.getKind());
		assertEquals(-1, property.get(0).getValue());
		assertEquals(1, document.getErrors().size());
		Diagnostic error = document.getErrors().get(0);
		assertEquals("Integer literal out of range", error.getMessage());
		assertEquals("99999999999999999999", error.getContext());
	}

	@Test
	void undeclaredNamesShareOnePlaceholderUnderTheBuiltins()
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseModel("int a = nosuch;\nint b = nosuch + 1;\n", "model.xta");

		assertEquals(2, document.getErrors().size());
		Expression property = parser.parseProperty(document, "E<> ghost", "inline");
		assertEquals(3, document.getErrors().size());
		assertEquals(ErrorKind.UNDECLARED_SYMBOL, document.getErrors().get(2).getKind());
		assertSame(document.getBuiltinFrame(), property.get(0).getSymbol().getFrame().getParent());
	}
}
