package org.lokray.tamodel.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.document.Function;
import org.lokray.tamodel.document.Location;
import org.lokray.tamodel.document.Template;
import org.lokray.tamodel.parser.ModelParser;
import org.lokray.tamodel.position.Diagnostic;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.semantic.symbol.Symbol;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TypeCheckerTest
{
	private static Document check(String text)
	{
		Document document = new ModelParser().parseModel(text, "model.xta");
		assertFalse(document.hasErrors(), () -> "model did not build: " + document.getErrors());
		TypeChecker.check(document);
		return document;
	}

	private static Diagnostic singleError(Document document)
	{
		assertEquals(1, document.getErrors().size(), () -> document.getErrors().toString());
		return document.getErrors().get(0);
	}

	private static Set<String> names(Set<Symbol> symbols)
	{
		return symbols.stream().map(Symbol::getName).collect(Collectors.toSet());
	}

	private static Function function(Document document, String name)
	{
		return document.getGlobals().getFunctions().stream()
				.filter(f -> f.getName().equals(name))
				.findFirst()
				.orElseThrow(() -> new AssertionError("no function " + name));
	}

	// --- Declarations and functions ---

	@Test
	void assigningRecordToIntIsRejected()
	{
		Document document = check("typedef struct { int a; } R;\nR r;\nint x;\nvoid f() { x = r; }\n");

		Diagnostic error = singleError(document);
		assertEquals(ErrorKind.TYPE_MISMATCH, error.getKind());
		assertTrue(error.getMessage().startsWith("Incompatible types"), error.getMessage());
		assertEquals(4, error.getStart().getLine());
	}

	@Test
	void voidFunctionCannotReturnValue()
	{
		Diagnostic error = singleError(check("void f() { return 1; }\n"));

		assertEquals(ErrorKind.TYPE_MISMATCH, error.getKind());
		assertEquals("Void function cannot return a value.", error.getMessage());
	}

	@Test
	void missingReturnOnSomePathIsReported()
	{
		Diagnostic error = singleError(check("int f(int a) { if (a > 0) return 1; }\n"));

		assertTrue(error.getMessage().startsWith("Function must return a result of type 'int'"), error.getMessage());
	}

	@Test
	void everyPathReturningIsAccepted()
	{
		Document document = check("int f(int a) { if (a > 0) return 1; else return 2; }\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
	}

	@Test
	void statementWithoutEffectIsAWarning()
	{
		Document document = check("int x;\nvoid f() { x + 1; x = 2; }\n");

		assertFalse(document.hasErrors());
		assertEquals(1, document.getWarnings().size());
		assertEquals("Expression has no effect", document.getWarnings().get(0).getMessage());
	}

	@Test
	void assigningToConstantIsRejected()
	{
		Diagnostic error = singleError(check("const int K = 1;\nvoid f() { K = 2; }\n"));

		assertEquals("Cannot assign to constant 'K'.", error.getMessage());
	}

	@Test
	void uninitialisedConstantIsRejected()
	{
		Diagnostic error = singleError(check("const int K;\n"));

		assertEquals("Constant 'K' must be initialized.", error.getMessage());
	}

	@Test
	void callArityIsChecked()
	{
		Diagnostic error = singleError(check("int g(int a) { return a; }\nint x;\nvoid f() { x = g(1, 2); }\n"));

		assertEquals(ErrorKind.ARITY_MISMATCH, error.getKind());
	}

	@Test
	void guardMustBeSideEffectFree()
	{
		Diagnostic error = singleError(check("int x;\nprocess P() { state A; init A; trans A -> A { guard x++ > 0; }; }\nsystem P;\n"));

		assertEquals("Guard must not have side effects.", error.getMessage());
	}

	@Test
	void guardMayCallPureFunctions() throws Exception
	{
		Document document = new ModelParser().parseFile(Path.of(getClass().getResource("/models/traingate.xta").toURI()));
		TypeChecker.check(document);

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		Function front = function(document, "front");
		assertTrue(front.getChanges().isEmpty());
		assertTrue(names(front.getDepends()).contains("list"));

		assertEquals(Set.of("list", "len"), names(function(document, "enqueue").getChanges()));
		assertEquals(Set.of("list", "len"), names(function(document, "dequeue").getChanges()));
	}

	// --- Capabilities ---

	@Test
	void strictInvariantIsRecorded()
	{
		Document document = check("process P() { clock x; state S { x < 5 }; init S; }\nsystem P;\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		Capabilities capabilities = document.getCapabilities();
		assertTrue(capabilities.hasStrictInvariants());
		assertFalse(capabilities.getSupportedMethods().isConcrete());
		assertTrue(capabilities.getSupportedMethods().isSymbolic());
	}

	@Test
	void zeroRateIsAStopwatch()
	{
		Document document = check("process P() { clock x; state S { x <= 5 && x' == 0 }; init S; }\nsystem P;\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		assertTrue(document.getCapabilities().hasStopWatch());
		assertFalse(document.getCapabilities().hasStrictInvariants());
		Location s = document.getTemplates().get(0).getLocations().get(0);
		assertEquals(1, s.getRates().size());
	}

	@Test
	void rateOfDoubleBecomesCostRate()
	{
		Document document = check("double cost;\nprocess P() { state S { cost' == 2 }; init S; }\nsystem P;\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		assertFalse(document.getCapabilities().hasStopWatch());
		Location s = document.getTemplates().get(0).getLocations().get(0);
		assertEquals(2, s.getCostRate().getValue());
	}

	@Test
	void broadcastReceiveWithClockGuardRestrictsStochasticMethods()
	{
		Document document = check("broadcast chan b;\n"
				+ "process P() { clock x; state A, B; init A; trans A -> B { guard x > 1; sync b?; }; }\n"
				+ "process Q() { state A; init A; trans A -> A { sync b!; }; }\n"
				+ "system P, Q;\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		Capabilities capabilities = document.getCapabilities();
		assertTrue(capabilities.hasClockGuardRecvBroadcast());
		assertEquals(SyncUsage.BROADCAST_ONLY, capabilities.getSyncUsage());
		assertFalse(capabilities.getSupportedMethods().isStochastic());
	}

	@Test
	void binaryAndBroadcastSyncIsMixed()
	{
		Document document = check("broadcast chan b;\nchan c;\n"
				+ "process P() { state A; init A; trans A -> A { sync b!; }, A -> A { sync c!; }; }\n"
				+ "system P;\n");

		assertEquals(SyncUsage.MIXED, document.getCapabilities().getSyncUsage());
	}

	@Test
	void noSyncLeavesUsageNone()
	{
		Document document = check("process P() { state A; init A; }\nsystem P;\n");

		assertEquals(SyncUsage.NONE, document.getCapabilities().getSyncUsage());
		SupportedMethods methods = document.getCapabilities().getSupportedMethods();
		assertTrue(methods.isSymbolic());
		assertTrue(methods.isStochastic());
		assertTrue(methods.isConcrete());
	}

	@Test
	void urgentChannelForbidsClockGuards()
	{
		Document document = check("urgent chan u;\n"
				+ "process P() { clock x; state A; init A; trans A -> A { guard x > 1; sync u!; }; }\n"
				+ "system P;\n");

		Diagnostic error = singleError(document);
		assertEquals(ErrorKind.GENERAL, error.getKind());
		assertEquals("Clock guards are not allowed on edges synchronising on urgent channels.", error.getMessage());
		assertTrue(document.getCapabilities().hasUrgentTransition());
	}

	@Test
	void channelPriorityIsRecorded()
	{
		Document document = check("chan a, b;\nchan priority a < b;\nprocess P() { state A; init A; }\nsystem P;\n");

		assertTrue(document.getCapabilities().hasPriorityDeclaration());
	}

	// --- Dynamic templates ---

	@Test
	void spawnOfDynamicTemplateIsAccepted()
	{
		Document document = check("dynamic Worker(int id);\n"
				+ "process Worker(int id) { state W; init W; trans W -> W { assign exit(); }; }\n"
				+ "process Main() { state A; init A; trans A -> A { assign spawn Worker(1); }; }\n"
				+ "system Main;\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		assertTrue(document.getWarnings().isEmpty(), () -> document.getWarnings().toString());
		Capabilities capabilities = document.getCapabilities();
		assertTrue(capabilities.hasDynamicTemplates());
		assertFalse(capabilities.getSupportedMethods().isSymbolic());

		Template main = document.getTemplates().get(0);
		assertEquals("Main", main.getName());
		assertEquals(1, main.getDynamicEvals().size());
	}

	@Test
	void spawnOfOrdinaryTemplateIsRejected()
	{
		Document document = check("process Worker() { state W; init W; }\n"
				+ "process Main() { state A; init A; trans A -> A { assign spawn Worker(); }; }\n"
				+ "system Main;\n");

		Diagnostic error = singleError(document);
		assertEquals("'Worker' is not a dynamic template.", error.getMessage());
	}

	@Test
	void exitOutsideDynamicTemplateIsRejected()
	{
		Diagnostic error = singleError(check("process P() { state A; init A; trans A -> A { assign exit(); }; }\nsystem P;\n"));

		assertEquals("exit() is only allowed in dynamic templates.", error.getMessage());
	}

	@Test
	void undefinedDynamicTemplateIsReported()
	{
		Diagnostic error = singleError(check("dynamic Worker(int id);\nprocess P() { state A; init A; }\nsystem P;\n"));

		assertEquals(ErrorKind.UNDECLARED_SYMBOL, error.getKind());
	}

	// --- Queries ---

	@Test
	void queryRunCountAndBoundAreChecked()
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseModel("int y;\nclock g;\nprocess P() { state A; init A; }\nsystem P;\n", "model.xta");
		parser.parseQueries(document, "Pr[<=10; 0](<> P.A)\nPr[y<=10](<> P.A)\nPr[g<=10](<> P.A)\n", "model.q");
		TypeChecker.check(document);

		List<String> messages = document.getErrors().stream().map(Diagnostic::getMessage).collect(Collectors.toList());
		assertEquals(List.of(
				"Number of runs must be positive.",
				"Run bound variable must be a clock, but found 'int'."), messages);
	}

	@Test
	void pathFormulaMustBeBoolean()
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseModel("double d;\nprocess P() { state A; init A; }\nsystem P;\n", "model.xta");
		parser.parseQueries(document, "E<> d\n", "model.q");
		TypeChecker.check(document);

		Diagnostic error = singleError(document);
		assertEquals(ErrorKind.TYPE_MISMATCH, error.getKind());
		assertEquals("model.q", error.getFile());
	}
}
