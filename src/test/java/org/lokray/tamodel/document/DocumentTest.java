package org.lokray.tamodel.document;

import org.junit.jupiter.api.Test;
import org.lokray.tamodel.parser.ModelParser;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.semantic.symbol.Symbol;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest
{
	private static final String TEMPLATE = "process P(const int a, const int b) { state S; init S; }\n";

	private static Document parse(String text)
	{
		return new ModelParser().parseModel(text, "model.xta");
	}

	private static void assertParametersAccountedFor(Instance instance)
	{
		assertEquals(instance.getParameters().size(), instance.getBound() + instance.getUnbound(), instance.getName());
	}

	private static Instance instance(Document document, String name)
	{
		return document.getInstances().stream()
				.filter(i -> i.getName().equals(name))
				.findFirst()
				.orElseThrow(() -> new AssertionError("no instance " + name));
	}

	@Test
	void framesChainFromBuiltinThroughGlobals()
	{
		Document document = parse(TEMPLATE);

		assertSame(document.getBuiltinFrame(), document.getGlobalFrame().getParent());
		assertSame(document.getGlobalFrame(), document.getSystemFrame().getParent());
		assertSame(document.getGlobalFrame(), document.getTemplates().get(0).getFrame().getParent());
		assertTrue(document.getBuiltinFrame().resolve("int").isPresent());
	}

	@Test
	void partialInstantiationBindsStepByStep()
	{
		Document document = parse(TEMPLATE + "Q(const int b) = P(1, b);\nR = Q(2);\nsystem R;\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		Instance q = instance(document, "Q");
		assertEquals(2, q.getArguments());
		assertEquals(1, q.getUnbound());
		assertEquals("b", q.getUnboundParameters().get(0).getName());
		assertFalse(q.isComplete());

		Instance r = instance(document, "R");
		assertEquals(1, r.getArguments());
		assertTrue(r.isComplete());
		assertSame(document.getTemplates().get(0), r.getTemplate());
		assertEquals(List.of(r), document.getProcesses());

		assertParametersAccountedFor(document.getTemplates().get(0).getInstance());
		assertParametersAccountedFor(q);
		assertParametersAccountedFor(r);
	}

	@Test
	void tooManyArgumentsIsRejected()
	{
		Document document = parse(TEMPLATE + "G1 = P(1, 2, 3);\n");

		assertEquals(1, document.getErrors().size());
		assertEquals(ErrorKind.TOO_MANY_ARGUMENTS, document.getErrors().get(0).getKind());
		assertEquals("G1", document.getErrors().get(0).getContext());
		assertTrue(document.getInstances().stream().noneMatch(i -> i.getName().equals("G1")));
	}

	@Test
	void arraySizeParameterOnlyAcceptsConstants()
	{
		Document document = parse("process P(const int n) { int a[n]; state S; init S; }\n"
				+ "int k = 2;\nconst int K = 2;\n"
				+ "A = P(K);\nB = P(k);\nC = P(3);\n");

		assertEquals(1, document.getErrors().size());
		assertEquals(ErrorKind.RESTRICTED_PARAMETER_VIOLATION, document.getErrors().get(0).getKind());
		assertEquals("B", document.getErrors().get(0).getContext());
	}

	@Test
	void restrictionPropagatesToParametersOfPartialInstances()
	{
		Document document = parse("process P(const int n) { int a[n]; state S; init S; }\n"
				+ "Q(const int m) = P(m);\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		Instance q = instance(document, "Q");
		Symbol m = q.getParameters().resolveLocally("m").orElseThrow();
		assertTrue(q.isRestricted(m));
		assertTrue(document.getTemplates().get(0).getInstance().isRestricted(
				document.getTemplates().get(0).getParameters().resolveLocally("n").orElseThrow()));
	}

	@Test
	void stringPoolReusesEqualStrings()
	{
		Document document = new Document();

		assertEquals(0, document.addString("a"));
		assertEquals(1, document.addStringIfNew("b"));
		assertEquals(0, document.addStringIfNew("a"));
		assertEquals(2, document.addString("a"));
		assertEquals(List.of("a", "b", "a"), document.getStrings());
	}

	@Test
	void removedProcessLeavesItsInstance()
	{
		Document document = parse(TEMPLATE + "X = P(1, 2);\nY = P(3, 4);\nsystem X, Y;\n");
		Instance x = instance(document, "X");

		assertTrue(document.removeProcess(x));
		assertEquals(1, document.getProcesses().size());
		assertEquals("Y", document.getProcesses().get(0).getName());
		assertTrue(document.getInstances().contains(x));
		assertFalse(document.removeProcess(x));
	}

	@Test
	void scenarioElementsAreGroupedIntoSimregions()
	{
		Document document = parse("process P() { state S; init S; }\n"
				+ "chan c;\n"
				+ "scenario Chart() existential invariant\n"
				+ "{\n"
				+ "    instanceline L1 = P;\n"
				+ "    instanceline L2 = P;\n"
				+ "    message 1 L1 -> L2 : c prechart;\n"
				+ "    condition 1 L1 : true prechart;\n"
				+ "    update 1 L2 prechart;\n"
				+ "    condition 2 L1, L2 : true hot;\n"
				+ "    update 3 L1;\n"
				+ "}\n");

		assertFalse(document.hasErrors(), () -> document.getErrors().toString());
		assertEquals(1, document.getLscTemplates().size());
		Template chart = document.getLscTemplates().get(0);
		assertFalse(chart.isTA());
		assertEquals("existential", chart.getType());
		assertEquals("invariant", chart.getMode());
		assertTrue(chart.hasPrechart());

		List<SimRegion> regions = chart.getSimregions();
		assertEquals(3, regions.size());

		SimRegion first = regions.get(0);
		assertTrue(first.hasMessage());
		assertTrue(first.hasCondition());
		assertTrue(first.hasUpdate());
		assertTrue(first.isInPrechart());

		SimRegion second = regions.get(1);
		assertFalse(second.hasMessage());
		assertEquals(1, second.getCondition());
		assertFalse(second.hasUpdate());
		assertEquals(2, second.getLocation());

		SimRegion third = regions.get(2);
		assertEquals(1, third.getUpdate());
		assertFalse(third.isInPrechart());

		Cut prechart = chart.getPrechartCut();
		assertEquals(1, prechart.getSimregions().size());
		assertTrue(prechart.contains(first));
	}

	@Test
	void unknownInstanceLineIsReported()
	{
		Document document = parse("process P() { state S; init S; }\n"
				+ "scenario Chart() universal initial\n"
				+ "{\n"
				+ "    instanceline L1 = P;\n"
				+ "    message 1 L1 -> L9;\n"
				+ "}\n");

		assertEquals(1, document.getErrors().size());
		assertEquals(ErrorKind.UNDECLARED_SYMBOL, document.getErrors().get(0).getKind());
		assertEquals("L9", document.getErrors().get(0).getContext());
		assertTrue(document.getLscTemplates().get(0).getMessages().isEmpty());
	}
}
