package org.lokray.tamodel.library;

import org.junit.jupiter.api.Test;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.document.Function;
import org.lokray.tamodel.dto.FunctionDTO;
import org.lokray.tamodel.dto.LibraryDTO;
import org.lokray.tamodel.parser.ModelParser;
import org.lokray.tamodel.position.Diagnostic;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.semantic.TypeChecker;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.PrimitiveType;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LibraryLoaderTest
{
	private static Path resource(String name) throws Exception
	{
		return Path.of(LibraryLoaderTest.class.getResource(name).toURI());
	}

	@Test
	void loadsManifestFromSearchPath() throws Exception
	{
		LibraryLoader loader = new LibraryLoader(List.of(resource("/libs")));

		Optional<LibraryDTO> library = loader.load("mathlib");
		assertTrue(library.isPresent());
		assertEquals("mathlib", library.get().name);
		assertEquals(2, library.get().functions.size());

		// Platform suffixes and directories map onto the same manifest.
		assertTrue(loader.load("/usr/lib/mathlib.so").isPresent());
		assertTrue(loader.load("nosuchlib").isEmpty());
	}

	@Test
	void exportedSignaturesAreCompared() throws Exception
	{
		LibraryDTO library = new LibraryLoader(List.of(resource("/libs"))).load("mathlib").orElseThrow();
		FunctionDTO ipow = LibraryLoader.findFunction(library, "ipow").orElseThrow();

		FunctionType exported = LibraryLoader.toFunctionType(ipow);
		assertEquals(2, exported.getArity());
		assertSame(PrimitiveType.INT, exported.getReturnType());

		assertTrue(LibraryLoader.matches(new FunctionType(PrimitiveType.INT, List.of(PrimitiveType.INT, PrimitiveType.INT)), ipow));
		assertFalse(LibraryLoader.matches(new FunctionType(PrimitiveType.INT, List.of(PrimitiveType.INT)), ipow));
		assertFalse(LibraryLoader.matches(new FunctionType(PrimitiveType.DOUBLE, List.of(PrimitiveType.INT, PrimitiveType.INT)), ipow));
		assertTrue(LibraryLoader.findFunction(library, "cube").isEmpty());
	}

	@Test
	void importBlocksReportUnresolvedFunctions() throws Exception
	{
		ModelParser parser = new ModelParser(List.of(resource("/libs")));
		Document document = parser.parseFile(resource("/models/external.xta"));
		TypeChecker.check(document);

		List<Diagnostic> errors = document.getErrors();
		assertEquals(3, errors.size(), errors::toString);
		assertTrue(document.getWarnings().isEmpty());

		assertEquals(ErrorKind.UNRESOLVED_EXTERNAL_FUNCTION, errors.get(0).getKind());
		assertEquals("cube", errors.get(0).getContext());
		assertEquals(ErrorKind.TYPE_MISMATCH, errors.get(1).getKind());
		assertEquals("sqrt", errors.get(1).getContext());
		assertEquals(ErrorKind.UNRESOLVED_EXTERNAL_FUNCTION, errors.get(2).getKind());
		assertEquals("f", errors.get(2).getContext());
		assertEquals("Library not found: nosuchlib", errors.get(2).getMessage());
	}

	@Test
	void everyFunctionOfAMissingLibraryIsUnresolved() throws Exception
	{
		ModelParser parser = new ModelParser(List.of(resource("/libs")));
		Document document = parser.parseFile(resource("/models/unresolved.xta"));
		TypeChecker.check(document);

		List<Diagnostic> errors = document.getErrors();
		assertEquals(3, errors.size(), errors::toString);
		assertTrue(document.getWarnings().isEmpty(), () -> document.getWarnings().toString());
		assertTrue(errors.stream().allMatch(e -> e.getKind() == ErrorKind.UNRESOLVED_EXTERNAL_FUNCTION));
		assertEquals(List.of("g", "h", "absent"), errors.stream().map(Diagnostic::getContext).collect(Collectors.toList()));
	}

	@Test
	void emptyImportOfMissingLibraryIsReportedOnce()
	{
		Document document = new ModelParser().parseModel("import \"libbad\" { }\n", "model.xta");

		assertEquals(1, document.getErrors().size());
		assertEquals(ErrorKind.UNRESOLVED_EXTERNAL_FUNCTION, document.getErrors().get(0).getKind());
		assertEquals("libbad", document.getErrors().get(0).getContext());
	}

	@Test
	void aliasNamesTheFunctionInTheModel() throws Exception
	{
		ModelParser parser = new ModelParser(List.of(resource("/libs")));
		Document document = parser.parseFile(resource("/models/external.xta"));

		Function isqrt = document.getGlobals().getFunctions().stream()
				.filter(f -> f.getName().equals("isqrt"))
				.findFirst()
				.orElseThrow();
		assertTrue(isqrt.isExternal());
		assertEquals("sqrt", isqrt.getExternalName());
		assertEquals("mathlib", isqrt.getLibrary());
	}
}
