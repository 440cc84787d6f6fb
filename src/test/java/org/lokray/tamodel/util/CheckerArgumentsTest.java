package org.lokray.tamodel.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckerArgumentsTest
{
	@AfterEach
	void resetLogging()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void collectsInputsAndRepeatableOptions()
	{
		CheckerArguments args = CheckerArguments.parse(new String[]{
				"a.xta", "-L", "libs", "-q", "a.q", "--queries", "b.q", "-L", "more", "b.xta", "--json", "out/report.json", "--ignore-warnings"});

		assertFalse(args.isHelpFlag());
		assertEquals(List.of(Path.of("a.xta"), Path.of("b.xta")), args.getInputFiles());
		assertEquals(List.of(Path.of("libs"), Path.of("more")), args.getLibrarySearchPaths());
		assertEquals(List.of(Path.of("a.q"), Path.of("b.q")), args.getQueryFiles());
		assertEquals(Path.of("out/report.json"), args.getReportPath());
		assertTrue(args.isIgnoreWarnings());
		assertFalse(args.isVerboseFlag());
	}

	@Test
	void noArgumentsShowsHelp()
	{
		assertTrue(CheckerArguments.parse(new String[0]).isHelpFlag());
	}

	@Test
	void helpAndVersionStopParsing()
	{
		CheckerArguments help = CheckerArguments.parse(new String[]{"model.xta", "--help", "--bogus"});
		assertTrue(help.isHelpFlag());

		CheckerArguments version = CheckerArguments.parse(new String[]{"--version", "model.xta"});
		assertTrue(version.isVersionFlag());
		assertTrue(version.getInputFiles().isEmpty());
	}

	@Test
	void verboseEnablesDebugLogging()
	{
		CheckerArguments args = CheckerArguments.parse(new String[]{"-v", "model.xta"});

		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
	}

	@Test
	void unknownOptionFallsBackToHelp()
	{
		assertTrue(CheckerArguments.parse(new String[]{"model.xta", "--frobnicate"}).isHelpFlag());
	}

	@Test
	void optionWithoutValueFallsBackToHelp()
	{
		assertTrue(CheckerArguments.parse(new String[]{"model.xta", "-q"}).isHelpFlag());
		assertTrue(CheckerArguments.parse(new String[]{"model.xta", "--json", "-v"}).isHelpFlag());
	}
}
