package org.lokray.tamodel.util;

import java.util.Arrays;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set through -v/--verbose. Controls logDebug output only.
	public static boolean ENABLE_DEBUG = false;

	// Diagnostics are echoed unless a caller (mostly tests) silences them.
	public static boolean ENABLE_DIAGNOSTICS = true;

	// Cleared by --ignore-warnings.
	public static boolean ENABLE_WARNINGS = true;

	public static void log(String log)
	{
		System.out.println(log);
	}

	public static void logInfo(String log)
	{
		System.out.println(ANSI_GREEN + log + ANSI_RESET);
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			System.out.println(log);
		}
	}

	public static void logWarning(String log)
	{
		if (ENABLE_DIAGNOSTICS && ENABLE_WARNINGS)
		{
			System.out.println(ANSI_YELLOW + log + ANSI_RESET);
		}
	}

	public static void logError(String log)
	{
		if (ENABLE_DIAGNOSTICS)
		{
			System.err.println(ANSI_RED + log + ANSI_RESET);
		}
	}

	public static void printUsage(String[] invalidArgs)
	{
		System.err.println("Invalid arguments: " + Arrays.toString(invalidArgs));
		CheckerArguments.printUsage();
	}
}
