package org.lokray.tamodel.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds the command-line arguments of the model checker front end.
 */
public class CheckerArguments
{

	private final List<Path> inputFiles = new ArrayList<>();
	private final List<Path> librarySearchPaths = new ArrayList<>();
	private final List<Path> queryFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean ignoreWarnings = false;
	// No JSON report unless --json is given
	private Path reportPath;

	private CheckerArguments()
	{
	}

	public static CheckerArguments parse(String[] args)
	{
		CheckerArguments parsed = new CheckerArguments();
		if (args.length == 0)
		{
			parsed.helpFlag = true;
			return parsed;
		}

		try
		{
			int i = 0;
			while (i < args.length)
			{
				String arg = args[i++];
				switch (arg)
				{
					case "-h", "--help" ->
					{
						parsed.helpFlag = true;
						return parsed;
					}
					case "--version" ->
					{
						parsed.versionFlag = true;
						return parsed;
					}
					case "-v", "--verbose" ->
					{
						parsed.verboseFlag = true;
						Debug.ENABLE_DEBUG = true;
					}
					case "--ignore-warnings" -> parsed.ignoreWarnings = true;
					case "-L" -> parsed.librarySearchPaths.add(Paths.get(valueOf(args, i++, arg)));
					case "-q", "--queries" -> parsed.queryFiles.add(Paths.get(valueOf(args, i++, arg)));
					case "--json" -> parsed.reportPath = Paths.get(valueOf(args, i++, arg));
					default ->
					{
						if (arg.startsWith("-"))
						{
							throw new IllegalArgumentException("Unknown option: " + arg);
						}
						parsed.inputFiles.add(Paths.get(arg));
					}
				}
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			// A bad command line prints the usage instead of checking anything
			parsed.helpFlag = true;
		}
		return parsed;
	}

	/** The value following an option; option-like values are rejected. */
	private static String valueOf(String[] args, int i, String option)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Option " + option + " expects a value");
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Parser and type checker for networks of timed automata.");
		System.out.println("\nUSAGE: tacheck [options] model...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -L <path>                 Add a directory to the external library search path.");
		System.out.println("  -q, --queries <file>      Parse and check the properties in <file>.");
		System.out.println("  --json <file>             Write errors and warnings as a JSON report.");
		System.out.println("\nFLAGS:");
		System.out.println("  --ignore-warnings         Do not print warnings.");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public List<Path> getLibrarySearchPaths()
	{
		return librarySearchPaths;
	}

	public List<Path> getQueryFiles()
	{
		return queryFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public Path getReportPath()
	{
		return reportPath;
	}

	public boolean isIgnoreWarnings()
	{
		return ignoreWarnings;
	}
}
