package org.lokray.tamodel;

import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.parser.ModelParser;
import org.lokray.tamodel.semantic.Capabilities;
import org.lokray.tamodel.semantic.TypeChecker;
import org.lokray.tamodel.util.CheckerArguments;
import org.lokray.tamodel.util.Debug;
import org.lokray.tamodel.util.ReportConverter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line front end: parses the models and queries, type checks them and reports
 * the diagnostics. Exits with status 1 when any error was found.
 */
public class Main
{

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	public static int run(String[] args)
	{
		try
		{
			CheckerArguments arguments = CheckerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CheckerArguments.printUsage();
				return 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("tacheck (timed automata model checker front end) version 0.1.0");
				return 0;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			if (!validatePaths(arguments))
			{
				Debug.logError("Aborting.");
				return 1;
			}

			Debug.ENABLE_WARNINGS = !arguments.isIgnoreWarnings();
			return check(arguments);
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
		}
		return 1;
	}

	private static int check(CheckerArguments args) throws IOException
	{
		ModelParser parser = new ModelParser(args.getLibrarySearchPaths());
		Document document = new Document();

		// --- Parse all models into one document ---
		boolean parsed = true;
		for (Path file : args.getInputFiles())
		{
			Debug.logDebug("Parsing model " + file);
			parsed &= parser.parseModel(document, Files.readString(file), file.toString());
		}

		// --- Semantic analysis ---
		Capabilities capabilities = null;
		if (parsed)
		{
			for (Path queries : args.getQueryFiles())
			{
				Debug.logDebug("Parsing queries " + queries);
				parser.parseQueryFile(document, queries);
			}
			capabilities = TypeChecker.check(document);
		}
		else
		{
			Debug.logError("Type checking skipped due to syntax errors.");
		}

		if (args.getReportPath() != null)
		{
			ReportConverter.writeReport(ReportConverter.toReport(document, args.getInputFiles()), args.getReportPath());
		}

		if (document.hasErrors())
		{
			Debug.logError("Check failed with " + document.getErrors().size() + " error(s).");
			return 1;
		}
		Debug.logInfo("Check passed" + (args.isIgnoreWarnings() ? "." : " with " + document.getWarnings().size() + " warning(s)."));
		if (capabilities != null)
		{
			Debug.logInfo("Supported methods: " + capabilities.getSupportedMethods());
		}
		return 0;
	}

	private static boolean validatePaths(CheckerArguments args)
	{
		boolean valid = true;

		for (Path input : args.getInputFiles())
		{
			if (!Files.exists(input))
			{
				Debug.logError("Input file not found: " + input);
				valid = false;
			}
		}

		for (Path queries : args.getQueryFiles())
		{
			if (!Files.exists(queries))
			{
				Debug.logError("Query file not found: " + queries);
				valid = false;
			}
		}

		for (Path libDir : args.getLibrarySearchPaths())
		{
			if (!Files.exists(libDir))
			{
				Debug.logError("Library search path does not exist: " + libDir);
				valid = false;
			}
			else if (!Files.isDirectory(libDir))
			{
				Debug.logError("Library search path is not a directory: " + libDir);
				valid = false;
			}
		}

		return valid;
	}
}
