package org.lokray.tamodel.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.lokray.tamodel.builder.ModelBuilder;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.document.Query;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.library.LibraryLoader;
import org.lokray.tamodel.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the textual front end. Every chunk of input gets its own range of
 * virtual offsets in the document, so diagnostics from several files and query lines
 * can be located back to their source.
 */
public class ModelParser
{
	private final LibraryLoader libraries;

	public ModelParser(List<Path> librarySearchPaths)
	{
		this.libraries = new LibraryLoader(librarySearchPaths);
	}

	public ModelParser()
	{
		this(List.of());
	}

	public LibraryLoader getLibraries()
	{
		return libraries;
	}

	public Document parseFile(Path file) throws IOException
	{
		Document document = new Document();
		parseModel(document, Files.readString(file), file.toString());
		return document;
	}

	public Document parseModel(String text, String path)
	{
		Document document = new Document();
		parseModel(document, text, path);
		return document;
	}

	/**
	 * Parses model text into an existing document.
	 *
	 * @return false if the text has syntax errors, in which case nothing of it is built
	 */
	public boolean parseModel(Document document, String text, String path)
	{
		Chunk chunk = register(document, text, path, 1, 0);
		TimedAutomataParser parser = chunk.parser();
		TimedAutomataParser.ModelContext tree = parser.model();
		if (chunk.listener.hasErrors())
		{
			Debug.logWarning("Skipping model construction for " + path + ": " + chunk.listener.getErrorCount() + " syntax error(s)");
			return false;
		}
		ModelBuilder builder = new ModelBuilder(document, libraries);
		new DeclarationVisitor(builder, chunk.base).visit(tree);
		Debug.logDebug("Parsed " + path + ": " + document.getTemplates().size() + " template(s), " + document.getProcesses().size() + " process(es)");
		return true;
	}

	public Expression parseProperty(Document document, String text, String path)
	{
		return parseProperty(document, text, path, 1, 0);
	}

	/**
	 * Parses one property, resolving names in the system scope.
	 *
	 * @return the formula, or the empty expression on a syntax error
	 */
	public Expression parseProperty(Document document, String text, String path, int line, int offset)
	{
		Chunk chunk = register(document, text, path, line, offset);
		TimedAutomataParser.PropertyContext tree = chunk.parser().property();
		if (chunk.listener.hasErrors())
		{
			return Expression.EMPTY;
		}
		ModelBuilder builder = new ModelBuilder(document, libraries);
		builder.pushScope(document.getSystemFrame());
		return new QueryVisitor(builder, chunk.base).visit(tree);
	}

	/**
	 * Reads a query file: one property per non-blank line. A {@code //} comment line
	 * becomes the comment of the property that follows it.
	 */
	public List<Query> parseQueries(Document document, String text, String path)
	{
		List<Query> queries = new ArrayList<>();
		String comment = "";
		int offset = 0;
		String[] lines = text.split("\n", -1);
		for (int i = 0; i < lines.length; i++)
		{
			String line = lines[i].strip();
			int lineOffset = offset;
			offset += lines[i].length() + 1;
			if (line.isEmpty())
			{
				continue;
			}
			if (line.startsWith("//"))
			{
				comment = line.substring(2).strip();
				continue;
			}
			Expression formula = parseProperty(document, lines[i], path, i + 1, lineOffset);
			if (!formula.isEmpty())
			{
				Query query = new Query(formula, line, comment);
				document.addQuery(query);
				queries.add(query);
			}
			comment = "";
		}
		return queries;
	}

	public List<Query> parseQueryFile(Document document, Path file) throws IOException
	{
		return parseQueries(document, Files.readString(file), file.toString());
	}

	private static Chunk register(Document document, String text, String path, int firstLine, int firstOffset)
	{
		int base = document.reserveOffsets(text.length());
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < text.length(); i++)
		{
			if (text.charAt(i) == '\n')
			{
				starts.add(i + 1);
			}
		}
		int[] lineStarts = new int[starts.size()];
		for (int i = 0; i < lineStarts.length; i++)
		{
			lineStarts[i] = starts.get(i);
			document.addPosition(base + lineStarts[i], firstOffset + lineStarts[i], firstLine + i, path);
		}
		return new Chunk(document, text, path, base, lineStarts);
	}

	private static final class Chunk
	{
		private final TimedAutomataLexer lexer;
		private final SyntaxErrorListener listener;
		private final int base;

		Chunk(Document document, String text, String path, int base, int[] lineStarts)
		{
			this.base = base;
			this.listener = new SyntaxErrorListener(document, base, lineStarts);
			this.lexer = new TimedAutomataLexer(CharStreams.fromString(text, path));
			lexer.removeErrorListeners();
			lexer.addErrorListener(listener);
		}

		TimedAutomataParser parser()
		{
			TimedAutomataParser parser = new TimedAutomataParser(new CommonTokenStream(lexer));
			parser.removeErrorListeners();
			parser.addErrorListener(listener);
			return parser;
		}
	}
}
