package org.lokray.tamodel.position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered table of virtual-offset breakpoints. Each breakpoint marks the beginning of
 * a source line and remembers where that line came from: the file, the line number
 * and the offset of the line inside its own source. Sources with structural
 * addressing, such as an element path inside a markup document, record that path too.
 */
public class PositionIndex
{
	public static final class Line
	{
		private final int position;
		private final int offset;
		private final int line;
		private final String path;
		private final String structuralPath;

		Line(int position, int offset, int line, String path, String structuralPath)
		{
			this.position = position;
			this.offset = offset;
			this.line = line;
			this.path = path;
			this.structuralPath = structuralPath;
		}

		/** Virtual offset where this line starts. */
		public int getPosition()
		{
			return position;
		}

		/** Offset of the line start inside its own source. */
		public int getOffset()
		{
			return offset;
		}

		public int getLine()
		{
			return line;
		}

		/** File path; may be null. */
		public String getPath()
		{
			return path;
		}

		/** Element path inside a structured source; null for plain text. */
		public String getStructuralPath()
		{
			return structuralPath;
		}
	}

	private static final Line UNKNOWN_LINE = new Line(0, 0, 0, null, null);

	private final List<Line> lines = new ArrayList<>();

	public void add(int position, int offset, int line, String path)
	{
		add(position, offset, line, path, null);
	}

	/**
	 * Appends a breakpoint. Breakpoints must be added in increasing order of their
	 * virtual position; a breakpoint at the same position replaces the previous one.
	 */
	public void add(int position, int offset, int line, String path, String structuralPath)
	{
		if (!lines.isEmpty())
		{
			Line last = lines.get(lines.size() - 1);
			if (position < last.position)
			{
				throw new IllegalArgumentException("Position " + position + " added out of order (last was " + last.position + ")");
			}
			if (position == last.position)
			{
				lines.set(lines.size() - 1, new Line(position, offset, line, path, structuralPath));
				return;
			}
		}
		lines.add(new Line(position, offset, line, path, structuralPath));
	}

	/**
	 * @return the nearest breakpoint at or before the given virtual offset.
	 */
	public Line lookup(int position)
	{
		int low = 0;
		int high = lines.size() - 1;
		Line found = UNKNOWN_LINE;
		while (low <= high)
		{
			int mid = (low + high) >>> 1;
			Line candidate = lines.get(mid);
			if (candidate.position <= position)
			{
				found = candidate;
				low = mid + 1;
			}
			else
			{
				high = mid - 1;
			}
		}
		return found;
	}

	/**
	 * @return the first breakpoint at or after the given virtual offset, or the last one.
	 */
	public Line lookupFirstAfter(int position)
	{
		for (Line line : lines)
		{
			if (line.position >= position)
			{
				return line;
			}
		}
		return lines.isEmpty() ? UNKNOWN_LINE : lines.get(lines.size() - 1);
	}

	public SourceLocation locate(int position)
	{
		if (position == Position.UNKNOWN_OFFSET)
		{
			return SourceLocation.UNKNOWN;
		}
		Line line = lookup(position);
		return new SourceLocation(line.getPath(), line.getStructuralPath(), line.getLine(), position - line.getPosition() + 1, position);
	}

	public List<Line> getLines()
	{
		return Collections.unmodifiableList(lines);
	}

	public int size()
	{
		return lines.size();
	}
}
