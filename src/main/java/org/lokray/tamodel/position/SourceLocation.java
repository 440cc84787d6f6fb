package org.lokray.tamodel.position;

/**
 * A resolved source location: file, line and column, plus the element path when the
 * source is structured.
 */
public final class SourceLocation
{
	public static final SourceLocation UNKNOWN = new SourceLocation(null, 0, 0, Position.UNKNOWN_OFFSET);

	private final String path;
	private final String structuralPath;
	private final int line;
	private final int column;
	private final int position;

	public SourceLocation(String path, int line, int column, int position)
	{
		this(path, null, line, column, position);
	}

	public SourceLocation(String path, String structuralPath, int line, int column, int position)
	{
		this.path = path;
		this.structuralPath = structuralPath;
		this.line = line;
		this.column = column;
		this.position = position;
	}

	public String getPath()
	{
		return path;
	}

	public String getStructuralPath()
	{
		return structuralPath;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public int getPosition()
	{
		return position;
	}

	@Override
	public String toString()
	{
		if (this == UNKNOWN || line == 0)
		{
			return "<unknown>";
		}
		String prefix = path != null ? path + " - " : "";
		return prefix + "line " + line + ":" + column;
	}
}
