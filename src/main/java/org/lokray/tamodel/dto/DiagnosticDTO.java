package org.lokray.tamodel.dto;

public class DiagnosticDTO
{
	// ErrorKind name, or "WARNING"
	public String kind;
	public String file;
	// Element path, only for structured sources
	public String path;
	public int line;
	public int column;
	public int endLine;
	public int endColumn;
	public String message;
	public String context;
}
