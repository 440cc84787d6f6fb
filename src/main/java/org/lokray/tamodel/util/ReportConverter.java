// File: src/main/java/org/lokray/tamodel/util/ReportConverter.java
package org.lokray.tamodel.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.document.Query;
import org.lokray.tamodel.dto.DiagnosticDTO;
import org.lokray.tamodel.dto.ReportDTO;
import org.lokray.tamodel.position.Diagnostic;
import org.lokray.tamodel.semantic.SupportedMethods;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

public class ReportConverter
{
	public static ReportDTO toReport(Document document, List<Path> files)
	{
		ReportDTO report = new ReportDTO();
		files.forEach(f -> report.files.add(f.toString()));
		document.getErrors().forEach(d -> report.errors.add(diagnosticToDTO(d, d.getKind().name())));
		document.getWarnings().forEach(d -> report.warnings.add(diagnosticToDTO(d, "WARNING")));
		for (Query query : document.getQueries())
		{
			report.queries.add(query.getText());
		}
		if (document.getCapabilities() != null)
		{
			SupportedMethods methods = document.getCapabilities().getSupportedMethods();
			report.symbolic = methods.isSymbolic();
			report.stochastic = methods.isStochastic();
			report.concrete = methods.isConcrete();
		}
		return report;
	}

	private static DiagnosticDTO diagnosticToDTO(Diagnostic diagnostic, String kind)
	{
		DiagnosticDTO dto = new DiagnosticDTO();
		dto.kind = kind;
		dto.file = diagnostic.getFile();
		dto.path = diagnostic.getPath();
		dto.line = diagnostic.getStart().getLine();
		dto.column = diagnostic.getStart().getColumn();
		dto.endLine = diagnostic.getEnd().getLine();
		dto.endColumn = diagnostic.getEnd().getColumn();
		dto.message = diagnostic.getMessage();
		dto.context = diagnostic.getContext();
		return dto;
	}

	public static String toJson(ReportDTO report)
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().create();
		return gson.toJson(report);
	}

	public static void writeReport(ReportDTO report, Path outPath) throws IOException
	{
		if (outPath.getParent() != null)
		{
			Files.createDirectories(outPath.getParent());
		}
		Files.writeString(outPath, toJson(report), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote diagnostics report to: " + outPath);
	}
}
