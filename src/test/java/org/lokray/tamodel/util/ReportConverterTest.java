package org.lokray.tamodel.util;

import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.dto.DiagnosticDTO;
import org.lokray.tamodel.dto.ReportDTO;
import org.lokray.tamodel.parser.ModelParser;
import org.lokray.tamodel.semantic.TypeChecker;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportConverterTest
{
	@Test
	void reportCarriesDiagnosticsAndSupportedMethods()
	{
		ModelParser parser = new ModelParser();
		Document document = parser.parseModel("int x;\nvoid f() { x + 1; }\nvoid g() { return 1; }\nprocess P() { clock c; state S { c < 3 }; init S; }\nsystem P;\n", "m.xta");
		parser.parseQueries(document, "A[] not deadlock\n", "m.q");
		TypeChecker.check(document);

		ReportDTO report = ReportConverter.toReport(document, List.of(Path.of("m.xta")));

		assertEquals(List.of("m.xta"), report.files);
		assertEquals(List.of("A[] not deadlock"), report.queries);
		assertEquals(1, report.errors.size());
		DiagnosticDTO error = report.errors.get(0);
		assertEquals("TYPE_MISMATCH", error.kind);
		assertEquals("m.xta", error.file);
		assertNull(error.path);
		assertEquals(3, error.line);

		assertEquals(1, report.warnings.size());
		assertEquals("WARNING", report.warnings.get(0).kind);
		assertEquals(2, report.warnings.get(0).line);

		assertTrue(report.symbolic);
		assertTrue(report.stochastic);
		assertFalse(report.concrete);
	}

	@Test
	void writtenReportReadsBack(@TempDir Path dir) throws Exception
	{
		ReportDTO report = new ReportDTO();
		report.files.add("a.xta");
		DiagnosticDTO warning = new DiagnosticDTO();
		warning.kind = "WARNING";
		warning.message = "Expression has no effect";
		warning.line = 4;
		report.warnings.add(warning);

		Path out = dir.resolve("nested").resolve("report.json");
		ReportConverter.writeReport(report, out);

		ReportDTO read = new Gson().fromJson(Files.readString(out), ReportDTO.class);
		assertEquals(List.of("a.xta"), read.files);
		assertTrue(read.errors.isEmpty());
		assertEquals("Expression has no effect", read.warnings.get(0).message);
		assertEquals(4, read.warnings.get(0).line);
	}
}
