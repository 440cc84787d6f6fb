package org.lokray.tamodel;

import com.google.gson.Gson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.tamodel.dto.ReportDTO;
import org.lokray.tamodel.util.Debug;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	@AfterEach
	void resetLogging()
	{
		Debug.ENABLE_WARNINGS = true;
	}

	private static String resource(String name) throws Exception
	{
		return Path.of(MainTest.class.getResource(name).toURI()).toString();
	}

	@Test
	void cleanModelPassesAndWritesReport(@TempDir Path dir) throws Exception
	{
		Path report = dir.resolve("report.json");
		int status = Main.run(new String[]{resource("/models/traingate.xta"), "-q", resource("/models/traingate.q"), "--json", report.toString()});

		assertEquals(0, status);
		ReportDTO dto = new Gson().fromJson(Files.readString(report), ReportDTO.class);
		assertTrue(dto.errors.isEmpty());
		assertEquals(6, dto.queries.size());
		assertTrue(dto.symbolic);
		assertTrue(dto.stochastic);
		assertTrue(dto.concrete);
	}

	@Test
	void unresolvedLibrariesFailTheCheck() throws Exception
	{
		assertEquals(1, Main.run(new String[]{resource("/models/external.xta")}));
		assertEquals(1, Main.run(new String[]{resource("/models/external.xta"), "-L", resource("/libs")}));
	}

	@Test
	void syntaxErrorsSkipTypeCheckingAndFail(@TempDir Path dir) throws Exception
	{
		Path model = dir.resolve("broken.xta");
		Files.writeString(model, "process P( { }\n");
		Path report = dir.resolve("report.json");

		assertEquals(1, Main.run(new String[]{model.toString(), "--json", report.toString()}));
		ReportDTO dto = new Gson().fromJson(Files.readString(report), ReportDTO.class);
		assertFalse(dto.errors.isEmpty());
		assertEquals("SYNTAX", dto.errors.get(0).kind);
	}

	@Test
	void missingInputsFail(@TempDir Path dir)
	{
		assertEquals(1, Main.run(new String[]{dir.resolve("absent.xta").toString()}));
		assertEquals(1, Main.run(new String[]{"-L", dir.toString()}));
	}

	@Test
	void helpAndVersionSucceed()
	{
		assertEquals(0, Main.run(new String[]{"--help"}));
		assertEquals(0, Main.run(new String[]{"--version"}));
		assertEquals(0, Main.run(new String[0]));
	}
}
