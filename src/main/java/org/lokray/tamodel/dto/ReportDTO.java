package org.lokray.tamodel.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of checking one model, written by {@code --json}.
 */
public class ReportDTO
{
	public List<String> files = new ArrayList<>();
	public List<DiagnosticDTO> errors = new ArrayList<>();
	public List<DiagnosticDTO> warnings = new ArrayList<>();
	public List<String> queries = new ArrayList<>();

	// Verification methods the model is admissible for
	public boolean symbolic;
	public boolean stochastic;
	public boolean concrete;
}
