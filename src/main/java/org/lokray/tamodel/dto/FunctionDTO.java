package org.lokray.tamodel.dto;

import java.util.ArrayList;
import java.util.List;

public class FunctionDTO
{
	// Name exported by the library
	public String name;

	// Type keyword of the result (e.g., "int", "double", "void")
	public String returnType;

	public List<ParameterDTO> parameters = new ArrayList<>();
}
