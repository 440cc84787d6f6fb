package org.lokray.tamodel.dto;

public class ParameterDTO
{
	// The name of the parameter (e.g., "seed")
	public String name;

	// The type keyword (e.g., "int", "double", "bool")
	public String type;

	// Passed by reference
	public boolean reference = false;
}
