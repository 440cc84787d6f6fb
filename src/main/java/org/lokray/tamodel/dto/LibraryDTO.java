package org.lokray.tamodel.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Manifest of an external function library, stored as {@code <library>.json}.
 */
public class LibraryDTO
{
	public String name;
	public String version;
	public List<FunctionDTO> functions = new ArrayList<>();
}
