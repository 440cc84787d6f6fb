// File: src/main/java/org/lokray/tamodel/library/LibraryLoader.java
package org.lokray.tamodel.library;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.lokray.tamodel.dto.FunctionDTO;
import org.lokray.tamodel.dto.LibraryDTO;
import org.lokray.tamodel.dto.ParameterDTO;
import org.lokray.tamodel.semantic.type.ErrorType;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.PrimitiveType;
import org.lokray.tamodel.semantic.type.Qualifier;
import org.lokray.tamodel.semantic.type.QualifiedType;
import org.lokray.tamodel.semantic.type.Type;
import org.lokray.tamodel.semantic.type.TypeSystem;
import org.lokray.tamodel.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds and reads the manifests of external function libraries. A library named
 * {@code "libfoo.so"} or {@code "/opt/lib/libfoo"} is described by {@code libfoo.json} in
 * one of the search paths; a library given as an existing {@code .json} file is read
 * directly.
 */
public class LibraryLoader
{
	private final List<Path> searchPaths;
	private final Map<String, Optional<LibraryDTO>> cache = new HashMap<>();
	private final Gson gson = new Gson();

	public LibraryLoader(List<Path> searchPaths)
	{
		this.searchPaths = List.copyOf(searchPaths);
	}

	public List<Path> getSearchPaths()
	{
		return searchPaths;
	}

	/**
	 * @return the manifest of the library, or empty if no readable manifest exists
	 */
	public Optional<LibraryDTO> load(String library)
	{
		return cache.computeIfAbsent(library, this::read);
	}

	private Optional<LibraryDTO> read(String library)
	{
		for (Path candidate : candidates(library))
		{
			if (!Files.isRegularFile(candidate))
			{
				continue;
			}
			try
			{
				LibraryDTO lib = gson.fromJson(Files.readString(candidate), LibraryDTO.class);
				if (lib != null)
				{
					Debug.logDebug("Loaded library manifest " + candidate);
					return Optional.of(lib);
				}
			}
			catch (IOException | JsonParseException e)
			{
				Debug.logWarning("Failed to load library: " + candidate.getFileName() + " | Reason: " + e.getMessage());
			}
		}
		return Optional.empty();
	}

	private List<Path> candidates(String library)
	{
		List<Path> result = new ArrayList<>();
		if (library.endsWith(".json"))
		{
			result.add(Path.of(library));
		}
		Path fileName = Path.of(library).getFileName();
		String base = fileName == null ? library : fileName.toString();
		int dot = base.indexOf('.');
		if (dot > 0)
		{
			base = base.substring(0, dot);
		}
		for (Path dir : searchPaths)
		{
			result.add(dir.resolve(base + ".json"));
		}
		return result;
	}

	public static Optional<FunctionDTO> findFunction(LibraryDTO library, String name)
	{
		if (library.functions == null)
		{
			return Optional.empty();
		}
		return library.functions.stream().filter(f -> name.equals(f.name)).findFirst();
	}

	/**
	 * Translates a manifest entry into a function type. Unknown type keywords become the
	 * error placeholder.
	 */
	public static FunctionType toFunctionType(FunctionDTO function)
	{
		List<Type> parameters = new ArrayList<>();
		if (function.parameters != null)
		{
			for (ParameterDTO p : function.parameters)
			{
				Type t = resolveType(p.type);
				parameters.add(p.reference ? QualifiedType.of(Qualifier.REF, t) : t);
			}
		}
		return new FunctionType(resolveType(function.returnType), parameters);
	}

	/**
	 * True if a declared signature agrees with the library's: same shape of result and
	 * parameters, and the same parameters passed by reference.
	 */
	public static boolean matches(FunctionType declared, FunctionDTO exported)
	{
		FunctionType actual = toFunctionType(exported);
		if (!TypeSystem.structuralEqual(declared, actual))
		{
			return false;
		}
		for (int i = 0; i < declared.getArity(); i++)
		{
			if (declared.getParameterTypes().get(i).isReference() != actual.getParameterTypes().get(i).isReference())
			{
				return false;
			}
		}
		return true;
	}

	private static Type resolveType(String keyword)
	{
		if (keyword == null)
		{
			return PrimitiveType.VOID;
		}
		Type type = PrimitiveType.getAllPrimitiveKeywords().get(keyword);
		return type != null ? type : ErrorType.INSTANCE;
	}
}
