package org.javai.fontfeatures.dsl;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link CompilerOptions} from YAML. Keys that are absent keep their default.
 *
 * <pre>
 * plugins: [ClassDefinition, Debug]
 * include_root: rules
 * must_exist: false
 * </pre>
 */
public class CompilerOptionsParser {

	private final Yaml yaml = new Yaml();

	public CompilerOptions parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to read compiler options from path: " + path, e);
		}
	}

	public CompilerOptions parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to read compiler options from input stream", e);
		}
	}

	public CompilerOptions parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to read compiler options from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private CompilerOptions build(Object loaded) {
		CompilerOptions options = CompilerOptions.defaults();
		if (loaded == null) {
			return options;
		}
		if (!(loaded instanceof Map)) {
			throw new IllegalArgumentException("Compiler options must be a YAML mapping");
		}
		Map<String, Object> data = (Map<String, Object>) loaded;
		Object plugins = data.get("plugins");
		if (plugins instanceof List<?> list) {
			List<String> names = new ArrayList<>();
			list.forEach(p -> names.add(String.valueOf(p)));
			options = options.withPlugins(names);
		} else if (plugins != null) {
			throw new IllegalArgumentException("'plugins' must be a list of plugin names");
		}
		Object includeRoot = data.get("include_root");
		if (includeRoot != null) {
			options = options.withIncludeRoot(Path.of(includeRoot.toString()));
		}
		Object mustExist = data.get("must_exist");
		if (mustExist != null) {
			options = options.withMustExist(Boolean.parseBoolean(mustExist.toString()));
		}
		return options;
	}
}
