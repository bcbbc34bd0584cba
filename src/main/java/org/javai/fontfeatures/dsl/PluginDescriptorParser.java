package org.javai.fontfeatures.dsl;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for plugin descriptor YAML files.
 *
 * <pre>
 * name: Debug
 * parse_options:
 *   use_helpers: true
 * grammar: ""
 * verbs: [ShowClass]
 * verb_grammars:
 *   ShowClass:
 *     main: |
 *       ?start: action
 *       action: glyphselector
 * </pre>
 *
 * Missing sections are left {@code null} so that registration can reject the plugin.
 */
public class PluginDescriptorParser {

	private final Yaml yaml = new Yaml();

	public PluginDescriptor parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse plugin descriptor from path: " + path, e);
		}
	}

	public PluginDescriptor parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse plugin descriptor from input stream", e);
		}
	}

	public PluginDescriptor parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse plugin descriptor from reader", e);
		}
	}

	public PluginDescriptor parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse plugin descriptor from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private PluginDescriptor build(Object loaded) {
		if (!(loaded instanceof Map)) {
			throw new IllegalArgumentException("Plugin descriptor must be a YAML mapping");
		}
		Map<String, Object> data = (Map<String, Object>) loaded;
		return new PluginDescriptor(
				toString(data.get("name")),
				buildOptions(data.get("parse_options")),
				toString(data.get("grammar")),
				buildVerbs(data.get("verbs")),
				buildVerbGrammars(data.get("verb_grammars")));
	}

	@SuppressWarnings("unchecked")
	private ParseOptions buildOptions(Object options) {
		if (!(options instanceof Map)) {
			return null;
		}
		Object useHelpers = ((Map<String, Object>) options).get("use_helpers");
		if (useHelpers == null) {
			return null;
		}
		return new ParseOptions(Boolean.parseBoolean(String.valueOf(useHelpers)));
	}

	private List<String> buildVerbs(Object verbs) {
		if (!(verbs instanceof List<?> list)) {
			return null;
		}
		List<String> names = new ArrayList<>();
		for (Object verb : list) {
			if (verb != null) {
				names.add(verb.toString());
			}
		}
		return names;
	}

	@SuppressWarnings("unchecked")
	private Map<String, VerbGrammars> buildVerbGrammars(Object verbGrammars) {
		Map<String, VerbGrammars> result = new LinkedHashMap<>();
		if (!(verbGrammars instanceof Map)) {
			return result;
		}
		((Map<String, Object>) verbGrammars).forEach((verb, value) -> {
			if (value instanceof Map) {
				Map<String, Object> fragments = (Map<String, Object>) value;
				result.put(verb, new VerbGrammars(
						toString(fragments.get("main")),
						toString(fragments.get("before_brace")),
						toString(fragments.get("after_brace"))));
			}
		});
		return result;
	}

	private String toString(Object obj) {
		return obj != null ? obj.toString() : null;
	}
}
