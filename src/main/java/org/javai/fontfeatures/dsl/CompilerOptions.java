package org.javai.fontfeatures.dsl;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Options of a compilation session.
 *
 * @param plugins names of the built-in plugins to register, in order
 * @param includeRoot directory that {@code Include} paths are resolved against when the including source is not a file; may be {@code null}
 * @param mustExist drop selector results that are not in the font, with a warning
 */
public record CompilerOptions(List<String> plugins, Path includeRoot, boolean mustExist) {

	public CompilerOptions {
		plugins = plugins != null ? List.copyOf(plugins) : List.of();
	}

	public static CompilerOptions defaults() {
		return new CompilerOptions(allBuiltinPlugins(), null, true);
	}

	public CompilerOptions withPlugins(List<String> pluginNames) {
		return new CompilerOptions(pluginNames, includeRoot, mustExist);
	}

	public CompilerOptions withIncludeRoot(Path root) {
		return new CompilerOptions(plugins, root, mustExist);
	}

	public CompilerOptions withMustExist(boolean check) {
		return new CompilerOptions(plugins, includeRoot, check);
	}

	static List<String> allBuiltinPlugins() {
		return Arrays.stream(BuiltinPlugin.values()).map(BuiltinPlugin::pluginName).toList();
	}
}
