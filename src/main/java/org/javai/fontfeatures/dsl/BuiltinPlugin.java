package org.javai.fontfeatures.dsl;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import org.javai.fontfeatures.dsl.classes.DefineClassBinnedVerb;
import org.javai.fontfeatures.dsl.classes.DefineClassVerb;
import org.javai.fontfeatures.dsl.debug.DumpClassNamesVerb;
import org.javai.fontfeatures.dsl.debug.DumpClassesVerb;
import org.javai.fontfeatures.dsl.debug.ShowClassVerb;
import org.javai.fontfeatures.dsl.layout.AnchorsVerb;
import org.javai.fontfeatures.dsl.layout.AttachVerb;
import org.javai.fontfeatures.dsl.layout.ChainVerb;
import org.javai.fontfeatures.dsl.layout.FeatureVerb;
import org.javai.fontfeatures.dsl.layout.IfVerb;
import org.javai.fontfeatures.dsl.layout.IncludeVerb;
import org.javai.fontfeatures.dsl.layout.PositionVerb;
import org.javai.fontfeatures.dsl.layout.RoutineVerb;
import org.javai.fontfeatures.dsl.layout.SetVerb;
import org.javai.fontfeatures.dsl.layout.SubstituteVerb;

/**
 * The plugins shipped with the compiler. Each reads its descriptor from
 * {@code META-INF/fontfeatures/plugins/<name>.yml}.
 */
public enum BuiltinPlugin implements VerbPlugin {

	CLASS_DEFINITION("ClassDefinition", Map.of(
			"DefineClass", DefineClassVerb::new,
			"DefineClassBinned", DefineClassBinnedVerb::new)),
	DEBUG("Debug", Map.of(
			"ShowClass", ShowClassVerb::new,
			"DumpClasses", DumpClassesVerb::new,
			"DumpClassNames", DumpClassNamesVerb::new)),
	VARIABLES("Variables", Map.of("Set", SetVerb::new)),
	FEATURE("Feature", Map.of("Feature", FeatureVerb::new)),
	ROUTINE("Routine", Map.of("Routine", RoutineVerb::new)),
	SUBSTITUTE("Substitute", Map.of("Substitute", SubstituteVerb::new)),
	POSITION("Position", Map.of("Position", PositionVerb::new)),
	CHAIN("Chain", Map.of("Chain", ChainVerb::new)),
	ANCHORS("Anchors", Map.of(
			"Anchors", AnchorsVerb::new,
			"Attach", AttachVerb::new)),
	INCLUDE("Include", Map.of("Include", IncludeVerb::new)),
	CONDITIONAL("Conditional", Map.of("If", IfVerb::new));

	static final String DESCRIPTOR_LOCATION = "META-INF/fontfeatures/plugins/";

	private final String pluginName;
	private final Map<String, TransformerFactory> transformers;
	private volatile PluginDescriptor descriptor;

	BuiltinPlugin(String pluginName, Map<String, TransformerFactory> transformers) {
		this.pluginName = pluginName;
		this.transformers = transformers;
	}

	public String pluginName() {
		return pluginName;
	}

	@Override
	public PluginDescriptor descriptor() {
		PluginDescriptor loaded = descriptor;
		if (loaded == null) {
			loaded = loadDescriptor();
			descriptor = loaded;
		}
		return loaded;
	}

	@Override
	public Optional<TransformerFactory> transformer(String verb) {
		return Optional.ofNullable(transformers.get(verb));
	}

	public static Optional<BuiltinPlugin> named(String name) {
		return Arrays.stream(values()).filter(p -> p.pluginName.equals(name)).findFirst();
	}

	private PluginDescriptor loadDescriptor() {
		String resource = DESCRIPTOR_LOCATION + pluginName + ".yml";
		try (InputStream is = BuiltinPlugin.class.getClassLoader().getResourceAsStream(resource)) {
			if (is == null) {
				throw new IllegalStateException("Plugin descriptor not found: " + resource);
			}
			return new PluginDescriptorParser().parse(is);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read plugin descriptor " + resource, e);
		}
	}
}
