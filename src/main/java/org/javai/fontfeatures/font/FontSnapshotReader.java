package org.javai.fontfeatures.font;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an {@link InMemoryFont} from a JSON snapshot of a font.
 *
 * <pre>{@code
 * {
 *   "glyphs": [
 *     { "name": "A", "codepoints": [65], "category": "base",
 *       "width": 600, "lsb": 20, "rsb": 20, "xMin": 20, "xMax": 580, "yMin": 0, "yMax": 700,
 *       "anchors": ["top"] }
 *   ]
 * }
 * }</pre>
 *
 * Codepoints may be numbers or {@code "U+0041"} strings. Missing metrics are zero.
 */
public class FontSnapshotReader {

	private final ObjectMapper mapper;

	public FontSnapshotReader() {
		this(new ObjectMapper());
	}

	public FontSnapshotReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public InMemoryFont read(Path path) {
		try (InputStream is = Files.newInputStream(path)) {
			return read(is);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read font snapshot from " + path, e);
		}
	}

	public InMemoryFont read(InputStream inputStream) {
		try {
			return build(mapper.readTree(inputStream));
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read font snapshot", e);
		}
	}

	public InMemoryFont readString(String json) {
		try {
			return build(mapper.readTree(json));
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read font snapshot", e);
		}
	}

	private InMemoryFont build(JsonNode root) {
		JsonNode glyphs = root == null ? null : root.get("glyphs");
		if (glyphs == null || !glyphs.isArray()) {
			throw new IllegalArgumentException("Font snapshot must contain a 'glyphs' array");
		}
		InMemoryFont.Builder builder = InMemoryFont.builder();
		for (JsonNode glyph : glyphs) {
			String name = glyph.path("name").asText(null);
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Glyph entry without a name: " + glyph);
			}
			builder.glyph(name, metrics(glyph));
			for (JsonNode codepoint : glyph.path("codepoints")) {
				builder.codepoint(codepoint(codepoint), name);
			}
			if (glyph.hasNonNull("category")) {
				builder.category(name, glyph.get("category").asText());
			}
			for (JsonNode anchor : glyph.path("anchors")) {
				builder.anchor(name, anchor.asText());
			}
		}
		return builder.build();
	}

	private static GlyphMetrics metrics(JsonNode glyph) {
		return new GlyphMetrics(
				glyph.path("width").asInt(0),
				glyph.path("lsb").asInt(0),
				glyph.path("rsb").asInt(0),
				glyph.path("xMin").asInt(0),
				glyph.path("xMax").asInt(0),
				glyph.path("yMin").asInt(0),
				glyph.path("yMax").asInt(0),
				glyph.path("rise").asInt(0),
				glyph.path("run").asInt(0));
	}

	private static int codepoint(JsonNode node) {
		if (node.isInt()) {
			return node.asInt();
		}
		String text = node.asText();
		try {
			if (text.startsWith("U+") || text.startsWith("u+")) {
				return Integer.parseInt(text.substring(2), 16);
			}
			return Integer.parseInt(text);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid codepoint '" + text + "' in font snapshot", e);
		}
	}
}
