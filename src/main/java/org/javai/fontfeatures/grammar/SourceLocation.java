package org.javai.fontfeatures.grammar;

/**
 * A position in a rule source: optional file name plus 1-based line and column.
 *
 * @param file the source file, or {@code null} for in-memory sources
 * @param line the 1-based line
 * @param column the 1-based column
 */
public record SourceLocation(String file, int line, int column) {

	public static final SourceLocation UNKNOWN = new SourceLocation(null, 0, 0);

	public static SourceLocation of(int line, int column) {
		return new SourceLocation(null, line, column);
	}

	public SourceLocation inFile(String fileName) {
		return new SourceLocation(fileName, line, column);
	}

	/**
	 * Renders the location as an address, e.g. {@code rules.fee:3:14}.
	 */
	@Override
	public String toString() {
		String position = line + ":" + column;
		return file != null ? file + ":" + position : position;
	}
}
