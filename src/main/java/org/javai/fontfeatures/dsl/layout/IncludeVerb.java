package org.javai.fontfeatures.dsl.layout;

import java.nio.file.Path;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.StatementBlock;
import org.javai.fontfeatures.dsl.VerbTransformer;

/**
 * {@code Include <path>;} compiles another rule file into the same session.
 * The values of its statements become the value of the {@code Include}, so included
 * rules can be gathered by an enclosing feature.
 */
public class IncludeVerb extends VerbTransformer {

	public IncludeVerb(CompilationSession session) {
		super(session);
		onRule("action", args -> {
			Path path = session.resolveInclude(args.text(0));
			return new StatementBlock(session.include(path)).values();
		});
	}
}
