package org.javai.fontfeatures.dsl.layout;

import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code Set $name = <integer | value record>;}
 * <p>
 * Setting a variable again shadows the earlier value for the statements that follow.
 */
public class SetVerb extends VerbTransformer {

	private static final Logger logger = LoggerFactory.getLogger(SetVerb.class);

	public SetVerb(CompilationSession session) {
		super(session);
		onRule("action", args -> {
			String name = args.text(0).substring(1);
			Object value = args.get(1);
			session.setVariable(name, value);
			logger.debug("Set ${} = {}", name, value);
			return null;
		});
	}
}
