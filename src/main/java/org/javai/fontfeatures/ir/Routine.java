package org.javai.fontfeatures.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of rules compiled as one lookup.
 * <p>
 * The routine's flags are applied to every rule it holds: to all current rules when
 * the flags are set, and to each rule as it is added.
 */
public final class Routine {

	private final String name;
	private final List<String> address = new ArrayList<>();
	private final List<Rule> rules = new ArrayList<>();
	private int flags;

	public Routine() {
		this(null);
	}

	public Routine(String name) {
		this.name = name;
	}

	/**
	 * The routine name, or {@code null} for an anonymous routine.
	 */
	public String name() {
		return name;
	}

	public List<Rule> rules() {
		return Collections.unmodifiableList(rules);
	}

	public List<String> address() {
		return Collections.unmodifiableList(address);
	}

	public void addAddress(String location) {
		address.add(location);
	}

	public int flags() {
		return flags;
	}

	public void setFlags(int flags) {
		this.flags = flags;
		for (Rule rule : rules) {
			rule.setFlags(flags);
		}
	}

	public void addRule(Rule rule) {
		rule.setFlags(flags);
		rules.add(rule);
	}

	public boolean isEmpty() {
		return rules.isEmpty();
	}

	@Override
	public String toString() {
		return "Routine(" + (name != null ? name : "<anonymous>") + ", " + rules.size() + " rules, flags=" + flags + ")";
	}
}
