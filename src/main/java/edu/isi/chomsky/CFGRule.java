package edu.isi.chomsky;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.Vector;

// CFG Rule. Symbol lhs, Vector of Symbols rhs. Immutable; equal rules collapse in a rule set.
// The empty string is the one-symbol rhs [ε], never an empty vector.
public class CFGRule implements Serializable {

	private final Symbol lhs;
	private final List<Symbol> rhs;
	private final int hsh;

	public CFGRule(Symbol inlhs, List<Symbol> inrhs) {
		if (inlhs == null)
			throw new NullPointerException("Rule lhs may not be null");
		if (inrhs == null)
			throw new NullPointerException("Rule rhs may not be null");
		if (inrhs.isEmpty())
			throw new IllegalArgumentException("Rule rhs may not be empty; use the epsilon symbol for "+inlhs);
		if (inrhs.size() > 1 && inrhs.contains(Symbol.getEpsilon()))
			throw new IllegalArgumentException("Epsilon must stand alone in the rhs of "+inlhs);
		lhs = inlhs;
		rhs = Collections.unmodifiableList(new Vector<Symbol>(inrhs));
		hsh = lhs.hashCode() * 31 + rhs.hashCode();
	}

	public CFGRule(Symbol inlhs, Symbol... inrhs) {
		this(inlhs, Arrays.asList(inrhs));
	}

	// epsilon rule
	public static CFGRule epsilon(Symbol inlhs) {
		return new CFGRule(inlhs, Symbol.getEpsilon());
	}

	// accessors
	public Symbol getLHS() { return lhs; }
	public List<Symbol> getRHS() { return rhs; }

	public boolean isEpsilonRule() {
		return rhs.size() == 1 && rhs.get(0).isEpsilon();
	}

	// A -> a or A -> B C, again relative to the rule set's states
	public boolean isNormal(Set<Symbol> states) {
		if (rhs.size() == 1)
			return !rhs.get(0).isEpsilon() && !states.contains(rhs.get(0));
		if (rhs.size() == 2)
			return states.contains(rhs.get(0)) && states.contains(rhs.get(1));
		return false;
	}

	public int hashCode() {
		return hsh;
	}

	// equals if lhs is same and rhs are same
	public boolean equals(Object o) {
		if (!(o instanceof CFGRule))
			return false;
		CFGRule r = (CFGRule)o;
		return lhs == r.lhs && rhs.equals(r.rhs);
	}

	// the rhs alone, space separated
	public String rhsString() {
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < rhs.size(); i++) {
			if (i > 0)
				sb.append(' ');
			sb.append(rhs.get(i).toString());
		}
		return sb.toString();
	}

	public String toString() {
		return lhs.toString()+" -> "+rhsString();
	}
}
