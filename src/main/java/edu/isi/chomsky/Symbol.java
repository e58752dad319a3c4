package edu.isi.chomsky;

import java.io.ObjectStreamException;
import java.io.Serializable;

// a grammar symbol. valued for its identity: SymbolFactory hands out one object per name,
// so equality is reference equality. Whether a symbol is a nonterminal or a terminal 
// depends on the rule set it is used in and is never stored here.
public class Symbol implements Comparable<Symbol>, Serializable {

	private static Symbol eps;
	static {
		eps = SymbolFactory.getSymbol("ε");
	}
	/** the empty string marker. An epsilon production has the one-symbol rhs [ε] */
	public static Symbol getEpsilon() {
		return eps;
	}

	private final String intern;

	// only SymbolFactory makes these
	Symbol(String s) {
		intern = s.intern();
	}

	public String toString() { return intern; }

	public int hashCode() {
		return intern.hashCode();
	}

	// prevent any slow comparisons
	public boolean equals(Object o) {
		return this == o;
	}

	// name order pins every iteration the parser depends on
	public int compareTo(Symbol o) {
		return intern.compareTo(o.intern);
	}

	public boolean isEpsilon() {
		return this == eps;
	}

	// upon restoration, use symbolfactory's copy
	public Object readResolve() throws ObjectStreamException {
		return SymbolFactory.getSymbol(intern);
	}
}
