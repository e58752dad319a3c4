package edu.isi.chomsky;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A derivation tree rebuilt from a CYK chart. Internal nodes are labeled with
 * states, leaves with tokens (or ε, for an accepted empty input).
 */
public class ParseTree {

	private final Symbol label;
	private final List<ParseTree> children;
	private final int numNodes;

	// a leaf
	public ParseTree(Symbol label) {
		this(label, Collections.<ParseTree>emptyList());
	}

	public ParseTree(Symbol label, List<ParseTree> kids) {
		if (label == null)
			throw new NullPointerException("Tree label may not be null");
		this.label = label;
		children = Collections.unmodifiableList(new ArrayList<ParseTree>(kids));
		int count = 1;
		for (ParseTree t : children)
			count += t.numNodes;
		numNodes = count;
	}

	public ParseTree(Symbol label, ParseTree... kids) {
		this(label, Arrays.asList(kids));
	}

	public Symbol getLabel() { return label; }
	public List<ParseTree> getChildren() { return children; }
	public int getNumChildren() { return children.size(); }
	public boolean isLeaf() { return children.isEmpty(); }
	public int getNumNodes() { return numNodes; }

	/**
	 * Parenthesized form: a leaf prints as its bare label, any other node as
	 * <tt>(label child1 child2 ...)</tt>. For example
	 * <tt>(S (NP (Det the) (N cat)) (V sleeps))</tt>
	 */
	public String toBracketedString() {
		if (children.isEmpty())
			return label.toString();
		StringBuffer ret = new StringBuffer("(");
		ret.append(label.toString());
		for (ParseTree t : children)
			ret.append(" ").append(t.toBracketedString());
		ret.append(")");
		return ret.toString();
	}

	/** Leaf labels left to right, space separated. ε leaves contribute nothing. */
	public String toYield() {
		if (children.isEmpty())
			return label.isEpsilon() ? "" : label.toString();
		StringBuffer ret = new StringBuffer();
		for (ParseTree t : children) {
			String y = t.toYield();
			if (y.length() == 0)
				continue;
			if (ret.length() > 0)
				ret.append(" ");
			ret.append(y);
		}
		return ret.toString();
	}

	public boolean equals(Object o) {
		if (!(o instanceof ParseTree))
			return false;
		ParseTree t = (ParseTree)o;
		return label == t.label && children.equals(t.children);
	}

	public int hashCode() {
		return label.hashCode() * 31 + children.hashCode();
	}

	// A(B C(D E)) form
	public String toString() {
		StringBuffer ret = new StringBuffer(label.toString());
		if (!children.isEmpty()) {
			ret.append("("+children.get(0).toString());
			for (int i = 1; i < children.size(); i++)
				ret.append(" "+children.get(i).toString());
			ret.append(")");
		}
		return ret.toString();
	}
}
