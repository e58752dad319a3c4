package edu.isi.chomsky;

// how a chart entry (i, j, A) was derived: either A -> token at i == j, or
// A -> B C with B over (i, split) and C over (split+1, j)
public final class Backpointer {

	private final Symbol token;
	private final int split;
	private final Symbol left;
	private final Symbol right;

	private Backpointer(Symbol token, int split, Symbol left, Symbol right) {
		this.token = token;
		this.split = split;
		this.left = left;
		this.right = right;
	}

	public static Backpointer terminal(Symbol token) {
		return new Backpointer(token, -1, null, null);
	}

	public static Backpointer split(int k, Symbol left, Symbol right) {
		return new Backpointer(null, k, left, right);
	}

	public boolean isTerminal() { return token != null; }

	// null unless terminal
	public Symbol getToken() { return token; }
	// -1 if terminal
	public int getSplit() { return split; }
	public Symbol getLeft() { return left; }
	public Symbol getRight() { return right; }

	public boolean equals(Object o) {
		if (!(o instanceof Backpointer))
			return false;
		Backpointer b = (Backpointer)o;
		return token == b.token && split == b.split && left == b.left && right == b.right;
	}

	public int hashCode() {
		if (isTerminal())
			return token.hashCode();
		return (split * 31 + left.hashCode()) * 31 + right.hashCode();
	}

	public String toString() {
		if (isTerminal())
			return "terminal("+token+")";
		return "split("+split+", "+left+", "+right+")";
	}
}
