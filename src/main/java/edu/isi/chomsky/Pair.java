package edu.isi.chomsky;

// pair for returning two things at once
public class Pair<A, B> {
	private final A _a;
	private final B _b;
	public A l() { return _a; }
	public B r() { return _b; }
	public Pair (A a, B b) {_a = a; _b = b; }
	public String toString() { return "<"+_a+", "+_b+">"; }
}
