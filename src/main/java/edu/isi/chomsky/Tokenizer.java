package edu.isi.chomsky;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a line of input into the terminal names the parser sees. Tokenizers
 * are stateless; {@link #get} hands out shared instances by name.
 */
public abstract class Tokenizer {

	public static final String EXPR = "expr";
	public static final String WORDS = "words";
	public static final String PLAIN = "plain";

	private static final Tokenizer exprTok = new ExprTokenizer();
	private static final Tokenizer wordTok = new WordTokenizer();
	private static final Tokenizer plainTok = new WhitespaceTokenizer();

	public abstract List<String> tokenize(String s);

	public abstract String getName();

	public static Tokenizer get(String name) throws ConfigureException {
		if (EXPR.equals(name))
			return exprTok;
		if (WORDS.equals(name))
			return wordTok;
		if (PLAIN.equals(name))
			return plainTok;
		throw new ConfigureException("Unknown tokenizer "+name+"; expected "+EXPR+", "+WORDS+" or "+PLAIN);
	}

	// w = ..., w: ...; with an optional trailing semicolon
	private static Pattern wPrefixPat = Pattern.compile("^\\s*w\\s*[:=]\\s*(.*?);?\\s*$", Pattern.CASE_INSENSITIVE);

	/**
	 * Strips an optional <tt>w =</tt> or <tt>w:</tt> prefix (and trailing
	 * semicolon) and then one pair of matching surrounding quotes, so
	 * <tt>w = "she eats a cake";</tt> becomes <tt>she eats a cake</tt>.
	 */
	public static String normalizeInput(String s) {
		Matcher m = wPrefixPat.matcher(s);
		String ret = m.matches() ? m.group(1) : s.trim();
		if (ret.length() >= 2) {
			char first = ret.charAt(0);
			if ((first == '"' || first == '\'') && ret.charAt(ret.length()-1) == first)
				ret = ret.substring(1, ret.length()-1);
		}
		return ret;
	}

	public String toString() {
		return getName();
	}
}
