package edu.isi.chomsky;

import java.util.List;
import java.util.Vector;

/**
 * Arithmetic expressions. <tt>+ * ( )</tt> are tokens of their own, any run of
 * letters, digits and underscores is the single terminal <tt>id</tt>, and
 * everything else is skipped. <tt>(x+3)*y</tt> gives <tt>( id + id ) * id</tt>.
 */
public class ExprTokenizer extends Tokenizer {

	public static final String ID = "id";

	private static final String OPERATORS = "+*()";

	private static boolean isIdChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	public List<String> tokenize(String s) {
		Vector<String> out = new Vector<String>();
		int i = 0;
		int n = s.length();
		while (i < n) {
			char c = s.charAt(i);
			if (OPERATORS.indexOf(c) >= 0) {
				out.add(String.valueOf(c));
				i++;
			}
			else if (isIdChar(c)) {
				int j = i + 1;
				while (j < n && isIdChar(s.charAt(j)))
					j++;
				out.add(ID);
				i = j;
			}
			else
				i++;
		}
		return out;
	}

	public String getName() {
		return EXPR;
	}
}
