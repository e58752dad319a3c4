package edu.isi.chomsky;

import java.util.List;
import java.util.Locale;
import java.util.Vector;
import java.util.regex.Pattern;

/**
 * Natural language sentences: lowercased, anything but a-z, apostrophes and
 * whitespace becomes a space, then split on whitespace.
 * <tt>She eats a cake!</tt> gives <tt>she eats a cake</tt>.
 */
public class WordTokenizer extends Tokenizer {

	private static Pattern cleanPat = Pattern.compile("[^a-z'\\s]");

	public List<String> tokenize(String s) {
		String clean = cleanPat.matcher(s.toLowerCase(Locale.ROOT)).replaceAll(" ");
		Vector<String> out = new Vector<String>();
		for (String tok : clean.trim().split("\\s+")) {
			if (tok.length() > 0)
				out.add(tok);
		}
		return out;
	}

	public String getName() {
		return WORDS;
	}
}
