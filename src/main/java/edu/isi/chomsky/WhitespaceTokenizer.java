package edu.isi.chomsky;

import java.util.List;
import java.util.Vector;

// tokens exactly as written, split on whitespace
public class WhitespaceTokenizer extends Tokenizer {

	public List<String> tokenize(String s) {
		Vector<String> out = new Vector<String>();
		for (String tok : s.trim().split("\\s+")) {
			if (tok.length() > 0)
				out.add(tok);
		}
		return out;
	}

	public String getName() {
		return PLAIN;
	}
}
