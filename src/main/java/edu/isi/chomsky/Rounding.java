package edu.isi.chomsky;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Fixed-point formatting of timings for reports.
 */
public class Rounding {

    /**
     * Round a double value to a specified number of decimal places. The
     * decimal separator is always '.', whatever the default locale.
     *
     * @param val the value to be rounded.
     * @param places the number of decimal places to round to.
     * @return string version of val with exactly places decimal places.
     */
    public static String round(double val, int places) {
	StringBuffer pattern = new StringBuffer("0");
	if (places > 0)
	    pattern.append('.');
	for (int i = 0; i < places; i++)
	    pattern.append('0');
	DecimalFormat form = new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(Locale.ROOT));
	return form.format(val);
    }
}
