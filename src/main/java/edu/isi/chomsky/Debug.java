package edu.isi.chomsky;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.Date;
// diagnostics for the converter, parser and command line. everything goes to stderr
// unless redirected
public class Debug {

    static String encoding = "utf-8";
    private static OutputStream target = System.err;

    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }

    // tests capture diagnostics this way
    public static void setStream(OutputStream os) {
	target = os;
	initializeStream();
    }

    private static Writer w=null;
    private static void initializeStream() {
	try {
	    w = new OutputStreamWriter(target, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(target);
	}
    }

    // stuff we always print
    public static void prettyDebug(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }

    // true debugging stuff; caller is found from the stack
    public static void debug(boolean d, String s)  {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	debug(0, caller.getClassName()+":"+caller.getMethodName(), s);
    }
    private static void debug(int indent, String caller, String s) {
	if (w == null)
	    initializeStream();
	try {
	    for (int x = 0; x < indent; x++)
		w.write(" ");
	    w.write(caller+" : "+s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }

    // timing verbosity set by --time. -1 means never print
    private static int dblevel=-1;
    public static void setDbLevel(int i) {
	dblevel = i;
    }

    // print elapsed time between two dates if the level is proper
    public static void dbtime(int needlevel, Date pta, Date ptb, String msg) {
	if (dblevel < needlevel)
	    return;
	prettyDebug(msg+": "+(ptb.getTime() - pta.getTime())+" ms");
    }

    // elapsed time from pta until now
    public static void dbtime(int needlevel, Date pta, String msg) {
	dbtime(needlevel, pta, new Date(), msg);
    }

}
