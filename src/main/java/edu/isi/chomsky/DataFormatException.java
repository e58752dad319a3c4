package edu.isi.chomsky;
/** for errors in the data format of grammars: malformed rule lines, empty
    grammars, start symbols with no productions */

public class DataFormatException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public DataFormatException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public DataFormatException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public DataFormatException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause. */
    public DataFormatException(Throwable cause) { super(cause); }

    /** Constructs a new exception for a bad line of a grammar file */
    public DataFormatException(int line, String message) { super("line "+line+": "+message); }
}
