package edu.isi.chomsky;
/** for grammars that are not in the form an operation needs, i.e. a 
    non-CNF grammar handed to the CYK parser */
public class ImproperConversionException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public ImproperConversionException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public ImproperConversionException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ImproperConversionException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause. */
    public ImproperConversionException(Throwable cause) { super(cause); }
}
