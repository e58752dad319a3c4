package edu.isi.chomsky;
/** for errors in the command line setup: unknown tokenizer names, 
    contradictory switches, unreadable input files */
public class ConfigureException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public ConfigureException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public ConfigureException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ConfigureException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause. */
    public ConfigureException(Throwable cause) { super(cause); }
}
