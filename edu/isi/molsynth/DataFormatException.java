package edu.isi.molsynth;
/** for errors in the shape of rule and molecule input */

public class DataFormatException extends Exception {
    /** Constructs a new exception with null as its detail message. */
    public DataFormatException() { super(); }
    /** Constructs a new exception with the specified detail message. */
    public DataFormatException(String message) { super(message); }
    /** Constructs a new exception with the specified detail message and cause. */
    public DataFormatException(String message, Throwable cause) { super(message, cause); }
    /** Constructs a new exception with the specified cause. */
    public DataFormatException(Throwable cause) { super(cause); }
}
