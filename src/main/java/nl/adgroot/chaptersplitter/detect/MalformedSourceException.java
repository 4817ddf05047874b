package nl.adgroot.chaptersplitter.detect;

/** The input document cannot be opened or its structure cannot be read. */
public class MalformedSourceException extends RuntimeException {

  public MalformedSourceException(String message) {
    super(message);
  }

  public MalformedSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
