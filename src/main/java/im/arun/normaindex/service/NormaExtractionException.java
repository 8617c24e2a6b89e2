package im.arun.normaindex.service;

/** Thrown when a norma document cannot be read or processed. */
public class NormaExtractionException extends RuntimeException {

    private final String fileName;

    public NormaExtractionException(String fileName, String message) {
        super(message);
        this.fileName = fileName;
    }

    public NormaExtractionException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
