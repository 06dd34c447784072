package guraa.refcompare.model;

/**
 * Thrown when an input record is not a mapping of field names to values.
 * This is the only input problem the comparison engine treats as fatal.
 */
public class InvalidRecordShapeException extends RuntimeException {

    public InvalidRecordShapeException(String message) {
        super(message);
    }
}
