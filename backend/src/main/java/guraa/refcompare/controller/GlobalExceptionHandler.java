package guraa.refcompare.controller;

import guraa.refcompare.model.InvalidRecordShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle records that are not field mappings
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(InvalidRecordShapeException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRecordShape(InvalidRecordShapeException e) {
        logger.warn("Rejected malformed record: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid record: " + e.getMessage());
    }

    /**
     * Handle invalid request arguments such as an unknown export subset
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Handle file upload size exceeded exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleMaxSizeException(MaxUploadSizeExceededException e) {
        logger.error("File size exceeded the maximum limit", e);
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "File size exceeds the maximum limit");
    }

    /**
     * Handle IO exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException e) {
        logger.error("IO Exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error processing file: " + e.getMessage());
    }

    /**
     * Handle all other exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        logger.error("Unexpected exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("error", message);
        return ResponseEntity.status(status).body(response);
    }
}
