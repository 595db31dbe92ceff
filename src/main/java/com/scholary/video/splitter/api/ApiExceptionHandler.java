package com.scholary.video.splitter.api;

import com.scholary.video.splitter.job.JobStoreException;
import com.scholary.video.splitter.service.InvalidSubmissionException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Maps exceptions to API responses.
 *
 * <p>Rejected submissions get their message back. Storage failures are logged in full and
 * answered with a generic message.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidSubmissionException.class)
  public ResponseEntity<ApiError> handleInvalidSubmission(InvalidSubmissionException e) {
    LOGGER.info("Rejected submission: {}", e.getMessage());
    return ResponseEntity.badRequest().body(new ApiError(e.getMessage()));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException e) {
    LOGGER.info("Rejected oversized upload: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(new ApiError("The uploaded file is too large."));
  }

  @ExceptionHandler({JobStoreException.class, IOException.class})
  public ResponseEntity<ApiError> handleStorageFailure(Exception e) {
    LOGGER.error("Storage failure while handling request", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiError("Unable to store the job. Please try again."));
  }
}
