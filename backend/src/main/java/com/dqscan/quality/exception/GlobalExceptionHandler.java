package com.dqscan.quality.exception;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps request failures to {@link ErrorResponse} bodies. Analysis problems never reach this class:
 * they are reported inside the quality report itself.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  // Automatic browser requests that would otherwise fill the log with 404 warnings.
  private static final List<String> SILENT_NOT_FOUND_PATHS =
      List.of("favicon.ico", ".well-known/appspecific/com.chrome.devtools.json");

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  /** Unreadable uploads, including {@link UnsupportedFormatException}. */
  @ExceptionHandler(DatasetLoadException.class)
  public ResponseEntity<ErrorResponse> handleDatasetLoadException(
      DatasetLoadException ex, WebRequest request) {
    if (ex instanceof UnsupportedFormatException) {
      log.warn("Rejected dataset upload: {}", ex.getMessage());
    } else {
      log.error("Dataset could not be loaded: {}", ex.getMessage(), ex.getCause());
    }
    return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.warn("Invalid request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ErrorResponse> handleMissingInput(Exception ex, WebRequest request) {
    String name =
        ex instanceof MissingServletRequestPartException
            ? ((MissingServletRequestPartException) ex).getRequestPartName()
            : ((MissingServletRequestParameterException) ex).getParameterName();
    String message = String.format("Required part '%s' is missing", name);
    log.warn("Invalid request: {}", message);
    return respond(HttpStatus.BAD_REQUEST, message, request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, WebRequest request) {
    log.warn("Upload rejected by multipart limit: {}", ex.getMessage());
    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file exceeds the maximum allowed size", request);
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(Exception ex, WebRequest request) {
    String path = pathOf(request);
    if (SILENT_NOT_FOUND_PATHS.stream().noneMatch(path::contains)) {
      log.warn("No resource for {}", path);
    }
    String message =
        ex instanceof NoHandlerFoundException
            ? "No endpoint "
                + ((NoHandlerFoundException) ex).getHttpMethod()
                + " "
                + ((NoHandlerFoundException) ex).getRequestURL()
            : "The requested resource was not found";
    return respond(HttpStatus.NOT_FOUND, message, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = "Request method '" + ex.getMethod() + "' is not supported";
    log.warn("{} on {}", message, pathOf(request));
    return respond(HttpStatus.METHOD_NOT_ALLOWED, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, WebRequest request) {
    log.error("Unexpected error on {}", pathOf(request), ex);
    ErrorResponse body =
        ErrorResponse.of(
            HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", pathOf(request));
    if (exposeDebugDetails()) {
      body.setDebugMessage(ex.getMessage());
    }
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }

  private boolean exposeDebugDetails() {
    return debugEnabled && !"production".equals(environment);
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String message, WebRequest request) {
    return ResponseEntity.status(status).body(ErrorResponse.of(status, message, pathOf(request)));
  }

  private static String pathOf(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Error body returned for rejected or failed requests")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String message;
    private String path;

    /** Exception text, only outside production with debugging enabled. */
    private String debugMessage;

    static ErrorResponse of(HttpStatus status, String message, String path) {
      return ErrorResponse.builder()
          .timestamp(LocalDateTime.now())
          .status(status.value())
          .error(status.getReasonPhrase())
          .message(message)
          .path(path)
          .build();
    }
  }
}
