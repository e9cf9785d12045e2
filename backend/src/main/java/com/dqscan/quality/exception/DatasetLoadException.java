package com.dqscan.quality.exception;

/** The uploaded file could not be turned into a dataset. No partial dataset is ever returned. */
public class DatasetLoadException extends RuntimeException {

  public DatasetLoadException(String message) {
    super(message);
  }

  public DatasetLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
