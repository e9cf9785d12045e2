package com.dqscan.quality.exception;

import lombok.Getter;

@Getter
public class UnsupportedFormatException extends DatasetLoadException {

  private final String extension;

  public UnsupportedFormatException(String extension) {
    super("Unsupported file extension: " + extension);
    this.extension = extension;
  }
}
