package com.flamingo.ai.webmarkdown.exception;

/** Exception thrown when a pipeline stage cannot convert a page. */
public class ContentConversionException extends RuntimeException {

  private final String url;
  private final String userMessage;

  public ContentConversionException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
    this.userMessage = "Failed to convert page content";
  }

  public String getUrl() {
    return url;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
