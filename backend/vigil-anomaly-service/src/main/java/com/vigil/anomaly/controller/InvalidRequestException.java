package com.vigil.anomaly.controller;

/** Request failed validation at the HTTP edge; answered with 400. */
public class InvalidRequestException extends RuntimeException {
  public InvalidRequestException(String message) {
    super(message);
  }
}
