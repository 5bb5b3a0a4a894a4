package io.mylab.lab.labplatform.exception;

public class PrincipalNotBoundException extends RuntimeException {

  public PrincipalNotBoundException() {
    super("Principal not available: PrincipalFilter did not bind one for this request");
  }
}
