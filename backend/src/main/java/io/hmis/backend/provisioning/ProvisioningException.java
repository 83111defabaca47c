package io.hmis.backend.provisioning;

public class ProvisioningException extends RuntimeException {

  public ProvisioningException(String message, Throwable cause) {
    super(message, cause);
  }
}
