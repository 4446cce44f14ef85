package cache.forge.error.exception;

import cache.forge.error.CommonErrorCode;
import cache.forge.error.exception.base.ClientBaseException;

public class BackendNotRegisteredException extends ClientBaseException {

  public BackendNotRegisteredException(String backendName) {
    super(CommonErrorCode.BACKEND_NOT_REGISTERED, backendName);
  }
}
