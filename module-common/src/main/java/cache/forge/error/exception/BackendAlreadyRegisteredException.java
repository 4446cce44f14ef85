package cache.forge.error.exception;

import cache.forge.error.CommonErrorCode;
import cache.forge.error.exception.base.ClientBaseException;

public class BackendAlreadyRegisteredException extends ClientBaseException {

  public BackendAlreadyRegisteredException(String backendName) {
    super(CommonErrorCode.BACKEND_ALREADY_REGISTERED, backendName);
  }
}
