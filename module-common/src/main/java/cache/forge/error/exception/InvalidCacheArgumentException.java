package cache.forge.error.exception;

import cache.forge.error.CommonErrorCode;
import cache.forge.error.exception.base.ClientBaseException;

public class InvalidCacheArgumentException extends ClientBaseException {

  public InvalidCacheArgumentException(String detail) {
    super(CommonErrorCode.INVALID_ARGUMENT, detail);
  }
}
