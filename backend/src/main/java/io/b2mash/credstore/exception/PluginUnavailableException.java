package io.b2mash.credstore.exception;

public class PluginUnavailableException extends CredentialStoreException {

  public PluginUnavailableException(String detail) {
    super(ErrorKind.PLUGIN_UNAVAILABLE, "Secret backend unavailable", detail);
  }

  public PluginUnavailableException(String detail, Throwable cause) {
    super(ErrorKind.PLUGIN_UNAVAILABLE, "Secret backend unavailable", detail, cause);
  }
}
