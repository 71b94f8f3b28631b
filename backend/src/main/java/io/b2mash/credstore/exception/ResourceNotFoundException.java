package io.b2mash.credstore.exception;

public class ResourceNotFoundException extends CredentialStoreException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        ErrorKind.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail, ErrorKind.NOT_FOUND);
  }

  private ResourceNotFoundException(String title, String detail, ErrorKind kind) {
    super(kind, title, detail);
  }
}
