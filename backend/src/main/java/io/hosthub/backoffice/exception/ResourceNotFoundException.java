package io.hosthub.backoffice.exception;

public class ResourceNotFoundException extends RuntimeException {

  private final String title;

  public ResourceNotFoundException(String resourceType, Object id) {
    super("No " + resourceType.toLowerCase() + " found with id " + id);
    this.title = resourceType + " not found";
  }

  public String getTitle() {
    return title;
  }
}
