package prism.coordinator.service;

/**
 * Thrown when a referenced entity does not exist. Mapped to 404 by the router.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String entity, String id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
