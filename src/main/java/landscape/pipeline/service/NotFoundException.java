package landscape.pipeline.service;

/**
 * A requested resource does not exist. Mapped to 404 by the HTTP router.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
