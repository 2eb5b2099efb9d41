package dev.badgersnacks.compendium.persistence;

/**
 * A catalog write or read failed. Writes are transactional, so the catalog is left as it was before the call.
 */
public class CatalogPersistenceException extends RuntimeException {

    public CatalogPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
