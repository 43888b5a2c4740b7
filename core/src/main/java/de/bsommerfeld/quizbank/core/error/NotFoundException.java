package de.bsommerfeld.quizbank.core.error;

/**
 * Thrown when a lookup by id matches no row.
 */
public class NotFoundException extends QuizbankException {

    private final String entity;
    private final long id;

    public NotFoundException(String entity, long id) {
        super(entity + " " + id + " not found");
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public long getId() {
        return id;
    }
}
