package org.l20n.engine.compiler;

/**
 * Thrown when an entity is asked for an attribute it does not declare.
 */
public class AttributeNotFoundException extends L20nResolutionException {

    private final String entityId;
    private final String attributeName;

    public AttributeNotFoundException(String entityId, String attributeName) {
        super("Entity '" + entityId + "' has no attribute '" + attributeName + "'");
        this.entityId = entityId;
        this.attributeName = attributeName;
    }

    public String entityId() {
        return entityId;
    }

    public String attributeName() {
        return attributeName;
    }
}
