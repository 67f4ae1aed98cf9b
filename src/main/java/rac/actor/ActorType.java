package rac.actor;

import java.util.Objects;

import rac.flow.ActorTrait;

/**
 * The classification of a sink candidate: its event capability and declared
 * element type. A primitive declared type stands for its wrapper class.
 */
public final class ActorType {

    static final ActorType INVALID = new ActorType(ActorTrait.INVALID, Object.class);

    final ActorTrait trait;

    final Class<?> type;

    ActorType(ActorTrait trait, Class<?> type) {
        this.trait = trait;
        this.type = box(type);
    }

    static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == char.class) {
            return Character.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        return Void.class;
    }

    public ActorTrait trait() {
        return trait;
    }

    public Class<?> type() {
        return type;
    }

    /**
     * @return true if the declared element type is narrower than {@code Object}
     */
    public boolean isTyped() {
        return type != Object.class;
    }

    /**
     * Checks whether values of the given type may be delivered.
     *
     * @param dataType the produced value type
     * @return true if accepted
     */
    public boolean accepts(Class<?> dataType) {
        return type == Object.class || type.isAssignableFrom(box(dataType));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActorType)) {
            return false;
        }
        ActorType other = (ActorType) o;
        return trait == other.trait && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(trait, type);
    }

    @Override
    public String toString() {
        if (trait == ActorTrait.INVALID) {
            return "INVALID";
        }
        return trait + "(" + type.getSimpleName() + ")";
    }
}
