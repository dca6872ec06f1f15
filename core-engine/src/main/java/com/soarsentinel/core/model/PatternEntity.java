package com.soarsentinel.core.model;

import java.util.Objects;

/**
 * Reference from a correlation pattern to one participating entity.
 */
public final class PatternEntity {

    public static final String ALERT = "alert";
    public static final String INTEL = "intel";

    private final String type;
    private final long id;
    private final String role;

    public PatternEntity(String type, long id, String role) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.id = id;
        this.role = role != null ? role : "member";
    }

    public String getType() {
        return type;
    }

    public long getId() {
        return id;
    }

    public String getRole() {
        return role;
    }

    public boolean isAlert() {
        return ALERT.equals(type);
    }

    /**
     * @return {@code type:id}, the key used for graph nodes
     */
    public String key() {
        return type + ":" + id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PatternEntity that))
            return false;
        return id == that.id && type.equals(that.type) && role.equals(that.role);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id, role);
    }

    @Override
    public String toString() {
        return key() + "(" + role + ")";
    }
}
