package dev.reviewgate.domain.entity;

import dev.reviewgate.domain.enums.Role;
import jakarta.persistence.*;

/**
 * Read-only view of the identity provider's profile table. Used to resolve notification recipients.
 */
@Entity
@Table(name = "profiles")
public class UserProfile {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Role role;

    protected UserProfile() {
    }

    public static UserProfile of(String id, String name, String email, Role role) {
        UserProfile p = new UserProfile();
        p.id = id;
        p.name = name;
        p.email = email;
        p.role = role;
        return p;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public Role getRole() {
        return role;
    }
}
