package com.gatehouse.backend.modules.action.domain;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.gatehouse.backend.modules.user.domain.AppUser;
import com.gatehouse.backend.modules.user.domain.Role;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import org.springframework.data.domain.Persistable;

/**
 * Single-use credential authorizing the actions in {@link #getType()} for {@link #getEmail()}.
 *
 * <p>The token value is assigned before insert, so the entity reports itself as new until it has
 * been persisted or loaded. That forces an INSERT and lets the primary key reject duplicates
 * instead of silently merging into an existing row.
 */
@Entity
@Table(name = "action_token")
public class ActionToken implements Persistable<String> {

    @Id
    @Column(name = "token", nullable = false, updatable = false, length = 128)
    private String token;

    @Column(name = "type", nullable = false, updatable = false)
    private int type;

    @Column(name = "email", nullable = false, updatable = false, length = 320)
    private String email;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", updatable = false)
    private OffsetDateTime expiresAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", updatable = false)
    private AppUser user;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "action_token_role",
            joinColumns = @JoinColumn(name = "token"),
            inverseJoinColumns = @JoinColumn(name = "role_id")
    )
    private Set<Role> roles = new LinkedHashSet<>();

    @Transient
    private boolean isNew = true;

    protected ActionToken() {
    }

    public static ActionToken issue(
            String token,
            int type,
            String email,
            AppUser user,
            Collection<Role> roles,
            OffsetDateTime createdAt,
            OffsetDateTime expiresAt
    ) {
        ActionToken actionToken = new ActionToken();
        actionToken.token = token;
        actionToken.type = type;
        actionToken.email = email;
        actionToken.user = user;
        if (roles != null) {
            actionToken.roles.addAll(roles);
        }
        actionToken.createdAt = createdAt;
        actionToken.expiresAt = expiresAt;
        return actionToken;
    }

    @Override
    public String getId() {
        return token;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    public String getToken() {
        return token;
    }

    public int getType() {
        return type;
    }

    public String getEmail() {
        return email;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public AppUser getUser() {
        return user;
    }

    public Set<Role> getRoles() {
        return Collections.unmodifiableSet(roles);
    }

    public List<String> getRoleNames() {
        return roles.stream().map(Role::getName).toList();
    }

    public boolean isExpired(OffsetDateTime now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
