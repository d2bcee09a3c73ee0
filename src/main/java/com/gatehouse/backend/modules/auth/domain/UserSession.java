package com.gatehouse.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.gatehouse.backend.global.jpa.AbstractTimestampedEntity;
import com.gatehouse.backend.modules.user.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Server-side record of an issued session token. A JWT is only honoured while its record exists
 * and has not expired.
 */
@Entity
@Table(name = "user_session")
public class UserSession extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "token", nullable = false, unique = true, updatable = false, columnDefinition = "text")
    private String token;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private AppUser user;

    @Column(name = "login_date", nullable = false, updatable = false)
    private OffsetDateTime loginDate;

    @Column(name = "expiration_date", nullable = false)
    private OffsetDateTime expirationDate;

    protected UserSession() {
    }

    public UserSession(String token, AppUser user, OffsetDateTime loginDate, OffsetDateTime expirationDate) {
        this.token = token;
        this.user = user;
        this.loginDate = loginDate;
        this.expirationDate = expirationDate;
    }

    public UUID getId() {
        return id;
    }

    public String getToken() {
        return token;
    }

    public AppUser getUser() {
        return user;
    }

    public OffsetDateTime getLoginDate() {
        return loginDate;
    }

    public OffsetDateTime getExpirationDate() {
        return expirationDate;
    }

    public boolean isActive(OffsetDateTime now) {
        return expirationDate.isAfter(now);
    }
}
