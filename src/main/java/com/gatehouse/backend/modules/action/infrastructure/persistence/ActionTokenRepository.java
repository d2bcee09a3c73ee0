package com.gatehouse.backend.modules.action.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.gatehouse.backend.modules.action.domain.ActionToken;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ActionTokenRepository extends JpaRepository<ActionToken, String>, ActionTokenRepositoryCustom {

    @EntityGraph(attributePaths = {"user", "roles"})
    @Query("select t from ActionToken t where t.token = :token")
    Optional<ActionToken> findByToken(@Param("token") String token);

    // row stays locked until the caller's transaction ends
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from ActionToken t where t.token = :token")
    Optional<ActionToken> findByTokenForUpdate(@Param("token") String token);

    // zero when another caller already removed the row
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "delete from action_token where token = :token", nativeQuery = true)
    int deleteByToken(@Param("token") String token);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "delete from action_token where expires_at is not null and expires_at < :now", nativeQuery = true)
    int deleteExpired(@Param("now") OffsetDateTime now);
}
