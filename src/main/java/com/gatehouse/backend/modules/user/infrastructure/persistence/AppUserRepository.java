package com.gatehouse.backend.modules.user.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.gatehouse.backend.modules.user.domain.AppUser;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @EntityGraph(attributePaths = "roles")
    @Query("select u from AppUser u where lower(u.email) = lower(:email)")
    Optional<AppUser> findByEmailIgnoreCase(@Param("email") String email);

    @EntityGraph(attributePaths = "roles")
    @Query("select u from AppUser u where u.id = :id")
    Optional<AppUser> findByIdWithRoles(@Param("id") UUID id);

    @Query("""
            select case when count(u) > 0 then true else false end
              from AppUser u
             where lower(u.email) = lower(:email)
            """)
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select case when count(u) > 0 then true else false end
              from AppUser u
             where lower(u.username) = lower(:username)
            """)
    boolean existsByUsernameIgnoreCase(@Param("username") String username);
}
