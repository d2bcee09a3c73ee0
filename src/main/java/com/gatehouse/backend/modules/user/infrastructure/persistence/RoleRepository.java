package com.gatehouse.backend.modules.user.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.gatehouse.backend.modules.user.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    List<Role> findByNameIn(Collection<String> names);
}
