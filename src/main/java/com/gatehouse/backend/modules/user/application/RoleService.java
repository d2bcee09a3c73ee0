package com.gatehouse.backend.modules.user.application;

import java.util.Collection;
import java.util.List;

import com.gatehouse.backend.modules.user.domain.Role;
import com.gatehouse.backend.modules.user.infrastructure.persistence.RoleRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class RoleService {

    private final RoleRepository roleRepository;

    public RoleService(RoleRepository roleRepository) {
        this.roleRepository = roleRepository;
    }

    /**
     * Roles whose name is in {@code names}. Unknown names are simply absent from the result;
     * callers compare sizes to detect them.
     */
    public List<Role> findByNames(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        return roleRepository.findByNameIn(names);
    }
}
