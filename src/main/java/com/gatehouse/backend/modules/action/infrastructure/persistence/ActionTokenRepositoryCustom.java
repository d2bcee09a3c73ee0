package com.gatehouse.backend.modules.action.infrastructure.persistence;

import com.gatehouse.backend.modules.action.domain.ActionToken;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface ActionTokenRepositoryCustom {

    Page<ActionToken> search(ActionTokenSearchCondition condition, Pageable pageable);
}
