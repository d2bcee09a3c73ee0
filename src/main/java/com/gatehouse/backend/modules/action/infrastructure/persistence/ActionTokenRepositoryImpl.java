package com.gatehouse.backend.modules.action.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.gatehouse.backend.modules.action.domain.ActionToken;

@Repository
public class ActionTokenRepositoryImpl implements ActionTokenRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<ActionToken> search(ActionTokenSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (condition.requiredActions() != null && condition.requiredActions() != 0) {
            whereClauses.add("(t.type & :requiredActions) = :requiredActions");
            params.put("requiredActions", condition.requiredActions());
        }
        if (StringUtils.hasText(condition.email())) {
            whereClauses.add("lower(t.email) = :email");
            params.put("email", condition.email().trim().toLowerCase(Locale.ROOT));
        }
        if (condition.userId() != null) {
            whereClauses.add("t.user_id = :userId");
            params.put("userId", condition.userId());
        }
        if (StringUtils.hasText(condition.roleName())) {
            whereClauses.add("EXISTS (SELECT 1 FROM action_token_role tr JOIN role r ON r.id = tr.role_id "
                    + "WHERE tr.token = t.token AND r.name = :roleName)");
            params.put("roleName", condition.roleName().trim());
        }

        String whereSql = whereClauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", whereClauses);

        Query countQuery = entityManager.createNativeQuery("SELECT COUNT(*) FROM action_token t" + whereSql);
        params.forEach(countQuery::setParameter);
        Number total = (Number) countQuery.getSingleResult();

        Query dataQuery = entityManager.createNativeQuery(
                "SELECT t.token FROM action_token t" + whereSql
                        + " ORDER BY t.created_at DESC, t.token LIMIT :limit OFFSET :offset");
        params.forEach(dataQuery::setParameter);
        dataQuery.setParameter("limit", pageable.getPageSize());
        dataQuery.setParameter("offset", pageable.getOffset());

        @SuppressWarnings("unchecked")
        List<Object> rawTokens = dataQuery.getResultList();
        List<String> tokens = rawTokens.stream().map(Object::toString).toList();
        if (tokens.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, total.longValue());
        }

        List<ActionToken> found = new ArrayList<>(entityManager.createQuery("""
                        select distinct t
                          from ActionToken t
                          left join fetch t.user
                          left join fetch t.roles
                         where t.token in :tokens
                        """, ActionToken.class)
                .setParameter("tokens", tokens)
                .getResultList());
        found.sort((a, b) -> Integer.compare(tokens.indexOf(a.getToken()), tokens.indexOf(b.getToken())));
        return new PageImpl<>(found, pageable, total.longValue());
    }
}
