package com.gatehouse.backend.modules.action.application;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.gatehouse.backend.modules.action.domain.ActionTokenType;
import com.gatehouse.backend.modules.action.domain.ActionTypeSet;

import org.springframework.stereotype.Component;

/**
 * Builds the mail sent with an action token. Actions are listed in canonical order.
 */
@Component
public class ActionMessageComposer {

    public ActionMessage compose(int actions, String token, int expiresInHours, String link) {
        List<ActionTokenType> types = ActionTypeSet.toList(actions);

        String subject = types.size() == 1
                ? types.get(0).title()
                : "Required actions: " + types.stream().map(ActionTokenType::title).collect(Collectors.joining(", "));

        String actionList = IntStream.range(0, types.size())
                .mapToObj(index -> (index + 1) + ". " + types.get(index).description())
                .collect(Collectors.joining("\n"));

        String body = """
                Hello,

                You are receiving this message because one or more actions are required on your account.

                %s

                Please use the following link to complete them:
                %s

                This link is valid for %d hours.

                Regards,
                The team""".formatted(actionList, link != null ? link : token, expiresInHours);

        return new ActionMessage(subject, body);
    }
}
