package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.domain.model.ActionOutcome;
import reactor.core.publisher.Mono;

/**
 * Side-effecting half of a rule. The returned Mono completes once the side effect finished;
 * failures surface as an error, usually an {@link com.byterox.sentinel.exception.ActionException}.
 */
public interface ActionHandler {

    ActionType type();

    Mono<ActionOutcome> handle(ActionContext context);
}
