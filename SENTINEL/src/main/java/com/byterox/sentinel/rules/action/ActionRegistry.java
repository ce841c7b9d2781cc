package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.domain.model.ActionOutcome;
import com.byterox.sentinel.exception.ActionNotSupportedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes an action type to its handler.
 */
@Slf4j
@Component
public class ActionRegistry {

    private final Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);

    public ActionRegistry(List<ActionHandler> handlers) {
        handlers.forEach(handler -> {
            ActionHandler previous = this.handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for action " + handler.type().value());
            }
        });
        log.info("Registered action handlers: {}", this.handlers.keySet());
    }

    /**
     * @return the handler's outcome, or an {@link ActionNotSupportedException} error
     */
    public Mono<ActionOutcome> dispatch(String actionType, ActionContext context) {
        return ActionType.fromValue(actionType)
                .map(handlers::get)
                .map(handler -> Mono.defer(() -> handler.handle(context)))
                .orElseGet(() -> Mono.error(new ActionNotSupportedException(actionType)));
    }
}
