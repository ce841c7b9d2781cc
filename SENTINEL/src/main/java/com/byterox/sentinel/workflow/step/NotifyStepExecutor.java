package com.byterox.sentinel.workflow.step;

import com.byterox.sentinel.domain.model.NotificationChannel;
import com.byterox.sentinel.domain.model.NotificationStatus;
import com.byterox.sentinel.domain.model.StepType;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.notification.NotificationDispatcher;
import com.byterox.sentinel.rules.RuleValidator;
import com.byterox.sentinel.workflow.ExecutionScope;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends one notification rendered from the context merged with {@code config.data}.
 * Anything but a delivered notification fails the step.
 */
@Component
public class NotifyStepExecutor implements StepExecutor {

    private final NotificationDispatcher dispatcher;

    public NotifyStepExecutor(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public StepType type() {
        return StepType.NOTIFY;
    }

    @Override
    public void validate(WorkflowStep step, String path, List<String> errors) {
        Map<String, Object> config = step.getConfig();
        if (RuleValidator.isBlank(stringOf(config.get("type")))) {
            errors.add(path + ".config.type is required");
        }
        String channel = stringOf(config.get("channel"));
        if (RuleValidator.isBlank(channel)) {
            errors.add(path + ".config.channel is required");
        } else if (NotificationChannel.fromValue(channel).isEmpty()) {
            errors.add(path + ".config.channel '" + channel + "' is not a known channel");
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<StepResult> execute(WorkflowStep step, Map<String, Object> context, ExecutionScope scope) {
        Map<String, Object> config = step.getConfig();
        Map<String, Object> data = new HashMap<>(context);
        if (config.get("data") instanceof Map<?, ?> extra) {
            data.putAll((Map<String, Object>) extra);
        }
        Map<String, Object> options = config.get("options") instanceof Map<?, ?> map
                ? (Map<String, Object>) map : Map.of();

        return dispatcher.send(stringOf(config.get("type")), stringOf(config.get("channel")), data, options)
                .map(notification -> {
                    if (notification.getStatus() != NotificationStatus.SENT) {
                        return StepResult.failure("Notification " + notification.getId() + " failed: "
                                + notification.getError());
                    }
                    Map<String, Object> output = new HashMap<>();
                    output.put("notification_sent", true);
                    output.put("notification_id", notification.getId());
                    return StepResult.success(output);
                })
                .onErrorResume(error -> Mono.just(StepResult.failure(error.getMessage())));
    }

    private static String stringOf(Object value) {
        return value != null ? value.toString() : null;
    }
}
