package com.netcourier.rag.service.ingestion.statemachine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineContext;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.statemachine.support.DefaultStateMachineContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Applies one event to a persisted version state. The machine is rebuilt from the stored state on every
 * call, so no machine instance outlives a transition.
 */
@Component
public class IngestionStateTransitions {

    private static final Logger log = LoggerFactory.getLogger(IngestionStateTransitions.class);

    private final StateMachineFactory<IngestionStates, IngestionEvents> stateMachineFactory;

    public IngestionStateTransitions(StateMachineFactory<IngestionStates, IngestionEvents> stateMachineFactory) {
        this.stateMachineFactory = stateMachineFactory;
    }

    public IngestionStates apply(String machineId, IngestionStates current, IngestionEvents event) {
        StateMachine<IngestionStates, IngestionEvents> machine = stateMachineFactory.getStateMachine(machineId);
        machine.getStateMachineAccessor().doWithAllRegions(access -> {
            StateMachineContext<IngestionStates, IngestionEvents> context =
                    new DefaultStateMachineContext<>(current, null, null, null);
            access.resetStateMachine(context);
        });
        machine.startReactively().block();
        try {
            List<StateMachineEventResult<IngestionStates, IngestionEvents>> results = machine
                    .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
                    .collectList()
                    .block();
            boolean accepted = results != null && results.stream()
                    .anyMatch(result -> result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED);
            if (!accepted) {
                throw new IllegalStateException("Event " + event + " not allowed in state " + current);
            }
            IngestionStates next = machine.getState().getId();
            log.debug("{}: {} -[{}]-> {}", machineId, current, event, next);
            return next;
        } finally {
            machine.stopReactively().block();
        }
    }
}
