package com.netcourier.rag.service.ingestion.statemachine;

import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

import java.util.EnumSet;

/**
 * Lifecycle of one document version, from the object-created event to a fully indexed set of chunks.
 */
@Configuration
@EnableStateMachineFactory
public class IngestionStateMachineConfig extends EnumStateMachineConfigurerAdapter<IngestionStates, IngestionEvents> {

    @Override
    public void configure(StateMachineStateConfigurer<IngestionStates, IngestionEvents> states) throws Exception {
        states.withStates()
                .initial(IngestionStates.RECEIVED)
                .states(EnumSet.allOf(IngestionStates.class));
    }

    @Override
    public void configure(StateMachineTransitionConfigurer<IngestionStates, IngestionEvents> transitions) throws Exception {
        transitions
                .withExternal()
                    .source(IngestionStates.RECEIVED)
                    .target(IngestionStates.CHUNKED)
                    .event(IngestionEvents.CHUNK)
                .and()
                .withExternal()
                    .source(IngestionStates.CHUNKED)
                    .target(IngestionStates.QUEUED)
                    .event(IngestionEvents.ENQUEUE)
                .and()
                .withExternal()
                    .source(IngestionStates.QUEUED)
                    .target(IngestionStates.EMBEDDING)
                    .event(IngestionEvents.EMBED)
                .and()
                .withExternal()
                    .source(IngestionStates.EMBEDDING)
                    .target(IngestionStates.INDEXED)
                    .event(IngestionEvents.COMPLETE)
                .and()
                .withExternal()
                    .source(IngestionStates.CHUNKED)
                    .target(IngestionStates.FAILED)
                    .event(IngestionEvents.FAIL)
                .and()
                .withExternal()
                    .source(IngestionStates.QUEUED)
                    .target(IngestionStates.FAILED)
                    .event(IngestionEvents.FAIL)
                .and()
                .withExternal()
                    .source(IngestionStates.EMBEDDING)
                    .target(IngestionStates.FAILED)
                    .event(IngestionEvents.FAIL)
                .and()
                .withExternal()
                    .source(IngestionStates.FAILED)
                    .target(IngestionStates.QUEUED)
                    .event(IngestionEvents.RETRY);
    }
}
