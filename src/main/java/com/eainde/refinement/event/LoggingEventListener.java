package com.eainde.refinement.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

/**
 * Writes each event as a single JSON line at INFO.
 */
@Log4j2
public class LoggingEventListener implements RefinementEventListener {

    private final ObjectMapper objectMapper;

    public LoggingEventListener(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void onEvent(RefinementEvent event) {
        log.info("refinement-event {}", toJson(event));
    }

    String toJson(RefinementEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {}: {}", event.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(event);
        }
    }
}
