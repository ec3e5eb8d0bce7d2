package com.securepower.antitheft.infrastructure.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securepower.antitheft.domain.alert.AlertType;
import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.domain.alert.NotificationOutcome;
import com.securepower.antitheft.domain.alert.SecurityEvent;
import com.securepower.antitheft.domain.ports.SecurityEventRepository;
import com.securepower.antitheft.domain.tracking.LocationPoint;
import com.securepower.antitheft.infrastructure.jpa.NotificationOutcomeEmbeddable;
import com.securepower.antitheft.infrastructure.jpa.SecurityEventEntity;
import com.securepower.antitheft.infrastructure.jpa.SpringSecurityEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.fromColumn;
import static com.securepower.antitheft.infrastructure.jpa.TimeColumns.toColumn;

@Component
public class JpaSecurityEventRepositoryAdapter implements SecurityEventRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaSecurityEventRepositoryAdapter.class);
    private static final TypeReference<Map<String, String>> DETAILS_TYPE = new TypeReference<>() {};

    private final SpringSecurityEventRepository events;
    private final ObjectMapper objectMapper;

    public JpaSecurityEventRepositoryAdapter(SpringSecurityEventRepository events, ObjectMapper objectMapper) {
        this.events = events;
        this.objectMapper = objectMapper;
    }

    @Override
    public SecurityEvent saveIfAbsent(SecurityEvent event) {
        Optional<SecurityEventEntity> existing = events.findById(event.getEventId());
        if (existing.isPresent()) {
            log.info("Security event {} already stored", event.getEventId());
            return toDomain(existing.get());
        }
        try {
            events.saveAndFlush(toEntity(event));
            return event;
        } catch (DataIntegrityViolationException e) {
            // lost an insert race against a redelivery of the same event
            log.info("Security event {} stored concurrently - loading existing row", event.getEventId());
            return events.findById(event.getEventId()).map(this::toDomain).orElseThrow(() -> e);
        }
    }

    @Override
    public Optional<SecurityEvent> findById(UUID eventId) {
        return events.findById(eventId).map(this::toDomain);
    }

    @Override
    @Transactional
    public void save(SecurityEvent event) {
        events.save(toEntity(event));
    }

    @Override
    public List<SecurityEvent> findByDevice(String deviceId) {
        return events.findByDeviceIdOrderByOccurredAtDesc(deviceId).stream()
                .map(this::toDomain)
                .toList();
    }

    private SecurityEventEntity toEntity(SecurityEvent event) {
        SecurityEventEntity e = new SecurityEventEntity();
        e.setEventId(event.getEventId());
        e.setDeviceId(event.getDeviceId());
        e.setUserId(event.getUserId());
        e.setAlertType(event.getType().name());
        e.setOccurredAt(toColumn(event.getTimestamp()));
        e.setDetailsJson(writeJson(event.getDetails()));
        e.setLocationJson(event.getLocation().map(this::writeJson).orElse(null));
        e.setSessionId(event.getSessionId().orElse(null));
        e.setProcessed(event.isProcessed());
        e.setProcessedAt(toColumn(event.getProcessedAt()));
        e.setProcessingError(event.getProcessingError());

        List<NotificationOutcomeEmbeddable> outcomes = new ArrayList<>();
        for (NotificationOutcome o : event.getOutcomes()) {
            NotificationOutcomeEmbeddable row = new NotificationOutcomeEmbeddable();
            row.setChannel(o.channel().name());
            row.setSent(o.sent());
            row.setSentAt(toColumn(o.sentAt()));
            row.setSkippedReason(o.skippedReason());
            row.setError(o.error());
            outcomes.add(row);
        }
        e.setOutcomes(outcomes);
        return e;
    }

    private SecurityEvent toDomain(SecurityEventEntity e) {
        List<NotificationOutcome> outcomes = e.getOutcomes().stream()
                .map(row -> new NotificationOutcome(
                        ChannelType.valueOf(row.getChannel()),
                        row.isSent(),
                        fromColumn(row.getSentAt()),
                        row.getSkippedReason(),
                        row.getError()))
                .toList();

        return new SecurityEvent(
                e.getEventId(),
                e.getDeviceId(),
                e.getUserId(),
                AlertType.valueOf(e.getAlertType()),
                fromColumn(e.getOccurredAt()),
                readJson(e.getDetailsJson(), DETAILS_TYPE),
                e.getLocationJson() != null ? readJson(e.getLocationJson(), new TypeReference<LocationPoint>() {}) : null,
                e.getSessionId(),
                e.isProcessed(),
                fromColumn(e.getProcessedAt()),
                e.getProcessingError(),
                outcomes);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize security event payload", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read security event payload", e);
        }
    }
}
