package com.securepower.antitheft.infrastructure.adapters;

import com.securepower.antitheft.domain.alert.ChannelType;
import com.securepower.antitheft.domain.ports.ChannelSendLogRepository;
import com.securepower.antitheft.infrastructure.jpa.ChannelSendLogEntity;
import com.securepower.antitheft.infrastructure.jpa.SpringChannelSendLogRepository;
import com.securepower.antitheft.infrastructure.jpa.TimeColumns;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Component
public class JpaChannelSendLogRepositoryAdapter implements ChannelSendLogRepository {
    private final SpringChannelSendLogRepository sendLog;

    public JpaChannelSendLogRepositoryAdapter(SpringChannelSendLogRepository sendLog) {
        this.sendLog = sendLog;
    }

    @Override
    public Optional<Instant> lastSentAt(String userId, ChannelType channel) {
        return sendLog.findById(ChannelSendLogEntity.idFor(userId, channel.name()))
                .map(e -> TimeColumns.fromColumn(e.getLastSentAt()));
    }

    @Override
    @Transactional
    public void recordSent(String userId, ChannelType channel, Instant sentAt) {
        ChannelSendLogEntity e = new ChannelSendLogEntity();
        e.setId(ChannelSendLogEntity.idFor(userId, channel.name()));
        e.setUserId(userId);
        e.setChannel(channel.name());
        e.setLastSentAt(TimeColumns.toColumn(sentAt));
        sendLog.save(e);
    }

    @Override
    @Transactional
    public void clear(String userId, ChannelType channel) {
        sendLog.deleteById(ChannelSendLogEntity.idFor(userId, channel.name()));
    }
}
