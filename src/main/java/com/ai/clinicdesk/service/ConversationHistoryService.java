package com.ai.clinicdesk.service;

import com.ai.clinicdesk.entity.ConversationTurn;
import com.ai.clinicdesk.platform.Platform;
import com.ai.clinicdesk.repository.ConversationTurnRepository;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
public class ConversationHistoryService {

    private static final int MAX_CONTENT_LENGTH = 4000;

    private final ConversationTurnRepository repository;
    private final Clock clock;
    private final int memoryTurns;

    public ConversationHistoryService(ConversationTurnRepository repository, Clock clock,
                                      @Value("${clinicdesk.memory.turns:6}") int memoryTurns) {
        this.repository = repository;
        this.clock = clock;
        this.memoryTurns = memoryTurns;
    }

    /** Last turns for the user, oldest first, as "user: ..." / "assistant: ..." lines. */
    @Transactional(readOnly = true)
    public List<String> recent(Platform platform, String userId) {
        List<ConversationTurn> turns = repository.findByPlatformAndUserIdOrderByCreatedAtDescIdDesc(
                platform, userId, PageRequest.of(0, memoryTurns));
        List<String> lines = new ArrayList<>(turns.size());
        for (ConversationTurn t : turns) {
            lines.add(t.getRole().name().toLowerCase() + ": " + t.getContent());
        }
        Collections.reverse(lines);
        return lines;
    }

    @Transactional
    public void append(Platform platform, String userId, ConversationTurn.Role role, String content) {
        if (StringUtils.isBlank(content)) return;
        repository.save(ConversationTurn.builder()
                .platform(platform)
                .userId(userId)
                .role(role)
                .content(StringUtils.abbreviate(content, MAX_CONTENT_LENGTH))
                .createdAt(clock.instant())
                .build());
    }
}
