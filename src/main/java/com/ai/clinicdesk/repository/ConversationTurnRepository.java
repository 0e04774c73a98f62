package com.ai.clinicdesk.repository;

import com.ai.clinicdesk.entity.ConversationTurn;
import com.ai.clinicdesk.platform.Platform;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, Long> {

    List<ConversationTurn> findByPlatformAndUserIdOrderByCreatedAtDescIdDesc(Platform platform, String userId, Pageable pageable);
}
