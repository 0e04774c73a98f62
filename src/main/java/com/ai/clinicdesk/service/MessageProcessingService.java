package com.ai.clinicdesk.service;

import com.ai.clinicdesk.component.ClarificationTracker;
import com.ai.clinicdesk.component.SessionLockRegistry;
import com.ai.clinicdesk.conversation.ClassificationContext;
import com.ai.clinicdesk.conversation.ClassificationResult;
import com.ai.clinicdesk.conversation.Intent;
import com.ai.clinicdesk.conversation.PendingClarification;
import com.ai.clinicdesk.conversation.ReplyLanguage;
import com.ai.clinicdesk.dto.BookingTransition;
import com.ai.clinicdesk.dto.EscalationContext;
import com.ai.clinicdesk.dto.InboundMessage;
import com.ai.clinicdesk.dto.ProcessingOutcome;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.dto.RoutingDecision;
import com.ai.clinicdesk.entity.BookingSession;
import com.ai.clinicdesk.entity.ConversationTurn;
import com.ai.clinicdesk.exception.PersistenceFailureException;
import com.ai.clinicdesk.llm.LlmCapability;
import com.ai.clinicdesk.llm.LlmResult;
import com.ai.clinicdesk.platform.Platform;
import com.ai.clinicdesk.utils.UserIdMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single entry for every inbound message, whatever the platform:
 * dedup, rate limit, then classify, route and answer under the per-user lock.
 * The LLM never drives booking; it only classifies what rules could not and writes escalated replies.
 */
@Service
public class MessageProcessingService {

    private static final Logger log = LoggerFactory.getLogger(MessageProcessingService.class);

    private final DeduplicationGate deduplicationGate;
    private final MessageRateLimiter rateLimiter;
    private final SessionLockRegistry locks;
    private final ReferenceDataProvider referenceData;
    private final IntentClassifier classifier;
    private final MessageRouter router;
    private final ClarificationTracker clarifications;
    private final BookingService bookingService;
    private final ConversationHistoryService historyService;
    private final LlmCapability llm;
    private final ReplyFormatter formatter;

    public MessageProcessingService(DeduplicationGate deduplicationGate,
                                    MessageRateLimiter rateLimiter,
                                    SessionLockRegistry locks,
                                    ReferenceDataProvider referenceData,
                                    IntentClassifier classifier,
                                    MessageRouter router,
                                    ClarificationTracker clarifications,
                                    BookingService bookingService,
                                    ConversationHistoryService historyService,
                                    LlmCapability llm,
                                    ReplyFormatter formatter) {
        this.deduplicationGate = deduplicationGate;
        this.rateLimiter = rateLimiter;
        this.locks = locks;
        this.referenceData = referenceData;
        this.classifier = classifier;
        this.router = router;
        this.clarifications = clarifications;
        this.bookingService = bookingService;
        this.historyService = historyService;
        this.llm = llm;
        this.formatter = formatter;
    }

    public ProcessingOutcome process(InboundMessage message) {
        Platform platform = message.platform();
        String user = message.senderId();

        if (!deduplicationGate.firstDelivery(platform, message.platformMessageId())) {
            log.info("[{}:{}] duplicate message {} dropped", platform, UserIdMasker.mask(user), message.platformMessageId());
            return ProcessingOutcome.duplicate();
        }

        switch (rateLimiter.check(platform, user)) {
            case THROTTLED_NOTIFY:
                log.warn("[{}:{}] rate limited, notice sent", platform, UserIdMasker.mask(user));
                return ProcessingOutcome.rateLimited(
                        formatter.throttleNotice(ReplyLanguage.detect(message.text(), ReplyLanguage.ENGLISH)));
            case THROTTLED_SILENT:
                log.debug("[{}:{}] rate limited, silent", platform, UserIdMasker.mask(user));
                return ProcessingOutcome.rateLimited(null);
            default:
                break;
        }

        return locks.withLock(platform, user, () -> handle(message));
    }

    private ProcessingOutcome handle(InboundMessage message) {
        Platform platform = message.platform();
        String user = message.senderId();
        String text = message.text();
        String reply;
        ReplyLanguage language = ReplyLanguage.detect(text, ReplyLanguage.ENGLISH);
        try {
            ReferenceSnapshot snapshot = referenceData.current().orElse(null);
            List<String> history = historyService.recent(platform, user);
            // a reply with no letters (a phone number, an option number) keeps the conversation's language
            language = ReplyLanguage.detect(text, ReplyLanguage.fromHistory(history));
            BookingSession session = bookingService.findActive(platform, user).orElse(null);
            PendingClarification pending = session == null ? clarifications.pending(platform, user).orElse(null) : null;

            ClassificationContext context = new ClassificationContext(snapshot, history, pending,
                    session == null ? null : session.getStep());
            ClassificationResult result = classifier.classify(text, context);
            if (result.getIntent() == Intent.CLARIFICATION_ANSWER && pending != null) {
                result = result.resume(pending.intent(), pending.entities());
            }

            RoutingDecision decision = router.route(result, snapshot, session, pending);
            log.info("[{}:{}] intent={} confidence={} source={} decision={}", platform, UserIdMasker.mask(user),
                    result.getIntent(), result.getConfidence(), result.getSource(), decision.getType());

            reply = answer(message, result, decision, snapshot, session, history, language);
        } catch (PersistenceFailureException | DataAccessException e) {
            log.error("[{}:{}] persistence failure, replying with apology", platform, UserIdMasker.mask(user), e);
            reply = formatter.apology(language);
        }

        record(platform, user, ConversationTurn.Role.USER, text);
        record(platform, user, ConversationTurn.Role.ASSISTANT, reply);
        return ProcessingOutcome.reply(reply);
    }

    private String answer(InboundMessage message, ClassificationResult result, RoutingDecision decision,
                          ReferenceSnapshot snapshot, BookingSession session, List<String> history,
                          ReplyLanguage language) {
        Platform platform = message.platform();
        String user = message.senderId();

        switch (decision.getType()) {
            case BOOKING: {
                clarifications.clear(platform, user);
                if (session == null) {
                    BookingTransition started = bookingService.start(platform, user, result);
                    return formatter.formatBooking(started, null, snapshot, language);
                }
                BookingTransition transition = bookingService.advance(session, message.text(), snapshot);
                return formatter.formatBooking(transition, session.getReservationCode(), snapshot, language);
            }
            case DIRECT:
                clarifications.clear(platform, user);
                return formatter.format(decision, snapshot, language);
            case CLARIFY:
                int attempts = clarifications.register(platform, user, result, decision.getMissingField(), decision.getOptions());
                log.debug("[{}:{}] clarifying {} (attempt {})", platform, UserIdMasker.mask(user),
                        decision.getMissingField(), attempts);
                return formatter.format(decision, snapshot, language);
            case ESCALATE:
            default: {
                clarifications.clear(platform, user);
                EscalationContext context = decision.getEscalation().withConversation(
                        message.text(), history, snapshot == null ? null : snapshot.describe());
                LlmResult<String> generated = llm.generate(context);
                if (!generated.isSuccess()) {
                    log.warn("[{}:{}] escalation failed: {} {}", platform, UserIdMasker.mask(user),
                            generated.getFailure(), generated.getDetail());
                }
                return formatter.escalated(generated, language);
            }
        }
    }

    private void record(Platform platform, String user, ConversationTurn.Role role, String content) {
        try {
            historyService.append(platform, user, role, content);
        } catch (DataAccessException e) {
            log.warn("Failed to persist conversation turn for {}:{}", platform, UserIdMasker.mask(user), e);
        }
    }
}
