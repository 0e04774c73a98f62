package com.ai.clinicdesk.service;

import com.ai.clinicdesk.component.DateParser;
import com.ai.clinicdesk.component.ReferenceMatcher;
import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.conversation.ClassificationContext;
import com.ai.clinicdesk.conversation.ClassificationResult;
import com.ai.clinicdesk.conversation.ClassificationResult.Source;
import com.ai.clinicdesk.conversation.Confidence;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.EntityValue;
import com.ai.clinicdesk.conversation.GreetingKind;
import com.ai.clinicdesk.conversation.InfoTopic;
import com.ai.clinicdesk.conversation.Intent;
import com.ai.clinicdesk.conversation.IntentRequirements;
import com.ai.clinicdesk.conversation.PendingClarification;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.llm.LlmCapability;
import com.ai.clinicdesk.llm.LlmClassification;
import com.ai.clinicdesk.llm.LlmResult;
import com.ai.clinicdesk.utils.PhoneNormalizer;
import com.ai.clinicdesk.utils.TextNormalizer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Intent and entity classifier. Keyword rules and fuzzy reference matching run first; the LLM
 * is asked only when no rule matched, so a deterministic match always wins and the two are
 * never merged. LLM failures degrade to {@link Intent#UNKNOWN} with {@link Confidence#LOW}.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private static final List<String> HELLO = List.of(
            "hi", "hello", "hey", "good morning", "good evening", "salam", "السلام عليكم", "سلام",
            "مرحبا", "اهلا", "هلا", "صباح الخير", "مساء الخير");
    private static final List<String> THANKS = List.of(
            "thanks", "thank you", "thx", "شكرا", "مشكور", "يعطيك العافيه");
    private static final List<String> GOODBYE = List.of(
            "bye", "goodbye", "see you", "مع السلامه", "باي");

    private static final List<String> BOOKING = List.of(
            "book", "booking", "appointment", "reserve", "reservation", "احجز", "حجز", "موعد", "ابي موعد", "ابغى موعد");
    private static final List<String> AVAILABILITY = List.of(
            "available", "availability", "in today", "in tomorrow", "there today", "there tomorrow", "working today",
            "working tomorrow", "on duty",
            "موجود", "موجوده", "متواجد", "متاح", "متاحه", "يداوم", "دوام الدكتور");
    private static final List<String> PRICE = List.of(
            "price", "prices", "cost", "how much", "fee", "fees", "charge", "سعر", "اسعار", "بكم", "كم سعر",
            "تكلفه", "كم يكلف");

    private static final Map<InfoTopic, List<String>> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put(InfoTopic.HOURS, List.of(
                "hours", "opening hours", "working hours", "open", "close", "closing", "timings",
                "ساعات", "الدوام", "متى تفتحون", "اوقات العمل"));
        TOPICS.put(InfoTopic.CONTACT, List.of(
                "contact", "phone number", "call you", "email", "تواصل", "رقمكم", "ايميل", "الايميل"));
        TOPICS.put(InfoTopic.BRANCH, List.of(
                "branch", "branches", "location", "locations", "address", "where are you", "map",
                "فرع", "فروع", "الفروع", "موقع", "الموقع", "عنوان", "العنوان", "وين"));
        TOPICS.put(InfoTopic.SERVICE, List.of(
                "services", "what do you offer", "treatments", "خدمات", "الخدمات", "العلاجات"));
        TOPICS.put(InfoTopic.DOCTOR, List.of(
                "doctors", "which doctors", "specialists", "الدكاتره", "الاطباء", "دكاتره", "اطباء"));
    }

    private static final Pattern DR_ABBREVIATION = Pattern.compile("(?i)\\bdr\\.?\\s+(\\p{L}[\\p{L}'-]+)");
    private static final Pattern DOCTOR_CAPITALIZED = Pattern.compile("\\b[Dd]octor\\s+(\\p{Lu}[\\p{L}'-]+)");
    private static final Pattern DOCTOR_ARABIC = Pattern.compile("(?:الدكتوره|الدكتور|دكتوره|دكتور|د\\.)\\s*(\\p{L}{2,})");
    private static final Pattern BRANCH_NAMED = Pattern.compile("(\\p{L}{3,})\\s+branch\\b|فرع\\s+(\\p{L}{2,})");
    private static final Set<String> NOT_A_NAME = Set.of(
            "the", "which", "your", "nearest", "any", "each", "every", "all", "one", "main", "closest",
            "موجود", "متواجد", "اليوم", "بكرا", "متاح", "يداوم", "الاقرب", "اي", "كل");

    private static final int MAX_CLARIFICATION_ANSWER_WORDS = 6;

    private final ReferenceMatcher matcher;
    private final DateParser dateParser;
    private final LlmCapability llm;
    private final Cache<String, LlmClassification> llmCache;

    public IntentClassifier(ReferenceMatcher matcher, DateParser dateParser, LlmCapability llm,
                            @Value("${clinicdesk.classifier.llm-cache-ttl:5m}") Duration cacheTtl) {
        this.matcher = matcher;
        this.dateParser = dateParser;
        this.llm = llm;
        this.llmCache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(800)
                .build();
    }

    public ClassificationResult classify(String text, ClassificationContext context) {
        String normalized = TextNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return ClassificationResult.unknown(Source.RULES);
        }
        ReferenceSnapshot snapshot = context.snapshot();

        Map<Intent, Integer> scores = score(normalized);
        PendingClarification pending = context.pendingClarification();
        if (pending != null) {
            Optional<ClassificationResult> answer = clarificationAnswer(text, normalized, pending, snapshot);
            if (answer.isPresent() && isAnswerTo(answer.get(), best(scores), pending)) {
                return answer.get();
            }
        }

        Map<EntityType, EntityValue> entities = extractEntities(text, normalized, snapshot);
        Optional<ClassificationResult> rules = byRules(normalized, scores, entities);
        if (rules.isPresent()) {
            log.debug("Classified by rules: {}", rules.get());
            return rules.get();
        }
        BookingStep step = context.pendingStep();
        if (step != null && !step.isTerminal()) {
            // an open booking step takes the raw value, no model call needed
            return new ClassificationResult(Intent.BOOKING_REQUEST, entities, Confidence.MEDIUM, Source.RULES, false);
        }
        return byLlm(text, normalized, context, snapshot);
    }

    private Map<Intent, Integer> score(String normalized) {
        Map<Intent, Integer> scores = new EnumMap<>(Intent.class);
        put(scores, Intent.BOOKING_REQUEST, TextNormalizer.countMatches(normalized, BOOKING));
        put(scores, Intent.AVAILABILITY_QUERY, TextNormalizer.countMatches(normalized, AVAILABILITY));
        put(scores, Intent.PRICE_QUERY, TextNormalizer.countMatches(normalized, PRICE));
        int info = 0;
        for (List<String> phrases : TOPICS.values()) {
            info += TextNormalizer.countMatches(normalized, phrases);
        }
        put(scores, Intent.INFO_QUERY, info);
        return scores;
    }

    private static void put(Map<Intent, Integer> scores, Intent intent, int hits) {
        if (hits > 0) scores.put(intent, hits * 2);
    }

    private Optional<ClassificationResult> byRules(String normalized, Map<Intent, Integer> scores,
                                                   Map<EntityType, EntityValue> entities) {
        Intent intent = best(scores);
        boolean explicit = intent != null;

        if (intent == Intent.INFO_QUERY) {
            InfoTopic topic = topic(normalized);
            if (topic == InfoTopic.HOURS && entities.containsKey(EntityType.DOCTOR)) {
                intent = Intent.AVAILABILITY_QUERY;
            } else if (topic != null) {
                entities.put(EntityType.TOPIC, EntityValue.text(topic.name()));
            }
        }

        if (intent == null) {
            GreetingKind greeting = greeting(normalized);
            if (greeting != null) {
                entities.put(EntityType.TOPIC, EntityValue.text(greeting.name()));
                return Optional.of(new ClassificationResult(Intent.GREETING, entities, Confidence.HIGH, Source.RULES, true));
            }
            InfoTopic inferred = inferTopicFromMention(entities);
            if (inferred == null) return Optional.empty();
            intent = Intent.INFO_QUERY;
            entities.put(EntityType.TOPIC, EntityValue.text(inferred.name()));
        }

        Confidence confidence = allRequiredResolved(intent, entities) ? Confidence.HIGH : Confidence.MEDIUM;
        return Optional.of(new ClassificationResult(intent, entities, confidence, Source.RULES, explicit));
    }

    private static Intent best(Map<Intent, Integer> scores) {
        Intent best = null;
        int bestScore = 0;
        // EnumMap iterates in declaration order, which doubles as the tie-break priority
        for (Map.Entry<Intent, Integer> e : scores.entrySet()) {
            if (e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }
        return best;
    }

    private static InfoTopic topic(String normalized) {
        InfoTopic best = null;
        int bestHits = 0;
        for (Map.Entry<InfoTopic, List<String>> e : TOPICS.entrySet()) {
            int hits = TextNormalizer.countMatches(normalized, e.getValue());
            if (hits > bestHits) {
                best = e.getKey();
                bestHits = hits;
            }
        }
        return best;
    }

    private static GreetingKind greeting(String normalized) {
        if (TextNormalizer.tokens(normalized).size() > 8) return null;
        if (TextNormalizer.containsAny(normalized, GOODBYE)) return GreetingKind.GOODBYE;
        if (TextNormalizer.containsAny(normalized, THANKS)) return GreetingKind.THANKS;
        if (TextNormalizer.containsAny(normalized, HELLO)) return GreetingKind.HELLO;
        return null;
    }

    /** A bare full-name mention ("Teeth Whitening", "Dr. Sarah Al-Harbi") reads as a question about it. */
    private static InfoTopic inferTopicFromMention(Map<EntityType, EntityValue> entities) {
        if (isResolved(entities, EntityType.DOCTOR)) return InfoTopic.DOCTOR;
        if (isResolved(entities, EntityType.SERVICE)) return InfoTopic.SERVICE;
        if (isResolved(entities, EntityType.BRANCH)) return InfoTopic.BRANCH;
        return null;
    }

    private static boolean isResolved(Map<EntityType, EntityValue> entities, EntityType type) {
        EntityValue v = entities.get(type);
        return v != null && v.isResolved();
    }

    private static boolean allRequiredResolved(Intent intent, Map<EntityType, EntityValue> entities) {
        for (EntityType type : IntentRequirements.required(intent)) {
            if (!isResolved(entities, type)) return false;
        }
        return true;
    }

    private Optional<ClassificationResult> clarificationAnswer(String text, String normalized,
                                                               PendingClarification pending,
                                                               ReferenceSnapshot snapshot) {
        EntityType field = pending.field();
        EntityValue value = null;

        String byNumber = ReferenceMatcher.byNumber(normalized, pending.optionIds());
        if (byNumber != null) {
            value = field == EntityType.TOPIC ? EntityValue.text(byNumber) : EntityValue.reference(text, byNumber);
        } else if (field.isReference() && snapshot != null) {
            Map<String, String> names = namesFor(field, snapshot);
            Map<String, String> offered = new LinkedHashMap<>();
            for (String id : pending.optionIds()) {
                if (names.containsKey(id)) offered.put(id, names.get(id));
            }
            ReferenceMatcher.Match m = matcher.match(normalized, offered.isEmpty() ? names : offered);
            if (m.isEmpty() && !offered.isEmpty()) m = matcher.match(normalized, names);
            value = toEntity(text, m);
        } else if (field == EntityType.TOPIC) {
            InfoTopic topic = topic(normalized);
            if (topic != null) value = EntityValue.text(topic.name());
        } else if (field == EntityType.DATE) {
            value = dateParser.parseDate(normalized).map(d -> EntityValue.date(text, d)).orElse(null);
        }

        if (value == null && TextNormalizer.tokens(normalized).size() > MAX_CLARIFICATION_ANSWER_WORDS) {
            return Optional.empty();
        }
        if (value == null) {
            value = EntityValue.unresolved(text);
        }
        Map<EntityType, EntityValue> entities = new EnumMap<>(EntityType.class);
        entities.put(field, value);
        Confidence confidence = value.isResolved() ? Confidence.HIGH : Confidence.MEDIUM;
        return Optional.of(new ClassificationResult(Intent.CLARIFICATION_ANSWER, entities, confidence, Source.RULES, false));
    }

    /**
     * A resolved answer wins unless the message clearly asks something else; an unresolved one
     * only counts when no intent keyword matched at all.
     */
    private static boolean isAnswerTo(ClassificationResult answer, Intent keywordIntent, PendingClarification pending) {
        if (answer.getEntities().values().stream().allMatch(EntityValue::isResolved)) {
            return keywordIntent == null || keywordIntent == pending.intent() || keywordIntent == Intent.INFO_QUERY;
        }
        return keywordIntent == null;
    }

    Map<EntityType, EntityValue> extractEntities(String text, String normalized, ReferenceSnapshot snapshot) {
        Map<EntityType, EntityValue> entities = new EnumMap<>(EntityType.class);

        if (snapshot != null) {
            ReferenceMatcher.Match doctor = matcher.match(normalized, snapshot.doctorNames());
            if (!doctor.isEmpty()) entities.put(EntityType.DOCTOR, toEntity(text, doctor));
            ReferenceMatcher.Match service = matcher.match(normalized, snapshot.serviceNames());
            if (!service.isEmpty()) entities.put(EntityType.SERVICE, toEntity(text, service));
            ReferenceMatcher.Match branch = matcher.match(normalized, snapshot.branchNames());
            if (!branch.isEmpty()) entities.put(EntityType.BRANCH, toEntity(text, branch));
        }
        if (!entities.containsKey(EntityType.DOCTOR)) {
            doctorMention(text, normalized).ifPresent(raw -> entities.put(EntityType.DOCTOR, EntityValue.unresolved(raw)));
        }
        if (!entities.containsKey(EntityType.BRANCH)) {
            branchMention(normalized).ifPresent(raw -> entities.put(EntityType.BRANCH, EntityValue.unresolved(raw)));
        }

        Optional<LocalDate> date = dateParser.parseDate(normalized);
        if (date.isPresent()) {
            entities.put(EntityType.DATE, EntityValue.date(text, date.get()));
        } else if (dateParser.mentionsDate(normalized)) {
            entities.put(EntityType.DATE, EntityValue.unreadableDate(text));
        }
        dateParser.parseTime(normalized).ifPresent(t -> entities.put(EntityType.TIME, EntityValue.text(t.toString())));
        PhoneNormalizer.extract(normalized).ifPresent(p -> entities.put(EntityType.PHONE, EntityValue.text(p)));
        return entities;
    }

    private static EntityValue toEntity(String raw, ReferenceMatcher.Match match) {
        if (match.isResolved()) return EntityValue.reference(raw, match.id());
        if (match.isAmbiguous()) return EntityValue.ambiguous(raw, match.ids());
        return EntityValue.unresolved(raw);
    }

    private static Optional<String> doctorMention(String raw, String normalized) {
        for (Matcher m : List.of(DR_ABBREVIATION.matcher(raw), DOCTOR_CAPITALIZED.matcher(raw), DOCTOR_ARABIC.matcher(normalized))) {
            while (m.find()) {
                String name = m.group(1).toLowerCase();
                if (!NOT_A_NAME.contains(name)) return Optional.of(m.group());
            }
        }
        return Optional.empty();
    }

    private static Optional<String> branchMention(String normalized) {
        Matcher m = BRANCH_NAMED.matcher(normalized);
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            if (!NOT_A_NAME.contains(name)) return Optional.of(m.group());
        }
        return Optional.empty();
    }

    private static Map<String, String> namesFor(EntityType type, ReferenceSnapshot snapshot) {
        switch (type) {
            case DOCTOR:
                return snapshot.doctorNames();
            case SERVICE:
                return snapshot.serviceNames();
            case BRANCH:
                return snapshot.branchNames();
            default:
                return Map.of();
        }
    }

    private ClassificationResult byLlm(String text, String normalized, ClassificationContext context,
                                       ReferenceSnapshot snapshot) {
        LlmClassification cached = llmCache.getIfPresent(normalized);
        LlmClassification classification;
        if (cached != null) {
            classification = cached;
        } else {
            LlmResult<LlmClassification> result = llm.classify(text, context.recentTurns());
            if (!result.isSuccess()) {
                log.warn("LLM classification unavailable ({}), falling back to UNKNOWN", result.getFailure());
                return ClassificationResult.unknown(Source.FALLBACK);
            }
            classification = result.getValue();
            llmCache.put(normalized, classification);
        }
        ClassificationResult grounded = ground(text, classification, snapshot);
        log.debug("Classified by LLM: {}", grounded);
        return grounded;
    }

    /**
     * Maps raw LLM entity mentions onto reference ids and typed values.
     */
    ClassificationResult ground(String text, LlmClassification c, ReferenceSnapshot snapshot) {
        Map<EntityType, EntityValue> entities = new EnumMap<>(EntityType.class);
        for (Map.Entry<EntityType, String> e : c.entities().entrySet()) {
            String raw = e.getValue();
            switch (e.getKey()) {
                case DOCTOR:
                case SERVICE:
                case BRANCH:
                    entities.put(e.getKey(), snapshot == null
                            ? EntityValue.unresolved(raw)
                            : toEntity(raw, matcher.match(raw, namesFor(e.getKey(), snapshot))));
                    break;
                case DATE:
                    Optional<LocalDate> date = dateParser.parseDate(raw);
                    entities.put(EntityType.DATE, date.map(d -> EntityValue.date(raw, d))
                            .orElseGet(() -> EntityValue.unreadableDate(raw)));
                    break;
                case TIME:
                    dateParser.parseTime(raw).ifPresent(t -> entities.put(EntityType.TIME, EntityValue.text(t.toString())));
                    break;
                case PHONE:
                    PhoneNormalizer.normalize(raw).ifPresent(p -> entities.put(EntityType.PHONE, EntityValue.text(p)));
                    break;
                case TOPIC:
                    try {
                        entities.put(EntityType.TOPIC, EntityValue.text(InfoTopic.valueOf(raw.trim().toUpperCase()).name()));
                    } catch (IllegalArgumentException ignored) {
                        log.debug("Dropping unknown topic from LLM: {}", raw);
                    }
                    break;
                default:
                    entities.put(e.getKey(), EntityValue.text(raw));
            }
        }
        Intent intent = c.intent();
        if (intent == Intent.INFO_QUERY && !entities.containsKey(EntityType.TOPIC)) {
            InfoTopic inferred = inferTopicFromMention(entities);
            if (inferred != null) entities.put(EntityType.TOPIC, EntityValue.text(inferred.name()));
        }
        if (intent == Intent.GREETING) {
            GreetingKind kind = greeting(TextNormalizer.normalize(text));
            entities.put(EntityType.TOPIC, EntityValue.text((kind != null ? kind : GreetingKind.HELLO).name()));
        }
        return new ClassificationResult(intent, entities, c.confidence(), Source.LLM, false);
    }
}
