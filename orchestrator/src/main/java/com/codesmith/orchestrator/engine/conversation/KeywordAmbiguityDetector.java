package com.codesmith.orchestrator.engine.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword-based ambiguity detection.
 *
 * Each rule fires when the task mentions a topic but none of the concrete
 * choices for it. "Add login with JWT" is clear; "add login" is not.
 */
public class KeywordAmbiguityDetector implements AmbiguityDetector {

    private static final Logger log = LoggerFactory.getLogger(KeywordAmbiguityDetector.class);

    private record Rule(Pattern topic, Ambiguity ambiguity, List<Pattern> choices) {

        Rule(Pattern topic, Ambiguity ambiguity) {
            this(topic, ambiguity, ambiguity.choices().stream()
                    .map(choice -> term(choice.toLowerCase(Locale.ROOT)))
                    .toList());
        }

        boolean matches(String lowerTask) {
            if (!topic.matcher(lowerTask).find()) return false;
            // Already decided by the task text.
            return choices.stream().noneMatch(choice -> choice.matcher(lowerTask).find());
        }
    }

    private static final List<Rule> RULES = List.of(
            new Rule(words("auth", "authentication", "login", "log in", "sign in", "signin"),
                    new Ambiguity("authentication",
                            "Which authentication method should be used?",
                            List.of("JWT", "Session cookies", "OAuth2", "API keys"),
                            "JWT", "Authentication")),
            new Rule(words("database", "databases", "db", "persistence", "persist", "storage", "sql"),
                    new Ambiguity("database",
                            "Which database should be used?",
                            List.of("PostgreSQL", "MySQL", "SQLite", "MongoDB"),
                            "PostgreSQL", "Database")),
            new Rule(words("cache", "caches", "caching", "cached"),
                    new Ambiguity("cache provider",
                            "Which cache should be used?",
                            List.of("In-memory", "Redis", "Memcached"),
                            "In-memory", "Caching")),
            new Rule(words("queue", "messaging", "message broker", "pub/sub", "publish"),
                    new Ambiguity("messaging",
                            "Which messaging system should be used?",
                            List.of("Kafka", "RabbitMQ", "In-process events"),
                            "In-process events", "Messaging")),
            new Rule(words("api", "endpoint", "endpoints", "service interface"),
                    new Ambiguity("api style",
                            "Which API style should be exposed?",
                            List.of("REST", "GraphQL", "gRPC"),
                            "REST", "API"))
    );

    @Override
    public List<Ambiguity> detect(String task, String language) {
        String lower = task.toLowerCase(Locale.ROOT);
        List<Ambiguity> found = new ArrayList<>();
        for (Rule rule : RULES) {
            if (rule.matches(lower)) {
                found.add(rule.ambiguity());
            }
        }
        if (!found.isEmpty()) {
            log.info("Detected {} ambiguities: {}", found.size(),
                    found.stream().map(Ambiguity::term).toList());
        }
        return found;
    }

    // A hyphenated compound is its own word: "rest-less" does not name REST.
    private static Pattern term(String choice) {
        return Pattern.compile("(?<![\\w-])" + Pattern.quote(choice) + "(?![\\w-])");
    }

    private static Pattern words(String... keywords) {
        StringBuilder regex = new StringBuilder("\\b(?:");
        for (int i = 0; i < keywords.length; i++) {
            if (i > 0) regex.append('|');
            regex.append(Pattern.quote(keywords[i]));
        }
        return Pattern.compile(regex.append(")\\b").toString());
    }
}
