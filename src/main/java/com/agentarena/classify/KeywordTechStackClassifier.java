package com.agentarena.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Keyword table classifier used by both the descriptor loader and signature inference.
 */
public class KeywordTechStackClassifier implements TechStackClassifier {

    private static final Map<String, Pattern> DEFAULT_TABLE = buildDefaultTable();

    private final Map<String, Pattern> table;

    public KeywordTechStackClassifier() {
        this(DEFAULT_TABLE);
    }

    public KeywordTechStackClassifier(Map<String, Pattern> table) {
        this.table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    @Override
    public Set<String> classify(String text) {
        var tags = new TreeSet<String>();
        if (text == null || text.isBlank()) return tags;
        table.forEach((tag, pattern) -> {
            if (pattern.matcher(text).find()) tags.add(tag);
        });
        return tags;
    }

    public Set<String> knownTags() {
        return table.keySet();
    }

    private static Map<String, Pattern> buildDefaultTable() {
        var t = new LinkedHashMap<String, Pattern>();
        t.put("python", p("python|django|fastapi|flask|pandas|numpy|pytorch"));
        t.put("javascript", p("javascript|node\\.?js|express\\.?js|vue|angular|next\\.?js"));
        t.put("typescript", p("typescript|tsx?"));
        t.put("react", p("react|react native|next\\.?js"));
        t.put("golang", p("golang|goroutines?|gin-gonic"));
        t.put("rust", p("rust|cargo|tokio|actix"));
        t.put("java", p("java|spring|spring boot|maven|gradle|junit|jvm"));
        t.put("sql", p("sql|postgres(?:ql)?|mysql|sqlite|mongodb|redis|database"));
        t.put("cloud", p("aws|azure|gcp|docker|kubernetes|k8s|terraform"));
        t.put("frontend", p("frontend|front-end|html|css|react|vue|angular|svelte|tailwind|ui|ux"));
        t.put("backend", p("backend|back-end|api|apis|rest|graphql|microservices?|server"));
        t.put("devops", p("devops|ci/cd|jenkins|github actions|deployment|pipelines? as code"));
        t.put("testing", p("tests?|testing|jest|pytest|cypress|selenium|qa"));
        t.put("security", p("security|auth(?:entication|orization)?|oauth|owasp|vulnerabilit(?:y|ies)|penetration"));
        t.put("data", p("etl|data pipelines?|data warehouse|spark|airflow|kafka|analytics"));
        return Collections.unmodifiableMap(t);
    }

    private static Pattern p(String alternatives) {
        return Pattern.compile("(?<![\\w-])(?:" + alternatives + ")(?![\\w-])", Pattern.CASE_INSENSITIVE);
    }
}
