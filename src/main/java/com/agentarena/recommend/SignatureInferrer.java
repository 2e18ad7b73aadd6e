package com.agentarena.recommend;

import com.agentarena.classify.TechStackClassifier;
import com.agentarena.shared.model.ProjectSignature;
import com.agentarena.shared.model.ProjectType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Derives a {@link ProjectSignature} from free text. Pure: no I/O, no state.
 */
public class SignatureInferrer {

    // insertion order breaks ties between equally matched types
    private static final Map<ProjectType, Pattern> TYPE_KEYWORDS = typeKeywords();
    private static final Pattern SCALE_WORDS = words("enterprise|scalable|distributed|real-time|mission-critical|"
        + "large-scale|high-performance|architecture|microservices|multi-tenant");
    private static final Pattern SIMPLE_WORDS = words("simple|basic|small|quick|tiny|prototype");
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}._+#/-]*");

    private final TechStackClassifier classifier;

    public SignatureInferrer(TechStackClassifier classifier) {
        this.classifier = classifier;
    }

    public ProjectSignature inferSignature(String request) {
        var text = request == null ? "" : request;
        var tags = classifier.classify(text);
        return new ProjectSignature(tags, inferProjectType(text), inferComplexity(text, tags.size()));
    }

    ProjectType inferProjectType(String text) {
        var best = ProjectType.GENERIC;
        int bestHits = 0;
        for (var entry : TYPE_KEYWORDS.entrySet()) {
            int hits = count(entry.getValue(), text);
            if (hits > bestHits) {
                best = entry.getKey();
                bestHits = hits;
            }
        }
        return best;
    }

    /**
     * 1-5, growing with request length and the number of distinct inferred tags.
     */
    int inferComplexity(String text, int distinctTags) {
        int tokens = count(TOKEN, text);
        int score = 1;
        if (tokens > 12) score++;
        if (tokens > 40) score++;
        if (distinctTags >= 3) score++;
        if (distinctTags >= 5) score++;
        if (SCALE_WORDS.matcher(text).find()) score++;
        if (SIMPLE_WORDS.matcher(text).find()) score--;
        return Math.max(1, Math.min(5, score));
    }

    private static int count(Pattern pattern, String text) {
        var m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static Map<ProjectType, Pattern> typeKeywords() {
        var map = new LinkedHashMap<ProjectType, Pattern>();
        map.put(ProjectType.WEB_APP, words("web ?app|website|frontend|front-end|ui|user interface|dashboard|landing page|spa"));
        map.put(ProjectType.API_SERVICE, words("api|apis|rest|restful|endpoints?|microservices?|backend|back-end|graphql|grpc|service"));
        map.put(ProjectType.DATA_PIPELINE, words("pipelines?|etl|elt|ingestion|warehouse|analytics|batch|streaming|data lake"));
        return map;
    }

    private static Pattern words(String alternatives) {
        return Pattern.compile("(?<![\\w-])(?:" + alternatives + ")(?![\\w-])", Pattern.CASE_INSENSITIVE);
    }
}
