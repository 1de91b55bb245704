package com.infra.anomaly.correlation;

import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.InsightCluster;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token-overlap clustering over title + description.
 *
 * Each insight not yet clustered seeds a cluster; every later unclustered
 * insight whose Jaccard similarity to the seed reaches the threshold joins it.
 * Single-member clusters are dropped.
 */
@Component
public class JaccardSimilarityClusterer implements SimilarityClusterer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final int MIN_TOKEN_LENGTH = 2;

    @Override
    public List<InsightCluster> findSimilarInsights(List<Insight> insights, double threshold) {
        if (insights.size() < 2) return List.of();

        List<Set<String>> tokens = new ArrayList<>();
        for (Insight insight : insights) {
            tokens.add(tokenize(insight.getTitle() + " " + nullToEmpty(insight.getDescription())));
        }

        boolean[] assigned = new boolean[insights.size()];
        List<InsightCluster> clusters = new ArrayList<>();

        for (int i = 0; i < insights.size(); i++) {
            if (assigned[i]) continue;

            List<Insight> members = new ArrayList<>();
            members.add(insights.get(i));
            for (int j = i + 1; j < insights.size(); j++) {
                if (assigned[j]) continue;
                if (jaccardSimilarity(tokens.get(i), tokens.get(j)) >= threshold) {
                    members.add(insights.get(j));
                    assigned[j] = true;
                }
            }

            if (members.size() >= 2) {
                assigned[i] = true;
                clusters.add(new InsightCluster(members));
            }
        }
        return clusters;
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : NON_ALPHANUMERIC.split(text.toLowerCase())) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static double jaccardSimilarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0.0;

        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
