package com.edgen.postfetch.source;

import com.edgen.postfetch.config.PostFetchProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Community-membership predicate: a post belongs when its text mentions any
 * configured term, ignoring case.
 */
@Component
public class RequiredMentionPolicy {

    private final PostFetchProperties properties;

    public RequiredMentionPolicy(PostFetchProperties properties) {
        this.properties = properties;
    }

    public boolean matches(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        List<String> terms = properties.getMembership().getRequiredTerms();
        if (terms == null || terms.isEmpty()) {
            return true;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (term != null && !term.isBlank() && normalized.contains(term.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
