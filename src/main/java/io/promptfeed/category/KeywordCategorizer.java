package io.promptfeed.category;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword-based categorizer. Labels are tried in declaration order and the first
 * matching keyword wins.
 */
@Component
public class KeywordCategorizer implements Categorizer {

    private static final Map<String, Pattern> RULES = new LinkedHashMap<>();

    static {
        RULES.put("business", Pattern.compile(
                "\\b(startup|business|marketing|sales|pitch|revenue|customers?)\\b", Pattern.CASE_INSENSITIVE));
        RULES.put("technical", Pattern.compile(
                "\\b(code|coding|programming|debug|api|software|function|sql)\\b", Pattern.CASE_INSENSITIVE));
        RULES.put("creative", Pattern.compile(
                "\\b(write|writing|story|poem|lyrics|fiction|character)\\b", Pattern.CASE_INSENSITIVE));
        RULES.put("analytical", Pattern.compile(
                "\\b(analy[sz]e|analysis|data|research|compare|statistics?)\\b", Pattern.CASE_INSENSITIVE));
    }

    private static final Set<String> LABELS;

    static {
        Set<String> labels = new LinkedHashSet<>(RULES.keySet());
        labels.add(GENERAL);
        LABELS = Set.copyOf(labels);
    }

    @Override
    public String categorize(String template) {
        if (template == null || template.isBlank()) {
            return GENERAL;
        }
        for (Map.Entry<String, Pattern> rule : RULES.entrySet()) {
            if (rule.getValue().matcher(template).find()) {
                return rule.getKey();
            }
        }
        return GENERAL;
    }

    @Override
    public Set<String> labels() {
        return LABELS;
    }
}
