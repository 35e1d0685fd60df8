package eu.virtualparadox.hybridrag.rag.answer;

import eu.virtualparadox.hybridrag.query.citation.Citation;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Suggests follow-up questions from the cited documents and a few keywords of the answer.
 * <ul>
 *   <li>One question per distinct cited topic, derived from the filename
 *       ({@code "hr_leave-policy.pdf"} becomes {@code "hr leave policy"}), at most three.</li>
 *   <li>{@value #POLICY_QUESTION} if the answer mentions a policy.</li>
 *   <li>{@value #PROCESS_QUESTION} if the answer mentions a process or procedure.</li>
 * </ul>
 * At most {@value #MAX_QUESTIONS} questions are returned.
 */
@Component
public class FollowUpQuestionGenerator {

    static final int MAX_QUESTIONS = 3;
    static final String POLICY_QUESTION = "What are the exceptions to this policy?";
    static final String PROCESS_QUESTION = "What are the next steps in this process?";

    public List<String> generate(final String question, final String answer, final List<Citation> citations) {
        final Set<String> topics = new LinkedHashSet<>();
        for (final Citation citation : citations) {
            final String topic = topicOf(citation.filename());
            if (!topic.isEmpty()) {
                topics.add(topic);
            }
        }

        final List<String> questions = new ArrayList<>();
        topics.stream()
                .limit(MAX_QUESTIONS)
                .forEach(topic -> questions.add("What else does " + topic + " say about this topic?"));

        final String lower = answer == null ? "" : answer.toLowerCase(Locale.ROOT);
        if (lower.contains("policy")) {
            questions.add(POLICY_QUESTION);
        }
        if (lower.contains("process") || lower.contains("procedure")) {
            questions.add(PROCESS_QUESTION);
        }

        return questions.size() > MAX_QUESTIONS ? List.copyOf(questions.subList(0, MAX_QUESTIONS)) : questions;
    }

    private static String topicOf(final String filename) {
        if (StringUtils.isBlank(filename)) {
            return "";
        }
        return StringUtils.replaceChars(StringUtils.substringBefore(filename, "."), "_-", "  ").trim();
    }
}
