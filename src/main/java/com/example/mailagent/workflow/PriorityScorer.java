package com.example.mailagent.workflow;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.domain.model.FolderCategory;
import com.example.mailagent.domain.repository.FolderCategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule based priority detection. The rule score is combined with the classifier's own score,
 * the higher of the two wins.
 */
@Component
public class PriorityScorer {

    private static final Logger logger = LoggerFactory.getLogger(PriorityScorer.class);
    private static final Pattern ADDRESS = Pattern.compile("<([^>]+)>|([^\\s<>]+@[^\\s<>]+)");
    static final int MAX_SCORE = 100;

    private final MailAgentProperties.Priority settings;
    private final FolderCategoryRepository folderCategoryRepository;

    public PriorityScorer(MailAgentProperties properties, FolderCategoryRepository folderCategoryRepository) {
        this.settings = properties.getPriority();
        this.folderCategoryRepository = folderCategoryRepository;
    }

    public record Assessment(int score, List<String> reasons) {
    }

    public Assessment assess(String userId, String sender, String subject, String body) {
        int score = 0;
        List<String> reasons = new ArrayList<>();

        String domain = domainOf(sender);
        if (domain != null && isGovernment(domain)) {
            score += settings.getGovernmentBoost();
            reasons.add("government_domain:" + domain);
        }

        String text = ((subject != null ? subject : "") + " " + (body != null ? body : "")).toLowerCase(Locale.ROOT);
        List<String> keywords = settings.getUrgentKeywords().stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .filter(text::contains)
                .distinct()
                .toList();
        if (!keywords.isEmpty()) {
            score += settings.getKeywordBoost();
            keywords.forEach(keyword -> reasons.add("keyword:" + keyword));
        }

        if (isPrioritySender(userId, sender)) {
            score += settings.getSenderBoost();
            reasons.add("user_configured_sender:" + sender);
        }

        score = Math.min(score, MAX_SCORE);
        logger.debug("Rule priority for sender {}: {} {}", sender, score, reasons);
        return new Assessment(score, reasons);
    }

    /**
     * Final score of an item: the maximum of the classifier's and the rule score, capped at 100.
     */
    public int combine(int classifierScore, Assessment assessment) {
        return Math.min(MAX_SCORE, Math.max(Math.max(0, classifierScore), assessment.score()));
    }

    private boolean isGovernment(String domain) {
        for (String government : settings.getGovernmentDomains()) {
            String candidate = government.toLowerCase(Locale.ROOT);
            if (domain.equals(candidate) || domain.endsWith("." + candidate)) {
                return true;
            }
        }
        return false;
    }

    private boolean isPrioritySender(String userId, String sender) {
        if (sender == null || userId == null) {
            return false;
        }
        String senderLower = sender.toLowerCase(Locale.ROOT);
        for (FolderCategory folder : folderCategoryRepository.findByUserIdOrderByNameAsc(userId)) {
            if (folder.getPrioritySenders() == null) {
                continue;
            }
            boolean match = Arrays.stream(folder.getPrioritySenders().split(","))
                    .map(String::trim)
                    .filter(pattern -> !pattern.isEmpty())
                    .anyMatch(pattern -> senderLower.contains(pattern.toLowerCase(Locale.ROOT)));
            if (match) {
                return true;
            }
        }
        return false;
    }

    static String domainOf(String sender) {
        if (sender == null) {
            return null;
        }
        Matcher matcher = ADDRESS.matcher(sender);
        if (!matcher.find()) {
            return null;
        }
        String address = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        int at = address.lastIndexOf('@');
        if (at < 0 || at == address.length() - 1) {
            return null;
        }
        return address.substring(at + 1).toLowerCase(Locale.ROOT).trim();
    }
}
