package com.example.mailagent.integration.llm;

import com.example.mailagent.domain.model.FolderCategory;
import com.example.mailagent.domain.repository.FolderCategoryRepository;
import com.example.mailagent.integration.Classification;
import com.example.mailagent.integration.Classifier;
import com.example.mailagent.integration.EmailItem;
import com.example.mailagent.integration.ExternalErrors;
import com.example.mailagent.integration.PortFailure;
import com.example.mailagent.integration.PortResult;
import com.example.mailagent.util.MessageSanitizer;
import com.example.mailagent.util.PromptHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Classifies an email into one of the user's folders with an LLM and drafts a reply when one is expected.
 */
@Service
public class LlmClassifier implements Classifier {

    private static final Logger logger = LoggerFactory.getLogger(LlmClassifier.class);
    static final int BODY_PREVIEW_LENGTH = 500;
    private static final String DEFAULT_FOLDER = "Important";

    private final ChatClient chatClient;
    private final FolderCategoryRepository folderCategoryRepository;
    private final BeanOutputConverter<ClassificationResponse> outputConverter;

    public LlmClassifier(ChatClient chatClient, FolderCategoryRepository folderCategoryRepository) {
        this.chatClient = chatClient;
        this.folderCategoryRepository = folderCategoryRepository;
        this.outputConverter = new BeanOutputConverter<>(ClassificationResponse.class);
    }

    @Override
    public PortResult<Classification> classify(EmailItem item) {
        List<FolderCategory> folders = folderCategoryRepository.findByUserIdOrderByNameAsc(item.userId());

        PromptTemplate promptTemplate = new PromptTemplate(PromptHolder.CLASSIFY_EMAIL);
        Prompt prompt = promptTemplate.create(Map.of(
                "folders", formatFolders(folders),
                "sender", MessageSanitizer.headerValue(item.sender()),
                "subject", MessageSanitizer.headerValue(item.subject()),
                "body", bodyPreview(item.body()),
                "format", outputConverter.getFormat()
        ));

        ClassificationResponse response;
        try {
            String text = chatClient.prompt(prompt).call().content();
            logger.debug("Classification output for message {}: {}", item.messageId(), text);
            if (text == null || text.isBlank()) {
                return PortResult.failure(PortFailure.permanentFailure("classify returned an empty answer"));
            }
            response = outputConverter.convert(text);
        } catch (RuntimeException e) {
            logger.warn("Error calling LLM for classification of message {}: {}", item.messageId(), e.getMessage());
            return PortResult.failure(ExternalErrors.classify("classify", e));
        }
        if (response == null || response.getSuggestedFolder() == null) {
            return PortResult.failure(PortFailure.permanentFailure("classify returned no folder"));
        }

        String folder = response.getSuggestedFolder().trim();
        if (!folders.isEmpty() && folders.stream().noneMatch(f -> f.getName().equals(folder))) {
            return PortResult.failure(PortFailure.permanentFailure("classify suggested unknown folder '" + folder + "'"));
        }
        int score = Math.max(0, Math.min(100, response.getPriorityScore()));
        String draft = response.isNeedsResponse() ? response.getResponseDraft() : null;
        logger.info("Classified message {} into '{}' with priority score {}", item.messageId(), folder, score);
        return PortResult.success(new Classification(
                response.getCategory() != null ? response.getCategory() : folder,
                folder,
                score,
                response.getReasoning(),
                response.isNeedsResponse() && draft != null && !draft.isBlank(),
                draft));
    }

    private String formatFolders(List<FolderCategory> folders) {
        if (folders.isEmpty()) {
            return "- " + DEFAULT_FOLDER;
        }
        return folders.stream()
                .map(folder -> "- " + folder.getName())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Plain text preview with tags stripped and whitespace collapsed, cut at a word boundary.
     */
    static String bodyPreview(String body) {
        if (body == null) {
            return "";
        }
        String text = MessageSanitizer.clean(body)
                .replaceAll("<[^>]+>", "")
                .replaceAll("\\s+", " ")
                .trim();
        if (text.length() <= BODY_PREVIEW_LENGTH) {
            return text;
        }
        String truncated = text.substring(0, BODY_PREVIEW_LENGTH);
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > BODY_PREVIEW_LENGTH * 0.8) {
            return text.substring(0, lastSpace) + "...";
        }
        return truncated + "...";
    }
}
