package com.example.mailagent.integration.mattermost;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.domain.model.ChannelLink;
import com.example.mailagent.domain.model.Decision;
import com.example.mailagent.domain.repository.ChannelLinkRepository;
import com.example.mailagent.integration.*;
import com.example.mailagent.integration.mattermost.model.MessageAttachment;
import com.example.mailagent.integration.mattermost.model.OpenDialogRequest;
import com.example.mailagent.integration.mattermost.model.PatchPostRequest;
import com.example.mailagent.integration.mattermost.model.Post;
import com.example.mailagent.integration.mattermost.model.PostList;
import com.example.mailagent.integration.mattermost.model.SendPostRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Delivers proposals to the user's direct channel as interactive messages. Button clicks come back
 * through {@code ApprovalCallbackController}.
 */
@Service
public class MattermostNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(MattermostNotifier.class);

    public static final String CONTEXT_CORRELATION_KEY = "correlation_key";
    public static final String CONTEXT_DECISION = "decision";
    public static final String CONTEXT_FOLDER = "folder";
    public static final String CONTEXT_TOKEN = "token";
    public static final String CONTEXT_SELECTED_OPTION = "selected_option";
    public static final String CONTEXT_REPLY_MODE = "reply_mode";
    public static final String PROP_DIGEST_KEY = "digest_key";
    public static final String PROP_IDEMPOTENCY_KEY = "idempotency_key";
    public static final String DIALOG_REPLY_FIELD = "reply";
    private static final int DIALOG_REPLY_LENGTH = 3000;

    private final MattermostApiClient mattermostApiClient;
    private final ChannelLinkRepository channelLinkRepository;
    private final MailAgentProperties.Mattermost settings;

    public MattermostNotifier(MattermostApiClient mattermostApiClient,
                              ChannelLinkRepository channelLinkRepository,
                              MailAgentProperties properties) {
        this.mattermostApiClient = mattermostApiClient;
        this.channelLinkRepository = channelLinkRepository;
        this.settings = properties.getMattermost();
    }

    @Override
    public PortResult<String> notify(String userId, String idempotencyKey, String summary, ActionSet actions) {
        Optional<ChannelLink> link = channelLinkRepository.findByUserId(userId);
        if (link.isEmpty()) {
            return PortResult.failure(PortFailure.permanentFailure("No Mattermost channel linked for user " + userId));
        }
        Map<String, Object> props = new HashMap<>();
        props.put("attachments", List.of(MessageAttachment.builder()
                .fallback(summary)
                .color("#1f6feb")
                .text(summary)
                .actions(toActions(actions))
                .build()));
        props.put(PROP_IDEMPOTENCY_KEY, idempotencyKey);
        return createPost("notify", SendPostRequest.builder()
                .channel_id(link.get().getChannelId())
                .message("New email needs your decision")
                .props(props)
                .build());
    }

    @Override
    public PortResult<String> notifyDigest(String userId, String summary, List<DigestItem> items, String digestKey) {
        Optional<ChannelLink> link = channelLinkRepository.findByUserId(userId);
        if (link.isEmpty()) {
            return PortResult.failure(PortFailure.permanentFailure("No Mattermost channel linked for user " + userId));
        }
        List<MessageAttachment> attachments = new ArrayList<>();
        for (DigestItem item : items) {
            attachments.add(MessageAttachment.builder()
                    .fallback(item.summary())
                    .text(item.summary())
                    .actions(toActions(item.actions()))
                    .build());
        }
        Map<String, Object> props = new HashMap<>();
        props.put("attachments", attachments);
        props.put(PROP_DIGEST_KEY, digestKey);
        props.put(PROP_IDEMPOTENCY_KEY, digestKey);
        return createPost("notifyDigest", SendPostRequest.builder()
                .channel_id(link.get().getChannelId())
                .message(summary)
                .props(props)
                .build());
    }

    /**
     * Single proposals are rewritten in place. A digest carries several proposals, so the outcome
     * of one is posted as a thread reply instead.
     */
    @Override
    public PortResult<Void> confirm(String userId, String messageRef, String text) {
        if (messageRef == null) {
            return PortResult.failure(PortFailure.permanentFailure("No message to confirm for user " + userId));
        }
        try {
            Post original = mattermostApiClient.getPost(messageRef);
            if (original != null && original.getProps() != null && original.getProps().containsKey(PROP_DIGEST_KEY)) {
                mattermostApiClient.sendPost(SendPostRequest.builder()
                        .channel_id(original.getChannel_id())
                        .root_id(messageRef)
                        .message(text)
                        .build());
            } else {
                Map<String, Object> props = new HashMap<>();
                if (original != null && original.getProps() != null) {
                    props.putAll(original.getProps());
                }
                props.put("attachments", List.of());
                mattermostApiClient.patchPost(messageRef, PatchPostRequest.builder()
                        .message(text)
                        .props(props)
                        .build());
            }
            log.info("Confirmed post {} for user {}", messageRef, userId);
            return PortResult.success(null);
        } catch (RuntimeException e) {
            log.warn("Error while confirming post {}: {}", messageRef, e.getMessage());
            return PortResult.failure(ExternalErrors.classify("confirm", e));
        }
    }

    @Override
    public PortResult<String> alert(String userId, String idempotencyKey, String text) {
        Optional<ChannelLink> link = channelLinkRepository.findByUserId(userId);
        if (link.isEmpty()) {
            return PortResult.failure(PortFailure.permanentFailure("No Mattermost channel linked for user " + userId));
        }
        Map<String, Object> props = new HashMap<>();
        props.put(PROP_IDEMPOTENCY_KEY, idempotencyKey);
        return createPost("alert", SendPostRequest.builder()
                .channel_id(link.get().getChannelId())
                .message(text)
                .props(props)
                .metadata(SendPostRequest.PostMetadata.builder()
                        .priority(SendPostRequest.Priority.builder().priority("important").build())
                        .build())
                .build());
    }

    /**
     * Scans the user's channel for a root post carrying the key. Thread replies are ignored.
     */
    @Override
    public PortResult<Optional<String>> findDelivered(String userId, String idempotencyKey, Instant since) {
        Optional<ChannelLink> link = channelLinkRepository.findByUserId(userId);
        if (link.isEmpty()) {
            return PortResult.failure(PortFailure.permanentFailure("No Mattermost channel linked for user " + userId));
        }
        try {
            PostList posts = mattermostApiClient.getPostsForChannel(link.get().getChannelId(), since.toEpochMilli());
            if (posts == null || posts.getPosts() == null) {
                return PortResult.success(Optional.empty());
            }
            Optional<String> found = posts.getPosts().values().stream()
                    .filter(post -> post.getRoot_id() == null || post.getRoot_id().isEmpty())
                    .filter(post -> post.getProps() != null && idempotencyKey.equals(post.getProps().get(PROP_IDEMPOTENCY_KEY)))
                    .min(Comparator.comparingLong(Post::getCreate_at))
                    .map(Post::getId);
            log.debug("Lookup of {} in channel {}: {}", idempotencyKey, link.get().getChannelId(), found.orElse("not found"));
            return PortResult.success(found);
        } catch (RuntimeException e) {
            log.warn("Error while looking up {} in channel {}: {}", idempotencyKey, link.get().getChannelId(), e.getMessage());
            return PortResult.failure(ExternalErrors.classify("findDelivered", e));
        }
    }

    /**
     * Opens a dialog prefilled with the drafted reply. The submission comes back to the dialog
     * endpoint with the correlation key as callback id and the callback token as state.
     */
    public PortResult<Void> openReplyEditor(String triggerId, String correlationKey, String draft) {
        if (triggerId == null || triggerId.isBlank()) {
            return PortResult.failure(PortFailure.permanentFailure("No trigger id to open the reply editor"));
        }
        OpenDialogRequest request = OpenDialogRequest.builder()
                .trigger_id(triggerId)
                .url(settings.getCallbackUrl() + "/dialog")
                .dialog(OpenDialogRequest.Dialog.builder()
                        .callback_id(correlationKey)
                        .title("Edit reply")
                        .introduction_text("The email is filed in the suggested folder once the reply is sent.")
                        .submit_label("Send")
                        .state(settings.getCallbackToken())
                        .elements(List.of(OpenDialogRequest.Element.builder()
                                .display_name("Reply")
                                .name(DIALOG_REPLY_FIELD)
                                .type("textarea")
                                .default_value(draft)
                                .max_length(DIALOG_REPLY_LENGTH)
                                .build()))
                        .build())
                .build();
        try {
            mattermostApiClient.openDialog(request);
            log.info("Opened reply editor for {}", correlationKey);
            return PortResult.success(null);
        } catch (RuntimeException e) {
            log.warn("Error while opening reply editor for {}: {}", correlationKey, e.getMessage());
            return PortResult.failure(ExternalErrors.classify("openReplyEditor", e));
        }
    }

    private PortResult<String> createPost(String operation, SendPostRequest request) {
        try {
            Post post = mattermostApiClient.sendPost(request);
            if (post == null || post.getId() == null) {
                return PortResult.failure(PortFailure.permanentFailure(operation + " returned no post id"));
            }
            log.info("{} delivered to channel {} as post {}", operation, request.getChannel_id(), post.getId());
            return PortResult.success(post.getId());
        } catch (RuntimeException e) {
            log.warn("Error while sending {} to channel {}: {}", operation, request.getChannel_id(), e.getMessage());
            return PortResult.failure(ExternalErrors.classify(operation, e));
        }
    }

    /**
     * Approve and reject become buttons. All change options collapse into one folder picker.
     */
    List<MessageAttachment.Action> toActions(ActionSet actionSet) {
        List<MessageAttachment.Action> actions = new ArrayList<>();
        List<MessageAttachment.SelectOption> folderOptions = new ArrayList<>();
        for (ActionOption option : actionSet.options()) {
            if (option.decision() == Decision.CHANGE) {
                folderOptions.add(MessageAttachment.SelectOption.builder()
                        .text(option.folder())
                        .value(option.folder())
                        .build());
                continue;
            }
            actions.add(MessageAttachment.Action.builder()
                    .id(buttonId(option))
                    .name(option.label())
                    .type("button")
                    .style(buttonStyle(option))
                    .integration(integration(actionSet.correlationKey(), option.decision(), option.replyMode()))
                    .build());
        }
        if (!folderOptions.isEmpty()) {
            actions.add(MessageAttachment.Action.builder()
                    .id("change")
                    .name("Move to another folder")
                    .type("select")
                    .options(folderOptions)
                    .integration(integration(actionSet.correlationKey(), Decision.CHANGE, ReplyMode.DRAFT))
                    .build());
        }
        return actions;
    }

    // Mattermost only routes clicks for alphanumeric action ids
    private static String buttonId(ActionOption option) {
        switch (option.replyMode()) {
            case EDIT:
                return "editreply";
            case NONE:
                return option.decision().toWire() + "noreply";
            default:
                return option.decision().toWire();
        }
    }

    private static String buttonStyle(ActionOption option) {
        if (option.decision() == Decision.REJECT) {
            return "danger";
        }
        return option.replyMode() == ReplyMode.DRAFT ? "primary" : "default";
    }

    private MessageAttachment.Integration integration(String correlationKey, Decision decision, ReplyMode replyMode) {
        Map<String, Object> context = new HashMap<>();
        context.put(CONTEXT_CORRELATION_KEY, correlationKey);
        context.put(CONTEXT_DECISION, decision.toWire());
        context.put(CONTEXT_REPLY_MODE, replyMode.toWire());
        context.put(CONTEXT_TOKEN, settings.getCallbackToken());
        return MessageAttachment.Integration.builder()
                .url(settings.getCallbackUrl())
                .context(context)
                .build();
    }
}
