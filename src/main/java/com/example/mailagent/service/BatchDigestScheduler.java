package com.example.mailagent.service;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.domain.model.*;
import com.example.mailagent.domain.repository.*;
import com.example.mailagent.integration.DigestItem;
import com.example.mailagent.integration.Notifier;
import com.example.mailagent.integration.PortResult;
import com.example.mailagent.workflow.InstanceTransactions;
import com.example.mailagent.workflow.LookupWindow;
import com.example.mailagent.workflow.RetryingCaller;
import com.example.mailagent.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Sends each user one digest of their queued emails at their batch time.
 *
 * The dispatch is recorded PENDING and its entries are stamped with its key in one transaction,
 * before the notifier is called. A later run finds a PENDING dispatch by its own entries, looks for
 * the digest in the channel and only sends it again when it is not there. Entries are deleted once
 * their instance has been reactivated, and entries held by a dispatch never go into a new one.
 */
@Service
public class BatchDigestScheduler {

    private static final Logger logger = LoggerFactory.getLogger(BatchDigestScheduler.class);

    private final BatchQueueRepository batchQueueRepository;
    private final DigestDispatchRepository digestDispatchRepository;
    private final WorkflowInstanceRepository instanceRepository;
    private final NotificationPreferencesRepository preferencesRepository;
    private final FolderCategoryRepository folderCategoryRepository;
    private final InstanceTransactions transactions;
    private final RetryingCaller retryingCaller;
    private final Notifier notifier;
    private final WorkflowEngine engine;
    private final NotificationMessageFormatter formatter;
    private final MailAgentProperties.Digest settings;

    public BatchDigestScheduler(BatchQueueRepository batchQueueRepository,
                                DigestDispatchRepository digestDispatchRepository,
                                WorkflowInstanceRepository instanceRepository,
                                NotificationPreferencesRepository preferencesRepository,
                                FolderCategoryRepository folderCategoryRepository,
                                InstanceTransactions transactions,
                                RetryingCaller retryingCaller,
                                Notifier notifier,
                                WorkflowEngine engine,
                                NotificationMessageFormatter formatter,
                                MailAgentProperties properties) {
        this.batchQueueRepository = batchQueueRepository;
        this.digestDispatchRepository = digestDispatchRepository;
        this.instanceRepository = instanceRepository;
        this.preferencesRepository = preferencesRepository;
        this.folderCategoryRepository = folderCategoryRepository;
        this.transactions = transactions;
        this.retryingCaller = retryingCaller;
        this.notifier = notifier;
        this.engine = engine;
        this.formatter = formatter;
        this.settings = properties.getDigest();
    }

    @Scheduled(cron = "${mailagent.digest.cron:0 */15 * * * *}")
    public void tick() {
        Instant now = Instant.now();
        for (String userId : batchQueueRepository.findDistinctUserIds()) {
            try {
                DigestOutcome outcome = dispatchIfDue(userId, now);
                if (outcome.status() != DigestOutcome.Status.SKIPPED) {
                    logger.info("Digest for user {}: {}", userId, outcome);
                }
            } catch (RuntimeException e) {
                logger.error("Error while dispatching digest for user {}", userId, e);
            }
        }
    }

    public DigestOutcome dispatchIfDue(String userId, Instant now) {
        Optional<NotificationPreferences> preferences = preferencesRepository.findByUserId(userId);
        if (!isDue(preferences.orElse(null), now)) {
            return DigestOutcome.skipped();
        }
        return drainAndDispatch(userId);
    }

    /**
     * Due once per day at or after the batch time, outside quiet hours. With batching switched off,
     * anything left in the queue goes out right away.
     */
    boolean isDue(NotificationPreferences preferences, Instant now) {
        if (preferences != null && !preferences.isBatchEnabled()) {
            return true;
        }
        ZoneId zone = zoneOf(preferences);
        LocalDateTime local = LocalDateTime.ofInstant(now, zone);
        if (preferences != null && inQuietHours(preferences, local.toLocalTime())) {
            return false;
        }
        LocalTime batchTime = preferences != null && preferences.getBatchTime() != null
                ? preferences.getBatchTime()
                : settings.getDefaultBatchTime();
        LocalDateTime dueAt = local.toLocalDate().atTime(batchTime);
        if (local.isBefore(dueAt)) {
            return false;
        }
        LocalDateTime last = preferences != null ? preferences.getLastDigestAt() : null;
        return last == null || last.isBefore(dueAt);
    }

    static boolean inQuietHours(NotificationPreferences preferences, LocalTime time) {
        LocalTime start = preferences.getQuietHoursStart();
        LocalTime end = preferences.getQuietHoursEnd();
        if (start == null || end == null || start.equals(end)) {
            return false;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        // spans midnight
        return !time.isBefore(start) || time.isBefore(end);
    }

    public DigestOutcome drainAndDispatch(String userId) {
        List<BatchQueueEntry> entries = batchQueueRepository.findByUserIdOrderByScheduledTimeAsc(userId);
        if (entries.isEmpty()) {
            return DigestOutcome.empty();
        }
        List<BatchQueueEntry> remaining = new ArrayList<>(entries);
        List<DigestOutcome> outcomes = new ArrayList<>();

        // Dispatches an earlier run recorded but did not see through
        for (DigestDispatch pending : digestDispatchRepository.findByUserIdAndStatusOrderByCreatedAtAsc(userId, DigestStatus.PENDING)) {
            Set<String> instanceIds = pending.getInstanceIdSet();
            List<BatchQueueEntry> held = remaining.stream()
                    .filter(e -> pending.getDigestKey().equals(e.getDispatchKey()) || instanceIds.contains(e.getInstanceId()))
                    .toList();
            remaining.removeAll(held);
            if (held.isEmpty()) {
                logger.info("Digest {} has no entries left, discarding it", pending.getDigestKey());
                pending.setStatus(DigestStatus.DISCARDED);
                digestDispatchRepository.save(pending);
                continue;
            }
            logger.info("Resuming digest {} with {} entries left from an earlier run", pending.getDigestKey(), held.size());
            outcomes.add(deliver(pending, held, true));
        }

        List<BatchQueueEntry> fresh = new ArrayList<>();
        Map<String, List<BatchQueueEntry>> stamped = new LinkedHashMap<>();
        for (BatchQueueEntry entry : remaining) {
            if (entry.getDispatchKey() == null) {
                fresh.add(entry);
            } else {
                stamped.computeIfAbsent(entry.getDispatchKey(), key -> new ArrayList<>()).add(entry);
            }
        }
        stamped.forEach((key, group) -> {
            Optional<DigestDispatch> dispatch = digestDispatchRepository.findByDigestKey(key);
            if (dispatch.isPresent() && dispatch.get().getStatus() == DigestStatus.SENT) {
                logger.info("Finishing {} entries of digest {} left from an earlier run", group.size(), key);
                finalizeEntries(group, dispatch.get().getMessageRef());
                outcomes.add(DigestOutcome.sent(group.size(), key));
            } else {
                logger.warn("Digest {} of {} entries is not on record, offering them again", key, group.size());
                group.forEach(entry -> entry.setDispatchKey(null));
                fresh.addAll(group);
            }
        });

        List<BatchQueueEntry> offered = stillQueued(fresh);
        if (!offered.isEmpty()) {
            DigestDispatch dispatch = transactions.inTransaction(() -> record(userId, offered));
            outcomes.add(deliver(dispatch, offered, false));
        }
        return combine(outcomes);
    }

    private List<BatchQueueEntry> stillQueued(List<BatchQueueEntry> entries) {
        if (entries.isEmpty()) {
            return entries;
        }
        Map<String, WorkflowInstance> instances = instances(entries);
        List<BatchQueueEntry> queued = new ArrayList<>();
        for (BatchQueueEntry entry : entries) {
            WorkflowInstance instance = instances.get(entry.getInstanceId());
            if (instance == null || instance.getTerminalReason() != TerminalReason.QUEUED) {
                logger.warn("Dropping batch entry {}: instance {} is no longer queued", entry.getId(), entry.getInstanceId());
                batchQueueRepository.delete(entry);
                continue;
            }
            queued.add(entry);
        }
        return queued;
    }

    /**
     * Records the dispatch and stamps its entries. Runs in one transaction so an entry is never
     * offered without its dispatch on record.
     */
    private DigestDispatch record(String userId, List<BatchQueueEntry> entries) {
        String digestKey = digestKey(userId, entries);
        DigestDispatch dispatch = digestDispatchRepository.findByDigestKey(digestKey).orElseGet(() -> {
            DigestDispatch created = new DigestDispatch();
            created.setUserId(userId);
            created.setDigestKey(digestKey);
            created.setStatus(DigestStatus.PENDING);
            created.setEntryCount(entries.size());
            created.setInstanceIds(entries.stream().map(BatchQueueEntry::getInstanceId).collect(Collectors.joining(",")));
            return created;
        });
        DigestDispatch saved = digestDispatchRepository.save(dispatch);
        for (BatchQueueEntry entry : entries) {
            entry.setDispatchKey(digestKey);
            batchQueueRepository.save(entry);
        }
        return saved;
    }

    private DigestOutcome deliver(DigestDispatch dispatch, List<BatchQueueEntry> entries, boolean earlierAttempt) {
        String userId = dispatch.getUserId();
        String digestKey = dispatch.getDigestKey();
        List<BatchQueueEntry> offered = earlierAttempt ? stillQueued(entries) : entries;
        if (offered.isEmpty()) {
            dispatch.setStatus(DigestStatus.DISCARDED);
            digestDispatchRepository.save(dispatch);
            return DigestOutcome.empty();
        }

        Map<String, WorkflowInstance> instances = instances(offered);
        List<FolderCategory> folders = folderCategoryRepository.findByUserIdOrderByNameAsc(userId);
        List<WorkflowInstance> offeredInstances = offered.stream().map(e -> instances.get(e.getInstanceId())).toList();
        List<DigestItem> items = offeredInstances.stream()
                .map(instance -> new DigestItem(instance.getId(), formatter.digestItem(instance),
                        formatter.actionSet(instance, folders)))
                .toList();
        String summary = formatter.digestSummary(offeredInstances);

        PortResult<String> result = retryingCaller.callReconciled("notifyDigest", userId, earlierAttempt,
                () -> notifier.findDelivered(userId, digestKey, LookupWindow.since(dispatch.getCreatedAt())),
                () -> notifier.notifyDigest(userId, summary, items, digestKey));
        if (!result.isSuccess()) {
            logger.error("Digest {} for user {} not delivered, entries stay queued: {}", digestKey, userId, result.getFailure());
            return DigestOutcome.failed(digestKey);
        }

        transactions.inTransaction(() -> {
            dispatch.setMessageRef(result.getValue());
            dispatch.setStatus(DigestStatus.SENT);
            if (dispatch.getSentAt() == null) {
                dispatch.setSentAt(LocalDateTime.now());
            }
            digestDispatchRepository.save(dispatch);
            recordDigestTime(userId);
            return null;
        });
        finalizeEntries(offered, result.getValue());
        logger.info("Digest {} with {} emails sent to user {}", digestKey, offered.size(), userId);
        return DigestOutcome.sent(offered.size(), digestKey);
    }

    private Map<String, WorkflowInstance> instances(List<BatchQueueEntry> entries) {
        return instanceRepository
                .findAllById(entries.stream().map(BatchQueueEntry::getInstanceId).toList())
                .stream()
                .collect(Collectors.toMap(WorkflowInstance::getId, instance -> instance));
    }

    private void finalizeEntries(List<BatchQueueEntry> entries, String messageRef) {
        for (BatchQueueEntry entry : entries) {
            engine.reactivateQueued(entry.getInstanceId(), messageRef);
        }
    }

    /**
     * Sent counts add up. The run only reports a failure when nothing went out.
     */
    private static DigestOutcome combine(List<DigestOutcome> outcomes) {
        int sent = 0;
        String lastKey = null;
        String failedKey = null;
        for (DigestOutcome outcome : outcomes) {
            if (outcome.status() == DigestOutcome.Status.SENT) {
                sent += outcome.itemCount();
                lastKey = outcome.digestKey();
            } else if (outcome.status() == DigestOutcome.Status.FAILED) {
                failedKey = outcome.digestKey();
            }
        }
        if (lastKey != null) {
            return DigestOutcome.sent(sent, lastKey);
        }
        return failedKey != null ? DigestOutcome.failed(failedKey) : DigestOutcome.empty();
    }

    private void recordDigestTime(String userId) {
        NotificationPreferences preferences = preferencesRepository.findByUserId(userId).orElseGet(() -> {
            NotificationPreferences created = new NotificationPreferences();
            created.setUserId(userId);
            created.setBatchTime(settings.getDefaultBatchTime());
            created.setTimezone(settings.getDefaultZone());
            return created;
        });
        preferences.setLastDigestAt(LocalDateTime.now(zoneOf(preferences)));
        preferencesRepository.save(preferences);
    }

    private ZoneId zoneOf(NotificationPreferences preferences) {
        String zone = preferences != null && preferences.getTimezone() != null
                ? preferences.getTimezone()
                : settings.getDefaultZone();
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            logger.warn("Unknown timezone '{}', falling back to {}", zone, settings.getDefaultZone());
            return ZoneId.of(settings.getDefaultZone());
        }
    }

    /**
     * Derived from the entry ids, so a set of entries is only ever offered under one key.
     */
    static String digestKey(String userId, List<BatchQueueEntry> entries) {
        String ids = entries.stream()
                .map(BatchQueueEntry::getId)
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
        return "digest_" + UUID.nameUUIDFromBytes((userId + ":" + ids).getBytes(StandardCharsets.UTF_8));
    }
}
