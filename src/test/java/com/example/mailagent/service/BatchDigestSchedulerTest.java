package com.example.mailagent.service;

import com.example.mailagent.domain.model.*;
import com.example.mailagent.domain.repository.*;
import com.example.mailagent.integration.*;
import com.example.mailagent.workflow.EngineTestConfiguration;
import com.example.mailagent.workflow.StepOutcome;
import com.example.mailagent.workflow.WorkflowEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.mailagent.workflow.WorkflowTestData.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DataJpaTest
@Import(EngineTestConfiguration.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class BatchDigestSchedulerTest {

    @Autowired
    private BatchDigestScheduler scheduler;

    @Autowired
    private WorkflowEngine engine;

    @Autowired
    private WorkflowInstanceRepository instanceRepository;

    @Autowired
    private CheckpointRepository checkpointRepository;

    @Autowired
    private PendingActionRepository pendingActionRepository;

    @Autowired
    private BatchQueueRepository batchQueueRepository;

    @Autowired
    private ExternalCorrelationRepository correlationRepository;

    @Autowired
    private DigestDispatchRepository digestDispatchRepository;

    @Autowired
    private ApprovalHistoryRepository approvalHistoryRepository;

    @Autowired
    private ChannelLinkRepository channelLinkRepository;

    @Autowired
    private FolderCategoryRepository folderCategoryRepository;

    @Autowired
    private NotificationPreferencesRepository preferencesRepository;

    @MockBean
    private Classifier classifier;

    @MockBean
    private Notifier notifier;

    @MockBean
    private MailboxClient mailboxClient;

    @BeforeEach
    void setUp() {
        clean(instanceRepository, checkpointRepository, pendingActionRepository, batchQueueRepository,
                correlationRepository, digestDispatchRepository, approvalHistoryRepository,
                channelLinkRepository, folderCategoryRepository, preferencesRepository);
        seedUser(USER, MATTERMOST_USER, channelLinkRepository, folderCategoryRepository);
        when(classifier.classify(any())).thenReturn(PortResult.success(routine()));
        when(notifier.notifyDigest(anyString(), anyString(), anyList(), anyString())).thenReturn(PortResult.success("digest-post"));
        when(notifier.findDelivered(anyString(), anyString(), any())).thenReturn(PortResult.success(Optional.empty()));
    }

    private DigestDispatch pendingDispatch(String digestKey, String instanceIds) {
        DigestDispatch dispatch = new DigestDispatch();
        dispatch.setUserId(USER);
        dispatch.setDigestKey(digestKey);
        dispatch.setStatus(DigestStatus.PENDING);
        dispatch.setEntryCount(instanceIds.split(",").length);
        dispatch.setInstanceIds(instanceIds);
        return digestDispatchRepository.save(dispatch);
    }

    private static Set<String> entryIds(List<DigestItem> items) {
        return items.stream().map(DigestItem::entryId).collect(Collectors.toSet());
    }

    private String queue(String messageId) {
        String instanceId = engine.start(email(USER, messageId, "Newsletter " + messageId, "This week in review"));
        StepOutcome outcome = engine.run(instanceId);
        assertEquals(TerminalReason.QUEUED, instanceRepository.findById(instanceId).orElseThrow().getTerminalReason(),
                "unexpected outcome " + outcome);
        return instanceId;
    }

    private NotificationPreferences preferences(LocalTime batchTime, String zone) {
        NotificationPreferences preferences = new NotificationPreferences();
        preferences.setUserId(USER);
        preferences.setBatchTime(batchTime);
        preferences.setTimezone(zone);
        return preferences;
    }

    @Test
    void testDigestBundlesAllQueuedEmails() {
        String first = queue("msg-1");
        String second = queue("msg-2");

        DigestOutcome outcome = scheduler.drainAndDispatch(USER);

        assertEquals(DigestOutcome.Status.SENT, outcome.status());
        assertEquals(2, outcome.itemCount());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DigestItem>> items = ArgumentCaptor.forClass(List.class);
        verify(notifier, times(1)).notifyDigest(eq(USER), contains("2 emails"), items.capture(), eq(outcome.digestKey()));
        assertEquals(Set.of(first, second), items.getValue().stream().map(DigestItem::entryId).collect(Collectors.toSet()));

        for (String instanceId : List.of(first, second)) {
            WorkflowInstance instance = instanceRepository.findById(instanceId).orElseThrow();
            assertEquals(WorkflowState.AWAITING_APPROVAL, instance.getCurrentState());
            assertEquals("digest-post", instance.getNotificationRef());
            assertTrue(correlationRepository.existsById(instance.getCorrelationKey()));
        }
        assertTrue(batchQueueRepository.findAll().isEmpty());
        DigestDispatch dispatch = digestDispatchRepository.findByDigestKey(outcome.digestKey()).orElseThrow();
        assertEquals(DigestStatus.SENT, dispatch.getStatus());
        assertNotNull(preferencesRepository.findByUserId(USER).orElseThrow().getLastDigestAt());

        assertEquals(DigestOutcome.Status.EMPTY, scheduler.drainAndDispatch(USER).status());
        verify(notifier, times(1)).notifyDigest(anyString(), anyString(), anyList(), anyString());
    }

    @Test
    void testCrashBeforeDeletionDoesNotResendDigest() {
        String instanceId = queue("msg-1");
        BatchQueueEntry entry = batchQueueRepository.findByInstanceId(instanceId).orElseThrow();
        DigestDispatch dispatch = new DigestDispatch();
        dispatch.setUserId(USER);
        dispatch.setDigestKey("digest_earlier");
        dispatch.setStatus(DigestStatus.SENT);
        dispatch.setMessageRef("digest-post-0");
        dispatch.setEntryCount(1);
        dispatch.setInstanceIds(instanceId);
        digestDispatchRepository.save(dispatch);
        entry.setDispatchKey("digest_earlier");
        batchQueueRepository.save(entry);

        DigestOutcome outcome = scheduler.drainAndDispatch(USER);

        assertEquals(DigestOutcome.Status.SENT, outcome.status());
        assertEquals("digest_earlier", outcome.digestKey());
        verify(notifier, never()).notifyDigest(anyString(), anyString(), anyList(), anyString());
        WorkflowInstance instance = instanceRepository.findById(instanceId).orElseThrow();
        assertEquals(WorkflowState.AWAITING_APPROVAL, instance.getCurrentState());
        assertEquals("digest-post-0", instance.getNotificationRef());
        assertTrue(batchQueueRepository.findByInstanceId(instanceId).isEmpty());
    }

    @Test
    void testFailedDigestKeepsEntriesQueued() {
        String instanceId = queue("msg-1");
        when(notifier.notifyDigest(anyString(), anyString(), anyList(), anyString()))
                .thenReturn(PortResult.failure(PortFailure.permanentFailure("404 channel not found")));

        DigestOutcome outcome = scheduler.drainAndDispatch(USER);

        assertEquals(DigestOutcome.Status.FAILED, outcome.status());
        assertTrue(batchQueueRepository.findByInstanceId(instanceId).isPresent());
        assertEquals(outcome.digestKey(), batchQueueRepository.findByInstanceId(instanceId).get().getDispatchKey());
        assertEquals(TerminalReason.QUEUED, instanceRepository.findById(instanceId).orElseThrow().getTerminalReason());
        assertEquals(DigestStatus.PENDING,
                digestDispatchRepository.findByDigestKey(outcome.digestKey()).orElseThrow().getStatus());

        when(notifier.notifyDigest(anyString(), anyString(), anyList(), anyString())).thenReturn(PortResult.success("digest-post"));
        DigestOutcome retried = scheduler.drainAndDispatch(USER);

        assertEquals(outcome.digestKey(), retried.digestKey());
        assertEquals(DigestStatus.SENT,
                digestDispatchRepository.findByDigestKey(retried.digestKey()).orElseThrow().getStatus());
        assertEquals(1, digestDispatchRepository.findByUserIdOrderByCreatedAtDesc(USER).size());
        verify(notifier).findDelivered(eq(USER), eq(outcome.digestKey()), any());
    }

    @Test
    void testDigestFoundInChannelIsNotSentAgain() {
        String first = queue("msg-1");
        BatchQueueEntry entry = batchQueueRepository.findByInstanceId(first).orElseThrow();
        pendingDispatch("digest_in_flight", first);
        entry.setDispatchKey("digest_in_flight");
        batchQueueRepository.save(entry);
        String second = queue("msg-2");
        when(notifier.findDelivered(eq(USER), eq("digest_in_flight"), any()))
                .thenReturn(PortResult.success(Optional.of("digest-post-0")));

        DigestOutcome outcome = scheduler.drainAndDispatch(USER);

        assertEquals(DigestOutcome.Status.SENT, outcome.status());
        assertEquals(2, outcome.itemCount());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DigestItem>> items = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);
        verify(notifier, times(1)).notifyDigest(eq(USER), anyString(), items.capture(), keys.capture());
        assertEquals(Set.of(second), entryIds(items.getValue()));
        assertNotEquals("digest_in_flight", keys.getValue());

        assertEquals("digest-post-0", instanceRepository.findById(first).orElseThrow().getNotificationRef());
        assertEquals("digest-post", instanceRepository.findById(second).orElseThrow().getNotificationRef());
        DigestDispatch resumed = digestDispatchRepository.findByDigestKey("digest_in_flight").orElseThrow();
        assertEquals(DigestStatus.SENT, resumed.getStatus());
        assertEquals("digest-post-0", resumed.getMessageRef());
        assertTrue(batchQueueRepository.findAll().isEmpty());
    }

    @Test
    void testPendingDispatchKeepsItsEntriesOutOfNewDigests() {
        String first = queue("msg-1");
        String heldKey = BatchDigestScheduler.digestKey(USER, batchQueueRepository.findByUserIdOrderByScheduledTimeAsc(USER));
        pendingDispatch(heldKey, first);
        String second = queue("msg-2");

        scheduler.drainAndDispatch(USER);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DigestItem>> items = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);
        verify(notifier, times(2)).notifyDigest(eq(USER), anyString(), items.capture(), keys.capture());
        assertEquals(List.of(heldKey), keys.getAllValues().subList(0, 1));
        assertEquals(Set.of(first), entryIds(items.getAllValues().get(0)));
        assertEquals(Set.of(second), entryIds(items.getAllValues().get(1)));
        verify(notifier).findDelivered(eq(USER), eq(heldKey), any());
        assertEquals(DigestStatus.SENT, digestDispatchRepository.findByDigestKey(heldKey).orElseThrow().getStatus());
    }

    @Test
    void testEntryStampedWithUnknownDispatchIsOfferedAgain() {
        String instanceId = queue("msg-1");
        BatchQueueEntry entry = batchQueueRepository.findByInstanceId(instanceId).orElseThrow();
        entry.setDispatchKey("digest_lost");
        batchQueueRepository.save(entry);

        DigestOutcome outcome = scheduler.drainAndDispatch(USER);

        assertEquals(DigestOutcome.Status.SENT, outcome.status());
        assertNotEquals("digest_lost", outcome.digestKey());
        verify(notifier).notifyDigest(eq(USER), anyString(), anyList(), eq(outcome.digestKey()));
        assertEquals(WorkflowState.AWAITING_APPROVAL, instanceRepository.findById(instanceId).orElseThrow().getCurrentState());
    }

    @Test
    void testPendingDispatchWithNothingLeftIsDiscarded() {
        pendingDispatch("digest_stale", "wf-gone");
        queue("msg-1");

        DigestOutcome outcome = scheduler.drainAndDispatch(USER);

        assertEquals(DigestOutcome.Status.SENT, outcome.status());
        assertEquals(DigestStatus.DISCARDED, digestDispatchRepository.findByDigestKey("digest_stale").orElseThrow().getStatus());
        verify(notifier, never()).findDelivered(anyString(), eq("digest_stale"), any());
    }

    @Test
    void testCancelledEntryIsDropped() {
        String cancelled = queue("msg-1");
        instanceRepository.findById(cancelled).ifPresent(instance -> {
            instance.setTerminalReason(TerminalReason.REJECTED);
            instanceRepository.save(instance);
        });

        DigestOutcome outcome = scheduler.drainAndDispatch(USER);

        assertEquals(DigestOutcome.Status.EMPTY, outcome.status());
        assertTrue(batchQueueRepository.findAll().isEmpty());
        verify(notifier, never()).notifyDigest(anyString(), anyString(), anyList(), anyString());
    }

    @Test
    void testIsDueOncePerDayAfterBatchTime() {
        NotificationPreferences preferences = preferences(LocalTime.of(18, 0), "Europe/Berlin");

        // 15:30 UTC is 17:30 in Berlin during summer time
        assertFalse(scheduler.isDue(preferences, Instant.parse("2026-07-01T15:30:00Z")));
        assertTrue(scheduler.isDue(preferences, Instant.parse("2026-07-01T16:05:00Z")));

        preferences.setLastDigestAt(LocalDateTime.of(2026, 7, 1, 18, 10));
        assertFalse(scheduler.isDue(preferences, Instant.parse("2026-07-01T19:00:00Z")));
        assertTrue(scheduler.isDue(preferences, Instant.parse("2026-07-02T16:00:00Z")));
    }

    @Test
    void testQuietHoursAndDisabledBatching() {
        NotificationPreferences preferences = preferences(LocalTime.of(21, 0), "UTC");
        preferences.setQuietHoursStart(LocalTime.of(22, 0));
        preferences.setQuietHoursEnd(LocalTime.of(7, 0));

        assertTrue(scheduler.isDue(preferences, Instant.parse("2026-07-01T21:30:00Z")));
        assertFalse(scheduler.isDue(preferences, Instant.parse("2026-07-01T23:30:00Z")));
        assertTrue(BatchDigestScheduler.inQuietHours(preferences, LocalTime.of(6, 59)));
        assertFalse(BatchDigestScheduler.inQuietHours(preferences, LocalTime.of(7, 0)));

        preferences.setBatchEnabled(false);
        assertTrue(scheduler.isDue(preferences, Instant.parse("2026-07-01T23:30:00Z")));
    }

    @Test
    void testDispatchIfDueSkipsBeforeBatchTime() {
        queue("msg-1");
        NotificationPreferences preferences = preferences(LocalTime.of(18, 0), "UTC");
        preferencesRepository.save(preferences);

        DigestOutcome early = scheduler.dispatchIfDue(USER, Instant.parse("2026-07-01T09:00:00Z"));

        assertEquals(DigestOutcome.Status.SKIPPED, early.status());
        verify(notifier, never()).notifyDigest(anyString(), anyString(), anyList(), anyString());
    }
}
