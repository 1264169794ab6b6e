package com.example.mailagent.workflow.action;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.domain.model.*;
import com.example.mailagent.domain.repository.FolderCategoryRepository;
import com.example.mailagent.domain.repository.PendingActionRepository;
import com.example.mailagent.integration.MailboxClient;
import com.example.mailagent.integration.MailboxReceipt;
import com.example.mailagent.integration.PortFailure;
import com.example.mailagent.integration.PortResult;
import com.example.mailagent.integration.ReplyRequest;
import com.example.mailagent.workflow.RetryingCaller;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ActionExecutorTest {

    private MailboxClient mailboxClient;
    private PendingActionRepository pendingActionRepository;
    private FolderCategoryRepository folderCategoryRepository;
    private ExecutorService executor;
    private ActionExecutor actionExecutor;

    @BeforeEach
    void setUp() {
        mailboxClient = mock(MailboxClient.class);
        pendingActionRepository = mock(PendingActionRepository.class);
        folderCategoryRepository = mock(FolderCategoryRepository.class);
        when(pendingActionRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        when(pendingActionRepository.save(any(PendingAction.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(folderCategoryRepository.findByUserIdAndName("user-1", "Government"))
                .thenReturn(Optional.of(new FolderCategory("user-1", "Government", "Label_gov")));
        when(folderCategoryRepository.findByUserIdAndName("user-1", "Personal"))
                .thenReturn(Optional.of(new FolderCategory("user-1", "Personal", "Label_personal")));

        MailAgentProperties properties = new MailAgentProperties();
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setInitialDelay(Duration.ZERO);
        properties.getRetry().setCallTimeout(Duration.ofSeconds(2));
        executor = Executors.newFixedThreadPool(2);
        actionExecutor = new ActionExecutor(mailboxClient, pendingActionRepository, folderCategoryRepository,
                new RetryingCaller(properties, executor));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private WorkflowInstance instance(Decision decision, boolean needsResponse) {
        WorkflowInstance instance = new WorkflowInstance();
        instance.setId("wf-1");
        instance.setUserId("user-1");
        instance.setItemRef("msg-1");
        instance.setThreadId("thread-1");
        instance.setRfcMessageId("<msg-1@mail.example>");
        instance.setSender("Anna Schmidt <anna@example.com>");
        instance.setSubject("Tax return");
        instance.setProposedFolder("Government");
        instance.setNeedsResponse(needsResponse);
        instance.setDraftResponse(needsResponse ? "Thanks, documents follow." : null);
        instance.setDecision(decision);
        instance.setCurrentState(WorkflowState.RESOLVED);
        return instance;
    }

    @Test
    void testExecute_ApproveSendsReplyAndAppliesLabel() {
        when(mailboxClient.sendReply(any())).thenReturn(PortResult.success(new MailboxReceipt("sent-1", true)));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, true));

        assertTrue(result.isSuccessful());
        assertTrue(result.isReplySent());
        assertTrue(result.isLabelApplied());

        ArgumentCaptor<ReplyRequest> captor = ArgumentCaptor.forClass(ReplyRequest.class);
        verify(mailboxClient, times(1)).sendReply(captor.capture());
        assertEquals("wf-1:reply", captor.getValue().idempotencyKey());
        assertEquals("<msg-1@mail.example>", captor.getValue().inReplyTo());
        assertEquals("Anna Schmidt <anna@example.com>", captor.getValue().to());
        verify(mailboxClient, times(1)).applyLabel("msg-1", "Label_gov");
        verify(mailboxClient, never()).findReply(anyString());
    }

    @Test
    void testExecute_NoReplyWhenNotNeeded() {
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", false)));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, false));

        assertTrue(result.isSuccessful());
        assertFalse(result.isReplySent());
        assertTrue(result.isLabelApplied());
        verify(mailboxClient, never()).sendReply(any());

        ArgumentCaptor<PendingAction> saved = ArgumentCaptor.forClass(PendingAction.class);
        verify(pendingActionRepository, atLeastOnce()).save(saved.capture());
        PendingAction label = saved.getValue();
        assertEquals(ActionType.APPLY_LABEL, label.getActionType());
        assertEquals(PendingActionStatus.SENT, label.getStatus());
    }

    @Test
    void testExecute_ChangeUsesSelectedFolder() {
        WorkflowInstance instance = instance(Decision.CHANGE, false);
        instance.setSelectedFolder("Personal");
        when(mailboxClient.applyLabel("msg-1", "Label_personal")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance);

        assertTrue(result.isSuccessful());
        verify(mailboxClient).applyLabel("msg-1", "Label_personal");
        verify(mailboxClient, never()).applyLabel("msg-1", "Label_gov");
    }

    @Test
    void testExecute_DeliveredReplyIsNotSentAgain() {
        PendingAction delivered = new PendingAction("wf-1", ActionType.SEND_REPLY, "wf-1:reply");
        delivered.setStatus(PendingActionStatus.CONFIRMED);
        when(pendingActionRepository.findByIdempotencyKey("wf-1:reply")).thenReturn(Optional.of(delivered));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, true));

        assertTrue(result.isSuccessful());
        assertTrue(result.isReplySent());
        verify(mailboxClient, never()).sendReply(any());
        verify(mailboxClient, never()).findReply(anyString());
    }

    @Test
    void testExecute_UnrecordedReplyFoundInMailbox() {
        PendingAction inFlight = new PendingAction("wf-1", ActionType.SEND_REPLY, "wf-1:reply");
        when(pendingActionRepository.findByIdempotencyKey("wf-1:reply")).thenReturn(Optional.of(inFlight));
        when(mailboxClient.findReply("wf-1:reply")).thenReturn(PortResult.success(Optional.of(new MailboxReceipt("sent-9", true))));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, true));

        assertTrue(result.isReplySent());
        verify(mailboxClient, never()).sendReply(any());
        assertEquals(PendingActionStatus.CONFIRMED, inFlight.getStatus());
        assertEquals("sent-9", inFlight.getExternalRef());
    }

    @Test
    void testExecute_FailedLookupDoesNotSend() {
        PendingAction failed = new PendingAction("wf-1", ActionType.SEND_REPLY, "wf-1:reply");
        failed.setStatus(PendingActionStatus.FAILED);
        when(pendingActionRepository.findByIdempotencyKey("wf-1:reply")).thenReturn(Optional.of(failed));
        when(mailboxClient.findReply("wf-1:reply")).thenReturn(PortResult.failure(PortFailure.transientFailure("503")));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, true));

        assertFalse(result.isSuccessful());
        assertFalse(result.isReplySent());
        assertTrue(result.isLabelApplied());
        assertEquals(ErrorKind.TRANSIENT_EXTERNAL, result.failureKind());
        verify(mailboxClient, never()).sendReply(any());
    }

    @Test
    void testExecute_TimedOutReplyIsLookedUpBeforeResending() {
        when(mailboxClient.sendReply(any())).thenReturn(PortResult.failure(PortFailure.transientFailure("Read timed out")));
        when(mailboxClient.findReply("wf-1:reply")).thenReturn(PortResult.success(Optional.of(new MailboxReceipt("sent-3", true))));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, true));

        assertTrue(result.isSuccessful());
        assertTrue(result.isReplySent());
        verify(mailboxClient, times(1)).sendReply(any());
        verify(mailboxClient, times(1)).findReply("wf-1:reply");
    }

    @Test
    void testExecute_ReplySentAgainOnlyWhenLookupFindsNothing() {
        when(mailboxClient.sendReply(any()))
                .thenReturn(PortResult.failure(PortFailure.transientFailure("503 Service Unavailable")))
                .thenReturn(PortResult.success(new MailboxReceipt("sent-4", true)));
        when(mailboxClient.findReply("wf-1:reply")).thenReturn(PortResult.success(Optional.empty()));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, true));

        assertTrue(result.isReplySent());
        verify(mailboxClient, times(2)).sendReply(any());
        verify(mailboxClient, times(1)).findReply("wf-1:reply");
    }

    @Test
    void testExecute_SentRowsPromotedWhenMailboxConfirms() {
        PendingAction reply = new PendingAction("wf-1", ActionType.SEND_REPLY, "wf-1:reply");
        reply.setStatus(PendingActionStatus.SENT);
        PendingAction label = new PendingAction("wf-1", ActionType.APPLY_LABEL, "wf-1:label");
        label.setStatus(PendingActionStatus.SENT);
        when(pendingActionRepository.findByIdempotencyKey("wf-1:reply")).thenReturn(Optional.of(reply));
        when(pendingActionRepository.findByIdempotencyKey("wf-1:label")).thenReturn(Optional.of(label));
        when(mailboxClient.findReply("wf-1:reply")).thenReturn(PortResult.success(Optional.of(new MailboxReceipt("sent-5", true))));
        when(mailboxClient.checkLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, true));

        assertTrue(result.isSuccessful());
        assertEquals(PendingActionStatus.CONFIRMED, reply.getStatus());
        assertEquals("sent-5", reply.getExternalRef());
        assertEquals(PendingActionStatus.CONFIRMED, label.getStatus());
        verify(mailboxClient, never()).sendReply(any());
        verify(mailboxClient, never()).applyLabel(anyString(), anyString());
    }

    @Test
    void testExecute_SentRowStaysSentWithoutProof() {
        PendingAction label = new PendingAction("wf-1", ActionType.APPLY_LABEL, "wf-1:label");
        label.setStatus(PendingActionStatus.SENT);
        when(pendingActionRepository.findByIdempotencyKey("wf-1:label")).thenReturn(Optional.of(label));
        when(mailboxClient.checkLabel("msg-1", "Label_gov")).thenReturn(PortResult.failure(PortFailure.transientFailure("503")));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, false));

        assertTrue(result.isSuccessful());
        assertTrue(result.isLabelApplied());
        assertEquals(PendingActionStatus.SENT, label.getStatus());
        verify(mailboxClient, never()).applyLabel(anyString(), anyString());
    }

    @Test
    void testExecute_EditedReplyReplacesDraft() {
        WorkflowInstance instance = instance(Decision.APPROVE, true);
        instance.setEditedResponse("Thanks Anna, I will send the receipts on Monday.");
        when(mailboxClient.sendReply(any())).thenReturn(PortResult.success(new MailboxReceipt("sent-6", true)));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        actionExecutor.execute(instance);

        ArgumentCaptor<ReplyRequest> captor = ArgumentCaptor.forClass(ReplyRequest.class);
        verify(mailboxClient).sendReply(captor.capture());
        assertEquals("Thanks Anna, I will send the receipts on Monday.", captor.getValue().body());
    }

    @Test
    void testExecute_EditedReplySentWhenNoneWasDrafted() {
        WorkflowInstance instance = instance(Decision.APPROVE, false);
        instance.setEditedResponse("Noted, thanks.");
        when(mailboxClient.sendReply(any())).thenReturn(PortResult.success(new MailboxReceipt("sent-7", true)));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance);

        assertTrue(result.isReplySent());
        verify(mailboxClient).sendReply(argThat(request -> "Noted, thanks.".equals(request.body())));
    }

    @Test
    void testExecute_DeclinedReplyOnlyFiles() {
        WorkflowInstance instance = instance(Decision.APPROVE, true);
        instance.setReplyDeclined(true);
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.success(new MailboxReceipt("msg-1", true)));

        ActionResult result = actionExecutor.execute(instance);

        assertTrue(result.isSuccessful());
        assertFalse(result.isReplySent());
        assertTrue(result.isLabelApplied());
        verify(mailboxClient, never()).sendReply(any());
    }

    @Test
    void testExecute_SubActionsFailIndependently() {
        when(mailboxClient.sendReply(any())).thenReturn(PortResult.success(new MailboxReceipt("sent-1", true)));
        when(mailboxClient.applyLabel("msg-1", "Label_gov")).thenReturn(PortResult.failure(PortFailure.transientFailure("429 Too Many Requests")));

        ActionResult result = actionExecutor.execute(instance(Decision.APPROVE, true));

        assertFalse(result.isSuccessful());
        assertTrue(result.isReplySent());
        assertFalse(result.isLabelApplied());
        assertEquals(ErrorKind.TRANSIENT_EXTERNAL, result.failureKind());
        assertEquals("429 Too Many Requests", result.errorSummary());
        verify(mailboxClient, times(2)).applyLabel("msg-1", "Label_gov");
    }

    @Test
    void testExecute_UnknownFolderIsPermanent() {
        WorkflowInstance instance = instance(Decision.CHANGE, false);
        instance.setSelectedFolder("Archive");

        ActionResult result = actionExecutor.execute(instance);

        assertFalse(result.isSuccessful());
        assertEquals(ErrorKind.PERMANENT_EXTERNAL, result.failureKind());
        verify(mailboxClient, never()).applyLabel(anyString(), anyString());
    }

    @Test
    void testExecute_RejectDoesNothing() {
        ActionResult result = actionExecutor.execute(instance(Decision.REJECT, true));

        assertTrue(result.isSuccessful());
        assertFalse(result.isReplySent());
        assertFalse(result.isLabelApplied());
        verifyNoInteractions(mailboxClient);
    }
}
