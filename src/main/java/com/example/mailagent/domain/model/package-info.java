/**
 * Persistent workflow state.
 *
 * Key entities:
 * - WorkflowInstance: one execution of the workflow for one inbound email
 * - Checkpoint: append-only snapshot log used for crash recovery
 * - PendingAction: idempotency ledger for every external side effect
 * - ExternalCorrelation: open link between a notification and a suspended instance
 * - BatchQueueEntry / DigestDispatch: non-priority queue and its dispatch markers
 * - ChannelLink, FolderCategory, NotificationPreferences: per-user settings read by the engine
 * - ApprovalHistory: audit of human decisions
 */
package com.example.mailagent.domain.model;
