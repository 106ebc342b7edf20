package com.briefforge.orchestrator.synthesis.logic;

/**
 * Notification dispatch workflow. Every notification goes through one
 * creation path that persists the record and then enqueues async delivery.
 */
final class NotificationServiceTemplate {

    private NotificationServiceTemplate() {}

    static final String SOURCE = """
            /**
             * Notification dispatch.
             *
             * Every notification is persisted first and then handed to the delivery
             * queue, so a failed push never loses the in-app record.
             */

            // ---------------------------------------------------------------------------
            // Types
            // ---------------------------------------------------------------------------

            export interface TaskRef {
              id: string;
              title: string;
              description?: string;
              priority?: string;
              dueDate?: Date;
              userId?: string;
              assignedTo?: string;
            }

            export type NotificationEvent =
              | { kind: 'task_assigned'; task: TaskRef }
              | { kind: 'task_unassigned'; task: TaskRef }
              | { kind: 'task_completed'; task: TaskRef }
              | { kind: 'task_escalated'; task: TaskRef; reason: string; recipientIsOwner: boolean }
              | { kind: 'task_shared'; task: TaskRef; sharedByName: string; permission: string }
              | { kind: 'share_revoked'; task: TaskRef }
              | { kind: 'task_deleted'; task: TaskRef }
              | { kind: 'task_unblocked'; task: TaskRef }
              | { kind: 'comment_added'; task: TaskRef; commenterName: string };

            export type NotificationType = NotificationEvent['kind'];

            export interface NotificationRecord {
              id: string;
              userId: string;
              type: NotificationType;
              title: string;
              message: string;
              referenceId?: string;
              isRead: boolean;
              createdAt: Date;
            }

            export interface NotificationStore {
              create(data: Omit<NotificationRecord, 'id'>): Promise<NotificationRecord>;
              findById(id: string): Promise<NotificationRecord | null>;
              update(id: string, data: Partial<NotificationRecord>): Promise<NotificationRecord>;
              markAllReadByUser(userId: string): Promise<number>;
              findUnreadByUser(userId: string): Promise<NotificationRecord[]>;
            }

            export interface UserDirectory {
              findById(id: string): Promise<{ id: string; name: string; email: string; isActive: boolean } | null>;
            }

            export interface DeliveryQueue {
              addNotificationJob(job: { userId: string; type: NotificationType; message: string; referenceId?: string }): Promise<void>;
              addEmailJob(job: { to: string; subject: string; html: string }): Promise<void>;
            }

            function assertNever(value: never): never {
              throw new Error(`Unhandled notification event: ${JSON.stringify(value)}`);
            }

            /** Title and message for an event. Exhaustive over NotificationEvent. */
            export function describeEvent(event: NotificationEvent): { title: string; message: string } {
              switch (event.kind) {
                case 'task_assigned':
                  return { title: 'New Task Assigned', message: `You have been assigned to: "${event.task.title}"` };
                case 'task_unassigned':
                  return { title: 'Task Unassigned', message: `You have been unassigned from: "${event.task.title}"` };
                case 'task_completed':
                  return { title: 'Task Completed', message: `Your task "${event.task.title}" has been completed` };
                case 'task_escalated':
                  return {
                    title: 'Task Escalated',
                    message: event.recipientIsOwner
                      ? `Your task "${event.task.title}" has been escalated: ${event.reason}`
                      : `Task "${event.task.title}" has been escalated: ${event.reason}`
                  };
                case 'task_shared':
                  return {
                    title: 'Task Shared With You',
                    message: `${event.sharedByName} shared a task with you: "${event.task.title}" (${event.permission} access)`
                  };
                case 'share_revoked':
                  return { title: 'Task Share Revoked', message: `Your access to task "${event.task.title}" has been revoked` };
                case 'task_deleted':
                  return { title: 'Task Deleted', message: `Task "${event.task.title}" has been deleted` };
                case 'task_unblocked':
                  return { title: 'Task Ready', message: `Task "${event.task.title}" is now ready to work on` };
                case 'comment_added':
                  return { title: 'New Comment', message: `${event.commenterName} commented on "${event.task.title}"` };
                default:
                  return assertNever(event);
              }
            }

            // ---------------------------------------------------------------------------
            // Service
            // ---------------------------------------------------------------------------

            export class NotificationService {
              constructor(
                private readonly store: NotificationStore,
                private readonly users: UserDirectory,
                private readonly queue: DeliveryQueue
              ) {}

              /** The single creation path: persist, then enqueue for delivery. */
              async notify(userId: string, event: NotificationEvent): Promise<NotificationRecord> {
                const { title, message } = describeEvent(event);
                const record = await this.store.create({
                  userId,
                  type: event.kind,
                  title,
                  message,
                  referenceId: event.task.id,
                  isRead: false,
                  createdAt: new Date()
                });

                await this.queue.addNotificationJob({
                  userId,
                  type: event.kind,
                  message,
                  referenceId: event.task.id
                });

                return record;
              }

              async notifyTaskAssigned(userId: string, task: TaskRef): Promise<void> {
                await this.notify(userId, { kind: 'task_assigned', task });

                const user = await this.users.findById(userId);
                if (user?.email) {
                  await this.queue.addEmailJob({
                    to: user.email,
                    subject: 'New Task Assigned to You',
                    html: renderAssignmentEmail(task)
                  });
                }
              }

              async notifyTaskUnassigned(userId: string, task: TaskRef): Promise<void> {
                await this.notify(userId, { kind: 'task_unassigned', task });
              }

              async notifyTaskCompleted(userId: string, task: TaskRef): Promise<void> {
                await this.notify(userId, { kind: 'task_completed', task });
              }

              /** Notifies the assignee and, when different, the owner. */
              async notifyTaskEscalated(task: TaskRef, reason: string): Promise<void> {
                if (task.assignedTo) {
                  await this.notify(task.assignedTo, { kind: 'task_escalated', task, reason, recipientIsOwner: false });
                }
                if (task.userId && task.userId !== task.assignedTo) {
                  await this.notify(task.userId, { kind: 'task_escalated', task, reason, recipientIsOwner: true });
                }
              }

              async notifyTaskShared(userId: string, task: TaskRef, sharedBy: string, permission: string): Promise<void> {
                const sharer = await this.users.findById(sharedBy);
                await this.notify(userId, {
                  kind: 'task_shared',
                  task,
                  sharedByName: sharer?.name ?? 'Someone',
                  permission
                });
              }

              async notifyShareRevoked(userId: string, task: TaskRef): Promise<void> {
                await this.notify(userId, { kind: 'share_revoked', task });
              }

              async notifyTaskDeleted(userId: string, task: TaskRef): Promise<void> {
                await this.notify(userId, { kind: 'task_deleted', task });
              }

              async notifyTaskUnblocked(userId: string, task: TaskRef): Promise<void> {
                await this.notify(userId, { kind: 'task_unblocked', task });
              }

              async notifyNewComment(userId: string, task: TaskRef, commenterId: string): Promise<void> {
                const commenter = await this.users.findById(commenterId);
                await this.notify(userId, {
                  kind: 'comment_added',
                  task,
                  commenterName: commenter?.name ?? 'Someone'
                });
              }

              async markAsRead(notificationId: string, userId: string): Promise<void> {
                const notification = await this.store.findById(notificationId);
                if (!notification || notification.userId !== userId) {
                  throw new Error('Notification not found or access denied');
                }
                await this.store.update(notificationId, { isRead: true });
              }

              async markAllAsRead(userId: string): Promise<number> {
                return this.store.markAllReadByUser(userId);
              }

              async getUnreadNotifications(userId: string): Promise<NotificationRecord[]> {
                return this.store.findUnreadByUser(userId);
              }
            }

            function renderAssignmentEmail(task: TaskRef): string {
              const due = task.dueDate ? new Date(task.dueDate).toLocaleDateString() : 'Not set';
              return `<!DOCTYPE html>
            <html>
              <body style="font-family: Arial, sans-serif;">
                <h2>New Task Assigned</h2>
                <p>You have been assigned a new task:</p>
                <div style="background: #f3f4f6; padding: 15px; margin: 10px 0;">
                  <h3>${task.title}</h3>
                  <p>${task.description ?? 'No description provided'}</p>
                  <p><strong>Priority:</strong> ${task.priority ?? 'medium'}</p>
                  <p><strong>Due Date:</strong> ${due}</p>
                </div>
              </body>
            </html>`;
            }
            """;
}
