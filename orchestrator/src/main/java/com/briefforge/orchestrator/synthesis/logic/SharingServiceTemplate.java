package com.briefforge.orchestrator.synthesis.logic;

/**
 * Sharing and permission workflow. Three-tier hierarchy view &lt; comment &lt; edit;
 * owner and assignee implicitly hold edit; revocation is owner-only.
 */
final class SharingServiceTemplate {

    private SharingServiceTemplate() {}

    static final String SOURCE = """
            import { NotificationService } from './notificationService';

            /**
             * Task sharing and permission checks.
             *
             * Permission hierarchy: view < comment < edit. The owner and the assignee
             * implicitly hold 'edit'. Only the owner can revoke a share.
             */

            // ---------------------------------------------------------------------------
            // Types
            // ---------------------------------------------------------------------------

            export type SharePermission = 'view' | 'comment' | 'edit';

            export interface SharedTask {
              id: string;
              title: string;
              userId: string;
              assignedTo?: string;
            }

            export interface TaskShare {
              id: string;
              taskId: string;
              userId: string;
              permission: SharePermission;
              sharedBy: string;
              createdAt: Date;
              updatedAt?: Date;
            }

            export interface CollaboratorUser {
              id: string;
              name: string;
              email: string;
              avatarUrl?: string;
            }

            export type Collaborator =
              | { role: 'owner'; user: CollaboratorUser }
              | { role: 'assignee'; user: CollaboratorUser }
              | { role: 'shared'; user: CollaboratorUser; permission: SharePermission };

            export interface SharingStore {
              findTask(taskId: string): Promise<SharedTask | null>;
              findShare(taskId: string, userId: string): Promise<TaskShare | null>;
              findSharesByTask(taskId: string): Promise<TaskShare[]>;
              createShare(data: Omit<TaskShare, 'id'>): Promise<TaskShare>;
              updateShare(id: string, data: Partial<TaskShare>): Promise<TaskShare>;
              deleteShare(id: string): Promise<void>;
              findUser(id: string): Promise<CollaboratorUser | null>;
              findUsers(ids: string[]): Promise<CollaboratorUser[]>;
            }

            export interface AuditLog {
              record(entry: { userId: string; action: 'task_shared' | 'share_revoked'; entityType: 'task'; entityId: string; changes: unknown }): Promise<void>;
            }

            function assertNever(value: never): never {
              throw new Error(`Unexpected value: ${JSON.stringify(value)}`);
            }

            export function permissionLevel(permission: SharePermission): number {
              switch (permission) {
                case 'view':
                  return 1;
                case 'comment':
                  return 2;
                case 'edit':
                  return 3;
                default:
                  return assertNever(permission);
              }
            }

            export function satisfies(granted: SharePermission, required: SharePermission): boolean {
              return permissionLevel(granted) >= permissionLevel(required);
            }

            /** The permission a collaborator actually holds. */
            export function effectivePermission(collaborator: Collaborator): SharePermission {
              switch (collaborator.role) {
                case 'owner':
                case 'assignee':
                  return 'edit';
                case 'shared':
                  return collaborator.permission;
                default:
                  return assertNever(collaborator);
              }
            }

            // ---------------------------------------------------------------------------
            // Service
            // ---------------------------------------------------------------------------

            export class SharingService {
              constructor(
                private readonly store: SharingStore,
                private readonly notifications: NotificationService,
                private readonly audit: AuditLog
              ) {}

              /** Shares a task with users. Only the owner or the assignee may share. */
              async shareTask(taskId: string, sharedBy: string, userIds: string[], permission: SharePermission = 'view'): Promise<void> {
                const task = await this.requireTask(taskId);

                if (task.userId !== sharedBy && task.assignedTo !== sharedBy) {
                  throw new Error('You do not have permission to share this task');
                }

                const users = await this.store.findUsers(userIds);
                if (users.length !== userIds.length) {
                  throw new Error('One or more users not found');
                }

                for (const userId of userIds) {
                  const existing = await this.store.findShare(taskId, userId);
                  if (existing) {
                    if (existing.permission !== permission) {
                      await this.store.updateShare(existing.id, { permission, updatedAt: new Date() });
                    }
                    continue;
                  }

                  await this.store.createShare({ taskId, userId, permission, sharedBy, createdAt: new Date() });
                  await this.notifications.notifyTaskShared(userId, task, sharedBy, permission);
                  await this.audit.record({
                    userId: sharedBy,
                    action: 'task_shared',
                    entityType: 'task',
                    entityId: taskId,
                    changes: { sharedWith: userId, permission }
                  });
                }
              }

              async revokeShare(taskId: string, userId: string, revokedBy: string): Promise<void> {
                const task = await this.requireTask(taskId);

                if (task.userId !== revokedBy) {
                  throw new Error('Only the task owner can revoke sharing');
                }

                const share = await this.store.findShare(taskId, userId);
                if (!share) {
                  throw new Error('Share not found');
                }

                await this.store.deleteShare(share.id);
                await this.notifications.notifyShareRevoked(userId, task);
                await this.audit.record({
                  userId: revokedBy,
                  action: 'share_revoked',
                  entityType: 'task',
                  entityId: taskId,
                  changes: { revokedFrom: userId }
                });
              }

              async canAccessTask(taskId: string, userId: string): Promise<boolean> {
                return this.hasPermission(taskId, userId, 'view');
              }

              async hasPermission(taskId: string, userId: string, required: SharePermission): Promise<boolean> {
                const task = await this.store.findTask(taskId);
                if (!task) return false;

                if (task.userId === userId || task.assignedTo === userId) {
                  return true;
                }

                const share = await this.store.findShare(taskId, userId);
                return share !== null && satisfies(share.permission, required);
              }

              async getTaskCollaborators(taskId: string): Promise<Collaborator[]> {
                const task = await this.requireTask(taskId);
                const collaborators: Collaborator[] = [];

                const owner = await this.store.findUser(task.userId);
                if (owner) {
                  collaborators.push({ role: 'owner', user: owner });
                }

                if (task.assignedTo && task.assignedTo !== task.userId) {
                  const assignee = await this.store.findUser(task.assignedTo);
                  if (assignee) {
                    collaborators.push({ role: 'assignee', user: assignee });
                  }
                }

                for (const share of await this.store.findSharesByTask(taskId)) {
                  const user = await this.store.findUser(share.userId);
                  if (user) {
                    collaborators.push({ role: 'shared', user, permission: share.permission });
                  }
                }
                return collaborators;
              }

              private async requireTask(taskId: string): Promise<SharedTask> {
                const task = await this.store.findTask(taskId);
                if (!task) {
                  throw new Error('Task not found');
                }
                return task;
              }
            }
            """;
}
