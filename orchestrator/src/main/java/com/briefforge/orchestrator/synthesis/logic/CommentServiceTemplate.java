package com.briefforge.orchestrator.synthesis.logic;

/**
 * Threaded comments workflow: soft delete when a comment has replies,
 * hard delete otherwise.
 */
final class CommentServiceTemplate {

    private CommentServiceTemplate() {}

    static final String SOURCE = """
            import { NotificationService, TaskRef } from './notificationService';
            import { SharingService } from './sharingService';

            /**
             * Threaded task comments.
             *
             * Deleting a comment that has replies keeps it as a placeholder so the
             * thread stays intact; a comment without replies is removed outright.
             */

            // ---------------------------------------------------------------------------
            // Types
            // ---------------------------------------------------------------------------

            export const MAX_COMMENT_LENGTH = 5000;
            export const DELETED_PLACEHOLDER = '[Comment deleted]';

            export interface Comment {
              id: string;
              taskId: string;
              userId: string;
              content: string;
              parentCommentId?: string;
              isEdited: boolean;
              deletedAt?: Date;
              createdAt: Date;
              updatedAt: Date;
            }

            export interface ThreadedComment extends Comment {
              replies: ThreadedComment[];
            }

            export type CommentDeletion =
              | { kind: 'soft'; commentId: string; replyCount: number }
              | { kind: 'hard'; commentId: string };

            export interface CommentStore {
              findTask(taskId: string): Promise<TaskRef & { userId: string } | null>;
              findById(id: string): Promise<Comment | null>;
              findByTask(taskId: string): Promise<Comment[]>;
              findReplies(commentId: string): Promise<Comment[]>;
              create(data: Omit<Comment, 'id' | 'isEdited'>): Promise<Comment>;
              update(id: string, data: Partial<Comment>): Promise<Comment>;
              delete(id: string): Promise<void>;
              touchTask(taskId: string, at: Date): Promise<void>;
            }

            export interface AuditLog {
              record(entry: {
                userId: string;
                action: 'comment_added' | 'comment_edited' | 'comment_deleted';
                entityType: 'task' | 'comment';
                entityId: string;
                changes: unknown;
              }): Promise<void>;
            }

            function assertNever(value: never): never {
              throw new Error(`Unexpected value: ${JSON.stringify(value)}`);
            }

            export function validateContent(content: string | undefined): string {
              if (!content || content.trim().length === 0) {
                throw new Error('Comment content is required');
              }
              if (content.length > MAX_COMMENT_LENGTH) {
                throw new Error(`Comment is too long (max ${MAX_COMMENT_LENGTH} characters)`);
              }
              return content.trim();
            }

            // ---------------------------------------------------------------------------
            // Service
            // ---------------------------------------------------------------------------

            export class CommentService {
              constructor(
                private readonly store: CommentStore,
                private readonly sharing: SharingService,
                private readonly notifications: NotificationService,
                private readonly audit: AuditLog
              ) {}

              async addComment(taskId: string, userId: string, content: string, parentCommentId?: string): Promise<Comment> {
                const task = await this.store.findTask(taskId);
                if (!task) {
                  throw new Error('Task not found');
                }

                if (!(await this.sharing.hasPermission(taskId, userId, 'comment'))) {
                  throw new Error('You do not have permission to comment on this task');
                }

                const text = validateContent(content);

                let parent: Comment | null = null;
                if (parentCommentId) {
                  parent = await this.store.findById(parentCommentId);
                  if (!parent || parent.taskId !== taskId) {
                    throw new Error('Parent comment not found');
                  }
                }

                const now = new Date();
                const comment = await this.store.create({ taskId, userId, content: text, parentCommentId, createdAt: now, updatedAt: now });
                await this.store.touchTask(taskId, now);
                await this.audit.record({ userId, action: 'comment_added', entityType: 'task', entityId: taskId, changes: { commentId: comment.id } });

                const notified = new Set<string>([userId]);
                for (const collaborator of await this.sharing.getTaskCollaborators(taskId)) {
                  if (notified.has(collaborator.user.id)) continue;
                  notified.add(collaborator.user.id);
                  await this.notifications.notifyNewComment(collaborator.user.id, task, userId);
                }
                if (parent && !notified.has(parent.userId)) {
                  await this.notifications.notifyNewComment(parent.userId, task, userId);
                }

                return comment;
              }

              async editComment(commentId: string, userId: string, newContent: string): Promise<Comment> {
                const comment = await this.store.findById(commentId);
                if (!comment) {
                  throw new Error('Comment not found');
                }
                if (comment.userId !== userId) {
                  throw new Error('You can only edit your own comments');
                }

                const text = validateContent(newContent);
                const updated = await this.store.update(commentId, { content: text, updatedAt: new Date(), isEdited: true });

                await this.audit.record({
                  userId,
                  action: 'comment_edited',
                  entityType: 'comment',
                  entityId: commentId,
                  changes: { previousContent: comment.content, newContent: text }
                });
                return updated;
              }

              /** The commenter or the task owner may delete. */
              async deleteComment(commentId: string, userId: string): Promise<CommentDeletion> {
                const comment = await this.store.findById(commentId);
                if (!comment) {
                  throw new Error('Comment not found');
                }

                const task = await this.store.findTask(comment.taskId);
                if (!task) {
                  throw new Error('Task not found');
                }
                if (comment.userId !== userId && task.userId !== userId) {
                  throw new Error('You do not have permission to delete this comment');
                }

                const replies = await this.store.findReplies(commentId);
                const deletion: CommentDeletion = replies.length > 0
                  ? { kind: 'soft', commentId, replyCount: replies.length }
                  : { kind: 'hard', commentId };

                switch (deletion.kind) {
                  case 'soft':
                    await this.store.update(commentId, { content: DELETED_PLACEHOLDER, deletedAt: new Date() });
                    break;
                  case 'hard':
                    await this.store.delete(commentId);
                    break;
                  default:
                    assertNever(deletion);
                }

                await this.audit.record({ userId, action: 'comment_deleted', entityType: 'comment', entityId: commentId, changes: deletion });
                return deletion;
              }

              async getTaskComments(taskId: string, userId: string): Promise<ThreadedComment[]> {
                if (!(await this.sharing.canAccessTask(taskId, userId))) {
                  throw new Error('You do not have access to this task');
                }
                return buildCommentThread(await this.store.findByTask(taskId));
              }
            }

            /** Nests replies under their parents; roots and replies sorted oldest first. */
            export function buildCommentThread(comments: Comment[]): ThreadedComment[] {
              const byId = new Map<string, ThreadedComment>();
              for (const comment of comments) {
                byId.set(comment.id, { ...comment, replies: [] });
              }

              const roots: ThreadedComment[] = [];
              for (const comment of comments) {
                const node = byId.get(comment.id)!;
                const parent = comment.parentCommentId ? byId.get(comment.parentCommentId) : undefined;
                if (parent) {
                  parent.replies.push(node);
                } else {
                  roots.push(node);
                }
              }

              sortByDate(roots);
              return roots;
            }

            function sortByDate(comments: ThreadedComment[]): void {
              comments.sort((a, b) => new Date(a.createdAt).getTime() - new Date(b.createdAt).getTime());
              for (const comment of comments) {
                sortByDate(comment.replies);
              }
            }
            """;
}
