package com.briefforge.orchestrator.synthesis.logic;

/**
 * Task lifecycle workflow: create, assign, complete, escalate, delete.
 */
final class TaskServiceTemplate {

    private TaskServiceTemplate() {}

    static final String SOURCE = """
            import { NotificationService } from './notificationService';

            /**
             * Task lifecycle rules.
             *
             *   - only the creator may delete a task, and only when nothing depends on it
             *   - a task cannot be completed while any of its subtasks is open
             *   - escalation to 'critical' notifies the assignee and the owner
             *   - an overdue 'high' task is escalated automatically
             */

            // ---------------------------------------------------------------------------
            // Types
            // ---------------------------------------------------------------------------

            export type TaskStatus = 'pending' | 'in_progress' | 'ready' | 'completed' | 'blocked';
            export type TaskPriority = 'low' | 'medium' | 'high' | 'critical';

            export const TASK_PRIORITIES: readonly TaskPriority[] = ['low', 'medium', 'high', 'critical'];

            export interface Task {
              id: string;
              title: string;
              description?: string;
              status: TaskStatus;
              priority: TaskPriority;
              userId: string;
              assignedTo?: string;
              parentTaskId?: string;
              dependencies: string[];
              dueDate?: Date;
              completedAt?: Date;
              createdAt: Date;
              updatedAt: Date;
            }

            export interface CreateTaskData {
              title: string;
              description?: string;
              priority?: TaskPriority;
              dueDate?: Date;
              assignedTo?: string;
              parentTaskId?: string;
              dependencies?: string[];
            }

            export interface TaskStore {
              create(data: Omit<Task, 'id'>): Promise<Task>;
              findById(id: string): Promise<Task | null>;
              findByIds(ids: string[]): Promise<Task[]>;
              findByParentId(parentId: string): Promise<Task[]>;
              findDependentTasks(taskId: string): Promise<Task[]>;
              findByDueDateRange(from: Date, to: Date): Promise<Task[]>;
              findOverdue(now: Date): Promise<Task[]>;
              countCompletedByUser(userId: string): Promise<number>;
              update(id: string, data: Partial<Task>): Promise<Task>;
              softDelete(id: string): Promise<void>;
            }

            export interface UserStore {
              findById(id: string): Promise<{ id: string; isActive: boolean } | null>;
              update(id: string, data: { totalCompletedTasks: number }): Promise<void>;
            }

            export interface SystemComments {
              addSystemComment(taskId: string, content: string): Promise<void>;
            }

            export type AuditAction =
              | 'task_created'
              | 'task_assigned'
              | 'task_completed'
              | 'task_priority_updated'
              | 'task_auto_escalated'
              | 'task_deleted';

            export interface AuditLog {
              record(entry: { userId: string; action: AuditAction; entityType: 'task'; entityId: string; changes: unknown }): Promise<void>;
            }

            function assertNever(value: never): never {
              throw new Error(`Unexpected value: ${JSON.stringify(value)}`);
            }

            /** Whether work on a task is still outstanding. */
            export function isOpen(status: TaskStatus): boolean {
              switch (status) {
                case 'pending':
                case 'in_progress':
                case 'ready':
                case 'blocked':
                  return true;
                case 'completed':
                  return false;
                default:
                  return assertNever(status);
              }
            }

            export function priorityRank(priority: TaskPriority): number {
              switch (priority) {
                case 'low':
                  return 1;
                case 'medium':
                  return 2;
                case 'high':
                  return 3;
                case 'critical':
                  return 4;
                default:
                  return assertNever(priority);
              }
            }

            // ---------------------------------------------------------------------------
            // Service
            // ---------------------------------------------------------------------------

            export class TaskService {
              constructor(
                private readonly tasks: TaskStore,
                private readonly users: UserStore,
                private readonly notifications: NotificationService,
                private readonly comments: SystemComments,
                private readonly audit: AuditLog
              ) {}

              async createTask(userId: string, data: CreateTaskData): Promise<Task> {
                validateTaskData(data);

                const now = new Date();
                const task = await this.tasks.create({
                  title: data.title.trim(),
                  description: data.description,
                  priority: data.priority ?? 'medium',
                  status: 'pending',
                  userId,
                  assignedTo: data.assignedTo,
                  parentTaskId: data.parentTaskId,
                  dependencies: data.dependencies ?? [],
                  dueDate: data.dueDate,
                  createdAt: now,
                  updatedAt: now
                });

                await this.audit.record({ userId, action: 'task_created', entityType: 'task', entityId: task.id, changes: data });

                if (data.assignedTo && data.assignedTo !== userId) {
                  await this.notifications.notifyTaskAssigned(data.assignedTo, task);
                }
                return task;
              }

              async assignTask(taskId: string, assignedTo: string, assignedBy: string): Promise<Task> {
                const task = await this.requireTask(taskId);

                if (task.userId !== assignedBy && task.assignedTo !== assignedBy) {
                  throw new Error('You do not have permission to assign this task');
                }
                if (task.userId === assignedTo && assignedBy === task.userId) {
                  throw new Error('Cannot assign task to yourself as the creator');
                }

                const target = await this.users.findById(assignedTo);
                if (!target || !target.isActive) {
                  throw new Error('Target user not found or inactive');
                }

                const previousAssignee = task.assignedTo;
                const updated = await this.tasks.update(taskId, { assignedTo, updatedAt: new Date() });

                await this.audit.record({
                  userId: assignedBy,
                  action: 'task_assigned',
                  entityType: 'task',
                  entityId: taskId,
                  changes: { previousAssignee, newAssignee: assignedTo }
                });

                await this.notifications.notifyTaskAssigned(assignedTo, updated);
                if (previousAssignee && previousAssignee !== assignedTo) {
                  await this.notifications.notifyTaskUnassigned(previousAssignee, updated);
                }
                return updated;
              }

              async completeTask(taskId: string, userId: string): Promise<Task> {
                const task = await this.requireTask(taskId);

                if (task.assignedTo !== userId && task.userId !== userId) {
                  throw new Error('You do not have permission to complete this task');
                }

                const subtasks = await this.tasks.findByParentId(taskId);
                const openSubtasks = subtasks.filter(st => isOpen(st.status));
                if (openSubtasks.length > 0) {
                  throw new Error(`Complete all ${openSubtasks.length} subtask(s) first`);
                }

                const now = new Date();
                const updated = await this.tasks.update(taskId, { status: 'completed', completedAt: now, updatedAt: now });

                await this.audit.record({ userId, action: 'task_completed', entityType: 'task', entityId: taskId, changes: { status: 'completed' } });

                if (task.userId !== userId) {
                  await this.notifications.notifyTaskCompleted(task.userId, updated);
                }

                await this.updateUserStatistics(userId);
                await this.unblockDependentTasks(taskId);
                return updated;
              }

              async updateTaskPriority(taskId: string, priority: TaskPriority, userId: string): Promise<Task> {
                const task = await this.requireTask(taskId);

                if (task.userId !== userId && task.assignedTo !== userId) {
                  throw new Error('You do not have permission to update this task');
                }

                const previousPriority = task.priority;
                const updated = await this.tasks.update(taskId, { priority, updatedAt: new Date() });

                await this.audit.record({
                  userId,
                  action: 'task_priority_updated',
                  entityType: 'task',
                  entityId: taskId,
                  changes: { previousPriority, newPriority: priority }
                });

                if (priority === 'critical' && priorityRank(previousPriority) < priorityRank('critical')) {
                  await this.notifications.notifyTaskEscalated(updated, 'Priority escalated to critical');
                }
                return updated;
              }

              /** Escalates an overdue, still-open 'high' task to 'critical'. */
              async checkTaskEscalation(taskId: string): Promise<boolean> {
                const task = await this.tasks.findById(taskId);
                if (!task) return false;

                const now = new Date();
                const overdue = task.dueDate !== undefined && new Date(task.dueDate) < now;
                if (!overdue || task.priority !== 'high' || !isOpen(task.status)) {
                  return false;
                }

                const updated = await this.tasks.update(taskId, { priority: 'critical', updatedAt: now });
                await this.comments.addSystemComment(taskId, 'Auto-escalated to critical priority due to overdue status');
                await this.notifications.notifyTaskEscalated(updated, 'Task is overdue and has been escalated');
                await this.audit.record({
                  userId: 'system',
                  action: 'task_auto_escalated',
                  entityType: 'task',
                  entityId: taskId,
                  changes: { priority: 'critical', reason: 'overdue' }
                });
                return true;
              }

              async deleteTask(taskId: string, userId: string): Promise<void> {
                const task = await this.requireTask(taskId);

                if (task.userId !== userId) {
                  throw new Error('Only the task creator can delete this task');
                }

                const dependents = await this.tasks.findDependentTasks(taskId);
                if (dependents.length > 0) {
                  throw new Error(`Cannot delete task with ${dependents.length} dependent task(s)`);
                }

                await this.tasks.softDelete(taskId);
                await this.audit.record({ userId, action: 'task_deleted', entityType: 'task', entityId: taskId, changes: { deletedAt: new Date() } });

                if (task.assignedTo) {
                  await this.notifications.notifyTaskDeleted(task.assignedTo, task);
                }
              }

              async getTasksDueTomorrow(): Promise<Task[]> {
                const tomorrow = new Date();
                tomorrow.setDate(tomorrow.getDate() + 1);
                tomorrow.setHours(0, 0, 0, 0);
                const dayAfter = new Date(tomorrow);
                dayAfter.setDate(dayAfter.getDate() + 1);
                return this.tasks.findByDueDateRange(tomorrow, dayAfter);
              }

              async getOverdueTasks(): Promise<Task[]> {
                return this.tasks.findOverdue(new Date());
              }

              private async requireTask(taskId: string): Promise<Task> {
                const task = await this.tasks.findById(taskId);
                if (!task) {
                  throw new Error('Task not found');
                }
                return task;
              }

              private async updateUserStatistics(userId: string): Promise<void> {
                const completed = await this.tasks.countCompletedByUser(userId);
                await this.users.update(userId, { totalCompletedTasks: completed });
              }

              /** Moves dependents whose dependencies are all completed to 'ready'. */
              private async unblockDependentTasks(taskId: string): Promise<void> {
                const dependents = await this.tasks.findDependentTasks(taskId);
                for (const dependent of dependents) {
                  if (!(await this.allDependenciesCompleted(dependent))) continue;

                  const ready = await this.tasks.update(dependent.id, { status: 'ready', updatedAt: new Date() });
                  if (ready.assignedTo) {
                    await this.notifications.notifyTaskUnblocked(ready.assignedTo, ready);
                  }
                }
              }

              private async allDependenciesCompleted(task: Task): Promise<boolean> {
                if (task.dependencies.length === 0) return true;
                const dependencies = await this.tasks.findByIds(task.dependencies);
                return dependencies.every(dep => !isOpen(dep.status));
              }
            }

            export function validateTaskData(data: CreateTaskData): void {
              if (!data.title || data.title.trim().length === 0) {
                throw new Error('Task title is required');
              }
              if (data.title.length > 255) {
                throw new Error('Task title must be less than 255 characters');
              }
              if (data.dueDate && new Date(data.dueDate) < new Date()) {
                throw new Error('Due date cannot be in the past');
              }
              if (data.priority !== undefined && !TASK_PRIORITIES.includes(data.priority)) {
                throw new Error('Invalid priority value');
              }
            }
            """;
}
