package com.briefforge.orchestrator.synthesis.frontend;

/**
 * React + TypeScript component sources. Components only import files
 * emitted by the same family.
 */
final class ComponentTemplates {

    private ComponentTemplates() {}

    // ------------------------------------------------------------------
    // Auth
    // ------------------------------------------------------------------

    static final String LOGIN_FORM = """
            import React, { useState } from 'react';
            import './AuthForm.css';

            interface LoginFormProps {
              onLogin: (email: string, password: string) => Promise<void>;
              isLoading?: boolean;
            }

            type LoginErrors = Partial<Record<'email' | 'password' | 'form', string>>;

            const EMAIL_PATTERN = /^[^@ ]+@[^@ ]+[.][^@ ]+$/;

            export const LoginForm: React.FC<LoginFormProps> = ({ onLogin, isLoading = false }) => {
              const [email, setEmail] = useState('');
              const [password, setPassword] = useState('');
              const [errors, setErrors] = useState<LoginErrors>({});

              const validate = (): LoginErrors => {
                const next: LoginErrors = {};
                if (!email) next.email = 'Email is required';
                else if (!EMAIL_PATTERN.test(email)) next.email = 'Email is invalid';
                if (!password) next.password = 'Password is required';
                return next;
              };

              const handleSubmit = async (e: React.FormEvent) => {
                e.preventDefault();
                const found = validate();
                setErrors(found);
                if (Object.keys(found).length > 0) return;
                try {
                  await onLogin(email, password);
                } catch {
                  setErrors({ form: 'Login failed. Please check your credentials.' });
                }
              };

              return (
                <div className="auth-form-container">
                  <form onSubmit={handleSubmit} className="auth-form" noValidate>
                    <h2>Sign in</h2>
                    {errors.form && <div className="form-error" role="alert">{errors.form}</div>}

                    <div className="form-group">
                      <label htmlFor="login-email">Email</label>
                      <input
                        id="login-email"
                        type="email"
                        value={email}
                        onChange={e => setEmail(e.target.value)}
                        className={errors.email ? 'error' : ''}
                        disabled={isLoading}
                      />
                      {errors.email && <span className="error-message">{errors.email}</span>}
                    </div>

                    <div className="form-group">
                      <label htmlFor="login-password">Password</label>
                      <input
                        id="login-password"
                        type="password"
                        value={password}
                        onChange={e => setPassword(e.target.value)}
                        className={errors.password ? 'error' : ''}
                        disabled={isLoading}
                      />
                      {errors.password && <span className="error-message">{errors.password}</span>}
                    </div>

                    <button type="submit" disabled={isLoading} className="submit-btn">
                      {isLoading ? 'Signing in...' : 'Sign in'}
                    </button>
                  </form>
                </div>
              );
            };
            """;

    static final String REGISTER_FORM = """
            import React, { useState } from 'react';
            import './AuthForm.css';

            export interface RegistrationData {
              name: string;
              email: string;
              password: string;
            }

            interface RegisterFormProps {
              onRegister: (data: RegistrationData) => Promise<void>;
              isLoading?: boolean;
            }

            type RegisterField = keyof RegistrationData | 'confirmPassword';
            type RegisterErrors = Partial<Record<RegisterField | 'form', string>>;

            const EMAIL_PATTERN = /^[^@ ]+@[^@ ]+[.][^@ ]+$/;

            export const RegisterForm: React.FC<RegisterFormProps> = ({ onRegister, isLoading = false }) => {
              const [values, setValues] = useState<Record<RegisterField, string>>({
                name: '', email: '', password: '', confirmPassword: ''
              });
              const [errors, setErrors] = useState<RegisterErrors>({});

              const update = (field: RegisterField) => (e: React.ChangeEvent<HTMLInputElement>) =>
                setValues(prev => ({ ...prev, [field]: e.target.value }));

              const validate = (): RegisterErrors => {
                const next: RegisterErrors = {};
                if (!values.name.trim()) next.name = 'Name is required';
                if (!EMAIL_PATTERN.test(values.email)) next.email = 'Email is invalid';
                if (values.password.length < 8) next.password = 'Password must be at least 8 characters';
                else if (!/[A-Z]/.test(values.password) || !/[0-9]/.test(values.password)) {
                  next.password = 'Password needs an upper case letter and a digit';
                }
                if (values.confirmPassword !== values.password) next.confirmPassword = 'Passwords do not match';
                return next;
              };

              const handleSubmit = async (e: React.FormEvent) => {
                e.preventDefault();
                const found = validate();
                setErrors(found);
                if (Object.keys(found).length > 0) return;
                try {
                  await onRegister({ name: values.name.trim(), email: values.email, password: values.password });
                } catch {
                  setErrors({ form: 'Registration failed. Please try again.' });
                }
              };

              const field = (name: RegisterField, label: string, type: string) => (
                <div className="form-group">
                  <label htmlFor={`register-${name}`}>{label}</label>
                  <input
                    id={`register-${name}`}
                    type={type}
                    value={values[name]}
                    onChange={update(name)}
                    className={errors[name] ? 'error' : ''}
                    disabled={isLoading}
                  />
                  {errors[name] && <span className="error-message">{errors[name]}</span>}
                </div>
              );

              return (
                <div className="auth-form-container">
                  <form onSubmit={handleSubmit} className="auth-form" noValidate>
                    <h2>Create account</h2>
                    {errors.form && <div className="form-error" role="alert">{errors.form}</div>}
                    {field('name', 'Name', 'text')}
                    {field('email', 'Email', 'email')}
                    {field('password', 'Password', 'password')}
                    {field('confirmPassword', 'Confirm password', 'password')}
                    <button type="submit" disabled={isLoading} className="submit-btn">
                      {isLoading ? 'Creating account...' : 'Create account'}
                    </button>
                  </form>
                </div>
              );
            };
            """;

    static final String AUTH_FORM_CSS = """
            .auth-form-container {
              display: flex;
              justify-content: center;
              align-items: center;
              min-height: 100vh;
              padding: 1rem;
              background: #f5f7fa;
            }

            .auth-form {
              width: 100%;
              max-width: 400px;
              padding: 2rem;
              background: #fff;
              border-radius: 8px;
              box-shadow: 0 4px 12px rgba(0, 0, 0, 0.08);
            }

            .auth-form h2 {
              margin: 0 0 1.5rem;
              text-align: center;
              color: #1f2937;
            }

            .form-group {
              margin-bottom: 1rem;
            }

            .form-group label {
              display: block;
              margin-bottom: 0.25rem;
              font-weight: 500;
              color: #374151;
            }

            .form-group input {
              width: 100%;
              padding: 0.6rem 0.75rem;
              border: 1px solid #d1d5db;
              border-radius: 4px;
              font-size: 1rem;
              box-sizing: border-box;
            }

            .form-group input:focus {
              outline: none;
              border-color: #3b82f6;
              box-shadow: 0 0 0 2px rgba(59, 130, 246, 0.25);
            }

            .form-group input.error {
              border-color: #dc2626;
            }

            .error-message,
            .form-error {
              display: block;
              margin-top: 0.25rem;
              font-size: 0.875rem;
              color: #dc2626;
            }

            .submit-btn {
              width: 100%;
              padding: 0.75rem;
              border: none;
              border-radius: 4px;
              background: #3b82f6;
              color: #fff;
              font-size: 1rem;
              cursor: pointer;
            }

            .submit-btn:disabled {
              background: #9ca3af;
              cursor: not-allowed;
            }
            """;

    // ------------------------------------------------------------------
    // Tasks
    // ------------------------------------------------------------------

    static final String TASK_TYPES = """
            export type TaskPriority = 'low' | 'medium' | 'high';

            export interface Task {
              id: string;
              title: string;
              description?: string;
              completed: boolean;
              priority: TaskPriority;
              dueDate?: string;
              createdAt: string;
              updatedAt: string;
              userId?: string;
              sharedWith?: string[];
            }

            export type TaskDraft = Pick<Task, 'title' | 'description' | 'priority' | 'dueDate'>;

            export type TaskFilter = 'all' | 'active' | 'completed';

            export function matchesFilter(task: Task, filter: TaskFilter): boolean {
              switch (filter) {
                case 'all':
                  return true;
                case 'active':
                  return !task.completed;
                case 'completed':
                  return task.completed;
                default: {
                  const unreachable: never = filter;
                  throw new Error(`Unknown filter: ${String(unreachable)}`);
                }
              }
            }
            """;

    static final String TASK_LIST = """
            import React, { useMemo, useState } from 'react';
            import { Task, TaskFilter, matchesFilter } from '../../types/Task';
            import { TaskItem } from './TaskItem';

            interface TaskListProps {
              tasks: Task[];
              onToggle: (id: string) => void;
              onDelete: (id: string) => void;
              onEdit?: (task: Task) => void;
            }

            const FILTERS: TaskFilter[] = ['all', 'active', 'completed'];

            export const TaskList: React.FC<TaskListProps> = ({ tasks, onToggle, onDelete, onEdit }) => {
              const [filter, setFilter] = useState<TaskFilter>('all');

              const visible = useMemo(() => tasks.filter(task => matchesFilter(task, filter)), [tasks, filter]);
              const remaining = tasks.filter(task => !task.completed).length;

              return (
                <section className="task-list">
                  <header className="task-list-header">
                    <span>{remaining} remaining</span>
                    <div className="task-filters" role="tablist">
                      {FILTERS.map(f => (
                        <button
                          key={f}
                          role="tab"
                          aria-selected={filter === f}
                          className={filter === f ? 'active' : ''}
                          onClick={() => setFilter(f)}
                        >
                          {f}
                        </button>
                      ))}
                    </div>
                  </header>

                  {visible.length === 0 ? (
                    <p className="task-list-empty">No tasks to show.</p>
                  ) : (
                    <ul>
                      {visible.map(task => (
                        <TaskItem key={task.id} task={task} onToggle={onToggle} onDelete={onDelete} onEdit={onEdit} />
                      ))}
                    </ul>
                  )}
                </section>
              );
            };
            """;

    static final String TASK_ITEM = """
            import React from 'react';
            import { Task } from '../../types/Task';

            interface TaskItemProps {
              task: Task;
              onToggle: (id: string) => void;
              onDelete: (id: string) => void;
              onEdit?: (task: Task) => void;
            }

            function isOverdue(task: Task): boolean {
              return !task.completed && !!task.dueDate && new Date(task.dueDate).getTime() < Date.now();
            }

            export const TaskItem: React.FC<TaskItemProps> = ({ task, onToggle, onDelete, onEdit }) => {
              const classes = ['task-item', `priority-${task.priority}`];
              if (task.completed) classes.push('completed');
              if (isOverdue(task)) classes.push('overdue');

              return (
                <li className={classes.join(' ')}>
                  <input
                    type="checkbox"
                    checked={task.completed}
                    onChange={() => onToggle(task.id)}
                    aria-label={`Mark ${task.title} as ${task.completed ? 'active' : 'completed'}`}
                  />
                  <div className="task-content">
                    <span className="task-title">{task.title}</span>
                    {task.description && <p className="task-description">{task.description}</p>}
                    {task.dueDate && <small>Due {new Date(task.dueDate).toLocaleDateString()}</small>}
                  </div>
                  <div className="task-actions">
                    {onEdit && <button onClick={() => onEdit(task)}>Edit</button>}
                    <button
                      onClick={() => {
                        if (window.confirm(`Delete "${task.title}"?`)) onDelete(task.id);
                      }}
                    >
                      Delete
                    </button>
                  </div>
                </li>
              );
            };
            """;

    static final String TASK_FORM = """
            import React, { useState } from 'react';
            import { TaskDraft, TaskPriority } from '../../types/Task';

            interface TaskFormProps {
              initial?: TaskDraft;
              onSubmit: (draft: TaskDraft) => Promise<void> | void;
              onCancel?: () => void;
            }

            const PRIORITIES: TaskPriority[] = ['low', 'medium', 'high'];
            const MAX_TITLE = 200;

            export const TaskForm: React.FC<TaskFormProps> = ({ initial, onSubmit, onCancel }) => {
              const [title, setTitle] = useState(initial?.title ?? '');
              const [description, setDescription] = useState(initial?.description ?? '');
              const [priority, setPriority] = useState<TaskPriority>(initial?.priority ?? 'medium');
              const [dueDate, setDueDate] = useState(initial?.dueDate ?? '');
              const [error, setError] = useState<string | null>(null);

              const handleSubmit = async (e: React.FormEvent) => {
                e.preventDefault();
                const trimmed = title.trim();
                if (!trimmed) {
                  setError('Title is required');
                  return;
                }
                if (trimmed.length > MAX_TITLE) {
                  setError(`Title must be at most ${MAX_TITLE} characters`);
                  return;
                }
                setError(null);
                await onSubmit({ title: trimmed, description: description.trim() || undefined, priority, dueDate: dueDate || undefined });
                if (!initial) {
                  setTitle('');
                  setDescription('');
                  setPriority('medium');
                  setDueDate('');
                }
              };

              return (
                <form className="task-form" onSubmit={handleSubmit} noValidate>
                  <input
                    type="text"
                    placeholder="What needs to be done?"
                    value={title}
                    onChange={e => setTitle(e.target.value)}
                    aria-invalid={!!error}
                  />
                  <textarea
                    placeholder="Description (optional)"
                    value={description}
                    onChange={e => setDescription(e.target.value)}
                  />
                  <select value={priority} onChange={e => setPriority(e.target.value as TaskPriority)}>
                    {PRIORITIES.map(p => (
                      <option key={p} value={p}>{p}</option>
                    ))}
                  </select>
                  <input type="date" value={dueDate} onChange={e => setDueDate(e.target.value)} />
                  {error && <span className="error-message">{error}</span>}
                  <div className="task-form-actions">
                    <button type="submit">{initial ? 'Save' : 'Add task'}</button>
                    {onCancel && <button type="button" onClick={onCancel}>Cancel</button>}
                  </div>
                </form>
              );
            };
            """;

    // ------------------------------------------------------------------
    // Sharing
    // ------------------------------------------------------------------

    static final String SHARE_TASK_MODAL = """
            import React, { useMemo, useState } from 'react';

            export type SharePermission = 'view' | 'comment' | 'edit';

            export interface ShareCandidate {
              id: string;
              name: string;
              email: string;
            }

            interface ShareTaskModalProps {
              isOpen: boolean;
              taskTitle: string;
              users: ShareCandidate[];
              onShare: (userIds: string[], permission: SharePermission) => Promise<void> | void;
              onClose: () => void;
              isLoading?: boolean;
            }

            const PERMISSIONS: SharePermission[] = ['view', 'comment', 'edit'];

            function describePermission(permission: SharePermission): string {
              switch (permission) {
                case 'view':
                  return 'Can view';
                case 'comment':
                  return 'Can comment';
                case 'edit':
                  return 'Can edit';
                default: {
                  const unreachable: never = permission;
                  return unreachable;
                }
              }
            }

            export const ShareTaskModal: React.FC<ShareTaskModalProps> = ({
              isOpen, taskTitle, users, onShare, onClose, isLoading = false
            }) => {
              const [search, setSearch] = useState('');
              const [selected, setSelected] = useState<string[]>([]);
              const [permission, setPermission] = useState<SharePermission>('view');

              const matches = useMemo(() => {
                const term = search.trim().toLowerCase();
                return term
                  ? users.filter(u => u.name.toLowerCase().includes(term) || u.email.toLowerCase().includes(term))
                  : users;
              }, [users, search]);

              if (!isOpen) return null;

              const toggle = (id: string) =>
                setSelected(prev => (prev.includes(id) ? prev.filter(x => x !== id) : [...prev, id]));

              const handleShare = async () => {
                if (selected.length === 0) return;
                await onShare(selected, permission);
                setSelected([]);
                setSearch('');
                onClose();
              };

              return (
                <div className="modal-backdrop" onClick={onClose}>
                  <div className="modal" role="dialog" aria-modal="true" onClick={e => e.stopPropagation()}>
                    <h3>Share "{taskTitle}"</h3>
                    <input
                      type="search"
                      placeholder="Search people by name or email"
                      value={search}
                      onChange={e => setSearch(e.target.value)}
                    />
                    <ul className="share-candidates">
                      {matches.map(user => (
                        <li key={user.id}>
                          <label>
                            <input type="checkbox" checked={selected.includes(user.id)} onChange={() => toggle(user.id)} />
                            {user.name} <small>{user.email}</small>
                          </label>
                        </li>
                      ))}
                      {matches.length === 0 && <li className="empty">No matching users</li>}
                    </ul>
                    <select value={permission} onChange={e => setPermission(e.target.value as SharePermission)}>
                      {PERMISSIONS.map(p => (
                        <option key={p} value={p}>{describePermission(p)}</option>
                      ))}
                    </select>
                    <div className="modal-actions">
                      <button onClick={onClose} disabled={isLoading}>Cancel</button>
                      <button onClick={handleShare} disabled={isLoading || selected.length === 0}>
                        {isLoading ? 'Sharing...' : `Share with ${selected.length}`}
                      </button>
                    </div>
                  </div>
                </div>
              );
            };
            """;
}
