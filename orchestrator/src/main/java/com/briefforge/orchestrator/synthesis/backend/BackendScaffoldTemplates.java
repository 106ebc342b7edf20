package com.briefforge.orchestrator.synthesis.backend;

/**
 * Express scaffolding shared by backend tasks.
 */
final class BackendScaffoldTemplates {

    private BackendScaffoldTemplates() {}

    static final String ENVIRONMENT = """
            import dotenv from 'dotenv';

            dotenv.config();

            export interface EnvironmentConfig {
              port: number;
              nodeEnv: 'development' | 'test' | 'production';
              jwtSecret: string;
              jwtExpiresIn: string;
              dbHost: string;
              dbPort: number;
              dbName: string;
              dbUser: string;
              dbPassword: string;
              corsOrigin: string;
              logLevel: string;
            }

            function parseNodeEnv(value: string | undefined): EnvironmentConfig['nodeEnv'] {
              return value === 'production' || value === 'test' ? value : 'development';
            }

            export const config: EnvironmentConfig = {
              port: parseInt(process.env.PORT || '3001', 10),
              nodeEnv: parseNodeEnv(process.env.NODE_ENV),
              jwtSecret: process.env.JWT_SECRET || '',
              jwtExpiresIn: process.env.JWT_EXPIRES_IN || '24h',
              dbHost: process.env.DB_HOST || 'localhost',
              dbPort: parseInt(process.env.DB_PORT || '5432', 10),
              dbName: process.env.DB_NAME || 'app',
              dbUser: process.env.DB_USER || 'postgres',
              dbPassword: process.env.DB_PASSWORD || '',
              corsOrigin: process.env.CORS_ORIGIN || 'http://localhost:3000',
              logLevel: process.env.LOG_LEVEL || 'info'
            };

            /** Call once at startup. Throws listing every missing variable. */
            export function validateEnvironment(): void {
              const required = ['JWT_SECRET'];
              if (config.nodeEnv === 'production') {
                required.push('DB_PASSWORD');
              }
              const missing = required.filter(name => !process.env[name]);
              if (missing.length > 0) {
                throw new Error(`Missing required environment variables: ${missing.join(', ')}`);
              }
            }
            """;

    static final String VALIDATION = """
            export interface ValidationError {
              field: string;
              message: string;
            }

            const EMAIL_PATTERN = /^[^@ ]+@[^@ ]+[.][^@ ]+$/;
            const UUID_PATTERN = /^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$/i;

            export function validateRequired(data: Record<string, unknown>, fields: readonly string[]): ValidationError[] {
              return fields
                .filter(field => data[field] === undefined || data[field] === null || String(data[field]).trim() === '')
                .map(field => ({ field, message: `${field} is required` }));
            }

            export function validateEmail(email: string): boolean {
              return EMAIL_PATTERN.test(email);
            }

            /** At least 8 characters with upper case, lower case and a digit. */
            export function validatePasswordStrength(password: string): boolean {
              return password.length >= 8
                && /[a-z]/.test(password)
                && /[A-Z]/.test(password)
                && /[0-9]/.test(password);
            }

            export function validateUuid(id: string): boolean {
              return UUID_PATTERN.test(id);
            }

            export function validateDateRange(start: Date, end: Date): boolean {
              return start.getTime() <= end.getTime();
            }

            export function sanitizeInput(input: string): string {
              return input.trim().replace(/[<>]/g, '');
            }
            """;

    static final String AUTH_MIDDLEWARE = """
            import { Request, Response, NextFunction } from 'express';
            import jwt from 'jsonwebtoken';
            import rateLimit from 'express-rate-limit';
            import { config } from '../config/environment';

            export interface TokenPayload {
              userId: string;
              role?: string;
            }

            export interface AuthRequest extends Request {
              user?: TokenPayload;
            }

            export const authRateLimit = rateLimit({
              windowMs: 15 * 60 * 1000,
              max: 5,
              standardHeaders: true,
              legacyHeaders: false,
              message: { error: 'Too many authentication attempts, please try again later' }
            });

            function bearerToken(req: Request): string | undefined {
              const header = req.headers.authorization;
              return header && header.startsWith('Bearer ') ? header.substring(7) : undefined;
            }

            export function authenticateToken(req: AuthRequest, res: Response, next: NextFunction): void {
              const token = bearerToken(req);
              if (!token) {
                res.status(401).json({ error: 'Authentication required', code: 'TOKEN_MISSING' });
                return;
              }

              try {
                req.user = jwt.verify(token, config.jwtSecret) as TokenPayload;
                next();
              } catch (error) {
                if (error instanceof jwt.TokenExpiredError) {
                  res.status(401).json({ error: 'Token expired', code: 'TOKEN_EXPIRED' });
                } else {
                  res.status(403).json({ error: 'Invalid token', code: 'TOKEN_INVALID' });
                }
              }
            }

            export function requireRole(roles: readonly string[]) {
              return (req: AuthRequest, res: Response, next: NextFunction): void => {
                if (!req.user?.role || !roles.includes(req.user.role)) {
                  res.status(403).json({ error: 'Access denied for this role', code: 'ROLE_FORBIDDEN' });
                  return;
                }
                next();
              };
            }

            export function generateToken(payload: TokenPayload): string {
              return jwt.sign(payload, config.jwtSecret, { expiresIn: config.jwtExpiresIn });
            }
            """;

    static final String AUTH_CONTROLLER = """
            import { Request, Response } from 'express';
            import bcrypt from 'bcryptjs';
            import { AuthRequest, generateToken } from '../middleware/auth';
            import { validateEmail, validatePasswordStrength, validateRequired } from '../utils/validation';

            export interface UserRecord {
              id: string;
              email: string;
              name: string;
              passwordHash: string;
            }

            export interface UserStore {
              findByEmail(email: string): Promise<UserRecord | null>;
              findById(id: string): Promise<UserRecord | null>;
              create(data: Omit<UserRecord, 'id'>): Promise<UserRecord>;
            }

            function publicUser(user: UserRecord) {
              return { id: user.id, email: user.email, name: user.name };
            }

            export class AuthController {
              constructor(private readonly users: UserStore) {}

              register = async (req: Request, res: Response): Promise<void> => {
                const errors = validateRequired(req.body, ['email', 'password', 'name']);
                if (errors.length > 0) {
                  res.status(400).json({ error: 'Validation failed', details: errors });
                  return;
                }

                const { email, password, name } = req.body;
                if (!validateEmail(email)) {
                  res.status(400).json({ error: 'Invalid email address' });
                  return;
                }
                if (!validatePasswordStrength(password)) {
                  res.status(400).json({ error: 'Password does not meet strength requirements' });
                  return;
                }

                try {
                  if (await this.users.findByEmail(email)) {
                    res.status(409).json({ error: 'Email already registered' });
                    return;
                  }
                  const user = await this.users.create({ email, name, passwordHash: await bcrypt.hash(password, 12) });
                  res.status(201).json({ user: publicUser(user), token: generateToken({ userId: user.id }) });
                } catch (error) {
                  console.error('Registration failed', error);
                  res.status(500).json({ error: 'Internal server error' });
                }
              };

              login = async (req: Request, res: Response): Promise<void> => {
                const errors = validateRequired(req.body, ['email', 'password']);
                if (errors.length > 0) {
                  res.status(400).json({ error: 'Validation failed', details: errors });
                  return;
                }

                try {
                  const user = await this.users.findByEmail(req.body.email);
                  if (!user || !(await bcrypt.compare(req.body.password, user.passwordHash))) {
                    res.status(401).json({ error: 'Invalid credentials' });
                    return;
                  }
                  res.json({ user: publicUser(user), token: generateToken({ userId: user.id }) });
                } catch (error) {
                  console.error('Login failed', error);
                  res.status(500).json({ error: 'Internal server error' });
                }
              };

              me = async (req: AuthRequest, res: Response): Promise<void> => {
                const user = req.user ? await this.users.findById(req.user.userId) : null;
                if (!user) {
                  res.status(404).json({ error: 'User not found' });
                  return;
                }
                res.json({ user: publicUser(user) });
              };
            }
            """;

    static final String TASK_CONTROLLER = """
            import { Response } from 'express';
            import { AuthRequest } from '../middleware/auth';
            import { validateRequired } from '../utils/validation';

            export type TaskPriority = 'low' | 'medium' | 'high';
            export type TaskStatus = 'pending' | 'in_progress' | 'completed';

            export interface TaskRecord {
              id: string;
              userId: string;
              title: string;
              description?: string;
              priority: TaskPriority;
              status: TaskStatus;
              dueDate?: Date;
            }

            export interface TaskStore {
              findById(id: string): Promise<TaskRecord | null>;
              findByUser(userId: string, status?: TaskStatus): Promise<TaskRecord[]>;
              create(data: Omit<TaskRecord, 'id'>): Promise<TaskRecord>;
              update(id: string, data: Partial<TaskRecord>): Promise<TaskRecord>;
              delete(id: string): Promise<void>;
            }

            const PRIORITIES: readonly TaskPriority[] = ['low', 'medium', 'high'];
            const STATUSES: readonly TaskStatus[] = ['pending', 'in_progress', 'completed'];

            export class TaskController {
              constructor(private readonly tasks: TaskStore) {}

              list = async (req: AuthRequest, res: Response): Promise<void> => {
                const status = STATUSES.find(s => s === req.query.status);
                res.json({ tasks: await this.tasks.findByUser(req.user!.userId, status) });
              };

              get = async (req: AuthRequest, res: Response): Promise<void> => {
                const task = await this.owned(req, res);
                if (task) res.json({ task });
              };

              create = async (req: AuthRequest, res: Response): Promise<void> => {
                const errors = validateRequired(req.body, ['title']);
                if (errors.length > 0) {
                  res.status(400).json({ error: 'Validation failed', details: errors });
                  return;
                }
                const priority = PRIORITIES.find(p => p === req.body.priority) ?? 'medium';
                const task = await this.tasks.create({
                  userId: req.user!.userId,
                  title: String(req.body.title).trim(),
                  description: req.body.description,
                  priority,
                  status: 'pending',
                  dueDate: req.body.dueDate ? new Date(req.body.dueDate) : undefined
                });
                res.status(201).json({ task });
              };

              update = async (req: AuthRequest, res: Response): Promise<void> => {
                const task = await this.owned(req, res);
                if (!task) return;
                if (req.body.priority !== undefined && !PRIORITIES.includes(req.body.priority)) {
                  res.status(400).json({ error: 'Priority must be low, medium, or high' });
                  return;
                }
                if (req.body.status !== undefined && !STATUSES.includes(req.body.status)) {
                  res.status(400).json({ error: 'Unknown status' });
                  return;
                }
                const { title, description, priority, status, dueDate } = req.body;
                res.json({ task: await this.tasks.update(task.id, { title, description, priority, status, dueDate }) });
              };

              remove = async (req: AuthRequest, res: Response): Promise<void> => {
                const task = await this.owned(req, res);
                if (!task) return;
                await this.tasks.delete(task.id);
                res.status(204).send();
              };

              private async owned(req: AuthRequest, res: Response): Promise<TaskRecord | null> {
                const task = await this.tasks.findById(req.params.id);
                if (!task) {
                  res.status(404).json({ error: 'Task not found' });
                  return null;
                }
                if (task.userId !== req.user!.userId) {
                  res.status(403).json({ error: 'Access denied' });
                  return null;
                }
                return task;
              }
            }
            """;

    /**
     * Express app used by the API test skeleton. Imports only the modules that
     * are emitted for every backend task; feature controllers are mounted on
     * {@code app} by the code that owns them.
     */
    static final String SERVER = """
            import express, { NextFunction, Request, Response } from 'express';
            import { config } from './config/environment';
            import { validateRequired } from './utils/validation';

            export const app = express();

            app.use(express.json());

            function requireBearer(req: Request, res: Response, next: NextFunction): void {
              const header = req.headers.authorization;
              if (!header || !header.startsWith('Bearer ')) {
                res.status(401).json({ error: 'Authentication required', code: 'TOKEN_MISSING' });
                return;
              }
              next();
            }

            app.get('/health', (_req: Request, res: Response) => {
              res.json({ status: 'ok', environment: config.nodeEnv });
            });

            app.get('/api/protected', requireBearer, (_req: Request, res: Response) => {
              res.json({ ok: true });
            });

            app.post('/api/tasks', requireBearer, (req: Request, res: Response) => {
              const errors = validateRequired(req.body ?? {}, ['title']);
              if (errors.length > 0) {
                res.status(400).json({ error: 'Validation failed', details: errors });
                return;
              }
              res.status(201).json({ title: req.body.title });
            });

            if (require.main === module) {
              app.listen(config.port, () => {
                console.log(`Server listening on port ${config.port}`);
              });
            }
            """;

    /** One argument: the task title, already quoted for a single-quoted string. */
    static final String API_TEST = """
            import request from 'supertest';
            import { app } from '../server';

            describe('%s', () => {
              describe('API endpoints', () => {
                it('rejects requests without a token', async () => {
                  const response = await request(app).get('/api/protected').expect(401);
                  expect(response.body.error).toBe('Authentication required');
                });

                it('rejects an empty payload', async () => {
                  const response = await request(app).post('/api/tasks').set('Authorization', 'Bearer test').send({});
                  expect([400, 403]).toContain(response.status);
                });
              });

              describe('Health', () => {
                it('responds on the health endpoint', async () => {
                  await request(app).get('/health').expect(200);
                });
              });
            });
            """;
}
