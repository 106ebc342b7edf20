package com.briefforge.orchestrator.synthesis.optimization;

/**
 * The four fixed database artifacts.
 */
final class OptimizationTemplates {

    private OptimizationTemplates() {}

    static final String DATABASE = """
            import { Pool, PoolClient, QueryResultRow } from 'pg';

            /**
             * Pooled PostgreSQL connection with health check and graceful shutdown.
             */

            export class DatabaseConnection {
              private static instance: DatabaseConnection | undefined;
              private readonly pool: Pool;
              private closed = false;

              private constructor() {
                this.pool = new Pool({
                  host: process.env.DB_HOST || 'localhost',
                  port: parseInt(process.env.DB_PORT || '5432', 10),
                  database: process.env.DB_NAME || 'app',
                  user: process.env.DB_USER || 'postgres',
                  password: process.env.DB_PASSWORD || '',
                  max: 20,
                  idleTimeoutMillis: 30000,
                  connectionTimeoutMillis: 2000
                });

                this.pool.on('error', err => {
                  console.error('Unexpected error on idle database client', err);
                });
              }

              static getInstance(): DatabaseConnection {
                if (!DatabaseConnection.instance) {
                  DatabaseConnection.instance = new DatabaseConnection();
                }
                return DatabaseConnection.instance;
              }

              async query<T extends QueryResultRow = any>(text: string, params: unknown[] = []): Promise<{ rows: T[]; rowCount: number }> {
                const started = Date.now();
                const result = await this.pool.query<T>(text, params);
                const duration = Date.now() - started;
                if (duration > 1000) {
                  console.warn(`Slow query (${duration}ms): ${text.substring(0, 100)}`);
                }
                return { rows: result.rows, rowCount: result.rowCount ?? 0 };
              }

              /** Runs the callback in a transaction; rolls back on any error. */
              async transaction<T>(callback: (client: PoolClient) => Promise<T>): Promise<T> {
                const client = await this.pool.connect();
                try {
                  await client.query('BEGIN');
                  const result = await callback(client);
                  await client.query('COMMIT');
                  return result;
                } catch (error) {
                  await client.query('ROLLBACK');
                  throw error;
                } finally {
                  client.release();
                }
              }

              getPoolStats(): { total: number; idle: number; waiting: number } {
                return { total: this.pool.totalCount, idle: this.pool.idleCount, waiting: this.pool.waitingCount };
              }

              async healthCheck(): Promise<boolean> {
                try {
                  await this.pool.query('SELECT 1');
                  return true;
                } catch (error) {
                  console.error('Database health check failed', error);
                  return false;
                }
              }

              async close(): Promise<void> {
                if (this.closed) return;
                this.closed = true;
                await this.pool.end();
              }
            }

            export const db = DatabaseConnection.getInstance();

            /** Generic CRUD over one table. Column names come from code, never from user input. */
            export class BaseRepository<T extends QueryResultRow> {
              constructor(protected readonly table: string) {}

              async findById(id: string): Promise<T | null> {
                const { rows } = await db.query<T>(`SELECT * FROM ${this.table} WHERE id = $1`, [id]);
                return rows[0] ?? null;
              }

              async findByIds(ids: string[]): Promise<T[]> {
                if (ids.length === 0) return [];
                const { rows } = await db.query<T>(`SELECT * FROM ${this.table} WHERE id = ANY($1)`, [ids]);
                return rows;
              }

              async findAll(limit = 100, offset = 0): Promise<T[]> {
                const { rows } = await db.query<T>(`SELECT * FROM ${this.table} ORDER BY created_at DESC LIMIT $1 OFFSET $2`, [limit, offset]);
                return rows;
              }

              async create(data: Partial<T>): Promise<T> {
                const keys = Object.keys(data);
                const placeholders = keys.map((_, i) => `$${i + 1}`).join(', ');
                const { rows } = await db.query<T>(
                  `INSERT INTO ${this.table} (${keys.join(', ')}) VALUES (${placeholders}) RETURNING *`,
                  Object.values(data)
                );
                return rows[0];
              }

              async update(id: string, data: Partial<T>): Promise<T> {
                const keys = Object.keys(data);
                const assignments = keys.map((key, i) => `${key} = $${i + 2}`).join(', ');
                const { rows } = await db.query<T>(
                  `UPDATE ${this.table} SET ${assignments} WHERE id = $1 RETURNING *`,
                  [id, ...Object.values(data)]
                );
                return rows[0];
              }

              async delete(id: string): Promise<boolean> {
                const { rowCount } = await db.query(`DELETE FROM ${this.table} WHERE id = $1`, [id]);
                return rowCount > 0;
              }

              async softDelete(id: string): Promise<T> {
                const { rows } = await db.query<T>(`UPDATE ${this.table} SET deleted_at = NOW() WHERE id = $1 RETURNING *`, [id]);
                return rows[0];
              }

              async count(whereClause = '', params: unknown[] = []): Promise<number> {
                const { rows } = await db.query<{ count: string }>(`SELECT COUNT(*) AS count FROM ${this.table} ${whereClause}`, params);
                return parseInt(rows[0]?.count ?? '0', 10);
              }
            }

            async function shutdown(signal: string): Promise<void> {
              console.log(`${signal} received, closing database pool`);
              await db.close();
              process.exit(0);
            }

            process.on('SIGINT', () => void shutdown('SIGINT'));
            process.on('SIGTERM', () => void shutdown('SIGTERM'));
            """;

    static final String QUERY_OPTIMIZATION = """
            import { db } from '../config/database';

            /**
             * Parameterised query builders. Identifiers are validated against allow-lists;
             * values always travel as bind parameters.
             */

            export type FilterValue = string | number | boolean | null | Array<string | number>;

            export function buildWhereClause(
              filters: Record<string, FilterValue | undefined>,
              allowedColumns: readonly string[],
              startIndex = 1
            ): { clause: string; params: unknown[] } {
              const conditions: string[] = [];
              const params: unknown[] = [];
              let index = startIndex;

              for (const [column, value] of Object.entries(filters)) {
                if (value === undefined || !allowedColumns.includes(column)) continue;
                if (value === null) {
                  conditions.push(`${column} IS NULL`);
                } else if (Array.isArray(value)) {
                  conditions.push(`${column} = ANY($${index++})`);
                  params.push(value);
                } else {
                  conditions.push(`${column} = $${index++}`);
                  params.push(value);
                }
              }

              return { clause: conditions.length > 0 ? `WHERE ${conditions.join(' AND ')}` : '', params };
            }

            export function buildPaginationClause(page = 1, pageSize = 50): { clause: string; limit: number; offset: number } {
              const safePage = Math.max(1, Math.floor(page));
              const limit = Math.min(Math.max(1, Math.floor(pageSize)), 500);
              const offset = (safePage - 1) * limit;
              return { clause: `LIMIT ${limit} OFFSET ${offset}`, limit, offset };
            }

            export function buildOrderByClause(
              sortBy: string | undefined,
              direction: string | undefined,
              allowedColumns: readonly string[],
              fallback = 'created_at'
            ): string {
              const column = sortBy && allowedColumns.includes(sortBy) ? sortBy : fallback;
              const dir = direction?.toUpperCase() === 'ASC' ? 'ASC' : 'DESC';
              return `ORDER BY ${column} ${dir}`;
            }

            export function buildBatchInsert(
              table: string,
              columns: readonly string[],
              rows: ReadonlyArray<ReadonlyArray<unknown>>
            ): { text: string; params: unknown[] } {
              if (rows.length === 0) {
                throw new Error('buildBatchInsert requires at least one row');
              }
              const params: unknown[] = [];
              const tuples = rows.map(row => {
                if (row.length !== columns.length) {
                  throw new Error(`Row has ${row.length} values, expected ${columns.length}`);
                }
                const placeholders = row.map(value => {
                  params.push(value);
                  return `$${params.length}`;
                });
                return `(${placeholders.join(', ')})`;
              });
              return { text: `INSERT INTO ${table} (${columns.join(', ')}) VALUES ${tuples.join(', ')} RETURNING *`, params };
            }

            export function buildFullTextSearch(
              columns: readonly string[],
              searchTerm: string,
              paramIndex = 1
            ): { clause: string; rank: string; param: string } {
              const document = columns.map(c => `coalesce(${c}, '')`).join(` || ' ' || `);
              return {
                clause: `to_tsvector('english', ${document}) @@ plainto_tsquery('english', $${paramIndex})`,
                rank: `ts_rank(to_tsvector('english', ${document}), plainto_tsquery('english', $${paramIndex}))`,
                param: searchTerm.trim()
              };
            }

            /** EXPLAIN ANALYZE for development; never call on production write paths. */
            export async function explainQuery(text: string, params: unknown[] = []): Promise<string[]> {
              const { rows } = await db.query<{ 'QUERY PLAN': string }>(`EXPLAIN ANALYZE ${text}`, params);
              return rows.map(row => row['QUERY PLAN']);
            }
            """;

    static final String CACHE = """
            /**
             * In-memory TTL cache with pattern invalidation and hit-rate tracking.
             */

            interface CacheEntry<T> {
              value: T;
              expiresAt: number;
            }

            export class CacheManager {
              private readonly store = new Map<string, CacheEntry<unknown>>();
              private hits = 0;
              private misses = 0;

              constructor(private readonly defaultTtlSeconds = 300) {}

              get<T>(key: string): T | undefined {
                const entry = this.store.get(key);
                if (!entry) {
                  this.misses++;
                  return undefined;
                }
                if (entry.expiresAt <= Date.now()) {
                  this.store.delete(key);
                  this.misses++;
                  return undefined;
                }
                this.hits++;
                return entry.value as T;
              }

              set<T>(key: string, value: T, ttlSeconds = this.defaultTtlSeconds): void {
                this.store.set(key, { value, expiresAt: Date.now() + ttlSeconds * 1000 });
              }

              delete(key: string): number {
                return this.store.delete(key) ? 1 : 0;
              }

              /** Deletes every key matching a glob-style pattern, e.g. "user:42:*". */
              deletePattern(pattern: string): number {
                const regex = new RegExp('^' + pattern.split('*').map(escapeRegex).join('.*') + '$');
                let deleted = 0;
                for (const key of Array.from(this.store.keys())) {
                  if (regex.test(key)) {
                    this.store.delete(key);
                    deleted++;
                  }
                }
                return deleted;
              }

              flush(): void {
                this.store.clear();
                this.hits = 0;
                this.misses = 0;
              }

              getStats(): { keys: number; hits: number; misses: number; hitRate: number } {
                const total = this.hits + this.misses;
                return {
                  keys: this.store.size,
                  hits: this.hits,
                  misses: this.misses,
                  hitRate: total === 0 ? 0 : Math.round((this.hits / total) * 10000) / 100
                };
              }

              async getOrSet<T>(key: string, loader: () => Promise<T>, ttlSeconds = this.defaultTtlSeconds): Promise<T> {
                const cached = this.get<T>(key);
                if (cached !== undefined) return cached;
                const value = await loader();
                this.set(key, value, ttlSeconds);
                return value;
              }
            }

            function escapeRegex(text: string): string {
              return text.replace(/[.+?^${}()|[\\]\\\\]/g, '\\\\$&');
            }

            export const cache = new CacheManager();

            export const CacheKeys = {
              user: (id: string) => `user:${id}`,
              userTasks: (userId: string) => `user:${userId}:tasks`,
              task: (id: string) => `task:${id}`,
              taskComments: (taskId: string) => `task:${taskId}:comments`
            };

            export const CacheInvalidation = {
              onTaskChanged(taskId: string, ownerId: string): void {
                cache.delete(CacheKeys.task(taskId));
                cache.deletePattern(`task:${taskId}:*`);
                cache.delete(CacheKeys.userTasks(ownerId));
              },
              onUserChanged(userId: string): void {
                cache.deletePattern(`user:${userId}*`);
              }
            };
            """;

    static final String DATABASE_HELPERS = """
            import { db } from '../config/database';

            /**
             * Maintenance helpers for operators. All queries target PostgreSQL system views.
             */

            export async function recordExists(table: string, id: string): Promise<boolean> {
              const { rows } = await db.query<{ exists: boolean }>(`SELECT EXISTS(SELECT 1 FROM ${table} WHERE id = $1) AS exists`, [id]);
              return rows[0]?.exists ?? false;
            }

            export async function getTableCount(table: string): Promise<number> {
              const { rows } = await db.query<{ count: string }>(`SELECT COUNT(*) AS count FROM ${table}`);
              return parseInt(rows[0]?.count ?? '0', 10);
            }

            export async function getDatabaseSize(): Promise<string> {
              const { rows } = await db.query<{ size: string }>('SELECT pg_size_pretty(pg_database_size(current_database())) AS size');
              return rows[0]?.size ?? '0 bytes';
            }

            export async function getTableSizes(): Promise<Array<{ table: string; size: string }>> {
              const { rows } = await db.query<{ table: string; size: string }>(`
                SELECT relname AS table, pg_size_pretty(pg_total_relation_size(relid)) AS size
                FROM pg_catalog.pg_statio_user_tables
                ORDER BY pg_total_relation_size(relid) DESC`);
              return rows;
            }

            /** Requires the pg_stat_statements extension. */
            export async function getSlowQueries(limit = 10): Promise<Array<{ query: string; calls: number; meanMs: number }>> {
              const { rows } = await db.query<{ query: string; calls: number; meanMs: number }>(`
                SELECT query, calls, mean_exec_time AS "meanMs"
                FROM pg_stat_statements
                ORDER BY mean_exec_time DESC
                LIMIT $1`, [limit]);
              return rows;
            }

            export async function getConnectionCount(): Promise<number> {
              const { rows } = await db.query<{ count: string }>('SELECT COUNT(*) AS count FROM pg_stat_activity WHERE datname = current_database()');
              return parseInt(rows[0]?.count ?? '0', 10);
            }

            /** Terminates sessions idle for longer than the given minutes. Returns how many were killed. */
            export async function killIdleConnections(idleMinutes = 30): Promise<number> {
              const { rowCount } = await db.query(`
                SELECT pg_terminate_backend(pid)
                FROM pg_stat_activity
                WHERE datname = current_database()
                  AND state = 'idle'
                  AND pid <> pg_backend_pid()
                  AND state_change < NOW() - ($1 || ' minutes')::interval`, [idleMinutes]);
              return rowCount;
            }

            /** Tables scanned sequentially far more often than by index. */
            export async function findMissingIndexes(): Promise<Array<{ table: string; seqScans: number; indexScans: number }>> {
              const { rows } = await db.query<{ table: string; seqScans: number; indexScans: number }>(`
                SELECT relname AS table, seq_scan AS "seqScans", COALESCE(idx_scan, 0) AS "indexScans"
                FROM pg_stat_user_tables
                WHERE seq_scan > COALESCE(idx_scan, 0) * 10
                  AND n_live_tup > 1000
                ORDER BY seq_scan DESC`);
              return rows;
            }

            export async function vacuumAnalyze(table?: string): Promise<void> {
              await db.query(table ? `VACUUM ANALYZE ${table}` : 'VACUUM ANALYZE');
            }
            """;
}
