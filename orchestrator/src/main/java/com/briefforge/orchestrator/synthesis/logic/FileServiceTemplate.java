package com.briefforge.orchestrator.synthesis.logic;

/**
 * Attachment workflow: size and MIME allowlist validation, disk write,
 * async post-processing enqueue.
 */
final class FileServiceTemplate {

    private FileServiceTemplate() {}

    static final String SOURCE = """
            import fs from 'fs/promises';
            import path from 'path';
            import crypto from 'crypto';
            import { SharingService } from './sharingService';

            /**
             * Task attachments.
             *
             * Uploads are validated (size, MIME allowlist, name), written under a random
             * name in the upload directory and queued for post-processing.
             */

            // ---------------------------------------------------------------------------
            // Types
            // ---------------------------------------------------------------------------

            export const MAX_FILE_SIZE = 50 * 1024 * 1024;

            export const ALLOWED_MIME_TYPES = [
              'image/jpeg', 'image/png', 'image/gif', 'image/webp',
              'application/pdf',
              'application/msword', 'application/vnd.openxmlformats-officedocument.wordprocessingml.document',
              'application/vnd.ms-excel', 'application/vnd.openxmlformats-officedocument.spreadsheetml.sheet',
              'text/plain', 'text/csv',
              'application/zip', 'application/x-rar-compressed'
            ] as const;

            export type AllowedMimeType = typeof ALLOWED_MIME_TYPES[number];

            export interface FileUpload {
              originalName: string;
              mimeType: string;
              size: number;
              buffer: Buffer;
            }

            export interface Attachment {
              id: string;
              taskId: string;
              userId: string;
              fileName: string;
              filePath: string;
              fileSize: number;
              mimeType: AllowedMimeType;
              processed: boolean;
              processedAt?: Date;
              createdAt: Date;
            }

            export type FileValidation =
              | { ok: true; mimeType: AllowedMimeType }
              | { ok: false; reason: 'too_large' | 'mime_not_allowed' | 'invalid_name'; detail: string };

            export interface AttachmentStore {
              findTask(taskId: string): Promise<{ id: string; userId: string } | null>;
              findById(id: string): Promise<Attachment | null>;
              findByTask(taskId: string): Promise<Attachment[]>;
              create(data: Omit<Attachment, 'id'>): Promise<Attachment>;
              update(id: string, data: Partial<Attachment>): Promise<Attachment>;
              delete(id: string): Promise<void>;
            }

            export interface FileProcessingQueue {
              addFileProcessingJob(job: { fileId: string; filePath: string; userId: string }): Promise<void>;
            }

            export interface AuditLog {
              record(entry: { userId: string; action: 'file_uploaded' | 'file_deleted'; entityType: 'task'; entityId: string; changes: unknown }): Promise<void>;
            }

            function assertNever(value: never): never {
              throw new Error(`Unexpected value: ${JSON.stringify(value)}`);
            }

            function isAllowedMimeType(mimeType: string): mimeType is AllowedMimeType {
              return (ALLOWED_MIME_TYPES as readonly string[]).includes(mimeType);
            }

            export function validateFile(file: FileUpload): FileValidation {
              if (file.size > MAX_FILE_SIZE) {
                return { ok: false, reason: 'too_large', detail: `Maximum size is ${MAX_FILE_SIZE / 1024 / 1024}MB` };
              }
              if (!isAllowedMimeType(file.mimeType)) {
                return { ok: false, reason: 'mime_not_allowed', detail: file.mimeType };
              }
              if (!file.originalName || file.originalName.length > 255) {
                return { ok: false, reason: 'invalid_name', detail: file.originalName ?? '' };
              }
              return { ok: true, mimeType: file.mimeType };
            }

            function rejectionMessage(result: Extract<FileValidation, { ok: false }>): string {
              switch (result.reason) {
                case 'too_large':
                  return `File too large. ${result.detail}`;
                case 'mime_not_allowed':
                  return `File type not allowed: ${result.detail}`;
                case 'invalid_name':
                  return 'Invalid file name';
                default:
                  return assertNever(result.reason);
              }
            }

            // ---------------------------------------------------------------------------
            // Service
            // ---------------------------------------------------------------------------

            export class FileService {
              constructor(
                private readonly store: AttachmentStore,
                private readonly sharing: SharingService,
                private readonly queue: FileProcessingQueue,
                private readonly audit: AuditLog,
                private readonly uploadDir: string = path.join(process.cwd(), 'uploads')
              ) {}

              /** Requires 'edit' permission on the task. */
              async uploadFile(taskId: string, userId: string, file: FileUpload): Promise<Attachment> {
                const task = await this.store.findTask(taskId);
                if (!task) {
                  throw new Error('Task not found');
                }
                if (!(await this.sharing.hasPermission(taskId, userId, 'edit'))) {
                  throw new Error('You do not have permission to upload files to this task');
                }

                const validation = validateFile(file);
                if (!validation.ok) {
                  throw new Error(rejectionMessage(validation));
                }

                await fs.mkdir(this.uploadDir, { recursive: true });
                const storedName = `${crypto.randomBytes(16).toString('hex')}${path.extname(file.originalName)}`;
                await fs.writeFile(path.join(this.uploadDir, storedName), file.buffer);

                const attachment = await this.store.create({
                  taskId,
                  userId,
                  fileName: file.originalName,
                  filePath: storedName,
                  fileSize: file.size,
                  mimeType: validation.mimeType,
                  processed: false,
                  createdAt: new Date()
                });

                await this.queue.addFileProcessingJob({ fileId: attachment.id, filePath: storedName, userId });
                await this.audit.record({
                  userId,
                  action: 'file_uploaded',
                  entityType: 'task',
                  entityId: taskId,
                  changes: { fileName: file.originalName, fileSize: file.size }
                });
                return attachment;
              }

              async getFile(attachmentId: string, userId: string): Promise<{ filePath: string; fileName: string }> {
                const attachment = await this.requireAttachment(attachmentId);
                if (!(await this.sharing.canAccessTask(attachment.taskId, userId))) {
                  throw new Error('You do not have access to this file');
                }

                const fullPath = path.join(this.uploadDir, attachment.filePath);
                try {
                  await fs.access(fullPath);
                } catch {
                  throw new Error('File not found on disk');
                }
                return { filePath: fullPath, fileName: attachment.fileName };
              }

              /** The uploader or the task owner may delete. */
              async deleteFile(attachmentId: string, userId: string): Promise<void> {
                const attachment = await this.requireAttachment(attachmentId);
                const task = await this.store.findTask(attachment.taskId);
                if (!task) {
                  throw new Error('Task not found');
                }
                if (attachment.userId !== userId && task.userId !== userId) {
                  throw new Error('You do not have permission to delete this file');
                }

                const fullPath = path.join(this.uploadDir, attachment.filePath);
                try {
                  await fs.unlink(fullPath);
                } catch (error) {
                  console.warn(`Failed to delete file from disk: ${fullPath}`, error);
                }

                await this.store.delete(attachmentId);
                await this.audit.record({
                  userId,
                  action: 'file_deleted',
                  entityType: 'task',
                  entityId: attachment.taskId,
                  changes: { fileName: attachment.fileName, attachmentId }
                });
              }

              async getTaskAttachments(taskId: string, userId: string): Promise<Attachment[]> {
                if (!(await this.sharing.canAccessTask(taskId, userId))) {
                  throw new Error('You do not have access to this task');
                }
                return this.store.findByTask(taskId);
              }

              /** Called by the file-processing queue worker. */
              async processFileUpload(fileId: string): Promise<void> {
                await this.store.update(fileId, { processed: true, processedAt: new Date() });
              }

              private async requireAttachment(attachmentId: string): Promise<Attachment> {
                const attachment = await this.store.findById(attachmentId);
                if (!attachment) {
                  throw new Error('Attachment not found');
                }
                return attachment;
              }
            }
            """;
}
