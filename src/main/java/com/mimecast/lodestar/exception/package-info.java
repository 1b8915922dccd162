/**
 * Discovery failures.
 *
 * <p>Server path: {@link com.mimecast.lodestar.exception.ServerUnreachableException} and
 * <br>{@link com.mimecast.lodestar.exception.NoRecordsException}.
 * <p>Client path: {@link com.mimecast.lodestar.exception.PromptFailureException} (retry or ask the user)
 * <br>and {@link com.mimecast.lodestar.exception.HardFailureException} (broken delegation).
 */
package com.mimecast.lodestar.exception;
