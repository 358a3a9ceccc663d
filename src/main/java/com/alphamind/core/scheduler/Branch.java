package com.alphamind.core.scheduler;

import java.nio.file.Path;

/**
 * One slice of a mining run.
 *
 * @param index     1-based branch number
 * @param direction research direction handed to the trial, or {@code null} for the default
 * @param logPath   the branch's own log directory, or {@code null} in the single-run layout
 */
public record Branch(int index, String direction, Path logPath) {
}
