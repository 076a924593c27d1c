package com.codewarden.core.watch;

import com.codewarden.core.model.ChangeType;

import java.nio.file.Path;

/**
 * A single filesystem change observed under a watched root.
 */
public record FileChangeEvent(Path path, ChangeType type) {}
