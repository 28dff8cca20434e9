package com.project.image.editor.service;

import com.project.image.editor.DTOs.HistoryView;
import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.InvalidStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.context.annotation.SessionScope;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of one user's {@link EditHistory}.
 * <p>
 * Every mutation runs under one lock. An edit is split in two around the slow model call:
 * {@link #beginEdit()} hands out the base snapshot and marks the session busy, then
 * {@link #completeEdit(Snapshot)} or {@link #abortEdit()} ends it. While an edit is pending
 * the history cannot be changed by anything else, so the result always lands on the base it was made from.
 */
@Component
@SessionScope
public class EditSession {
    private static final Logger log = LoggerFactory.getLogger(EditSession.class);

    private final EditHistory history = new EditHistory();
    private final ReentrantLock lock = new ReentrantLock();
    private boolean editPending;

    public void load(Snapshot original) {
        lock.lock();
        try {
            requireIdle("load a new image");
            history.load(original);
            log.debug("Loaded {}", original);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            requireIdle("reset");
            history.reset();
            log.debug("History cleared");
        } finally {
            lock.unlock();
        }
    }

    public boolean undo() {
        lock.lock();
        try {
            requireIdle("undo");
            boolean moved = history.undo();
            log.debug("Undo {} (cursor {})", moved ? "applied" : "ignored", history.currentIndex());
            return moved;
        } finally {
            lock.unlock();
        }
    }

    public boolean redo() {
        lock.lock();
        try {
            requireIdle("redo");
            boolean moved = history.redo();
            log.debug("Redo {} (cursor {})", moved ? "applied" : "ignored", history.currentIndex());
            return moved;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Snapshot> current() {
        lock.lock();
        try {
            return history.current();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks an edit as running and returns the snapshot it starts from.
     *
     * @throws InvalidStateException if nothing is loaded or another edit is still running
     */
    public Snapshot beginEdit() {
        lock.lock();
        try {
            requireIdle("start another edit");
            Snapshot base = history.current()
                    .orElseThrow(() -> new InvalidStateException("Please upload an image first"));
            editPending = true;
            return base;
        } finally {
            lock.unlock();
        }
    }

    public void completeEdit(Snapshot result) {
        lock.lock();
        try {
            if (!editPending) {
                throw new InvalidStateException("No edit in progress");
            }
            try {
                history.append(result);
            } finally {
                editPending = false;
            }
            log.debug("Appended {} at index {}", result, history.currentIndex());
        } finally {
            lock.unlock();
        }
    }

    public void abortEdit() {
        lock.lock();
        try {
            editPending = false;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEditPending() {
        lock.lock();
        try {
            return editPending;
        } finally {
            lock.unlock();
        }
    }

    public HistoryView view() {
        lock.lock();
        try {
            if (history.isEmpty()) {
                return HistoryView.EMPTY;
            }
            return new HistoryView(
                    true,
                    history.currentIndex(),
                    history.size(),
                    history.canUndo(),
                    history.canRedo(),
                    history.currentIndex() > 0,
                    editPending,
                    history.current().map(Snapshot::mimeType).orElse(null)
            );
        } finally {
            lock.unlock();
        }
    }

    private void requireIdle(String action) {
        if (editPending) {
            throw new InvalidStateException("Cannot " + action + " while an edit is in progress");
        }
    }
}
