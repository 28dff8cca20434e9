package com.project.image.editor.service;

import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.InvalidStateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Linear undo/redo history of image snapshots.
 * <p>
 * Index 0 is the original upload. The cursor moves over existing snapshots on undo and redo;
 * appending from a non-tip cursor drops everything after the cursor, there is no branching.
 * <p>
 * Not thread safe. {@link EditSession} serialises access.
 */
public class EditHistory {

    private final List<Snapshot> snapshots = new ArrayList<>();
    private int currentIndex = -1;

    public void reset() {
        snapshots.clear();
        currentIndex = -1;
    }

    /** Starts a new history with {@code original} as its only entry. */
    public void load(Snapshot original) {
        Objects.requireNonNull(original, "original");
        reset();
        snapshots.add(original);
        currentIndex = 0;
    }

    /**
     * Discards the snapshots after the cursor, appends {@code snapshot} and moves the cursor onto it.
     *
     * @throws InvalidStateException when no image is loaded
     */
    public void append(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (currentIndex < 0) {
            throw new InvalidStateException("No image loaded to edit");
        }
        snapshots.subList(currentIndex + 1, snapshots.size()).clear();
        snapshots.add(snapshot);
        currentIndex = snapshots.size() - 1;
    }

    /** @return false, leaving the cursor alone, when already at the original */
    public boolean undo() {
        if (!canUndo()) return false;
        currentIndex--;
        return true;
    }

    /** @return false, leaving the cursor alone, when already at the newest snapshot */
    public boolean redo() {
        if (!canRedo()) return false;
        currentIndex++;
        return true;
    }

    public Optional<Snapshot> current() {
        return currentIndex < 0 ? Optional.empty() : Optional.of(snapshots.get(currentIndex));
    }

    public boolean canUndo() {
        return currentIndex > 0;
    }

    public boolean canRedo() {
        return currentIndex < snapshots.size() - 1;
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }

    public int currentIndex() {
        return currentIndex;
    }

    public int size() {
        return snapshots.size();
    }

    public List<Snapshot> snapshots() {
        return List.copyOf(snapshots);
    }
}
