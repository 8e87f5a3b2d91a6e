/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/internal/JobRegistry.java
 description: Thread-safe arena of job records addressed by generation-checked handles; owns insert, lookup, restart preparation and removal.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.jconveyor.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.jconveyor.DuplicateJobException;
import tech.robd.jconveyor.Job;
import tech.robd.jconveyor.JobHandle;
import tech.robd.jconveyor.UnknownJobException;
import tech.robd.jconveyor.diagnostics.Diagnostics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps {@link JobHandle}s to {@link JobRecord}s.
 *
 * <p>Records live in a growable array of slots. A handle is {@code (slot, generation)}; each
 * insert into a slot bumps that slot's generation, so a handle that outlived its job never
 * resolves to whatever job took the slot afterwards. Freed slots are reused FIFO.</p>
 *
 * <p>Registered {@link Job} instances are tracked by identity to reject duplicate
 * submissions. Restart and removal both check the job's state while the registry lock is
 * held, so one cannot slip in between the other's check and its effect.</p>
 */
public final class JobRegistry {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(JobRegistry.class);
    // [/🧩 Section: diagnostics]

    private static final class Slot {
        int generation = 0;
        @Nullable JobRecord record;
    }

    // 🧩 Section: state
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Slot> slots = new ArrayList<>();
    private final ArrayDeque<Integer> freeSlots = new ArrayDeque<>();
    private final Map<Job, JobHandle> registered = new IdentityHashMap<>();
    // [/🧩 Section: state]

    // 🧩 Section: insert

    /**
     * Register {@code job} under a fresh handle.
     *
     * @param job the job to register
     * @return the new record, in state CREATED
     * @throws DuplicateJobException if the same instance is already registered
     */
    public JobRecord insert(Job job) {
        lock.lock();
        try {
            JobHandle existing = registered.get(job);
            if (existing != null) throw new DuplicateJobException(existing);

            Integer free = freeSlots.pollFirst();
            int index;
            if (free != null) {
                index = free;
            } else {
                index = slots.size();
                slots.add(new Slot());
            }
            Slot slot = slots.get(index);
            slot.generation++;
            JobHandle handle = new JobHandle(index, slot.generation);
            JobRecord record = new JobRecord(job, handle);
            slot.record = record;
            registered.put(job, handle);
            DIAG.debug("registry insert {}", handle);
            return record;
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: insert]

    // 🧩 Section: lookup

    /**
     * @return the record for {@code handle}, or empty if unknown, removed or stale
     */
    public Optional<JobRecord> lookup(JobHandle handle) {
        lock.lock();
        try {
            return Optional.ofNullable(resolve(handle));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the record for {@code handle}
     * @throws UnknownJobException if unknown, removed or stale
     */
    public JobRecord require(JobHandle handle) {
        return lookup(handle).orElseThrow(() -> new UnknownJobException(handle));
    }

    private @Nullable JobRecord resolve(JobHandle handle) {
        if (handle.slot() < 0 || handle.slot() >= slots.size()) return null;
        Slot slot = slots.get(handle.slot());
        if (slot.generation != handle.generation()) return null;
        return slot.record;
    }
    // [/🧩 Section: lookup]

    // 🧩 Section: lifecycle

    /**
     * Reset a finished job for another run while holding the registry lock.
     *
     * @return the record, now in state CREATED
     * @throws UnknownJobException if the handle does not resolve
     * @throws tech.robd.jconveyor.IllegalJobStateException if the job is still running
     */
    public JobRecord prepareRestart(JobHandle handle) {
        lock.lock();
        try {
            JobRecord record = resolve(handle);
            if (record == null) throw new UnknownJobException(handle);
            record.prepareRestart();
            return record;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a finished job and hand its record back.
     *
     * @return the removed record, or empty if the handle does not resolve
     * @throws tech.robd.jconveyor.IllegalJobStateException if the job is still running
     */
    public Optional<JobRecord> remove(JobHandle handle) {
        lock.lock();
        try {
            JobRecord record = resolve(handle);
            if (record == null) return Optional.empty();
            record.requireTerminal("remove");
            Slot slot = slots.get(handle.slot());
            slot.record = null;
            freeSlots.addLast(handle.slot());
            registered.remove(record.job());
            DIAG.debug("registry remove {}", handle);
            return Optional.of(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Abort every registered job that has not drained yet.
     *
     * @return how many jobs were aborted
     */
    public int abortAll() {
        int aborted = 0;
        for (JobRecord record : records()) {
            if (record.abort()) aborted++;
        }
        DIAG.debug("registry abortAll aborted={}", aborted);
        return aborted;
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: info

    /**
     * @return a copy of every registered record, in slot order
     */
    public List<JobRecord> records() {
        lock.lock();
        try {
            List<JobRecord> out = new ArrayList<>(registered.size());
            for (Slot slot : slots) {
                if (slot.record != null) out.add(slot.record);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return registered.size();
        } finally {
            lock.unlock();
        }
    }
    // [/🧩 Section: info]
}
