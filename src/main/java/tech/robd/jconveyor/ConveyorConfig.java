/*
 [File Info]
 path: src/main/java/tech/robd/jconveyor/ConveyorConfig.java
 description: Immutable conveyor configuration with builder; defaults come from jconveyor.* system properties.
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

package tech.robd.jconveyor;

import tech.robd.jconveyor.internal.WorkerPool;

import java.time.Duration;
import java.util.Properties;

/**
 * Construction parameters of a {@link Conveyor}.
 *
 * <p>Defaults can be supplied as system properties:
 * <ul>
 *   <li>{@code jconveyor.workers} – worker count, {@code 0} (default) for
 *       {@code availableProcessors - 1}, minimum one.</li>
 *   <li>{@code jconveyor.queueCapacity} – queue bound, {@code 0} (default) for unbounded.</li>
 *   <li>{@code jconveyor.daemonThreads} – daemon flag of worker/driver threads (default {@code true}).</li>
 *   <li>{@code jconveyor.shutdownTimeoutMs} – how long shutdown waits for driver threads
 *       before interrupting them (default {@code 5000}).</li>
 *   <li>{@code jconveyor.name} – thread-name prefix (default {@code conveyor}).</li>
 * </ul>
 */
public final class ConveyorConfig {

    // 🧩 Section: constants
    public static final String WORKERS_PROPERTY = "jconveyor.workers";
    public static final String QUEUE_CAPACITY_PROPERTY = "jconveyor.queueCapacity";
    public static final String DAEMON_PROPERTY = "jconveyor.daemonThreads";
    public static final String SHUTDOWN_TIMEOUT_PROPERTY = "jconveyor.shutdownTimeoutMs";
    public static final String NAME_PROPERTY = "jconveyor.name";

    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
    static final String DEFAULT_NAME = "conveyor";
    // [/🧩 Section: constants]

    // 🧩 Section: state
    private final int workers;
    private final int queueCapacity;
    private final boolean daemonThreads;
    private final Duration shutdownTimeout;
    private final String name;
    // [/🧩 Section: state]

    private ConveyorConfig(Builder b) {
        this.workers = b.workers;
        this.queueCapacity = b.queueCapacity;
        this.daemonThreads = b.daemonThreads;
        this.shutdownTimeout = b.shutdownTimeout;
        this.name = b.name;
    }

    // 🧩 Section: factories

    /**
     * @return configuration built from {@link System#getProperties()}
     * @throws IllegalArgumentException if a property holds a malformed value
     */
    public static ConveyorConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * @param props property source; absent keys take the built-in defaults
     * @return configuration built from {@code props}
     * @throws IllegalArgumentException if a property holds a malformed value
     */
    public static ConveyorConfig fromProperties(Properties props) {
        Builder b = builder();
        b.workers(intProperty(props, WORKERS_PROPERTY, 0));
        b.queueCapacity(intProperty(props, QUEUE_CAPACITY_PROPERTY, 0));
        b.daemonThreads(Boolean.parseBoolean(props.getProperty(DAEMON_PROPERTY, "true").trim()));
        b.shutdownTimeout(Duration.ofMillis(intProperty(props, SHUTDOWN_TIMEOUT_PROPERTY,
                (int) DEFAULT_SHUTDOWN_TIMEOUT.toMillis())));
        b.name(props.getProperty(NAME_PROPERTY, DEFAULT_NAME).trim());
        return b.build();
    }

    public static ConveyorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int intProperty(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: '" + raw + "'", e);
        }
    }
    // [/🧩 Section: factories]

    // 🧩 Section: accessors

    /**
     * @return the requested worker count; {@code 0} means "pick from the processor count"
     */
    public int workers() {
        return workers;
    }

    /**
     * @return the worker count the conveyor will actually start
     */
    public int effectiveWorkers() {
        return workers > 0 ? workers : WorkerPool.defaultSize();
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public boolean daemonThreads() {
        return daemonThreads;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public String name() {
        return name;
    }

    public Builder toBuilder() {
        return builder()
                .workers(workers)
                .queueCapacity(queueCapacity)
                .daemonThreads(daemonThreads)
                .shutdownTimeout(shutdownTimeout)
                .name(name);
    }

    @Override
    public String toString() {
        return "ConveyorConfig{" +
                "workers=" + workers +
                ", queueCapacity=" + queueCapacity +
                ", daemonThreads=" + daemonThreads +
                ", shutdownTimeout=" + shutdownTimeout +
                ", name='" + name + '\'' +
                '}';
    }
    // [/🧩 Section: accessors]

    // 🧩 Section: builder
    public static final class Builder {
        private int workers = 0;
        private int queueCapacity = 0;
        private boolean daemonThreads = true;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private String name = DEFAULT_NAME;

        private Builder() {
        }

        /**
         * @param workers worker count; {@code 0} or negative picks {@code availableProcessors - 1}
         */
        public Builder workers(int workers) {
            this.workers = Math.max(0, workers);
            return this;
        }

        /**
         * @param queueCapacity queue bound; {@code 0} for unbounded
         * @throws IllegalArgumentException if negative
         */
        public Builder queueCapacity(int queueCapacity) {
            if (queueCapacity < 0) {
                throw new IllegalArgumentException("Queue capacity cannot be negative: " + queueCapacity);
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder daemonThreads(boolean daemonThreads) {
            this.daemonThreads = daemonThreads;
            return this;
        }

        /**
         * @throws IllegalArgumentException if null or negative
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("Shutdown timeout must be a non-negative duration");
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * @throws IllegalArgumentException if null or blank
         */
        public Builder name(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Name cannot be blank");
            this.name = name;
            return this;
        }

        public ConveyorConfig build() {
            return new ConveyorConfig(this);
        }
    }
    // [/🧩 Section: builder]
}
