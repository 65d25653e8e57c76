package com.questrail.webm.config;

import com.questrail.webm.internal.time.SystemWallClock;
import com.questrail.webm.internal.time.WallClock;
import com.questrail.webm.observability.NullObservabilitySink;
import com.questrail.webm.observability.WebmObservabilitySink;

import java.util.Objects;

/**
 * Configuration for {@code WebmParser}.
 *
 * @param maxDepth          deepest container nesting accepted, counting the
 *                          top-level element as depth 1
 * @param observabilitySink receiver of parse events
 * @param wallClock         timestamp source for events
 */
public record WebmParserConfig(
    int maxDepth,
    WebmObservabilitySink observabilitySink,
    WallClock wallClock
) {
    /** Real files nest about ten levels deep. */
    public static final int DEFAULT_MAX_DEPTH = 64;

    public WebmParserConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        }
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    public static WebmParserConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private WebmObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder withObservabilitySink(WebmObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public WebmParserConfig build() {
            return new WebmParserConfig(maxDepth, observabilitySink, wallClock);
        }
    }
}
