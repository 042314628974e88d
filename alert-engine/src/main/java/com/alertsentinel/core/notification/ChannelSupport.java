package com.alertsentinel.core.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared collaborators handed to every channel built by
 * {@link ChannelFactory}: the HTTP client, the JSON mapper, the mail
 * transport, the executor for blocking transports and the request timeout.
 *
 * <p>
 * {@link #defaults()} is enough for production use. Tests substitute
 * individual pieces through the {@link Builder}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChannelSupport {

    /** Default per-request timeout for HTTP channels. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MailTransport mailTransport;
    private final Executor executor;
    private final Duration requestTimeout;
    private final Clock clock;

    private ChannelSupport(Builder b) {
        this.requestTimeout = b.requestTimeout;
        this.httpClient = b.httpClient != null
                ? b.httpClient
                : HttpClient.newBuilder().connectTimeout(requestTimeout).build();
        this.objectMapper = b.objectMapper != null ? b.objectMapper : defaultObjectMapper();
        this.mailTransport = b.mailTransport != null ? b.mailTransport : new LoggingMailTransport();
        this.executor = b.executor != null ? b.executor : defaultExecutor();
        this.clock = b.clock;
    }

    public static ChannelSupport defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Jackson mapper with {@code java.time} support and ISO-8601 dates.
     *
     * @return a new mapper
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    private static ExecutorService defaultExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "notification-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public MailTransport mailTransport() {
        return mailTransport;
    }

    public Executor executor() {
        return executor;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Fluent builder; every field is optional.
     */
    public static class Builder {
        private HttpClient httpClient;
        private ObjectMapper objectMapper;
        private MailTransport mailTransport;
        private Executor executor;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Clock clock = Clock.systemUTC();

        public Builder httpClient(HttpClient v) {
            this.httpClient = v;
            return this;
        }

        public Builder objectMapper(ObjectMapper v) {
            this.objectMapper = v;
            return this;
        }

        public Builder mailTransport(MailTransport v) {
            this.mailTransport = v;
            return this;
        }

        public Builder executor(Executor v) {
            this.executor = v;
            return this;
        }

        public Builder requestTimeout(Duration v) {
            this.requestTimeout = v;
            return this;
        }

        public Builder clock(Clock v) {
            this.clock = v;
            return this;
        }

        /**
         * @return the assembled support object
         * @throws IllegalArgumentException if the request timeout is not
         *                                  positive
         */
        public ChannelSupport build() {
            Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            if (requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new IllegalArgumentException("requestTimeout must be > 0, got: " + requestTimeout);
            }
            return new ChannelSupport(this);
        }
    }
}
