package com.eainde.breakdown.job;

import com.eainde.breakdown.exception.InvalidTransitionException;
import com.eainde.breakdown.exception.JobNotFoundException;
import com.eainde.breakdown.model.ScriptBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Lifecycle, priority queue and result cache of analysis jobs.
 *
 * <h3>Lifecycle</h3>
 * <pre>
 *   PENDING --> PROCESSING --> COMPLETED | FAILED | CANCELLED
 *   PENDING --> CANCELLED
 * </pre>
 *
 * <h3>Queue</h3>
 * A new job goes in front of the first queued job with a strictly lower priority weight,
 * so equal priorities keep submission order. At most {@code maxConcurrent} jobs are
 * processing at a time; {@link #claimNext()} hands out nothing beyond that cap.
 *
 * <h3>Cache</h3>
 * Keyed by the SHA-256 of text, component and confidence threshold. A request that opts
 * in and finds an entry younger than the TTL is completed at submission.
 *
 * <h3>Retention</h3>
 * Expired cache entries, and finished jobs older than the retention period, are purged on
 * every {@link #submit} and {@link #metrics()}. A purged job is no longer found; the
 * per-status counts are lifetime totals and keep it.
 *
 * <p>Every operation runs under one lock.</p>
 */
public class JobManager {

    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    private static final Map<JobStatus, Set<JobStatus>> ALLOWED = new EnumMap<>(JobStatus.class);

    static {
        ALLOWED.put(JobStatus.PENDING, EnumSet.of(JobStatus.PROCESSING, JobStatus.CANCELLED));
        ALLOWED.put(JobStatus.PROCESSING, EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED));
        ALLOWED.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        ALLOWED.put(JobStatus.FAILED, EnumSet.noneOf(JobStatus.class));
        ALLOWED.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
    }

    static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final int maxConcurrent;
    private final Duration cacheTtl;
    private final Duration retention;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AnalysisJob> jobs = new HashMap<>();
    private final List<String> queue = new ArrayList<>();
    private final Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
    private final Map<String, CacheEntry> cache = new HashMap<>();

    public JobManager(int maxConcurrent, Duration cacheTtl, Clock clock) {
        this(maxConcurrent, cacheTtl, DEFAULT_RETENTION, clock);
    }

    /**
     * @param retention how long a finished job stays queryable
     */
    public JobManager(int maxConcurrent, Duration cacheTtl, Duration retention, Clock clock) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.cacheTtl = cacheTtl;
        this.retention = retention;
        this.clock = clock;
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @return the new job's id; the job is already completed on a fresh cache hit
     */
    public String submit(AnalysisRequest request) {
        String cacheKey = cacheKey(request);
        Instant now = clock.instant();
        lock.lock();
        try {
            purge(now);
            AnalysisJob job = new AnalysisJob(UUID.randomUUID().toString(), request, cacheKey, now);
            jobs.put(job.getId(), job);

            Optional<ScriptBreakdown> cached = request.cacheResults() ? freshCacheEntry(cacheKey, now) : Optional.empty();
            if (cached.isPresent()) {
                job.setStatus(JobStatus.COMPLETED);
                job.setResult(cached.get());
                job.setFromCache(true);
                job.setFinishedAt(now);
                increment(JobStatus.COMPLETED);
                log.info("Job {} ({}) served from cache", job.getId(), request.component());
                return job.getId();
            }

            increment(JobStatus.PENDING);
            enqueue(job);
            log.info("Job {} queued: {} with priority {}, position {}",
                    job.getId(), request.component(), request.priority(), queue.indexOf(job.getId()) + 1);
            return job.getId();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Peeks at the next job to start. Queued ids whose job is gone or no longer pending are
     * dropped on the way.
     *
     * @return empty when the queue is empty or the processing cap is reached
     */
    public Optional<String> dequeueNext() {
        lock.lock();
        try {
            while (!queue.isEmpty() && activeJobs() < maxConcurrent) {
                String head = queue.get(0);
                AnalysisJob job = jobs.get(head);
                if (job != null && job.getStatus() == JobStatus.PENDING) {
                    return Optional.of(head);
                }
                queue.remove(0);
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@link #dequeueNext()} and the move to PROCESSING as one step.
     */
    public Optional<AnalysisJob> claimNext() {
        lock.lock();
        try {
            Optional<String> next = dequeueNext();
            next.ifPresent(id -> transition(id, JobStatus.PROCESSING));
            return next.map(jobs::get);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws JobNotFoundException       for an unknown id
     * @throws InvalidTransitionException when the lifecycle does not allow the move
     */
    public void transition(String jobId, JobStatus to) {
        lock.lock();
        try {
            AnalysisJob job = require(jobId);
            JobStatus from = job.getStatus();
            if (!ALLOWED.get(from).contains(to)) {
                throw new InvalidTransitionException(jobId, from, to);
            }
            job.setStatus(to);
            decrement(from);
            increment(to);

            Instant now = clock.instant();
            if (from == JobStatus.PENDING) {
                queue.remove(jobId);
            }
            if (to == JobStatus.PROCESSING) {
                job.setStartedAt(now);
            }
            if (to.isTerminal()) {
                job.setFinishedAt(now);
            }
            log.debug("Job {}: {} -> {}", jobId, from, to);
        } finally {
            lock.unlock();
        }
    }

    public void complete(String jobId, ScriptBreakdown result) {
        lock.lock();
        try {
            transition(jobId, JobStatus.COMPLETED);
            AnalysisJob job = jobs.get(jobId);
            job.setResult(result);
            if (job.getRequest().cacheResults()) {
                cache.put(job.getCacheKey(), new CacheEntry(result, clock.instant()));
            }
        } finally {
            lock.unlock();
        }
    }

    public void fail(String jobId, String message) {
        lock.lock();
        try {
            transition(jobId, JobStatus.FAILED);
            jobs.get(jobId).setError(message);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels a pending job. A job already processing runs to the end.
     *
     * @return true if the job was pending and is now cancelled
     * @throws JobNotFoundException for an unknown id
     */
    public boolean cancel(String jobId) {
        lock.lock();
        try {
            AnalysisJob job = require(jobId);
            if (job.getStatus() != JobStatus.PENDING) {
                return false;
            }
            transition(jobId, JobStatus.CANCELLED);
            log.info("Job {} cancelled", jobId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public JobStatusView getStatus(String jobId) {
        lock.lock();
        try {
            AnalysisJob job = require(jobId);
            Integer position = null;
            if (job.getStatus() == JobStatus.PENDING) {
                int index = queue.indexOf(jobId);
                position = index < 0 ? null : index + 1;
            }
            return new JobStatusView(jobId, job.getStatus(), position);
        } finally {
            lock.unlock();
        }
    }

    public JobResult getResult(String jobId) {
        lock.lock();
        try {
            AnalysisJob job = require(jobId);
            return new JobResult(jobId, job.getStatus(), job.getResult(), job.getError(), job.isFromCache());
        } finally {
            lock.unlock();
        }
    }

    public JobMetrics metrics() {
        Instant now = clock.instant();
        lock.lock();
        try {
            purge(now);
            return new JobMetrics(counts, queue.size(), activeJobs(), maxConcurrent, cache.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Jobs still held, highest priority first and newest first within a priority.
     *
     * @param status only jobs in this status, or all when null
     * @param limit  maximum number returned, at least 1
     */
    public List<JobSummary> listJobs(JobStatus status, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        lock.lock();
        try {
            return jobs.values().stream()
                    .filter(job -> status == null || job.getStatus() == status)
                    .sorted(Comparator.comparingInt((AnalysisJob job) -> job.getPriority().weight()).reversed()
                            .thenComparing(AnalysisJob::getCreatedAt, Comparator.reverseOrder()))
                    .limit(limit)
                    .map(JobSummary::of)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    /**
     * SHA-256 over text, component and threshold, hex encoded.
     */
    public static String cacheKey(AnalysisRequest request) {
        String content = request.text() + '\0' + request.component() + '\0' + request.confidenceThreshold();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private void enqueue(AnalysisJob job) {
        int weight = job.getPriority().weight();
        for (int i = 0; i < queue.size(); i++) {
            AnalysisJob queued = jobs.get(queue.get(i));
            if (queued != null && queued.getPriority().weight() < weight) {
                queue.add(i, job.getId());
                return;
            }
        }
        queue.add(job.getId());
    }

    private void purge(Instant now) {
        int cached = cache.size();
        cache.values().removeIf(entry -> !isFresh(entry, now));
        int held = jobs.size();
        jobs.values().removeIf(job -> job.getStatus().isTerminal()
                && job.getFinishedAt() != null
                && Duration.between(job.getFinishedAt(), now).compareTo(retention) >= 0);
        if (cached != cache.size() || held != jobs.size()) {
            log.debug("Purged {} cache entries and {} finished jobs", cached - cache.size(), held - jobs.size());
        }
    }

    private Optional<ScriptBreakdown> freshCacheEntry(String cacheKey, Instant now) {
        CacheEntry entry = cache.get(cacheKey);
        if (entry == null) {
            return Optional.empty();
        }
        if (!isFresh(entry, now)) {
            cache.remove(cacheKey);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    private boolean isFresh(CacheEntry entry, Instant now) {
        return Duration.between(entry.cachedAt(), now).compareTo(cacheTtl) < 0;
    }

    private AnalysisJob require(String jobId) {
        AnalysisJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private int activeJobs() {
        return counts.get(JobStatus.PROCESSING);
    }

    private void increment(JobStatus status) {
        counts.merge(status, 1, Integer::sum);
    }

    private void decrement(JobStatus status) {
        counts.merge(status, -1, (a, b) -> Math.max(0, a + b));
    }

    private record CacheEntry(ScriptBreakdown result, Instant cachedAt) {
    }
}
