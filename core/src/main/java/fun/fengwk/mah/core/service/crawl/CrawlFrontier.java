package fun.fengwk.mah.core.service.crawl;

import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.CandidateKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Frontier, visited set and article budget of one job behind a single lock.
 *
 * <p>Candidates are handed out shallowest first, in discovery order within a depth. A canonical url is
 * accepted once per job. Handing out an article reserves one budget slot, so the job can never produce
 * more than {@code maxArticles} articles however many workers run; the slot is released again when the
 * candidate ends without an article.
 *
 * @author fengwk
 */
public class CrawlFrontier {

    private final int maxArticles;
    private final Set<String> visited = new HashSet<>();
    private final PriorityQueue<Entry> ready = new PriorityQueue<>(
        Comparator.comparingInt((Entry entry) -> entry.candidate.getDepth()).thenComparingLong(entry -> entry.seq));
    private final PriorityQueue<Entry> delayed = new PriorityQueue<>(
        Comparator.comparingLong((Entry entry) -> entry.readyAt).thenComparingLong(entry -> entry.seq));
    private long seq;
    private int inFlight;
    private int reservedArticles;
    private int producedArticles;
    private int idleExpansions;
    private boolean closed;

    public CrawlFrontier(int maxArticles) {
        if (maxArticles <= 0) {
            throw new IllegalArgumentException("maxArticles must be positive");
        }
        this.maxArticles = maxArticles;
    }

    /**
     * Queue a newly discovered candidate.
     *
     * @return {@code false} when its url was already seen in this job or the frontier is closed
     */
    public synchronized boolean offer(Candidate candidate) {
        if (closed || candidate == null || !visited.add(candidate.getCanonicalUrl())) {
            return false;
        }
        ready.add(new Entry(candidate, 0L, seq++));
        return true;
    }

    /**
     * Mark a url seen without queueing it, used for redirect targets.
     *
     * @return {@code true} when the url had not been seen before
     */
    public synchronized boolean markVisited(String canonicalUrl) {
        return canonicalUrl != null && visited.add(canonicalUrl);
    }

    /**
     * Next candidate ready at {@code nowMs}, or {@code null}. Articles beyond the budget are discarded.
     */
    public synchronized Candidate take(long nowMs) {
        promoteDue(nowMs);
        List<Entry> deferred = new ArrayList<>();
        Candidate taken = null;
        while (!ready.isEmpty()) {
            Entry entry = ready.poll();
            Candidate candidate = entry.candidate;
            if (candidate.getKind() == CandidateKind.ARTICLE) {
                if (producedArticles >= maxArticles) {
                    discard();
                    return null;
                }
                if (producedArticles + reservedArticles >= maxArticles) {
                    // Remaining budget is held by in-flight articles, keep it queued until they settle.
                    deferred.add(entry);
                    continue;
                }
                reservedArticles++;
            }
            inFlight++;
            taken = candidate;
            break;
        }
        ready.addAll(deferred);
        return taken;
    }

    /**
     * Put a taken candidate back to be handed out again at {@code readyAtMs}.
     */
    public synchronized void retry(Candidate candidate, long readyAtMs) {
        settle(candidate, false);
        if (!closed) {
            delayed.add(new Entry(candidate, readyAtMs, seq++));
        }
    }

    /**
     * Finish a taken candidate.
     *
     * @param articleProduced whether it produced a stored article
     */
    public synchronized void complete(Candidate candidate, boolean articleProduced) {
        settle(candidate, articleProduced);
        if (producedArticles >= maxArticles) {
            discard();
        }
    }

    /**
     * Count one expansion, {@code newArticles} being the article candidates it added.
     *
     * @return queued listing candidates dropped because the idle limit was reached
     */
    public synchronized int recordExpansion(int newArticles, int idleLimit) {
        if (newArticles > 0) {
            idleExpansions = 0;
            return 0;
        }
        idleExpansions++;
        if (idleLimit <= 0 || idleExpansions < idleLimit || hasQueuedArticles()) {
            return 0;
        }
        int dropped = 0;
        dropped += removeListings(ready.iterator());
        dropped += removeListings(delayed.iterator());
        idleExpansions = 0;
        return dropped;
    }

    /**
     * Drop every queued candidate and refuse new ones.
     *
     * @return number of candidates dropped
     */
    public synchronized int discard() {
        int dropped = ready.size() + delayed.size();
        ready.clear();
        delayed.clear();
        closed = true;
        return dropped;
    }

    /**
     * Nothing queued and nothing in flight.
     */
    public synchronized boolean isExhausted() {
        return ready.isEmpty() && delayed.isEmpty() && inFlight == 0;
    }

    public synchronized boolean isBudgetMet() {
        return producedArticles >= maxArticles;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Milliseconds until the next delayed candidate is due, {@code Long.MAX_VALUE} when none is delayed.
     */
    public synchronized long nextDelayMs(long nowMs) {
        Entry head = delayed.peek();
        return head == null ? Long.MAX_VALUE : Math.max(0, head.readyAt - nowMs);
    }

    public synchronized int size() {
        return ready.size() + delayed.size();
    }

    public synchronized int inFlight() {
        return inFlight;
    }

    public synchronized int producedArticles() {
        return producedArticles;
    }

    public synchronized int visitedCount() {
        return visited.size();
    }

    private void settle(Candidate candidate, boolean articleProduced) {
        if (inFlight <= 0) {
            throw new IllegalStateException("candidate was not taken: " + candidate.getUrl());
        }
        inFlight--;
        if (candidate.getKind() == CandidateKind.ARTICLE) {
            reservedArticles--;
            if (articleProduced) {
                producedArticles++;
            }
        }
    }

    private void promoteDue(long nowMs) {
        while (!delayed.isEmpty() && delayed.peek().readyAt <= nowMs) {
            Entry entry = delayed.poll();
            ready.add(new Entry(entry.candidate, 0L, entry.seq));
        }
    }

    private boolean hasQueuedArticles() {
        for (Entry entry : ready) {
            if (entry.candidate.getKind() == CandidateKind.ARTICLE) {
                return true;
            }
        }
        for (Entry entry : delayed) {
            if (entry.candidate.getKind() == CandidateKind.ARTICLE) {
                return true;
            }
        }
        return false;
    }

    private int removeListings(Iterator<Entry> iterator) {
        int removed = 0;
        while (iterator.hasNext()) {
            if (iterator.next().candidate.isListing()) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    private static final class Entry {

        private final Candidate candidate;
        private final long readyAt;
        private final long seq;

        private Entry(Candidate candidate, long readyAt, long seq) {
            this.candidate = candidate;
            this.readyAt = readyAt;
            this.seq = seq;
        }

    }

}
