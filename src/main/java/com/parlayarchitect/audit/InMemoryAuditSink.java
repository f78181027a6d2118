package com.parlayarchitect.audit;

import com.parlayarchitect.domain.enums.RejectionReason;
import com.parlayarchitect.domain.enums.SelectionStatus;
import com.parlayarchitect.mapper.JsonHelper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link AuditSink}: logs each record as a JSON line and keeps the most recent ones in a
 * bounded ring buffer for inspection and simple stats.
 *
 * <p>The ring buffer is a {@link ConcurrentLinkedDeque} capped at {@value #RING_BUFFER_SIZE}
 * entries; new records go to the front and the oldest are evicted.
 */
@Component
public class InMemoryAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditSink.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ConcurrentLinkedDeque<AuditRecord> ringBuffer = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();

    @Override
    public void write(AuditRecord auditRecord) {
        ringBuffer.addFirst(auditRecord);
        if (size.incrementAndGet() > RING_BUFFER_SIZE) {
            if (ringBuffer.pollLast() != null) {
                size.decrementAndGet();
            }
        }
        log.info("Selection audit: {}", JsonHelper.toJson(auditRecord));
    }

    /** Most recent records, newest first. */
    public List<AuditRecord> recent(int limit) {
        List<AuditRecord> result = new ArrayList<>(Math.min(limit, RING_BUFFER_SIZE));
        Iterator<AuditRecord> iterator = ringBuffer.iterator();
        while (iterator.hasNext() && result.size() < limit) {
            result.add(iterator.next());
        }
        return Collections.unmodifiableList(result);
    }

    public AuditStats stats() {
        int total = 0;
        int accepted = 0;
        Map<RejectionReason, Integer> byReason = new EnumMap<>(RejectionReason.class);
        for (AuditRecord auditRecord : ringBuffer) {
            total++;
            if (auditRecord.getStatus() == SelectionStatus.ACCEPTED) {
                accepted++;
            } else if (auditRecord.getReasonCode() != null) {
                byReason.merge(auditRecord.getReasonCode(), 1, Integer::sum);
            }
        }
        return new AuditStats(total, accepted, total - accepted, Collections.unmodifiableMap(byReason));
    }

    public int size() {
        return size.get();
    }
}
