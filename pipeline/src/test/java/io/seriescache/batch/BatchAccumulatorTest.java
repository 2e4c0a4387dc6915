package io.seriescache.batch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BatchAccumulatorTest {

    static class Collect implements BatchListener {
        final List<BatchEvent> events = new ArrayList<>();
        @Override public void onEvent(BatchEvent event) { events.add(event); }

        List<BatchEvent> of(EventType type) {
            return events.stream().filter(e -> e.type() == type).toList();
        }
    }

    private static DataRecord headline(String id, String text) {
        return DataRecord.builder().put("story_id", id).put("headline", text).build();
    }

    private static List<DataRecord> headlines(int n) {
        List<DataRecord> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(headline("s" + i, "headline " + i));
        return out;
    }

    private static BatchAccumulator.Builder accumulator(Collect sink) {
        return BatchAccumulator.builder().identity("story_id", "headline").listener(sink);
    }

    @Test
    void seven_records_with_minibatch_three_leave_one_pending() {
        var sink = new Collect();
        var acc = accumulator(sink).minibatch(3).build();

        acc.beginRequest();
        headlines(7).forEach(acc::append);

        assertEquals(2, sink.of(EventType.MINIBATCH).size());
        assertEquals(3, sink.of(EventType.MINIBATCH).get(0).data().size());
        assertEquals(3, sink.of(EventType.MINIBATCH).get(1).data().size());
        assertEquals(1, acc.pendingSize());
        assertTrue(sink.of(EventType.BATCH).isEmpty());

        acc.finalizeRequest();
        assertEquals(1, sink.of(EventType.BATCH).size());
        assertEquals(7, sink.of(EventType.BATCH).get(0).data().size());
        assertEquals(1, acc.pendingSize(), "leftover carries into the next request");
    }

    @Test
    void duplicates_collapse_in_minibatch_and_batch() {
        var sink = new Collect();
        var acc = accumulator(sink).minibatch(2).build();

        BatchData batch = acc.process(List.of(
                headline("1", "Fed holds"),
                headline("1", "Fed holds"),
                headline("2", "Oil slips")));

        assertEquals(2, batch.size());
        assertEquals(1, sink.of(EventType.MINIBATCH).size());
        assertEquals(List.of("1", "2"), batch.columns().get("story_id"));
    }

    @Test
    void same_story_id_with_other_headline_is_a_new_item() {
        var acc = BatchAccumulator.builder().identity("story_id", "headline").build();
        BatchData batch = acc.process(List.of(headline("1", "first"), headline("1", "corrected")));
        assertEquals(2, batch.size());
    }

    @Test
    void dedup_is_scoped_to_one_request() {
        var acc = BatchAccumulator.builder().identity("story_id", "headline").build();
        assertEquals(1, acc.process(List.of(headline("1", "a"))).size());
        assertEquals(1, acc.process(List.of(headline("1", "a"))).size());
    }

    @Test
    void emitted_snapshots_do_not_change_afterwards() {
        var sink = new Collect();
        var acc = accumulator(sink).minibatch(2).build();
        acc.beginRequest();
        headlines(2).forEach(acc::append);
        BatchData first = sink.of(EventType.MINIBATCH).get(0).data();
        Map<String, List<Object>> before = first.columns();

        headlines(4).subList(2, 4).forEach(acc::append);
        acc.finalizeRequest();

        assertEquals(before, first.columns());
        assertEquals(2, first.size());
        assertThrows(UnsupportedOperationException.class, () -> first.rows().add(headline("x", "y")));
    }

    @Test
    void row_layout_renders_a_list_of_records() {
        var sink = new Collect();
        var acc = accumulator(sink).layout(LayoutMode.ROW).build();
        acc.process(headlines(2));

        BatchEvent event = sink.of(EventType.BATCH).get(0);
        Map<String, Object> message = event.toMessage();
        assertEquals("batch", message.get("type"));
        assertEquals(List.of(
                Map.of("story_id", "s0", "headline", "headline 0"),
                Map.of("story_id", "s1", "headline", "headline 1")), message.get("data"));
    }

    @Test
    void column_layout_renders_field_to_values() {
        var sink = new Collect();
        var acc = accumulator(sink).minibatch(2).build();
        acc.process(headlines(2));

        Map<String, Object> message = sink.of(EventType.MINIBATCH).get(0).toMessage();
        assertEquals("minibatch", message.get("type"));
        assertEquals(Map.of("story_id", List.of("s0", "s1"), "headline", List.of("headline 0", "headline 1")),
                message.get("data"));
    }

    @Test
    void mismatched_fields_are_rejected() {
        var acc = BatchAccumulator.builder().identity("story_id", "headline").minibatch(5).build();
        acc.beginRequest();
        acc.append(headline("1", "a"));
        DataRecord extra = headline("2", "b").with("source", "DJ");
        SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () -> acc.append(extra));
        assertTrue(e.actual().contains("source"));
        assertEquals(1, acc.requestSize());
        assertEquals(1, acc.pendingSize());
    }

    @Test
    void without_minibatch_size_only_batches_are_emitted() {
        var sink = new Collect();
        var acc = accumulator(sink).build();
        acc.process(headlines(10));
        assertTrue(sink.of(EventType.MINIBATCH).isEmpty());
        assertEquals(0, acc.pendingSize());
        assertEquals(10, sink.of(EventType.BATCH).get(0).data().size());
    }

    @Test
    void an_empty_request_still_emits_a_batch() {
        var sink = new Collect();
        var acc = accumulator(sink).minibatch(3).build();
        BatchData batch = acc.process(List.of());
        assertTrue(batch.isEmpty());
        assertEquals(1, sink.of(EventType.BATCH).size());
        assertEquals(Map.of(), batch.columns());
    }

    @Test
    void minibatches_span_requests_and_flush_emits_the_leftover() {
        var sink = new Collect();
        var acc = accumulator(sink).minibatch(3).build();
        acc.process(headlines(2));
        acc.process(List.of(headline("x", "next request")));
        assertEquals(1, sink.of(EventType.MINIBATCH).size());

        acc.process(List.of(headline("y", "another")));
        assertTrue(acc.flushPending());
        assertEquals(2, sink.of(EventType.MINIBATCH).size());
        assertEquals(1, sink.of(EventType.MINIBATCH).get(1).data().size());
        assertFalse(acc.flushPending());
    }

    @Test
    void enricher_and_suffix_apply_to_accepted_records() {
        var sink = new Collect();
        var acc = accumulator(sink)
                .enricher(r -> r.with("text", "body of " + r.getString("story_id")))
                .fieldSuffix("_news")
                .build();
        BatchData batch = acc.process(List.of(headline("1", "a")));

        DataRecord row = batch.rows().get(0);
        assertEquals(List.of("story_id_news", "headline_news", "text_news"), List.copyOf(row.fieldNames()));
        assertEquals("body of 1", row.get("text_news"));
    }

    @Test
    void listeners_run_in_registration_order() {
        List<String> calls = new ArrayList<>();
        var acc = BatchAccumulator.builder().identity("story_id", "headline")
                .listener(e -> calls.add("first"))
                .build();
        acc.addListener(e -> calls.add("second"));
        acc.process(headlines(1));
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void queueing_listener_hands_batches_to_another_thread() throws Exception {
        var queue = new QueueingBatchListener(EventType.BATCH);
        var acc = BatchAccumulator.builder().identity("story_id", "headline").minibatch(1).listener(queue).build();
        Thread t = new Thread(() -> acc.process(headlines(3)));
        t.start();
        BatchData data = queue.poll(java.time.Duration.ofSeconds(5));
        t.join();
        assertNotNull(data);
        assertEquals(3, data.size());
        assertEquals(0, queue.size());
    }

    @Test
    void aborted_request_takes_its_pending_records_back() {
        var sink = new Collect();
        var acc = accumulator(sink).minibatch(3)
                .enricher(r -> {
                    if ("r3".equals(r.getString("story_id"))) throw new IllegalStateException("story r3 unavailable");
                    return r;
                })
                .build();

        assertThrows(IllegalStateException.class,
                () -> acc.process(List.of(headline("r1", "a"), headline("r2", "b"), headline("r3", "c"))));
        assertEquals(0, acc.pendingSize());
        assertEquals(0, acc.requestSize());
        assertTrue(sink.events.isEmpty());

        acc.process(List.of(headline("m0", "next")));
        assertTrue(sink.of(EventType.MINIBATCH).isEmpty());
        assertEquals(1, acc.pendingSize());
        acc.flushPending();
        assertEquals(List.of("m0"), sink.of(EventType.MINIBATCH).get(0).data().columns().get("story_id"));
    }

    @Test
    void abort_keeps_what_earlier_requests_left_pending() {
        var sink = new Collect();
        var acc = accumulator(sink).minibatch(3).build();
        acc.process(List.of(headline("p0", "carried")));

        acc.beginRequest();
        acc.append(headline("x1", "dropped"));
        acc.abortRequest();

        assertEquals(1, acc.pendingSize());
        assertEquals(1, sink.of(EventType.BATCH).size());
    }
}
