package anyrun.mock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import anyrun.core.model.request.RawResponse;
import anyrun.core.model.request.RequestDescriptor;
import anyrun.core.port.out.Transport;

/**
 * Transport answering from a queue of scripted responses and recording every request.
 *
 * <p>The last scripted answer repeats once the queue is down to one entry.
 */
public class ScriptedTransport implements Transport {

    private final Deque<Supplier<Uni<RawResponse>>> answers = new ArrayDeque<>();
    private final Deque<Supplier<Multi<String>>> streams = new ArrayDeque<>();
    private final List<RequestDescriptor> requests = new ArrayList<>();
    private boolean closed;

    public ScriptedTransport respond(int status, String body) {
        return respond(new RawResponse(status, Map.of(), body));
    }

    public ScriptedTransport respond(RawResponse response) {
        answers.add(() -> Uni.createFrom().item(response));
        return this;
    }

    public ScriptedTransport fail(RuntimeException failure) {
        answers.add(() -> Uni.createFrom().failure(failure));
        return this;
    }

    public ScriptedTransport stream(Supplier<Multi<String>> lines) {
        streams.add(lines);
        return this;
    }

    @Override
    public synchronized Uni<RawResponse> send(RequestDescriptor request) {
        requests.add(request);
        if (answers.isEmpty()) {
            return Uni.createFrom().failure(new IllegalStateException("no scripted response"));
        }
        return (answers.size() > 1 ? answers.poll() : answers.peek()).get();
    }

    @Override
    public synchronized Multi<String> streamLines(RequestDescriptor request) {
        requests.add(request);
        if (streams.isEmpty()) {
            return Multi.createFrom().failure(new IllegalStateException("no scripted stream"));
        }
        return (streams.size() > 1 ? streams.poll() : streams.peek()).get();
    }

    public synchronized int calls() {
        return requests.size();
    }

    public synchronized List<RequestDescriptor> requests() {
        return List.copyOf(requests);
    }

    public synchronized RequestDescriptor lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }
}
