package anyrun.core.port.out;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import anyrun.core.model.request.RawResponse;
import anyrun.core.model.request.RequestDescriptor;

/**
 * Port interface for the HTTP exchange with the sandbox service.
 *
 * <p>One call is one attempt: implementations neither retry nor classify responses. Any HTTP
 * status is delivered as a {@link RawResponse}; only failures without a response (connection
 * errors, timeouts) fail the returned {@link Uni}.
 */
public interface Transport {

    /**
     * Perform a single request.
     *
     * @param request the request
     * @return the response
     */
    Uni<RawResponse> send(RequestDescriptor request);

    /**
     * Open a server-sent event stream and emit its lines without line terminators.
     *
     * <p>A last line without a terminator belongs to no complete event and may be dropped.
     *
     * <p>A non-2xx answer fails the stream with
     * {@link anyrun.core.model.request.UnexpectedStatusException}.
     *
     * @param request the request
     * @return the raw lines
     */
    Multi<String> streamLines(RequestDescriptor request);

    /**
     * Release connections and, when owned, the event loop.
     */
    void close();
}
