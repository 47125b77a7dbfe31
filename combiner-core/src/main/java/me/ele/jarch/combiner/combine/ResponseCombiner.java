package me.ele.jarch.combiner.combine;

import me.ele.jarch.combiner.ResponseSink;
import me.ele.jarch.combiner.aggregate.SimpleAggregate;
import me.ele.jarch.combiner.exception.CombinerException;
import me.ele.jarch.combiner.exception.ErrorCode;
import me.ele.jarch.combiner.pg.proto.BackendMessage;
import me.ele.jarch.combiner.pg.proto.CommandComplete;
import me.ele.jarch.combiner.pg.proto.PGFlags;
import me.ele.jarch.combiner.pg.proto.PGMessage;
import me.ele.jarch.combiner.pg.proto.PGProto;
import me.ele.jarch.combiner.pg.proto.ResponseKind;
import me.ele.jarch.combiner.pg.util.SqlState;
import me.ele.jarch.combiner.util.CombinerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * Combines the responses of the data nodes that executed one statement into the single reply
 * the client expects from one PostgreSQL server.
 * <p>
 * One combiner serves one statement at a time and is not thread safe: the owner feeds every
 * message of every node through {@link #merge(ResponseKind, byte[])} from a single thread,
 * keeping each node's own message order. Order across nodes does not matter.
 * <p>
 * When all nodes are accounted for, call {@link #validateAndClose()}, or
 * {@link #validateAndReset()} to reuse the combiner for the next statement of the session.
 */
public class ResponseCombiner implements ResponseHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseCombiner.class);

    private final int nodeCount;
    private final CombineType initialCombineType;
    private final CommandDest dest;
    private final ResponseSink clientSink;
    private final Charset serverEncoding;
    private final Charset clientEncoding;

    private CombineType combineType;
    private RequestType requestType = RequestType.NOT_DEFINED;
    private int commandCompleteCount = 0;
    private final DescriptionPhase descriptionPhase = new DescriptionPhase();
    private int copyInCount = 0;
    private int copyOutCount = 0;
    private long rowCount = 0;
    private boolean inErrorState = false;
    private List<SimpleAggregate> simpleAggregates = Collections.emptyList();
    private ResponseSink copySink = null;
    private boolean closed = false;

    public ResponseCombiner(int nodeCount, CombineType combineType, CommandDest dest,
        ResponseSink clientSink) {
        this(nodeCount, combineType, dest, clientSink,
            CombinerConfig.getInstance().getServerEncoding(),
            CombinerConfig.getInstance().getClientEncoding());
    }

    public ResponseCombiner(int nodeCount, CombineType combineType, CommandDest dest,
        ResponseSink clientSink, Charset serverEncoding, Charset clientEncoding) {
        if (nodeCount <= 0) {
            throw new IllegalArgumentException("nodeCount must be positive: " + nodeCount);
        }
        this.nodeCount = nodeCount;
        this.initialCombineType = Objects.requireNonNull(combineType, "combineType");
        this.combineType = combineType;
        this.dest = Objects.requireNonNull(dest, "dest");
        if (dest.isRemote()) {
            Objects.requireNonNull(clientSink, "clientSink is required for " + dest);
        }
        this.clientSink = clientSink;
        this.serverEncoding = serverEncoding;
        this.clientEncoding = clientEncoding;
    }

    /**
     * Attach the simple aggregates of the statement plan. DataRows are then reduced instead of
     * forwarded.
     */
    public void assignAggregates(List<SimpleAggregate> simpleAggregates) {
        this.simpleAggregates =
            simpleAggregates == null ? Collections.emptyList() : new ArrayList<>(simpleAggregates);
    }

    /**
     * Send COPY OUT rows to a local destination instead of the client.
     * The caller keeps ownership of the sink and must detach and close it itself.
     */
    public void attachCopySink(ResponseSink copySink) {
        this.copySink = copySink;
    }

    public void detachCopySink() {
        this.copySink = null;
    }

    public boolean merge(BackendMessage message) {
        return merge(message.getKind(), message.getPayload());
    }

    /**
     * @param packet a whole packet, tag and length included
     */
    public boolean merge(byte[] packet) {
        return merge(BackendMessage.loadFromPacket(packet));
    }

    /**
     * Handle one response message of one data node and update the combiner's state, possibly
     * writing one message to the client.
     *
     * @return false if the combiner already saw an error in this cycle and ignored the message
     * @throws CombinerException if the responses are inconsistent; on this or any other
     *                           exception, e.g. from a copy sink, the combiner stays in error
     *                           state for the rest of the cycle
     */
    public boolean merge(ResponseKind kind, byte[] payload) {
        if (closed) {
            throw new IllegalStateException("merge on a closed combiner");
        }
        // Ignore anything if we have encountered error
        if (inErrorState) {
            return false;
        }
        try {
            kind.dispatch(this, payload);
        } catch (RuntimeException e) {
            // a message that could not be handled leaves the cycle incomplete
            inErrorState = true;
            throw e;
        }
        return true;
    }

    @Override public void onCopyOutComplete(byte[] payload) {
        establishRequestType(RequestType.COPY_OUT, ResponseKind.COPY_OUT_COMPLETE);
        // close message is managed by the coordinator
        copyOutCount++;
    }

    @Override public void onCommandComplete(byte[] payload) {
        // a query or a copy ends with CommandComplete too, it only defines a COMMAND cycle
        if (requestType == RequestType.NOT_DEFINED) {
            requestType = RequestType.COMMAND;
        }
        CommandTag tag = null;
        if (isCombiningRowCount()) {
            tag = CommandTag.parse(CommandComplete.loadFromPayload(payload).getTag());
            combineRowCount(tag.getRowCount());
        }
        if (++commandCompleteCount != nodeCount) {
            return;
        }
        if (isCombiningRowCount()) {
            String merged = tag.withRowCount(rowCount);
            LOGGER.debug("merged CommandComplete of {} nodes: {}", nodeCount, merged);
            emit(PGFlags.COMMAND_COMPLETE, new CommandComplete(merged).toPayload());
        } else {
            emit(PGFlags.COMMAND_COMPLETE, payload);
        }
    }

    private boolean isCombiningRowCount() {
        return combineType != CombineType.NONE && requestType == RequestType.COMMAND;
    }

    private void combineRowCount(RowCount count) {
        if (!count.isPresent()) {
            LOGGER.warn("no row count in CommandComplete, combine type {} falls back to NONE",
                combineType);
            combineType = CombineType.NONE;
            return;
        }
        if (combineType == CombineType.SAME) {
            if (commandCompleteCount == 0) {
                // first result
                rowCount = count.value;
            } else if (count.value != rowCount) {
                LOGGER.error("replicated write returned {} rows on one node and {} on another",
                    count.value, rowCount);
                throw new CombinerException.Builder(ErrorCode.REPLICA_INCONSISTENCY)
                    .setErrorMessage(
                        "Write to replicated table returned different results from the data nodes")
                    .build();
            }
            return;
        }
        try {
            rowCount = Math.addExact(rowCount, count.value);
        } catch (ArithmeticException e) {
            throw new CombinerException.Builder(ErrorCode.PROTOCOL_INCONSISTENCY)
                .setErrorMessage("sum of row counts out of range").build(e);
        }
    }

    @Override public void onRowDescription(byte[] payload) {
        establishRequestType(RequestType.QUERY, ResponseKind.ROW_DESCRIPTION);
        // proxy first
        if (descriptionPhase.onRowDescription()) {
            emit(PGFlags.ROW_DESCRIPTION, payload);
        }
    }

    @Override public void onParameterStatus(byte[] payload) {
        establishRequestType(RequestType.QUERY, ResponseKind.PARAMETER_STATUS);
        // proxy last
        if (descriptionPhase.onParameterStatus(nodeCount)) {
            emit(PGFlags.PARAMETER_STATUS, payload);
        }
    }

    @Override public void onCopyInResponse(byte[] payload) {
        establishRequestType(RequestType.COPY_IN, ResponseKind.COPY_IN_RESPONSE);
        // proxy first
        if (copyInCount++ == 0) {
            emit(PGFlags.COPY_IN_RESPONSE, payload);
        }
    }

    @Override public void onCopyOutResponse(byte[] payload) {
        establishRequestType(RequestType.COPY_OUT, ResponseKind.COPY_OUT_RESPONSE);
        // the coordinator sends its own CopyOutResponse, just count it
        copyOutCount++;
    }

    @Override public void onCopyOutDataRow(byte[] payload) {
        establishRequestType(RequestType.COPY_OUT, ResponseKind.COPY_OUT_DATA_ROW);
        if (Objects.nonNull(copySink)) {
            copySink.write(payload);
            return;
        }
        emit(PGFlags.B_COPY_DATA, toClientEncoding(payload));
    }

    private byte[] toClientEncoding(byte[] payload) {
        if (serverEncoding.equals(clientEncoding)) {
            return payload;
        }
        CharBuffer chars;
        try {
            chars = serverEncoding.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(payload));
        } catch (CharacterCodingException e) {
            throw new CombinerException.Builder(ErrorCode.UNTRANSLATABLE_CHARACTER)
                .setSqlState(SqlState.CHARACTER_NOT_IN_REPERTOIRE).setErrorMessage(
                    "invalid byte sequence for encoding \"" + serverEncoding.name() + "\"")
                .build(e);
        }
        try {
            ByteBuffer bytes = clientEncoding.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT).encode(chars);
            byte[] converted = new byte[bytes.remaining()];
            bytes.get(converted);
            return converted;
        } catch (CharacterCodingException e) {
            throw new CombinerException.Builder(ErrorCode.UNTRANSLATABLE_CHARACTER).setErrorMessage(
                "character has no equivalent in encoding \"" + clientEncoding.name() + "\"")
                .build(e);
        }
    }

    @Override public void onDataRow(byte[] payload) {
        if (simpleAggregates.isEmpty()) {
            emit(PGFlags.DATA_ROW, payload);
            return;
        }
        for (SimpleAggregate simpleAggregate : simpleAggregates) {
            simpleAggregate.mergeOne(payload);
        }
        // only after every node contributed is one DataRow sent
        if (simpleAggregates.get(0).isComplete(nodeCount)) {
            emit(PGFlags.DATA_ROW, buildAggregateRow());
        }
    }

    private byte[] buildAggregateRow() {
        List<byte[]> bytes = new LinkedList<>();
        // one field per aggregate, whatever the width of the node rows
        bytes.add(PGProto.buildInt16BE(simpleAggregates.size()));
        for (SimpleAggregate simpleAggregate : simpleAggregates) {
            byte[] text = simpleAggregate.toText();
            if (text == null) {
                bytes.add(PGProto.buildInt32BE(-1));
                continue;
            }
            bytes.add(PGProto.buildInt32BE(text.length));
            bytes.add(text);
        }
        return PGMessage.concat(bytes);
    }

    @Override public void onErrorResponse(byte[] payload) {
        inErrorState = true;
        emit(PGFlags.ERROR_RESPONSE, payload);
    }

    @Override public void onNotification(ResponseKind kind, byte[] payload) {
        emit(kind.getTag(), payload);
    }

    @Override public void onUnexpected(ResponseKind kind, byte[] payload) {
        throw new CombinerException.Builder(ErrorCode.PROTOCOL_INCONSISTENCY)
            .setErrorMessage("Unexpected response from the data nodes: " + kind).build();
    }

    private void establishRequestType(RequestType expected, ResponseKind kind) {
        if (requestType == RequestType.NOT_DEFINED) {
            requestType = expected;
        }
        if (requestType != expected) {
            // Inconsistent responses
            throw new CombinerException.Builder(ErrorCode.PROTOCOL_INCONSISTENCY).setErrorMessage(
                String.format("Unexpected response from the data nodes: %s in a %s statement",
                    kind, requestType)).build();
        }
    }

    private void emit(byte type, byte[] payload) {
        if (!dest.isRemote()) {
            return;
        }
        clientSink.write(PGMessage.buildPacket(type, payload));
    }

    /**
     * Check the combiner state: no error, a defined request type and every node done with the
     * phases of that request type. Does not change any state.
     */
    public boolean validate() {
        return CombinerValidator.validate(this);
    }

    /**
     * Validate and release the combiner. No message can be merged afterwards.
     */
    public boolean validateAndClose() {
        boolean valid = validate();
        flushClient();
        close();
        return valid;
    }

    /**
     * Validate, then bring the combiner back to its freshly created state for the next
     * statement: same node count, combine type, destination and client sink.
     */
    public boolean validateAndReset() {
        boolean valid = validate();
        flushClient();
        combineType = initialCombineType;
        requestType = RequestType.NOT_DEFINED;
        commandCompleteCount = 0;
        descriptionPhase.reset();
        copyInCount = 0;
        copyOutCount = 0;
        rowCount = 0;
        inErrorState = false;
        simpleAggregates = Collections.emptyList();
        copySink = null;
        return valid;
    }

    /**
     * Release the combiner without validation, e.g. when the statement was cancelled.
     */
    public void close() {
        closed = true;
        simpleAggregates = Collections.emptyList();
        copySink = null;
    }

    private void flushClient() {
        if (dest.isRemote()) {
            clientSink.flush();
        }
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public CombineType getCombineType() {
        return combineType;
    }

    public CommandDest getDest() {
        return dest;
    }

    public RequestType getRequestType() {
        return requestType;
    }

    public int getCommandCompleteCount() {
        return commandCompleteCount;
    }

    public int getDescriptionCount() {
        return descriptionPhase.getCount();
    }

    public int getCopyInCount() {
        return copyInCount;
    }

    public int getCopyOutCount() {
        return copyOutCount;
    }

    public long getRowCount() {
        return rowCount;
    }

    public boolean isInErrorState() {
        return inErrorState;
    }

    public List<SimpleAggregate> getSimpleAggregates() {
        return Collections.unmodifiableList(simpleAggregates);
    }

    public ResponseSink getCopySink() {
        return copySink;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override public String toString() {
        return "ResponseCombiner{nodeCount=" + nodeCount + ", combineType=" + combineType
            + ", dest=" + dest + ", requestType=" + requestType + ", commandCompleteCount="
            + commandCompleteCount + ", descriptionCount=" + descriptionPhase.getCount()
            + ", copyInCount=" + copyInCount + ", copyOutCount=" + copyOutCount
            + ", rowCount=" + rowCount + ", inErrorState=" + inErrorState + '}';
    }
}
