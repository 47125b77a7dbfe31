package microbench.combiner;

import me.ele.jarch.combiner.ByteArrayResponseSink;
import me.ele.jarch.combiner.aggregate.AggregateFunc;
import me.ele.jarch.combiner.aggregate.SimpleAggregate;
import me.ele.jarch.combiner.combine.CombineType;
import me.ele.jarch.combiner.combine.CommandDest;
import me.ele.jarch.combiner.combine.ResponseCombiner;
import me.ele.jarch.combiner.combine.RowCountParser;
import me.ele.jarch.combiner.pg.proto.CommandComplete;
import me.ele.jarch.combiner.pg.proto.DataRow;
import me.ele.jarch.combiner.pg.proto.ResponseKind;
import me.ele.jarch.combiner.pg.proto.RowDescription;
import microbench.util.AbstractMicrobenchmark;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Setup;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

/**
 * Cost of one statement cycle over N data nodes, reset included.
 */
public class ResponseCombinerBenchmark extends AbstractMicrobenchmark {
    @Param({"4", "32"}) int nodeCount;

    private ByteArrayResponseSink client;
    private ResponseCombiner sumCombiner;
    private ResponseCombiner queryCombiner;
    private ResponseCombiner maxCombiner;
    private byte[] updateTag;
    private byte[] selectTag;
    private byte[] description;
    private byte[] textRow;
    private byte[] maxRow;

    @Setup public void setup() {
        client = new ByteArrayResponseSink();
        sumCombiner = newCombiner(CombineType.SUM);
        queryCombiner = newCombiner(CombineType.NONE);
        maxCombiner = newCombiner(CombineType.NONE);
        updateTag = new CommandComplete("UPDATE 12").toPayload();
        selectTag = new CommandComplete("SELECT 1").toPayload();
        description = new RowDescription(new RowDescription.PGColumn("max", 20, 8, 1)).toPayload();
        textRow = new DataRow(DataRow.PGCol.text("a row of text"), new DataRow.PGCol()).toPayload();
        maxRow = new DataRow(DataRow.PGCol.binary(123456789L, 8)).toPayload();
    }

    private ResponseCombiner newCombiner(CombineType combineType) {
        return new ResponseCombiner(nodeCount, combineType, CommandDest.REMOTE, client,
            StandardCharsets.UTF_8, StandardCharsets.UTF_8);
    }

    @Benchmark public boolean sumRowCounts() {
        for (int i = 0; i < nodeCount; i++) {
            sumCombiner.merge(ResponseKind.COMMAND_COMPLETE, updateTag);
        }
        client.clear();
        return sumCombiner.validateAndReset();
    }

    @Benchmark public boolean forwardQuery() {
        for (int i = 0; i < nodeCount; i++) {
            queryCombiner.merge(ResponseKind.ROW_DESCRIPTION, description);
            queryCombiner.merge(ResponseKind.DATA_ROW, textRow);
            queryCombiner.merge(ResponseKind.COMMAND_COMPLETE, selectTag);
        }
        client.clear();
        return queryCombiner.validateAndReset();
    }

    @Benchmark public boolean reduceMax() {
        maxCombiner.assignAggregates(
            Collections.singletonList(new SimpleAggregate(AggregateFunc.MAX)));
        for (int i = 0; i < nodeCount; i++) {
            maxCombiner.merge(ResponseKind.ROW_DESCRIPTION, description);
            maxCombiner.merge(ResponseKind.DATA_ROW, maxRow);
            maxCombiner.merge(ResponseKind.COMMAND_COMPLETE, selectTag);
        }
        client.clear();
        return maxCombiner.validateAndReset();
    }

    @Benchmark public long parseRowCount() {
        return RowCountParser.parse(updateTag).value;
    }
}
