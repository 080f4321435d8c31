package work.strata.engine.commands;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import work.strata.engine.pipeline.ParallelMapper;
import work.strata.engine.pipeline.PipelineData;
import work.strata.engine.protocol.CellPath;
import work.strata.engine.protocol.ShellError;
import work.strata.engine.protocol.Span;
import work.strata.engine.protocol.Value;
import work.strata.engine.runtime.Call;
import work.strata.engine.runtime.Command;
import work.strata.engine.runtime.Evaluator;
import work.strata.engine.runtime.Signature;
import work.strata.engine.runtime.Stack;
import work.strata.engine.scope.EngineState;
import work.strata.engine.scope.StateWorkingSet;
import work.strata.engine.shared.ShellLog;

/**
 * Row-level consumers of pipeline data: iteration, filtering, selection and slicing.
 */
public final class FilterCommands {
    private FilterCommands() {}

    public static StateWorkingSet register(StateWorkingSet workingSet) {
        workingSet.addDecl(Command.builtin(
            Signature.build("each")
                .required("block", "the block to run")
                .switchFlag("numbered", "iterate with an index", 'n'),
            "Run a block on each element of input.",
            FilterCommands::each
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("par-each")
                .required("block", "the block to run")
                .switchFlag("numbered", "iterate with an index", 'n'),
            "Run a block on each element of input in parallel.",
            FilterCommands::parEach
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("where").required("cond", "condition"),
            "Filter values based on a condition.",
            FilterCommands::where
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("keep until").required("predicate", "the predicate that kept element must not match"),
            "Keep elements of the input until a predicate is true.",
            FilterCommands::keepUntil
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("get").required("cell_path", "the cell path to the data"),
            "Extract data using a cell path.",
            FilterCommands::get
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("select").rest("rest", "the columns to select from the table"),
            "Down-select table to only these columns.",
            FilterCommands::select
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("length"),
            "Count the number of elements in the input.",
            FilterCommands::length
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("wrap").required("name", "the name of the column"),
            "Wrap the value into a column.",
            FilterCommands::wrap
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("range").optional("rows", "range of rows to return: Eg) 4..7 (=> from 4 to 7)"),
            "Return only the selected rows.",
            FilterCommands::range
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("drop column").optional("columns", "starting from the end, the number of columns to remove"),
            "Remove the last number of columns. If you want to remove columns by name, try 'reject'.",
            FilterCommands::dropColumn
        ));
        workingSet.addDecl(Command.builtin(
            Signature.build("reject").rest("rest", "the names of columns to remove from the table"),
            "Remove the given columns from the table.",
            FilterCommands::reject
        ));
        return workingSet;
    }

    private static PipelineData each(EngineState engine, Stack stack, Call call, PipelineData input) {
        int blockId = call.blockAt(engine, stack, 0);
        boolean numbered = call.hasFlag("numbered");
        var index = new AtomicLong();
        return input.map(item -> {
            var arg = numbered ? numberedItem(index.getAndIncrement(), item, call.head()) : item;
            return Evaluator.callBlock(engine, stack, blockId, List.of(arg), PipelineData.empty())
                .intoValue(call.head());
        }, engine.cancellationToken());
    }

    /**
     * Workers run on independent copies of the stack; results keep the input order.
     */
    private static PipelineData parEach(EngineState engine, Stack stack, Call call, PipelineData input) {
        int blockId = call.blockAt(engine, stack, 0);
        boolean numbered = call.hasFlag("numbered");
        var token = engine.cancellationToken();
        int workers = stack.getConfig().parallelWorkers();
        var results = ParallelMapper.map(input.iterator(), workers, token, (index, item) -> {
            var workerStack = stack.forkForWorker();
            var arg = numbered ? numberedItem(index, item, call.head()) : item;
            return Evaluator.callBlock(engine, workerStack, blockId, List.of(arg), PipelineData.empty())
                .intoValue(call.head());
        });
        return PipelineData.fromList(results, token);
    }

    private static PipelineData where(EngineState engine, Stack stack, Call call, PipelineData input) {
        int blockId = call.blockAt(engine, stack, 0);
        return input.filter(item -> predicateHolds(engine, stack, blockId, item, call.head()), engine.cancellationToken());
    }

    private static PipelineData keepUntil(EngineState engine, Stack stack, Call call, PipelineData input) {
        int blockId = call.blockAt(engine, stack, 0);
        return input.takeWhile(item -> !predicateHolds(engine, stack, blockId, item, call.head()), engine.cancellationToken());
    }

    /**
     * A predicate that fails to evaluate counts as not holding.
     */
    private static boolean predicateHolds(EngineState engine, Stack stack, int blockId, Value item, Span head) {
        try {
            return Evaluator.callBlock(engine, stack, blockId, List.of(item), PipelineData.empty())
                .intoValue(head)
                .isTrue();
        } catch (ShellError ex) {
            ShellLog.trace(() -> "predicate failed, treated as false: " + ex.getMessage());
            return false;
        }
    }

    private static PipelineData get(EngineState engine, Stack stack, Call call, PipelineData input) {
        var path = call.cellPathAt(engine, stack, 0);
        return PipelineData.value(input.followCellPath(path.members(), call.head()));
    }

    private static PipelineData select(EngineState engine, Stack stack, Call call, PipelineData input) {
        var paths = call.restCellPaths(engine, stack, 0);
        if (paths.isEmpty()) {
            throw ShellError.missingParameter("rest", call.head());
        }
        return input.map(row -> project(row, paths), engine.cancellationToken());
    }

    private static Value project(Value row, List<CellPath> paths) {
        var entries = new LinkedHashMap<String, Value>();
        for (var path : paths) {
            entries.put(path.intoString(), row.followCellPath(path.members()));
        }
        return Value.Record.of(entries, row.span());
    }

    private static PipelineData length(EngineState engine, Stack stack, Call call, PipelineData input) {
        long count;
        if (input instanceof PipelineData.Empty) {
            count = 0;
        } else if (input instanceof PipelineData.ValueData data && !(data.value() instanceof Value.List)
            && !(data.value() instanceof Value.Range)) {
            count = data.value() instanceof Value.Nothing ? 0 : 1;
        } else {
            count = 0;
            var iterator = input.iterator();
            while (iterator.hasNext()) {
                iterator.next();
                count++;
            }
        }
        return PipelineData.value(Value.integer(count, call.head()));
    }

    private static PipelineData wrap(EngineState engine, Stack stack, Call call, PipelineData input) {
        var name = call.req(engine, stack, 0).asString();
        return input.map(
            item -> Value.record(List.of(name), List.of(item), call.head()),
            engine.cancellationToken()
        );
    }

    /**
     * Rows {@code from..to} by zero-based index. Negative bounds count from the end and force the input
     * to be collected; otherwise the input is consumed only as far as needed.
     */
    private static PipelineData range(EngineState engine, Stack stack, Call call, PipelineData input) {
        var rows = call.opt(engine, stack, 0).orElse(null);
        long from = 0;
        long to = Long.MAX_VALUE;
        boolean inclusive = true;
        if (rows instanceof Value.Range bounds) {
            from = bounds.from() instanceof Value.Int start ? start.val() : 0;
            to = bounds.to() instanceof Value.Int end ? end.val() : Long.MAX_VALUE;
            inclusive = bounds.inclusive();
        } else if (rows != null && !(rows instanceof Value.Nothing)) {
            throw ShellError.typeMismatch("expected range, got " + rows.typeName(), rows.span());
        }
        var token = engine.cancellationToken();
        var source = input;
        if (from < 0 || to < 0) {
            var values = input.intoStream(token).collect();
            long length = values.size();
            from = from < 0 ? Math.max(length + from, 0) : from;
            to = to < 0 ? length + to : to;
            source = PipelineData.fromList(values, token);
        }
        if (!inclusive && to != Long.MAX_VALUE) {
            to--;
        }
        if (from > to) {
            return PipelineData.value(Value.nothing(call.head()));
        }
        long limit = to == Long.MAX_VALUE ? Long.MAX_VALUE : to - from + 1;
        return new PipelineData.Stream(source.intoStream(token).slice(from, limit), source.metadata());
    }

    /**
     * Keeps the leading columns of the first row, dropping {@code columns} (default 1) from the end.
     */
    private static PipelineData dropColumn(EngineState engine, Stack stack, Call call, PipelineData input) {
        long columns = call.opt(engine, stack, 0).map(Value::asLong).orElse(1L);
        if (columns < 0) {
            throw ShellError.unsupportedInput("Number of columns to drop must be non-negative", call.head());
        }
        var value = input.intoValue(call.head());
        List<String> header;
        if (value instanceof Value.Record record) {
            header = record.cols();
        } else if (value instanceof Value.List list && !list.vals().isEmpty()) {
            var first = list.vals().get(0);
            header = first instanceof Value.Record record ? record.cols() : List.of("");
        } else {
            header = List.of("");
        }
        int keepCount = (int) Math.max(header.size() - Math.min(columns, header.size()), 0);
        var keep = new ArrayList<CellPath>();
        for (var column : header.subList(0, keepCount)) {
            keep.add(CellPath.fromValue(Value.string(column, call.head())));
        }
        if (value instanceof Value.List list) {
            var rows = new ArrayList<Value>(list.vals().size());
            for (var row : list.vals()) {
                rows.add(project(row, keep));
            }
            return PipelineData.value(Value.list(rows, list.span()));
        }
        return PipelineData.value(project(value, keep));
    }

    private static PipelineData reject(EngineState engine, Stack stack, Call call, PipelineData input) {
        var columns = new ArrayList<String>();
        for (var path : call.restCellPaths(engine, stack, 0)) {
            columns.add(path.intoString());
        }
        if (columns.isEmpty()) {
            throw ShellError.missingParameter("rest", call.head());
        }
        return input.map(row -> {
            if (!(row instanceof Value.Record record)) {
                row.orThrow();
                throw ShellError.unsupportedInput("reject expects records, got " + row.typeName(), row.span());
            }
            var result = record;
            for (var column : columns) {
                result = result.without(column);
            }
            return result;
        }, engine.cancellationToken());
    }

    private static Value numberedItem(long index, Value item, Span span) {
        return Value.record(List.of("index", "item"), List.of(Value.integer(index, span), item), span);
    }
}
