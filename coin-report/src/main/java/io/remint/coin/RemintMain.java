package io.remint.coin;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.ProvisionException;
import com.google.inject.TypeLiteral;
import io.remint.coin.error.RemintException;
import io.remint.coin.table.TimeWindow;
import io.remint.metrics.Metrics;
import io.remint.runtime.Pipeline;
import io.remint.runtime.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI turning monitoring dumps into per-category CSV files or an XLSX workbook.
 */
@CommandLine.Command(name = "remint", mixinStandardHelpOptions = true,
        description = "Convert repeated fixed-width monitoring output into per-category tables",
        footer = {"",
                "Examples:",
                "  remint -o output ./coin_log_2009-03-20T*/dbstat/dbstat*",
                "  remint -o output -b \"2009-03-20 15:30\" -e \"2009-03-20 16:30\" -c SGASTAT,SYSSTAT ./dbstat*",
                "  remint -o output -T csv ./dbstat*"})
public final class RemintMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RemintMain.class);

    @CommandLine.Option(names = {"-o", "--output"}, required = true, description = "Output file name prefix")
    String output;

    @CommandLine.Option(names = {"-b", "--begin"}, description = "Begin time, inclusive (e.g. \"2009-03-20 15:30\")")
    String begin;

    @CommandLine.Option(names = {"-e", "--end"}, description = "End time, inclusive")
    String end;

    @CommandLine.Option(names = {"-c", "--category"}, split = ",", description = "Categories to output (comma-separated); default all")
    List<String> categories;

    @CommandLine.Option(names = {"-f", "--file"}, description = "Category config file (YAML); default built-in")
    Path configFile;

    @CommandLine.Option(names = {"-T", "--format"}, defaultValue = "xls", description = "Output format: xls, xlsx or csv (default: ${DEFAULT-VALUE})")
    String format;

    @CommandLine.Option(names = {"-z", "--zone"}, description = "Time zone of timestamps without one; default remint.zone / REMINT_ZONE / system")
    ZoneId zone;

    @CommandLine.Option(names = "--encoding", defaultValue = "UTF-8", description = "Input file encoding (default: ${DEFAULT-VALUE})")
    Charset encoding;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "<file>", description = "Log files, plain or gzip, processed in the given order")
    List<Path> files = new ArrayList<>();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new RemintMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        PrintWriter out = spec.commandLine().getOut();
        RunConfig config;
        try {
            config = new RunConfig(output, OutputFormat.parse(format), begin, end, categories, configFile,
                    files, zone == null ? RunConfig.defaultZone() : zone, encoding);
            TimeWindow window = config.window();
            if (window.isEmpty()) {
                err.println("Begin time must be on/before end time");
                return 2;
            }
        } catch (IllegalArgumentException | RemintException e) {
            err.println(e.getMessage());
            return 2;
        }

        try {
            Injector injector = Guice.createInjector(new RemintModule(config));
            Pipeline<String> pipeline = injector.getInstance(Key.get(new TypeLiteral<Pipeline<String>>() {}));
            pipeline.run();
            printOnce(injector.getInstance(MetricRegistry.class), out);
            return 0;
        } catch (PipelineException e) {
            log.error("Run aborted at {}", e.position(), e.getCause());
            err.println(e.getMessage());
            return 1;
        } catch (ProvisionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Setup failed", cause);
            err.println(cause.getMessage());
            return 1;
        }
    }

    private static void printOnce(MetricRegistry r, PrintWriter out) {
        Timer src = r.timer(Metrics.SOURCE_TIME);
        Timer snk = r.timer(Metrics.SINK_TIME);
        out.println("[" + Instant.now() + "] metrics:" +
                " lines=" + r.meter(Metrics.INPUT_RATE).getCount() +
                " | categories=" + r.counter(Metrics.CATEGORIES_DETECTED).getCount() +
                " headers=" + r.counter(Metrics.HEADERS_EMITTED).getCount() +
                " rows=" + r.counter(Metrics.ROWS_EMITTED).getCount() +
                " | stray=" + r.counter(Metrics.ROWS_STRAY).getCount() +
                " outOfWindow=" + r.counter(Metrics.ROWS_OUT_OF_WINDOW).getCount() +
                " filtered=" + r.counter(Metrics.ROWS_FILTERED).getCount() +
                " | t.p50(ms)=" + nsToMs(src.getSnapshot().getMedian()) + "/" + nsToMs(snk.getSnapshot().getMedian()));
        out.flush();
    }

    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}
